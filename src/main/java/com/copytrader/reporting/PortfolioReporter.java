package com.copytrader.reporting;

import com.copytrader.config.CopyTraderProperties;
import com.copytrader.domain.model.PaperTrade;
import com.copytrader.domain.model.PortfolioSnapshot;
import com.copytrader.domain.model.PositionSnapshot;
import com.copytrader.event.PaperTradeEvent;
import com.copytrader.session.PaperTradingSession;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Human-readable view of the paper portfolio.
 *
 * <p>Read-only: every report is rendered from one snapshot or one history copy taken under the
 * session lock, and nothing here mutates session state. Reports are logged at INFO and also
 * returned, so the REST layer and tests can use the rendered text directly.
 *
 * <p>Logs each committed trade as it happens, a full summary every
 * {@code copytrader.reporting.summary-interval} trades, and a final summary plus the most recent
 * trades on shutdown.
 */
@Component
public class PortfolioReporter {

    private static final Logger log = LoggerFactory.getLogger(PortfolioReporter.class);

    private static final String RULE = "=".repeat(80);
    private static final String THIN_RULE = "-".repeat(80);
    private static final DateTimeFormatter TIME_OF_DAY =
            DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneId.systemDefault());

    private final PaperTradingSession session;
    private final CopyTraderProperties.Reporting reporting;

    public PortfolioReporter(PaperTradingSession session, CopyTraderProperties properties) {
        this.session = session;
        this.reporting = properties.getReporting();
    }

    @EventListener
    @Order(10)
    public void onPaperTrade(PaperTradeEvent event) {
        log.info(formatTrade(event.getTrade()));
        int interval = reporting.getSummaryInterval();
        if (interval > 0 && event.getTotalTrades() % interval == 0) {
            printPortfolioSummary();
        }
    }

    @PreDestroy
    public void printFinalReport() {
        printPortfolioSummary();
        printRecentTrades(reporting.getRecentTradesCount());
    }

    public String printPortfolioSummary() {
        String summary = formatSummary(session.snapshot());
        log.info("\n{}", summary);
        return summary;
    }

    /** Renders the last {@code count} trades; returns an empty string when nothing was traded yet. */
    public String printRecentTrades(int count) {
        List<PaperTrade> trades = session.getRecentTrades(count);
        if (trades.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "LAST %d TRADES:%n", count));
        sb.append(THIN_RULE).append(System.lineSeparator());
        for (PaperTrade trade : trades) {
            sb.append(String.format(
                    Locale.ROOT,
                    "%s | %s %s %s %.4f %s @ $%.2f | PnL: $%.2f%n",
                    TIME_OF_DAY.format(trade.getTimestamp()),
                    trade.getAction().getEmoji(),
                    trade.getAction(),
                    trade.getSide(),
                    trade.getSize(),
                    trade.getCoin(),
                    trade.getPrice(),
                    trade.getRealizedPnl()));
        }
        String rendered = sb.toString();
        log.info("\n{}", rendered);
        return rendered;
    }

    /**
     * One-line trade description, e.g.
     * {@code 🟡 REDUCE SELL 1.00 BTC @ $58000.00 | Position: +2.00 BTC | Realized: $4666.67 | Unrealized: $9333.33}.
     */
    public static String formatTrade(PaperTrade trade) {
        String position;
        if (trade.getPositionSize() == 0) {
            position = "Position: FLAT";
        } else {
            position = String.format(
                    Locale.ROOT, "Position: %s %s", signed(trade.getPositionSize()), trade.getCoin());
        }

        StringBuilder pnl = new StringBuilder();
        if (trade.getRealizedPnl() != 0) {
            pnl.append(String.format(Locale.ROOT, "Realized: $%.2f | ", trade.getRealizedPnl()));
        }
        pnl.append(String.format(Locale.ROOT, "Unrealized: $%.2f", trade.getUnrealizedPnl()));

        return String.format(
                Locale.ROOT,
                "%s %s %s %.2f %s @ $%.2f | %s | %s",
                trade.getAction().getEmoji(),
                trade.getAction(),
                trade.getSide(),
                trade.getSize(),
                trade.getCoin(),
                trade.getPrice(),
                position,
                pnl);
    }

    public static String formatSummary(PortfolioSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        String nl = System.lineSeparator();
        sb.append(RULE).append(nl);
        sb.append("PAPER TRADING PORTFOLIO SUMMARY").append(nl);
        sb.append(RULE).append(nl);

        Duration elapsed = Duration.between(snapshot.getSessionStart(), snapshot.getTimestamp());
        sb.append("Session Duration: ").append(formatDuration(elapsed)).append(nl);
        sb.append(String.format(Locale.ROOT, "Total Realized PnL: $%.2f%n", snapshot.getTotalRealizedPnl()));
        sb.append(String.format(Locale.ROOT, "Total Unrealized PnL: $%.2f%n", snapshot.getTotalUnrealizedPnl()));
        sb.append(String.format(Locale.ROOT, "Total Portfolio PnL: $%.2f%n", snapshot.getTotalPnl()));
        sb.append(String.format(Locale.ROOT, "Total Trades: %d%n", snapshot.getTotalTrades()));
        sb.append(String.format(Locale.ROOT, "Active Positions: %d%n", snapshot.getActivePositions()));
        if (snapshot.getTotalTrades() > 0) {
            sb.append(String.format(
                    Locale.ROOT, "Avg PnL per Trade: $%.2f%n", snapshot.getTotalPnl() / snapshot.getTotalTrades()));
        }
        sb.append(String.format(
                Locale.ROOT,
                "Capital: $%.2f | Max Exposure: $%.2f | Current Exposure: $%.2f%n",
                snapshot.getAvailableCapital(),
                snapshot.getMaxExposure(),
                snapshot.getCurrentExposure()));

        if (!snapshot.getPositions().isEmpty()) {
            sb.append(nl).append("ACTIVE POSITIONS:").append(nl);
            sb.append("-".repeat(60)).append(nl);
            for (PositionSnapshot position : snapshot.getPositions()) {
                sb.append(String.format(
                        Locale.ROOT,
                        "%-8s | %s | Avg: $%.2f | Last: $%.2f | PnL: $%.2f (%.2f%%)%n",
                        position.getCoin(),
                        signed(position.getSize()),
                        position.getAvgEntryPrice(),
                        position.getLastPrice(),
                        position.getUnrealizedPnl(),
                        position.getPnlPercent()));
            }
        }
        sb.append(RULE);
        return sb.toString();
    }

    private static String signed(double size) {
        String formatted = String.format(Locale.ROOT, "%.2f", size);
        return size > 0 ? "+" + formatted : formatted;
    }

    static String formatDuration(Duration duration) {
        long seconds = Math.max(0, duration.getSeconds());
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        if (hours > 0) {
            return String.format(Locale.ROOT, "%dh%02dm%02ds", hours, minutes, secs);
        }
        if (minutes > 0) {
            return String.format(Locale.ROOT, "%dm%02ds", minutes, secs);
        }
        return secs + "s";
    }
}
