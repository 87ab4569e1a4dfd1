package com.copytrader.session;

import com.copytrader.aggregation.FillAggregator;
import com.copytrader.domain.enums.OrderSide;
import com.copytrader.domain.enums.PositionAction;
import com.copytrader.domain.enums.PositionSizingType;
import com.copytrader.domain.model.AggregatedTrade;
import com.copytrader.domain.model.Fill;
import com.copytrader.domain.model.PaperTrade;
import com.copytrader.domain.model.PortfolioSnapshot;
import com.copytrader.domain.model.Position;
import com.copytrader.domain.model.PositionSnapshot;
import com.copytrader.event.PaperTradeEvent;
import com.copytrader.ledger.PositionActionClassifier;
import com.copytrader.ledger.PositionLedger;
import com.copytrader.ledger.PositionSizes;
import com.copytrader.persistence.NoopTradeJournal;
import com.copytrader.persistence.TradeJournal;
import com.copytrader.pnl.PnLCalculator;
import com.copytrader.risk.ExposureGuard;
import com.copytrader.risk.RiskValidationResult;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Paper portfolio for one running session: the position ledger, pending aggregation buffers,
 * trade history and session totals.
 *
 * <p>{@link #processFill(Fill)} is the single entry point that mutates state. It runs the whole
 * pipeline under one {@link ReentrantLock}: aggregate, size or validate against the exposure
 * ceiling, classify, compute realized PnL, update the ledger, record the trade, then notify the
 * journal and event listeners. Commits are serialized across all coins so the exposure ceiling
 * is always evaluated against a consistent portfolio.
 *
 * <p>Read operations take the same lock and return copies, never live positions.
 *
 * <p>Policy outcomes (a rejected or zero-sized trade, a zero-size fill) are not errors: they show
 * up only as the absence of a new trade record. Journal and listener failures are logged and never
 * undo a commit.
 */
public class PaperTradingSession {

    private static final Logger log = LoggerFactory.getLogger(PaperTradingSession.class);

    private final ReentrantLock lock = new ReentrantLock();

    private final SessionSettings settings;
    private final PositionSizingType sizingType;
    private final Clock clock;
    private final TradeJournal tradeJournal;
    private final ApplicationEventPublisher eventPublisher;

    private final PositionLedger ledger = new PositionLedger();
    private final PositionActionClassifier classifier = new PositionActionClassifier();
    private final PnLCalculator pnlCalculator = new PnLCalculator();
    private final ExposureGuard exposureGuard;
    private final FillAggregator aggregator;

    private final List<PaperTrade> tradeHistory = new ArrayList<>();
    private final Instant startTime;
    private double totalRealizedPnl;
    private int totalTrades;

    public PaperTradingSession(
            SessionSettings settings, TradeJournal tradeJournal, ApplicationEventPublisher eventPublisher, Clock clock) {
        settings.validate();
        this.settings = settings;
        this.sizingType = settings.sizingType();
        this.clock = clock;
        this.tradeJournal = tradeJournal;
        this.eventPublisher = eventPublisher;
        this.exposureGuard = new ExposureGuard(settings.getBankroll(), settings.getLeverage(), pnlCalculator);
        this.aggregator = new FillAggregator(settings.toAggregationSettings(), clock);
        this.startTime = clock.instant();
    }

    /** Session with no journal and no listeners, on the system clock. */
    public PaperTradingSession(SessionSettings settings) {
        this(settings, new NoopTradeJournal(), event -> {}, Clock.systemUTC());
    }

    /**
     * Feeds one fill through the pipeline.
     *
     * @return the trade record if this fill triggered a commit, empty if it was ignored, buffered,
     *     sized to zero or rejected by the exposure ceiling
     */
    public Optional<PaperTrade> processFill(Fill fill) {
        lock.lock();
        try {
            if (fill.getSize() == 0) {
                log.debug("Ignoring zero-size fill for {}", fill.getCoin());
                return Optional.empty();
            }
            Optional<AggregatedTrade> committed = aggregator.offer(fill);
            if (committed.isEmpty()) {
                return Optional.empty();
            }
            return commit(committed.get());
        } finally {
            lock.unlock();
        }
    }

    private Optional<PaperTrade> commit(AggregatedTrade trade) {
        String coin = trade.getCoin();
        double price = trade.getAveragePrice();
        double delta = trade.getSignedSize();

        if (delta == 0) {
            log.debug("Batch of {} fills for {} nets to zero, nothing to commit", trade.getFills().size(), coin);
            return Optional.empty();
        }

        if (sizingType == PositionSizingType.DYNAMIC_NOTIONAL) {
            double sized = exposureGuard.calculateDynamicTradeSize(
                    ledger, totalRealizedPnl, settings.getBaseNotional(), price);
            if (sized <= 0) {
                log.info("Skipping {} {} {}: no exposure capacity left", trade.getSide(), Math.abs(delta), coin);
                return Optional.empty();
            }
            delta = Math.signum(delta) * sized;
        } else {
            double currentSize = ledger.find(coin).map(Position::getSize).orElse(0.0);
            double resultingSize = PositionSizes.resultingSize(currentSize, delta);
            if (Math.abs(resultingSize) > Math.abs(currentSize)) {
                RiskValidationResult validation =
                        exposureGuard.validatePositionSize(ledger, totalRealizedPnl, coin, resultingSize, price);
                if (validation.isRejected()) {
                    log.warn("Rejected {} {} {}: {}", trade.getSide(), Math.abs(delta), coin, validation.getViolations());
                    return Optional.empty();
                }
            }
        }

        Instant now = clock.instant();
        Position position = ledger.getOrCreate(coin);
        double oldSize = position.getSize();
        PositionAction action = classifier.classify(oldSize, PositionSizes.resultingSize(oldSize, delta));
        double realizedPnl = pnlCalculator.realizedPnl(position, delta, price, trade.getVenueClosedPnl(), action);

        ledger.applyTrade(position, delta, price, realizedPnl, now);
        position.setLastPrice(trade.getLastPrice());

        totalTrades++;
        totalRealizedPnl += realizedPnl;

        PaperTrade paperTrade = PaperTrade.builder()
                .timestamp(trade.getLastFillTime())
                .coin(coin)
                .action(action)
                .side(OrderSide.fromSignedSize(delta))
                .size(Math.abs(delta))
                .price(price)
                .realizedPnl(realizedPnl)
                .positionSize(position.getSize())
                .unrealizedPnl(pnlCalculator.unrealizedPnl(position))
                .build();
        tradeHistory.add(paperTrade);

        notifyCollaborators(trade, paperTrade, position);
        return Optional.of(paperTrade);
    }

    private void notifyCollaborators(AggregatedTrade trade, PaperTrade paperTrade, Position position) {
        try {
            for (Fill fill : trade.getFills()) {
                tradeJournal.saveFill(
                        fill, paperTrade.getAction(), paperTrade.getRealizedPnl(), paperTrade.getUnrealizedPnl());
            }
            tradeJournal.saveAccount(buildSnapshot());
        } catch (RuntimeException e) {
            log.warn("Trade journal failed for {} {}: {}", paperTrade.getAction(), paperTrade.getCoin(), e.getMessage());
        }
        try {
            eventPublisher.publishEvent(new PaperTradeEvent(this, paperTrade, position.copy(), totalTrades));
        } catch (RuntimeException e) {
            log.warn("Trade listener failed for {} {}: {}", paperTrade.getAction(), paperTrade.getCoin(), e.getMessage());
        }
    }

    public PortfolioSnapshot snapshot() {
        lock.lock();
        try {
            return buildSnapshot();
        } finally {
            lock.unlock();
        }
    }

    /** Copies of every position ever traded, flat ones included, in first-traded order. */
    public List<Position> getPositions() {
        lock.lock();
        try {
            List<Position> copies = new ArrayList<>();
            for (Position position : ledger.all()) {
                copies.add(position.copy());
            }
            return copies;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Position> getPosition(String coin) {
        lock.lock();
        try {
            return ledger.find(coin).map(Position::copy);
        } finally {
            lock.unlock();
        }
    }

    public List<PaperTrade> getTradeHistory() {
        lock.lock();
        try {
            return List.copyOf(tradeHistory);
        } finally {
            lock.unlock();
        }
    }

    /** The last {@code count} trades in processing order, oldest first. */
    public List<PaperTrade> getRecentTrades(int count) {
        lock.lock();
        try {
            int from = Math.max(0, tradeHistory.size() - Math.max(0, count));
            return List.copyOf(tradeHistory.subList(from, tradeHistory.size()));
        } finally {
            lock.unlock();
        }
    }

    public int getTotalTrades() {
        lock.lock();
        try {
            return totalTrades;
        } finally {
            lock.unlock();
        }
    }

    public double getTotalRealizedPnl() {
        lock.lock();
        try {
            return totalRealizedPnl;
        } finally {
            lock.unlock();
        }
    }

    public int getPendingFillCount(String coin) {
        lock.lock();
        try {
            return aggregator.pendingFillCount(coin);
        } finally {
            lock.unlock();
        }
    }

    public SessionSettings getSettings() {
        return settings;
    }

    public Instant getStartTime() {
        return startTime;
    }

    private PortfolioSnapshot buildSnapshot() {
        List<PositionSnapshot> open = new ArrayList<>();
        double totalUnrealized = 0.0;
        for (Position position : ledger.open()) {
            double unrealized = pnlCalculator.unrealizedPnl(position);
            totalUnrealized += unrealized;
            open.add(PositionSnapshot.builder()
                    .coin(position.getCoin())
                    .size(position.getSize())
                    .avgEntryPrice(position.getAvgEntryPrice())
                    .lastPrice(position.getLastPrice())
                    .realizedPnl(position.getRealizedPnl())
                    .unrealizedPnl(unrealized)
                    .marketValue(position.marketValue())
                    .pnlPercent(pnlCalculator.pnlPercent(position))
                    .build());
        }
        return PortfolioSnapshot.builder()
                .timestamp(clock.instant())
                .sessionStart(startTime)
                .totalRealizedPnl(totalRealizedPnl)
                .totalUnrealizedPnl(totalUnrealized)
                .totalPnl(totalRealizedPnl + totalUnrealized)
                .totalTrades(totalTrades)
                .availableCapital(exposureGuard.availableCapital(ledger, totalRealizedPnl))
                .maxExposure(exposureGuard.maxExposure(ledger, totalRealizedPnl))
                .currentExposure(exposureGuard.currentExposure(ledger))
                .positions(List.copyOf(open))
                .build();
    }
}
