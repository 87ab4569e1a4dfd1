package com.copytrader.event;

import com.copytrader.domain.model.PaperTrade;
import com.copytrader.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the session after a trade is committed to the ledger.
 *
 * <p>Listeners run synchronously on the committing thread while the session lock is held,
 * so they must stay fast and must not call back into blocking I/O. Key listeners:
 * <ul>
 *   <li>PortfolioReporter: logs the trade line and periodic summaries</li>
 *   <li>PaperTradingMetrics: counts committed trades</li>
 * </ul>
 */
public class PaperTradeEvent extends ApplicationEvent {

    private final PaperTrade trade;
    private final Position position;
    private final int totalTrades;

    /**
     * @param source      the session that committed the trade
     * @param trade       the appended trade record
     * @param position    copy of the position after the trade
     * @param totalTrades session trade count including this trade
     */
    public PaperTradeEvent(Object source, PaperTrade trade, Position position, int totalTrades) {
        super(source);
        this.trade = trade;
        this.position = position;
        this.totalTrades = totalTrades;
    }

    public PaperTrade getTrade() {
        return trade;
    }

    public Position getPosition() {
        return position;
    }

    public int getTotalTrades() {
        return totalTrades;
    }
}
