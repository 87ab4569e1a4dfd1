package com.copytrader.pnl;

import com.copytrader.domain.enums.PositionAction;
import com.copytrader.domain.model.Position;

/**
 * Realized and unrealized PnL over ledger state. Pure functions, no side effects.
 *
 * <p>Realized PnL is only ever produced by REDUCE, CLOSE and REVERSE. When the venue reports
 * a non-zero closed PnL for such a trade it is taken verbatim; otherwise the disposed quantity
 * is valued against the position's average entry price.
 */
public class PnLCalculator {

    /**
     * PnL realized by applying {@code tradeSize} (signed) at {@code execPrice} to {@code position}.
     * Must be called before the ledger changes the position.
     *
     * @param venueClosedPnl the venue's closed PnL for the trade, 0 if absent or unparsable
     */
    public double realizedPnl(
            Position position, double tradeSize, double execPrice, double venueClosedPnl, PositionAction action) {
        if (!action.realizesPnl()) {
            return 0.0;
        }
        if (venueClosedPnl != 0.0) {
            return venueClosedPnl;
        }
        double reducedQuantity = Math.min(Math.abs(tradeSize), Math.abs(position.getSize()));
        double pnlPerUnit;
        if (position.getSize() > 0) {
            // Long being reduced: profit if sold above entry
            pnlPerUnit = execPrice - position.getAvgEntryPrice();
        } else {
            // Short being reduced: profit if bought back below entry
            pnlPerUnit = position.getAvgEntryPrice() - execPrice;
        }
        return pnlPerUnit * reducedQuantity;
    }

    /**
     * Mark-to-market PnL: {@code (lastPrice - avgEntryPrice) * size}.
     * The signed size makes the formula correct for both longs and shorts.
     */
    public double unrealizedPnl(Position position) {
        if (position.getSize() == 0 || position.getAvgEntryPrice() == 0) {
            return 0.0;
        }
        return (position.getLastPrice() - position.getAvgEntryPrice()) * position.getSize();
    }

    /** Price move since entry as a percentage of entry, 0 when there is no entry price. */
    public double pnlPercent(Position position) {
        if (position.getAvgEntryPrice() <= 0) {
            return 0.0;
        }
        return (position.getLastPrice() - position.getAvgEntryPrice()) / position.getAvgEntryPrice() * 100.0;
    }
}
