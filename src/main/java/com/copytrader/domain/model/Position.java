package com.copytrader.domain.model;

import com.copytrader.domain.enums.PositionType;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Paper position in one instrument.
 *
 * <p>Size is signed: positive = LONG, negative = SHORT, zero = FLAT. A position is created
 * lazily on the first committed trade for its coin and is never removed, so a flat position
 * still carries its realized PnL and trade count.
 *
 * <p>While {@code size != 0}, {@code avgEntryPrice == totalCostBasis / |size|}. While flat,
 * both are exactly zero. Only {@link com.copytrader.ledger.PositionLedger} mutates these fields;
 * everything outside the session sees copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String coin;

    /** Signed quantity: positive = long, negative = short. */
    private double size;

    /** Volume-weighted average entry price of the currently open exposure. */
    private double avgEntryPrice;

    /** Absolute cost of the currently open exposure. */
    private double totalCostBasis;

    /** Cumulative realized PnL attributed to this coin. */
    private double realizedPnl;

    /** Most recent traded price, used for mark-to-market. */
    private double lastPrice;

    private int tradeCount;

    /** Time the current directional exposure was opened. Null until the first open. */
    private Instant openTime;

    private Instant lastUpdated;

    public static Position flat(String coin) {
        return Position.builder().coin(coin).build();
    }

    /** Derived from signed size. */
    public PositionType getType() {
        if (size > 0) {
            return PositionType.LONG;
        }
        return size < 0 ? PositionType.SHORT : PositionType.FLAT;
    }

    public boolean isFlat() {
        return size == 0;
    }

    /** Signed market value at the last price. */
    public double marketValue() {
        return size * lastPrice;
    }

    /** Absolute notional exposure at the last price. */
    public double exposure() {
        return Math.abs(size) * lastPrice;
    }

    public Position copy() {
        return toBuilder().build();
    }
}
