package com.copytrader.domain.model;

import com.copytrader.domain.enums.OrderSide;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * A batch of pending fills for one coin, collapsed into a single ledger update.
 *
 * <p>{@code averagePrice} weights each fill by its absolute size, so a batch that nets to
 * zero still has a meaningful price.
 */
@Getter
@Builder(toBuilder = true)
public class AggregatedTrade {

    private final String coin;

    /** Sum of the fills' signed sizes. */
    private final double signedSize;

    private final double averagePrice;

    /** Price of the last fill in the batch. */
    private final double lastPrice;

    /** Sum of the parsed venue closed-PnL values; unparsable values count as zero. */
    private final double venueClosedPnl;

    private final Instant lastFillTime;

    private final List<Fill> fills;

    public OrderSide getSide() {
        return OrderSide.fromSignedSize(signedSize);
    }
}
