package com.copytrader.domain.model;

import com.copytrader.domain.enums.OrderSide;
import com.copytrader.domain.enums.PositionAction;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Append-only record of one committed (possibly aggregated) trade.
 * History order is processing order.
 */
@Getter
@Builder
@ToString
public class PaperTrade {

    private final Instant timestamp;
    private final String coin;
    private final PositionAction action;
    private final OrderSide side;

    /** Traded quantity, always non-negative. */
    private final double size;

    /** Average execution price of the committed batch. */
    private final double price;

    /** PnL realized by this trade alone. */
    private final double realizedPnl;

    /** Signed position size after the trade. */
    private final double positionSize;

    /** Unrealized PnL of the position right after the trade. */
    private final double unrealizedPnl;
}
