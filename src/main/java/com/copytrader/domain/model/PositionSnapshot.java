package com.copytrader.domain.model;

import lombok.Builder;
import lombok.Getter;

/** Point-in-time valuation of one open position. */
@Getter
@Builder
public class PositionSnapshot {

    private final String coin;
    private final double size;
    private final double avgEntryPrice;
    private final double lastPrice;
    private final double realizedPnl;
    private final double unrealizedPnl;
    private final double marketValue;

    /** Price move since entry as a percentage of the entry price. */
    private final double pnlPercent;
}
