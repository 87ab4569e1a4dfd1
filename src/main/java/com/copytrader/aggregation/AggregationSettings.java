package com.copytrader.aggregation;

import java.time.Duration;
import lombok.Builder;
import lombok.Getter;

/** Commit thresholds and decay parameters for {@link FillAggregator}. */
@Getter
@Builder
public class AggregationSettings {

    /** Pending dollar volume that forces a commit. 0 commits every fill. */
    private final double volumeThreshold;

    /** Age of the oldest pending fill that forces a commit. */
    private final Duration minTradeInterval;

    /** Fraction of pending volume lost per minute of waiting, in [0, 1]. */
    private final double volumeDecayRate;
}
