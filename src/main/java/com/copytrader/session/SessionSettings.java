package com.copytrader.session;

import com.copytrader.aggregation.AggregationSettings;
import com.copytrader.domain.enums.PositionSizingType;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable inputs a {@link PaperTradingSession} is constructed with.
 *
 * <p>Dynamic sizing is in effect only when it is not disabled and a positive base notional is set;
 * otherwise committed trades keep their copied size and go through hard validation.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class SessionSettings {

    public static final double DEFAULT_VOLUME_THRESHOLD = 1000.0;
    public static final double DEFAULT_VOLUME_DECAY_RATE = 0.5;
    public static final Duration DEFAULT_MIN_TRADE_INTERVAL = Duration.ofSeconds(60);

    private final double bankroll;

    @Builder.Default
    private final double leverage = 1.0;

    /** Target notional per copied trade. Null or non-positive disables dynamic sizing. */
    private final Double baseNotional;

    private final boolean dynamicSizingDisabled;

    @Builder.Default
    private final Duration minTradeInterval = DEFAULT_MIN_TRADE_INTERVAL;

    @Builder.Default
    private final double volumeThreshold = DEFAULT_VOLUME_THRESHOLD;

    @Builder.Default
    private final double volumeDecayRate = DEFAULT_VOLUME_DECAY_RATE;

    public PositionSizingType sizingType() {
        if (dynamicSizingDisabled || baseNotional == null || baseNotional <= 0) {
            return PositionSizingType.HARD_LIMIT;
        }
        return PositionSizingType.DYNAMIC_NOTIONAL;
    }

    /** True when every fill is committed on arrival. */
    public boolean commitsEveryFill() {
        return volumeThreshold == 0;
    }

    public AggregationSettings toAggregationSettings() {
        return AggregationSettings.builder()
                .volumeThreshold(volumeThreshold)
                .minTradeInterval(minTradeInterval)
                .volumeDecayRate(volumeDecayRate)
                .build();
    }

    /**
     * @throws IllegalArgumentException if any value is outside its allowed range
     */
    public void validate() {
        if (!(bankroll > 0) || Double.isInfinite(bankroll)) {
            throw new IllegalArgumentException("bankroll must be a positive finite number, got " + bankroll);
        }
        if (!(leverage >= 1) || Double.isInfinite(leverage)) {
            throw new IllegalArgumentException("leverage must be at least 1, got " + leverage);
        }
        if (!(volumeDecayRate >= 0 && volumeDecayRate <= 1)) {
            throw new IllegalArgumentException("volumeDecayRate must be within [0, 1], got " + volumeDecayRate);
        }
        if (!(volumeThreshold >= 0)) {
            throw new IllegalArgumentException("volumeThreshold must not be negative, got " + volumeThreshold);
        }
        if (minTradeInterval == null || minTradeInterval.isNegative()) {
            throw new IllegalArgumentException("minTradeInterval must not be negative, got " + minTradeInterval);
        }
    }
}
