package com.copytrader.aggregation;

import com.copytrader.domain.model.AggregatedTrade;
import com.copytrader.domain.model.Fill;
import com.copytrader.ledger.PositionSizes;
import com.copytrader.pnl.VenueDecimals;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buffers fills per coin and releases them as one {@link AggregatedTrade} once the pending
 * dollar volume reaches the threshold or the oldest pending fill reaches the minimum interval.
 *
 * <p>Pending volume decays by {@code (1 - decayRate)^minutes} since accumulation started, but
 * only after {@link #DECAY_GRACE_PERIOD}. When decayed volume drops below {@link #VOLUME_FLOOR}
 * the buffered fills are discarded without being committed.
 *
 * <p>Not thread-safe; owned by a single session and called under its lock.
 */
public class FillAggregator {

    private static final Logger log = LoggerFactory.getLogger(FillAggregator.class);

    static final Duration DECAY_GRACE_PERIOD = Duration.ofSeconds(10);
    static final double VOLUME_FLOOR = 1.0;

    private final AggregationSettings settings;
    private final Clock clock;
    private final Map<String, PendingFills> pendingByCoin = new HashMap<>();

    public FillAggregator(AggregationSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Adds a fill to its coin's buffer and returns the committed batch if a trigger fired.
     * The decay step runs against the fills already pending, before the new fill's volume is added.
     */
    public Optional<AggregatedTrade> offer(Fill fill) {
        Instant now = clock.instant();
        PendingFills pending = pendingByCoin.computeIfAbsent(fill.getCoin(), coin -> new PendingFills());

        applyDecay(fill.getCoin(), pending, now);
        pending.add(fill, now);

        if (shouldCommit(pending, now)) {
            return Optional.of(aggregate(fill.getCoin(), pending.drain()));
        }

        log.debug(
                "Buffered {} fill for {}: {} pending, volume {}",
                fill.getSide(),
                fill.getCoin(),
                pending.size(),
                String.format("%.2f", pending.getVolume()));
        return Optional.empty();
    }

    public int pendingFillCount(String coin) {
        PendingFills pending = pendingByCoin.get(coin);
        return pending == null ? 0 : pending.size();
    }

    public double pendingVolume(String coin) {
        PendingFills pending = pendingByCoin.get(coin);
        return pending == null ? 0.0 : pending.getVolume();
    }

    private void applyDecay(String coin, PendingFills pending, Instant now) {
        if (pending.isEmpty() || pending.getVolume() == 0) {
            return;
        }
        Duration elapsed = Duration.between(pending.getStartedAt(), now);
        if (elapsed.compareTo(DECAY_GRACE_PERIOD) < 0) {
            return;
        }
        double minutes = elapsed.toMillis() / 60_000.0;
        double decayed = pending.getVolume() * Math.pow(1.0 - settings.getVolumeDecayRate(), minutes);
        if (decayed < VOLUME_FLOOR) {
            log.debug("Pending volume for {} decayed away, dropping {} fills", coin, pending.size());
            pending.clear();
        } else {
            pending.setVolume(decayed);
        }
    }

    private boolean shouldCommit(PendingFills pending, Instant now) {
        if (pending.getVolume() >= settings.getVolumeThreshold()) {
            return true;
        }
        Duration waited = Duration.between(pending.getStartedAt(), now);
        return waited.compareTo(settings.getMinTradeInterval()) >= 0;
    }

    private AggregatedTrade aggregate(String coin, List<Fill> fills) {
        double signedSize = 0;
        double absoluteSize = 0;
        double notional = 0;
        double closedPnl = 0;
        Fill last = fills.get(fills.size() - 1);

        for (Fill fill : fills) {
            signedSize += fill.signedSize();
            absoluteSize += fill.getSize();
            notional += fill.getSize() * fill.getPrice();
            closedPnl += VenueDecimals.parseOrZero(fill.getClosedPnl());
        }

        return AggregatedTrade.builder()
                .coin(coin)
                .signedSize(PositionSizes.snapToZero(signedSize, absoluteSize))
                .averagePrice(notional / absoluteSize)
                .lastPrice(last.getPrice())
                .venueClosedPnl(closedPnl)
                .lastFillTime(last.timestamp())
                .fills(fills)
                .build();
    }
}
