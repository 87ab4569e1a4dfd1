package com.copytrader.observability;

import com.copytrader.event.PaperTradeEvent;
import com.copytrader.session.PaperTradingSession;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the paper session and the fill monitor.
 *
 * <ul>
 *   <li><b>paper.trades.committed</b> (counter, tag action): one per committed trade</li>
 *   <li><b>monitor.fills.copied</b> (counter): fills handed to the session</li>
 *   <li><b>monitor.fills.below.threshold</b> (counter): fills too small to copy</li>
 *   <li><b>monitor.fetch.failures</b> (counter): polls that exhausted their retries</li>
 *   <li><b>paper.realized.pnl</b>, <b>paper.unrealized.pnl</b>, <b>paper.exposure.current</b>,
 *       <b>paper.positions.active</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges are evaluated lazily by Micrometer at scrape time.
 */
@Service
public class PaperTradingMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter fillsCopiedCounter;
    private final Counter fillsBelowThresholdCounter;
    private final Counter fetchFailureCounter;

    public PaperTradingMetrics(MeterRegistry meterRegistry, PaperTradingSession session) {
        this.meterRegistry = meterRegistry;

        this.fillsCopiedCounter = Counter.builder("monitor.fills.copied")
                .description("Fills handed to the paper session")
                .register(meterRegistry);
        this.fillsBelowThresholdCounter = Counter.builder("monitor.fills.below.threshold")
                .description("Fills skipped because their notional is below the copy threshold")
                .register(meterRegistry);
        this.fetchFailureCounter = Counter.builder("monitor.fetch.failures")
                .description("Fill polls abandoned after exhausting retries")
                .register(meterRegistry);

        meterRegistry.gauge("paper.realized.pnl", session, s -> s.snapshot().getTotalRealizedPnl());
        meterRegistry.gauge("paper.unrealized.pnl", session, s -> s.snapshot().getTotalUnrealizedPnl());
        meterRegistry.gauge("paper.exposure.current", session, s -> s.snapshot().getCurrentExposure());
        meterRegistry.gauge("paper.positions.active", session, s -> s.snapshot().getActivePositions());
    }

    @EventListener
    @Order(20)
    public void onPaperTrade(PaperTradeEvent event) {
        meterRegistry
                .counter("paper.trades.committed", "action", event.getTrade().getAction().name())
                .increment();
    }

    public void recordFillCopied() {
        fillsCopiedCounter.increment();
    }

    public void recordFillBelowThreshold() {
        fillsBelowThresholdCounter.increment();
    }

    public void recordFetchFailure() {
        fetchFailureCounter.increment();
    }
}
