package com.copytrader.monitor;

import com.copytrader.broker.FillSource;
import com.copytrader.config.CopyTraderProperties;
import com.copytrader.domain.model.Fill;
import com.copytrader.exception.VenueException;
import com.copytrader.observability.PaperTradingMetrics;
import com.copytrader.session.PaperTradingSession;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls the target account's recent fills and copies new ones into the paper session.
 *
 * <p>Each poll asks for the last {@code lookback} of fills, skips hashes already processed,
 * skips fills under the copy threshold, and hands at most {@code max-fills-per-check} new fills
 * to {@link PaperTradingSession#processFill(Fill)} in time order. Fills under the threshold are
 * not recorded, so a later poll sees them again and skips them again.
 *
 * <p>A failed fetch is retried with a linearly growing wait. When every attempt fails the poll is
 * abandoned and the next scheduled poll starts fresh. The session lock is never held across the
 * venue call.
 *
 * <p>Only active when {@code copytrader.monitor.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "copytrader.monitor", name = "enabled", havingValue = "true")
public class FillMonitor {

    private static final Logger log = LoggerFactory.getLogger(FillMonitor.class);

    private final FillSource fillSource;
    private final PaperTradingSession session;
    private final PaperTradingMetrics metrics;
    private final CopyTraderProperties.Monitor config;
    private final Clock clock;
    private final ProcessedFillRegistry registry = new ProcessedFillRegistry();

    public FillMonitor(
            FillSource fillSource,
            PaperTradingSession session,
            PaperTradingMetrics metrics,
            CopyTraderProperties properties,
            Clock clock) {
        this.fillSource = fillSource;
        this.session = session;
        this.metrics = metrics;
        this.config = properties.getMonitor();
        this.clock = clock;
    }

    @PostConstruct
    void start() {
        if (config.getTargetAccount() == null || config.getTargetAccount().isBlank()) {
            throw new IllegalStateException("copytrader.monitor.target-account must be set when the monitor is enabled");
        }
        log.info(
                "Copying fills of {} every {} (copy threshold ${}, max {} fills per check)",
                config.getTargetAccount(),
                config.getPollInterval(),
                config.getCopyThreshold(),
                config.getMaxFillsPerCheck());
    }

    @Scheduled(fixedDelayString = "${copytrader.monitor.poll-interval:5s}")
    public void poll() {
        pollWithRetries();
    }

    /** Runs one poll, retrying failed fetches. Returns the number of fills copied. */
    public int pollWithRetries() {
        int maxRetries = config.getMaxRetries();
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                return checkForNewFills();
            } catch (VenueException e) {
                log.warn("Fill check attempt {}/{} failed: {}", attempt, maxRetries, e.getMessage());
                if (attempt < maxRetries && !backOff(attempt)) {
                    return 0;
                }
            }
        }
        metrics.recordFetchFailure();
        log.error("Fill check abandoned after {} attempts", maxRetries);
        return 0;
    }

    private int checkForNewFills() {
        Instant now = clock.instant();
        int evicted = registry.evictOlderThan(now.minus(config.getDedupRetention()));
        if (evicted > 0) {
            log.debug("Evicted {} processed fill hashes", evicted);
        }

        List<Fill> fills = fillSource.fetchFills(config.getTargetAccount(), now.minus(config.getLookback()), now);

        int copied = 0;
        for (Fill fill : fills) {
            if (copied >= config.getMaxFillsPerCheck()) {
                log.info("Reached {} fills this check, deferring the rest", copied);
                break;
            }
            if (registry.contains(fill)) {
                continue;
            }
            if (fill.notional() < config.getCopyThreshold()) {
                metrics.recordFillBelowThreshold();
                log.debug("Skipping {} {} fill of ${} below copy threshold", fill.getCoin(), fill.getSide(), fill.notional());
                continue;
            }
            registry.markIfNew(fill);
            session.processFill(fill);
            metrics.recordFillCopied();
            copied++;
        }
        return copied;
    }

    private boolean backOff(int attempt) {
        Duration wait = config.getRetryDelay().multipliedBy(attempt);
        try {
            Thread.sleep(wait.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Fill check interrupted while backing off");
            return false;
        }
    }
}
