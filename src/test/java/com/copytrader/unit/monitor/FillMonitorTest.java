package com.copytrader.unit.monitor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.copytrader.broker.FillSource;
import com.copytrader.config.CopyTraderProperties;
import com.copytrader.domain.model.Fill;
import com.copytrader.exception.VenueException;
import com.copytrader.monitor.FillMonitor;
import com.copytrader.observability.PaperTradingMetrics;
import com.copytrader.persistence.NoopTradeJournal;
import com.copytrader.session.PaperTradingSession;
import com.copytrader.session.SessionSettings;
import com.copytrader.unit.support.Fills;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for the fill monitor: deduplication across overlapping polls, the copy threshold,
 * the per-check cap and retry handling. Uses a real session and a mocked fill source.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("FillMonitor")
class FillMonitorTest {

    private static final String ACCOUNT = "0x1234567890abcdef1234567890abcdef12345678";
    private static final Instant NOW = Instant.parse("2025-01-15T10:30:00Z");

    @Mock
    private FillSource fillSource;

    private CopyTraderProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private PaperTradingSession session;
    private FillMonitor fillMonitor;

    @BeforeEach
    void setUp() {
        properties = new CopyTraderProperties();
        properties.getMonitor().setTargetAccount(ACCOUNT);
        properties.getMonitor().setRetryDelay(Duration.ZERO);

        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        meterRegistry = new SimpleMeterRegistry();
        session = new PaperTradingSession(
                SessionSettings.builder().bankroll(1e9).volumeThreshold(0).build(),
                new NoopTradeJournal(),
                event -> {},
                clock);
        PaperTradingMetrics metrics = new PaperTradingMetrics(meterRegistry, session);
        fillMonitor = new FillMonitor(fillSource, session, metrics, properties, clock);
    }

    private double counter(String name) {
        return meterRegistry.get(name).counter().count();
    }

    // ==== Copying ====

    @Nested
    @DisplayName("Copying")
    class Copying {

        @Test
        @DisplayName("should query the lookback window ending now")
        void queriesLookbackWindow() {
            when(fillSource.fetchFills(any(), any(), any())).thenReturn(List.of());

            fillMonitor.pollWithRetries();

            verify(fillSource).fetchFills(ACCOUNT, NOW.minus(Duration.ofHours(1)), NOW);
        }

        @Test
        @DisplayName("should copy each fill once across overlapping polls")
        void dedupAcrossPolls() {
            Fill first = Fills.buy("BTC", 0.1, 50000);
            Fill second = Fills.buy("ETH", 1.0, 3000);
            when(fillSource.fetchFills(eq(ACCOUNT), any(), any()))
                    .thenReturn(List.of(first, second))
                    .thenReturn(List.of(first, second, Fills.sell("BTC", 0.1, 51000)));

            assertThat(fillMonitor.pollWithRetries()).isEqualTo(2);
            assertThat(fillMonitor.pollWithRetries()).isEqualTo(1);

            assertThat(session.getTotalTrades()).isEqualTo(3);
            assertThat(session.getPosition("BTC").orElseThrow().isFlat()).isTrue();
            assertThat(counter("monitor.fills.copied")).isEqualTo(3.0);
        }

        @Test
        @DisplayName("should skip fills below the copy threshold on every poll")
        void belowThreshold_skipped() {
            Fill small = Fills.buy("BTC", 0.01, 50000);
            when(fillSource.fetchFills(eq(ACCOUNT), any(), any())).thenReturn(List.of(small));

            assertThat(fillMonitor.pollWithRetries()).isZero();
            assertThat(fillMonitor.pollWithRetries()).isZero();

            assertThat(session.getTotalTrades()).isZero();
            assertThat(counter("monitor.fills.below.threshold")).isEqualTo(2.0);
        }

        @Test
        @DisplayName("should cap fills per check and pick up the rest next poll")
        void maxFillsPerCheck() {
            properties.getMonitor().setMaxFillsPerCheck(2);
            List<Fill> fills = List.of(
                    Fills.buy("BTC", 0.1, 50000), Fills.buy("BTC", 0.1, 50100), Fills.buy("BTC", 0.1, 50200));
            when(fillSource.fetchFills(eq(ACCOUNT), any(), any())).thenReturn(fills);

            assertThat(fillMonitor.pollWithRetries()).isEqualTo(2);
            assertThat(fillMonitor.pollWithRetries()).isEqualTo(1);
            assertThat(fillMonitor.pollWithRetries()).isZero();

            assertThat(session.getPosition("BTC").orElseThrow().getTradeCount()).isEqualTo(3);
        }
    }

    // ==== Retries ====

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("should give up after max retries and record the failure")
        void exhaustsRetries() {
            when(fillSource.fetchFills(eq(ACCOUNT), any(), any())).thenThrow(new VenueException("503 from venue"));

            assertThat(fillMonitor.pollWithRetries()).isZero();

            verify(fillSource, times(3)).fetchFills(eq(ACCOUNT), any(), any());
            assertThat(counter("monitor.fetch.failures")).isEqualTo(1.0);
            assertThat(session.getTotalTrades()).isZero();
        }

        @Test
        @DisplayName("should recover when a retry succeeds")
        void recoversOnRetry() {
            when(fillSource.fetchFills(eq(ACCOUNT), any(), any()))
                    .thenThrow(new VenueException("timeout"))
                    .thenReturn(List.of(Fills.buy("SOL", 20, 100)));

            assertThat(fillMonitor.pollWithRetries()).isEqualTo(1);

            verify(fillSource, times(2)).fetchFills(eq(ACCOUNT), any(), any());
            assertThat(counter("monitor.fetch.failures")).isZero();
            assertThat(session.getPosition("SOL")).isPresent();
        }
    }
}
