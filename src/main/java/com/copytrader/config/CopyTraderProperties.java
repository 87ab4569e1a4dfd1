package com.copytrader.config;

import com.copytrader.session.SessionSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the copy-trading paper engine.
 *
 * <p>Binds to the {@code copytrader.*} prefix in application.properties:
 * <ul>
 *   <li>{@code paper}: bankroll, leverage, sizing and aggregation inputs of the session</li>
 *   <li>{@code venue}: Hyperliquid info API endpoints and HTTP timeouts</li>
 *   <li>{@code monitor}: polling of the target account's fills</li>
 *   <li>{@code storage}: JSON-lines journal location</li>
 *   <li>{@code reporting}: summary cadence</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "copytrader")
@Validated
@Getter
@Setter
public class CopyTraderProperties {

    @Valid
    private Paper paper = new Paper();

    @Valid
    private Venue venue = new Venue();

    @Valid
    private Monitor monitor = new Monitor();

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Reporting reporting = new Reporting();

    public SessionSettings toSessionSettings() {
        return SessionSettings.builder()
                .bankroll(paper.getBankroll())
                .leverage(paper.getLeverage())
                .baseNotional(paper.getBaseNotional())
                .dynamicSizingDisabled(paper.isDynamicSizingDisabled())
                .minTradeInterval(paper.getMinTradeInterval())
                .volumeThreshold(paper.getVolumeThreshold())
                .volumeDecayRate(paper.getVolumeDecayRate())
                .build();
    }

    @Getter
    @Setter
    public static class Paper {

        /** Paper capital the session starts with, in USD. */
        @Positive
        private double bankroll = 10_000;

        /** Multiplier on available capital giving the exposure ceiling. */
        @DecimalMin("1.0")
        private double leverage = 1.0;

        /** USD notional per copied trade under dynamic sizing. Unset or 0 disables it. */
        private Double baseNotional = 1_000.0;

        /** Keep copied sizes and reject trades over the ceiling instead of resizing them. */
        private boolean dynamicSizingDisabled = false;

        /** Oldest a pending fill may get before its batch is committed. */
        @NotNull
        private Duration minTradeInterval = SessionSettings.DEFAULT_MIN_TRADE_INTERVAL;

        /** Pending USD volume that commits a batch. 0 commits every fill. */
        @PositiveOrZero
        private double volumeThreshold = SessionSettings.DEFAULT_VOLUME_THRESHOLD;

        /** Fraction of pending volume lost per minute. */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double volumeDecayRate = SessionSettings.DEFAULT_VOLUME_DECAY_RATE;
    }

    @Getter
    @Setter
    public static class Venue {

        private boolean useTestnet = false;

        @NotBlank
        private String mainnetUrl = "https://api.hyperliquid.xyz";

        @NotBlank
        private String testnetUrl = "https://api.hyperliquid-testnet.xyz";

        /** HTTP connect timeout in milliseconds. */
        private int connectTimeout = 5000;

        /** HTTP read timeout in milliseconds. */
        private int readTimeout = 10000;

        public String baseUrl() {
            return useTestnet ? testnetUrl : mainnetUrl;
        }
    }

    @Getter
    @Setter
    public static class Monitor {

        /** Starts the scheduled poll of the target account. */
        private boolean enabled = false;

        /** Address whose fills are copied. */
        private String targetAccount;

        @NotNull
        private Duration pollInterval = Duration.ofSeconds(5);

        /** How far back each poll asks the venue for fills. */
        @NotNull
        private Duration lookback = Duration.ofHours(1);

        /** How long a processed fill hash is remembered. */
        @NotNull
        private Duration dedupRetention = Duration.ofHours(2);

        @Min(1)
        private int maxFillsPerCheck = 50;

        /** Fills below this USD notional are not copied. */
        @PositiveOrZero
        private double copyThreshold = 1_000;

        @Min(1)
        private int maxRetries = 3;

        /** Base wait between fetch attempts; attempt n waits n times this. */
        @NotNull
        private Duration retryDelay = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class Storage {

        private boolean enabled = true;

        /** Root of the fills/ and accounts/ journal directories. */
        @NotBlank
        private String dataDir = "data/hype-copy-bot";
    }

    @Getter
    @Setter
    public static class Reporting {

        /** Log a portfolio summary every this many committed trades. 0 disables it. */
        @PositiveOrZero
        private int summaryInterval = 10;

        /** Trades listed in the shutdown report. */
        @Min(1)
        private int recentTradesCount = 10;
    }
}
