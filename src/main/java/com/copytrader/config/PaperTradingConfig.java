package com.copytrader.config;

import com.copytrader.persistence.JsonLinesTradeJournal;
import com.copytrader.persistence.NoopTradeJournal;
import com.copytrader.persistence.TradeJournal;
import com.copytrader.session.PaperTradingSession;
import com.copytrader.session.SessionSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the paper-trading session and its journal.
 *
 * <p>The session is an ordinary object built from {@link SessionSettings}; Spring holds the one
 * instance this process trades with, and tests construct their own.
 */
@Configuration
@EnableConfigurationProperties(CopyTraderProperties.class)
public class PaperTradingConfig {

    private static final Logger log = LoggerFactory.getLogger(PaperTradingConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionSettings sessionSettings(CopyTraderProperties properties) {
        return properties.toSessionSettings();
    }

    /**
     * JSON-lines journal under the configured data directory. Falls back to a no-op journal when
     * storage is disabled or every fill is committed on arrival (deterministic test mode).
     */
    @Bean
    public TradeJournal tradeJournal(
            CopyTraderProperties properties, SessionSettings settings, ObjectMapper objectMapper, Clock clock) {
        CopyTraderProperties.Storage storage = properties.getStorage();
        if (!storage.isEnabled() || settings.commitsEveryFill()) {
            log.info("Trade journal disabled");
            return new NoopTradeJournal();
        }
        log.info("Trade journal writing to {}", storage.getDataDir());
        return new JsonLinesTradeJournal(Path.of(storage.getDataDir()), objectMapper, clock);
    }

    @Bean
    public PaperTradingSession paperTradingSession(
            SessionSettings settings,
            TradeJournal tradeJournal,
            ApplicationEventPublisher eventPublisher,
            Clock clock) {
        log.info(
                "Paper trading session: bankroll=${} leverage={}x sizing={} baseNotional={} volumeThreshold=${} "
                        + "minTradeInterval={} decayRate={}",
                settings.getBankroll(),
                settings.getLeverage(),
                settings.sizingType(),
                settings.getBaseNotional(),
                settings.getVolumeThreshold(),
                settings.getMinTradeInterval(),
                settings.getVolumeDecayRate());
        return new PaperTradingSession(settings, tradeJournal, eventPublisher, clock);
    }
}
