package com.copytrader.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/** HTTP client for the venue's public info API. */
@Configuration
public class VenueConfig {

    private static final Logger log = LoggerFactory.getLogger(VenueConfig.class);

    /**
     * RestClient bound to mainnet or testnet depending on {@code copytrader.venue.use-testnet}.
     * Used by HyperliquidFillSource for fill queries.
     */
    @Bean
    public RestClient venueRestClient(CopyTraderProperties properties) {
        CopyTraderProperties.Venue venue = properties.getVenue();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(venue.getConnectTimeout());
        requestFactory.setReadTimeout(venue.getReadTimeout());
        log.info("Venue client targeting {}", venue.baseUrl());
        return RestClient.builder()
                .baseUrl(venue.baseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
