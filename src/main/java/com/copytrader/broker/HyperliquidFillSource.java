package com.copytrader.broker;

import com.copytrader.broker.dto.HyperliquidFillResponse;
import com.copytrader.broker.mapper.HyperliquidFillMapper;
import com.copytrader.domain.model.Fill;
import com.copytrader.exception.VenueException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Reads fills from the Hyperliquid public info endpoint.
 *
 * <p>Sends {@code POST /info} with {@code {"type":"userFillsByTime", "user", "startTime", "endTime"}}
 * and sorts the result by fill time, since the venue returns newest first.
 */
@Component
public class HyperliquidFillSource implements FillSource {

    private static final Logger log = LoggerFactory.getLogger(HyperliquidFillSource.class);

    private static final ParameterizedTypeReference<List<HyperliquidFillResponse>> FILL_LIST =
            new ParameterizedTypeReference<>() {};

    private final RestClient venueRestClient;
    private final HyperliquidFillMapper fillMapper;

    public HyperliquidFillSource(
            @Qualifier("venueRestClient") RestClient venueRestClient, HyperliquidFillMapper fillMapper) {
        this.venueRestClient = venueRestClient;
        this.fillMapper = fillMapper;
    }

    @Override
    public List<Fill> fetchFills(String account, Instant from, Instant to) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "userFillsByTime");
        body.put("user", account);
        body.put("startTime", from.toEpochMilli());
        body.put("endTime", to.toEpochMilli());

        List<HyperliquidFillResponse> responses;
        try {
            responses = venueRestClient
                    .post()
                    .uri("/info")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(FILL_LIST);
        } catch (RestClientException e) {
            throw new VenueException("Failed to fetch fills for " + account + ": " + e.getMessage(), e);
        }

        List<Fill> fills = new ArrayList<>(fillMapper.toFills(responses));
        fills.sort(Comparator.comparingLong(Fill::getTime));
        log.debug("Fetched {} fills for {} between {} and {}", fills.size(), account, from, to);
        return fills;
    }
}
