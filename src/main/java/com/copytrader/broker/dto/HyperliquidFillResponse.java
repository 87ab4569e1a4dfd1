package com.copytrader.broker.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One element of the {@code userFills} / {@code userFillsByTime} info response.
 * Decimals arrive as strings and are converted by {@link com.copytrader.broker.mapper.HyperliquidFillMapper}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HyperliquidFillResponse {

    private String coin;

    /** "B" for a buy, "A" for a sell. */
    private String side;

    @JsonProperty("sz")
    private String size;

    @JsonProperty("px")
    private String price;

    private long time;

    private String startPosition;

    @JsonProperty("dir")
    private String direction;

    private String closedPnl;

    private String hash;

    @JsonProperty("oid")
    private Long orderId;

    private boolean crossed;

    private String fee;
}
