package com.copytrader.api.dto.response;

import com.copytrader.domain.model.PaperTrade;
import lombok.Builder;
import lombok.Getter;

/** Outcome of a submitted fill: the committed trade, or the fill count still pending for the coin. */
@Getter
@Builder
public class FillIngestResponse {

    private final boolean committed;
    private final PaperTrade trade;
    private final int pendingFills;
}
