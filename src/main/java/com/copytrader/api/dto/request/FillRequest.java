package com.copytrader.api.dto.request;

import com.copytrader.domain.enums.OrderSide;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Manually submitted fill. A zero size is accepted and ignored by the session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FillRequest {

    @NotBlank
    private String coin;

    @NotNull
    private OrderSide side;

    @NotNull
    @PositiveOrZero
    private Double size;

    @NotNull
    @Positive
    private Double price;

    /** Venue closed PnL as a decimal string; optional. */
    private String closedPnl;

    /** Execution time in epoch millis; defaults to the time of the request. */
    private Long time;

    private String hash;
}
