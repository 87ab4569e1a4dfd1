package com.copytrader.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.copytrader.broker.dto.HyperliquidFillResponse;
import com.copytrader.broker.mapper.HyperliquidFillMapper;
import com.copytrader.domain.enums.OrderSide;
import com.copytrader.domain.model.Fill;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HyperliquidFillMapperTest {

    private final HyperliquidFillMapper mapper = new HyperliquidFillMapper();

    private HyperliquidFillResponse.HyperliquidFillResponseBuilder response() {
        return HyperliquidFillResponse.builder()
                .coin("BTC")
                .side("B")
                .size("0.125")
                .price("50123.5")
                .time(1_736_935_200_000L)
                .startPosition("0.0")
                .direction("Open Long")
                .closedPnl("0.0")
                .hash("0xabc")
                .orderId(91490942L)
                .crossed(true)
                .fee("2.15");
    }

    @Test
    @DisplayName("Maps venue strings to typed fill fields")
    void toFill_mapsFields() {
        Fill fill = mapper.toFill(response().build());

        assertThat(fill.getCoin()).isEqualTo("BTC");
        assertThat(fill.getSide()).isEqualTo(OrderSide.BUY);
        assertThat(fill.getSize()).isEqualTo(0.125);
        assertThat(fill.getPrice()).isEqualTo(50123.5);
        assertThat(fill.getTime()).isEqualTo(1_736_935_200_000L);
        assertThat(fill.getClosedPnl()).isEqualTo("0.0");
        assertThat(fill.getHash()).isEqualTo("0xabc");
        assertThat(fill.getDirection()).isEqualTo("Open Long");
        assertThat(fill.getOrderId()).isEqualTo(91490942L);
        assertThat(fill.isCrossed()).isTrue();
    }

    @Test
    @DisplayName("Side code A maps to SELL")
    void sellSide() {
        assertThat(mapper.toFill(response().side("A").build()).getSide()).isEqualTo(OrderSide.SELL);
    }

    @Test
    @DisplayName("Malformed size parses to zero")
    void malformedSize_isZero() {
        assertThat(mapper.toFill(response().size("n/a").build()).getSize()).isZero();
    }

    @Test
    @DisplayName("Unknown side code is rejected")
    void unknownSide_throws() {
        assertThatThrownBy(() -> mapper.toFill(response().side("X").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Batch mapping drops unknown sides, bad prices and null entries")
    void toFills_dropsInvalid() {
        List<Fill> fills = mapper.toFills(Arrays.asList(
                response().hash("0x1").build(),
                response().hash("0x2").side("Z").build(),
                null,
                response().hash("0x3").price("0").build(),
                response().hash("0x4").price("garbage").build(),
                response().hash("0x5").side("A").build()));

        assertThat(fills).extracting(Fill::getHash).containsExactly("0x1", "0x5");
    }

    @Test
    @DisplayName("Null payload maps to an empty list")
    void toFills_null() {
        assertThat(mapper.toFills(null)).isEmpty();
    }
}
