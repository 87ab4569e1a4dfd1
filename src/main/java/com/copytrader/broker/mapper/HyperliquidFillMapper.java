package com.copytrader.broker.mapper;

import com.copytrader.broker.dto.HyperliquidFillResponse;
import com.copytrader.domain.enums.OrderSide;
import com.copytrader.domain.model.Fill;
import com.copytrader.pnl.VenueDecimals;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts venue fill payloads to domain {@link Fill}s.
 *
 * <p>Side codes become {@link OrderSide}; string decimals go through
 * {@link VenueDecimals#parseOrZero(String)}. The closed PnL stays a string on the fill and is
 * parsed where it is summed. A payload with an unknown side or a non-positive price is dropped
 * with a warning rather than fed to the session.
 */
@Component
public class HyperliquidFillMapper {

    private static final Logger log = LoggerFactory.getLogger(HyperliquidFillMapper.class);

    public Fill toFill(HyperliquidFillResponse response) {
        return Fill.builder()
                .coin(response.getCoin())
                .side(OrderSide.fromVenueCode(response.getSide()))
                .size(Math.abs(VenueDecimals.parseOrZero(response.getSize())))
                .price(VenueDecimals.parseOrZero(response.getPrice()))
                .closedPnl(response.getClosedPnl())
                .time(response.getTime())
                .hash(response.getHash())
                .direction(response.getDirection())
                .orderId(response.getOrderId())
                .startPosition(response.getStartPosition())
                .fee(response.getFee())
                .crossed(response.isCrossed())
                .build();
    }

    public List<Fill> toFills(List<HyperliquidFillResponse> responses) {
        if (responses == null) {
            return List.of();
        }
        List<Fill> fills = new ArrayList<>(responses.size());
        for (HyperliquidFillResponse response : responses) {
            if (response == null) {
                continue;
            }
            try {
                Fill fill = toFill(response);
                if (fill.getPrice() <= 0) {
                    log.warn("Dropping {} fill {} with non-positive price {}", fill.getCoin(), fill.getHash(), response.getPrice());
                    continue;
                }
                fills.add(fill);
            } catch (IllegalArgumentException e) {
                log.warn("Dropping {} fill {}: {}", response.getCoin(), response.getHash(), e.getMessage());
            }
        }
        return fills;
    }
}
