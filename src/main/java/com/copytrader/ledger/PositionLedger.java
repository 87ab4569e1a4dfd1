package com.copytrader.ledger;

import com.copytrader.domain.model.Position;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One mutable {@link Position} per coin, plus the update that keeps each position's
 * cost basis consistent with its size.
 *
 * <p>Positions are created lazily and never removed. The ledger is not thread-safe: the owning
 * session calls it only while holding its lock, and calls {@link #applyTrade} exactly once per
 * committed trade.
 */
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    /** Insertion-ordered so reports list coins in the order they were first traded. */
    private final Map<String, Position> positions = new LinkedHashMap<>();

    public Position getOrCreate(String coin) {
        return positions.computeIfAbsent(coin, Position::flat);
    }

    public Optional<Position> find(String coin) {
        return Optional.ofNullable(positions.get(coin));
    }

    /** Live view of every position, flat ones included. */
    public Collection<Position> all() {
        return Collections.unmodifiableCollection(positions.values());
    }

    public List<Position> open() {
        List<Position> open = new ArrayList<>();
        for (Position position : positions.values()) {
            if (!position.isFlat()) {
                open.add(position);
            }
        }
        return open;
    }

    /**
     * Applies a committed trade of signed size {@code delta} at {@code price}.
     *
     * <p>{@code realizedPnl} must already be computed against the pre-trade position.
     * The average entry price is reset on open, reversal and close, blended on add,
     * and left alone on reduce. The resulting size goes through
     * {@link PositionSizes#resultingSize}, so a full close lands exactly on zero.
     *
     * <p>On reduce the cost basis is not left unchanged: it is rescaled to
     * {@code avgEntryPrice x |newSize|}. Keeping the pre-reduce cost basis would break
     * {@code avgEntryPrice == totalCostBasis / |size|} and overstate the blended entry price of
     * a later add.
     */
    public void applyTrade(Position position, double delta, double price, double realizedPnl, Instant now) {
        double oldSize = position.getSize();
        double newSize = PositionSizes.resultingSize(oldSize, delta);

        position.setRealizedPnl(position.getRealizedPnl() + realizedPnl);

        if (newSize == 0) {
            position.setAvgEntryPrice(0);
            position.setTotalCostBasis(0);
        } else if (oldSize == 0) {
            position.setAvgEntryPrice(price);
            position.setTotalCostBasis(price * Math.abs(delta));
            position.setOpenTime(now);
        } else if (Math.signum(oldSize) != Math.signum(newSize)) {
            // Reversal: the surviving quantity is a fresh position at the trade price
            position.setAvgEntryPrice(price);
            position.setTotalCostBasis(price * Math.abs(newSize));
            position.setOpenTime(now);
        } else if (Math.abs(newSize) > Math.abs(oldSize)) {
            double costBasis = position.getTotalCostBasis() + price * Math.abs(delta);
            position.setTotalCostBasis(costBasis);
            position.setAvgEntryPrice(costBasis / Math.abs(newSize));
        } else {
            // Reduce: entry price is kept, cost basis shrinks with the remaining lot
            position.setTotalCostBasis(position.getAvgEntryPrice() * Math.abs(newSize));
        }

        position.setSize(newSize);
        position.setTradeCount(position.getTradeCount() + 1);
        position.setLastUpdated(now);

        log.debug(
                "Position {} size {} -> {} avg={} realized={}",
                position.getCoin(),
                oldSize,
                newSize,
                position.getAvgEntryPrice(),
                position.getRealizedPnl());
    }
}
