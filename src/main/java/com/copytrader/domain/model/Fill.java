package com.copytrader.domain.model;

import com.copytrader.domain.enums.OrderSide;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One executed trade reported for the monitored account.
 *
 * <p>Immutable once built. Size is always non-negative; direction lives in {@link #side}.
 * The venue's closed-PnL field is kept as the raw string it arrived as, because the venue
 * sometimes sends values that do not parse. Callers convert it through
 * {@link com.copytrader.pnl.VenueDecimals#parseOrZero(String)}.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class Fill {

    private final String coin;
    private final OrderSide side;
    private final double size;
    private final double price;

    /** Venue-reported closed PnL, string-encoded. May be null, blank, or malformed. */
    private final String closedPnl;

    /** Execution time in epoch milliseconds, as reported by the venue. */
    private final long time;

    /** Unique content hash, used upstream for idempotent ingestion. */
    private final String hash;

    /** Venue direction label, e.g. "Open Long" or "Close Short". Informational only. */
    private final String direction;

    private final Long orderId;
    private final String startPosition;
    private final String fee;
    private final boolean crossed;

    /** Size with the side's sign applied: positive for BUY, negative for SELL. */
    public double signedSize() {
        return side.sign() * size;
    }

    /** Dollar volume of the fill (size x price). */
    public double notional() {
        return size * price;
    }

    public Instant timestamp() {
        return Instant.ofEpochMilli(time);
    }
}
