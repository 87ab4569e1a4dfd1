package com.copytrader.pnl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Boundary parser for the string-encoded decimals the venue sends (sizes, prices, closed PnL).
 *
 * <p>A value that is null, blank, malformed, or not finite parses to zero. Accounting then
 * proceeds on locally computed figures instead of failing the fill.
 */
public final class VenueDecimals {

    private static final Logger log = LoggerFactory.getLogger(VenueDecimals.class);

    private VenueDecimals() {}

    public static double parseOrZero(String value) {
        if (value == null || value.isBlank()) {
            return 0.0;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            if (!Double.isFinite(parsed)) {
                log.debug("Non-finite venue decimal '{}' treated as 0", value);
                return 0.0;
            }
            return parsed;
        } catch (NumberFormatException e) {
            log.debug("Unparsable venue decimal '{}' treated as 0", value);
            return 0.0;
        }
    }
}
