package com.copytrader.domain.enums;

/** Buy or sell side of a fill. Maps to the venue's one-letter side code ("B" bid, "A" ask). */
public enum OrderSide {
    BUY("B"),
    SELL("A");

    private final String venueCode;

    OrderSide(String venueCode) {
        this.venueCode = venueCode;
    }

    public String getVenueCode() {
        return venueCode;
    }

    /** +1 for BUY, -1 for SELL. Multiplied into a fill size to get the signed position delta. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }

    /** Side that moves a position by a delta of the given sign. Zero is treated as BUY. */
    public static OrderSide fromSignedSize(double signedSize) {
        return signedSize < 0 ? SELL : BUY;
    }

    /**
     * Parses the venue's side code. Anything other than "B" or "A" is rejected so that an
     * unknown code never silently flips a position.
     */
    public static OrderSide fromVenueCode(String code) {
        if ("B".equals(code)) {
            return BUY;
        }
        if ("A".equals(code)) {
            return SELL;
        }
        throw new IllegalArgumentException("Unknown venue side code: " + code);
    }
}
