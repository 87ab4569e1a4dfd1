package com.copytrader.ledger;

/**
 * Size arithmetic shared by the aggregator, classifier and ledger.
 *
 * <p>Decimal lot sizes do not sum exactly in binary floating point: 0.1 + 0.2 - 0.3 leaves
 * 5.55e-17. A result within {@link #RELATIVE_TOLERANCE} of the magnitudes that produced it
 * is snapped to exactly zero, so a position that is closed in full ends flat and a batch that
 * nets out commits nothing.
 */
public final class PositionSizes {

    public static final double RELATIVE_TOLERANCE = 1e-9;

    private PositionSizes() {}

    /** Returns 0 when {@code |value| <= tolerance x scale}, otherwise {@code value}. */
    public static double snapToZero(double value, double scale) {
        return Math.abs(value) <= RELATIVE_TOLERANCE * Math.abs(scale) ? 0.0 : value;
    }

    /** Position size after applying {@code delta}, with rounding residue snapped to zero. */
    public static double resultingSize(double oldSize, double delta) {
        return snapToZero(oldSize + delta, Math.max(Math.abs(oldSize), Math.abs(delta)));
    }
}
