package com.copytrader.domain.enums;

/**
 * Direction of a position, derived from the signed size.
 * Positive size = LONG, negative size = SHORT, zero = FLAT.
 */
public enum PositionType {
    LONG,
    SHORT,
    FLAT
}
