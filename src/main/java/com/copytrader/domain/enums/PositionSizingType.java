package com.copytrader.domain.enums;

/** How the exposure guard treats a committed trade before it reaches the ledger. */
public enum PositionSizingType {
    /** Keep the copied size, reject the trade if it would breach the exposure ceiling. */
    HARD_LIMIT,
    /** Replace the copied size with a base notional, shrunk to the remaining exposure capacity. */
    DYNAMIC_NOTIONAL
}
