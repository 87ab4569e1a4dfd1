package com.copytrader.domain.enums;

/**
 * Transition a committed trade causes on the position it touches, derived from the
 * position's signed size before and after the trade.
 */
public enum PositionAction {
    OPEN("🟢"),
    ADD("🔵"),
    REDUCE("🟡"),
    CLOSE("🔴"),
    REVERSE("🔄");

    private final String emoji;

    PositionAction(String emoji) {
        this.emoji = emoji;
    }

    public String getEmoji() {
        return emoji;
    }

    /** True for the transitions that dispose of existing exposure and therefore realize PnL. */
    public boolean realizesPnl() {
        return this == REDUCE || this == CLOSE || this == REVERSE;
    }
}
