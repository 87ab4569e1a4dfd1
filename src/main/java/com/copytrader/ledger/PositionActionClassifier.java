package com.copytrader.ledger;

import com.copytrader.domain.enums.PositionAction;

/**
 * Maps a position's signed size before and after a trade to the transition it represents.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>old == 0, new != 0: OPEN</li>
 *   <li>old != 0, new == 0: CLOSE</li>
 *   <li>opposite non-zero signs: REVERSE</li>
 *   <li>same sign, |new| &gt; |old|: ADD</li>
 *   <li>same sign, |new| &lt; |old|: REDUCE</li>
 * </ol>
 *
 * <p>Callers pass a new size from {@link PositionSizes#resultingSize}, the same value the ledger
 * stores, so a full close classifies as CLOSE rather than a REDUCE to rounding residue.
 *
 * <p>The only pairs left over are zero-delta ones (old == new). The session never commits a
 * zero-delta trade, so they cannot reach the ledger; they classify as ADD, which realizes
 * nothing and leaves the cost basis untouched.
 */
public class PositionActionClassifier {

    public PositionAction classify(double oldSize, double newSize) {
        if (oldSize == 0 && newSize != 0) {
            return PositionAction.OPEN;
        }
        if (oldSize != 0 && newSize == 0) {
            return PositionAction.CLOSE;
        }
        if (oldSize != 0 && Math.signum(oldSize) != Math.signum(newSize)) {
            return PositionAction.REVERSE;
        }
        if (Math.abs(newSize) > Math.abs(oldSize)) {
            return PositionAction.ADD;
        }
        if (Math.abs(newSize) < Math.abs(oldSize)) {
            return PositionAction.REDUCE;
        }
        return PositionAction.ADD;
    }
}
