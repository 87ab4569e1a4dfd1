package com.copytrader.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Consistent view of session state, read under the session lock.
 * Only open positions are listed.
 */
@Getter
@Builder
public class PortfolioSnapshot {

    private final Instant timestamp;
    private final Instant sessionStart;
    private final double totalRealizedPnl;
    private final double totalUnrealizedPnl;
    private final double totalPnl;
    private final int totalTrades;
    private final double availableCapital;
    private final double maxExposure;
    private final double currentExposure;
    private final List<PositionSnapshot> positions;

    public int getActivePositions() {
        return positions.size();
    }
}
