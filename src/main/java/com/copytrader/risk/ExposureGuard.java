package com.copytrader.risk;

import com.copytrader.domain.model.Position;
import com.copytrader.ledger.PositionLedger;
import com.copytrader.pnl.PnLCalculator;
import java.util.List;

/**
 * Keeps total paper exposure under a leverage-based ceiling.
 *
 * <ul>
 *   <li>available capital = bankroll + total realized PnL + unrealized PnL of open positions</li>
 *   <li>max exposure = available capital x leverage</li>
 *   <li>current exposure = sum of |size| x lastPrice over open positions</li>
 * </ul>
 *
 * <p>Every figure is recomputed from the ledger on each call; nothing is cached, so profitable
 * sessions gain capacity and losing sessions lose it as soon as prices move.
 *
 * <p>Not thread-safe on its own: callers pass a ledger they hold exclusively.
 */
public class ExposureGuard {

    public static final String EXPOSURE_LIMIT_EXCEEDED = "EXPOSURE_LIMIT_EXCEEDED";

    private final double bankroll;
    private final double leverage;
    private final PnLCalculator pnlCalculator;

    public ExposureGuard(double bankroll, double leverage, PnLCalculator pnlCalculator) {
        this.bankroll = bankroll;
        this.leverage = leverage;
        this.pnlCalculator = pnlCalculator;
    }

    public double availableCapital(PositionLedger ledger, double totalRealizedPnl) {
        double unrealized = 0.0;
        for (Position position : ledger.open()) {
            unrealized += pnlCalculator.unrealizedPnl(position);
        }
        return bankroll + totalRealizedPnl + unrealized;
    }

    public double maxExposure(PositionLedger ledger, double totalRealizedPnl) {
        return availableCapital(ledger, totalRealizedPnl) * leverage;
    }

    public double currentExposure(PositionLedger ledger) {
        return exposureExcluding(ledger.open(), null);
    }

    /**
     * Hard validation: rejects when the exposure of every other coin plus the candidate's full
     * notional would exceed the ceiling. The candidate coin's existing exposure is left out because
     * the candidate size replaces it in the comparison.
     */
    public RiskValidationResult validatePositionSize(
            PositionLedger ledger, double totalRealizedPnl, String coin, double size, double price) {
        double otherExposure = exposureExcluding(ledger.open(), coin);
        double candidateNotional = Math.abs(size * price);
        double maxExposure = maxExposure(ledger, totalRealizedPnl);

        if (otherExposure + candidateNotional > maxExposure) {
            return RiskValidationResult.rejected(List.of(RiskViolation.of(
                    EXPOSURE_LIMIT_EXCEEDED,
                    String.format(
                            "%s notional %.2f plus other exposure %.2f exceeds max exposure %.2f",
                            coin, candidateNotional, otherExposure, maxExposure))));
        }
        return RiskValidationResult.approved();
    }

    /**
     * Dynamic sizing: the quantity worth {@code min(baseNotional, remaining capacity)} at {@code price}.
     * Returns 0 when the ceiling is already reached; never negative.
     */
    public double calculateDynamicTradeSize(
            PositionLedger ledger, double totalRealizedPnl, double baseNotional, double price) {
        if (price <= 0) {
            return 0.0;
        }
        double remainingCapacity = maxExposure(ledger, totalRealizedPnl) - currentExposure(ledger);
        if (remainingCapacity <= 0) {
            return 0.0;
        }
        return Math.min(baseNotional, remainingCapacity) / price;
    }

    private double exposureExcluding(List<Position> openPositions, String excludedCoin) {
        double exposure = 0.0;
        for (Position position : openPositions) {
            if (excludedCoin != null && excludedCoin.equals(position.getCoin())) {
                continue;
            }
            exposure += position.exposure();
        }
        return exposure;
    }
}
