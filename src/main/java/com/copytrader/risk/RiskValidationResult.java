package com.copytrader.risk;

import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Result of validating a trade against the exposure ceiling.
 *
 * <p>Either APPROVED (empty violations list) or REJECTED (one or more violations).
 * A rejection is a policy outcome, not an error: the session drops the trade and moves on.
 */
@Getter
public class RiskValidationResult {

    private final boolean approved;
    private final List<RiskViolation> violations;

    private RiskValidationResult(boolean approved, List<RiskViolation> violations) {
        this.approved = approved;
        this.violations = violations;
    }

    public static RiskValidationResult approved() {
        return new RiskValidationResult(true, Collections.emptyList());
    }

    public static RiskValidationResult rejected(List<RiskViolation> violations) {
        return new RiskValidationResult(false, List.copyOf(violations));
    }

    public boolean isRejected() {
        return !approved;
    }
}
