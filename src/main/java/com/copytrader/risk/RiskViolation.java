package com.copytrader.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * A single exposure-limit violation detected while validating a committed trade.
 *
 * <p>The code is machine-readable (e.g. EXPOSURE_LIMIT_EXCEEDED), the message carries the
 * figures that caused the rejection.
 */
@Getter
@Builder
public class RiskViolation {

    private final String code;
    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
