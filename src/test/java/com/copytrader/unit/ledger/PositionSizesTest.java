package com.copytrader.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.copytrader.ledger.PositionSizes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PositionSizesTest {

    @Test
    @DisplayName("Rounding residue of a full close snaps to zero")
    void fullClose_snapsToZero() {
        double held = 0.1 + 0.2;

        assertThat(held + -0.3).isNotZero();
        assertThat(PositionSizes.resultingSize(held, -0.3)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Genuine small remainders are kept")
    void smallRemainder_isKept() {
        assertThat(PositionSizes.resultingSize(0.3, -0.2999)).isCloseTo(0.0001, within(1e-12));
        assertThat(PositionSizes.resultingSize(1e-6, 1e-6)).isEqualTo(2e-6);
    }

    @Test
    @DisplayName("Tolerance scales with the magnitudes involved")
    void tolerance_isRelative() {
        assertThat(PositionSizes.snapToZero(5e-17, 0.6)).isEqualTo(0.0);
        assertThat(PositionSizes.snapToZero(5e-17, 0)).isEqualTo(5e-17);
        assertThat(PositionSizes.snapToZero(-1e-3, 100)).isEqualTo(-1e-3);
    }
}
