package com.copytrader.unit.ledger;

import static org.assertj.core.api.Assertions.assertThat;

import com.copytrader.domain.enums.PositionAction;
import com.copytrader.ledger.PositionActionClassifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PositionActionClassifierTest {

    private final PositionActionClassifier classifier = new PositionActionClassifier();

    @Test
    @DisplayName("Flat to non-zero is OPEN in either direction")
    void flatToNonZero_isOpen() {
        assertThat(classifier.classify(0, 1.5)).isEqualTo(PositionAction.OPEN);
        assertThat(classifier.classify(0, -2)).isEqualTo(PositionAction.OPEN);
    }

    @Test
    @DisplayName("Non-zero to flat is CLOSE")
    void nonZeroToFlat_isClose() {
        assertThat(classifier.classify(1, 0)).isEqualTo(PositionAction.CLOSE);
        assertThat(classifier.classify(-3, 0)).isEqualTo(PositionAction.CLOSE);
    }

    @Test
    @DisplayName("Sign flip is REVERSE")
    void signFlip_isReverse() {
        assertThat(classifier.classify(2, -2)).isEqualTo(PositionAction.REVERSE);
        assertThat(classifier.classify(-1, 0.5)).isEqualTo(PositionAction.REVERSE);
    }

    @Test
    @DisplayName("Growing same-direction size is ADD")
    void growingSize_isAdd() {
        assertThat(classifier.classify(1, 2.5)).isEqualTo(PositionAction.ADD);
        assertThat(classifier.classify(-1, -4)).isEqualTo(PositionAction.ADD);
    }

    @Test
    @DisplayName("Shrinking same-direction size is REDUCE")
    void shrinkingSize_isReduce() {
        assertThat(classifier.classify(3, 2)).isEqualTo(PositionAction.REDUCE);
        assertThat(classifier.classify(-3, -0.5)).isEqualTo(PositionAction.REDUCE);
    }

    @Test
    @DisplayName("Unchanged size falls back to ADD")
    void unchangedSize_fallsBackToAdd() {
        assertThat(classifier.classify(0, 0)).isEqualTo(PositionAction.ADD);
        assertThat(classifier.classify(2, 2)).isEqualTo(PositionAction.ADD);
    }

    @Test
    @DisplayName("Only disposing transitions realize PnL")
    void realizesPnl_onlyForDisposals() {
        assertThat(PositionAction.OPEN.realizesPnl()).isFalse();
        assertThat(PositionAction.ADD.realizesPnl()).isFalse();
        assertThat(PositionAction.REDUCE.realizesPnl()).isTrue();
        assertThat(PositionAction.CLOSE.realizesPnl()).isTrue();
        assertThat(PositionAction.REVERSE.realizesPnl()).isTrue();
    }
}
