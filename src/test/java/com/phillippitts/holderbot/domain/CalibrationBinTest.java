package com.phillippitts.holderbot.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalibrationBinTest {

    @Test
    void confidenceRoundsToDecile() {
        assertThat(CalibrationBin.levelOf(0.0)).isZero();
        assertThat(CalibrationBin.levelOf(0.86)).isEqualTo(90);
        assertThat(CalibrationBin.levelOf(0.84)).isEqualTo(80);
        assertThat(CalibrationBin.levelOf(1.0)).isEqualTo(100);
    }

    @Test
    void judgesAgainstMargin() {
        assertThat(new CalibrationBin(90, 20, 10).judge(0.2, 5)).isEqualTo(CalibrationJudgement.OVERCONFIDENT);
        assertThat(new CalibrationBin(30, 10, 8).judge(0.2, 5)).isEqualTo(CalibrationJudgement.UNDERCONFIDENT);
        assertThat(new CalibrationBin(70, 10, 7).judge(0.2, 5)).isEqualTo(CalibrationJudgement.CALIBRATED);
        assertThat(new CalibrationBin(90, 4, 0).judge(0.2, 5)).isEqualTo(CalibrationJudgement.INSUFFICIENT_DATA);
    }

    @Test
    void rejectsImpossibleTally() {
        assertThatThrownBy(() -> new CalibrationBin(55, 1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CalibrationBin(50, 1, 2)).isInstanceOf(IllegalArgumentException.class);
    }
}
