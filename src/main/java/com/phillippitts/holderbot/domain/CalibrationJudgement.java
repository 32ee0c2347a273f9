package com.phillippitts.holderbot.domain;

public enum CalibrationJudgement {
    OVERCONFIDENT,
    UNDERCONFIDENT,
    CALIBRATED,
    INSUFFICIENT_DATA
}
