package com.phillippitts.holderbot.domain;

public enum AccuracyTrend {
    IMPROVING,
    DECLINING,
    STABLE
}
