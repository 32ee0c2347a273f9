package com.phillippitts.holderbot.domain;

/**
 * The two independent classification axes.
 */
public enum Axis {
    MATERIAL,
    TYPE
}
