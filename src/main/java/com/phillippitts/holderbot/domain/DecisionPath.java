package com.phillippitts.holderbot.domain;

/**
 * How a {@link Decision} was reached.
 */
public enum DecisionPath {
    /** Stored human truth returned without consulting any source. */
    VERIFIED,
    /** At least one observation was gathered and combined. */
    ENSEMBLE,
    /** No source produced an observation; configured fallback returned. */
    FALLBACK
}
