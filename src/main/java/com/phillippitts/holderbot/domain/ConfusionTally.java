package com.phillippitts.holderbot.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * How often a predicted value was corrected to another value on one axis.
 *
 * @param axis     material or type
 * @param before   value held before the correction
 * @param after    value set by the human
 * @param count    number of such corrections
 * @param lastSeen timestamp of the most recent such correction
 */
public record ConfusionTally(Axis axis, String before, String after, long count, Instant lastSeen) {

    public ConfusionTally {
        Objects.requireNonNull(axis, "axis");
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
        Objects.requireNonNull(lastSeen, "lastSeen");
    }
}
