package com.phillippitts.holderbot.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable entry of the append-only correction log.
 *
 * @param subjectId      corrected subject
 * @param materialBefore material held before the correction (fallback value if none was stored)
 * @param typeBefore     type held before the correction (fallback value if none was stored)
 * @param materialAfter  material set by the human
 * @param typeAfter      type set by the human
 * @param timestamp      when the correction was applied
 */
public record CorrectionEvent(
        String subjectId,
        String materialBefore,
        String typeBefore,
        String materialAfter,
        String typeAfter,
        Instant timestamp
) {

    public CorrectionEvent {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(materialBefore, "materialBefore");
        Objects.requireNonNull(typeBefore, "typeBefore");
        Objects.requireNonNull(materialAfter, "materialAfter");
        Objects.requireNonNull(typeAfter, "typeAfter");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Returns the (before, after) values on one axis.
     */
    public String before(Axis axis) {
        return axis == Axis.MATERIAL ? materialBefore : typeBefore;
    }

    public String after(Axis axis) {
        return axis == Axis.MATERIAL ? materialAfter : typeAfter;
    }

    /**
     * True when the human kept both values, i.e. the correction confirmed the prediction.
     */
    public boolean confirmsPrediction() {
        return materialBefore.equals(materialAfter) && typeBefore.equals(typeAfter);
    }
}
