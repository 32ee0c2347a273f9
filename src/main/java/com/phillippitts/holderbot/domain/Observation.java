package com.phillippitts.holderbot.domain;

import java.util.Objects;

/**
 * One source's proposal for a single decision. Never persisted.
 *
 * @param material   proposed material (open vocabulary)
 * @param type       proposed holder type (open vocabulary)
 * @param confidence source confidence in [0, 1]
 * @param sourceKind which source produced the proposal
 * @param weight     reliability weight assigned to the source kind (&gt; 0)
 */
public record Observation(
        String material,
        String type,
        double confidence,
        SourceKind sourceKind,
        double weight
) {

    public Observation {
        Objects.requireNonNull(material, "material");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sourceKind, "sourceKind");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        if (weight <= 0.0) {
            throw new IllegalArgumentException("Weight must be positive, got: " + weight);
        }
    }
}
