package com.phillippitts.holderbot.domain;

import java.util.List;
import java.util.Objects;

/**
 * Result of one ensemble decision.
 *
 * @param subjectId  decided subject
 * @param material   winning material
 * @param type       winning holder type
 * @param confidence final confidence in [0, 1]
 * @param sources    source kinds that contributed observations, in gathering order
 * @param path       how the decision was reached
 * @param elapsedMs  wall time spent deciding
 */
public record Decision(
        String subjectId,
        String material,
        String type,
        double confidence,
        List<SourceKind> sources,
        DecisionPath path,
        long elapsedMs
) {

    public Decision {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(material, "material");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(path, "path");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
