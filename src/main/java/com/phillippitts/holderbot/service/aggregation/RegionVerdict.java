package com.phillippitts.holderbot.service.aggregation;

import java.util.Objects;

/**
 * Parsed oracle reply for one region.
 */
public record RegionVerdict(String material, String type, double confidence, String rationale) {

    public RegionVerdict {
        Objects.requireNonNull(material, "material");
        Objects.requireNonNull(type, "type");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        rationale = rationale == null ? "" : rationale;
    }
}
