package com.phillippitts.holderbot.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Persistent classification of one subject. At most one record exists per subject id.
 *
 * <p>{@code verified == true} only for records written by a human correction (or a verified
 * bulk import); the decision engine never writes verified records.
 *
 * @param subjectId       opaque subject id (non-blank)
 * @param material        current material
 * @param type            current holder type
 * @param confidence      confidence of the current value in [0, 1]
 * @param sourceKind      provenance of the last write
 * @param timestamp       time of the last write
 * @param verified        whether the current value is human truth
 * @param correctionCount number of corrections applied so far (&ge; 0)
 */
public record SubjectRecord(
        String subjectId,
        String material,
        String type,
        double confidence,
        SourceKind sourceKind,
        Instant timestamp,
        boolean verified,
        int correctionCount
) {

    public SubjectRecord {
        Objects.requireNonNull(subjectId, "subjectId");
        if (subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be blank");
        }
        // one subject, one key: " 42" and "42" are the same subject
        subjectId = subjectId.strip();
        Objects.requireNonNull(material, "material");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sourceKind, "sourceKind");
        Objects.requireNonNull(timestamp, "timestamp");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        if (correctionCount < 0) {
            throw new IllegalArgumentException("correctionCount must be >= 0, got: " + correctionCount);
        }
    }

    /**
     * Creates an unverified record stamped with the current time.
     */
    public static SubjectRecord unverified(String subjectId, String material, String type,
                                           double confidence, SourceKind sourceKind) {
        return new SubjectRecord(subjectId, material, type, confidence, sourceKind, Instant.now(), false, 0);
    }

    /**
     * Returns a copy carrying the given correction count.
     */
    public SubjectRecord withCorrectionCount(int count) {
        return new SubjectRecord(subjectId, material, type, confidence, sourceKind, timestamp, verified, count);
    }
}
