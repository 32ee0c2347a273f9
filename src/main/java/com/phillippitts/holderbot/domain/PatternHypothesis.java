package com.phillippitts.holderbot.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A learned mapping from one id bucket to one (material, type) pair.
 *
 * <p>Several hypotheses may compete for the same {@code (bucketType, bucketValue)}; their
 * success rates within a bucket always sum to 1.
 *
 * @param bucketType  bucket function
 * @param bucketValue bucket function result
 * @param material    learned material
 * @param type        learned holder type
 * @param sampleCount corrections that mapped to this key (&ge; 1)
 * @param successRate share of this hypothesis among all samples of its bucket, in [0, 1]
 * @param lastUpdated time of the last increment
 */
public record PatternHypothesis(
        BucketFunction bucketType,
        long bucketValue,
        String material,
        String type,
        int sampleCount,
        double successRate,
        Instant lastUpdated
) {

    /** Sample count at which a hypothesis earns its full success rate as confidence. */
    public static final int FULL_EVIDENCE_SAMPLES = 10;

    public PatternHypothesis {
        Objects.requireNonNull(bucketType, "bucketType");
        Objects.requireNonNull(material, "material");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
        if (sampleCount < 1) {
            throw new IllegalArgumentException("sampleCount must be >= 1, got: " + sampleCount);
        }
        if (successRate < 0.0 || successRate > 1.0) {
            throw new IllegalArgumentException("successRate must be between 0.0 and 1.0, got: " + successRate);
        }
    }

    /**
     * {@code successRate × min(sampleCount / 10, 1)}.
     */
    public double derivedConfidence() {
        return successRate * Math.min(sampleCount / (double) FULL_EVIDENCE_SAMPLES, 1.0);
    }
}
