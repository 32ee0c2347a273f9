package com.phillippitts.holderbot.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Fixed fallback classification used when nothing better is known: the engine's answer with
 * zero observations, the aggregator's answer with zero surviving regions, and the "before"
 * values of a correction applied to a subject with no stored record.
 */
@Validated
@ConfigurationProperties(prefix = "holderbot.fallback")
public class FallbackProperties {

    @NotBlank
    private final String material;

    @NotBlank
    private final String type;

    /** Engine confidence when no observation was gathered. */
    private final double confidence;

    /** Aggregator confidence when every region was discarded. */
    private final double aggregatorConfidence;

    @ConstructorBinding
    public FallbackProperties(String material, String type, Double confidence, Double aggregatorConfidence) {
        this.material = material == null || material.isBlank() ? "kov" : material;
        this.type = type == null || type.isBlank() ? "stĺp značky samostatný" : type;
        this.confidence = confidence == null ? 0.4 : confidence;
        this.aggregatorConfidence = aggregatorConfidence == null ? 0.3 : aggregatorConfidence;
        if (this.confidence < 0.0 || this.confidence > 1.0) {
            throw new IllegalArgumentException("holderbot.fallback.confidence must be in [0,1]");
        }
        if (this.aggregatorConfidence < 0.0 || this.aggregatorConfidence > 1.0) {
            throw new IllegalArgumentException("holderbot.fallback.aggregator-confidence must be in [0,1]");
        }
    }

    public static FallbackProperties defaults() {
        return new FallbackProperties(null, null, null, null);
    }

    public String getMaterial() {
        return material;
    }

    public String getType() {
        return type;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getAggregatorConfidence() {
        return aggregatorConfidence;
    }
}
