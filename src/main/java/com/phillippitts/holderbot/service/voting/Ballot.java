package com.phillippitts.holderbot.service.voting;

import java.util.Objects;

/**
 * One vote: a proposed pair, the voter's confidence in it and the voter's weight.
 * A ballot's contribution to its candidates is {@code weight × confidence}.
 */
public record Ballot(String material, String type, double confidence, double weight) {

    public Ballot {
        Objects.requireNonNull(material, "material");
        Objects.requireNonNull(type, "type");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        if (weight < 0.0) {
            throw new IllegalArgumentException("Weight must be >= 0, got: " + weight);
        }
    }

    double score() {
        return weight * confidence;
    }
}
