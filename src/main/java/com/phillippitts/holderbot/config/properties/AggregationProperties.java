package com.phillippitts.holderbot.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

/**
 * Multi-region aggregation settings.
 */
@ConfigurationProperties(prefix = "holderbot.aggregation")
public class AggregationProperties {

    /** Replies at or below this confidence are discarded. */
    private final double discardThreshold;

    /** Per-region oracle call timeout. */
    private final long regionTimeoutMs;

    /** Crops are scaled so their longest edge is at least this many pixels. */
    private final int minEdge;

    /** ...and at most this many. */
    private final int maxEdge;

    /** Characters of rationale kept in logs. */
    private final int rationalePreviewChars;

    @ConstructorBinding
    public AggregationProperties(Double discardThreshold, Long regionTimeoutMs, Integer minEdge,
                                 Integer maxEdge, Integer rationalePreviewChars) {
        this.discardThreshold = discardThreshold == null ? 0.3 : discardThreshold;
        if (this.discardThreshold < 0.0 || this.discardThreshold >= 1.0) {
            throw new IllegalArgumentException("holderbot.aggregation.discard-threshold must be in [0,1)");
        }
        this.regionTimeoutMs = regionTimeoutMs == null || regionTimeoutMs <= 0 ? 30_000L : regionTimeoutMs;
        this.minEdge = minEdge == null ? 256 : minEdge;
        this.maxEdge = maxEdge == null ? 1024 : maxEdge;
        if (this.minEdge <= 0 || this.maxEdge < this.minEdge) {
            throw new IllegalArgumentException("holderbot.aggregation requires 0 < min-edge <= max-edge");
        }
        this.rationalePreviewChars = rationalePreviewChars == null ? 80 : rationalePreviewChars;
    }

    public static AggregationProperties defaults() {
        return new AggregationProperties(null, null, null, null, null);
    }

    public double getDiscardThreshold() {
        return discardThreshold;
    }

    public long getRegionTimeoutMs() {
        return regionTimeoutMs;
    }

    public int getMinEdge() {
        return minEdge;
    }

    public int getMaxEdge() {
        return maxEdge;
    }

    public int getRationalePreviewChars() {
        return rationalePreviewChars;
    }
}
