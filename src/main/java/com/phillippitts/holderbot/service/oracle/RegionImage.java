package com.phillippitts.holderbot.service.oracle;

import java.util.Objects;

/**
 * One PNG-encoded crop of a photograph, ready to send to the oracle.
 *
 * @param region region name, e.g. {@code main-junction}
 * @param png    encoded image bytes
 * @param width  pixel width after scaling
 * @param height pixel height after scaling
 */
public record RegionImage(String region, byte[] png, int width, int height) {

    public RegionImage {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(png, "png");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("image dimensions must be positive: " + width + "x" + height);
        }
    }

    public int longestEdge() {
        return Math.max(width, height);
    }
}
