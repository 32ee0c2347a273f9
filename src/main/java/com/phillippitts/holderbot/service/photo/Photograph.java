package com.phillippitts.holderbot.service.photo;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * A decoded photograph of one subject.
 */
public record Photograph(String subjectId, BufferedImage image) {

    public Photograph {
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(image, "image");
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
