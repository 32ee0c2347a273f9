package com.phillippitts.holderbot.service.aggregation;

import com.phillippitts.holderbot.config.properties.AggregationProperties;
import com.phillippitts.holderbot.service.oracle.RegionImage;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Cuts an {@link AnalysisRegion} out of a photograph and scales it so the longest edge lies
 * within {@code [min-edge, max-edge]}, then encodes it as PNG.
 */
@Component
public class RegionCropper {

    private final int minEdge;
    private final int maxEdge;

    public RegionCropper(AggregationProperties properties) {
        this.minEdge = properties.getMinEdge();
        this.maxEdge = properties.getMaxEdge();
    }

    public RegionImage crop(BufferedImage source, AnalysisRegion region) {
        int w = source.getWidth();
        int h = source.getHeight();
        int x0 = clamp((int) Math.round(w * region.left()), 0, w - 1);
        int y0 = clamp((int) Math.round(h * region.top()), 0, h - 1);
        int x1 = clamp((int) Math.round(w * region.right()), x0 + 1, w);
        int y1 = clamp((int) Math.round(h * region.bottom()), y0 + 1, h);

        BufferedImage cropped = source.getSubimage(x0, y0, x1 - x0, y1 - y0);
        BufferedImage scaled = scale(cropped);
        return new RegionImage(region.regionName(), encode(scaled), scaled.getWidth(), scaled.getHeight());
    }

    BufferedImage scale(BufferedImage image) {
        int longest = Math.max(image.getWidth(), image.getHeight());
        double factor;
        if (longest < minEdge) {
            factor = minEdge / (double) longest;
        } else if (longest > maxEdge) {
            factor = maxEdge / (double) longest;
        } else {
            factor = 1.0;
        }
        int nw = Math.max(1, (int) Math.round(image.getWidth() * factor));
        int nh = Math.max(1, (int) Math.round(image.getHeight() * factor));
        // rounding must not push the longest edge out of range
        if (Math.max(nw, nh) > maxEdge) {
            if (nw >= nh) {
                nw = maxEdge;
            } else {
                nh = maxEdge;
            }
        }

        BufferedImage out = new BufferedImage(nw, nh, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, nw, nh, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static byte[] encode(BufferedImage image) {
        try (ByteArrayOutputStream bytes = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, "png", bytes)) {
                throw new IllegalStateException("No PNG writer available");
            }
            return bytes.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("PNG encoding failed", e);
        }
    }

    private static int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
