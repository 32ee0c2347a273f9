package com.phillippitts.holderbot.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds for calibration judgement and trend detection.
 */
@Validated
@ConfigurationProperties(prefix = "holderbot.calibration")
public class CalibrationProperties {

    /** Gap between predicted level and observed accuracy that flags a bin. */
    private final double margin;

    /** Bins with fewer outcomes are not judged. */
    @Min(1)
    private final int minSamples;

    /** Snapshots per trend window; the trend needs two full windows. */
    @Min(1)
    private final int trendWindow;

    /** Mean difference between windows that counts as a trend. */
    private final double trendDelta;

    /** Confusions turned into oracle hints. */
    @Min(0)
    private final int hintLimit;

    @ConstructorBinding
    public CalibrationProperties(Double margin, Integer minSamples, Integer trendWindow,
                                 Double trendDelta, Integer hintLimit) {
        this.margin = margin == null ? 0.2 : margin;
        this.minSamples = minSamples == null ? 5 : minSamples;
        this.trendWindow = trendWindow == null ? 10 : trendWindow;
        this.trendDelta = trendDelta == null ? 0.05 : trendDelta;
        this.hintLimit = hintLimit == null ? 3 : hintLimit;
        if (this.margin < 0.0 || this.margin > 1.0) {
            throw new IllegalArgumentException("holderbot.calibration.margin must be in [0,1]");
        }
        if (this.trendDelta < 0.0 || this.trendDelta > 1.0) {
            throw new IllegalArgumentException("holderbot.calibration.trend-delta must be in [0,1]");
        }
        if (this.minSamples < 1 || this.trendWindow < 1 || this.hintLimit < 0) {
            throw new IllegalArgumentException("holderbot.calibration sample counts must be positive");
        }
    }

    public static CalibrationProperties defaults() {
        return new CalibrationProperties(null, null, null, null, null);
    }

    public double getMargin() {
        return margin;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public int getTrendWindow() {
        return trendWindow;
    }

    public double getTrendDelta() {
        return trendDelta;
    }

    public int getHintLimit() {
        return hintLimit;
    }
}
