package com.phillippitts.holderbot.domain;

/**
 * Outcome tally for one confidence decile.
 *
 * @param level   decile 0, 10, ..., 100
 * @param total   outcomes recorded in this bin
 * @param correct outcomes that turned out correct
 */
public record CalibrationBin(int level, long total, long correct) {

    public CalibrationBin {
        if (level < 0 || level > 100 || level % 10 != 0) {
            throw new IllegalArgumentException("level must be a decile in [0,100], got: " + level);
        }
        if (total < 0 || correct < 0 || correct > total) {
            throw new IllegalArgumentException("invalid tally: correct=" + correct + ", total=" + total);
        }
    }

    /**
     * Maps a predicted confidence to its decile, {@code round(confidence, 1) × 100}.
     */
    public static int levelOf(double confidence) {
        double clamped = Math.max(0.0, Math.min(1.0, confidence));
        return (int) Math.round(clamped * 10.0) * 10;
    }

    public double levelFraction() {
        return level / 100.0;
    }

    /** Observed accuracy, 0 for an empty bin. */
    public double accuracy() {
        return total == 0 ? 0.0 : correct / (double) total;
    }

    public double calibrationError() {
        return Math.abs(accuracy() - levelFraction());
    }

    /**
     * Judges this bin against a margin, excluding bins with too little evidence.
     */
    public CalibrationJudgement judge(double margin, int minSamples) {
        if (total < minSamples) {
            return CalibrationJudgement.INSUFFICIENT_DATA;
        }
        double gap = levelFraction() - accuracy();
        if (gap > margin) {
            return CalibrationJudgement.OVERCONFIDENT;
        }
        if (-gap > margin) {
            return CalibrationJudgement.UNDERCONFIDENT;
        }
        return CalibrationJudgement.CALIBRATED;
    }
}
