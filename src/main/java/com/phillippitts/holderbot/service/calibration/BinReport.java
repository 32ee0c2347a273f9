package com.phillippitts.holderbot.service.calibration;

import com.phillippitts.holderbot.domain.CalibrationBin;
import com.phillippitts.holderbot.domain.CalibrationJudgement;

/**
 * One calibration bin with its derived figures.
 */
public record BinReport(
        int level,
        long total,
        long correct,
        double accuracy,
        double calibrationError,
        CalibrationJudgement judgement
) {

    static BinReport of(CalibrationBin bin, double margin, int minSamples) {
        return new BinReport(bin.level(), bin.total(), bin.correct(), bin.accuracy(),
                bin.calibrationError(), bin.judge(margin, minSamples));
    }
}
