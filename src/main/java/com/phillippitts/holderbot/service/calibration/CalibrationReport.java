package com.phillippitts.holderbot.service.calibration;

import com.phillippitts.holderbot.domain.AccuracyTrend;
import com.phillippitts.holderbot.domain.ConfusionTally;

import java.util.List;

/**
 * Everything a tuning tool needs in one snapshot.
 *
 * @param bins                non-empty bins, lowest level first
 * @param materialConfusions  most frequent material corrections
 * @param typeConfusions      most frequent type corrections
 * @param totalOutcomes       outcomes recorded so far
 * @param currentAccuracy     running accuracy after the latest outcome
 * @param trend               accuracy trend
 * @param recommendations     plain-text tuning advice
 */
public record CalibrationReport(
        List<BinReport> bins,
        List<ConfusionTally> materialConfusions,
        List<ConfusionTally> typeConfusions,
        long totalOutcomes,
        double currentAccuracy,
        AccuracyTrend trend,
        List<String> recommendations
) {
    public CalibrationReport {
        bins = List.copyOf(bins);
        materialConfusions = List.copyOf(materialConfusions);
        typeConfusions = List.copyOf(typeConfusions);
        recommendations = List.copyOf(recommendations);
    }
}
