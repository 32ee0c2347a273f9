package com.phillippitts.holderbot.service.store;

import com.phillippitts.holderbot.domain.SourceKind;

import java.util.Map;

/**
 * Store-wide totals.
 *
 * @param analysed     stored subject records
 * @param verified     records holding human truth
 * @param corrections  correction log entries
 * @param hypotheses   learned bucket hypotheses
 * @param accuracyRate {@code (verified - corrections) / verified}, clamped at 0
 * @param bySource     record count and mean confidence per provenance
 */
public record StoreStatistics(
        long analysed,
        long verified,
        long corrections,
        long hypotheses,
        double accuracyRate,
        Map<SourceKind, SourceStats> bySource
) {

    public StoreStatistics {
        bySource = bySource == null ? Map.of() : Map.copyOf(bySource);
    }

    public record SourceStats(long count, double averageConfidence) {
    }
}
