package com.phillippitts.holderbot.service.events;

import com.phillippitts.holderbot.domain.CorrectionEvent;
import com.phillippitts.holderbot.domain.SubjectRecord;

import java.time.Instant;
import java.util.Objects;

/**
 * Published after a correction committed.
 *
 * @param correction the appended log entry
 * @param previous   record held before the correction, null if the subject was unknown
 * @param at         publication time
 */
public record CorrectionAppliedEvent(CorrectionEvent correction, SubjectRecord previous, Instant at) {
    public CorrectionAppliedEvent {
        Objects.requireNonNull(correction, "correction");
        if (at == null) {
            at = Instant.now();
        }
    }

    /**
     * True when the corrected subject held an unverified engine prediction, i.e. the
     * correction is the outcome of a prediction.
     */
    public boolean correctsPrediction() {
        return previous != null && !previous.verified();
    }
}
