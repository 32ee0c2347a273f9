package com.phillippitts.holderbot.service.store;

import com.phillippitts.holderbot.domain.CorrectionEvent;
import com.phillippitts.holderbot.domain.SubjectRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a committed correction.
 *
 * @param event    the appended log entry
 * @param previous the record held before the correction, null if there was none
 * @param updated  the verified record now stored
 */
public record AppliedCorrection(CorrectionEvent event, SubjectRecord previous, SubjectRecord updated) {

    public AppliedCorrection {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(updated, "updated");
    }

    public Optional<SubjectRecord> previousRecord() {
        return Optional.ofNullable(previous);
    }
}
