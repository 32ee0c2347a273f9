package com.phillippitts.holderbot.service.ensemble.source;

import com.phillippitts.holderbot.domain.Observation;
import com.phillippitts.holderbot.domain.SourceKind;
import com.phillippitts.holderbot.domain.SubjectRecord;

import java.util.Optional;

/**
 * One independent contributor to an ensemble decision.
 *
 * <p>Sources are consulted in bean order. A source that has nothing to say returns empty; a
 * source that throws is treated the same way by the engine, so implementations need not
 * guard against their own collaborators failing.
 */
public interface ObservationSource {

    /**
     * Kind stamped on the observations this source produces.
     */
    SourceKind kind();

    /**
     * @param subjectId    stripped, non-blank subject id
     * @param prior        the record currently stored for the subject, if any
     * @param forceRefresh whether the caller bypassed the verified short-circuit
     */
    Optional<Observation> observe(String subjectId, Optional<SubjectRecord> prior, boolean forceRefresh);
}
