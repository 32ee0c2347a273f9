package com.phillippitts.holderbot.service.ensemble;

import com.phillippitts.holderbot.domain.Decision;

/**
 * Decides the (material, type) of a subject by combining every available observation.
 */
public interface EnsembleDecisionEngine {

    /**
     * Returns the stored verified values at confidence 1.0 unless {@code forceRefresh}; otherwise
     * gathers observations, votes, applies the agreement bonus and writes confident results back.
     *
     * <p>Never throws for a valid id: source and storage faults degrade the decision instead.
     *
     * @throws com.phillippitts.holderbot.exception.InvalidSubjectException if the id is blank
     */
    Decision decide(String subjectId, boolean forceRefresh);

    default Decision decide(String subjectId) {
        return decide(subjectId, false);
    }
}
