package com.phillippitts.holderbot.service.aggregation;

import com.phillippitts.holderbot.domain.Observation;
import com.phillippitts.holderbot.service.photo.Photograph;

/**
 * Analyzes one photograph region by region through the vision oracle and reduces the
 * surviving verdicts to a single {@link Observation} by weighted majority vote.
 */
public interface MultiRegionAggregator {

    /**
     * Never throws for oracle or parse failures: with no surviving region the configured
     * fallback pair is returned at the aggregator fallback confidence.
     *
     * @param subjectId subject the photograph belongs to (used for logging and events)
     * @param photograph the photograph to analyze
     * @return an {@code AGGREGATOR} observation
     */
    Observation aggregate(String subjectId, Photograph photograph);
}
