package com.phillippitts.holderbot.service.ensemble.source;

import com.phillippitts.holderbot.config.properties.EnsembleProperties;
import com.phillippitts.holderbot.domain.Observation;
import com.phillippitts.holderbot.domain.PatternHypothesis;
import com.phillippitts.holderbot.domain.SourceKind;
import com.phillippitts.holderbot.domain.SubjectRecord;
import com.phillippitts.holderbot.service.store.PatternLearningStore;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Best bucket hypothesis learned from past corrections, at its derived confidence.
 */
@Component
@Order(2)
public class LearnedPatternObservationSource implements ObservationSource {

    private final PatternLearningStore store;
    private final EnsembleProperties properties;

    public LearnedPatternObservationSource(PatternLearningStore store, EnsembleProperties properties) {
        this.store = Objects.requireNonNull(store);
        this.properties = Objects.requireNonNull(properties);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.PATTERN_LEARNED;
    }

    @Override
    public Optional<Observation> observe(String subjectId, Optional<SubjectRecord> prior, boolean forceRefresh) {
        Optional<PatternHypothesis> best = store.queryLearnedPrediction(subjectId);
        return best.map(h -> new Observation(h.material(), h.type(), h.derivedConfidence(),
                SourceKind.PATTERN_LEARNED, properties.weightFor(SourceKind.PATTERN_LEARNED)));
    }
}
