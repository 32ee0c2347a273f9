package com.phillippitts.holderbot.service.ensemble.source;

import com.phillippitts.holderbot.config.properties.EnsembleProperties;
import com.phillippitts.holderbot.domain.Observation;
import com.phillippitts.holderbot.domain.SourceKind;
import com.phillippitts.holderbot.domain.SubjectRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Re-uses the stored record. An unverified record votes as {@link SourceKind#PRIOR_RECORD};
 * a verified one only reaches the vote when the refresh was forced, and then votes as
 * {@link SourceKind#VERIFIED_RECORD}.
 */
@Component
@Order(3)
public class PriorRecordObservationSource implements ObservationSource {

    private final EnsembleProperties properties;

    public PriorRecordObservationSource(EnsembleProperties properties) {
        this.properties = Objects.requireNonNull(properties);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.PRIOR_RECORD;
    }

    @Override
    public Optional<Observation> observe(String subjectId, Optional<SubjectRecord> prior, boolean forceRefresh) {
        if (prior.isEmpty()) {
            return Optional.empty();
        }
        SubjectRecord r = prior.get();
        if (r.verified() && !forceRefresh) {
            return Optional.empty();
        }
        SourceKind kind = r.verified() ? SourceKind.VERIFIED_RECORD : SourceKind.PRIOR_RECORD;
        return Optional.of(new Observation(r.material(), r.type(), r.confidence(), kind, properties.weightFor(kind)));
    }
}
