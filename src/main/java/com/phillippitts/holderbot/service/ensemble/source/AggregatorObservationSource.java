package com.phillippitts.holderbot.service.ensemble.source;

import com.phillippitts.holderbot.domain.Observation;
import com.phillippitts.holderbot.domain.SourceKind;
import com.phillippitts.holderbot.domain.SubjectRecord;
import com.phillippitts.holderbot.service.aggregation.MultiRegionAggregator;
import com.phillippitts.holderbot.service.oracle.VisionOracle;
import com.phillippitts.holderbot.service.photo.PhotoSource;
import com.phillippitts.holderbot.service.photo.Photograph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * Vision-based observation. Contributes only when the subject has a photograph and the oracle
 * is available.
 */
@Component
@Order(1)
public class AggregatorObservationSource implements ObservationSource {
    private static final Logger LOG = LogManager.getLogger(AggregatorObservationSource.class);

    private final PhotoSource photos;
    private final VisionOracle oracle;
    private final MultiRegionAggregator aggregator;

    public AggregatorObservationSource(PhotoSource photos, VisionOracle oracle, MultiRegionAggregator aggregator) {
        this.photos = Objects.requireNonNull(photos);
        this.oracle = Objects.requireNonNull(oracle);
        this.aggregator = Objects.requireNonNull(aggregator);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.AGGREGATOR;
    }

    @Override
    public Optional<Observation> observe(String subjectId, Optional<SubjectRecord> prior, boolean forceRefresh) {
        if (!oracle.isAvailable()) {
            LOG.debug("Vision oracle unavailable; skipping aggregation for subject={}", subjectId);
            return Optional.empty();
        }
        Optional<Photograph> photo = photos.find(subjectId);
        if (photo.isEmpty()) {
            LOG.debug("No photograph for subject={}", subjectId);
            return Optional.empty();
        }
        return Optional.of(aggregator.aggregate(subjectId, photo.get()));
    }
}
