package com.phillippitts.holderbot.service.correction;

import com.phillippitts.holderbot.service.events.CorrectionAppliedEvent;
import com.phillippitts.holderbot.service.metrics.DecisionMetrics;
import com.phillippitts.holderbot.service.store.AppliedCorrection;
import com.phillippitts.holderbot.service.store.PatternLearningStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;

/**
 * Entry point for human corrections. The store commits the correction; listeners
 * (calibration) learn from it afterwards through {@link CorrectionAppliedEvent}.
 */
@Service
public class CorrectionService {
    private static final Logger LOG = LogManager.getLogger(CorrectionService.class);

    private final PatternLearningStore store;
    private final ApplicationEventPublisher publisher;
    private final DecisionMetrics metrics;

    public CorrectionService(PatternLearningStore store, ApplicationEventPublisher publisher,
                             DecisionMetrics metrics) {
        this.store = Objects.requireNonNull(store);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = metrics;
    }

    /**
     * @throws com.phillippitts.holderbot.exception.InvalidSubjectException on a blank id or value
     * @throws com.phillippitts.holderbot.exception.StorageException if nothing could be committed
     */
    public AppliedCorrection applyCorrection(String subjectId, String material, String type) {
        AppliedCorrection applied = store.applyCorrection(subjectId, material, type);
        if (metrics != null) {
            metrics.incrementCorrection();
        }
        LOG.info("Correction applied: subject={}, {} / {} -> {} / {}", applied.event().subjectId(),
                applied.event().materialBefore(), applied.event().typeBefore(),
                applied.event().materialAfter(), applied.event().typeAfter());
        publisher.publishEvent(new CorrectionAppliedEvent(applied.event(), applied.previous(), Instant.now()));
        return applied;
    }
}
