package com.phillippitts.holderbot.service.ensemble;

import com.phillippitts.holderbot.domain.Decision;
import com.phillippitts.holderbot.exception.InvalidSubjectException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decides many subjects one after another. A stop request is honoured between subjects,
 * never in the middle of one.
 */
@Service
public class BatchDecisionService {
    private static final Logger LOG = LogManager.getLogger(BatchDecisionService.class);

    static final int PROGRESS_EVERY = 10;

    private final EnsembleDecisionEngine engine;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);

    public BatchDecisionService(EnsembleDecisionEngine engine) {
        this.engine = Objects.requireNonNull(engine);
    }

    /**
     * Decides every id in order. Blank ids are skipped with a warning.
     *
     * @return the decisions made before completion or before a stop was honoured
     */
    public List<Decision> decideAll(List<String> subjectIds, boolean forceRefresh) {
        Objects.requireNonNull(subjectIds, "subjectIds");
        stopRequested.set(false);
        running.set(true);
        List<Decision> out = new ArrayList<>(subjectIds.size());
        try {
            int processed = 0;
            for (String id : subjectIds) {
                if (stopRequested.get()) {
                    LOG.info("Batch stopped after {}/{} subjects", processed, subjectIds.size());
                    break;
                }
                try {
                    out.add(engine.decide(id, forceRefresh));
                } catch (InvalidSubjectException e) {
                    LOG.warn("Skipping invalid subject id in batch: {}", e.getReason());
                }
                processed++;
                if (processed % PROGRESS_EVERY == 0) {
                    LOG.info("Batch progress: {}/{} subjects", processed, subjectIds.size());
                }
            }
            LOG.info("Batch finished: {} decisions for {} ids", out.size(), subjectIds.size());
            return out;
        } finally {
            running.set(false);
        }
    }

    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }
}
