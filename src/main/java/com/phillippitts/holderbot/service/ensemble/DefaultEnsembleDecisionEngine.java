package com.phillippitts.holderbot.service.ensemble;

import com.phillippitts.holderbot.config.logging.MdcFilter;
import com.phillippitts.holderbot.config.properties.EnsembleProperties;
import com.phillippitts.holderbot.config.properties.FallbackProperties;
import com.phillippitts.holderbot.domain.Decision;
import com.phillippitts.holderbot.domain.DecisionPath;
import com.phillippitts.holderbot.domain.Observation;
import com.phillippitts.holderbot.domain.SourceKind;
import com.phillippitts.holderbot.domain.SubjectRecord;
import com.phillippitts.holderbot.exception.InvalidSubjectException;
import com.phillippitts.holderbot.exception.StorageException;
import com.phillippitts.holderbot.service.ensemble.source.ObservationSource;
import com.phillippitts.holderbot.service.events.WriteBackFailedEvent;
import com.phillippitts.holderbot.service.metrics.DecisionMetrics;
import com.phillippitts.holderbot.service.store.PatternLearningStore;
import com.phillippitts.holderbot.service.voting.Ballot;
import com.phillippitts.holderbot.service.voting.VoteResult;
import com.phillippitts.holderbot.service.voting.WeightedVoter;
import com.phillippitts.holderbot.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Default {@link EnsembleDecisionEngine}.
 *
 * <p>Flow per subject:
 * <ol>
 *   <li>verified record and no forced refresh: return it at confidence 1.0</li>
 *   <li>ask every {@link ObservationSource}; failing sources contribute nothing</li>
 *   <li>no observation: configured fallback pair</li>
 *   <li>one observation: returned unchanged</li>
 *   <li>several: weighted vote plus an agreement bonus of {@code min(cap, (k-1) × step)},
 *       capped at the maximum confidence</li>
 *   <li>confidence at or above the store threshold: best-effort write-back that never
 *       overwrites a verified record</li>
 * </ol>
 */
@Service
public class DefaultEnsembleDecisionEngine implements EnsembleDecisionEngine {
    private static final Logger LOG = LogManager.getLogger(DefaultEnsembleDecisionEngine.class);

    private final PatternLearningStore store;
    private final List<ObservationSource> sources;
    private final EnsembleProperties properties;
    private final FallbackProperties fallback;
    private final DecisionMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public DefaultEnsembleDecisionEngine(PatternLearningStore store,
                                         List<ObservationSource> sources,
                                         EnsembleProperties properties,
                                         FallbackProperties fallback,
                                         DecisionMetrics metrics,
                                         ApplicationEventPublisher publisher) {
        this.store = Objects.requireNonNull(store);
        this.sources = List.copyOf(sources);
        this.properties = Objects.requireNonNull(properties);
        this.fallback = Objects.requireNonNull(fallback);
        this.metrics = metrics;
        this.publisher = Objects.requireNonNull(publisher);
    }

    @Override
    public Decision decide(String subjectId, boolean forceRefresh) {
        if (subjectId == null || subjectId.isBlank()) {
            throw new InvalidSubjectException("subject id must not be blank");
        }
        String id = subjectId.strip();
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put(MdcFilter.SUBJECT_ID, id)) {
            long t0 = System.nanoTime();
            Decision decision = decideInternal(id, forceRefresh, t0);
            if (metrics != null) {
                metrics.recordDecision(decision.path(), TimeUtils.elapsedNanos(t0));
            }
            LOG.info("Decided subject={}: {} / {} ({}) via {} from {} in {} ms", id, decision.material(),
                    decision.type(), String.format("%.3f", decision.confidence()), decision.path(),
                    decision.sources(), decision.elapsedMs());
            return decision;
        }
    }

    private Decision decideInternal(String id, boolean forceRefresh, long t0) {
        Optional<SubjectRecord> prior = readPrior(id);
        if (!forceRefresh && prior.isPresent() && prior.get().verified()) {
            SubjectRecord r = prior.get();
            return new Decision(id, r.material(), r.type(), 1.0, List.of(SourceKind.VERIFIED_RECORD),
                    DecisionPath.VERIFIED, TimeUtils.elapsedMillis(t0));
        }

        List<Observation> observations = gather(id, prior, forceRefresh);
        if (observations.isEmpty()) {
            LOG.warn("No observation for subject={}; using configured fallback", id);
            return new Decision(id, fallback.getMaterial(), fallback.getType(), fallback.getConfidence(),
                    List.of(), DecisionPath.FALLBACK, TimeUtils.elapsedMillis(t0));
        }

        List<SourceKind> kinds = observations.stream().map(Observation::sourceKind).toList();
        String material;
        String type;
        double confidence;
        if (observations.size() == 1) {
            Observation only = observations.get(0);
            material = only.material();
            type = only.type();
            confidence = only.confidence();
        } else {
            List<Ballot> ballots = observations.stream()
                    .map(o -> new Ballot(o.material(), o.type(), o.confidence(), o.weight()))
                    .toList();
            VoteResult vote = WeightedVoter.vote(ballots);
            material = vote.material();
            type = vote.type();
            confidence = withAgreementBonus(vote.confidence(), observations.size());
        }

        if (confidence >= properties.getStoreThreshold()) {
            writeBack(SubjectRecord.unverified(id, material, type, confidence, SourceKind.ENSEMBLE));
        }
        return new Decision(id, material, type, confidence, kinds, DecisionPath.ENSEMBLE,
                TimeUtils.elapsedMillis(t0));
    }

    double withAgreementBonus(double confidence, int observations) {
        if (observations < 2) {
            return confidence;
        }
        double bonus = Math.min(properties.getAgreementCap(), (observations - 1) * properties.getAgreementStep());
        return Math.min(properties.getMaxConfidence(), confidence + bonus);
    }

    private Optional<SubjectRecord> readPrior(String id) {
        try {
            return store.getAnalysis(id);
        } catch (StorageException e) {
            LOG.warn("Stored record unavailable for subject={}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    private List<Observation> gather(String id, Optional<SubjectRecord> prior, boolean forceRefresh) {
        List<Observation> out = new ArrayList<>(sources.size());
        for (ObservationSource source : sources) {
            try {
                Optional<Observation> o = source.observe(id, prior, forceRefresh);
                if (o.isPresent()) {
                    out.add(o.get());
                    if (metrics != null) {
                        metrics.incrementObservation(o.get().sourceKind());
                    }
                }
            } catch (RuntimeException e) {
                LOG.warn("Source {} failed for subject={}: {}", source.kind(), id, e.getMessage());
                LOG.debug("Source failure detail", e);
                if (metrics != null) {
                    metrics.incrementSourceFailure(source.kind());
                }
            }
        }
        return out;
    }

    private void writeBack(SubjectRecord record) {
        try {
            boolean written = store.storeAnalysisUnlessVerified(record);
            if (!written) {
                LOG.debug("Write-back skipped for verified subject={}", record.subjectId());
            }
        } catch (StorageException e) {
            LOG.warn("Write-back failed for subject={}: {}", record.subjectId(), e.getMessage());
            if (metrics != null) {
                metrics.incrementWriteBackFailure();
            }
            publisher.publishEvent(new WriteBackFailedEvent(record.subjectId(), e.getOperation(), Instant.now()));
        }
    }
}
