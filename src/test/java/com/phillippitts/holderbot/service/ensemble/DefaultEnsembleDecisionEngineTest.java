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
import com.phillippitts.holderbot.testutil.EventCapturingPublisher;
import com.phillippitts.holderbot.testutil.StubObservationSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultEnsembleDecisionEngineTest {

    private PatternLearningStore store;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        store = mock(PatternLearningStore.class);
        when(store.getAnalysis(anyString())).thenReturn(Optional.empty());
        when(store.storeAnalysisUnlessVerified(any())).thenReturn(true);
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
    }

    private DefaultEnsembleDecisionEngine engine(ObservationSource... sources) {
        return new DefaultEnsembleDecisionEngine(store, List.of(sources), EnsembleProperties.defaults(),
                FallbackProperties.defaults(), new DecisionMetrics(registry), publisher);
    }

    @Test
    void twoSourcesVoteAndEarnAgreementBonus() {
        Decision d = engine(
                StubObservationSource.of("kov", "X", 0.7, SourceKind.AGGREGATOR, 0.9),
                StubObservationSource.of("betón", "X", 0.5, SourceKind.PATTERN_LEARNED, 0.6))
                .decide("120");

        assertThat(d.material()).isEqualTo("kov");
        assertThat(d.type()).isEqualTo("X");
        assertThat(d.confidence()).isCloseTo(0.889, within(0.001));
        assertThat(d.path()).isEqualTo(DecisionPath.ENSEMBLE);
        assertThat(d.sources()).containsExactly(SourceKind.AGGREGATOR, SourceKind.PATTERN_LEARNED);

        ArgumentCaptor<SubjectRecord> written = ArgumentCaptor.forClass(SubjectRecord.class);
        verify(store).storeAnalysisUnlessVerified(written.capture());
        assertThat(written.getValue().verified()).isFalse();
        assertThat(written.getValue().sourceKind()).isEqualTo(SourceKind.ENSEMBLE);
        assertThat(written.getValue().confidence()).isEqualTo(d.confidence());
    }

    @Test
    void singleObservationIsReturnedUnchanged() {
        Decision d = engine(StubObservationSource.of("kov", "A", 0.7, SourceKind.RULE_BASED, 0.5)).decide("3");

        assertThat(d.material()).isEqualTo("kov");
        assertThat(d.type()).isEqualTo("A");
        assertThat(d.confidence()).isEqualTo(0.7);
    }

    @Test
    void verifiedRecordShortCircuits() {
        when(store.getAnalysis("5")).thenReturn(Optional.of(
                new SubjectRecord("5", "drevo", "T", 1.0, SourceKind.CORRECTION, Instant.now(), true, 1)));
        StubObservationSource rule = StubObservationSource.of("kov", "A", 0.7, SourceKind.RULE_BASED, 0.5);

        Decision d = engine(rule).decide("5");

        assertThat(d.material()).isEqualTo("drevo");
        assertThat(d.confidence()).isEqualTo(1.0);
        assertThat(d.path()).isEqualTo(DecisionPath.VERIFIED);
        assertThat(rule.calls()).isZero();
        verify(store, never()).storeAnalysisUnlessVerified(any());
    }

    @Test
    void forcedRefreshBypassesVerifiedShortCircuit() {
        when(store.getAnalysis("5")).thenReturn(Optional.of(
                new SubjectRecord("5", "drevo", "T", 1.0, SourceKind.CORRECTION, Instant.now(), true, 1)));
        StubObservationSource rule = StubObservationSource.of("kov", "A", 0.7, SourceKind.RULE_BASED, 0.5);

        Decision d = engine(rule).decide("5", true);

        assertThat(rule.calls()).isEqualTo(1);
        assertThat(d.path()).isEqualTo(DecisionPath.ENSEMBLE);
    }

    @Test
    void noObservationsYieldFallbackDeterministically() {
        DefaultEnsembleDecisionEngine engine = engine(StubObservationSource.empty(SourceKind.AGGREGATOR));

        Decision first = engine.decide("abc");
        Decision second = engine.decide("abc");

        assertThat(first.material()).isEqualTo("kov");
        assertThat(first.type()).isEqualTo("stĺp značky samostatný");
        assertThat(first.confidence()).isEqualTo(0.4);
        assertThat(first.path()).isEqualTo(DecisionPath.FALLBACK);
        assertThat(second.material()).isEqualTo(first.material());
        assertThat(second.confidence()).isEqualTo(first.confidence());
        verify(store, never()).storeAnalysisUnlessVerified(any());
    }

    @Test
    void failingSourceContributesNothing() {
        Decision d = engine(
                StubObservationSource.failing(SourceKind.PATTERN_LEARNED, new StorageException("query", new RuntimeException())),
                StubObservationSource.of("kov", "A", 0.7, SourceKind.RULE_BASED, 0.5))
                .decide("10");

        assertThat(d.confidence()).isEqualTo(0.7);
        assertThat(d.sources()).containsExactly(SourceKind.RULE_BASED);
        assertThat(registry.get("holderbot.observation.failure").tag("source", "pattern_learned").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void lowConfidenceIsNotWrittenBack() {
        engine(StubObservationSource.of("kov", "A", 0.45, SourceKind.RULE_BASED, 0.5)).decide("10");

        verify(store, never()).storeAnalysisUnlessVerified(any());
    }

    @Test
    void writeBackFailureIsAbsorbed() {
        when(store.storeAnalysisUnlessVerified(any()))
                .thenThrow(new StorageException("storeAnalysisUnlessVerified", "10", new RuntimeException("disk")));

        Decision d = engine(StubObservationSource.of("kov", "A", 0.7, SourceKind.RULE_BASED, 0.5)).decide("10");

        assertThat(d.confidence()).isEqualTo(0.7);
        assertThat(publisher.eventsOf(WriteBackFailedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.subjectId()).isEqualTo("10"));
        assertThat(registry.get("holderbot.writeback.failure").counter().count()).isEqualTo(1.0);
    }

    @Test
    void unreachableStoreStillDecides() {
        when(store.getAnalysis(anyString())).thenThrow(new StorageException("getAnalysis", new RuntimeException()));
        when(store.storeAnalysisUnlessVerified(any())).thenThrow(new StorageException("store", new RuntimeException()));

        Decision d = engine(StubObservationSource.empty(SourceKind.RULE_BASED)).decide("10");

        assertThat(d.path()).isEqualTo(DecisionPath.FALLBACK);
    }

    @Test
    void agreementBonusIsCapped() {
        Decision d = engine(
                StubObservationSource.of("kov", "A", 0.95, SourceKind.AGGREGATOR, 0.9),
                StubObservationSource.of("kov", "A", 0.95, SourceKind.PATTERN_LEARNED, 0.6),
                StubObservationSource.of("kov", "A", 0.95, SourceKind.PRIOR_RECORD, 0.7),
                StubObservationSource.of("kov", "A", 0.95, SourceKind.RULE_BASED, 0.5))
                .decide("1");

        assertThat(d.confidence()).isEqualTo(0.99);
    }

    @Test
    void bonusGrowsWithAgreeingSourcesUpToCap() {
        DefaultEnsembleDecisionEngine engine = engine();

        assertThat(engine.withAgreementBonus(0.5, 1)).isEqualTo(0.5);
        assertThat(engine.withAgreementBonus(0.5, 2)).isCloseTo(0.55, within(1e-9));
        assertThat(engine.withAgreementBonus(0.5, 3)).isCloseTo(0.60, within(1e-9));
        assertThat(engine.withAgreementBonus(0.5, 6)).isCloseTo(0.60, within(1e-9));
    }

    @Test
    void blankIdIsRejected() {
        assertThatThrownBy(() -> engine().decide("  "))
                .isInstanceOf(InvalidSubjectException.class);
    }

    @Test
    void subjectIdIsInThreadContextWhileDeciding() {
        AtomicReference<String> seen = new AtomicReference<>();
        ObservationSource probe = new ObservationSource() {
            @Override
            public SourceKind kind() {
                return SourceKind.RULE_BASED;
            }

            @Override
            public Optional<Observation> observe(String subjectId, Optional<SubjectRecord> prior, boolean forceRefresh) {
                seen.set(ThreadContext.get(MdcFilter.SUBJECT_ID));
                return Optional.empty();
            }
        };

        engine(probe).decide(" 77 ");

        assertThat(seen.get()).isEqualTo("77");
        assertThat(ThreadContext.get(MdcFilter.SUBJECT_ID)).isNull();
    }
}
