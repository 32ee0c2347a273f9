package com.phillippitts.holderbot.service.correction;

import com.phillippitts.holderbot.domain.CorrectionEvent;
import com.phillippitts.holderbot.domain.SourceKind;
import com.phillippitts.holderbot.domain.SubjectRecord;
import com.phillippitts.holderbot.exception.StorageException;
import com.phillippitts.holderbot.service.events.CorrectionAppliedEvent;
import com.phillippitts.holderbot.service.metrics.DecisionMetrics;
import com.phillippitts.holderbot.service.store.AppliedCorrection;
import com.phillippitts.holderbot.service.store.PatternLearningStore;
import com.phillippitts.holderbot.testutil.EventCapturingPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CorrectionServiceTest {

    private final PatternLearningStore store = mock(PatternLearningStore.class);
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final CorrectionService service = new CorrectionService(store, publisher, new DecisionMetrics(registry));

    @Test
    void publishesEventCarryingPreviousRecord() {
        SubjectRecord previous = SubjectRecord.unverified("5", "kov", "A", 0.6, SourceKind.ENSEMBLE);
        CorrectionEvent event = new CorrectionEvent("5", "kov", "A", "betón", "B", Instant.now());
        SubjectRecord updated = new SubjectRecord("5", "betón", "B", 1.0, SourceKind.CORRECTION,
                Instant.now(), true, 1);
        when(store.applyCorrection("5", "betón", "B")).thenReturn(new AppliedCorrection(event, previous, updated));

        AppliedCorrection applied = service.applyCorrection("5", "betón", "B");

        assertThat(applied.updated().verified()).isTrue();
        assertThat(publisher.eventsOf(CorrectionAppliedEvent.class)).singleElement()
                .satisfies(e -> {
                    assertThat(e.correction()).isEqualTo(event);
                    assertThat(e.previous()).isEqualTo(previous);
                });
        assertThat(registry.get("holderbot.correction.count").counter().count()).isEqualTo(1.0);
    }

    @Test
    void failedCommitPublishesNothing() {
        when(store.applyCorrection("5", "kov", "A"))
                .thenThrow(new StorageException("applyCorrection", "5", new RuntimeException("db down")));

        assertThatThrownBy(() -> service.applyCorrection("5", "kov", "A"))
                .isInstanceOf(StorageException.class);
        assertThat(publisher.events()).isEmpty();
        assertThat(registry.find("holderbot.correction.count").counter()).isNull();
    }
}
