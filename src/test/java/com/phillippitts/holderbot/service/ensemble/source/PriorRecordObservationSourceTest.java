package com.phillippitts.holderbot.service.ensemble.source;

import com.phillippitts.holderbot.config.properties.EnsembleProperties;
import com.phillippitts.holderbot.domain.Observation;
import com.phillippitts.holderbot.domain.SourceKind;
import com.phillippitts.holderbot.domain.SubjectRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PriorRecordObservationSourceTest {

    private final PriorRecordObservationSource source = new PriorRecordObservationSource(EnsembleProperties.defaults());

    @Test
    void unverifiedRecordVotesAsPrior() {
        SubjectRecord r = SubjectRecord.unverified("1", "betón", "T", 0.6, SourceKind.ENSEMBLE);

        Observation o = source.observe("1", Optional.of(r), false).orElseThrow();

        assertThat(o.sourceKind()).isEqualTo(SourceKind.PRIOR_RECORD);
        assertThat(o.weight()).isEqualTo(0.7);
        assertThat(o.confidence()).isEqualTo(0.6);
    }

    @Test
    void verifiedRecordVotesOnlyWhenForced() {
        SubjectRecord r = new SubjectRecord("1", "kov", "T", 1.0, SourceKind.CORRECTION, Instant.now(), true, 1);

        assertThat(source.observe("1", Optional.of(r), false)).isEmpty();
        Observation forced = source.observe("1", Optional.of(r), true).orElseThrow();
        assertThat(forced.sourceKind()).isEqualTo(SourceKind.VERIFIED_RECORD);
        assertThat(forced.weight()).isEqualTo(1.0);
    }

    @Test
    void noRecordNoObservation() {
        assertThat(source.observe("1", Optional.empty(), true)).isEmpty();
    }
}
