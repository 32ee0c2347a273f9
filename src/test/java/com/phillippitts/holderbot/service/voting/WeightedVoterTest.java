package com.phillippitts.holderbot.service.voting;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WeightedVoterTest {

    @Test
    void weightedScoresDecideEachAxis() {
        VoteResult r = WeightedVoter.vote(List.of(
                new Ballot("kov", "X", 0.7, 0.9),
                new Ballot("betón", "X", 0.5, 0.6)));

        assertThat(r.material()).isEqualTo("kov");
        assertThat(r.type()).isEqualTo("X");
        assertThat(r.materialConfidence()).isCloseTo(0.63 / 0.93, within(1e-9));
        assertThat(r.typeConfidence()).isCloseTo(1.0, within(1e-9));
        assertThat(r.confidence()).isCloseTo((0.63 / 0.93 + 1.0) / 2, within(1e-9));
        assertThat(r.ballots()).isEqualTo(2);
    }

    @Test
    void singleBallotIsReturnedUnchanged() {
        VoteResult r = WeightedVoter.vote(List.of(new Ballot("kov", "A", 0.7, 0.5)));

        assertThat(r.material()).isEqualTo("kov");
        assertThat(r.type()).isEqualTo("A");
        assertThat(r.confidence()).isEqualTo(0.7);
    }

    @Test
    void axesAreVotedIndependently() {
        VoteResult r = WeightedVoter.vote(List.of(
                new Ballot("kov", "A", 0.9, 1.0),
                new Ballot("betón", "B", 0.8, 1.0),
                new Ballot("betón", "A", 0.2, 1.0)));

        assertThat(r.material()).isEqualTo("betón");
        assertThat(r.type()).isEqualTo("A");
    }

    @Test
    void tieGoesToStrongestSupporter() {
        // both score 0.4; betón is backed by the heavier single ballot
        VoteResult r = WeightedVoter.vote(List.of(
                new Ballot("kov", "A", 0.8, 0.5),
                new Ballot("betón", "A", 0.5, 0.8)));

        assertThat(r.material()).isEqualTo("betón");
    }

    @Test
    void exactTieKeepsFirstSeen() {
        VoteResult r = WeightedVoter.vote(List.of(
                new Ballot("kov", "A", 0.5, 0.5),
                new Ballot("betón", "B", 0.5, 0.5)));

        assertThat(r.material()).isEqualTo("kov");
        assertThat(r.type()).isEqualTo("A");
        assertThat(r.confidence()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void zeroScoresYieldZeroConfidence() {
        VoteResult r = WeightedVoter.vote(List.of(
                new Ballot("kov", "A", 0.0, 0.9),
                new Ballot("kov", "A", 0.0, 0.6)));

        assertThat(r.confidence()).isZero();
    }

    @Test
    void emptyInputIsRejected() {
        assertThatThrownBy(() -> WeightedVoter.vote(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
