package com.phillippitts.holderbot.service.voting;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Per-axis weighted plurality vote shared by the region aggregator and the ensemble engine.
 *
 * <p>For each axis every distinct candidate accumulates {@code Σ weight × confidence} of the
 * ballots proposing it. The highest score wins; a tie goes to the candidate whose strongest
 * supporter has the higher individual weight, then to the candidate seen first. The axis
 * confidence is the winner's share of all scores on that axis, and the overall confidence is
 * the mean of both axes.
 *
 * <p>A single ballot is returned unchanged.
 */
public final class WeightedVoter {

    private static final double EPSILON = 1e-12;

    private WeightedVoter() {
    }

    /**
     * @param ballots at least one ballot, in gathering order
     * @throws IllegalArgumentException if ballots is empty
     */
    public static VoteResult vote(List<Ballot> ballots) {
        if (ballots == null || ballots.isEmpty()) {
            throw new IllegalArgumentException("at least one ballot is required");
        }
        if (ballots.size() == 1) {
            Ballot only = ballots.get(0);
            return new VoteResult(only.material(), only.type(), only.confidence(),
                    only.confidence(), only.confidence(), 1);
        }

        AxisWinner material = tally(ballots, Ballot::material);
        AxisWinner type = tally(ballots, Ballot::type);
        double confidence = clamp((material.share + type.share) / 2.0);
        return new VoteResult(material.value, type.value, confidence, material.share, type.share, ballots.size());
    }

    private static AxisWinner tally(List<Ballot> ballots, Function<Ballot, String> axis) {
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        double total = 0.0;
        for (Ballot b : ballots) {
            Candidate c = candidates.computeIfAbsent(axis.apply(b), k -> new Candidate());
            c.score += b.score();
            c.strongestWeight = Math.max(c.strongestWeight, b.weight());
            total += b.score();
        }

        String winner = null;
        Candidate best = null;
        for (Map.Entry<String, Candidate> e : candidates.entrySet()) {
            Candidate c = e.getValue();
            if (best == null || beats(c, best)) {
                winner = e.getKey();
                best = c;
            }
        }
        double share = total <= 0.0 ? 0.0 : best.score / total;
        return new AxisWinner(winner, clamp(share));
    }

    // strict: an exact tie on both criteria keeps the earlier candidate
    private static boolean beats(Candidate challenger, Candidate incumbent) {
        if (challenger.score > incumbent.score + EPSILON) {
            return true;
        }
        if (Math.abs(challenger.score - incumbent.score) <= EPSILON) {
            return challenger.strongestWeight > incumbent.strongestWeight + EPSILON;
        }
        return false;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static final class Candidate {
        double score;
        double strongestWeight;
    }

    private record AxisWinner(String value, double share) {
    }
}
