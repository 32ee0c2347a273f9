package com.phillippitts.holderbot.service.voting;

/**
 * Consensus of a weighted vote.
 *
 * @param material           winning material
 * @param type               winning type
 * @param confidence         mean of the two axis confidences
 * @param materialConfidence winner's share of the material scores
 * @param typeConfidence     winner's share of the type scores
 * @param ballots            number of ballots counted
 */
public record VoteResult(
        String material,
        String type,
        double confidence,
        double materialConfidence,
        double typeConfidence,
        int ballots
) {
}
