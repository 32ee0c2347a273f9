package com.phillippitts.holderbot.domain;

/**
 * Provenance of an {@link Observation} or of the last write to a {@link SubjectRecord}.
 *
 * <p>Observation kinds ({@link #VERIFIED_RECORD}, {@link #AGGREGATOR}, {@link #PATTERN_LEARNED},
 * {@link #PRIOR_RECORD}, {@link #RULE_BASED}) are weighted by the reliability table in
 * {@link com.phillippitts.holderbot.config.properties.EnsembleProperties}. Record kinds
 * ({@link #ENSEMBLE}, {@link #CORRECTION}, {@link #IMPORTED}) only describe who wrote a row.
 */
public enum SourceKind {

    /** A verified record re-used as an observation because a refresh was forced. */
    VERIFIED_RECORD,

    /** Consensus of the multi-region vision aggregation. */
    AGGREGATOR,

    /** Best learned bucket hypothesis for the subject id. */
    PATTERN_LEARNED,

    /** An earlier unverified engine decision stored for the subject. */
    PRIOR_RECORD,

    /** Deterministic id rules; lowest trust. */
    RULE_BASED,

    /** Record written by the decision engine. */
    ENSEMBLE,

    /** Record written by a human correction. */
    CORRECTION,

    /** Record loaded through bulk import. */
    IMPORTED
}
