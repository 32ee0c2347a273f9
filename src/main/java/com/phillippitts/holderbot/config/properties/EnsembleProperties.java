package com.phillippitts.holderbot.config.properties;

import com.phillippitts.holderbot.domain.SourceKind;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Reliability table and combination constants for the ensemble decision engine.
 *
 * <p>The weights must keep the order
 * {@code verified-record > aggregator > pattern-learned > rule-based}, with
 * {@code prior-record} strictly between aggregator and rule-based. The constructor rejects
 * any table that breaks this order so a bad override fails at startup.
 */
@Validated
@ConfigurationProperties(prefix = "holderbot.ensemble")
public class EnsembleProperties {

    private final double verifiedRecordWeight;
    private final double aggregatorWeight;
    private final double patternLearnedWeight;
    private final double priorRecordWeight;
    private final double ruleBasedWeight;

    /** Decisions at or above this confidence are written back as unverified records. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double storeThreshold;

    /** Bonus per additional agreeing observation. */
    private final double agreementStep;

    /** Upper bound of the total agreement bonus. */
    private final double agreementCap;

    /** Final confidence never exceeds this after the bonus. */
    private final double maxConfidence;

    @ConstructorBinding
    public EnsembleProperties(Double verifiedRecordWeight, Double aggregatorWeight,
                              Double patternLearnedWeight, Double priorRecordWeight,
                              Double ruleBasedWeight, Double storeThreshold,
                              Double agreementStep, Double agreementCap, Double maxConfidence) {
        this.verifiedRecordWeight = verifiedRecordWeight == null ? 1.0 : verifiedRecordWeight;
        this.aggregatorWeight = aggregatorWeight == null ? 0.9 : aggregatorWeight;
        this.patternLearnedWeight = patternLearnedWeight == null ? 0.6 : patternLearnedWeight;
        this.priorRecordWeight = priorRecordWeight == null ? 0.7 : priorRecordWeight;
        this.ruleBasedWeight = ruleBasedWeight == null ? 0.5 : ruleBasedWeight;
        this.storeThreshold = unit("store-threshold", storeThreshold, 0.5);
        this.agreementStep = unit("agreement-step", agreementStep, 0.05);
        this.agreementCap = unit("agreement-cap", agreementCap, 0.10);
        this.maxConfidence = unit("max-confidence", maxConfidence, 0.99);
        validateOrdering();
    }

    /**
     * Defaults for tests and manual wiring.
     */
    public static EnsembleProperties defaults() {
        return new EnsembleProperties(null, null, null, null, null, null, null, null, null);
    }

    private void validateOrdering() {
        if (ruleBasedWeight <= 0.0) {
            throw new IllegalArgumentException("holderbot.ensemble.rule-based-weight must be > 0");
        }
        if (!(verifiedRecordWeight > aggregatorWeight
                && aggregatorWeight > patternLearnedWeight
                && patternLearnedWeight > ruleBasedWeight)) {
            throw new IllegalArgumentException("holderbot.ensemble weights must satisfy "
                    + "verified-record > aggregator > pattern-learned > rule-based");
        }
        if (!(priorRecordWeight < aggregatorWeight && priorRecordWeight > ruleBasedWeight)) {
            throw new IllegalArgumentException("holderbot.ensemble.prior-record-weight must lie "
                    + "strictly between rule-based and aggregator weights");
        }
    }

    private static double unit(String name, Double value, double fallback) {
        double v = value == null ? fallback : value;
        if (v < 0.0 || v > 1.0) {
            throw new IllegalArgumentException("holderbot.ensemble." + name + " must be in [0,1]");
        }
        return v;
    }

    /**
     * Reliability weight of an observation source.
     *
     * @throws IllegalArgumentException for record-only kinds that never produce observations
     */
    public double weightFor(SourceKind kind) {
        return switch (kind) {
            case VERIFIED_RECORD -> verifiedRecordWeight;
            case AGGREGATOR -> aggregatorWeight;
            case PATTERN_LEARNED -> patternLearnedWeight;
            case PRIOR_RECORD -> priorRecordWeight;
            case RULE_BASED -> ruleBasedWeight;
            default -> throw new IllegalArgumentException("No observation weight for " + kind);
        };
    }

    public double getStoreThreshold() {
        return storeThreshold;
    }

    public double getAgreementStep() {
        return agreementStep;
    }

    public double getAgreementCap() {
        return agreementCap;
    }

    public double getMaxConfidence() {
        return maxConfidence;
    }
}
