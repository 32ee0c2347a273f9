package com.phillippitts.holderbot.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

import java.util.List;
import java.util.Objects;

/**
 * Ordered id rules of the rule-based observation source. The first matching rule wins;
 * ids that are not numeric get {@link #getNonNumeric()}.
 *
 * <pre>
 * holderbot.rules.rules[0].condition=DIVISIBLE_BY
 * holderbot.rules.rules[0].operand=100
 * holderbot.rules.rules[0].material=kov
 * holderbot.rules.rules[0].type=stĺp svetelného signalizačného zariadenia
 * holderbot.rules.rules[0].confidence=0.65
 * </pre>
 */
@ConfigurationProperties(prefix = "holderbot.rules")
public class RuleProperties {

    public enum Condition { DIVISIBLE_BY, GREATER_THAN, ALWAYS }

    /**
     * One id rule.
     */
    public record IdRule(Condition condition, long operand, String material, String type, double confidence) {

        public IdRule {
            Objects.requireNonNull(condition, "condition");
            if (material == null || material.isBlank() || type == null || type.isBlank()) {
                throw new IllegalArgumentException("holderbot.rules entries need material and type");
            }
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("holderbot.rules confidence must be in [0,1]");
            }
            if (condition == Condition.DIVISIBLE_BY && operand <= 0) {
                throw new IllegalArgumentException("holderbot.rules DIVISIBLE_BY operand must be > 0");
            }
        }

        public boolean matches(long id) {
            return switch (condition) {
                case DIVISIBLE_BY -> id % operand == 0;
                case GREATER_THAN -> id > operand;
                case ALWAYS -> true;
            };
        }
    }

    private static final List<IdRule> DEFAULT_RULES = List.of(
            new IdRule(Condition.DIVISIBLE_BY, 100, "kov", "stĺp svetelného signalizačného zariadenia", 0.65),
            new IdRule(Condition.DIVISIBLE_BY, 20, "kov", "stĺp značky dvojitý", 0.6),
            new IdRule(Condition.DIVISIBLE_BY, 10, "kov", "stĺp verejného osvetlenia", 0.55),
            new IdRule(Condition.GREATER_THAN, 1000, "betón", "stĺp značky samostatný", 0.5),
            new IdRule(Condition.ALWAYS, 0, "kov", "stĺp značky samostatný", 0.7)
    );

    private static final IdRule DEFAULT_NON_NUMERIC =
            new IdRule(Condition.ALWAYS, 0, "kov", "stĺp značky samostatný", 0.5);

    private final List<IdRule> rules;
    private final IdRule nonNumeric;

    @ConstructorBinding
    public RuleProperties(List<IdRule> rules, IdRule nonNumeric) {
        this.rules = rules == null || rules.isEmpty() ? DEFAULT_RULES : List.copyOf(rules);
        this.nonNumeric = nonNumeric == null ? DEFAULT_NON_NUMERIC : nonNumeric;
    }

    public static RuleProperties defaults() {
        return new RuleProperties(null, null);
    }

    public List<IdRule> getRules() {
        return rules;
    }

    public IdRule getNonNumeric() {
        return nonNumeric;
    }
}
