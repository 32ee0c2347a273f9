package com.phillippitts.holderbot.service.ensemble.source;

import com.phillippitts.holderbot.config.properties.EnsembleProperties;
import com.phillippitts.holderbot.config.properties.RuleProperties;
import com.phillippitts.holderbot.config.properties.RuleProperties.IdRule;
import com.phillippitts.holderbot.domain.BucketFunction;
import com.phillippitts.holderbot.domain.Observation;
import com.phillippitts.holderbot.domain.SourceKind;
import com.phillippitts.holderbot.domain.SubjectRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Deterministic id rules; the first matching rule wins. Always contributes, even when the
 * store is unreachable.
 */
@Component
@Order(4)
public class RuleBasedObservationSource implements ObservationSource {

    private final RuleProperties rules;
    private final EnsembleProperties properties;

    public RuleBasedObservationSource(RuleProperties rules, EnsembleProperties properties) {
        this.rules = Objects.requireNonNull(rules);
        this.properties = Objects.requireNonNull(properties);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.RULE_BASED;
    }

    @Override
    public Optional<Observation> observe(String subjectId, Optional<SubjectRecord> prior, boolean forceRefresh) {
        IdRule rule = ruleFor(subjectId);
        return Optional.of(new Observation(rule.material(), rule.type(), rule.confidence(),
                SourceKind.RULE_BASED, properties.weightFor(SourceKind.RULE_BASED)));
    }

    IdRule ruleFor(String subjectId) {
        OptionalLong id = BucketFunction.numericId(subjectId);
        if (id.isEmpty()) {
            return rules.getNonNumeric();
        }
        long n = id.getAsLong();
        return rules.getRules().stream()
                .filter(r -> r.matches(n))
                .findFirst()
                .orElse(rules.getNonNumeric());
    }
}
