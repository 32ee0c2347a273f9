package com.phillippitts.holderbot.service.ensemble.source;

import com.phillippitts.holderbot.config.properties.EnsembleProperties;
import com.phillippitts.holderbot.config.properties.RuleProperties;
import com.phillippitts.holderbot.config.properties.RuleProperties.Condition;
import com.phillippitts.holderbot.config.properties.RuleProperties.IdRule;
import com.phillippitts.holderbot.domain.Observation;
import com.phillippitts.holderbot.domain.SourceKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedObservationSourceTest {

    private final RuleBasedObservationSource source =
            new RuleBasedObservationSource(RuleProperties.defaults(), EnsembleProperties.defaults());

    private Observation observe(String id) {
        return source.observe(id, Optional.empty(), false).orElseThrow();
    }

    @Test
    void firstMatchingRuleWins() {
        assertThat(observe("200").type()).isEqualTo("stĺp svetelného signalizačného zariadenia");
        assertThat(observe("200").confidence()).isEqualTo(0.65);
        assertThat(observe("40").type()).isEqualTo("stĺp značky dvojitý");
        assertThat(observe("30").type()).isEqualTo("stĺp verejného osvetlenia");
        assertThat(observe("1001").material()).isEqualTo("betón");
        assertThat(observe("7").confidence()).isEqualTo(0.7);
    }

    @Test
    void nonNumericIdGetsDedicatedRule() {
        Observation o = observe("A-17");

        assertThat(o.material()).isEqualTo("kov");
        assertThat(o.confidence()).isEqualTo(0.5);
        assertThat(o.sourceKind()).isEqualTo(SourceKind.RULE_BASED);
        assertThat(o.weight()).isEqualTo(0.5);
    }

    @Test
    void configuredRulesReplaceDefaults() {
        RuleProperties rules = new RuleProperties(
                List.of(new IdRule(Condition.GREATER_THAN, 10, "drevo", "T", 0.6)),
                new IdRule(Condition.ALWAYS, 0, "plast", "U", 0.2));
        RuleBasedObservationSource custom = new RuleBasedObservationSource(rules, EnsembleProperties.defaults());

        assertThat(custom.ruleFor("11").material()).isEqualTo("drevo");
        // no rule matches, so the non-numeric rule is the last resort
        assertThat(custom.ruleFor("5").material()).isEqualTo("plast");
    }
}
