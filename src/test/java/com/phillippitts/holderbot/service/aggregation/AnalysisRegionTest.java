package com.phillippitts.holderbot.service.aggregation;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnalysisRegionTest {

    @Test
    void regionsAreFixedAndValidBoxes() {
        assertThat(Arrays.stream(AnalysisRegion.values()).map(AnalysisRegion::regionName))
                .containsExactly("full", "upper-junction", "main-junction", "lower-junction",
                        "center-shaft", "upper-section", "base-section");
        for (AnalysisRegion r : AnalysisRegion.values()) {
            assertThat(r.left()).isBetween(0.0, 1.0).isLessThan(r.right());
            assertThat(r.top()).isBetween(0.0, 1.0).isLessThan(r.bottom());
            assertThat(r.right()).isLessThanOrEqualTo(1.0);
            assertThat(r.bottom()).isLessThanOrEqualTo(1.0);
        }
    }

    @Test
    void instructionCarriesReplyFormatAndHints() {
        String text = AnalysisRegion.MAIN_JUNCTION.instruction(List.of("Common mistake: do not confuse betón with kov"));

        assertThat(text).contains("Material:", "Type:", "Confidence:", "Reasoning:");
        assertThat(text).contains("Learned from past corrections:");
        assertThat(text).contains("- Common mistake: do not confuse betón with kov");
    }

    @Test
    void instructionWithoutHintsHasNoHintSection() {
        assertThat(AnalysisRegion.FULL.instruction(List.of())).doesNotContain("Learned from past corrections");
        assertThat(AnalysisRegion.FULL.instruction(null)).doesNotContain("Learned from past corrections");
    }
}
