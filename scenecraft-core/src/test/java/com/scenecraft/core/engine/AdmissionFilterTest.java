package com.scenecraft.core.engine;

import com.scenecraft.core.model.ContainerType;
import com.scenecraft.core.model.NodeSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AdmissionFilter}.
 */
class AdmissionFilterTest {

    private final GenerationCounters counters = new GenerationCounters(Clock.systemUTC());

    private AdmissionFilter filter(GeneratorConfig config) {
        return new AdmissionFilter(config, counters);
    }

    @Test
    void evaluate_descriptiveItem_acceptsAndReservesSlot() {
        Admission verdict = filter(GeneratorConfig.defaults()).evaluate(NodeSpec.item("pen", "A blue ballpoint pen"));

        assertThat(verdict).isEqualTo(Admission.ACCEPTED);
        assertThat(verdict.isAccepted()).isTrue();
        assertThat(counters.nodesGenerated()).isEqualTo(1);
    }

    @Test
    void evaluate_shortDescription_rejectsWithoutReserving() {
        Admission verdict = filter(GeneratorConfig.defaults()).evaluate(NodeSpec.item("pen", "   A pen   "));

        assertThat(verdict).isEqualTo(Admission.DESCRIPTION_TOO_SHORT);
        assertThat(counters.nodesGenerated()).isZero();
    }

    @ParameterizedTest
    @ValueSource(strings = {"door", "Wall", " floor ", "窗户"})
    void evaluate_genericItemWithShortDescription_rejects(String name) {
        Admission verdict = filter(GeneratorConfig.defaults()).evaluate(NodeSpec.item(name, "Plain and white"));

        assertThat(verdict).isEqualTo(Admission.GENERIC_ITEM);
    }

    @Test
    void evaluate_genericItemWithLongDescription_accepts() {
        NodeSpec spec = NodeSpec.item("door", "A heavy door with iron studs and a lion knocker");

        assertThat(filter(GeneratorConfig.defaults()).evaluate(spec)).isEqualTo(Admission.ACCEPTED);
    }

    @Test
    void evaluate_genericNamedContainer_isNotGenericItem() {
        NodeSpec spec = NodeSpec.container("window", ContainerType.PHYSICAL, "Plain and white");

        assertThat(filter(GeneratorConfig.defaults()).evaluate(spec)).isEqualTo(Admission.ACCEPTED);
    }

    @Test
    void evaluate_budgetExhausted_rejects() {
        AdmissionFilter filter = filter(GeneratorConfig.builder().maxTotalNodes(1).build());

        assertThat(filter.evaluate(NodeSpec.item("pen", "A blue ballpoint pen"))).isEqualTo(Admission.ACCEPTED);
        assertThat(filter.evaluate(NodeSpec.item("ink", "A bottle of black ink"))).isEqualTo(Admission.BUDGET_EXHAUSTED);
        assertThat(counters.nodesGenerated()).isEqualTo(1);
    }

    @Test
    void evaluate_costControlDisabled_acceptsEverythingAndCounts() {
        AdmissionFilter filter = filter(GeneratorConfig.builder().costControl(false).maxTotalNodes(0).build());

        assertThat(filter.evaluate(NodeSpec.item("door", ""))).isEqualTo(Admission.ACCEPTED);
        assertThat(counters.nodesGenerated()).isEqualTo(1);
    }
}
