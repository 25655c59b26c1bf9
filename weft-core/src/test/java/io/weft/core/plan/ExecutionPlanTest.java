package io.weft.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExecutionPlanTest {

    private static PlanStep step(String tool, int group) {
        return new PlanStep("step_" + tool, tool, null, null, group, null, null);
    }

    @Test
    void shouldGroupStepsInOrder() {
        ExecutionPlan plan =
                new ExecutionPlan(
                        "p",
                        "plan",
                        null,
                        List.of(step("a", 0), step("b", 0), step("c", 1)),
                        null,
                        null,
                        null,
                        null,
                        0.0);

        assertThat(plan.groupCount()).isEqualTo(2);
        assertThat(plan.groups().get(0)).extracting(PlanStep::toolName).containsExactly("a", "b");
        assertThat(plan.groups().get(1)).extracting(PlanStep::toolName).containsExactly("c");
        assertThat(plan.stepFor("c")).map(PlanStep::parallelGroup).contains(1);
        assertThat(plan.stepFor("missing")).isEmpty();
    }

    @Test
    void shouldRejectUnorderedSteps() {
        assertThatThrownBy(
                        () ->
                                new ExecutionPlan(
                                        "p",
                                        "plan",
                                        null,
                                        List.of(step("b", 1), step("a", 0)),
                                        null,
                                        null,
                                        null,
                                        null,
                                        0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ordered");
    }

    @Test
    void shouldApplyDefaults() {
        ExecutionPlan plan =
                new ExecutionPlan("p", "plan", null, List.of(), null, null, null, null, 0.0);

        assertThat(plan.description()).isEmpty();
        assertThat(plan.optimization()).isEqualTo(OptimizationSettings.defaults());
        assertThat(plan.constraints()).isEqualTo(PlanConstraints.defaults());
        assertThat(plan.createdAt()).isNotNull();
        assertThat(plan.hasSteps()).isFalse();
    }

    @Test
    void shouldResolveUnsetLimitsOnly() {
        PlanConstraints constraints =
                PlanConstraints.defaults()
                        .withMaxCost(1.5)
                        .resolve(Duration.ofSeconds(4), 0.2);

        assertThat(constraints.maxDuration()).isEqualTo(Duration.ofSeconds(4));
        assertThat(constraints.maxCost()).isEqualTo(1.5);
    }
}
