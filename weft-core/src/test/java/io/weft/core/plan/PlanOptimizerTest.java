package io.weft.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.weft.core.exception.CircularDependencyException;
import io.weft.core.performance.PerformanceTracker;
import io.weft.core.tool.BuiltInTools;
import io.weft.core.tool.DefaultToolRegistry;
import io.weft.core.tool.ToolDefinition;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PlanOptimizerTest {

    private DefaultToolRegistry registry;
    private PerformanceTracker tracker;
    private PlanOptimizer optimizer;

    @BeforeEach
    void setUp() {
        registry = new DefaultToolRegistry();
        tracker = new PerformanceTracker(100, true);
        optimizer = new PlanOptimizer(tracker);
    }

    private List<PlanStep> plan(String... requested) throws Exception {
        List<ToolRequest> requests = new ArrayList<>();
        for (String name : requested) {
            requests.add(ToolRequest.of(name));
        }
        DependencyGraph graph = new DependencyGraphBuilder(registry).build(requests);
        return optimizer.optimize(graph, Map.of(), registry);
    }

    private static Map<String, Integer> groupsByTool(List<PlanStep> steps) {
        Map<String, Integer> groups = new HashMap<>();
        steps.forEach(s -> groups.put(s.toolName(), s.parallelGroup()));
        return groups;
    }

    @Nested
    class Ordering {

        @Test
        void shouldPlaceEveryDependencyInALowerGroup() throws Exception {
            registry.register(ToolDefinition.simple("a"));
            registry.register(ToolDefinition.simple("b", "a"));
            registry.register(ToolDefinition.simple("c", "a"));
            registry.register(ToolDefinition.simple("d", "b", "c"));
            registry.register(ToolDefinition.simple("e", "a", "d"));

            List<PlanStep> steps = plan("e");
            Map<String, Integer> groups = groupsByTool(steps);

            for (PlanStep step : steps) {
                for (String dep : step.dependencies()) {
                    assertThat(groups.get(dep)).isLessThan(step.parallelGroup());
                }
            }
            assertThat(groups)
                    .containsEntry("a", 0)
                    .containsEntry("b", 1)
                    .containsEntry("c", 1)
                    .containsEntry("d", 2)
                    .containsEntry("e", 3);
        }

        @Test
        void shouldSortStepsByGroup() throws Exception {
            registry.register(ToolDefinition.simple("a"));
            registry.register(ToolDefinition.simple("b", "a"));
            registry.register(ToolDefinition.simple("c"));

            List<PlanStep> steps = plan("b", "c");

            assertThat(steps).extracting(PlanStep::parallelGroup).isSorted();
            assertThat(steps).extracting(PlanStep::toolName).containsExactly("a", "c", "b");
        }

        @Test
        void shouldGroupIndependentToolsTogether() throws Exception {
            registry.register(ToolDefinition.simple("a"));
            registry.register(ToolDefinition.simple("b"));
            registry.register(ToolDefinition.simple("c"));

            List<PlanStep> steps = plan("a", "b", "c");

            assertThat(steps).allMatch(s -> s.parallelGroup() == 0);
            assertThat(PlanOptimizer.countParallelGroups(steps)).isEqualTo(1);
        }

        @Test
        void shouldBuildBuiltInChain() throws Exception {
            BuiltInTools.all().forEach(registry::register);

            List<PlanStep> steps = plan("smart_write", "smart_orchestrate");

            assertThat(steps)
                    .extracting(PlanStep::stepId)
                    .containsExactly(
                            "step_1_smart_begin",
                            "step_4_smart_orchestrate",
                            "step_2_smart_plan",
                            "step_3_smart_write");
            assertThat(groupsByTool(steps))
                    .containsEntry("smart_begin", 0)
                    .containsEntry("smart_orchestrate", 0)
                    .containsEntry("smart_plan", 1)
                    .containsEntry("smart_write", 2);
        }

        @Test
        void shouldPassRequestInputsAndDefaultPulledInputsToEmpty() throws Exception {
            registry.register(ToolDefinition.simple("a"));
            registry.register(ToolDefinition.simple("b", "a"));
            DependencyGraph graph =
                    new DependencyGraphBuilder(registry).build(List.of(ToolRequest.of("b")));

            List<PlanStep> steps =
                    optimizer.optimize(graph, Map.of("b", Map.of("k", "v")), registry);

            assertThat(steps.get(0).input()).isEmpty();
            assertThat(steps.get(1).input()).containsEntry("k", "v");
            assertThat(steps.get(1).expectedOutputs()).containsExactly("b_output");
        }
    }

    @Nested
    class CycleDetection {

        @Test
        void shouldRejectTwoToolCycle() {
            registry.register(ToolDefinition.simple("a", "b"));
            registry.register(ToolDefinition.simple("b", "a"));

            assertThatThrownBy(() -> plan("a"))
                    .isInstanceOf(CircularDependencyException.class)
                    .hasMessageContaining("Circular dependency")
                    .satisfies(
                            e -> {
                                CircularDependencyException cycle =
                                        (CircularDependencyException) e;
                                assertThat(cycle.getToolName()).isEqualTo("a");
                                assertThat(cycle.getCycle()).containsExactly("a", "b", "a");
                            });
        }

        @Test
        void shouldRejectLongerCycleBehindAcyclicPrefix() {
            registry.register(ToolDefinition.simple("root", "x"));
            registry.register(ToolDefinition.simple("x", "y"));
            registry.register(ToolDefinition.simple("y", "z"));
            registry.register(ToolDefinition.simple("z", "x"));

            assertThatThrownBy(() -> plan("root"))
                    .isInstanceOf(CircularDependencyException.class)
                    .satisfies(
                            e ->
                                    assertThat(((CircularDependencyException) e).getCycle())
                                            .containsExactly("x", "y", "z", "x"));
        }
    }

    @Nested
    class RetryPolicies {

        @Test
        void shouldEnhanceRetriesForUnreliableDeclaredTool() throws Exception {
            registry.register(ToolDefinition.builder("flaky").reliability(0.5).build());
            registry.register(ToolDefinition.builder("solid").reliability(0.99).build());

            List<PlanStep> steps =
                    optimizer.applyIntelligentOptimizations(
                            plan("flaky", "solid"), PlanConstraints.defaults(), registry);

            assertThat(steps.get(0).retryPolicy()).isEqualTo(RetryPolicy.enhanced());
            assertThat(steps.get(1).retryPolicy()).isEqualTo(RetryPolicy.none());
        }

        @Test
        void shouldPreferObservedSuccessRateOverDeclaredReliability() throws Exception {
            registry.register(ToolDefinition.builder("flaky").reliability(0.99).build());
            tracker.recordAttempt("flaky", Duration.ofMillis(10), 0.01, false);
            tracker.recordAttempt("flaky", Duration.ofMillis(10), 0.01, true);

            List<PlanStep> steps =
                    optimizer.applyIntelligentOptimizations(
                            plan("flaky"), PlanConstraints.defaults(), registry);

            assertThat(steps.get(0).retryPolicy().maxRetries()).isEqualTo(3);
        }

        @Test
        void shouldGrantDefaultRetriesToReliableTools() throws Exception {
            registry.register(ToolDefinition.simple("a"));

            List<PlanStep> steps =
                    optimizer.applyIntelligentOptimizations(
                            plan("a"), PlanConstraints.defaults().withDefaultRetries(2), registry);

            assertThat(steps.get(0).retryPolicy().maxRetries()).isEqualTo(2);
        }

        @Test
        void shouldBeIdempotent() throws Exception {
            registry.register(ToolDefinition.builder("flaky").reliability(0.4).build());
            registry.register(ToolDefinition.simple("solid", "flaky"));
            PlanConstraints constraints = PlanConstraints.defaults().withDefaultRetries(1);

            List<PlanStep> once =
                    optimizer.applyIntelligentOptimizations(
                            plan("solid"), constraints, registry);
            List<PlanStep> twice =
                    optimizer.applyIntelligentOptimizations(once, constraints, registry);

            assertThat(twice).isEqualTo(once);
        }
    }

    @Nested
    class Estimates {

        @BeforeEach
        void registerTools() {
            registry.register(
                    ToolDefinition.builder("a")
                            .estimatedDuration(Duration.ofSeconds(2))
                            .costPerExecution(0.1)
                            .reliability(0.9)
                            .build());
            registry.register(
                    ToolDefinition.builder("b")
                            .estimatedDuration(Duration.ofSeconds(5))
                            .costPerExecution(0.2)
                            .reliability(0.8)
                            .build());
            registry.register(
                    ToolDefinition.builder("c")
                            .dependsOn("a")
                            .dependsOn("b")
                            .estimatedDuration(Duration.ofSeconds(1))
                            .costPerExecution(0.3)
                            .reliability(1.0)
                            .build());
        }

        @Test
        void shouldSumSlowestToolPerGroup() throws Exception {
            assertThat(optimizer.estimateDuration(plan("c"), registry))
                    .isEqualTo(Duration.ofSeconds(6));
        }

        @Test
        void shouldSumCosts() throws Exception {
            assertThat(optimizer.estimateCost(plan("c"), registry)).isCloseTo(0.6, within());
        }

        @Test
        void shouldMultiplyReliabilities() throws Exception {
            assertThat(optimizer.estimateReliability(plan("c"), registry))
                    .isCloseTo(0.72, within());
        }

        @Test
        void shouldApplyTimeoutFloor() throws Exception {
            assertThat(optimizer.calculateTimeout(plan("c"), registry))
                    .isEqualTo(Duration.ofSeconds(60));
        }

        @Test
        void shouldScaleTimeoutAboveFloor() throws Exception {
            PlanOptimizer lowFloor = new PlanOptimizer(tracker, 0.9, Duration.ofSeconds(1));

            assertThat(lowFloor.calculateTimeout(plan("c"), registry))
                    .isEqualTo(Duration.ofMillis(12_000));
        }

        private Offset<Double> within() {
            return Offset.offset(1e-9);
        }
    }
}
