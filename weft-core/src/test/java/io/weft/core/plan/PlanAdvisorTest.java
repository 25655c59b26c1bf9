package io.weft.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.weft.core.performance.PerformanceTracker;
import io.weft.core.plan.OptimizationSuggestion.Difficulty;
import io.weft.core.plan.OptimizationSuggestion.Type;
import io.weft.core.tool.DefaultToolRegistry;
import io.weft.core.tool.ToolDefinition;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PlanAdvisorTest {

    private DefaultToolRegistry registry;
    private PerformanceTracker tracker;
    private PlanOptimizer optimizer;
    private PlanAdvisor advisor;

    @BeforeEach
    void setUp() {
        registry = new DefaultToolRegistry();
        tracker = new PerformanceTracker(100, true);
        optimizer = new PlanOptimizer(tracker);
        advisor = new PlanAdvisor(registry, tracker, optimizer, 0.9);
    }

    private ExecutionPlan planOf(String... tools) throws Exception {
        List<ToolRequest> requests = new ArrayList<>();
        for (String tool : tools) {
            requests.add(ToolRequest.of(tool));
        }
        DependencyGraph graph = new DependencyGraphBuilder(registry).build(requests);
        List<PlanStep> steps = optimizer.optimize(graph, Map.of(), registry);
        return new ExecutionPlan(
                ExecutionPlan.newId(), "test", null, steps, null, null, null, null, 0.0);
    }

    private static ToolDefinition.Builder reliableTool(String name) {
        return ToolDefinition.builder(name).reliability(1.0);
    }

    @Test
    void shouldReturnNothingForEmptyPlan() {
        ExecutionPlan empty =
                new ExecutionPlan("p", "empty", null, List.of(), null, null, null, null, 0.0);

        assertThat(advisor.suggestOptimizations(empty)).isEmpty();
    }

    @Test
    void shouldReturnNothingForHealthySequentialPlan() throws Exception {
        registry.register(reliableTool("a").build());
        registry.register(reliableTool("b").dependsOn("a").build());

        assertThat(advisor.suggestOptimizations(planOf("b"))).isEmpty();
    }

    @Test
    void shouldSuggestParallelismWithSavingPercentage() throws Exception {
        registry.register(reliableTool("a").estimatedDuration(Duration.ofMillis(1000)).build());
        registry.register(reliableTool("b").estimatedDuration(Duration.ofMillis(2000)).build());
        registry.register(reliableTool("c").estimatedDuration(Duration.ofMillis(3000)).build());

        List<OptimizationSuggestion> suggestions =
                advisor.suggestOptimizations(planOf("a", "b", "c"));

        assertThat(suggestions).hasSize(1);
        OptimizationSuggestion suggestion = suggestions.get(0);
        assertThat(suggestion.type()).isEqualTo(Type.PARALLELISM);
        assertThat(suggestion.difficulty()).isEqualTo(Difficulty.LOW);
        assertThat(suggestion.message())
                .isEqualTo("3 steps can be parallelized to reduce execution time");
        assertThat(suggestion.estimatedImpact().timeReduction()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void shouldNotSuggestParallelismForNonParallelizableTools() throws Exception {
        registry.register(reliableTool("a").parallelizable(false).build());
        registry.register(reliableTool("b").parallelizable(false).build());

        assertThat(advisor.suggestOptimizations(planOf("a", "b")))
                .extracting(OptimizationSuggestion::type)
                .doesNotContain(Type.PARALLELISM);
    }

    @Test
    void shouldSuggestCachingForCacheableTools() throws Exception {
        registry.register(reliableTool("a").cacheEnabled(true).build());
        registry.register(reliableTool("b").dependsOn("a").cacheEnabled(true).build());

        List<OptimizationSuggestion> suggestions = advisor.suggestOptimizations(planOf("b"));

        assertThat(suggestions).hasSize(1);
        assertThat(suggestions.get(0).type()).isEqualTo(Type.PERFORMANCE);
        assertThat(suggestions.get(0).message())
                .isEqualTo("Enable caching for 2 steps to improve performance");
        assertThat(suggestions.get(0).estimatedImpact().costReduction())
                .isCloseTo(1.0, within(1e-9));
    }

    @Test
    void shouldSuggestCostReductionForExpensiveOutliers() throws Exception {
        registry.register(reliableTool("a").parallelizable(false).build());
        registry.register(reliableTool("b").parallelizable(false).build());
        registry.register(reliableTool("c").parallelizable(false).build());
        registry.register(
                reliableTool("d").parallelizable(false).costPerExecution(0.5).build());

        List<OptimizationSuggestion> suggestions =
                advisor.suggestOptimizations(planOf("a", "b", "c", "d"));

        assertThat(suggestions).hasSize(1);
        OptimizationSuggestion suggestion = suggestions.get(0);
        assertThat(suggestion.type()).isEqualTo(Type.COST);
        assertThat(suggestion.difficulty()).isEqualTo(Difficulty.MEDIUM);
        assertThat(suggestion.message())
                .isEqualTo("Optimize 1 high-cost steps through alternative approaches");
        assertThat(suggestion.estimatedImpact().costReduction()).isCloseTo(0.15, within(1e-9));
    }

    @Test
    void shouldSuggestFallbacksAndFlagPlanReliability() throws Exception {
        registry.register(ToolDefinition.builder("flaky").reliability(0.5).build());

        List<OptimizationSuggestion> suggestions = advisor.suggestOptimizations(planOf("flaky"));

        assertThat(suggestions)
                .extracting(OptimizationSuggestion::message)
                .containsExactly(
                        "Estimated plan reliability 0.50 is below the required 0.90",
                        "Add fallback strategies for 1 potentially unreliable steps");
        assertThat(suggestions).allMatch(s -> s.type() == Type.RELIABILITY);
    }

    @Test
    void shouldUseObservedSuccessRateForReliability() throws Exception {
        registry.register(reliableTool("a").build());
        tracker.recordAttempt("a", Duration.ofMillis(5), 0.01, false);

        assertThat(advisor.suggestOptimizations(planOf("a")))
                .extracting(OptimizationSuggestion::type)
                .containsOnly(Type.RELIABILITY);
    }

    @Test
    void shouldRankByImpactScore() throws Exception {
        registry.register(
                reliableTool("a")
                        .cacheEnabled(true)
                        .estimatedDuration(Duration.ofMillis(1000))
                        .build());
        registry.register(reliableTool("b").estimatedDuration(Duration.ofMillis(1000)).build());

        List<OptimizationSuggestion> suggestions =
                advisor.suggestOptimizations(planOf("a", "b"));

        assertThat(suggestions)
                .extracting(OptimizationSuggestion::type)
                .containsExactly(Type.PARALLELISM, Type.PERFORMANCE);
        assertThat(suggestions)
                .extracting(s -> s.estimatedImpact().score())
                .isSortedAccordingTo((x, y) -> Double.compare(y, x));
    }
}
