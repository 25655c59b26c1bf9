package io.weft.core.plan;

import io.weft.core.performance.PerformanceTracker;
import io.weft.core.plan.OptimizationSuggestion.Difficulty;
import io.weft.core.plan.OptimizationSuggestion.EstimatedImpact;
import io.weft.core.plan.OptimizationSuggestion.Type;
import io.weft.core.tool.ToolDefinition;
import io.weft.core.tool.ToolRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// Produces {@link OptimizationSuggestion}s for a plan.
///
/// Four analyses run over the plan's steps:
/// - **Parallelism**: parallelizable steps that share a group with another step
/// - **Performance**: steps whose tool allows caching
/// - **Cost**: steps costing more than twice the plan's average step cost
/// - **Reliability**: steps whose tool has a declared or observed success rate
///   below the threshold, and plans whose estimated reliability is below the
///   required reliability
///
/// Suggestions are returned sorted by {@link OptimizationSuggestion#BY_IMPACT}.
/// Steps whose tool is no longer registered are ignored.
public class PlanAdvisor {

    private final ToolRegistry registry;
    private final PerformanceTracker tracker;
    private final PlanOptimizer optimizer;
    private final double reliabilityThreshold;

    public PlanAdvisor(
            ToolRegistry registry,
            PerformanceTracker tracker,
            PlanOptimizer optimizer,
            double reliabilityThreshold) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
        this.reliabilityThreshold = reliabilityThreshold;
    }

    /// Analyzes a plan and returns ranked suggestions.
    ///
    /// @param plan the plan to analyze, not null
    /// @return suggestions sorted by descending impact, never null (may be empty)
    public List<OptimizationSuggestion> suggestOptimizations(ExecutionPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        List<OptimizationSuggestion> suggestions = new ArrayList<>();
        if (!plan.hasSteps()) {
            return suggestions;
        }

        suggestParallelism(plan).ifPresent(suggestions::add);
        suggestCaching(plan).ifPresent(suggestions::add);
        suggestCostReduction(plan).ifPresent(suggestions::add);
        suggestions.addAll(suggestReliability(plan));

        suggestions.sort(OptimizationSuggestion.BY_IMPACT);
        return suggestions;
    }

    private Optional<OptimizationSuggestion> suggestParallelism(ExecutionPlan plan) {
        Map<Integer, Long> groupSizes =
                plan.steps().stream()
                        .collect(
                                Collectors.groupingBy(
                                        PlanStep::parallelGroup, Collectors.counting()));
        List<ToolDefinition> parallelizable =
                plan.steps().stream()
                        .filter(step -> groupSizes.get(step.parallelGroup()) > 1)
                        .map(step -> registry.get(step.toolName()))
                        .flatMap(Optional::stream)
                        .filter(ToolDefinition::parallelizable)
                        .toList();
        if (parallelizable.size() < 2) {
            return Optional.empty();
        }

        long total = 0;
        long slowest = 0;
        for (ToolDefinition tool : parallelizable) {
            long millis = tool.estimatedDuration().toMillis();
            total += millis;
            slowest = Math.max(slowest, millis);
        }
        double saving = total > 0 ? (double) (total - slowest) / total * 100 : 0;
        return Optional.of(
                new OptimizationSuggestion(
                        Type.PARALLELISM,
                        parallelizable.size()
                                + " steps can be parallelized to reduce execution time",
                        new EstimatedImpact(saving, 0, 0),
                        Difficulty.LOW));
    }

    private Optional<OptimizationSuggestion> suggestCaching(ExecutionPlan plan) {
        long cacheable = tools(plan).stream().filter(ToolDefinition::cacheEnabled).count();
        if (cacheable == 0) {
            return Optional.empty();
        }
        return Optional.of(
                new OptimizationSuggestion(
                        Type.PERFORMANCE,
                        "Enable caching for " + cacheable + " steps to improve performance",
                        new EstimatedImpact(cacheable * 0.3, cacheable * 0.5, 0),
                        Difficulty.LOW));
    }

    private Optional<OptimizationSuggestion> suggestCostReduction(ExecutionPlan plan) {
        List<ToolDefinition> tools = tools(plan);
        double averageCost =
                tools.stream().mapToDouble(ToolDefinition::costPerExecution).average().orElse(0);
        List<ToolDefinition> expensive =
                tools.stream().filter(tool -> tool.costPerExecution() > averageCost * 2).toList();
        if (expensive.isEmpty()) {
            return Optional.empty();
        }
        double expensiveCost =
                expensive.stream().mapToDouble(ToolDefinition::costPerExecution).sum();
        return Optional.of(
                new OptimizationSuggestion(
                        Type.COST,
                        "Optimize "
                                + expensive.size()
                                + " high-cost steps through alternative approaches",
                        new EstimatedImpact(0, expensiveCost * 0.3, 0),
                        Difficulty.MEDIUM));
    }

    private List<OptimizationSuggestion> suggestReliability(ExecutionPlan plan) {
        List<OptimizationSuggestion> suggestions = new ArrayList<>(2);

        long unreliable =
                tools(plan).stream()
                        .filter(
                                tool ->
                                        tracker.successRate(tool.name(), tool.reliability())
                                                < reliabilityThreshold)
                        .count();
        if (unreliable > 0) {
            suggestions.add(
                    new OptimizationSuggestion(
                            Type.RELIABILITY,
                            "Add fallback strategies for "
                                    + unreliable
                                    + " potentially unreliable steps",
                            new EstimatedImpact(0, 0, 0.15),
                            Difficulty.MEDIUM));
        }

        double estimated = optimizer.estimateReliability(plan.steps(), registry);
        double required = plan.constraints().requiredReliability();
        if (estimated < required) {
            suggestions.add(
                    new OptimizationSuggestion(
                            Type.RELIABILITY,
                            String.format(
                                    Locale.ROOT,
                                    "Estimated plan reliability %.2f is below the required %.2f",
                                    estimated, required),
                            new EstimatedImpact(0, 0, required - estimated),
                            Difficulty.MEDIUM));
        }
        return suggestions;
    }

    private List<ToolDefinition> tools(ExecutionPlan plan) {
        return plan.steps().stream()
                .map(PlanStep::toolName)
                .map(registry::get)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }
}
