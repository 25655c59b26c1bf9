package io.weft.core.plan;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/// An ordered, grouped sequence of steps derived from a set of tool requests.
///
/// Plans are created by {@link io.weft.core.ToolChainCoordinator#createPlan} and
/// are immutable afterwards; the same plan may be executed any number of times.
///
/// ### Contracts
/// - **Precondition**: `id`, `name` and `steps` must not be null
/// - **Invariant**: steps are ordered by ascending parallel group
/// - **Postcondition**: All fields immutable after construction
///
/// @param id unique plan identifier, not null
/// @param name human-readable plan name, not null
/// @param description plan description, never null after construction
/// @param steps ordered steps, never null
/// @param optimization execution switches, never null after construction
/// @param constraints resolved constraints, never null after construction
/// @param createdAt creation time, never null after construction
/// @param estimatedDuration estimated wall-clock duration, never null after construction
/// @param estimatedCost estimated total cost in USD
/// @see PlanStep for the step shape
public record ExecutionPlan(
        String id,
        String name,
        String description,
        List<PlanStep> steps,
        OptimizationSettings optimization,
        PlanConstraints constraints,
        Instant createdAt,
        Duration estimatedDuration,
        double estimatedCost) {

    public ExecutionPlan {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(steps, "steps must not be null");
        steps = List.copyOf(steps);
        for (int i = 1; i < steps.size(); i++) {
            if (steps.get(i).parallelGroup() < steps.get(i - 1).parallelGroup()) {
                throw new IllegalArgumentException("steps must be ordered by parallel group");
            }
        }
        description = description != null ? description : "";
        optimization = optimization != null ? optimization : OptimizationSettings.defaults();
        constraints = constraints != null ? constraints : PlanConstraints.defaults();
        createdAt = createdAt != null ? createdAt : Instant.now();
        estimatedDuration = estimatedDuration != null ? estimatedDuration : Duration.ZERO;
    }

    /// Generates a fresh plan identifier.
    ///
    /// @return identifier of the form `plan_<uuid>`, never null
    public static String newId() {
        return "plan_" + UUID.randomUUID();
    }

    /// Returns whether the plan contains any step.
    ///
    /// @return true if there is at least one step
    public boolean hasSteps() {
        return !steps.isEmpty();
    }

    /// Returns the steps partitioned by parallel group, in ascending group order.
    ///
    /// Within a group, steps keep their plan order.
    ///
    /// @return list of non-empty groups, never null
    public List<List<PlanStep>> groups() {
        Map<Integer, List<PlanStep>> byGroup = new TreeMap<>();
        for (PlanStep step : steps) {
            byGroup.computeIfAbsent(step.parallelGroup(), g -> new ArrayList<>()).add(step);
        }
        List<List<PlanStep>> groups = new ArrayList<>(byGroup.size());
        byGroup.values().forEach(group -> groups.add(List.copyOf(group)));
        return List.copyOf(groups);
    }

    /// Returns the number of distinct parallel groups.
    ///
    /// @return group count
    public int groupCount() {
        return (int) steps.stream().mapToInt(PlanStep::parallelGroup).distinct().count();
    }

    /// Finds the step running the given tool.
    ///
    /// @param toolName tool identifier, not null
    /// @return the step if present, empty otherwise
    public Optional<PlanStep> stepFor(String toolName) {
        return steps.stream().filter(s -> s.toolName().equals(toolName)).findFirst();
    }

    /// Returns a copy with different optimization settings.
    ///
    /// @param settings new settings, not null
    /// @return new plan with the same id, never null
    public ExecutionPlan withOptimization(OptimizationSettings settings) {
        return new ExecutionPlan(
                id,
                name,
                description,
                steps,
                settings,
                constraints,
                createdAt,
                estimatedDuration,
                estimatedCost);
    }
}
