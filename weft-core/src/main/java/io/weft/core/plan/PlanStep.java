package io.weft.core.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A single step of an {@link ExecutionPlan}.
///
/// ### Contracts
/// - **Precondition**: `stepId` and `toolName` not null; `parallelGroup >= 0`
/// - **Invariant**: within a plan, every dependency of a step sits in a strictly
///   lower parallel group
///
/// @param stepId identifier unique within the plan, not null
/// @param toolName registered tool to invoke, not null
/// @param input input payload, never null after construction
/// @param dependencies names of the tools this step waits for, never null
/// @param parallelGroup group number; steps of a group may run concurrently
/// @param retryPolicy retry behaviour, never null after construction
/// @param expectedOutputs output names the step is expected to produce, never null
public record PlanStep(
        String stepId,
        String toolName,
        Map<String, Object> input,
        List<String> dependencies,
        int parallelGroup,
        RetryPolicy retryPolicy,
        List<String> expectedOutputs) {

    public PlanStep {
        Objects.requireNonNull(stepId, "stepId must not be null");
        Objects.requireNonNull(toolName, "toolName must not be null");
        if (parallelGroup < 0) {
            throw new IllegalArgumentException("parallelGroup must be >= 0");
        }
        input =
                input != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(input))
                        : Map.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.none();
        expectedOutputs = expectedOutputs != null ? List.copyOf(expectedOutputs) : List.of();
    }

    /// Returns a copy with a different retry policy.
    ///
    /// @param policy the new policy, not null
    /// @return new step, never null
    public PlanStep withRetryPolicy(RetryPolicy policy) {
        Objects.requireNonNull(policy, "policy must not be null");
        return new PlanStep(
                stepId, toolName, input, dependencies, parallelGroup, policy, expectedOutputs);
    }

    /// Returns whether the step has no dependencies.
    ///
    /// @return true for root steps
    public boolean isRoot() {
        return dependencies.isEmpty();
    }
}
