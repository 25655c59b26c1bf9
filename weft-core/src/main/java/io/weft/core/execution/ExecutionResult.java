package io.weft.core.execution;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Outcome of executing an {@link io.weft.core.plan.ExecutionPlan} once.
///
/// `success` is the logical AND of all step results and is only computed after
/// every step of every group has terminated.
///
/// ### Contracts
/// - **Precondition**: `planId` not null
/// - **Postcondition**: All fields immutable after construction
///
/// @param planId identifier of the executed plan, not null
/// @param success whether every step succeeded
/// @param totalDuration wall-clock duration of the run, never null after construction
/// @param totalCost sum of step costs
/// @param stepResults step results in group order, then submission order; never null
/// @param optimization optimization figures, never null after construction
/// @param recommendations advice derived from the run, never null
public record ExecutionResult(
        String planId,
        boolean success,
        Duration totalDuration,
        double totalCost,
        List<StepResult> stepResults,
        OptimizationSummary optimization,
        List<Recommendation> recommendations) {

    public ExecutionResult {
        Objects.requireNonNull(planId, "planId must not be null");
        totalDuration = totalDuration != null ? totalDuration : Duration.ZERO;
        stepResults = stepResults != null ? List.copyOf(stepResults) : List.of();
        optimization = optimization != null ? optimization : OptimizationSummary.empty();
        recommendations = recommendations != null ? List.copyOf(recommendations) : List.of();
    }

    /// Creates the result reported when the engine itself fails mid-run.
    ///
    /// Carries the step results collected so far, zero cost and a single
    /// high-priority reliability recommendation describing the fault.
    ///
    /// @param planId identifier of the plan, not null
    /// @param elapsed time spent before the fault, not null
    /// @param partialResults step results collected before the fault, not null
    /// @param summary optimization figures collected so far, may be null
    /// @param fault the fault, not null
    /// @return failed result, never null
    public static ExecutionResult engineFault(
            String planId,
            Duration elapsed,
            List<StepResult> partialResults,
            OptimizationSummary summary,
            Throwable fault) {
        return new ExecutionResult(
                planId,
                false,
                elapsed,
                0.0,
                partialResults,
                summary,
                List.of(
                        new Recommendation(
                                Recommendation.Type.RELIABILITY,
                                "Execution failed: " + fault,
                                Recommendation.Priority.HIGH)));
    }

    /// Returns the result of the step that ran the given tool.
    ///
    /// @param toolName tool identifier, not null
    /// @return the step result if the tool was part of the run
    public Optional<StepResult> resultFor(String toolName) {
        return stepResults.stream().filter(r -> r.toolName().equals(toolName)).findFirst();
    }

    /// Returns the number of successful steps.
    ///
    /// @return successful step count
    public int successfulStepCount() {
        return (int) stepResults.stream().filter(StepResult::success).count();
    }

    /// Returns the number of failed steps, cascade-skipped steps included.
    ///
    /// @return failed step count
    public int failedStepCount() {
        return (int) stepResults.stream().filter(StepResult::isFailure).count();
    }

    /// Returns the total number of retries across all steps.
    ///
    /// @return retry count
    public int totalRetries() {
        return stepResults.stream().mapToInt(StepResult::retryCount).sum();
    }
}
