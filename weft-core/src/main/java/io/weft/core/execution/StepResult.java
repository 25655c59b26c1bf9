package io.weft.core.execution;

import java.time.Duration;
import java.util.Objects;

/// Outcome of one step in one plan run.
///
/// Produced exactly once per executed step and never mutated afterwards.
///
/// ### Contracts
/// - **Precondition**: `stepId` and `toolName` not null; `retryCount >= 0`
/// - **Postcondition**: All fields immutable after construction
///
/// @param stepId the plan step that produced this result, not null
/// @param toolName the tool that was (or would have been) invoked, not null
/// @param success whether the step succeeded
/// @param duration wall-clock time of the step including backoff, never null after construction
/// @param cost monetary cost charged for the step (0 on cache hits and failures)
/// @param output tool output if successful, may be null
/// @param error error message if failed, may be null
/// @param retryCount retries performed after the first attempt
/// @param cacheHit whether the output came from the cache
/// @param skipped whether the step was not run because a dependency did not succeed
/// @param attempts executor invocations made for this step
public record StepResult(
        String stepId,
        String toolName,
        boolean success,
        Duration duration,
        double cost,
        Object output,
        String error,
        int retryCount,
        boolean cacheHit,
        boolean skipped,
        int attempts) {

    /// Synthetic duration reported for cache hits.
    public static final Duration CACHE_ACCESS_TIME = Duration.ofMillis(50);

    public StepResult {
        Objects.requireNonNull(stepId, "stepId must not be null");
        Objects.requireNonNull(toolName, "toolName must not be null");
        duration = duration != null ? duration : Duration.ZERO;
        if (retryCount < 0 || attempts < 0) {
            throw new IllegalArgumentException("retryCount and attempts must be >= 0");
        }
    }

    /// Creates a successful result from an executor invocation.
    public static StepResult success(
            String stepId,
            String toolName,
            Object output,
            Duration duration,
            double cost,
            int retryCount) {
        return new StepResult(
                stepId, toolName, true, duration, cost, output, null, retryCount, false, false,
                retryCount + 1);
    }

    /// Creates a successful result served from the cache.
    public static StepResult cacheHit(String stepId, String toolName, Object output) {
        return new StepResult(
                stepId, toolName, true, CACHE_ACCESS_TIME, 0.0, output, null, 0, true, false, 0);
    }

    /// Creates a failed result after the final attempt.
    public static StepResult failure(
            String stepId, String toolName, String error, Duration duration, int retryCount) {
        return new StepResult(
                stepId, toolName, false, duration, 0.0, null, error, retryCount, false, false,
                retryCount + 1);
    }

    /// Creates a result for a step that was not run because a dependency did not succeed.
    public static StepResult skipped(String stepId, String toolName, String failedDependency) {
        return new StepResult(
                stepId,
                toolName,
                false,
                Duration.ZERO,
                0.0,
                null,
                "Skipped: dependency '" + failedDependency + "' did not succeed",
                0,
                false,
                true,
                0);
    }

    /// Returns whether the step failed.
    ///
    /// @return true if not successful
    public boolean isFailure() {
        return !success;
    }

    /// Returns the duration in milliseconds.
    ///
    /// @return duration millis
    public long durationMillis() {
        return duration.toMillis();
    }
}
