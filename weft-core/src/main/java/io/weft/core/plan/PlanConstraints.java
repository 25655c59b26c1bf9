package io.weft.core.plan;

import java.time.Duration;

/// Limits a plan is expected to respect.
///
/// Caller-supplied constraints may leave `maxDuration` and `maxCost` unset
/// (`null`); plan creation fills them with the plan's own estimates via
/// {@link #resolve(Duration, double)}. Exceeding a limit never aborts a run: it
/// produces a recommendation on the {@link io.weft.core.execution.ExecutionResult}.
///
/// ### Contracts
/// - **Precondition**: numeric values must be non-negative; `requiredReliability`
///   in `[0, 1]`
/// - **Postcondition**: All fields immutable after construction
///
/// @param maxDuration maximum total execution time, may be null until resolved
/// @param maxCost maximum total cost in USD, may be null until resolved
/// @param requiredReliability minimum acceptable estimated plan reliability
/// @param defaultRetries retries granted to tools that are not flagged unreliable
public record PlanConstraints(
        Duration maxDuration, Double maxCost, double requiredReliability, int defaultRetries) {

    /// Default reliability floor.
    public static final double DEFAULT_REQUIRED_RELIABILITY = 0.9;

    public PlanConstraints {
        if (maxDuration != null && maxDuration.isNegative()) {
            throw new IllegalArgumentException("maxDuration must not be negative");
        }
        if (maxCost != null && maxCost < 0) {
            throw new IllegalArgumentException("maxCost must be >= 0");
        }
        if (requiredReliability < 0.0 || requiredReliability > 1.0) {
            throw new IllegalArgumentException("requiredReliability must be in [0, 1]");
        }
        if (defaultRetries < 0) {
            throw new IllegalArgumentException("defaultRetries must be >= 0");
        }
    }

    /// Returns unconstrained defaults: limits unset, 0.9 reliability floor, no retries.
    ///
    /// @return default constraints, never null
    public static PlanConstraints defaults() {
        return new PlanConstraints(null, null, DEFAULT_REQUIRED_RELIABILITY, 0);
    }

    /// Returns a copy with unset limits replaced by the given estimates.
    ///
    /// @param estimatedDuration fallback for `maxDuration`, not null
    /// @param estimatedCost fallback for `maxCost`
    /// @return resolved constraints, never null
    public PlanConstraints resolve(Duration estimatedDuration, double estimatedCost) {
        return new PlanConstraints(
                maxDuration != null ? maxDuration : estimatedDuration,
                maxCost != null ? maxCost : estimatedCost,
                requiredReliability,
                defaultRetries);
    }

    public PlanConstraints withMaxDuration(Duration duration) {
        return new PlanConstraints(duration, maxCost, requiredReliability, defaultRetries);
    }

    public PlanConstraints withMaxCost(double cost) {
        return new PlanConstraints(maxDuration, cost, requiredReliability, defaultRetries);
    }

    public PlanConstraints withDefaultRetries(int retries) {
        return new PlanConstraints(maxDuration, maxCost, requiredReliability, retries);
    }
}
