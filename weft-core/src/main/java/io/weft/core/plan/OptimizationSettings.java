package io.weft.core.plan;

import java.time.Duration;

/// Execution-time optimization switches of an {@link ExecutionPlan}.
///
/// @param parallelEnabled whether steps of one group may run concurrently
/// @param cachingEnabled whether cached outputs may be reused and new ones stored
/// @param targetDuration duration the run should stay under; exceeding it yields a
///        performance recommendation, never null after construction
/// @param maxConcurrentSteps upper bound of concurrently running steps, at least 1
/// @param timeout advisory plan timeout; not enforced by the engine, never null after construction
public record OptimizationSettings(
        boolean parallelEnabled,
        boolean cachingEnabled,
        Duration targetDuration,
        int maxConcurrentSteps,
        Duration timeout) {

    /// Default target duration.
    public static final Duration DEFAULT_TARGET = Duration.ofSeconds(30);

    /// Default concurrency bound.
    public static final int DEFAULT_MAX_CONCURRENT = 5;

    public OptimizationSettings {
        targetDuration = targetDuration != null ? targetDuration : DEFAULT_TARGET;
        timeout = timeout != null ? timeout : Duration.ofSeconds(60);
        if (maxConcurrentSteps < 1) {
            throw new IllegalArgumentException("maxConcurrentSteps must be >= 1");
        }
    }

    /// Returns defaults: parallel and caching on, 30s target, 5 concurrent steps, 60s timeout.
    ///
    /// @return default settings, never null
    public static OptimizationSettings defaults() {
        return new OptimizationSettings(
                true, true, DEFAULT_TARGET, DEFAULT_MAX_CONCURRENT, Duration.ofSeconds(60));
    }

    public OptimizationSettings withCaching(boolean enabled) {
        return new OptimizationSettings(
                parallelEnabled, enabled, targetDuration, maxConcurrentSteps, timeout);
    }

    public OptimizationSettings withParallel(boolean enabled) {
        return new OptimizationSettings(
                enabled, cachingEnabled, targetDuration, maxConcurrentSteps, timeout);
    }

    public OptimizationSettings withTargetDuration(Duration target) {
        return new OptimizationSettings(
                parallelEnabled, cachingEnabled, target, maxConcurrentSteps, timeout);
    }
}
