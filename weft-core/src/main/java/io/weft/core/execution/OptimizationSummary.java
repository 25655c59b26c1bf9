package io.weft.core.execution;

import java.util.List;

/// Optimization figures of one plan run.
///
/// @param parallelSteps steps that ran in a group of more than one step
/// @param cacheHits steps served from the cache
/// @param skippedSteps steps that succeeded without producing output
/// @param cascadeSkippedSteps steps not run because a dependency did not succeed
/// @param bottlenecks human-readable bottleneck descriptions, never null
public record OptimizationSummary(
        int parallelSteps,
        int cacheHits,
        int skippedSteps,
        int cascadeSkippedSteps,
        List<String> bottlenecks) {

    public OptimizationSummary {
        bottlenecks = bottlenecks != null ? List.copyOf(bottlenecks) : List.of();
    }

    /// Returns an all-zero summary.
    ///
    /// @return empty summary, never null
    public static OptimizationSummary empty() {
        return new OptimizationSummary(0, 0, 0, 0, List.of());
    }
}
