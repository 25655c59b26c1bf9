package io.weft.core.performance;

import java.util.List;

/// Aggregate report over the retained execution history.
///
/// Rates are percentages in `[0, 100]`.
///
/// @param totalExecutions number of retained runs
/// @param averageDuration mean run duration in milliseconds
/// @param parallelismRate steps run in parallel groups, as a percentage of all steps
/// @param cacheHitRate cache hits as a percentage of all steps
/// @param errorRate failed runs as a percentage of all runs
/// @param costEfficiency successful runs per USD spent (0 when nothing was spent)
/// @param bottleneckTools up to five tools with the largest total time impact
/// @param trends comparison of the older and newer half of the history
public record PerformanceMetrics(
        int totalExecutions,
        double averageDuration,
        double parallelismRate,
        double cacheHitRate,
        double errorRate,
        double costEfficiency,
        List<BottleneckTool> bottleneckTools,
        TrendAnalysis trends) {

    public PerformanceMetrics {
        bottleneckTools = bottleneckTools != null ? List.copyOf(bottleneckTools) : List.of();
        trends = trends != null ? trends : TrendAnalysis.flat();
    }

    /// Returns the report of an empty history.
    ///
    /// @return all-zero metrics, never null
    public static PerformanceMetrics empty() {
        return new PerformanceMetrics(0, 0, 0, 0, 0, 0, List.of(), TrendAnalysis.flat());
    }

    /// Time impact of one tool across the history.
    ///
    /// @param toolName tool identifier
    /// @param averageDuration mean step duration in milliseconds
    /// @param frequency number of steps that ran the tool
    /// @param impact total time impact (`averageDuration × frequency`)
    public record BottleneckTool(
            String toolName, double averageDuration, int frequency, double impact) {}

    /// Percentage change from the older half of the history to the newer half.
    ///
    /// Positive values are improvements: shorter runs, cheaper runs, higher
    /// success rate.
    ///
    /// @param performanceImprovement change of mean run duration
    /// @param costReduction change of mean run cost
    /// @param reliabilityImprovement change of run success rate
    public record TrendAnalysis(
            double performanceImprovement, double costReduction, double reliabilityImprovement) {

        public static TrendAnalysis flat() {
            return new TrendAnalysis(0, 0, 0);
        }
    }
}
