package io.weft.core.performance;

import io.weft.core.execution.ExecutionResult;
import io.weft.core.execution.StepResult;
import io.weft.core.performance.PerformanceMetrics.BottleneckTool;
import io.weft.core.performance.PerformanceMetrics.TrendAnalysis;
import io.weft.core.tool.ToolDefinition;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToDoubleFunction;
import java.util.logging.Logger;

/// Learns per-tool performance and keeps a bounded execution history.
///
/// Two kinds of data are maintained:
/// - **Profiles**, one per tool, updated by the execution engine after every
///   executor attempt (see {@link PerformanceProfile#record})
/// - **History**, an append-only log of {@link ExecutionRecord}s truncated to the
///   most recent `historyLimit` entries
///
/// {@link #getMetrics()} derives the aggregate report from the history on demand.
///
/// ### Learning
/// When learning is disabled, profiles keep their declared estimates; history is
/// still recorded.
///
/// @implNote Thread-safe. Profiles live in a {@link ProfileStore} with atomic
/// per-tool upserts; history access is synchronized on this tracker.
///
/// @see io.weft.core.plan.PlanOptimizer for how profiles steer retry policies
public class PerformanceTracker {

    private static final Logger logger = Logger.getLogger(PerformanceTracker.class.getName());

    /// Number of bottleneck tools reported by {@link #getMetrics()}.
    public static final int TOP_BOTTLENECKS = 5;

    private final ProfileStore profiles = new ProfileStore();
    private final Deque<ExecutionRecord> history = new ArrayDeque<>();
    private final int historyLimit;
    private final boolean learningEnabled;

    /// Creates a tracker.
    ///
    /// @param historyLimit maximum retained history entries, must be positive
    /// @param learningEnabled whether observations update profiles
    public PerformanceTracker(int historyLimit, boolean learningEnabled) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be >= 1");
        }
        this.historyLimit = historyLimit;
        this.learningEnabled = learningEnabled;
    }

    /// Seeds the profile of a newly registered tool from its declared estimates.
    ///
    /// @param tool the tool definition, not null
    public void initializeProfile(ToolDefinition tool) {
        profiles.initialize(tool);
    }

    /// Records one executor attempt.
    ///
    /// @param toolName tool identifier, not null
    /// @param duration observed duration, not null
    /// @param cost observed cost
    /// @param success whether the attempt succeeded
    public void recordAttempt(String toolName, Duration duration, double cost, boolean success) {
        Objects.requireNonNull(duration, "duration must not be null");
        if (!learningEnabled) {
            return;
        }
        PerformanceProfile updated = profiles.record(toolName, duration.toMillis(), cost, success);
        logger.fine(
                () ->
                        "Profile "
                                + toolName
                                + ": avg "
                                + Math.round(updated.averageDuration())
                                + "ms, success "
                                + updated.successRate()
                                + " over "
                                + updated.sampleCount()
                                + " samples");
    }

    /// Returns the profile of a tool.
    ///
    /// @param toolName tool identifier, not null
    /// @return the profile if the tool is known
    public Optional<PerformanceProfile> getProfile(String toolName) {
        return profiles.get(toolName);
    }

    /// Returns the observed success rate of a tool, or the fallback when no
    /// sample has been recorded yet.
    ///
    /// @param toolName tool identifier, not null
    /// @param fallback value used without samples, typically the declared reliability
    /// @return success rate in `[0, 1]`
    public double successRate(String toolName, double fallback) {
        return profiles.get(toolName)
                .filter(PerformanceProfile::hasSamples)
                .map(PerformanceProfile::successRate)
                .orElse(fallback);
    }

    /// Returns a snapshot of all profiles.
    ///
    /// @return profiles keyed by tool name, never null
    public Map<String, PerformanceProfile> getProfiles() {
        return profiles.snapshot();
    }

    /// Appends a run to the history, evicting the oldest entries beyond the limit.
    ///
    /// @param result the run's result, not null
    public void recordExecution(ExecutionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        synchronized (this) {
            history.addLast(new ExecutionRecord(result.planId(), Instant.now(), result));
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
    }

    /// Returns the retained history, oldest first.
    ///
    /// @return immutable copy, never null
    public synchronized List<ExecutionRecord> getHistory() {
        return List.copyOf(history);
    }

    /// Computes the aggregate report over the retained history.
    ///
    /// @return metrics, never null
    public PerformanceMetrics getMetrics() {
        List<ExecutionRecord> executions = getHistory();
        if (executions.isEmpty()) {
            return PerformanceMetrics.empty();
        }

        int total = executions.size();
        double averageDuration =
                executions.stream()
                        .mapToDouble(e -> e.result().totalDuration().toMillis())
                        .average()
                        .orElse(0);

        long totalSteps = 0;
        long parallelSteps = 0;
        long cacheHits = 0;
        double totalCost = 0;
        int failed = 0;
        for (ExecutionRecord record : executions) {
            ExecutionResult result = record.result();
            totalSteps += result.stepResults().size();
            parallelSteps += result.optimization().parallelSteps();
            cacheHits += result.optimization().cacheHits();
            totalCost += result.totalCost();
            if (!result.success()) {
                failed++;
            }
        }

        double parallelismRate = totalSteps > 0 ? parallelSteps * 100.0 / totalSteps : 0;
        double cacheHitRate = totalSteps > 0 ? cacheHits * 100.0 / totalSteps : 0;
        double errorRate = failed * 100.0 / total;
        double costEfficiency = totalCost > 0 ? (total - failed) / totalCost : 0;

        return new PerformanceMetrics(
                total,
                averageDuration,
                parallelismRate,
                cacheHitRate,
                errorRate,
                costEfficiency,
                findBottleneckTools(executions),
                analyzeTrends(executions));
    }

    /// Drops all profiles and history.
    ///
    /// @apiNote **Side effects**: profiles of registered tools are removed too;
    /// the next observation starts a fresh profile.
    public void clear() {
        profiles.clear();
        synchronized (this) {
            history.clear();
        }
    }

    /// Exports profiles, history and metrics.
    ///
    /// @return snapshot, never null
    public PerformanceExport export() {
        return new PerformanceExport(getProfiles(), getHistory(), getMetrics());
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public boolean isLearningEnabled() {
        return learningEnabled;
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static List<BottleneckTool> findBottleneckTools(List<ExecutionRecord> executions) {
        Map<String, long[]> perTool = new LinkedHashMap<>();
        for (ExecutionRecord record : executions) {
            for (StepResult step : record.result().stepResults()) {
                long[] totals = perTool.computeIfAbsent(step.toolName(), k -> new long[2]);
                totals[0] += step.durationMillis();
                totals[1]++;
            }
        }

        List<BottleneckTool> tools = new ArrayList<>(perTool.size());
        perTool.forEach(
                (name, totals) -> {
                    double average = (double) totals[0] / totals[1];
                    tools.add(
                            new BottleneckTool(name, average, (int) totals[1], average * totals[1]));
                });
        tools.sort(Comparator.comparingDouble(BottleneckTool::impact).reversed());
        return tools.size() > TOP_BOTTLENECKS ? tools.subList(0, TOP_BOTTLENECKS) : tools;
    }

    private static TrendAnalysis analyzeTrends(List<ExecutionRecord> executions) {
        int half = executions.size() / 2;
        List<ExecutionRecord> older = executions.subList(0, half);
        List<ExecutionRecord> recent = executions.subList(half, executions.size());
        if (older.isEmpty() || recent.isEmpty()) {
            return TrendAnalysis.flat();
        }
        return new TrendAnalysis(
                reduction(older, recent, r -> r.totalDuration().toMillis()),
                reduction(older, recent, ExecutionResult::totalCost),
                improvement(successRate(older), successRate(recent)));
    }

    private static double reduction(
            List<ExecutionRecord> older,
            List<ExecutionRecord> recent,
            ToDoubleFunction<ExecutionResult> metric) {
        double olderAvg = average(older, metric);
        double recentAvg = average(recent, metric);
        if (olderAvg == 0) {
            return 0;
        }
        return (olderAvg - recentAvg) / olderAvg * 100;
    }

    private static double average(
            List<ExecutionRecord> executions, ToDoubleFunction<ExecutionResult> metric) {
        return executions.stream()
                .mapToDouble(e -> metric.applyAsDouble(e.result()))
                .average()
                .orElse(0);
    }

    private static double improvement(double olderRate, double recentRate) {
        // percentage points
        return (recentRate - olderRate) * 100;
    }

    private static double successRate(List<ExecutionRecord> executions) {
        long succeeded = executions.stream().filter(e -> e.result().success()).count();
        return (double) succeeded / executions.size();
    }
}
