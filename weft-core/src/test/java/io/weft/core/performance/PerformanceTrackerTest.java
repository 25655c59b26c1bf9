package io.weft.core.performance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.weft.core.execution.ExecutionResult;
import io.weft.core.execution.OptimizationSummary;
import io.weft.core.execution.StepResult;
import io.weft.core.performance.PerformanceMetrics.BottleneckTool;
import io.weft.core.performance.PerformanceMetrics.TrendAnalysis;
import io.weft.core.tool.ToolDefinition;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PerformanceTrackerTest {

    private PerformanceTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new PerformanceTracker(100, true);
    }

    private static StepResult step(String tool, long millis) {
        return StepResult.success("step_" + tool, tool, "out", Duration.ofMillis(millis), 0.0, 0);
    }

    private static ExecutionResult run(
            String planId,
            boolean success,
            long millis,
            double cost,
            int parallelSteps,
            List<StepResult> steps) {
        int cacheHits = (int) steps.stream().filter(StepResult::cacheHit).count();
        return new ExecutionResult(
                planId,
                success,
                Duration.ofMillis(millis),
                cost,
                steps,
                new OptimizationSummary(parallelSteps, cacheHits, 0, 0, List.of()),
                List.of());
    }

    @Nested
    class Profiles {

        @Test
        void shouldSeedProfileFromDeclaredEstimates() {
            tracker.initializeProfile(
                    ToolDefinition.builder("fetch")
                            .estimatedDuration(Duration.ofMillis(800))
                            .reliability(0.97)
                            .build());

            PerformanceProfile profile = tracker.getProfile("fetch").orElseThrow();
            assertThat(profile.averageDuration()).isEqualTo(800.0);
            assertThat(profile.successRate()).isEqualTo(0.97);
            assertThat(profile.hasSamples()).isFalse();
            assertThat(tracker.successRate("fetch", 0.1)).isEqualTo(0.1);
        }

        @Test
        void shouldReplaceEstimatesWithFirstObservationThenAverage() {
            tracker.initializeProfile(ToolDefinition.simple("fetch"));

            tracker.recordAttempt("fetch", Duration.ofMillis(200), 0.02, true);
            tracker.recordAttempt("fetch", Duration.ofMillis(400), 0.04, false);

            PerformanceProfile profile = tracker.getProfile("fetch").orElseThrow();
            assertThat(profile.sampleCount()).isEqualTo(2);
            assertThat(profile.averageDuration()).isCloseTo(300.0, within(1e-9));
            assertThat(profile.averageCost()).isCloseTo(0.03, within(1e-9));
            assertThat(profile.successRate()).isCloseTo(0.5, within(1e-9));
            assertThat(tracker.successRate("fetch", 1.0)).isCloseTo(0.5, within(1e-9));
        }

        @Test
        void shouldConvergeToObservedMean() {
            tracker.initializeProfile(
                    ToolDefinition.builder("fetch")
                            .estimatedDuration(Duration.ofSeconds(10))
                            .build());

            for (int i = 0; i < 50; i++) {
                tracker.recordAttempt("fetch", Duration.ofMillis(i % 2 == 0 ? 100 : 300), 0, true);
            }

            assertThat(tracker.getProfile("fetch").orElseThrow().averageDuration())
                    .isCloseTo(200.0, within(1e-6));
        }

        @Test
        void shouldCreateProfileForUnregisteredTool() {
            tracker.recordAttempt("adhoc", Duration.ofMillis(10), 0, true);

            assertThat(tracker.getProfiles()).containsKey("adhoc");
        }

        @Test
        void shouldIgnoreObservationsWhenLearningIsDisabled() {
            PerformanceTracker frozen = new PerformanceTracker(10, false);
            frozen.initializeProfile(ToolDefinition.simple("fetch"));

            frozen.recordAttempt("fetch", Duration.ofMillis(10), 0, false);

            assertThat(frozen.getProfile("fetch").orElseThrow().hasSamples()).isFalse();
            assertThat(frozen.isLearningEnabled()).isFalse();
        }
    }

    @Nested
    class History {

        @Test
        void shouldKeepOnlyMostRecentRuns() {
            PerformanceTracker bounded = new PerformanceTracker(3, true);
            for (int i = 1; i <= 5; i++) {
                bounded.recordExecution(run("p" + i, true, 10, 0, 0, List.of()));
            }

            assertThat(bounded.getHistory())
                    .extracting(ExecutionRecord::planId)
                    .containsExactly("p3", "p4", "p5");
        }

        @Test
        void shouldRejectNonPositiveLimit() {
            assertThatThrownBy(() -> new PerformanceTracker(0, true))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldClearProfilesAndHistory() {
            tracker.initializeProfile(ToolDefinition.simple("fetch"));
            tracker.recordExecution(run("p", true, 10, 0, 0, List.of()));

            tracker.clear();

            assertThat(tracker.getProfiles()).isEmpty();
            assertThat(tracker.getHistory()).isEmpty();
            assertThat(tracker.getMetrics()).isEqualTo(PerformanceMetrics.empty());
        }

        @Test
        void shouldExportSnapshot() {
            tracker.initializeProfile(ToolDefinition.simple("fetch"));
            tracker.recordExecution(run("p", true, 10, 0, 0, List.of(step("fetch", 10))));

            PerformanceExport export = tracker.export();

            assertThat(export.profiles()).containsOnlyKeys("fetch");
            assertThat(export.history()).hasSize(1);
            assertThat(export.metrics().totalExecutions()).isEqualTo(1);
        }
    }

    @Nested
    class Metrics {

        @BeforeEach
        void recordRuns() {
            tracker.recordExecution(
                    run("p1", true, 1000, 0.2, 2, List.of(step("a", 400), step("b", 600))));
            tracker.recordExecution(
                    run("p2", false, 1000, 0.2, 0, List.of(step("a", 400), step("b", 600))));
            tracker.recordExecution(
                    run(
                            "p3",
                            true,
                            500,
                            0.1,
                            0,
                            List.of(StepResult.cacheHit("step_a", "a", "out"), step("b", 450))));
            tracker.recordExecution(
                    run(
                            "p4",
                            true,
                            500,
                            0.1,
                            0,
                            List.of(StepResult.cacheHit("step_a", "a", "out"), step("b", 450))));
        }

        @Test
        void shouldAggregateRates() {
            PerformanceMetrics metrics = tracker.getMetrics();

            assertThat(metrics.totalExecutions()).isEqualTo(4);
            assertThat(metrics.averageDuration()).isCloseTo(750.0, within(1e-9));
            assertThat(metrics.parallelismRate()).isCloseTo(25.0, within(1e-9));
            assertThat(metrics.cacheHitRate()).isCloseTo(25.0, within(1e-9));
            assertThat(metrics.errorRate()).isCloseTo(25.0, within(1e-9));
            assertThat(metrics.costEfficiency()).isCloseTo(5.0, within(1e-9));
        }

        @Test
        void shouldRankBottlenecksByImpact() {
            List<BottleneckTool> bottlenecks = tracker.getMetrics().bottleneckTools();

            assertThat(bottlenecks).extracting(BottleneckTool::toolName).containsExactly("b", "a");
            BottleneckTool b = bottlenecks.get(0);
            assertThat(b.frequency()).isEqualTo(4);
            assertThat(b.averageDuration()).isCloseTo(525.0, within(1e-9));
            assertThat(b.impact()).isCloseTo(2100.0, within(1e-9));
        }

        @Test
        void shouldCompareRecentHalfWithOlderHalf() {
            TrendAnalysis trends = tracker.getMetrics().trends();

            assertThat(trends.performanceImprovement()).isCloseTo(50.0, within(1e-9));
            assertThat(trends.costReduction()).isCloseTo(50.0, within(1e-9));
            assertThat(trends.reliabilityImprovement()).isCloseTo(50.0, within(1e-9));
        }
    }

    @Test
    void shouldReportEmptyMetricsWithoutHistory() {
        assertThat(tracker.getMetrics()).isEqualTo(PerformanceMetrics.empty());
    }

    @Test
    void shouldReportFlatTrendForSingleRun() {
        tracker.recordExecution(run("p", true, 100, 0.1, 0, List.of(step("a", 100))));

        assertThat(tracker.getMetrics().trends()).isEqualTo(TrendAnalysis.flat());
    }

    @Test
    void shouldLimitBottlenecksToTopFive() {
        List<StepResult> steps = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            steps.add(step("t" + i, i * 100L));
        }
        tracker.recordExecution(run("p", true, 2800, 0.0, 0, steps));

        assertThat(tracker.getMetrics().bottleneckTools())
                .hasSize(PerformanceTracker.TOP_BOTTLENECKS)
                .extracting(BottleneckTool::toolName)
                .containsExactly("t7", "t6", "t5", "t4", "t3");
    }
}
