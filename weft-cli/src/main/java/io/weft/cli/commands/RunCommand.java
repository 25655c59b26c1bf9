package io.weft.cli.commands;

import io.weft.cli.execution.VerboseExecutionListener;
import io.weft.cli.ui.Formats;
import io.weft.core.ToolChainCoordinator;
import io.weft.core.WeftConfig;
import io.weft.core.execution.ExecutionResult;
import io.weft.core.execution.OptimizationSummary;
import io.weft.core.execution.Recommendation;
import io.weft.core.execution.StepResult;
import io.weft.core.performance.PerformanceMetrics;
import io.weft.core.plan.ExecutionPlan;
import io.weft.serialization.WeftSerializer;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

/// Runs the tool chain described by a catalog on the simulated executor.
///
/// Each run prints its step results, the optimization summary and the
/// recommendations. With `--repeat` the plan runs several times in the same
/// environment, so later runs reuse cached outputs and learned profiles; the
/// aggregate performance metrics follow the last run.
///
/// ### Usage
/// ```
/// weft run catalog.json --repeat 5 --seed 7
/// weft run catalog.json --json --no-cache
/// ```
@Command(
        name = "run",
        mixinStandardHelpOptions = true,
        description = "Execute a tool catalog with the simulated executor")
class RunCommand extends CatalogCommand {

    @Option(
            names = "--repeat",
            defaultValue = "1",
            description = "Number of times to run the plan (default: ${DEFAULT-VALUE})")
    int repeat;

    @Option(names = "--no-cache", description = "Disable output caching")
    boolean noCache;

    @Option(
            names = "--sequential",
            description = "Run every step on the calling thread, one at a time")
    boolean sequential;

    @Option(
            names = "--no-predictive",
            description = "Use the catalog's default retries instead of learned retry policies")
    boolean noPredictive;

    @Override
    protected void configure(WeftConfig config) {
        if (repeat < 1) {
            throw new ParameterException(
                    spec.commandLine(), "--repeat must be at least 1, was " + repeat);
        }
        if (noCache) {
            config.setCachingEnabled(false);
        }
        if (noPredictive) {
            config.setPredictiveOptimization(false);
        }
    }

    @Override
    protected int execute(ToolChainCoordinator coordinator, ExecutionPlan plan) {
        ExecutionPlan runnable =
                sequential ? plan.withOptimization(plan.optimization().withParallel(false)) : plan;
        if (verbose && !json) {
            coordinator.addListener(new VerboseExecutionListener(out, styles));
        }

        List<ExecutionResult> results = new ArrayList<>();
        for (int run = 1; run <= repeat; run++) {
            ExecutionResult result = coordinator.executePlan(runnable);
            results.add(result);
            if (!json) {
                if (repeat > 1) {
                    out.println(styles.bold("Run " + run + "/" + repeat));
                }
                printResult(runnable, result);
            }
        }

        if (json) {
            out.println(
                    results.size() == 1
                            ? WeftSerializer.resultToJson(results.get(0))
                            : WeftSerializer.toJson(results));
        } else if (repeat > 1) {
            printMetrics(coordinator.getPerformanceMetrics());
        }

        boolean allSucceeded = results.stream().allMatch(ExecutionResult::success);
        return allSucceeded ? EXIT_OK : EXIT_FAILED;
    }

    private void printResult(ExecutionPlan plan, ExecutionResult result) {
        out.printf(
                "%s %s%n",
                styles.bold(plan.name()),
                styles.gray(
                        "(" + plan.steps().size() + " steps, " + plan.groupCount() + " groups)"));

        for (StepResult step : result.stepResults()) {
            String detail;
            if (step.skipped()) {
                detail = styles.warn("skipped");
            } else if (!step.success()) {
                detail = styles.error(step.error());
            } else if (step.cacheHit()) {
                detail = styles.accent("cached");
            } else {
                detail = Formats.duration(step.duration()) + " " + Formats.cost(step.cost());
            }
            String retries =
                    step.retryCount() > 0 ? styles.gray(" retries=" + step.retryCount()) : "";
            out.printf(
                    "  %s %-24s %s%s%n",
                    styles.stepMarker(step), step.toolName(), detail, retries);
        }

        String status = result.success() ? "SUCCESS" : "FAILED";
        out.printf(
                "%s in %s, cost %s%n",
                styles.successOrError(status, result.success()),
                Formats.duration(result.totalDuration()),
                Formats.cost(result.totalCost()));

        OptimizationSummary summary = result.optimization();
        out.printf(
                "  parallel steps %d, cache hits %d, skipped %d%n",
                summary.parallelSteps(), summary.cacheHits(), summary.skippedSteps());
        if (!summary.bottlenecks().isEmpty()) {
            out.printf("  bottlenecks %s%n", String.join(", ", summary.bottlenecks()));
        }

        if (!result.recommendations().isEmpty()) {
            out.println("Recommendations");
            for (Recommendation recommendation : result.recommendations()) {
                out.printf(
                        "  %s [%s] %s: %s%n",
                        styles.bullet(),
                        styles.priority(recommendation.priority()),
                        recommendation.type(),
                        recommendation.message());
            }
        }
        out.println();
    }

    private void printMetrics(PerformanceMetrics metrics) {
        out.println(styles.bold("Performance over " + metrics.totalExecutions() + " runs"));
        out.printf("  average duration  %s%n", Formats.millis(metrics.averageDuration()));
        out.printf("  parallelism       %s%n", Formats.percent(metrics.parallelismRate()));
        out.printf("  cache hit rate    %s%n", Formats.percent(metrics.cacheHitRate()));
        out.printf("  error rate        %s%n", Formats.percent(metrics.errorRate()));
        out.printf("  cost efficiency   %s runs/USD%n", Formats.decimal(metrics.costEfficiency()));
        for (PerformanceMetrics.BottleneckTool tool : metrics.bottleneckTools()) {
            out.printf(
                    "  %s %s avg %s x%d%n",
                    styles.bullet(),
                    tool.toolName(),
                    Formats.millis(tool.averageDuration()),
                    tool.frequency());
        }
    }
}
