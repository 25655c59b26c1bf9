package io.weft.cli.execution;

import io.weft.cli.ui.AnsiStyles;
import io.weft.cli.ui.Formats;
import io.weft.core.execution.ExecutionListener;
import io.weft.core.execution.ExecutionResult;
import io.weft.core.execution.StepResult;
import io.weft.core.plan.ExecutionPlan;
import io.weft.core.plan.PlanStep;
import java.io.PrintWriter;
import java.util.List;
import java.util.stream.Collectors;

/// Prints execution progress as it happens.
///
/// ### Output Format
/// ```
/// ▶ digest (plan_1f3a...)
///   group 1 → fetch
///     ✓ fetch 120ms
///   group 2 → summarize, translate
///     ✗ summarize Simulated failure for summarize (2 retries)
///     − translate skipped
/// ■ digest FAILED in 1.52s
/// ```
///
/// @implNote Thread-safe. Steps of a parallel group complete on worker threads;
/// each callback prints under the writer's lock so lines never interleave.
public class VerboseExecutionListener implements ExecutionListener {

    private final PrintWriter out;
    private final AnsiStyles styles;

    /// Creates a listener.
    ///
    /// @param out writer for progress lines, not null
    /// @param styles output styling, not null
    public VerboseExecutionListener(PrintWriter out, AnsiStyles styles) {
        this.out = out;
        this.styles = styles;
    }

    @Override
    public void onPlanStarted(ExecutionPlan plan) {
        print(
                styles.accent("▶")
                        + " "
                        + styles.bold(plan.name())
                        + " "
                        + styles.gray("(" + plan.id() + ")"));
    }

    @Override
    public void onGroupStarted(ExecutionPlan plan, int groupNumber, List<PlanStep> steps) {
        String tools = steps.stream().map(PlanStep::toolName).collect(Collectors.joining(", "));
        print("  group " + groupNumber + " " + styles.arrow() + " " + tools);
    }

    @Override
    public void onStepCompleted(ExecutionPlan plan, PlanStep step, StepResult result) {
        StringBuilder line =
                new StringBuilder("    ")
                        .append(styles.stepMarker(result))
                        .append(' ')
                        .append(result.toolName())
                        .append(' ');
        if (result.skipped()) {
            line.append(styles.warn("skipped"));
        } else if (result.success()) {
            line.append(styles.gray(Formats.duration(result.duration())));
            if (result.cacheHit()) {
                line.append(' ').append(styles.accent("cached"));
            }
        } else {
            line.append(styles.error(result.error()));
        }
        if (result.retryCount() > 0) {
            line.append(styles.gray(" (" + result.retryCount() + " retries)"));
        }
        print(line.toString());
    }

    @Override
    public void onPlanCompleted(ExecutionPlan plan, ExecutionResult result) {
        String status =
                styles.successOrError(result.success() ? "SUCCESS" : "FAILED", result.success());
        print("■ " + plan.name() + " " + status + " in " + Formats.duration(result.totalDuration()));
    }

    private void print(String line) {
        synchronized (out) {
            out.println(line);
            out.flush();
        }
    }
}
