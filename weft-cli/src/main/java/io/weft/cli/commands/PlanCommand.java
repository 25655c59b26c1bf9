package io.weft.cli.commands;

import io.weft.cli.ui.Formats;
import io.weft.core.ToolChainCoordinator;
import io.weft.core.plan.ExecutionPlan;
import io.weft.core.plan.PlanStep;
import io.weft.core.plan.RetryPolicy;
import io.weft.serialization.WeftSerializer;
import java.util.List;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;

/// Prints the execution plan built from a catalog without running it.
///
/// Lists the parallel groups in execution order with each step's dependencies
/// and retry policy, followed by the plan estimates.
@Command(
        name = "plan",
        mixinStandardHelpOptions = true,
        description = "Show the execution plan for a tool catalog")
class PlanCommand extends CatalogCommand {

    @Override
    protected int execute(ToolChainCoordinator coordinator, ExecutionPlan plan) {
        if (json) {
            out.println(WeftSerializer.planToJson(plan));
            return EXIT_OK;
        }

        out.println(styles.bold("Plan " + plan.name()) + " " + styles.gray(plan.id()));
        if (!plan.description().isBlank()) {
            out.println("  " + plan.description());
        }
        out.println();

        List<List<PlanStep>> groups = plan.groups();
        for (int i = 0; i < groups.size(); i++) {
            List<PlanStep> group = groups.get(i);
            String mode = group.size() > 1 ? styles.accent("parallel") : styles.gray("sequential");
            out.printf("Group %d (%s)%n", i + 1, mode);
            for (PlanStep step : group) {
                out.printf(
                        "  %s %s %s%n",
                        styles.bullet(), styles.bold(step.toolName()), styles.gray(step.stepId()));
                if (!step.dependencies().isEmpty()) {
                    out.printf("      after   %s%n", String.join(", ", step.dependencies()));
                }
                out.printf("      retries %s%n", describe(step.retryPolicy()));
            }
        }

        out.println();
        out.printf(
                "Estimated %s, %s; timeout %s%n",
                Formats.duration(plan.estimatedDuration()),
                Formats.cost(plan.estimatedCost()),
                Formats.duration(plan.optimization().timeout()));
        out.printf(
                "Limits    %s, %s, reliability %s%n",
                Formats.duration(plan.constraints().maxDuration()),
                plan.constraints().maxCost() != null
                        ? Formats.cost(plan.constraints().maxCost())
                        : "-",
                Formats.fraction(plan.constraints().requiredReliability()));
        return EXIT_OK;
    }

    static String describe(RetryPolicy policy) {
        if (policy.maxRetries() == 0) {
            return "none";
        }
        String kinds =
                policy.retryOn().stream()
                        .map(Enum::name)
                        .sorted()
                        .collect(Collectors.joining(", "));
        return policy.maxRetries() + " every " + Formats.duration(policy.backoff()) + " on " + kinds;
    }
}
