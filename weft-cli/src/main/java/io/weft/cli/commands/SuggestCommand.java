package io.weft.cli.commands;

import io.weft.cli.ui.Formats;
import io.weft.core.ToolChainCoordinator;
import io.weft.core.execution.ExecutionResult;
import io.weft.core.plan.ExecutionPlan;
import io.weft.core.plan.OptimizationSuggestion;
import io.weft.serialization.WeftSerializer;
import java.util.List;
import java.util.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Prints optimization suggestions for the plan built from a catalog.
///
/// Suggestions come from the tools' declared estimates. `--warmup` runs the plan
/// first so they reflect learned durations and reliabilities instead.
@Command(
        name = "suggest",
        mixinStandardHelpOptions = true,
        description = "Suggest optimizations for a tool catalog")
class SuggestCommand extends CatalogCommand {

    private static final Logger logger = Logger.getLogger(SuggestCommand.class.getName());

    @Option(
            names = "--warmup",
            defaultValue = "0",
            description = "Runs of the plan before suggesting (default: ${DEFAULT-VALUE})")
    int warmup;

    @Override
    protected int execute(ToolChainCoordinator coordinator, ExecutionPlan plan) {
        for (int run = 1; run <= warmup; run++) {
            ExecutionResult result = coordinator.executePlan(plan);
            logger.fine("Warmup run " + run + " finished, success=" + result.success());
        }

        List<OptimizationSuggestion> suggestions = coordinator.suggestOptimizations(plan);
        if (json) {
            out.println(WeftSerializer.toJson(suggestions));
            return EXIT_OK;
        }

        if (suggestions.isEmpty()) {
            out.println(styles.success("No optimizations suggested for " + plan.name()));
            return EXIT_OK;
        }

        out.println(styles.bold("Suggestions for " + plan.name()));
        int rank = 1;
        for (OptimizationSuggestion suggestion : suggestions) {
            OptimizationSuggestion.EstimatedImpact impact = suggestion.estimatedImpact();
            out.printf(
                    "%2d. %s %s%n",
                    rank++,
                    styles.accent(suggestion.type().name()),
                    suggestion.message());
            out.printf(
                    "    difficulty %s, impact %s %s%n",
                    styles.difficulty(suggestion.difficulty()),
                    Formats.decimal(impact.score()),
                    styles.gray(
                            "(time "
                                    + Formats.decimal(impact.timeReduction())
                                    + ", cost "
                                    + Formats.decimal(impact.costReduction())
                                    + ", reliability "
                                    + Formats.decimal(impact.reliabilityImprovement())
                                    + ")"));
        }
        return EXIT_OK;
    }
}
