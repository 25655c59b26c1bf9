package io.weft.cli.ui;

import io.weft.core.execution.Recommendation;
import io.weft.core.execution.StepResult;
import io.weft.core.plan.OptimizationSuggestion;

/// ANSI styling for run reports, plan listings and suggestions.
///
/// Every method returns a string; printing is the caller's job. With color
/// disabled the text comes back unchanged, so the same rendering code serves
/// terminals and redirected output.
///
/// {@snippet :
/// AnsiStyles styles = AnsiStyles.of(true);
/// out.println(styles.stepMarker(result) + " " + styles.bold(result.toolName()));
/// }
///
/// @implNote **Thread-safe**. Instances are immutable.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates styles with the given color preference.
    ///
    /// @param useColor true to emit ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    public String bold(String text) {
        return style(text, BOLD);
    }

    /// Secondary details such as durations and step ids.
    public String gray(String text) {
        return style(text, GRAY);
    }

    public String success(String text) {
        return style(text, GREEN);
    }

    public String error(String text) {
        return style(text, RED);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    public String accent(String text) {
        return style(text, BLUE);
    }

    /// Green on success, red otherwise.
    public String successOrError(String text, boolean isSuccess) {
        return style(text, isSuccess ? GREEN : RED);
    }

    public String arrow() {
        return style("→", BLUE);
    }

    public String bullet() {
        return style("•", GRAY);
    }

    /// Marks a finished step.
    ///
    /// `✓` for a run that succeeded, `◆` for a cache hit, `−` for a step skipped
    /// after a dependency failed and `✗` for a failure.
    ///
    /// @param result the step result, not null
    /// @return the styled marker, never null
    public String stepMarker(StepResult result) {
        if (result.skipped()) {
            return style("−", YELLOW);
        }
        if (result.cacheHit()) {
            return style("◆", BLUE);
        }
        return result.success() ? style("✓", GREEN) : style("✗", RED);
    }

    /// Labels a recommendation priority: red for high, yellow for medium, gray for low.
    public String priority(Recommendation.Priority priority) {
        return switch (priority) {
            case HIGH -> style(priority.name(), RED);
            case MEDIUM -> style(priority.name(), YELLOW);
            case LOW -> style(priority.name(), GRAY);
        };
    }

    /// Labels a suggestion difficulty: green for low, yellow for medium, red for high.
    public String difficulty(OptimizationSuggestion.Difficulty difficulty) {
        return switch (difficulty) {
            case LOW -> style(difficulty.name(), GREEN);
            case MEDIUM -> style(difficulty.name(), YELLOW);
            case HIGH -> style(difficulty.name(), RED);
        };
    }
}
