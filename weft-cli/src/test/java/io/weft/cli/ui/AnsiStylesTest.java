package io.weft.cli.ui;

import static org.assertj.core.api.Assertions.assertThat;

import io.weft.core.execution.Recommendation;
import io.weft.core.execution.StepResult;
import io.weft.core.plan.OptimizationSuggestion;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class AnsiStylesTest {

    private final AnsiStyles color = AnsiStyles.of(true);
    private final AnsiStyles plain = AnsiStyles.of(false);

    @Test
    void shouldApplyBoldFormattingWhenColorEnabled() {
        String result = color.bold("digest");

        assertThat(result).startsWith("\033[1m").contains("digest").endsWith("\033[0m");
    }

    @Test
    void shouldReturnPlainTextWhenColorDisabled() {
        assertThat(plain.bold("digest")).isEqualTo("digest");
        assertThat(plain.error("FAILED")).isEqualTo("FAILED");
        assertThat(plain.isColorEnabled()).isFalse();
    }

    @Test
    void shouldColorBySuccess() {
        assertThat(color.successOrError("SUCCESS", true)).contains("\033[0;32m");
        assertThat(color.successOrError("FAILED", false)).contains("\033[38;5;167m");
    }

    @Test
    void shouldMarkStepsByOutcome() {
        Duration duration = Duration.ofMillis(10);

        assertThat(plain.stepMarker(StepResult.success("s1", "fetch", "out", duration, 0.1, 0)))
                .isEqualTo("✓");
        assertThat(plain.stepMarker(StepResult.cacheHit("s1", "fetch", "out"))).isEqualTo("◆");
        assertThat(plain.stepMarker(StepResult.failure("s1", "fetch", "boom", duration, 1)))
                .isEqualTo("✗");
        assertThat(plain.stepMarker(StepResult.skipped("s2", "summarize", "fetch")))
                .isEqualTo("−");
    }

    @Test
    void shouldColorPrioritiesAndDifficulties() {
        assertThat(color.priority(Recommendation.Priority.HIGH))
                .isEqualTo("\033[38;5;167mHIGH\033[0m");
        assertThat(plain.priority(Recommendation.Priority.LOW)).isEqualTo("LOW");
        assertThat(color.difficulty(OptimizationSuggestion.Difficulty.LOW))
                .isEqualTo("\033[0;32mLOW\033[0m");
    }
}
