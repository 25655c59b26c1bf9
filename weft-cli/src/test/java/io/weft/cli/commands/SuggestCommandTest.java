package io.weft.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.weft.cli.commands.CommandHarness.Outcome;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SuggestCommandTest {

    @TempDir Path tempDir;

    @Test
    void shouldSuggestCachingForCacheableTools() throws Exception {
        Path catalog = CommandHarness.writeCatalog(tempDir, Catalogs.DIGEST);

        Outcome outcome = CommandHarness.run("suggest", catalog.toString(), "--no-color");

        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.out())
                .contains("Suggestions for digest")
                .contains(" 1. PERFORMANCE Enable caching for 1 steps to improve performance")
                .contains("difficulty");
    }

    @Test
    void shouldSuggestReliabilityFixesForUnreliableTools() throws Exception {
        Path catalog = CommandHarness.writeCatalog(tempDir, Catalogs.FLAKY);

        Outcome outcome = CommandHarness.run("suggest", catalog.toString(), "--no-color");

        assertThat(outcome.out()).contains("RELIABILITY");
    }

    @Test
    void shouldReportWhenNothingToSuggest() throws Exception {
        Path catalog = CommandHarness.writeCatalog(tempDir, Catalogs.SINGLE);

        Outcome outcome = CommandHarness.run("suggest", catalog.toString(), "--no-color");

        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.out()).contains("No optimizations suggested for single");
    }

    @Test
    void shouldRunWarmupBeforeSuggesting() throws Exception {
        Path catalog = CommandHarness.writeCatalog(tempDir, Catalogs.SINGLE);

        Outcome outcome =
                CommandHarness.run(
                        "suggest", catalog.toString(), "--no-color", "--warmup", "2");

        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.out()).contains("No optimizations suggested for single");
    }

    @Test
    void shouldPrintSuggestionsAsJson() throws Exception {
        Path catalog = CommandHarness.writeCatalog(tempDir, Catalogs.DIGEST);

        Outcome outcome = CommandHarness.run("suggest", catalog.toString(), "--json");

        JsonNode suggestions = new ObjectMapper().readTree(outcome.out());
        assertThat(suggestions.isArray()).isTrue();
        assertThat(suggestions.get(0).get("type").asText()).isEqualTo("PERFORMANCE");
        assertThat(suggestions.get(0).get("estimatedImpact").has("timeReduction")).isTrue();
    }
}
