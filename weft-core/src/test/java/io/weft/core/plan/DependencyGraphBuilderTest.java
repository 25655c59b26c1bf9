package io.weft.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.weft.core.exception.ToolNotFoundException;
import io.weft.core.tool.DefaultToolRegistry;
import io.weft.core.tool.ToolDefinition;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DependencyGraphBuilderTest {

    private DefaultToolRegistry registry;
    private DependencyGraphBuilder builder;

    @BeforeEach
    void setUp() {
        registry = new DefaultToolRegistry();
        registry.register(ToolDefinition.simple("fetch"));
        registry.register(ToolDefinition.simple("parse", "fetch"));
        registry.register(ToolDefinition.simple("summarize", "parse"));
        builder = new DependencyGraphBuilder(registry);
    }

    @Test
    void shouldPullTransitiveDependencies() throws Exception {
        DependencyGraph graph = builder.build(List.of(ToolRequest.of("summarize")));

        assertThat(graph.nodes()).containsExactly("summarize", "parse", "fetch");
        assertThat(graph.dependenciesOf("summarize")).containsExactly("parse");
        assertThat(graph.dependenciesOf("fetch")).isEmpty();
    }

    @Test
    void shouldKeepRequestOrderBeforePulledDependencies() throws Exception {
        registry.register(ToolDefinition.simple("notify"));

        DependencyGraph graph =
                builder.build(List.of(ToolRequest.of("summarize"), ToolRequest.of("notify")));

        assertThat(graph.nodes()).containsExactly("summarize", "notify", "parse", "fetch");
    }

    @Test
    void shouldIncludeDuplicateRequestOnce() throws Exception {
        DependencyGraph graph =
                builder.build(
                        List.of(
                                ToolRequest.of("fetch", Map.of("url", "a")),
                                ToolRequest.of("fetch", Map.of("url", "b"))));

        assertThat(graph.size()).isEqualTo(1);
    }

    @Test
    void shouldFailForUnknownRequestedTool() {
        assertThatThrownBy(() -> builder.build(List.of(ToolRequest.of("missing"))))
                .isInstanceOf(ToolNotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void shouldFailForUnknownDependencyAndNameTheRequester() {
        registry.register(ToolDefinition.simple("publish", "render"));

        assertThatThrownBy(() -> builder.build(List.of(ToolRequest.of("publish"))))
                .isInstanceOf(ToolNotFoundException.class)
                .hasMessageContaining("render")
                .hasMessageContaining("required by publish")
                .satisfies(
                        e ->
                                assertThat(((ToolNotFoundException) e).getToolName())
                                        .isEqualTo("render"));
    }
}
