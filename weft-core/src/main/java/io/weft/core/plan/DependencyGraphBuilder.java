package io.weft.core.plan;

import io.weft.core.exception.ToolNotFoundException;
import io.weft.core.tool.ToolDefinition;
import io.weft.core.tool.ToolRegistry;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Builds the {@link DependencyGraph} for a set of tool requests.
///
/// Dependencies are resolved against the {@link ToolRegistry}, not against the
/// request list: a dependency must be registered but need not be requested, and
/// transitive dependencies are pulled in automatically.
///
/// @implNote Stateless apart from the registry reference; safe to share.
public class DependencyGraphBuilder {

    private final ToolRegistry registry;

    /// Creates a builder backed by the given registry.
    ///
    /// @param registry tool registry used for lookups, not null
    public DependencyGraphBuilder(ToolRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /// Builds the dependency graph of the requested tools and their transitive dependencies.
    ///
    /// @param requests requested tools, not null
    /// @return the graph, never null
    /// @throws ToolNotFoundException if a requested tool or any dependency is unregistered
    public DependencyGraph build(List<ToolRequest> requests) throws ToolNotFoundException {
        Objects.requireNonNull(requests, "requests must not be null");

        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        Deque<String> pending = new ArrayDeque<>();
        Map<String, String> requiredBy = new LinkedHashMap<>();

        for (ToolRequest request : requests) {
            ToolDefinition tool =
                    registry.get(request.toolName())
                            .orElseThrow(() -> new ToolNotFoundException(request.toolName()));
            if (!adjacency.containsKey(tool.name())) {
                adjacency.put(tool.name(), new LinkedHashSet<>(tool.dependencies()));
                pending.addAll(tool.dependencies());
                tool.dependencies().forEach(dep -> requiredBy.putIfAbsent(dep, tool.name()));
            }
        }

        while (!pending.isEmpty()) {
            String name = pending.poll();
            if (adjacency.containsKey(name)) {
                continue;
            }
            ToolDefinition dependency =
                    registry.get(name)
                            .orElseThrow(
                                    () -> new ToolNotFoundException(name, requiredBy.get(name)));
            adjacency.put(name, new LinkedHashSet<>(dependency.dependencies()));
            for (String next : dependency.dependencies()) {
                requiredBy.putIfAbsent(next, name);
                pending.add(next);
            }
        }

        return new DependencyGraph(adjacency);
    }
}
