package io.weft.core.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Adjacency mapping from tool name to the names it depends on.
///
/// Built fresh for every plan request by {@link DependencyGraphBuilder}; never
/// persisted. Iteration order is insertion order: requested tools first, in
/// request order, followed by dependencies pulled in transitively.
public final class DependencyGraph {

    private final Map<String, Set<String>> adjacency;

    /// Creates a graph from an adjacency map.
    ///
    /// @param adjacency mapping of tool name to dependency names, not null
    public DependencyGraph(Map<String, ? extends Set<String>> adjacency) {
        Objects.requireNonNull(adjacency, "adjacency must not be null");
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        adjacency.forEach(
                (name, deps) ->
                        copy.put(name, Collections.unmodifiableSet(new LinkedHashSet<>(deps))));
        this.adjacency = Collections.unmodifiableMap(copy);
    }

    /// Returns all tool names in the graph.
    ///
    /// @return ordered, unmodifiable set of names
    public Set<String> nodes() {
        return adjacency.keySet();
    }

    /// Returns the dependencies of a tool.
    ///
    /// @param toolName tool identifier, not null
    /// @return dependency names, empty if the tool is unknown
    public Set<String> dependenciesOf(String toolName) {
        return adjacency.getOrDefault(toolName, Set.of());
    }

    public boolean contains(String toolName) {
        return adjacency.containsKey(toolName);
    }

    public int size() {
        return adjacency.size();
    }

    /// Returns the unmodifiable adjacency map.
    ///
    /// @return adjacency view, never null
    public Map<String, Set<String>> asMap() {
        return adjacency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof DependencyGraph other && adjacency.equals(other.adjacency);
    }

    @Override
    public int hashCode() {
        return adjacency.hashCode();
    }

    @Override
    public String toString() {
        return "DependencyGraph" + adjacency;
    }
}
