package io.weft.core.tool;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Default thread-safe implementation of {@link ToolRegistry}.
///
/// Backed by a {@link ConcurrentHashMap}. In strict mode a second registration
/// under an existing name fails with {@link DuplicateToolException}; otherwise
/// the new definition silently replaces the old one.
///
/// @implNote Thread-safe. Strict-mode registration uses `putIfAbsent` so two
/// concurrent registrations of the same name cannot both succeed.
///
/// @see ToolRegistry for the contract
public final class DefaultToolRegistry implements ToolRegistry {

    private static final Logger logger = Logger.getLogger(DefaultToolRegistry.class.getName());

    private final Map<String, ToolDefinition> tools = new ConcurrentHashMap<>();
    private final boolean strict;

    /// Creates an empty, non-strict tool registry.
    public DefaultToolRegistry() {
        this(false);
    }

    /// Creates an empty tool registry.
    ///
    /// @param strict whether duplicate registrations are rejected
    public DefaultToolRegistry(boolean strict) {
        this.strict = strict;
    }

    /// Creates a non-strict tool registry with initial tools.
    ///
    /// @param initialTools tools to register, not null
    public DefaultToolRegistry(List<ToolDefinition> initialTools) {
        this(false);
        Objects.requireNonNull(initialTools, "initialTools must not be null");
        initialTools.forEach(this::register);
    }

    @Override
    public void register(ToolDefinition tool) {
        Objects.requireNonNull(tool, "tool must not be null");
        if (strict) {
            if (tools.putIfAbsent(tool.name(), tool) != null) {
                throw new DuplicateToolException(tool.name());
            }
        } else {
            tools.put(tool.name(), tool);
        }
        logger.fine("Registered tool: " + tool.name() + " (" + tool.category() + ")");
    }

    @Override
    public Optional<ToolDefinition> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(tools.get(name));
    }

    @Override
    public List<ToolDefinition> all() {
        return List.copyOf(tools.values());
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return tools.containsKey(name);
    }

    @Override
    public boolean remove(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return tools.remove(name) != null;
    }

    @Override
    public void clear() {
        tools.clear();
    }

    @Override
    public int size() {
        return tools.size();
    }

    /// Returns whether duplicate registrations are rejected.
    ///
    /// @return true in strict mode
    public boolean isStrict() {
        return strict;
    }
}
