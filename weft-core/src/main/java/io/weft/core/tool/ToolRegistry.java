package io.weft.core.tool;

import java.util.List;
import java.util.Optional;

/// Registry of tool definitions available for planning and execution.
///
/// The registry is a pure data store: lookups never trigger planning or
/// execution side effects. A registry is owned by a single
/// {@link io.weft.core.ToolChainCoordinator}; there is no process-wide instance.
///
/// ### Thread Safety
/// @implNote Implementations must be thread-safe. Plans may be created while
/// other threads register tools.
///
/// ### Usage
/// {@snippet :
/// ToolRegistry registry = new DefaultToolRegistry();
/// registry.register(ToolDefinition.simple("fetch"));
/// registry.register(ToolDefinition.simple("summarize", "fetch"));
///
/// Optional<ToolDefinition> tool = registry.get("summarize");
/// }
///
/// @see ToolDefinition for tool descriptors
/// @see io.weft.core.plan.DependencyGraphBuilder for registry-driven graph construction
public interface ToolRegistry {

    /// Registers a tool definition.
    ///
    /// If a tool with the same name already exists it is replaced, unless the
    /// registry is strict.
    ///
    /// @apiNote **Side effects**: Modifies internal tool registry
    ///
    /// @param tool the tool definition to register, not null
    /// @throws NullPointerException if tool is null
    /// @throws DuplicateToolException if the registry is strict and the name is taken
    void register(ToolDefinition tool);

    /// Retrieves a tool by name.
    ///
    /// @param name the tool identifier to look up, not null
    /// @return the tool definition if found, empty otherwise
    /// @throws NullPointerException if name is null
    Optional<ToolDefinition> get(String name);

    /// Returns all registered tools.
    ///
    /// @return unmodifiable list of all tools, never null (may be empty)
    List<ToolDefinition> all();

    /// Returns whether a tool with the given name is registered.
    ///
    /// @param name the tool identifier to check, not null
    /// @return true if the tool exists
    default boolean contains(String name) {
        return get(name).isPresent();
    }

    /// Removes a tool by name.
    ///
    /// @param name the tool identifier to remove, not null
    /// @return true if the tool was removed, false if not found
    boolean remove(String name);

    /// Removes every registered tool.
    ///
    /// @apiNote **Side effects**: Empties the registry
    void clear();

    /// Returns the number of registered tools.
    ///
    /// @return count of registered tools
    default int size() {
        return all().size();
    }
}
