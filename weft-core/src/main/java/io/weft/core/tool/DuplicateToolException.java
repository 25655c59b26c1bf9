package io.weft.core.tool;

import java.io.Serial;

/// Thrown by a strict {@link ToolRegistry} when a tool name is registered twice.
///
/// Non-strict registries silently replace the previous definition instead.
public class DuplicateToolException extends IllegalStateException {

    @Serial private static final long serialVersionUID = 4127756340091851322L;

    private final String toolName;

    /// Creates the exception for the given tool name.
    ///
    /// @param toolName the name that was already registered, not null
    public DuplicateToolException(String toolName) {
        super("Tool already registered: " + toolName);
        this.toolName = toolName;
    }

    /// Returns the duplicated tool name.
    ///
    /// @return tool name, never null
    public String getToolName() {
        return toolName;
    }
}
