package io.weft.core.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A request to include a tool in a plan, with the input payload it should run with.
///
/// @param toolName registered tool identifier, not null or blank
/// @param input step input payload, never null after construction
public record ToolRequest(String toolName, Map<String, Object> input) {

    public ToolRequest {
        Objects.requireNonNull(toolName, "toolName must not be null");
        if (toolName.isBlank()) {
            throw new IllegalArgumentException("toolName must not be blank");
        }
        input =
                input != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(input))
                        : Map.of();
    }

    /// Creates a request with an empty input payload.
    ///
    /// @param toolName registered tool identifier, not null
    /// @return new request, never null
    public static ToolRequest of(String toolName) {
        return new ToolRequest(toolName, Map.of());
    }

    /// Creates a request with the given payload.
    ///
    /// @param toolName registered tool identifier, not null
    /// @param input payload, may be null (treated as empty)
    /// @return new request, never null
    public static ToolRequest of(String toolName, Map<String, Object> input) {
        return new ToolRequest(toolName, input);
    }
}
