package io.weft.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `ToolDefinition.Builder`.
///
/// Sets `withPrefix = ""` so JSON field names map directly to the builder's
/// fluent setters. The incremental `dependsOn(String)` setter is hidden; catalogs
/// list dependencies as the `dependencies` array.
///
/// @see ToolDefinitionMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class ToolDefinitionBuilderMixin {

    @JsonIgnore
    public abstract ToolDefinitionBuilderMixin dependsOn(String dependency);
}
