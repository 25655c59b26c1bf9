package io.weft.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.weft.core.tool.ToolDefinition;

/// Jackson mixin that binds `ToolDefinition` deserialization to its builder.
///
/// Applied to `ToolDefinition.class` via `WeftJacksonModule.setupModule()`. Going
/// through the builder means a catalog entry only needs a `name`; every other field
/// falls back to the builder default (1s duration, $0.01, 0.95 reliability,
/// parallelizable, not cacheable).
///
/// @apiNote The companion mixin {@link ToolDefinitionBuilderMixin} must also be registered
/// so Jackson knows how to invoke the builder's setters and `build()` method.
///
/// @see ToolDefinitionBuilderMixin
/// @see io.weft.serialization.WeftJacksonModule
@JsonDeserialize(builder = ToolDefinition.Builder.class)
public abstract class ToolDefinitionMixin {}
