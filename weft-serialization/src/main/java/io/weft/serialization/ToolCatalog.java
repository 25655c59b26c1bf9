package io.weft.serialization;

import io.weft.core.plan.PlanConstraints;
import io.weft.core.plan.ToolRequest;
import io.weft.core.tool.ToolDefinition;
import java.util.List;

/// A JSON document describing tools, the tools to run and the plan constraints.
///
/// ### Format
/// {@snippet lang=json :
/// {
///   "name": "digest",
///   "tools": [
///     { "name": "fetch", "estimatedDuration": "PT2S", "cacheEnabled": true },
///     { "name": "summarize", "dependencies": ["fetch"], "reliability": 0.85 }
///   ],
///   "requests": [ { "toolName": "summarize", "input": { "length": 200 } } ],
///   "constraints": { "maxCost": 0.5, "defaultRetries": 1 }
/// }
/// }
///
/// @param name plan name, defaults to `"catalog"`
/// @param description plan description, defaults to empty
/// @param tools tool definitions to register, never null after construction
/// @param requests tools to plan, never null after construction
/// @param constraints plan constraints, defaults to {@link PlanConstraints#defaults()}
public record ToolCatalog(
        String name,
        String description,
        List<ToolDefinition> tools,
        List<ToolRequest> requests,
        PlanConstraints constraints) {

    public ToolCatalog {
        name = name != null && !name.isBlank() ? name : "catalog";
        description = description != null ? description : "";
        tools = tools != null ? List.copyOf(tools) : List.of();
        requests = requests != null ? List.copyOf(requests) : List.of();
        constraints = constraints != null ? constraints : PlanConstraints.defaults();
    }
}
