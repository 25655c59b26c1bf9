package io.weft.core.tool;

import java.time.Duration;
import java.util.List;

/// The default tool set shipped with Weft.
///
/// Registered by {@link io.weft.core.WeftFactory} when
/// {@link io.weft.core.WeftConfig#isRegisterBuiltInTools()} is enabled. The set forms a
/// small project pipeline: `smart_begin` → `smart_plan` → `smart_write`, plus the
/// independent `smart_orchestrate`.
public final class BuiltInTools {

    private BuiltInTools() {}

    /// Returns the built-in tool definitions.
    ///
    /// @return immutable list of definitions, never null
    public static List<ToolDefinition> all() {
        return List.of(
                ToolDefinition.builder("smart_begin")
                        .description("Initialize and plan project structure")
                        .category(ToolCategory.PLANNING)
                        .estimatedDuration(Duration.ofMillis(2000))
                        .resources(new ToolDefinition.ResourceRequirements(50, 1, 500))
                        .reliability(0.95)
                        .costPerExecution(0.02)
                        .parallelizable(false)
                        .cacheEnabled(true)
                        .build(),
                ToolDefinition.builder("smart_plan")
                        .description("Create detailed implementation plans")
                        .category(ToolCategory.PLANNING)
                        .dependsOn("smart_begin")
                        .estimatedDuration(Duration.ofMillis(3000))
                        .resources(new ToolDefinition.ResourceRequirements(100, 2, 1000))
                        .reliability(0.92)
                        .costPerExecution(0.04)
                        .parallelizable(false)
                        .cacheEnabled(true)
                        .build(),
                ToolDefinition.builder("smart_write")
                        .description("Generate code and documentation")
                        .category(ToolCategory.GENERATION)
                        .dependsOn("smart_plan")
                        .estimatedDuration(Duration.ofMillis(4000))
                        .resources(new ToolDefinition.ResourceRequirements(200, 2, 2000))
                        .reliability(0.9)
                        .costPerExecution(0.08)
                        .parallelizable(true)
                        .cacheEnabled(false)
                        .build(),
                ToolDefinition.builder("smart_orchestrate")
                        .description("Coordinate multiple tool executions")
                        .category(ToolCategory.ORCHESTRATION)
                        .estimatedDuration(Duration.ofMillis(1500))
                        .resources(new ToolDefinition.ResourceRequirements(150, 3, 800))
                        .reliability(0.98)
                        .costPerExecution(0.03)
                        .parallelizable(false)
                        .cacheEnabled(true)
                        .build());
    }
}
