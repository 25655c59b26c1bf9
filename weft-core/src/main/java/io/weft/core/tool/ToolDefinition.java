package io.weft.core.tool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Describes a schedulable tool: its dependencies and its cost, time and
/// reliability estimates.
///
/// Tool definitions are pure descriptors. They drive planning (dependency
/// ordering, retry policy selection, estimates) and execution (caching and
/// concurrency eligibility), but never carry the tool's business logic; that
/// lives behind {@link io.weft.core.execution.ToolExecutor}.
///
/// ### Contracts
/// - **Precondition**: `name` must not be null or blank; `reliability` must be in
///   `[0, 1]`; `costPerExecution` and `estimatedDuration` must not be negative
/// - **Postcondition**: All fields immutable after construction
///
/// ### Usage
/// {@snippet :
/// ToolDefinition write = ToolDefinition.builder("smart_write")
///     .category(ToolCategory.GENERATION)
///     .dependencies(List.of("smart_plan"))
///     .estimatedDuration(Duration.ofSeconds(4))
///     .costPerExecution(0.08)
///     .reliability(0.9)
///     .build();
/// }
///
/// @param name unique tool identifier, not null
/// @param description human-readable description, never null after construction
/// @param category functional category, never null after construction
/// @param dependencies names of tools that must complete first, never null
/// @param estimatedDuration expected execution time, never null after construction
/// @param costPerExecution expected monetary cost per invocation (USD)
/// @param reliability probability of a successful invocation, in `[0, 1]`
/// @param parallelizable whether the tool may run concurrently with siblings
/// @param cacheEnabled whether successful outputs may be cached
/// @param resources declared resource footprint, never null after construction
/// @param version descriptor version, never null after construction
/// @see ToolRegistry for registration
public record ToolDefinition(
        String name,
        String description,
        ToolCategory category,
        List<String> dependencies,
        Duration estimatedDuration,
        double costPerExecution,
        double reliability,
        boolean parallelizable,
        boolean cacheEnabled,
        ResourceRequirements resources,
        String version) {

    /// Default estimated execution time.
    public static final Duration DEFAULT_DURATION = Duration.ofMillis(1000);

    /// Default cost per execution in USD.
    public static final double DEFAULT_COST = 0.01;

    /// Default reliability.
    public static final double DEFAULT_RELIABILITY = 0.95;

    /// Compact constructor with validation.
    public ToolDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (reliability < 0.0 || reliability > 1.0) {
            throw new IllegalArgumentException("reliability must be in [0, 1]: " + reliability);
        }
        if (costPerExecution < 0.0) {
            throw new IllegalArgumentException("costPerExecution must be >= 0");
        }
        description = description != null ? description : "";
        category = category != null ? category : ToolCategory.ORCHESTRATION;
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        if (dependencies.contains(name)) {
            throw new IllegalArgumentException("Tool cannot depend on itself: " + name);
        }
        estimatedDuration = estimatedDuration != null ? estimatedDuration : DEFAULT_DURATION;
        if (estimatedDuration.isNegative()) {
            throw new IllegalArgumentException("estimatedDuration must not be negative");
        }
        resources = resources != null ? resources : ResourceRequirements.defaults();
        version = version != null ? version : "1.0.0";
    }

    /// Creates a tool with default estimates and the given dependencies.
    ///
    /// @param name unique tool identifier, not null
    /// @param dependencies names of prerequisite tools
    /// @return new definition, never null
    public static ToolDefinition simple(String name, String... dependencies) {
        return builder(name).dependencies(Arrays.asList(dependencies)).build();
    }

    /// Returns whether this tool declares any dependency.
    ///
    /// @return true if {@link #dependencies()} is not empty
    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    /// Creates a builder pre-populated with this definition's values.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .description(description)
                .category(category)
                .dependencies(dependencies)
                .estimatedDuration(estimatedDuration)
                .costPerExecution(costPerExecution)
                .reliability(reliability)
                .parallelizable(parallelizable)
                .cacheEnabled(cacheEnabled)
                .resources(resources)
                .version(version);
    }

    /// Creates a new builder for the named tool.
    ///
    /// @param name unique tool identifier, not null
    /// @return new builder, never null
    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    /// Declared resource footprint of a tool. Informational only.
    ///
    /// @param memoryMb expected memory usage in megabytes
    /// @param cpuUnits expected CPU units
    /// @param tokens expected token usage
    public record ResourceRequirements(int memoryMb, int cpuUnits, int tokens) {

        public ResourceRequirements {
            if (memoryMb < 0 || cpuUnits < 0 || tokens < 0) {
                throw new IllegalArgumentException("resource requirements must be >= 0");
            }
        }

        /// Returns the defaults: 100 MB, 1 CPU unit, 1000 tokens.
        ///
        /// @return default requirements, never null
        public static ResourceRequirements defaults() {
            return new ResourceRequirements(100, 1, 1000);
        }
    }

    /// Fluent builder for {@link ToolDefinition}.
    ///
    /// Unset fields take the defaults `estimatedDuration = 1000ms`,
    /// `costPerExecution = 0.01`, `reliability = 0.95`, `parallelizable = true`
    /// and `cacheEnabled = false`.
    public static final class Builder {
        private String name;
        private String description;
        private ToolCategory category;
        private List<String> dependencies = new ArrayList<>();
        private Duration estimatedDuration = DEFAULT_DURATION;
        private double costPerExecution = DEFAULT_COST;
        private double reliability = DEFAULT_RELIABILITY;
        private boolean parallelizable = true;
        private boolean cacheEnabled;
        private ResourceRequirements resources;
        private String version;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(ToolCategory category) {
            this.category = category;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies != null ? new ArrayList<>(dependencies) : new ArrayList<>();
            return this;
        }

        public Builder dependsOn(String dependency) {
            this.dependencies.add(dependency);
            return this;
        }

        public Builder estimatedDuration(Duration estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
            return this;
        }

        public Builder costPerExecution(double costPerExecution) {
            this.costPerExecution = costPerExecution;
            return this;
        }

        public Builder reliability(double reliability) {
            this.reliability = reliability;
            return this;
        }

        public Builder parallelizable(boolean parallelizable) {
            this.parallelizable = parallelizable;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder resources(ResourceRequirements resources) {
            this.resources = resources;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        /// Builds the definition.
        ///
        /// @return new definition, never null
        /// @throws IllegalArgumentException if any field fails validation
        public ToolDefinition build() {
            return new ToolDefinition(
                    name,
                    description,
                    category,
                    dependencies,
                    estimatedDuration,
                    costPerExecution,
                    reliability,
                    parallelizable,
                    cacheEnabled,
                    resources,
                    version);
        }
    }
}
