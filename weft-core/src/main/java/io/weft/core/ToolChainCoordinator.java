package io.weft.core;

import io.weft.core.execution.ExecutionEngine;
import io.weft.core.execution.ExecutionListener;
import io.weft.core.execution.ExecutionResult;
import io.weft.core.execution.cache.CacheStats;
import io.weft.core.execution.cache.ExecutionCache;
import io.weft.core.performance.PerformanceExport;
import io.weft.core.performance.PerformanceMetrics;
import io.weft.core.performance.PerformanceProfile;
import io.weft.core.performance.PerformanceTracker;
import io.weft.core.plan.DependencyGraph;
import io.weft.core.plan.DependencyGraphBuilder;
import io.weft.core.plan.ExecutionPlan;
import io.weft.core.plan.OptimizationSettings;
import io.weft.core.plan.OptimizationSuggestion;
import io.weft.core.plan.PlanAdvisor;
import io.weft.core.plan.PlanConstraints;
import io.weft.core.plan.PlanCreationException;
import io.weft.core.plan.PlanOptimizer;
import io.weft.core.plan.PlanStep;
import io.weft.core.plan.RetryPolicy;
import io.weft.core.plan.ToolRequest;
import io.weft.core.tool.ToolDefinition;
import io.weft.core.tool.ToolRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Entry point for registering tools, planning tool chains and executing them.
///
/// A coordinator owns one {@link ToolRegistry}, {@link PerformanceTracker} and
/// {@link ExecutionCache}; there is no process-wide state. Create one through
/// {@link WeftFactory} rather than by hand.
///
/// ### Usage
/// {@snippet :
/// try (WeftEnvironment env = WeftFactory.createEnvironment(config, executor)) {
///     ToolChainCoordinator coordinator = env.getCoordinator();
///     coordinator.registerTool(ToolDefinition.simple("fetch"));
///     coordinator.registerTool(ToolDefinition.simple("summarize", "fetch"));
///
///     ExecutionPlan plan = coordinator.createPlan(
///             "digest", "Fetch and summarize", List.of(ToolRequest.of("summarize")), null);
///     ExecutionResult result = coordinator.executePlan(plan);
/// }
/// }
///
/// @implNote Thread-safe. All state lives in the thread-safe collaborators; plans
/// may be created and executed concurrently.
///
/// @see WeftFactory#createEnvironment(WeftConfig, io.weft.core.execution.ToolExecutor)
public class ToolChainCoordinator {

    private static final Logger logger = Logger.getLogger(ToolChainCoordinator.class.getName());

    private final ToolRegistry registry;
    private final PerformanceTracker tracker;
    private final ExecutionCache cache;
    private final ExecutionEngine engine;
    private final WeftConfig config;
    private final DependencyGraphBuilder graphBuilder;
    private final PlanOptimizer optimizer;
    private final PlanAdvisor advisor;

    /// Creates a coordinator over explicit collaborators.
    ///
    /// @param registry tool registry, not null
    /// @param tracker performance tracker shared with the engine, not null
    /// @param cache execution cache shared with the engine, not null
    /// @param engine execution engine, not null
    /// @param config planning options, not null
    public ToolChainCoordinator(
            ToolRegistry registry,
            PerformanceTracker tracker,
            ExecutionCache cache,
            ExecutionEngine engine,
            WeftConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.graphBuilder = new DependencyGraphBuilder(registry);
        this.optimizer =
                new PlanOptimizer(
                        tracker, config.getReliabilityThreshold(), config.getPlanTimeoutFloor());
        this.advisor =
                new PlanAdvisor(registry, tracker, optimizer, config.getReliabilityThreshold());
    }

    /// Registers a tool and seeds its performance profile from the declared estimates.
    ///
    /// @apiNote **Side effects**: replaces an existing tool of the same name and
    /// resets its profile, unless the registry is strict
    ///
    /// @param tool the tool definition, not null
    /// @throws io.weft.core.tool.DuplicateToolException if the registry is strict and
    ///         the name is taken
    public void registerTool(ToolDefinition tool) {
        registry.register(tool);
        tracker.initializeProfile(tool);
        logger.info("Registered tool: " + tool.name());
    }

    /// Creates an execution plan with default constraints.
    ///
    /// @param name plan name, not null
    /// @param requests requested tools, not null
    /// @return the plan, never null
    /// @throws PlanCreationException if a tool is missing or the dependencies form a cycle
    public ExecutionPlan createPlan(String name, List<ToolRequest> requests)
            throws PlanCreationException {
        return createPlan(name, "", requests, null);
    }

    /// Creates an execution plan.
    ///
    /// Resolves transitive dependencies, orders and groups the tools, assigns retry
    /// policies from learned reliability (unless predictive optimization is off) and
    /// fills unset constraint limits with the plan's estimates. Nothing is created
    /// when this method throws.
    ///
    /// @param name plan name, not null
    /// @param description plan description, may be null
    /// @param requests requested tools; for repeated tool names the first input wins, not null
    /// @param constraints plan constraints, null for {@link PlanConstraints#defaults()}
    /// @return the plan, never null
    /// @throws PlanCreationException if a tool is missing or the dependencies form a cycle
    public ExecutionPlan createPlan(
            String name, String description, List<ToolRequest> requests, PlanConstraints constraints)
            throws PlanCreationException {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(requests, "requests must not be null");
        PlanConstraints requested = constraints != null ? constraints : PlanConstraints.defaults();

        DependencyGraph graph = graphBuilder.build(requests);
        Map<String, Map<String, Object>> inputs = new HashMap<>();
        for (ToolRequest request : requests) {
            inputs.putIfAbsent(request.toolName(), request.input());
        }

        List<PlanStep> steps = optimizer.optimize(graph, inputs, registry);
        if (config.isPredictiveOptimization()) {
            steps = optimizer.applyIntelligentOptimizations(steps, requested, registry);
        } else {
            RetryPolicy policy = RetryPolicy.none().withMaxRetries(requested.defaultRetries());
            steps = steps.stream().map(s -> s.withRetryPolicy(policy)).collect(Collectors.toList());
        }

        Duration estimatedDuration = optimizer.estimateDuration(steps, registry);
        double estimatedCost = optimizer.estimateCost(steps, registry);
        OptimizationSettings settings =
                new OptimizationSettings(
                        true,
                        config.isCachingEnabled(),
                        OptimizationSettings.DEFAULT_TARGET,
                        config.getMaxParallelExecutions(),
                        optimizer.calculateTimeout(steps, registry));

        ExecutionPlan plan =
                new ExecutionPlan(
                        ExecutionPlan.newId(),
                        name,
                        description,
                        steps,
                        settings,
                        requested.resolve(estimatedDuration, estimatedCost),
                        Instant.now(),
                        estimatedDuration,
                        estimatedCost);

        logger.info(
                "Created plan "
                        + plan.id()
                        + " ("
                        + name
                        + "): "
                        + steps.size()
                        + " steps in "
                        + PlanOptimizer.countParallelGroups(steps)
                        + " groups, estimated "
                        + estimatedDuration.toMillis()
                        + "ms");
        return plan;
    }

    /// Executes a plan and records the run in the performance history.
    ///
    /// @param plan the plan, not null
    /// @return result of the run, never null
    public ExecutionResult executePlan(ExecutionPlan plan) {
        ExecutionResult result = engine.execute(plan);
        tracker.recordExecution(result);
        return result;
    }

    /// Returns ranked optimization suggestions for a plan.
    ///
    /// @param plan the plan, not null
    /// @return suggestions sorted by descending impact, never null
    public List<OptimizationSuggestion> suggestOptimizations(ExecutionPlan plan) {
        return advisor.suggestOptimizations(plan);
    }

    public PerformanceMetrics getPerformanceMetrics() {
        return tracker.getMetrics();
    }

    public Map<String, PerformanceProfile> getPerformanceProfiles() {
        return tracker.getProfiles();
    }

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    /// Removes every cached output.
    public void clearCache() {
        cache.clear();
        logger.info("Execution cache cleared");
    }

    /// Drops the execution history and all learned profiles.
    ///
    /// Registered tools are re-seeded with their declared estimates.
    public void clearPerformanceData() {
        tracker.clear();
        registry.all().forEach(tracker::initializeProfile);
        logger.info("Performance data cleared");
    }

    /// Exports profiles, history and aggregate metrics.
    ///
    /// @return snapshot, never null
    public PerformanceExport exportPerformanceData() {
        return tracker.export();
    }

    /// Registers a listener for execution progress.
    ///
    /// @param listener the listener, not null
    public void addListener(ExecutionListener listener) {
        engine.addListener(listener);
    }

    public ToolRegistry getRegistry() {
        return registry;
    }

    public PlanOptimizer getOptimizer() {
        return optimizer;
    }
}
