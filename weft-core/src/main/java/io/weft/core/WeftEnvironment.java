package io.weft.core;

import io.weft.core.execution.ExecutionEngine;
import io.weft.core.execution.ToolExecutor;
import io.weft.core.execution.cache.ExecutionCache;
import io.weft.core.performance.PerformanceTracker;
import io.weft.core.tool.ToolRegistry;
import java.util.concurrent.ExecutorService;

/// Container holding the wired Weft components.
///
/// Implements {@link AutoCloseable} so the worker pool is released when the
/// environment goes out of scope.
///
/// ### Contracts
/// - **Precondition**: All constructor parameters must be non-null
/// - **Postcondition**: All getters return the same instances passed to constructor
///
/// @apiNote Create instances via {@link WeftFactory} rather than direct construction.
///
/// @see WeftFactory#createEnvironment(WeftConfig, ToolExecutor)
public final class WeftEnvironment implements AutoCloseable {

    private final ToolChainCoordinator coordinator;
    private final ToolRegistry registry;
    private final PerformanceTracker tracker;
    private final ExecutionCache cache;
    private final ExecutionEngine engine;
    private final ToolExecutor toolExecutor;
    private final ExecutorService executorService;
    private final WeftConfig config;

    /// Creates an environment from already wired components.
    ///
    /// @param coordinator public facade, not null
    /// @param registry tool registry, not null
    /// @param tracker performance tracker, not null
    /// @param cache execution cache, not null
    /// @param engine execution engine, not null
    /// @param toolExecutor tool executor used by the engine, not null
    /// @param executorService worker pool, not null
    /// @param config configuration the components were built from, not null
    public WeftEnvironment(
            ToolChainCoordinator coordinator,
            ToolRegistry registry,
            PerformanceTracker tracker,
            ExecutionCache cache,
            ExecutionEngine engine,
            ToolExecutor toolExecutor,
            ExecutorService executorService,
            WeftConfig config) {
        this.coordinator = coordinator;
        this.registry = registry;
        this.tracker = tracker;
        this.cache = cache;
        this.engine = engine;
        this.toolExecutor = toolExecutor;
        this.executorService = executorService;
        this.config = config;
    }

    /// Returns the facade for registering, planning and executing.
    ///
    /// @return the coordinator, never null
    public ToolChainCoordinator getCoordinator() {
        return coordinator;
    }

    public ToolRegistry getRegistry() {
        return registry;
    }

    public PerformanceTracker getTracker() {
        return tracker;
    }

    public ExecutionCache getCache() {
        return cache;
    }

    public ExecutionEngine getEngine() {
        return engine;
    }

    /// Returns the tool executor the engine invokes.
    ///
    /// @return the executor, never null
    public ToolExecutor getToolExecutor() {
        return toolExecutor;
    }

    public WeftConfig getConfig() {
        return config;
    }

    /// Shuts down the worker pool.
    ///
    /// @apiNote **Side effects**: running steps finish; no new plan can run
    /// concurrent steps afterwards.
    ///
    /// @implNote Calls `ExecutorService.shutdown()`, which does not block.
    @Override
    public void close() {
        executorService.shutdown();
    }
}
