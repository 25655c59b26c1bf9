package io.weft.core;

import io.weft.core.execution.ExecutionEngine;
import io.weft.core.execution.ToolExecutor;
import io.weft.core.execution.cache.CacheKeyStrategy;
import io.weft.core.execution.cache.CanonicalCacheKeyStrategy;
import io.weft.core.execution.cache.ExecutionCache;
import io.weft.core.execution.stub.SimulatedToolExecutor;
import io.weft.core.performance.PerformanceTracker;
import io.weft.core.tool.BuiltInTools;
import io.weft.core.tool.DefaultToolRegistry;
import io.weft.core.tool.ToolRegistry;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/// Factory for creating and wiring Weft environments.
///
/// Provides static factory methods for constructing fully-configured
/// {@link WeftEnvironment} instances with zero external dependencies.
///
/// ### Usage Patterns
///
/// **Real executor**:
/// {@snippet :
/// var env = WeftFactory.createEnvironment(
///     WeftConfig.builder().threadPoolSize(4).build(),
///     (toolName, input) -> myTools.call(toolName, input));
/// }
///
/// **Simulated executor** (tests, demos):
/// {@snippet :
/// var env = WeftFactory.createSimulatedEnvironment(new WeftConfig(), 42L);
/// }
///
/// @implNote This is a utility class with only static methods. All dependencies
/// are wired explicitly via constructor injection in created components.
///
/// @see WeftEnvironment
/// @see WeftConfig
public final class WeftFactory {

    private WeftFactory() {}

    /// Creates an environment with default configuration and a simulated executor.
    ///
    /// @apiNote **Side effects**: creates a new fixed thread pool
    ///
    /// @return a fully-configured environment, never null
    public static WeftEnvironment createEnvironment() {
        return createEnvironment(new WeftConfig());
    }

    /// Creates an environment with a simulated executor seeded from the clock.
    ///
    /// @param config configuration options, not null
    /// @return a fully-configured environment, never null
    public static WeftEnvironment createEnvironment(WeftConfig config) {
        return createSimulatedEnvironment(config, System.nanoTime());
    }

    /// Creates an environment backed by a {@link SimulatedToolExecutor}.
    ///
    /// @param config configuration options, not null
    /// @param seed random seed of the simulated executor
    /// @return a fully-configured environment, never null
    public static WeftEnvironment createSimulatedEnvironment(WeftConfig config, long seed) {
        return createEnvironment(
                config,
                registry -> new SimulatedToolExecutor(registry, seed),
                new CanonicalCacheKeyStrategy());
    }

    /// Creates an environment backed by the given executor.
    ///
    /// This is the primary factory method for production use.
    ///
    /// @param config configuration options, not null
    /// @param toolExecutor invokes tool logic, not null
    /// @return a fully-configured environment, never null
    public static WeftEnvironment createEnvironment(WeftConfig config, ToolExecutor toolExecutor) {
        Objects.requireNonNull(toolExecutor, "toolExecutor must not be null");
        return createEnvironment(
                config, registry -> toolExecutor, new CanonicalCacheKeyStrategy());
    }

    /// Creates an environment with all options.
    ///
    /// The executor factory receives the environment's registry so executors that
    /// need tool metadata (like the simulated one) can be wired to it.
    ///
    /// @apiNote **Side effects**: creates a new fixed thread pool of
    /// `config.threadPoolSize` threads; registers {@link BuiltInTools} when configured
    ///
    /// @param config configuration options, not null
    /// @param executorFactory creates the tool executor from the registry, not null
    /// @param keyStrategy cache key derivation, not null
    /// @return a fully-configured environment, never null
    public static WeftEnvironment createEnvironment(
            WeftConfig config,
            Function<ToolRegistry, ToolExecutor> executorFactory,
            CacheKeyStrategy keyStrategy) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(executorFactory, "executorFactory must not be null");
        Objects.requireNonNull(keyStrategy, "keyStrategy must not be null");

        ToolRegistry registry = new DefaultToolRegistry(config.isStrictRegistration());
        PerformanceTracker tracker =
                new PerformanceTracker(config.getHistoryLimit(), config.isLearningEnabled());
        ExecutionCache cache =
                new ExecutionCache(
                        config.getCacheMaxEntries(), config.getCacheTtl(), Clock.systemUTC());
        ToolExecutor toolExecutor =
                Objects.requireNonNull(
                        executorFactory.apply(registry), "executorFactory returned null");
        ExecutorService executorService = Executors.newFixedThreadPool(config.getThreadPoolSize());

        ExecutionEngine engine =
                new ExecutionEngine(
                        registry, toolExecutor, cache, keyStrategy, tracker, executorService, config);
        ToolChainCoordinator coordinator =
                new ToolChainCoordinator(registry, tracker, cache, engine, config);

        if (config.isRegisterBuiltInTools()) {
            BuiltInTools.all().forEach(coordinator::registerTool);
        }

        return new WeftEnvironment(
                coordinator,
                registry,
                tracker,
                cache,
                engine,
                toolExecutor,
                executorService,
                config);
    }
}
