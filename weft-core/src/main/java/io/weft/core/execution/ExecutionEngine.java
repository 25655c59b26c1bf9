package io.weft.core.execution;

import io.weft.core.WeftConfig;
import io.weft.core.execution.cache.CacheEntry;
import io.weft.core.execution.cache.CacheKeyStrategy;
import io.weft.core.execution.cache.ExecutionCache;
import io.weft.core.performance.PerformanceTracker;
import io.weft.core.plan.ExecutionPlan;
import io.weft.core.plan.PlanStep;
import io.weft.core.plan.RetryPolicy;
import io.weft.core.tool.ToolDefinition;
import io.weft.core.tool.ToolRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Executes {@link ExecutionPlan}s group by group.
///
/// ### Execution model
/// - Groups run in ascending order with a barrier between them: no step of group
///   `g + 1` starts before every step of group `g` has terminated
/// - Within a group, parallelizable steps run concurrently on the shared
///   {@link ExecutorService}, at most `maxConcurrentSteps` at a time; steps whose tool
///   is not parallelizable, or every step when the plan disables parallelism, run one
///   at a time on the calling thread afterwards
/// - Results keep submission order, whatever the completion order
///
/// ### Per step
/// 1. If a dependency did not succeed and the policy is
///    {@link DependencyFailurePolicy#SKIP_DEPENDENTS}, the step is skipped
/// 2. If both the plan and the tool allow caching and the cache holds the key, the
///    cached output is returned without invoking the tool
/// 3. Otherwise the {@link ToolExecutor} is invoked; transient failures listed in the
///    step's {@link RetryPolicy} are retried with linear backoff
///
/// Every executor attempt updates the tool's profile in the
/// {@link PerformanceTracker}. Step failures never abort the run; a fault of the
/// engine itself yields {@link ExecutionResult#engineFault}.
///
/// @implNote Thread-safe. The engine keeps no per-run state in fields; the
/// executor service is owned by the caller and never shut down here.
///
/// @see io.weft.core.ToolChainCoordinator for the public entry point
public class ExecutionEngine {

    private static final Logger logger = Logger.getLogger(ExecutionEngine.class.getName());

    /// Retry rate above which a run recommends reliability work.
    static final double HIGH_RETRY_RATE = 0.2;

    /// Pauses the calling thread between retries.
    @FunctionalInterface
    public interface Sleeper {

        /// Sleeper backed by {@link Thread#sleep(long)}.
        Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }

    private final ToolRegistry registry;
    private final ToolExecutor toolExecutor;
    private final ExecutionCache cache;
    private final CacheKeyStrategy keyStrategy;
    private final PerformanceTracker tracker;
    private final ExecutorService executorService;
    private final WeftConfig config;
    private final Sleeper sleeper;
    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();

    /// Creates an engine that sleeps on the calling thread between retries.
    ///
    /// @param registry tool registry, not null
    /// @param toolExecutor invokes tool logic, not null
    /// @param cache output cache, not null
    /// @param keyStrategy cache key derivation, not null
    /// @param tracker receives per-attempt observations, not null
    /// @param executorService runs parallel steps, not null
    /// @param config thresholds and dependency failure policy, not null
    public ExecutionEngine(
            ToolRegistry registry,
            ToolExecutor toolExecutor,
            ExecutionCache cache,
            CacheKeyStrategy keyStrategy,
            PerformanceTracker tracker,
            ExecutorService executorService,
            WeftConfig config) {
        this(
                registry,
                toolExecutor,
                cache,
                keyStrategy,
                tracker,
                executorService,
                config,
                Sleeper.SYSTEM);
    }

    /// Creates an engine with a custom backoff sleeper.
    ///
    /// @param registry tool registry, not null
    /// @param toolExecutor invokes tool logic, not null
    /// @param cache output cache, not null
    /// @param keyStrategy cache key derivation, not null
    /// @param tracker receives per-attempt observations, not null
    /// @param executorService runs parallel steps, not null
    /// @param config thresholds and dependency failure policy, not null
    /// @param sleeper pauses between retries, not null
    public ExecutionEngine(
            ToolRegistry registry,
            ToolExecutor toolExecutor,
            ExecutionCache cache,
            CacheKeyStrategy keyStrategy,
            PerformanceTracker tracker,
            ExecutorService executorService,
            WeftConfig config,
            Sleeper sleeper) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.toolExecutor = Objects.requireNonNull(toolExecutor, "toolExecutor must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.keyStrategy = Objects.requireNonNull(keyStrategy, "keyStrategy must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /// Registers a listener for progress callbacks.
    ///
    /// @param listener the listener, not null
    public void addListener(ExecutionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /// Removes a previously registered listener.
    ///
    /// @param listener the listener, not null
    /// @return true if the listener was registered
    public boolean removeListener(ExecutionListener listener) {
        return listeners.remove(listener);
    }

    /// Executes a plan once.
    ///
    /// Never throws for step failures: they are reported in the returned result.
    ///
    /// @param plan the plan to execute, not null
    /// @return result of the run, never null
    public ExecutionResult execute(ExecutionPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        logger.info("Executing plan: " + plan.name() + " (" + plan.steps().size() + " steps)");

        long start = System.nanoTime();
        List<StepResult> stepResults = new ArrayList<>(plan.steps().size());
        Map<String, StepResult> resultsByTool = new ConcurrentHashMap<>();
        int parallelSteps = 0;

        notifyListeners(listener -> listener.onPlanStarted(plan));
        try {
            List<List<PlanStep>> groups = plan.groups();
            for (int groupNumber = 0; groupNumber < groups.size(); groupNumber++) {
                List<PlanStep> group = groups.get(groupNumber);
                int currentGroup = groupNumber;
                notifyListeners(listener -> listener.onGroupStarted(plan, currentGroup, group));

                List<StepResult> groupResults = executeGroup(plan, group, resultsByTool);
                stepResults.addAll(groupResults);
                groupResults.forEach(r -> resultsByTool.put(r.toolName(), r));
                if (group.size() > 1) {
                    parallelSteps += group.size();
                }
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            ExecutionResult result = summarize(plan, stepResults, parallelSteps, elapsed);
            logger.info(
                    String.format(
                            Locale.ROOT,
                            "Plan execution %s in %dms, cost: $%.4f",
                            result.success() ? "completed" : "failed",
                            elapsed.toMillis(),
                            result.totalCost()));
            notifyListeners(listener -> listener.onPlanCompleted(plan, result));
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fault(plan, start, stepResults, parallelSteps, e);
        } catch (RuntimeException e) {
            return fault(plan, start, stepResults, parallelSteps, e);
        }
    }

    private ExecutionResult fault(
            ExecutionPlan plan,
            long start,
            List<StepResult> stepResults,
            int parallelSteps,
            Exception fault) {
        logger.severe("Plan execution failed: " + plan.name() + " - " + fault);
        ExecutionResult result =
                ExecutionResult.engineFault(
                        plan.id(),
                        Duration.ofNanos(System.nanoTime() - start),
                        stepResults,
                        buildSummary(stepResults, parallelSteps),
                        fault);
        notifyListeners(listener -> listener.onPlanCompleted(plan, result));
        return result;
    }

    // -----------------------------------------------------------------------
    // Group execution
    // -----------------------------------------------------------------------

    private List<StepResult> executeGroup(
            ExecutionPlan plan, List<PlanStep> group, Map<String, StepResult> previousResults)
            throws InterruptedException {
        List<PlanStep> concurrent = new ArrayList<>();
        List<Integer> concurrentSlots = new ArrayList<>();
        List<Integer> serialSlots = new ArrayList<>();
        for (int i = 0; i < group.size(); i++) {
            PlanStep step = group.get(i);
            boolean parallelizable =
                    registry.get(step.toolName()).map(ToolDefinition::parallelizable).orElse(false);
            if (plan.optimization().parallelEnabled() && parallelizable && group.size() > 1) {
                concurrent.add(step);
                concurrentSlots.add(i);
            } else {
                serialSlots.add(i);
            }
        }

        // One slot per step so results keep the group's submission order.
        StepResult[] slots = new StepResult[group.size()];
        List<StepResult> concurrentResults = runConcurrently(plan, concurrent, previousResults);
        for (int i = 0; i < concurrentResults.size(); i++) {
            slots[concurrentSlots.get(i)] = concurrentResults.get(i);
        }
        for (int slot : serialSlots) {
            slots[slot] = runStep(plan, group.get(slot), previousResults);
        }
        return Arrays.asList(slots);
    }

    private List<StepResult> runConcurrently(
            ExecutionPlan plan, List<PlanStep> steps, Map<String, StepResult> previousResults)
            throws InterruptedException {
        if (steps.isEmpty()) {
            return List.of();
        }
        Semaphore permits = new Semaphore(plan.optimization().maxConcurrentSteps());
        List<Future<StepResult>> futures = new ArrayList<>(steps.size());
        for (PlanStep step : steps) {
            permits.acquire();
            try {
                futures.add(
                        executorService.submit(
                                () -> {
                                    try {
                                        return runStep(plan, step, previousResults);
                                    } finally {
                                        permits.release();
                                    }
                                }));
            } catch (RejectedExecutionException e) {
                permits.release();
                throw e;
            }
        }

        List<StepResult> results = new ArrayList<>(steps.size());
        for (int i = 0; i < futures.size(); i++) {
            PlanStep step = steps.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                logger.warning(
                        "Step failed with exception: "
                                + step.stepId()
                                + " - "
                                + e.getCause().getMessage());
                results.add(
                        StepResult.failure(
                                step.stepId(),
                                step.toolName(),
                                "Step execution failed: " + e.getCause(),
                                Duration.ZERO,
                                0));
            }
        }
        return results;
    }

    // -----------------------------------------------------------------------
    // Step execution
    // -----------------------------------------------------------------------

    private StepResult runStep(
            ExecutionPlan plan, PlanStep step, Map<String, StepResult> previousResults) {
        StepResult result = executeStep(plan, step, previousResults);
        notifyListeners(listener -> listener.onStepCompleted(plan, step, result));
        return result;
    }

    private StepResult executeStep(
            ExecutionPlan plan, PlanStep step, Map<String, StepResult> previousResults) {
        if (config.getDependencyFailurePolicy() == DependencyFailurePolicy.SKIP_DEPENDENTS) {
            Optional<String> failedDependency =
                    step.dependencies().stream()
                            .filter(
                                    dep -> {
                                        StepResult depResult = previousResults.get(dep);
                                        return depResult != null && !depResult.success();
                                    })
                            .findFirst();
            if (failedDependency.isPresent()) {
                logger.warning(
                        "Skipping "
                                + step.stepId()
                                + ": dependency '"
                                + failedDependency.get()
                                + "' did not succeed");
                return StepResult.skipped(step.stepId(), step.toolName(), failedDependency.get());
            }
        }

        Optional<ToolDefinition> tool = registry.get(step.toolName());
        boolean cacheable =
                plan.optimization().cachingEnabled()
                        && tool.map(ToolDefinition::cacheEnabled).orElse(false);
        String cacheKey = cacheable ? keyStrategy.key(step.toolName(), step.input()) : null;

        if (cacheable) {
            Optional<CacheEntry> cached = cache.lookup(cacheKey);
            if (cached.isPresent()) {
                logger.fine(() -> "Cache hit for " + step.stepId());
                return StepResult.cacheHit(step.stepId(), step.toolName(), cached.get().output());
            }
        }

        double cost = tool.map(ToolDefinition::costPerExecution).orElse(0.0);
        RetryPolicy policy = step.retryPolicy();
        long stepStart = System.nanoTime();
        int retries = 0;

        while (true) {
            long attemptStart = System.nanoTime();
            try {
                Object output = toolExecutor.invoke(step.toolName(), step.input());
                Duration attempt = Duration.ofNanos(System.nanoTime() - attemptStart);
                tracker.recordAttempt(step.toolName(), attempt, cost, true);
                if (cacheable) {
                    cache.store(cacheKey, step.toolName(), output, attempt);
                }
                Duration total = Duration.ofNanos(System.nanoTime() - stepStart);
                logger.fine(
                        () -> "Step " + step.stepId() + " succeeded in " + total.toMillis() + "ms");
                return StepResult.success(
                        step.stepId(), step.toolName(), output, total, cost, retries);
            } catch (ToolExecutionException e) {
                tracker.recordAttempt(
                        step.toolName(),
                        Duration.ofNanos(System.nanoTime() - attemptStart),
                        0.0,
                        false);
                if (!policy.shouldRetry(e, retries)) {
                    return failed(step, e.getMessage(), stepStart, retries);
                }
                retries++;
                Duration backoff = policy.backoffFor(retries);
                logger.warning(
                        "Retrying "
                                + step.stepId()
                                + " ("
                                + retries
                                + "/"
                                + policy.maxRetries()
                                + ") after "
                                + backoff.toMillis()
                                + "ms: "
                                + e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return failed(step, "Interrupted during retry backoff", stepStart, retries);
                }
            } catch (RuntimeException e) {
                tracker.recordAttempt(
                        step.toolName(),
                        Duration.ofNanos(System.nanoTime() - attemptStart),
                        0.0,
                        false);
                return failed(step, "Unexpected error: " + e, stepStart, retries);
            }
        }
    }

    private StepResult failed(PlanStep step, String error, long stepStart, int retries) {
        logger.warning("Step " + step.stepId() + " failed: " + error);
        return StepResult.failure(
                step.stepId(),
                step.toolName(),
                error != null ? error : "Execution failed",
                Duration.ofNanos(System.nanoTime() - stepStart),
                retries);
    }

    // -----------------------------------------------------------------------
    // Summary and recommendations
    // -----------------------------------------------------------------------

    private ExecutionResult summarize(
            ExecutionPlan plan, List<StepResult> stepResults, int parallelSteps, Duration elapsed) {
        double totalCost = stepResults.stream().mapToDouble(StepResult::cost).sum();
        boolean success = stepResults.stream().allMatch(StepResult::success);
        return new ExecutionResult(
                plan.id(),
                success,
                elapsed,
                totalCost,
                stepResults,
                buildSummary(stepResults, parallelSteps),
                recommend(plan, stepResults, elapsed, totalCost));
    }

    private static OptimizationSummary buildSummary(
            List<StepResult> stepResults, int parallelSteps) {
        int cacheHits = (int) stepResults.stream().filter(StepResult::cacheHit).count();
        int emptySuccesses =
                (int) stepResults.stream().filter(r -> r.success() && r.output() == null).count();
        int cascadeSkipped = (int) stepResults.stream().filter(StepResult::skipped).count();
        return new OptimizationSummary(
                parallelSteps,
                cacheHits,
                emptySuccesses,
                cascadeSkipped,
                identifyBottlenecks(stepResults));
    }

    static List<String> identifyBottlenecks(List<StepResult> stepResults) {
        List<String> bottlenecks = new ArrayList<>();
        if (stepResults.isEmpty()) {
            return bottlenecks;
        }
        double average =
                stepResults.stream().mapToLong(StepResult::durationMillis).average().orElse(0);
        for (StepResult result : stepResults) {
            if (result.durationMillis() > average * 2) {
                bottlenecks.add(
                        result.toolName() + ": " + result.durationMillis() + "ms (slow execution)");
            }
            if (result.retryCount() > 0) {
                bottlenecks.add(
                        result.toolName()
                                + ": "
                                + result.retryCount()
                                + " retries (reliability issue)");
            }
        }
        return bottlenecks;
    }

    private List<Recommendation> recommend(
            ExecutionPlan plan, List<StepResult> stepResults, Duration elapsed, double totalCost) {
        List<Recommendation> recommendations = new ArrayList<>();

        Duration target = plan.optimization().targetDuration();
        if (elapsed.compareTo(target) > 0) {
            recommendations.add(
                    new Recommendation(
                            Recommendation.Type.PERFORMANCE,
                            "Execution time exceeded target ("
                                    + elapsed.toMillis()
                                    + "ms > "
                                    + target.toMillis()
                                    + "ms)",
                            Recommendation.Priority.MEDIUM));
        }

        Duration maxDuration = plan.constraints().maxDuration();
        if (maxDuration != null && elapsed.compareTo(maxDuration) > 0) {
            recommendations.add(
                    new Recommendation(
                            Recommendation.Type.PERFORMANCE,
                            "Execution time exceeded the plan limit ("
                                    + elapsed.toMillis()
                                    + "ms > "
                                    + maxDuration.toMillis()
                                    + "ms)",
                            Recommendation.Priority.HIGH));
        }

        List<String> slowTools =
                stepResults.stream()
                        .filter(r -> !r.cacheHit())
                        .filter(r -> r.duration().compareTo(config.getPerformanceThreshold()) > 0)
                        .map(StepResult::toolName)
                        .collect(Collectors.toList());
        if (!slowTools.isEmpty()) {
            recommendations.add(
                    new Recommendation(
                            Recommendation.Type.PERFORMANCE,
                            slowTools.size()
                                    + " steps exceeded "
                                    + config.getPerformanceThreshold().toMillis()
                                    + "ms: "
                                    + String.join(", ", slowTools),
                            Recommendation.Priority.MEDIUM));
        }

        if (totalCost > config.getCostThreshold()) {
            recommendations.add(
                    new Recommendation(
                            Recommendation.Type.COST,
                            String.format(Locale.ROOT, "High execution cost: $%.4f", totalCost),
                            Recommendation.Priority.MEDIUM));
        }
        Double maxCost = plan.constraints().maxCost();
        if (maxCost != null && totalCost > maxCost) {
            recommendations.add(
                    new Recommendation(
                            Recommendation.Type.COST,
                            String.format(
                                    Locale.ROOT,
                                    "Execution cost exceeded the plan limit ($%.4f > $%.4f)",
                                    totalCost,
                                    maxCost),
                            Recommendation.Priority.MEDIUM));
        }

        List<String> failedTools =
                stepResults.stream()
                        .filter(StepResult::isFailure)
                        .map(StepResult::toolName)
                        .collect(Collectors.toList());
        if (!failedTools.isEmpty()) {
            recommendations.add(
                    new Recommendation(
                            Recommendation.Type.RELIABILITY,
                            failedTools.size() + " steps failed: " + String.join(", ", failedTools),
                            Recommendation.Priority.HIGH));
        }

        if (!stepResults.isEmpty()) {
            double retryRate =
                    (double) stepResults.stream().mapToInt(StepResult::retryCount).sum()
                            / stepResults.size();
            if (retryRate > HIGH_RETRY_RATE) {
                recommendations.add(
                        new Recommendation(
                                Recommendation.Type.RELIABILITY,
                                String.format(
                                        Locale.ROOT, "High retry rate: %.1f%%", retryRate * 100),
                                Recommendation.Priority.HIGH));
            }
        }
        return recommendations;
    }

    private void notifyListeners(Consumer<ExecutionListener> callback) {
        for (ExecutionListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                logger.warning("Execution listener failed: " + e);
            }
        }
    }
}
