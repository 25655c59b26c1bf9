package io.weft.core.execution.stub;

import io.weft.core.execution.FailureKind;
import io.weft.core.execution.PermanentExecutionException;
import io.weft.core.execution.ToolExecutionException;
import io.weft.core.execution.ToolExecutor;
import io.weft.core.execution.TransientExecutionException;
import io.weft.core.tool.ToolDefinition;
import io.weft.core.tool.ToolRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Executor that simulates tool invocations without doing any real work.
///
/// Useful for exercising plans, retries and caching without external services.
/// Each invocation fails with probability `1 − reliability` of the registered tool,
/// raised as a transient {@link FailureKind#SERVICE_UNAVAILABLE} failure; otherwise
/// it returns a map `{toolName, input, output}`.
///
/// ### Determinism
/// Outcomes are drawn from a {@link Random} seeded at construction. With parallel
/// execution the order of draws depends on thread scheduling; run plans with
/// parallelism disabled when a seed must reproduce exactly.
///
/// ### Scripted failures
/// {@link #scriptFailures(String, int, FailureKind)} forces the next `n` invocations
/// of a tool to fail with a given kind before random outcomes resume.
///
/// @implNote Thread-safe. The random source is guarded by its own monitor and the
/// scripted failures and counters are concurrent maps.
public class SimulatedToolExecutor implements ToolExecutor {

    private static final Logger logger = Logger.getLogger(SimulatedToolExecutor.class.getName());

    private final ToolRegistry registry;
    private final Random random;
    private final double latencyScale;
    private final Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();
    private final Map<String, ScriptedFailure> scripted = new ConcurrentHashMap<>();

    private record ScriptedFailure(int remaining, FailureKind kind) {}

    /// Creates an executor without simulated latency.
    ///
    /// @param registry source of tool reliabilities, not null
    /// @param seed random seed
    public SimulatedToolExecutor(ToolRegistry registry, long seed) {
        this(registry, seed, 0.0);
    }

    /// Creates an executor.
    ///
    /// @param registry source of tool reliabilities and estimated durations, not null
    /// @param seed random seed
    /// @param latencyScale fraction of the estimated duration to sleep per invocation;
    ///        0 disables latency
    public SimulatedToolExecutor(ToolRegistry registry, long seed, double latencyScale) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        if (latencyScale < 0) {
            throw new IllegalArgumentException("latencyScale must be >= 0");
        }
        this.random = new Random(seed);
        this.latencyScale = latencyScale;
    }

    @Override
    public Object invoke(String toolName, Map<String, Object> input)
            throws ToolExecutionException {
        invocations.computeIfAbsent(toolName, k -> new AtomicInteger()).incrementAndGet();

        ToolDefinition tool =
                registry.get(toolName)
                        .orElseThrow(
                                () ->
                                        new PermanentExecutionException(
                                                toolName,
                                                FailureKind.INVALID_INPUT,
                                                "Unknown tool: " + toolName));

        simulateLatency(tool);

        FailureKind forced = consumeScriptedFailure(toolName);
        if (forced != null) {
            logger.fine(() -> "[SIMULATED] Scripted " + forced + " for " + toolName);
            throw failure(toolName, forced);
        }

        double draw;
        synchronized (random) {
            draw = random.nextDouble();
        }
        if (draw > tool.reliability()) {
            logger.fine(() -> "[SIMULATED] Random failure for " + toolName);
            throw new TransientExecutionException(
                    toolName,
                    FailureKind.SERVICE_UNAVAILABLE,
                    "Simulated failure for " + toolName);
        }

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("toolName", toolName);
        output.put("input", input != null ? input : Map.of());
        output.put("output", "Simulated output from " + toolName);
        return output;
    }

    /// Forces the next invocations of a tool to fail.
    ///
    /// @param toolName tool identifier, not null
    /// @param count number of invocations to fail, must be positive
    /// @param kind failure kind to raise; {@link FailureKind#INVALID_INPUT} and
    ///        {@link FailureKind#INTERNAL} are raised as permanent failures, not null
    public void scriptFailures(String toolName, int count, FailureKind kind) {
        Objects.requireNonNull(toolName, "toolName must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        scripted.put(toolName, new ScriptedFailure(count, kind));
    }

    /// Returns how often a tool was invoked.
    ///
    /// @param toolName tool identifier, not null
    /// @return invocation count, 0 if never invoked
    public int invocationCount(String toolName) {
        AtomicInteger count = invocations.get(toolName);
        return count != null ? count.get() : 0;
    }

    /// Returns the total number of invocations across all tools.
    ///
    /// @return invocation count
    public int totalInvocations() {
        return invocations.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    private FailureKind consumeScriptedFailure(String toolName) {
        FailureKind[] consumed = new FailureKind[1];
        scripted.computeIfPresent(
                toolName,
                (name, failure) -> {
                    consumed[0] = failure.kind();
                    return failure.remaining() > 1
                            ? new ScriptedFailure(failure.remaining() - 1, failure.kind())
                            : null;
                });
        return consumed[0];
    }

    private static ToolExecutionException failure(String toolName, FailureKind kind) {
        String message = "Simulated " + kind + " for " + toolName;
        return switch (kind) {
            case INVALID_INPUT, INTERNAL ->
                    new PermanentExecutionException(toolName, kind, message);
            default -> new TransientExecutionException(toolName, kind, message);
        };
    }

    private void simulateLatency(ToolDefinition tool) throws ToolExecutionException {
        if (latencyScale == 0) {
            return;
        }
        long millis = Math.round(tool.estimatedDuration().toMillis() * latencyScale);
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PermanentExecutionException(
                    tool.name(), FailureKind.INTERNAL, "Interrupted during simulated latency", e);
        }
    }
}
