package io.weft.core.plan;

import io.weft.core.exception.CircularDependencyException;
import io.weft.core.performance.PerformanceTracker;
import io.weft.core.tool.ToolDefinition;
import io.weft.core.tool.ToolRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Turns a {@link DependencyGraph} into an ordered, grouped list of {@link PlanStep}s.
///
/// ### Ordering
/// Depth-first topological sort with three-colour marking. A node reached while it
/// is still in progress closes a cycle and aborts planning with
/// {@link CircularDependencyException}. Each node gets
/// `group = 0` without dependencies, otherwise `1 + max(group(dep))`, so every
/// dependency sits in a strictly lower group. Steps are emitted in DFS post-order
/// and then stably sorted by group.
///
/// ### Retry policies
/// {@link #applyIntelligentOptimizations} assigns {@link RetryPolicy#enhanced()} to
/// tools whose observed success rate (or declared reliability, before any sample)
/// is below the reliability threshold. The assignment is a pure function of the
/// steps, the tracker's profiles and the constraints, so applying it twice yields
/// the same steps.
///
/// @implNote Stateless apart from the injected collaborators; safe to share
/// between threads.
///
/// @see DependencyGraphBuilder for graph construction
/// @see PlanAdvisor for optimization suggestions on finished plans
public class PlanOptimizer {

    private static final Logger logger = Logger.getLogger(PlanOptimizer.class.getName());

    /// Success rate below which a tool is treated as unreliable.
    public static final double DEFAULT_RELIABILITY_THRESHOLD = 0.9;

    /// Minimum advisory plan timeout.
    public static final Duration DEFAULT_TIMEOUT_FLOOR = Duration.ofSeconds(60);

    private enum Mark {
        IN_PROGRESS,
        DONE
    }

    private final PerformanceTracker tracker;
    private final double reliabilityThreshold;
    private final Duration timeoutFloor;

    /// Creates an optimizer with the default threshold and timeout floor.
    ///
    /// @param tracker source of observed success rates, not null
    public PlanOptimizer(PerformanceTracker tracker) {
        this(tracker, DEFAULT_RELIABILITY_THRESHOLD, DEFAULT_TIMEOUT_FLOOR);
    }

    /// Creates an optimizer.
    ///
    /// @param tracker source of observed success rates, not null
    /// @param reliabilityThreshold success rate below which retries are enhanced
    /// @param timeoutFloor minimum advisory plan timeout, not null
    public PlanOptimizer(
            PerformanceTracker tracker, double reliabilityThreshold, Duration timeoutFloor) {
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.reliabilityThreshold = reliabilityThreshold;
        this.timeoutFloor = Objects.requireNonNull(timeoutFloor, "timeoutFloor must not be null");
    }

    /// Orders and groups the tools of a graph.
    ///
    /// Every step starts with {@link RetryPolicy#none()}; call
    /// {@link #applyIntelligentOptimizations} to assign learned policies.
    ///
    /// @param graph dependency graph, not null
    /// @param inputs input payload per requested tool; tools pulled in as dependencies
    ///        get an empty input, not null
    /// @param registry registry holding every tool of the graph, not null
    /// @return steps ordered by ascending group, never null
    /// @throws CircularDependencyException if the graph contains a cycle
    public List<PlanStep> optimize(
            DependencyGraph graph, Map<String, Map<String, Object>> inputs, ToolRegistry registry)
            throws CircularDependencyException {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(inputs, "inputs must not be null");
        Objects.requireNonNull(registry, "registry must not be null");

        Map<String, Mark> marks = new HashMap<>();
        Map<String, Integer> groups = new HashMap<>();
        List<String> postOrder = new ArrayList<>(graph.size());

        for (String node : graph.nodes()) {
            if (!marks.containsKey(node)) {
                visit(node, graph, marks, groups, postOrder, new ArrayList<>());
            }
        }

        List<PlanStep> steps = new ArrayList<>(postOrder.size());
        int index = 1;
        for (String toolName : postOrder) {
            steps.add(
                    new PlanStep(
                            "step_" + index++ + "_" + toolName,
                            toolName,
                            inputs.get(toolName),
                            List.copyOf(graph.dependenciesOf(toolName)),
                            groups.get(toolName),
                            RetryPolicy.none(),
                            expectedOutputs(registry, toolName)));
        }
        // List.sort is stable: post-order is kept within a group
        steps.sort(Comparator.comparingInt(PlanStep::parallelGroup));

        logger.fine(
                () ->
                        "Ordered "
                                + steps.size()
                                + " steps into "
                                + countParallelGroups(steps)
                                + " groups");
        return steps;
    }

    /// Assigns retry policies from observed tool reliability.
    ///
    /// Tools whose success rate is below the threshold receive
    /// {@link RetryPolicy#enhanced()}; all others receive {@link RetryPolicy#none()}
    /// with `maxRetries = constraints.defaultRetries()`.
    ///
    /// @param steps steps to adjust, not null
    /// @param constraints plan constraints, not null
    /// @param registry registry used for declared reliabilities, not null
    /// @return new list of steps in the same order, never null
    public List<PlanStep> applyIntelligentOptimizations(
            List<PlanStep> steps, PlanConstraints constraints, ToolRegistry registry) {
        Objects.requireNonNull(steps, "steps must not be null");
        Objects.requireNonNull(constraints, "constraints must not be null");

        List<PlanStep> adjusted = new ArrayList<>(steps.size());
        for (PlanStep step : steps) {
            double declared =
                    registry.get(step.toolName())
                            .map(ToolDefinition::reliability)
                            .orElse(ToolDefinition.DEFAULT_RELIABILITY);
            double successRate = tracker.successRate(step.toolName(), declared);
            if (successRate < reliabilityThreshold) {
                logger.fine(
                        () ->
                                "Enhanced retries for "
                                        + step.toolName()
                                        + " (success rate "
                                        + successRate
                                        + ")");
                adjusted.add(step.withRetryPolicy(RetryPolicy.enhanced()));
            } else {
                adjusted.add(
                        step.withRetryPolicy(
                                RetryPolicy.none().withMaxRetries(constraints.defaultRetries())));
            }
        }
        return adjusted;
    }

    /// Estimates the wall-clock duration of a plan: the sum over groups of the
    /// slowest tool in each group.
    ///
    /// @param steps ordered steps, not null
    /// @param registry registry holding the step tools, not null
    /// @return estimated duration, never null
    public Duration estimateDuration(List<PlanStep> steps, ToolRegistry registry) {
        Map<Integer, Duration> slowestPerGroup = new LinkedHashMap<>();
        for (PlanStep step : steps) {
            Duration estimate = estimatedDurationOf(step, registry);
            slowestPerGroup.merge(
                    step.parallelGroup(),
                    estimate,
                    (current, next) -> next.compareTo(current) > 0 ? next : current);
        }
        return slowestPerGroup.values().stream().reduce(Duration.ZERO, Duration::plus);
    }

    /// Estimates the total cost of a plan.
    ///
    /// @param steps ordered steps, not null
    /// @param registry registry holding the step tools, not null
    /// @return sum of per-execution costs in USD
    public double estimateCost(List<PlanStep> steps, ToolRegistry registry) {
        return steps.stream()
                .mapToDouble(
                        step ->
                                registry.get(step.toolName())
                                        .map(ToolDefinition::costPerExecution)
                                        .orElse(ToolDefinition.DEFAULT_COST))
                .sum();
    }

    /// Estimates the probability that every step succeeds on its first attempt.
    ///
    /// @param steps ordered steps, not null
    /// @param registry registry holding the step tools, not null
    /// @return product of tool success rates
    public double estimateReliability(List<PlanStep> steps, ToolRegistry registry) {
        double reliability = 1.0;
        for (PlanStep step : steps) {
            double declared =
                    registry.get(step.toolName())
                            .map(ToolDefinition::reliability)
                            .orElse(ToolDefinition.DEFAULT_RELIABILITY);
            reliability *= tracker.successRate(step.toolName(), declared);
        }
        return reliability;
    }

    /// Computes the advisory plan timeout: `max(1.5 × Σ estimated durations, floor)`.
    ///
    /// @param steps ordered steps, not null
    /// @param registry registry holding the step tools, not null
    /// @return timeout, never null
    public Duration calculateTimeout(List<PlanStep> steps, ToolRegistry registry) {
        long totalMillis =
                steps.stream().mapToLong(step -> estimatedDurationOf(step, registry).toMillis()).sum();
        Duration scaled = Duration.ofMillis(Math.round(totalMillis * 1.5));
        return scaled.compareTo(timeoutFloor) > 0 ? scaled : timeoutFloor;
    }

    /// Counts the distinct parallel groups of a step list.
    ///
    /// @param steps steps, not null
    /// @return number of distinct groups
    public static int countParallelGroups(List<PlanStep> steps) {
        return (int) steps.stream().mapToInt(PlanStep::parallelGroup).distinct().count();
    }

    private void visit(
            String node,
            DependencyGraph graph,
            Map<String, Mark> marks,
            Map<String, Integer> groups,
            List<String> postOrder,
            List<String> path)
            throws CircularDependencyException {
        marks.put(node, Mark.IN_PROGRESS);
        path.add(node);

        int group = 0;
        for (String dependency : graph.dependenciesOf(node)) {
            Mark mark = marks.get(dependency);
            if (mark == Mark.IN_PROGRESS) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency);
                throw new CircularDependencyException(dependency, cycle);
            }
            if (mark == null) {
                visit(dependency, graph, marks, groups, postOrder, path);
            }
            group = Math.max(group, groups.get(dependency) + 1);
        }

        path.remove(path.size() - 1);
        marks.put(node, Mark.DONE);
        groups.put(node, group);
        postOrder.add(node);
    }

    private static Duration estimatedDurationOf(PlanStep step, ToolRegistry registry) {
        return registry.get(step.toolName())
                .map(ToolDefinition::estimatedDuration)
                .orElse(ToolDefinition.DEFAULT_DURATION);
    }

    private static List<String> expectedOutputs(ToolRegistry registry, String toolName) {
        return registry.get(toolName)
                .map(tool -> List.of(tool.name() + "_output"))
                .orElse(List.of());
    }
}
