package io.weft.core.execution;

import io.weft.core.plan.ExecutionPlan;
import io.weft.core.plan.PlanStep;
import java.util.List;

/// Receives progress callbacks while a plan executes.
///
/// All methods have empty defaults so implementations override only what
/// they need. Step callbacks arrive from worker threads.
///
/// @implNote Implementations must be thread-safe. Exceptions thrown by a listener
/// are logged and otherwise ignored by the engine.
public interface ExecutionListener {

    /// Listener that ignores every callback.
    ExecutionListener NOOP = new ExecutionListener() {};

    default void onPlanStarted(ExecutionPlan plan) {}

    default void onGroupStarted(ExecutionPlan plan, int groupNumber, List<PlanStep> steps) {}

    default void onStepCompleted(ExecutionPlan plan, PlanStep step, StepResult result) {}

    default void onPlanCompleted(ExecutionPlan plan, ExecutionResult result) {}
}
