package io.weft.core.execution;

import java.util.Map;

/// Invokes the business logic behind a tool.
///
/// This is the boundary between the scheduling engine and the outside world:
/// the engine decides when and how often to call a tool, an implementation of
/// this interface decides what calling it means (an in-process handler, a
/// remote service, a simulation).
///
/// ### Contracts
/// - Implementations must be thread-safe; steps of a parallel group invoke the
///   executor concurrently
/// - Failures are reported by throwing a classified {@link ToolExecutionException};
///   any other exception is treated as a permanent failure of the step
///
/// @see io.weft.core.execution.stub.SimulatedToolExecutor for a deterministic test double
@FunctionalInterface
public interface ToolExecutor {

    /// Invokes a tool.
    ///
    /// @param toolName registered tool identifier, not null
    /// @param input step input payload, not null (may be empty)
    /// @return tool output, may be null
    /// @throws ToolExecutionException if the invocation fails
    Object invoke(String toolName, Map<String, Object> input) throws ToolExecutionException;
}
