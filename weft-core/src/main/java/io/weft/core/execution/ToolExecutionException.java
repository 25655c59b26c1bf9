package io.weft.core.execution;

import java.io.Serial;
import java.util.Objects;

/// Failure raised by a {@link ToolExecutor} invocation.
///
/// Use {@link TransientExecutionException} for failures worth retrying and
/// {@link PermanentExecutionException} for failures that never are. The
/// {@link FailureKind} is matched against the step's retry policy.
///
/// @see io.weft.core.plan.RetryPolicy#shouldRetry(ToolExecutionException, int)
public abstract class ToolExecutionException extends Exception {

    @Serial private static final long serialVersionUID = 2316027440863095154L;

    private final String toolName;
    private final FailureKind kind;

    protected ToolExecutionException(
            String toolName, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.toolName = Objects.requireNonNull(toolName, "toolName must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Returns the tool whose invocation failed.
    ///
    /// @return tool name, never null
    public String getToolName() {
        return toolName;
    }

    /// Returns the failure classification.
    ///
    /// @return failure kind, never null
    public FailureKind getKind() {
        return kind;
    }

    /// Returns whether this failure may succeed on a later attempt.
    ///
    /// @return true for transient failures
    public abstract boolean isTransient();
}
