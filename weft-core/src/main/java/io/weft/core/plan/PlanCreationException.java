package io.weft.core.plan;

import java.io.Serial;

/// Thrown when a plan cannot be created.
///
/// Plan creation is all-or-nothing: when this exception is thrown no partial
/// plan exists. Concrete causes:
/// - {@link io.weft.core.exception.ToolNotFoundException}: a requested tool or one of its
///   dependencies is not registered
/// - {@link io.weft.core.exception.CircularDependencyException}: the dependency graph
///   contains a cycle
///
/// @see io.weft.core.ToolChainCoordinator#createPlan
public class PlanCreationException extends Exception {

    @Serial private static final long serialVersionUID = -3020842179115547718L;

    /// Creates exception with message.
    ///
    /// @param message description of why plan creation failed
    public PlanCreationException(String message) {
        super(message);
    }

    /// Creates exception with message and cause.
    ///
    /// @param message description of why plan creation failed
    /// @param cause the underlying exception
    public PlanCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
