package io.weft.core.execution;

/// Classification of a tool invocation failure.
///
/// Retry policies list the kinds that trigger a retry; see
/// {@link io.weft.core.plan.RetryPolicy#retryOn()}.
public enum FailureKind {
    /// The invocation did not answer in time.
    TIMEOUT,
    /// The transport to the tool failed.
    NETWORK_ERROR,
    /// The tool reported itself temporarily unavailable.
    SERVICE_UNAVAILABLE,
    /// The tool rejected its input.
    INVALID_INPUT,
    /// The tool failed for a reason that will not change on retry.
    INTERNAL
}
