package io.weft.core.plan;

import io.weft.core.execution.FailureKind;
import io.weft.core.execution.ToolExecutionException;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/// Retry behaviour attached to a {@link PlanStep}.
///
/// Backoff is **linear**: the sleep before retry `n` (1-based) is `backoff × n`.
///
/// ### Contracts
/// - **Precondition**: `maxRetries >= 0`; `backoff` not negative
/// - **Postcondition**: All fields immutable after construction
///
/// @param maxRetries number of retries after the first attempt
/// @param backoff linear backoff base, never null after construction
/// @param retryOn failure kinds that trigger a retry, never null after construction
public record RetryPolicy(int maxRetries, Duration backoff, Set<FailureKind> retryOn) {

    /// Default backoff base.
    public static final Duration DEFAULT_BACKOFF = Duration.ofMillis(1000);

    /// Retries granted to historically unreliable tools.
    public static final int ENHANCED_MAX_RETRIES = 3;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        backoff = backoff != null ? backoff : DEFAULT_BACKOFF;
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        retryOn =
                retryOn == null || retryOn.isEmpty()
                        ? Set.of()
                        : Set.copyOf(EnumSet.copyOf(retryOn));
    }

    /// Light default policy: no retries, triggers on timeouts and network errors.
    ///
    /// @return default policy, never null
    public static RetryPolicy none() {
        return new RetryPolicy(
                0, DEFAULT_BACKOFF, EnumSet.of(FailureKind.TIMEOUT, FailureKind.NETWORK_ERROR));
    }

    /// Policy for unreliable tools: 3 retries, 1s linear backoff, triggers on
    /// timeouts, network errors and temporary unavailability.
    ///
    /// @return enhanced policy, never null
    public static RetryPolicy enhanced() {
        return new RetryPolicy(
                ENHANCED_MAX_RETRIES,
                DEFAULT_BACKOFF,
                EnumSet.of(
                        FailureKind.TIMEOUT,
                        FailureKind.NETWORK_ERROR,
                        FailureKind.SERVICE_UNAVAILABLE));
    }

    /// Returns a copy with a different retry count.
    ///
    /// @param retries new retry count, must be >= 0
    /// @return new policy, never null
    public RetryPolicy withMaxRetries(int retries) {
        return new RetryPolicy(retries, backoff, retryOn);
    }

    /// Returns a copy with a different backoff base.
    ///
    /// @param newBackoff new backoff base, not null
    /// @return new policy, never null
    public RetryPolicy withBackoff(Duration newBackoff) {
        return new RetryPolicy(maxRetries, newBackoff, retryOn);
    }

    /// Decides whether a failed attempt should be retried.
    ///
    /// @param failure the failure of the latest attempt, not null
    /// @param retriesSoFar retries already performed
    /// @return true if the failure is transient, its kind is listed and retries remain
    public boolean shouldRetry(ToolExecutionException failure, int retriesSoFar) {
        Objects.requireNonNull(failure, "failure must not be null");
        return failure.isTransient()
                && retryOn.contains(failure.getKind())
                && retriesSoFar < maxRetries;
    }

    /// Returns the sleep before the given retry.
    ///
    /// @param retryNumber 1-based retry number
    /// @return `backoff × retryNumber`, never null
    public Duration backoffFor(int retryNumber) {
        return backoff.multipliedBy(Math.max(retryNumber, 0));
    }
}
