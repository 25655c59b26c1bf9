package io.weft.core.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.weft.core.execution.FailureKind;
import io.weft.core.execution.PermanentExecutionException;
import io.weft.core.execution.TransientExecutionException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

    @Test
    void shouldNotRetryWithDefaultPolicy() {
        RetryPolicy policy = RetryPolicy.none();

        assertThat(policy.maxRetries()).isZero();
        assertThat(
                        policy.shouldRetry(
                                new TransientExecutionException("t", FailureKind.TIMEOUT, "slow"),
                                0))
                .isFalse();
    }

    @Test
    void shouldRetryListedTransientFailuresUntilExhausted() {
        RetryPolicy policy = RetryPolicy.enhanced();
        TransientExecutionException failure =
                new TransientExecutionException("t", FailureKind.SERVICE_UNAVAILABLE, "busy");

        assertThat(policy.shouldRetry(failure, 0)).isTrue();
        assertThat(policy.shouldRetry(failure, 2)).isTrue();
        assertThat(policy.shouldRetry(failure, 3)).isFalse();
    }

    @Test
    void shouldIgnoreUnlistedKinds() {
        RetryPolicy policy = RetryPolicy.none().withMaxRetries(2);

        assertThat(
                        policy.shouldRetry(
                                new TransientExecutionException(
                                        "t", FailureKind.SERVICE_UNAVAILABLE, "busy"),
                                0))
                .isFalse();
        assertThat(
                        policy.shouldRetry(
                                new TransientExecutionException(
                                        "t", FailureKind.NETWORK_ERROR, "reset"),
                                0))
                .isTrue();
    }

    @Test
    void shouldNeverRetryPermanentFailures() {
        RetryPolicy policy = RetryPolicy.enhanced();

        assertThat(
                        policy.shouldRetry(
                                new PermanentExecutionException(
                                        "t", FailureKind.TIMEOUT, "rejected"),
                                0))
                .isFalse();
    }

    @Test
    void shouldBackOffLinearly() {
        RetryPolicy policy = RetryPolicy.enhanced().withBackoff(Duration.ofMillis(200));

        assertThat(policy.backoffFor(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.backoffFor(3)).isEqualTo(Duration.ofMillis(600));
    }

    @Test
    void shouldRejectNegativeRetries() {
        assertThatThrownBy(() -> RetryPolicy.none().withMaxRetries(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDefaultNullBackoff() {
        assertThat(new RetryPolicy(1, null, null).backoff())
                .isEqualTo(RetryPolicy.DEFAULT_BACKOFF);
    }
}
