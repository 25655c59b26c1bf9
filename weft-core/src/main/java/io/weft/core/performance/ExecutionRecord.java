package io.weft.core.performance;

import io.weft.core.execution.ExecutionResult;
import java.time.Instant;
import java.util.Objects;

/// One entry of the execution history.
///
/// @param planId identifier of the executed plan, not null
/// @param timestamp when the run was recorded, not null
/// @param result the run's result, not null
public record ExecutionRecord(String planId, Instant timestamp, ExecutionResult result) {

    public ExecutionRecord {
        Objects.requireNonNull(planId, "planId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(result, "result must not be null");
    }
}
