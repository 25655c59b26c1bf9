package io.weft.core.execution;

import java.util.Objects;

/// Advice attached to an {@link ExecutionResult}.
///
/// @param type concern the recommendation addresses, not null
/// @param message human-readable advice, not null
/// @param priority urgency, not null
public record Recommendation(Type type, String message, Priority priority) {

    /// Concern addressed by a recommendation or suggestion.
    public enum Type {
        PERFORMANCE,
        COST,
        RELIABILITY,
        PARALLELISM
    }

    /// Urgency of a recommendation.
    public enum Priority {
        LOW,
        MEDIUM,
        HIGH
    }

    public Recommendation {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
    }
}
