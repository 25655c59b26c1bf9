package io.weft.core.plan;

import java.util.Comparator;
import java.util.Objects;

/// An improvement proposed for an {@link ExecutionPlan} before it runs.
///
/// @param type the aspect the suggestion targets, not null
/// @param message human-readable suggestion, not null
/// @param estimatedImpact expected benefit, never null after construction
/// @param difficulty expected effort to apply the suggestion, not null
/// @see PlanAdvisor#suggestOptimizations(ExecutionPlan)
public record OptimizationSuggestion(
        Type type, String message, EstimatedImpact estimatedImpact, Difficulty difficulty) {

    /// Orders suggestions by descending {@link EstimatedImpact#score()}.
    public static final Comparator<OptimizationSuggestion> BY_IMPACT =
            Comparator.comparingDouble((OptimizationSuggestion s) -> s.estimatedImpact().score())
                    .reversed();

    public OptimizationSuggestion {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(difficulty, "difficulty must not be null");
        estimatedImpact = estimatedImpact != null ? estimatedImpact : EstimatedImpact.NONE;
    }

    public enum Type {
        PARALLELISM,
        PERFORMANCE,
        COST,
        RELIABILITY
    }

    public enum Difficulty {
        LOW,
        MEDIUM,
        HIGH
    }

    /// Expected benefit of a suggestion.
    ///
    /// `timeReduction` is a percentage for parallelism suggestions and a relative
    /// factor for caching; `costReduction` is in USD or a relative factor;
    /// `reliabilityImprovement` is a fraction.
    ///
    /// @param timeReduction expected time saving
    /// @param costReduction expected cost saving
    /// @param reliabilityImprovement expected reliability gain
    public record EstimatedImpact(
            double timeReduction, double costReduction, double reliabilityImprovement) {

        public static final EstimatedImpact NONE = new EstimatedImpact(0, 0, 0);

        /// Returns the ranking score `time × 10 + cost × 100 + reliability × 50`.
        ///
        /// @return impact score
        public double score() {
            return timeReduction * 10 + costReduction * 100 + reliabilityImprovement * 50;
        }
    }
}
