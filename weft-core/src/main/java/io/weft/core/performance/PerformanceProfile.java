package io.weft.core.performance;

import io.weft.core.tool.ToolDefinition;
import java.util.Objects;

/// Running performance statistics of one tool.
///
/// Each observation updates the averages with a plain cumulative running mean:
/// with `n` the sample count after the update,
/// `avg' = avg × (1 − 1/n) + sample × (1/n)`. The first observation therefore
/// replaces the declared estimates entirely.
///
/// @param toolName tool identifier, not null
/// @param averageDuration mean duration in milliseconds
/// @param averageCost mean cost per invocation in USD
/// @param successRate fraction of successful invocations, in `[0, 1]`
/// @param sampleCount number of observations
public record PerformanceProfile(
        String toolName,
        double averageDuration,
        double averageCost,
        double successRate,
        long sampleCount) {

    public PerformanceProfile {
        Objects.requireNonNull(toolName, "toolName must not be null");
        if (sampleCount < 0) {
            throw new IllegalArgumentException("sampleCount must be >= 0");
        }
    }

    /// Creates a sample-free profile seeded with a tool's declared estimates.
    ///
    /// @param tool the tool definition, not null
    /// @return initial profile, never null
    public static PerformanceProfile initial(ToolDefinition tool) {
        return new PerformanceProfile(
                tool.name(),
                tool.estimatedDuration().toMillis(),
                tool.costPerExecution(),
                tool.reliability(),
                0);
    }

    /// Creates an empty profile for a tool without declared estimates.
    ///
    /// @param toolName tool identifier, not null
    /// @return empty profile, never null
    public static PerformanceProfile empty(String toolName) {
        return new PerformanceProfile(toolName, 0.0, 0.0, 1.0, 0);
    }

    /// Returns a new profile that includes one more observation.
    ///
    /// @param durationMillis observed duration in milliseconds
    /// @param cost observed cost
    /// @param success whether the invocation succeeded
    /// @return updated profile, never null
    public PerformanceProfile record(double durationMillis, double cost, boolean success) {
        long n = sampleCount + 1;
        double weight = 1.0 / n;
        return new PerformanceProfile(
                toolName,
                averageDuration * (1 - weight) + durationMillis * weight,
                averageCost * (1 - weight) + cost * weight,
                successRate * (1 - weight) + (success ? 1.0 : 0.0) * weight,
                n);
    }

    /// Returns whether at least one observation was recorded.
    ///
    /// @return true if `sampleCount > 0`
    public boolean hasSamples() {
        return sampleCount > 0;
    }
}
