package io.weft.core.performance;

import io.weft.core.tool.ToolDefinition;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Keyed store of {@link PerformanceProfile}s.
///
/// @implNote Thread-safe. Every update is a single `ConcurrentHashMap.compute`
/// call, so concurrent observations of the same tool never lose an update and
/// observations of different tools never contend.
public final class ProfileStore {

    private final Map<String, PerformanceProfile> profiles = new ConcurrentHashMap<>();

    /// Seeds (or re-seeds) the profile of a tool from its declared estimates.
    ///
    /// @param tool the tool definition, not null
    public void initialize(ToolDefinition tool) {
        Objects.requireNonNull(tool, "tool must not be null");
        profiles.put(tool.name(), PerformanceProfile.initial(tool));
    }

    /// Records one observation for a tool, creating an empty profile if none exists.
    ///
    /// @param toolName tool identifier, not null
    /// @param durationMillis observed duration in milliseconds
    /// @param cost observed cost
    /// @param success whether the invocation succeeded
    /// @return the updated profile, never null
    public PerformanceProfile record(
            String toolName, double durationMillis, double cost, boolean success) {
        Objects.requireNonNull(toolName, "toolName must not be null");
        return profiles.compute(
                toolName,
                (name, current) ->
                        (current != null ? current : PerformanceProfile.empty(name))
                                .record(durationMillis, cost, success));
    }

    public Optional<PerformanceProfile> get(String toolName) {
        return Optional.ofNullable(profiles.get(toolName));
    }

    /// Returns an immutable snapshot of all profiles.
    ///
    /// @return profile map keyed by tool name, never null
    public Map<String, PerformanceProfile> snapshot() {
        return Map.copyOf(profiles);
    }

    public void remove(String toolName) {
        profiles.remove(toolName);
    }

    public void clear() {
        profiles.clear();
    }

    public int size() {
        return profiles.size();
    }
}
