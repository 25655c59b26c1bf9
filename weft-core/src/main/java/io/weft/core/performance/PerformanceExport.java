package io.weft.core.performance;

import java.util.List;
import java.util.Map;

/// Snapshot of all performance data, for offline analysis.
///
/// @param profiles per-tool profiles keyed by tool name
/// @param history retained execution history, oldest first
/// @param metrics aggregate report over `history`
public record PerformanceExport(
        Map<String, PerformanceProfile> profiles,
        List<ExecutionRecord> history,
        PerformanceMetrics metrics) {

    public PerformanceExport {
        profiles = profiles != null ? Map.copyOf(profiles) : Map.of();
        history = history != null ? List.copyOf(history) : List.of();
    }
}
