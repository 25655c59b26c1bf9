package io.weft.core.execution.cache;

/// Snapshot of {@link ExecutionCache} statistics.
///
/// `hitRate` keeps its historical meaning: the sum of the hit counters of the
/// live entries, not a ratio. The ratio of hits to lookups is {@link #hitRatio()}.
///
/// @param size number of live entries
/// @param hitRate sum of hit counters over live entries
/// @param totalEntries entries stored since creation or the last clear
/// @param totalHits lookups served since creation or the last clear
/// @param evictions entries dropped for size or age
/// @param lookups lookups since creation or the last clear
public record CacheStats(
        int size, long hitRate, long totalEntries, long totalHits, long evictions, long lookups) {

    /// Returns the fraction of lookups that were hits.
    ///
    /// @return ratio in `[0, 1]`, 0 when nothing was looked up
    public double hitRatio() {
        return lookups == 0 ? 0.0 : (double) totalHits / lookups;
    }
}
