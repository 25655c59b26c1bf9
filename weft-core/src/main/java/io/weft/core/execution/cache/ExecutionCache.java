package io.weft.core.execution.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Bounded store of successful tool outputs.
///
/// Entries are evicted least-recently-used first once `maxEntries` is reached, and
/// lazily dropped on lookup when older than the time-to-live. Plans opt in through
/// {@link io.weft.core.plan.OptimizationSettings#cachingEnabled()}; tools through
/// {@link io.weft.core.tool.ToolDefinition#cacheEnabled()}.
///
/// ### Contracts
/// - **Invariant**: `size() <= maxEntries`
/// - **Postcondition**: a successful {@link #lookup} increments the entry's hit count
///
/// @implNote Thread-safe. Every public method holds the cache monitor for its whole
/// duration, so a lookup-and-count or a store-and-evict is atomic.
public class ExecutionCache {

    private static final Logger logger = Logger.getLogger(ExecutionCache.class.getName());

    /// Default maximum number of entries.
    public static final int DEFAULT_MAX_ENTRIES = 1000;

    /// Default time-to-live.
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final int maxEntries;
    private final Duration ttl;
    private final Clock clock;
    private final LinkedHashMap<String, CacheEntry> entries;

    private long totalEntries;
    private long totalHits;
    private long lookups;
    private long evictions;

    /// Creates a cache with default bounds.
    public ExecutionCache() {
        this(DEFAULT_MAX_ENTRIES, DEFAULT_TTL, Clock.systemUTC());
    }

    /// Creates a cache.
    ///
    /// @param maxEntries maximum number of entries, must be positive
    /// @param ttl time-to-live, null or zero for no expiry
    /// @param clock clock used for entry timestamps, not null
    public ExecutionCache(int maxEntries, Duration ttl, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.maxEntries = maxEntries;
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /// Looks up an entry and counts the hit.
    ///
    /// @param key cache key, not null
    /// @return the entry after its hit count was incremented, or empty on a miss
    public synchronized Optional<CacheEntry> lookup(String key) {
        Objects.requireNonNull(key, "key must not be null");
        lookups++;
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(ttl, clock.instant())) {
            entries.remove(key);
            evictions++;
            logger.fine(() -> "Expired cache entry " + key);
            return Optional.empty();
        }
        CacheEntry hit = entry.withHit();
        entries.put(key, hit);
        totalHits++;
        return Optional.of(hit);
    }

    /// Returns an entry without counting a hit or refreshing its recency.
    ///
    /// @param key cache key, not null
    /// @return the entry if present
    public synchronized Optional<CacheEntry> peek(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /// Stores an output, replacing any entry under the same key.
    ///
    /// @param key cache key, not null
    /// @param toolName producing tool, not null
    /// @param output output to cache, may be null
    /// @param duration observed execution time, not null
    /// @return the stored entry, never null
    public synchronized CacheEntry store(
            String key, String toolName, Object output, Duration duration) {
        CacheEntry entry = new CacheEntry(key, toolName, output, clock.instant(), duration, 0);
        entries.put(key, entry);
        totalEntries++;
        evictOverflow();
        return entry;
    }

    /// Removes every entry and resets the counters.
    public synchronized void clear() {
        entries.clear();
        totalEntries = 0;
        totalHits = 0;
        lookups = 0;
        evictions = 0;
    }

    /// Drops entries older than the time-to-live.
    ///
    /// @return number of entries dropped
    public synchronized int purgeExpired() {
        Instant now = clock.instant();
        int purged = 0;
        Iterator<CacheEntry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(ttl, now)) {
                it.remove();
                purged++;
            }
        }
        evictions += purged;
        return purged;
    }

    public synchronized int size() {
        return entries.size();
    }

    /// Returns a statistics snapshot.
    ///
    /// @return statistics, never null
    public synchronized CacheStats stats() {
        long hitCounters = entries.values().stream().mapToLong(CacheEntry::hitCount).sum();
        return new CacheStats(
                entries.size(), hitCounters, totalEntries, totalHits, evictions, lookups);
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public Duration getTtl() {
        return ttl;
    }

    private void evictOverflow() {
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        while (entries.size() > maxEntries && it.hasNext()) {
            Map.Entry<String, CacheEntry> eldest = it.next();
            it.remove();
            evictions++;
            logger.fine(() -> "Evicted cache entry " + eldest.getKey());
        }
    }
}
