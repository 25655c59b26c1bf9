package io.weft.core.execution.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/// A cached tool output.
///
/// @param key cache key, not null
/// @param toolName tool that produced the output, not null
/// @param output cached output, may be null
/// @param createdAt time the entry was stored, not null
/// @param duration execution time observed when the output was produced, not null
/// @param hitCount number of times the entry was served
public record CacheEntry(
        String key,
        String toolName,
        Object output,
        Instant createdAt,
        Duration duration,
        long hitCount) {

    public CacheEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(toolName, "toolName must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
    }

    /// Returns a copy with the hit counter incremented.
    ///
    /// @return new entry, never null
    public CacheEntry withHit() {
        return new CacheEntry(key, toolName, output, createdAt, duration, hitCount + 1);
    }

    /// Returns whether the entry is older than the given time-to-live.
    ///
    /// @param ttl time-to-live, null or zero for no expiry
    /// @param now current time, not null
    /// @return true if expired
    public boolean isExpired(Duration ttl, Instant now) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        return createdAt.plus(ttl).isBefore(now);
    }
}
