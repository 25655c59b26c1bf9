package io.weft.core.execution.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExecutionCacheTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Nested
    class Lookup {

        @Test
        void shouldMissOnEmptyCache() {
            ExecutionCache cache = new ExecutionCache(10, Duration.ofMinutes(1), clock);

            assertThat(cache.lookup("k")).isEmpty();
            assertThat(cache.stats().lookups()).isEqualTo(1);
            assertThat(cache.stats().hitRatio()).isZero();
        }

        @Test
        void shouldCountHitsOnEntry() {
            ExecutionCache cache = new ExecutionCache(10, Duration.ofMinutes(1), clock);
            cache.store("k", "fetch", "page", Duration.ofMillis(120));

            cache.lookup("k");
            CacheEntry entry = cache.lookup("k").orElseThrow();

            assertThat(entry.output()).isEqualTo("page");
            assertThat(entry.hitCount()).isEqualTo(2);
            assertThat(entry.duration()).isEqualTo(Duration.ofMillis(120));
            CacheStats stats = cache.stats();
            assertThat(stats.hitRate()).isEqualTo(2);
            assertThat(stats.totalHits()).isEqualTo(2);
            assertThat(stats.hitRatio()).isEqualTo(1.0);
        }

        @Test
        void shouldNotCountPeek() {
            ExecutionCache cache = new ExecutionCache(10, Duration.ofMinutes(1), clock);
            cache.store("k", "fetch", "page", Duration.ZERO);

            assertThat(cache.peek("k")).map(CacheEntry::hitCount).contains(0L);
            assertThat(cache.stats().lookups()).isZero();
        }

        @Test
        void shouldCacheNullOutput() {
            ExecutionCache cache = new ExecutionCache(10, Duration.ofMinutes(1), clock);
            cache.store("k", "noop", null, Duration.ZERO);

            assertThat(cache.lookup("k")).isPresent().get().extracting(CacheEntry::output).isNull();
        }
    }

    @Nested
    class Expiry {

        @Test
        void shouldExpireEntryAfterTtl() {
            ExecutionCache cache = new ExecutionCache(10, Duration.ofMinutes(1), clock);
            cache.store("k", "fetch", "page", Duration.ZERO);

            clock.advance(Duration.ofSeconds(59));
            assertThat(cache.lookup("k")).isPresent();

            clock.advance(Duration.ofSeconds(2));
            assertThat(cache.lookup("k")).isEmpty();
            assertThat(cache.size()).isZero();
            assertThat(cache.stats().evictions()).isEqualTo(1);
        }

        @Test
        void shouldNeverExpireWithoutTtl() {
            ExecutionCache cache = new ExecutionCache(10, null, clock);
            cache.store("k", "fetch", "page", Duration.ZERO);

            clock.advance(Duration.ofDays(365));

            assertThat(cache.lookup("k")).isPresent();
        }

        @Test
        void shouldPurgeOnlyExpiredEntries() {
            ExecutionCache cache = new ExecutionCache(10, Duration.ofMinutes(1), clock);
            cache.store("old", "fetch", "a", Duration.ZERO);
            clock.advance(Duration.ofSeconds(45));
            cache.store("new", "fetch", "b", Duration.ZERO);
            clock.advance(Duration.ofSeconds(30));

            assertThat(cache.purgeExpired()).isEqualTo(1);
            assertThat(cache.peek("old")).isEmpty();
            assertThat(cache.peek("new")).isPresent();
        }
    }

    @Nested
    class Eviction {

        @Test
        void shouldEvictLeastRecentlyUsedEntry() {
            ExecutionCache cache = new ExecutionCache(2, Duration.ofMinutes(1), clock);
            cache.store("a", "t", 1, Duration.ZERO);
            cache.store("b", "t", 2, Duration.ZERO);
            cache.lookup("a");

            cache.store("c", "t", 3, Duration.ZERO);

            assertThat(cache.size()).isEqualTo(2);
            assertThat(cache.peek("b")).isEmpty();
            assertThat(cache.peek("a")).isPresent();
            assertThat(cache.peek("c")).isPresent();
            assertThat(cache.stats().evictions()).isEqualTo(1);
        }

        @Test
        void shouldReplaceEntryUnderSameKeyWithoutEviction() {
            ExecutionCache cache = new ExecutionCache(1, Duration.ofMinutes(1), clock);
            cache.store("a", "t", 1, Duration.ZERO);
            cache.store("a", "t", 2, Duration.ZERO);

            assertThat(cache.peek("a")).map(CacheEntry::output).contains(2);
            assertThat(cache.stats().evictions()).isZero();
            assertThat(cache.stats().totalEntries()).isEqualTo(2);
        }

        @Test
        void shouldResetCountersOnClear() {
            ExecutionCache cache = new ExecutionCache(10, Duration.ofMinutes(1), clock);
            cache.store("a", "t", 1, Duration.ZERO);
            cache.lookup("a");

            cache.clear();

            assertThat(cache.stats()).isEqualTo(new CacheStats(0, 0, 0, 0, 0, 0));
        }

        @Test
        void shouldRejectNonPositiveBound() {
            assertThatThrownBy(() -> new ExecutionCache(0, Duration.ZERO, clock))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
