package io.canopy.core.blackboard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BlackboardCacheTest {

    private final AtomicLong clock = new AtomicLong();
    private BlackboardCache cache;

    @BeforeEach
    void setUp() {
        cache = new BlackboardCache(2, Duration.ofSeconds(10), clock::get);
    }

    @Test
    void shouldExpireEntriesAfterTtl() {
        // Given
        cache.put("key", "value");

        // When
        clock.addAndGet(Duration.ofSeconds(11).toNanos());

        // Then
        assertThat(cache.lookup("key")).isEmpty();
        assertThat(cache.contains("key")).isFalse();
    }

    @Test
    void shouldServeEntriesWithinTtl() {
        cache.put("key", "value");
        clock.addAndGet(Duration.ofSeconds(5).toNanos());

        assertThat(cache.lookup("key")).contains("value");
    }

    @Test
    void shouldEvictLeastAccessedEntryWhenFull() {
        // Given
        cache.put("hot", 1);
        cache.put("cold", 2);
        cache.lookup("hot");

        // When
        cache.put("new", 3);

        // Then
        assertThat(cache.contains("hot")).isTrue();
        assertThat(cache.contains("cold")).isFalse();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void shouldEvictOldestAmongEquallyAccessed() {
        // Given
        cache.put("older", 1);
        clock.incrementAndGet();
        cache.put("newer", 2);

        // When
        clock.incrementAndGet();
        cache.put("third", 3);

        // Then
        assertThat(cache.contains("older")).isFalse();
        assertThat(cache.contains("newer")).isTrue();
    }

    @Test
    void shouldOverwriteWithoutEvicting() {
        cache.put("a", 1);
        cache.put("b", 2);

        cache.put("a", 10);

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.lookup("a")).contains(10);
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new BlackboardCache(0, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
