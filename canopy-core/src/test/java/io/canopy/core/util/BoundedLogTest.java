package io.canopy.core.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BoundedLogTest {

    @Test
    void shouldDropOldestEntriesBeyondCapacity() {
        // Given
        BoundedLog<Integer> log = new BoundedLog<>(3);

        // When
        for (int i = 1; i <= 5; i++) {
            log.add(i);
        }

        // Then
        assertThat(log.snapshot()).containsExactly(3, 4, 5);
        assertThat(log.size()).isEqualTo(3);
        assertThat(log.getCapacity()).isEqualTo(3);
    }

    @Test
    void shouldFilterSnapshot() {
        BoundedLog<Integer> log = new BoundedLog<>(10);
        for (int i = 1; i <= 6; i++) {
            log.add(i);
        }

        assertThat(log.snapshot(i -> i % 2 == 0)).containsExactly(2, 4, 6);
    }

    @Test
    void shouldClear() {
        BoundedLog<String> log = new BoundedLog<>(2);
        log.add("a");

        log.clear();

        assertThat(log.snapshot()).isEmpty();
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThatThrownBy(() -> new BoundedLog<>(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
