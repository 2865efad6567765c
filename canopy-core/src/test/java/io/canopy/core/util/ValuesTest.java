package io.canopy.core.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ValuesTest {

    @Nested
    class DurationTest {

        @Test
        void shouldReadSecondsAndIsoText() {
            assertThat(Values.toDuration(2)).isEqualTo(Duration.ofSeconds(2));
            assertThat(Values.toDuration(0.25)).isEqualTo(Duration.ofMillis(250));
            assertThat(Values.toDuration("1.5")).isEqualTo(Duration.ofMillis(1500));
            assertThat(Values.toDuration("PT3S")).isEqualTo(Duration.ofSeconds(3));
            assertThat(Values.toDuration(Duration.ofMinutes(1))).isEqualTo(Duration.ofMinutes(1));
        }

        @ParameterizedTest
        @ValueSource(strings = {"soon", "-1"})
        void shouldRejectUnreadableDurations(String text) {
            assertThatThrownBy(() -> Values.toDuration(text)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class ComparisonTest {

        @Test
        void shouldCompareNumbersAcrossTypes() {
            assertThat(Values.looselyEquals(1, 1L)).isTrue();
            assertThat(Values.looselyEquals(1, 1.0)).isTrue();
            assertThat(Values.looselyEquals(new BigDecimal("2.50"), 2.5)).isTrue();
            assertThat(Values.looselyEquals("1", 1)).isFalse();
            assertThat(Values.looselyEquals(null, null)).isTrue();
        }

        @Test
        void shouldOrderValues() {
            assertThat(Values.compare(2, 1.5)).isPositive();
            assertThat(Values.compare("a", "b")).isNegative();
            assertThatThrownBy(() -> Values.compare("a", 1)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> Values.compare(null, 1)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldConvertNumbers() {
            assertThat(Values.toInt(" 42 ")).isEqualTo(42);
            assertThat(Values.toInt(3.9)).isEqualTo(3);
            assertThat(Values.toDouble("0.5")).isEqualTo(0.5);
        }
    }
}
