package io.canopy.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.canopy.core.blackboard.Blackboard;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class CanopyConfigTest {

    @Test
    void shouldUseDefaults() {
        CanopyConfig config = new CanopyConfig();

        assertThat(config.getTickRate()).isEqualTo(60.0);
        assertThat(config.isCachingEnabled()).isTrue();
        assertThat(config.getCacheCapacity()).isEqualTo(1000);
        assertThat(config.getCacheTtl()).isEqualTo(Duration.ofSeconds(300));
        assertThat(config.getThreadPoolSize()).isEqualTo(10);
        assertThat(config.getMonitorInterval()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.getLogLimit()).isEqualTo(1000);
        assertThat(config.getStateHistoryLimit()).isEqualTo(100);
    }

    @Test
    void shouldReadProperties() {
        // Given
        Properties properties = new Properties();
        properties.setProperty(CanopyConfig.TICK_RATE, "12.5");
        properties.setProperty(CanopyConfig.CACHING_ENABLED, "false");
        properties.setProperty(CanopyConfig.CACHE_TTL, "2");
        properties.setProperty(CanopyConfig.LOG_LIMIT, " 20 ");
        properties.setProperty("unrelated.key", "ignored");

        // When
        CanopyConfig config = CanopyConfig.fromProperties(properties);

        // Then
        assertThat(config.getTickRate()).isEqualTo(12.5);
        assertThat(config.isCachingEnabled()).isFalse();
        assertThat(config.getCacheTtl()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.getLogLimit()).isEqualTo(20);
        assertThat(config.getCacheCapacity()).isEqualTo(1000);
    }

    @Test
    void shouldRejectMalformedNumbers() {
        Properties properties = new Properties();
        properties.setProperty(CanopyConfig.THREAD_POOL_SIZE, "many");

        assertThatThrownBy(() -> CanopyConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid Canopy property value");
    }

    @Test
    void shouldBuildFluentlyAndCreateBlackboard() {
        CanopyConfig config = CanopyConfig.builder()
                .tickRate(5)
                .cachingEnabled(false)
                .statsEnabled(false)
                .stateHistoryLimit(7)
                .build();

        Blackboard blackboard = config.newBlackboard();

        assertThat(config.getTickRate()).isEqualTo(5.0);
        assertThat(config.getStateHistoryLimit()).isEqualTo(7);
        assertThat(blackboard.isCachingEnabled()).isFalse();
        assertThat(config.toString()).contains("tickRate=5.0");
    }
}
