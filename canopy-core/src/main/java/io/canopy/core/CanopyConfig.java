package io.canopy.core;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.engine.TickManager;
import io.canopy.core.forest.BehaviorForest;
import io.canopy.core.util.Values;
import java.time.Duration;
import java.util.Properties;

/// Configuration options for a Canopy environment.
///
/// Controls tick scheduling, blackboard caching, pool sizing and the capacity of the
/// communication logs. Use the {@link Builder} for fluent configuration, setters for
/// mutable configuration, or {@link #fromProperties(Properties)} to read `canopy.*` keys.
///
/// ### Default Values
/// - `tickRate`: `60` ticks per second
/// - `cachingEnabled`: `true`, `cacheCapacity`: `1000`, `cacheTtl`: `300s`
/// - `statsEnabled`: `true`
/// - `threadPoolSize`: `10`
/// - `monitorInterval`: `100ms`
/// - `logLimit`: `1000`, `stateHistoryLimit`: `100`
///
/// ### Property Keys
/// | Key | Type |
/// |-----|------|
/// | `canopy.tick-rate` | decimal |
/// | `canopy.blackboard.caching-enabled` | boolean |
/// | `canopy.blackboard.cache-capacity` | integer |
/// | `canopy.blackboard.cache-ttl` | seconds or ISO-8601 |
/// | `canopy.blackboard.stats-enabled` | boolean |
/// | `canopy.thread-pool-size` | integer |
/// | `canopy.forest.monitor-interval` | seconds or ISO-8601 |
/// | `canopy.communication.log-limit` | integer |
/// | `canopy.communication.state-history-limit` | integer |
///
/// @implNote **Not thread-safe**. Configure before passing to {@link CanopyFactory} and
/// do not modify afterwards.
///
/// @see CanopyFactory#createEnvironment(CanopyConfig)
public class CanopyConfig {

    public static final String PREFIX = "canopy.";
    public static final String TICK_RATE = PREFIX + "tick-rate";
    public static final String CACHING_ENABLED = PREFIX + "blackboard.caching-enabled";
    public static final String CACHE_CAPACITY = PREFIX + "blackboard.cache-capacity";
    public static final String CACHE_TTL = PREFIX + "blackboard.cache-ttl";
    public static final String STATS_ENABLED = PREFIX + "blackboard.stats-enabled";
    public static final String THREAD_POOL_SIZE = PREFIX + "thread-pool-size";
    public static final String MONITOR_INTERVAL = PREFIX + "forest.monitor-interval";
    public static final String LOG_LIMIT = PREFIX + "communication.log-limit";
    public static final String STATE_HISTORY_LIMIT = PREFIX + "communication.state-history-limit";

    private double tickRate = TickManager.DEFAULT_TICK_RATE;
    private boolean cachingEnabled = true;
    private int cacheCapacity = Blackboard.DEFAULT_CACHE_CAPACITY;
    private Duration cacheTtl = Blackboard.DEFAULT_CACHE_TTL;
    private boolean statsEnabled = true;
    private int threadPoolSize = 10;
    private Duration monitorInterval = BehaviorForest.DEFAULT_MONITOR_INTERVAL;
    private int logLimit = CommunicationMiddleware.DEFAULT_LOG_LIMIT;
    private int stateHistoryLimit = CommunicationMiddleware.DEFAULT_STATE_HISTORY_LIMIT;

    /// Creates a configuration with default values.
    public CanopyConfig() {}

    /// Reads a configuration from properties. Missing keys keep their defaults and keys
    /// outside the `canopy.` prefix are ignored.
    ///
    /// @param properties source properties, not null
    /// @return a new configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static CanopyConfig fromProperties(Properties properties) {
        CanopyConfig config = new CanopyConfig();
        config.apply(properties);
        return config;
    }

    /// Overrides values with the `canopy.*` keys present in the properties.
    ///
    /// @param properties source properties, not null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public void apply(Properties properties) {
        String value;
        try {
            if ((value = properties.getProperty(TICK_RATE)) != null) {
                tickRate = Values.toDouble(value);
            }
            if ((value = properties.getProperty(CACHING_ENABLED)) != null) {
                cachingEnabled = Boolean.parseBoolean(value.trim());
            }
            if ((value = properties.getProperty(CACHE_CAPACITY)) != null) {
                cacheCapacity = Values.toInt(value);
            }
            if ((value = properties.getProperty(CACHE_TTL)) != null) {
                cacheTtl = Values.toDuration(value);
            }
            if ((value = properties.getProperty(STATS_ENABLED)) != null) {
                statsEnabled = Boolean.parseBoolean(value.trim());
            }
            if ((value = properties.getProperty(THREAD_POOL_SIZE)) != null) {
                threadPoolSize = Values.toInt(value);
            }
            if ((value = properties.getProperty(MONITOR_INTERVAL)) != null) {
                monitorInterval = Values.toDuration(value);
            }
            if ((value = properties.getProperty(LOG_LIMIT)) != null) {
                logLimit = Values.toInt(value);
            }
            if ((value = properties.getProperty(STATE_HISTORY_LIMIT)) != null) {
                stateHistoryLimit = Values.toInt(value);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid Canopy property value: " + e.getMessage(), e);
        }
    }

    public double getTickRate() {
        return tickRate;
    }

    public void setTickRate(double tickRate) {
        this.tickRate = tickRate;
    }

    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    public void setCachingEnabled(boolean cachingEnabled) {
        this.cachingEnabled = cachingEnabled;
    }

    public int getCacheCapacity() {
        return cacheCapacity;
    }

    public void setCacheCapacity(int cacheCapacity) {
        this.cacheCapacity = cacheCapacity;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
    }

    public boolean isStatsEnabled() {
        return statsEnabled;
    }

    public void setStatsEnabled(boolean statsEnabled) {
        this.statsEnabled = statsEnabled;
    }

    /// Returns the size of the pool that ticks forest nodes.
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// Sets the size of the pool that ticks forest nodes.
    ///
    /// @param threadPoolSize number of threads, must be positive
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    public Duration getMonitorInterval() {
        return monitorInterval;
    }

    public void setMonitorInterval(Duration monitorInterval) {
        this.monitorInterval = monitorInterval;
    }

    public int getLogLimit() {
        return logLimit;
    }

    public void setLogLimit(int logLimit) {
        this.logLimit = logLimit;
    }

    public int getStateHistoryLimit() {
        return stateHistoryLimit;
    }

    public void setStateHistoryLimit(int stateHistoryLimit) {
        this.stateHistoryLimit = stateHistoryLimit;
    }

    /// Creates a blackboard configured with this configuration's cache and stats options.
    ///
    /// @return a new blackboard, never null
    public Blackboard newBlackboard() {
        return new Blackboard(cachingEnabled, cacheCapacity, cacheTtl, statsEnabled);
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "CanopyConfig{tickRate="
                + tickRate
                + ", cachingEnabled="
                + cachingEnabled
                + ", cacheCapacity="
                + cacheCapacity
                + ", cacheTtl="
                + cacheTtl
                + ", statsEnabled="
                + statsEnabled
                + ", threadPoolSize="
                + threadPoolSize
                + ", monitorInterval="
                + monitorInterval
                + ", logLimit="
                + logLimit
                + ", stateHistoryLimit="
                + stateHistoryLimit
                + '}';
    }

    /// Fluent builder for constructing {@link CanopyConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final CanopyConfig config = new CanopyConfig();

        public Builder tickRate(double tickRate) {
            config.tickRate = tickRate;
            return this;
        }

        public Builder cachingEnabled(boolean cachingEnabled) {
            config.cachingEnabled = cachingEnabled;
            return this;
        }

        public Builder cacheCapacity(int cacheCapacity) {
            config.cacheCapacity = cacheCapacity;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            config.cacheTtl = cacheTtl;
            return this;
        }

        public Builder statsEnabled(boolean statsEnabled) {
            config.statsEnabled = statsEnabled;
            return this;
        }

        /// Sets the size of the pool that ticks forest nodes.
        ///
        /// @param threadPoolSize the number of threads, must be positive
        /// @return this builder for chaining, never null
        public Builder threadPoolSize(int threadPoolSize) {
            config.threadPoolSize = threadPoolSize;
            return this;
        }

        public Builder monitorInterval(Duration monitorInterval) {
            config.monitorInterval = monitorInterval;
            return this;
        }

        public Builder logLimit(int logLimit) {
            config.logLimit = logLimit;
            return this;
        }

        public Builder stateHistoryLimit(int stateHistoryLimit) {
            config.stateHistoryLimit = stateHistoryLimit;
            return this;
        }

        /// Builds and returns the configured {@link CanopyConfig} instance.
        ///
        /// @return the configured instance, never null
        public CanopyConfig build() {
            return config;
        }
    }
}
