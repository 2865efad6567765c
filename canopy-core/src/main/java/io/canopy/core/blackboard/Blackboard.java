package io.canopy.core.blackboard;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

/// Shared key-value store read and written by the nodes of a tree, or by all trees of a
/// forest.
///
/// Values are stored by reference and never copied. Null values are not accepted, use
/// {@link #remove(String)} instead.
///
/// ### Concurrency
/// A single read/write lock guards the store: any number of readers proceed together,
/// a writer excludes everyone else. {@link #transaction(Function)} holds the write lock
/// for a whole unit of work, {@link #read(Function)} holds the read lock for a consistent
/// multi-key view. The lock is reentrant, so the blackboard's own methods may be called
/// from inside a transaction, and its read methods from inside a read.
///
/// ### Caching
/// Reads go through an optional {@link BlackboardCache} kept in sync by write-through.
/// Statistics are advisory and never influence what a read returns.
///
/// @implNote Thread-safe.
///
/// @see BlackboardStats
public class Blackboard {

    public static final int DEFAULT_CACHE_CAPACITY = 1000;
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(300);

    private final Map<String, Object> data = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final BlackboardCache cache;
    private final boolean statsEnabled;

    private final LongAdder reads = new LongAdder();
    private final LongAdder writes = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final LongAdder lockAcquisitions = new LongAdder();
    private final LongAdder lockWaitNanos = new LongAdder();

    /// Creates a blackboard with caching and statistics on, using default cache limits.
    public Blackboard() {
        this(true, DEFAULT_CACHE_CAPACITY, DEFAULT_CACHE_TTL, true);
    }

    /// Creates a blackboard.
    ///
    /// @param cachingEnabled whether reads go through a cache
    /// @param cacheCapacity maximum cached entries, positive
    /// @param cacheTtl time an entry stays valid in the cache, not null
    /// @param statsEnabled whether usage counters are maintained
    public Blackboard(
            boolean cachingEnabled, int cacheCapacity, Duration cacheTtl, boolean statsEnabled) {
        this(cachingEnabled ? new BlackboardCache(cacheCapacity, cacheTtl) : null, statsEnabled);
    }

    Blackboard(BlackboardCache cache, boolean statsEnabled) {
        this.cache = cache;
        this.statsEnabled = statsEnabled;
    }

    /// Returns the value stored under a key.
    ///
    /// @param key the key, not null
    /// @return the value, or null if the key is absent
    public Object get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Lock readLock = acquire(lock.readLock());
        try {
            count(reads);
            if (cache != null) {
                Optional<Object> cached = cache.lookup(key);
                if (cached.isPresent()) {
                    count(cacheHits);
                    return cached.get();
                }
                count(cacheMisses);
            }
            Object value = data.get(key);
            if (cache != null && value != null) {
                cache.put(key, value);
            }
            return value;
        } finally {
            readLock.unlock();
        }
    }

    /// Returns the value stored under a key, or a fallback.
    ///
    /// @param key the key, not null
    /// @param defaultValue returned when the key is absent, may be null
    /// @return the stored value or `defaultValue`
    public Object get(String key, Object defaultValue) {
        Object value = get(key);
        return value != null ? value : defaultValue;
    }

    /// Returns the value under a key if it is an instance of the requested type.
    ///
    /// @param key the key, not null
    /// @param type expected type, not null
    /// @return the typed value, or empty if absent or of another type
    public <T> Optional<T> getAs(String key, Class<T> type) {
        Object value = get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    /// Stores a value, replacing any previous one.
    ///
    /// @param key the key, not null
    /// @param value the value, not null
    public void set(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null, use remove() instead");
        Lock writeLock = acquire(lock.writeLock());
        try {
            count(writes);
            data.put(key, value);
            if (cache != null) {
                cache.put(key, value);
            }
        } finally {
            writeLock.unlock();
        }
    }

    public boolean has(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Lock readLock = acquire(lock.readLock());
        try {
            count(reads);
            return data.containsKey(key);
        } finally {
            readLock.unlock();
        }
    }

    /// Removes a key.
    ///
    /// @param key the key, not null
    /// @return `true` if the key was present
    public boolean remove(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Lock writeLock = acquire(lock.writeLock());
        try {
            count(writes);
            if (cache != null) {
                cache.invalidate(key);
            }
            return data.remove(key) != null;
        } finally {
            writeLock.unlock();
        }
    }

    /// Removes every key and empties the cache.
    public void clear() {
        Lock writeLock = acquire(lock.writeLock());
        try {
            count(writes);
            data.clear();
            if (cache != null) {
                cache.clear();
            }
        } finally {
            writeLock.unlock();
        }
    }

    /// Returns a copy of the current key set.
    public Set<String> keys() {
        Lock readLock = acquire(lock.readLock());
        try {
            return Set.copyOf(data.keySet());
        } finally {
            readLock.unlock();
        }
    }

    public int size() {
        Lock readLock = acquire(lock.readLock());
        try {
            return data.size();
        } finally {
            readLock.unlock();
        }
    }

    /// Returns a consistent copy of every entry.
    ///
    /// @return unmodifiable copy, never null
    public Map<String, Object> snapshot() {
        Lock readLock = acquire(lock.readLock());
        try {
            return Collections.unmodifiableMap(new HashMap<>(data));
        } finally {
            readLock.unlock();
        }
    }

    /// Runs a unit of work while holding the write lock exclusively.
    ///
    /// No other reader or writer observes the blackboard until the work returns or
    /// throws. The lock is released on every exit path.
    ///
    /// @param work operations to perform, not null
    /// @return whatever the work returns
    public <T> T transaction(Function<Blackboard, T> work) {
        Objects.requireNonNull(work, "work must not be null");
        Lock writeLock = acquire(lock.writeLock());
        try {
            return work.apply(this);
        } finally {
            writeLock.unlock();
        }
    }

    /// Runs a read-only unit of work while holding the read lock.
    ///
    /// Other readers proceed concurrently, writers wait until the work returns. The work
    /// must not write: the read lock cannot be upgraded and a write from inside blocks forever.
    ///
    /// @param work reads to perform, not null
    /// @return whatever the work returns
    public <T> T read(Function<Blackboard, T> work) {
        Objects.requireNonNull(work, "work must not be null");
        Lock readLock = acquire(lock.readLock());
        try {
            return work.apply(this);
        } finally {
            readLock.unlock();
        }
    }

    /// Runs a unit of work without result while holding the write lock exclusively.
    ///
    /// @param work operations to perform, not null
    /// @see #transaction(Function)
    public void update(Consumer<Blackboard> work) {
        Objects.requireNonNull(work, "work must not be null");
        transaction(
                bb -> {
                    work.accept(bb);
                    return null;
                });
    }

    public boolean isCachingEnabled() {
        return cache != null;
    }

    /// Returns a snapshot of the usage counters.
    ///
    /// @return the stats, all counters zero when statistics are disabled
    public BlackboardStats getStats() {
        long hits = cacheHits.sum();
        long misses = cacheMisses.sum();
        long lookups = hits + misses;
        long acquisitions = lockAcquisitions.sum();
        return new BlackboardStats(
                reads.sum(),
                writes.sum(),
                hits,
                misses,
                lookups == 0 ? 0.0 : (double) hits / lookups,
                acquisitions == 0
                        ? Duration.ZERO
                        : Duration.ofNanos(lockWaitNanos.sum() / acquisitions),
                size(),
                cache == null ? 0 : cache.size());
    }

    /// Zeroes every usage counter.
    public void resetStats() {
        reads.reset();
        writes.reset();
        cacheHits.reset();
        cacheMisses.reset();
        lockAcquisitions.reset();
        lockWaitNanos.reset();
    }

    private Lock acquire(Lock target) {
        if (!statsEnabled) {
            target.lock();
            return target;
        }
        long start = System.nanoTime();
        target.lock();
        lockWaitNanos.add(System.nanoTime() - start);
        lockAcquisitions.increment();
        return target;
    }

    private void count(LongAdder counter) {
        if (statsEnabled) {
            counter.increment();
        }
    }
}
