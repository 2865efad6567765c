package io.canopy.core.blackboard;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/// Bounded read cache in front of the blackboard store.
///
/// Entries expire after a fixed time to live. When the cache is full the entry with the
/// fewest accesses is evicted, the least recently accessed one among equals.
///
/// @implNote Thread-safe through the cache's own monitor. The blackboard keeps the cache
/// consistent with the store by writing through under its write lock.
final class BlackboardCache {

    private final int capacity;
    private final long ttlNanos;
    private final LongSupplier clock;
    private final Map<String, Entry> entries = new HashMap<>();

    BlackboardCache(int capacity, Duration ttl) {
        this(capacity, ttl, System::nanoTime);
    }

    BlackboardCache(int capacity, Duration ttl, LongSupplier clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.ttlNanos = Objects.requireNonNull(ttl, "ttl must not be null").toNanos();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Looks a key up, counting the access.
    ///
    /// @return the cached value, or empty on a miss or an expired entry
    synchronized Optional<Object> lookup(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        long now = clock.getAsLong();
        if (now - entry.storedAt > ttlNanos) {
            entries.remove(key);
            return Optional.empty();
        }
        entry.accessCount++;
        entry.lastAccess = now;
        return Optional.of(entry.value);
    }

    synchronized void put(String key, Object value) {
        long now = clock.getAsLong();
        Entry existing = entries.get(key);
        if (existing != null) {
            existing.value = value;
            existing.storedAt = now;
            existing.lastAccess = now;
            return;
        }
        if (entries.size() >= capacity) {
            evictOne();
        }
        entries.put(key, new Entry(value, now));
    }

    synchronized void invalidate(String key) {
        entries.remove(key);
    }

    synchronized void clear() {
        entries.clear();
    }

    synchronized int size() {
        return entries.size();
    }

    synchronized boolean contains(String key) {
        return entries.containsKey(key);
    }

    private void evictOne() {
        String victim = null;
        Entry victimEntry = null;
        Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Entry> candidate = it.next();
            Entry e = candidate.getValue();
            if (victimEntry == null
                    || e.accessCount < victimEntry.accessCount
                    || (e.accessCount == victimEntry.accessCount
                            && e.lastAccess < victimEntry.lastAccess)) {
                victim = candidate.getKey();
                victimEntry = e;
            }
        }
        if (victim != null) {
            entries.remove(victim);
        }
    }

    private static final class Entry {
        private Object value;
        private long storedAt;
        private long lastAccess;
        private long accessCount;

        private Entry(Object value, long now) {
            this.value = value;
            this.storedAt = now;
            this.lastAccess = now;
        }
    }
}
