package io.canopy.core.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/// Append-only log keeping the most recent entries up to a fixed capacity.
///
/// Adding to a full log drops the oldest entry.
///
/// @param <T> entry type
/// @implNote Thread-safe through the log's own monitor.
public final class BoundedLog<T> {

    private final int capacity;
    private final Deque<T> entries = new ArrayDeque<>();

    public BoundedLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void add(T entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(entry);
    }

    /// Returns the entries oldest first.
    ///
    /// @return immutable copy, never null
    public synchronized List<T> snapshot() {
        return List.copyOf(entries);
    }

    /// Returns the matching entries oldest first.
    ///
    /// @param filter selection predicate, not null
    /// @return immutable copy, never null
    public synchronized List<T> snapshot(Predicate<? super T> filter) {
        return entries.stream().filter(filter).toList();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public int getCapacity() {
        return capacity;
    }
}
