package io.canopy.core.communication;

import io.canopy.core.util.BoundedLog;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Watched state values with per-key change history.
///
/// An update that leaves the value equal to the current one is ignored. A real change
/// is recorded in the key's bounded history and then delivered to every watcher of the
/// key concurrently.
public class StateStore {

    private static final Logger logger = Logger.getLogger(StateStore.class.getName());

    private final Map<String, Object> state = new HashMap<>();
    private final Map<String, BoundedLog<StateChange>> history = new HashMap<>();
    private final Map<String, List<StateWatcher>> watchers = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private final int historyLimit;

    StateStore(ExecutorService executor, int historyLimit) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("historyLimit must be positive, got " + historyLimit);
        }
        this.historyLimit = historyLimit;
    }

    /// Registers a watcher for a key.
    ///
    /// @param key state key, not null
    /// @param watcher callback, not null
    /// @param source name of the watching tree, used for logging
    public void watch(String key, StateWatcher watcher, String source) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(watcher, "watcher must not be null");
        watchers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(watcher);
        logger.fine(source + " watches state '" + key + "'");
    }

    public boolean unwatch(String key, StateWatcher watcher) {
        List<StateWatcher> registered = watchers.get(key);
        return registered != null && registered.remove(watcher);
    }

    /// Updates a value and notifies watchers if it changed.
    ///
    /// @param key state key, not null
    /// @param value new value, not null
    /// @param source updater name, not null
    /// @return `true` if the value changed
    public boolean update(String key, Object value, String source) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        StateChange change;
        synchronized (this) {
            Object previous = state.get(key);
            if (Objects.equals(previous, value)) {
                return false;
            }
            state.put(key, value);
            change = new StateChange(key, previous, value, source, Instant.now());
            history.computeIfAbsent(key, k -> new BoundedLog<>(historyLimit)).add(change);
        }
        List<FanOut.Delivery> deliveries = watchers.getOrDefault(key, List.of()).stream()
                .map(w -> (FanOut.Delivery) () -> w.onChange(change))
                .toList();
        FanOut.runAll(executor, "Watcher of '" + key + "'", deliveries);
        return true;
    }

    /// Returns the current value of a key, or null if it was never set.
    public synchronized Object get(String key) {
        return state.get(key);
    }

    /// Returns the recorded changes of a key oldest first.
    public synchronized List<StateChange> getHistory(String key) {
        BoundedLog<StateChange> log = history.get(key);
        return log == null ? List.of() : log.snapshot();
    }

    public Set<String> getWatchedKeys() {
        return Set.copyOf(watchers.keySet());
    }

    synchronized int size() {
        return state.size();
    }
}
