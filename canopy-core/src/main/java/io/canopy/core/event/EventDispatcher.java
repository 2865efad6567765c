package io.canopy.core.event;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Named, latched events that threads can wait on.
///
/// Emitting an event sets its flag and records an {@link EventInfo}. An emission that
/// happens while threads are waiting releases all of them. An emission with nobody waiting
/// stays latched until the next waiter consumes it. Waiting never throws on timeout; it
/// reports `false`.
///
/// ### Usage
/// {@snippet :
/// EventDispatcher events = new EventDispatcher();
/// events.emit("target_spotted", "scanner", position);
/// if (events.waitFor("target_spotted", Duration.ofSeconds(1))) {
///     // react
/// }
/// }
///
/// @implNote Thread-safe. All flags share one lock and condition; emissions are rare
/// compared to ticks, so the broadcast wake-up stays cheap.
public class EventDispatcher {

    private static final Logger logger = Logger.getLogger(EventDispatcher.class.getName());

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition triggered = lock.newCondition();
    private final Map<String, EventInfo> infos = new HashMap<>();
    private final Set<String> pending = new LinkedHashSet<>();
    private final Map<String, Long> lastEmission = new HashMap<>();
    private final Map<String, Integer> waiting = new HashMap<>();
    private long emissions;
    private final Map<String, List<EventListener>> listeners = new ConcurrentHashMap<>();

    /// Emits an event, releasing every waiter and then notifying listeners.
    ///
    /// @param name event name, not null
    /// @param source emitter name, may be null
    /// @param data payload, may be null
    /// @return the recorded occurrence, never null
    public EventInfo emit(String name, String source, Object data) {
        Objects.requireNonNull(name, "name must not be null");
        EventInfo info;
        lock.lock();
        try {
            EventInfo previous = infos.get(name);
            long count = previous == null ? 1 : previous.triggerCount() + 1;
            info = new EventInfo(name, source, Instant.now(), count, data);
            infos.put(name, info);
            pending.add(name);
            lastEmission.put(name, ++emissions);
            triggered.signalAll();
        } finally {
            lock.unlock();
        }
        for (EventListener listener : listeners.getOrDefault(name, List.of())) {
            try {
                listener.onEvent(info);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Listener for event '" + name + "' failed", e);
            }
        }
        return info;
    }

    public EventInfo emit(String name) {
        return emit(name, null, null);
    }

    /// Waits until an event is emitted and consumes it.
    ///
    /// @param name event name, not null
    /// @param timeout maximum wait, null to wait indefinitely
    /// @return `true` if the event fired, `false` on timeout
    /// @throws InterruptedException if the waiting thread is interrupted
    public boolean waitFor(String name, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(name, "name must not be null");
        return waitForAny(List.of(name), timeout).isPresent();
    }

    /// Waits until any of several events is emitted and consumes that one.
    ///
    /// A latched emission from before the call is returned at once. Otherwise the call
    /// returns on the first emission of any candidate, which also releases every other
    /// thread waiting on it.
    ///
    /// @param names candidate events, not null or empty
    /// @param timeout maximum wait, null to wait indefinitely
    /// @return the event that fired first, or empty on timeout
    /// @throws InterruptedException if the waiting thread is interrupted
    public Optional<String> waitForAny(Collection<String> names, Duration timeout)
            throws InterruptedException {
        requireNames(names);
        long remaining = timeout == null ? Long.MAX_VALUE : timeout.toNanos();
        lock.lockInterruptibly();
        try {
            for (String name : names) {
                if (pending.remove(name)) {
                    return Optional.of(name);
                }
            }
            Map<String, Long> seen = emissionsOf(names);
            enter(names);
            try {
                while (remaining > 0) {
                    remaining = awaitNanos(remaining, timeout == null);
                    for (String name : names) {
                        if (emittedSince(name, seen)) {
                            pending.remove(name);
                            return Optional.of(name);
                        }
                    }
                }
                return Optional.empty();
            } finally {
                leave(names);
            }
        } finally {
            lock.unlock();
        }
    }

    /// Waits until every one of several events has been emitted and consumes them all.
    ///
    /// An event counts once it is latched at the time of the call or emitted during the
    /// wait. Flags are consumed only on success, so a timeout leaves the flags that did
    /// fire untouched.
    ///
    /// @param names required events, not null or empty
    /// @param timeout maximum wait, null to wait indefinitely
    /// @return `true` if all events fired, `false` on timeout
    /// @throws InterruptedException if the waiting thread is interrupted
    public boolean waitForAll(Collection<String> names, Duration timeout)
            throws InterruptedException {
        requireNames(names);
        long remaining = timeout == null ? Long.MAX_VALUE : timeout.toNanos();
        lock.lockInterruptibly();
        try {
            Set<String> latched = new LinkedHashSet<>(names);
            latched.retainAll(pending);
            Map<String, Long> seen = emissionsOf(names);
            enter(names);
            try {
                while (!allFired(names, latched, seen)) {
                    if (remaining <= 0) {
                        return false;
                    }
                    remaining = awaitNanos(remaining, timeout == null);
                }
                pending.removeAll(names);
                return true;
            } finally {
                leave(names);
            }
        } finally {
            lock.unlock();
        }
    }

    /// Registers a synchronous listener for an event.
    ///
    /// @param name event name, not null
    /// @param listener receiver, not null
    public void addListener(String name, EventListener listener) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.computeIfAbsent(name, k -> new CopyOnWriteArrayList<>()).add(listener);
    }

    public boolean removeListener(String name, EventListener listener) {
        List<EventListener> registered = listeners.get(name);
        return registered != null && registered.remove(listener);
    }

    /// Returns whether an event has fired and not yet been consumed.
    public boolean isPending(String name) {
        lock.lock();
        try {
            return pending.contains(name);
        } finally {
            lock.unlock();
        }
    }

    /// Returns the latest occurrence of an event.
    ///
    /// @param name event name, not null
    /// @return the occurrence, or empty if the event was never emitted
    public Optional<EventInfo> getEventInfo(String name) {
        lock.lock();
        try {
            return Optional.ofNullable(infos.get(name));
        } finally {
            lock.unlock();
        }
    }

    /// Returns how many threads are currently waiting on an event.
    public int getWaiterCount(String name) {
        lock.lock();
        try {
            return waiting.getOrDefault(name, 0);
        } finally {
            lock.unlock();
        }
    }

    /// Drops the pending flag of an event, keeping its history.
    public void clearEvent(String name) {
        lock.lock();
        try {
            pending.remove(name);
        } finally {
            lock.unlock();
        }
    }

    /// Forgets an event entirely, including its listeners.
    ///
    /// @return `true` if the event was known
    public boolean removeEvent(String name) {
        listeners.remove(name);
        lock.lock();
        try {
            pending.remove(name);
            return infos.remove(name) != null;
        } finally {
            lock.unlock();
        }
    }

    /// Returns the names of all events emitted so far.
    public Set<String> getEventNames() {
        lock.lock();
        try {
            return Set.copyOf(infos.keySet());
        } finally {
            lock.unlock();
        }
    }

    /// Returns emission counts per event name.
    ///
    /// @return event name to trigger count, never null
    public Map<String, Long> getStats() {
        lock.lock();
        try {
            Map<String, Long> counts = new HashMap<>();
            for (EventInfo info : infos.values()) {
                counts.put(info.name(), info.triggerCount());
            }
            return Map.copyOf(counts);
        } finally {
            lock.unlock();
        }
    }

    private Map<String, Long> emissionsOf(Collection<String> names) {
        Map<String, Long> seen = new HashMap<>();
        for (String name : names) {
            seen.put(name, lastEmission.getOrDefault(name, 0L));
        }
        return seen;
    }

    private boolean emittedSince(String name, Map<String, Long> seen) {
        return lastEmission.getOrDefault(name, 0L) > seen.get(name);
    }

    private boolean allFired(Collection<String> names, Set<String> latched, Map<String, Long> seen) {
        for (String name : names) {
            if (!latched.contains(name) && !emittedSince(name, seen)) {
                return false;
            }
        }
        return true;
    }

    private void enter(Collection<String> names) {
        for (String name : Set.copyOf(names)) {
            waiting.merge(name, 1, Integer::sum);
        }
    }

    private void leave(Collection<String> names) {
        for (String name : Set.copyOf(names)) {
            waiting.computeIfPresent(name, (k, count) -> count == 1 ? null : count - 1);
        }
    }

    private long awaitNanos(long remaining, boolean indefinitely) throws InterruptedException {
        if (indefinitely) {
            triggered.await();
            return Long.MAX_VALUE;
        }
        return triggered.awaitNanos(remaining);
    }

    private static void requireNames(Collection<String> names) {
        Objects.requireNonNull(names, "names must not be null");
        if (names.isEmpty()) {
            throw new IllegalArgumentException("names must not be empty");
        }
        for (String name : names) {
            Objects.requireNonNull(name, "event name must not be null");
        }
    }
}
