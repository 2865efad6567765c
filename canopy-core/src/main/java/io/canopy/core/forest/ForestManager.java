package io.canopy.core.forest;

import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.communication.StateWatcher;
import io.canopy.core.event.EventDispatcher;
import io.canopy.core.event.EventListener;
import io.canopy.core.exception.CommunicationException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Coordinates several forests and connects them through a cross-forest
/// {@link CommunicationMiddleware}.
///
/// Lifecycle events of managed forests are forwarded to the global dispatcher with a
/// `_global` suffix, so `forest_started` in any forest becomes `forest_started_global`.
/// The manager itself emits `manager_started` and `manager_stopped`.
///
/// ### Example usage
/// {@snippet :
/// try (ForestManager manager = new ForestManager("site")) {
///     manager.addForest(patrol);
///     manager.addForest(logistics);
///     manager.startAll();
///     manager.setGlobalData("alarm", false);
/// }
/// }
///
/// @implNote Thread-safe. Forest registration and lifecycle changes are serialised on the
/// manager.
public class ForestManager implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ForestManager.class.getName());

    public static final String EVENT_MANAGER_STARTED = "manager_started";
    public static final String EVENT_MANAGER_STOPPED = "manager_stopped";
    public static final String GLOBAL_SUFFIX = "_global";

    private static final List<String> FORWARDED_EVENTS = List.of(
            BehaviorForest.EVENT_STARTED, BehaviorForest.EVENT_STOPPED, BehaviorForest.EVENT_RESET);

    private final String name;
    private final CommunicationMiddleware communication;
    private final Map<String, BehaviorForest> forests = new LinkedHashMap<>();
    private final Map<String, EventListener> forwarders = new LinkedHashMap<>();

    private volatile boolean running;
    private volatile Instant startedAt;

    public ForestManager(String name) {
        this(name, new CommunicationMiddleware(name + "-global"));
    }

    /// Creates a manager.
    ///
    /// @param name manager name, not null
    /// @param communication cross-forest middleware, not null
    public ForestManager(String name, CommunicationMiddleware communication) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.communication = Objects.requireNonNull(communication, "communication must not be null");
    }

    /// Adds a forest and forwards its lifecycle events to the global dispatcher.
    ///
    /// @throws IllegalArgumentException if a forest with the same name is managed
    public synchronized void addForest(BehaviorForest forest) {
        Objects.requireNonNull(forest, "forest must not be null");
        if (forests.containsKey(forest.getName())) {
            throw new IllegalArgumentException("Forest already managed: " + forest.getName());
        }
        forests.put(forest.getName(), forest);
        EventDispatcher global = communication.getEventDispatcher();
        EventListener forwarder = event -> global.emit(event.name() + GLOBAL_SUFFIX, event.source(), event.data());
        FORWARDED_EVENTS.forEach(event -> forest.getEventDispatcher().addListener(event, forwarder));
        forwarders.put(forest.getName(), forwarder);
        logger.info("Manager '" + name + "' added forest '" + forest.getName() + "'");
    }

    /// Removes a forest, stopping it first when it runs.
    ///
    /// @return `true` if the forest was managed
    public synchronized boolean removeForest(String forestName) {
        BehaviorForest forest = forests.remove(forestName);
        if (forest == null) {
            return false;
        }
        forest.stop();
        EventListener forwarder = forwarders.remove(forestName);
        FORWARDED_EVENTS.forEach(event -> forest.getEventDispatcher().removeListener(event, forwarder));
        logger.info("Manager '" + name + "' removed forest '" + forestName + "'");
        return true;
    }

    public synchronized Optional<BehaviorForest> getForest(String forestName) {
        return Optional.ofNullable(forests.get(forestName));
    }

    /// @return managed forests in insertion order, never null
    public synchronized List<BehaviorForest> getForests() {
        return List.copyOf(forests.values());
    }

    public List<BehaviorForest> getForests(boolean runningOnly) {
        return getForests().stream().filter(f -> f.isRunning() == runningOnly).toList();
    }

    // -- Lifecycle --------------------------------------------------------------------------

    /// Starts every forest that is not running. A forest failing to start is logged and
    /// does not prevent the others from starting.
    public void startAll() {
        for (BehaviorForest forest : getForests()) {
            if (!forest.isRunning()) {
                try {
                    forest.start();
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Forest '" + forest.getName() + "' failed to start", e);
                }
            }
        }
    }

    /// Stops every running forest.
    public void stopAll() {
        for (BehaviorForest forest : getForests()) {
            if (forest.isRunning()) {
                try {
                    forest.stop();
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Forest '" + forest.getName() + "' failed to stop", e);
                }
            }
        }
    }

    /// Starts the manager and all its forests. Has no effect while running.
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        startedAt = Instant.now();
        startAll();
        communication.emitSharedEvent(EVENT_MANAGER_STARTED, name, forests.size());
        logger.info("Manager '" + name + "' started with " + forests.size() + " forests");
    }

    /// Stops all forests and the manager. Has no effect while stopped.
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        stopAll();
        startedAt = null;
        communication.emitSharedEvent(EVENT_MANAGER_STOPPED, name, null);
        logger.info("Manager '" + name + "' stopped");
    }

    public boolean isRunning() {
        return running;
    }

    // -- Global communication ---------------------------------------------------------------

    /// Publishes a message on the cross-forest topic bus.
    public void publishGlobal(String topic, Object data) {
        communication.publish(topic, data, name);
    }

    public void setGlobalData(String key, Object value) {
        communication.set(key, value, name);
    }

    public Object getGlobalData(String key, Object defaultValue) {
        return communication.get(key, defaultValue, name);
    }

    public void watchGlobalState(String key, StateWatcher watcher) {
        communication.watchState(key, watcher, name);
    }

    public boolean updateGlobalState(String key, Object value) {
        return communication.updateState(key, value, name);
    }

    /// Posts a task on the cross-forest task board.
    ///
    /// @return the task id
    /// @throws CommunicationException if the cross-forest middleware is disabled
    public String publishGlobalTask(
            String title, String description, Set<String> requirements, int priority, Map<String, Object> data)
            throws CommunicationException {
        return communication
                .publishTask(title, description, requirements, priority, data)
                .orElseThrow(() -> new CommunicationException("Communication of manager '" + name + "' is disabled"));
    }

    public CommunicationMiddleware getCommunication() {
        return communication;
    }

    // -- Inspection -------------------------------------------------------------------------

    public Optional<ForestInfo> getForestInfo(String forestName) {
        return getForest(forestName).map(ForestManager::describe);
    }

    public List<ForestInfo> getAllForestInfo() {
        List<ForestInfo> infos = new ArrayList<>();
        getForests().forEach(f -> infos.add(describe(f)));
        return infos;
    }

    public ForestManagerStats getStats() {
        List<BehaviorForest> snapshot = getForests();
        int runningForests = (int) snapshot.stream().filter(BehaviorForest::isRunning).count();
        int totalNodes = snapshot.stream().mapToInt(f -> f.getNodes().size()).sum();
        Instant since = startedAt;
        Duration uptime = since == null ? Duration.ZERO : Duration.between(since, Instant.now());
        return new ForestManagerStats(name, running, snapshot.size(), runningForests, totalNodes, uptime);
    }

    private static ForestInfo describe(BehaviorForest forest) {
        ForestStats stats = forest.getStats();
        return new ForestInfo(
                stats.name(), stats.running(), stats.nodeCount(), stats.middleware().size(), stats.forestTicks());
    }

    public String getName() {
        return name;
    }

    @Override
    public void close() {
        stop();
        stopAll();
    }

    @Override
    public String toString() {
        return "ForestManager(" + name + ", " + getForests().size() + " forests)";
    }
}
