package io.canopy.core.forest;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.communication.ChannelHandler;
import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.engine.BehaviorTree;
import io.canopy.core.engine.TickManager;
import io.canopy.core.event.EventDispatcher;
import io.canopy.core.node.LoggingFaultHandler;
import io.canopy.core.node.Status;
import io.canopy.core.util.NamedThreadFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// A set of cooperating behavior trees sharing a blackboard, an event dispatcher and a
/// chain of middleware.
///
/// ### Ticking
/// {@link #tick()} takes a snapshot of the registered nodes, runs every middleware's
/// {@link ForestMiddleware#preTick()}, ticks each snapshot node exactly once with all
/// nodes running concurrently, then hands the results to
/// {@link ForestMiddleware#postTick(Map)}. Results keep registration order.
///
/// ### Running
/// {@link #start()} starts every tree on its own tick manager and a monitor that runs
/// the middleware hooks with the trees' latest statuses at a fixed interval.
///
/// ### Communication
/// A {@link CommunicationMiddleware} backed by the forest blackboard and dispatcher is
/// attached at construction and reachable through {@link #getCommunication()}. Trees
/// created with {@link #newTree(String)} share the same blackboard and dispatcher.
///
/// ### Events
/// Emitted on the forest dispatcher with the forest or node name as source:
/// `node_added`, `node_removed`, `forest_started`, `forest_stopped`, `forest_reset`.
///
/// @implNote Thread-safe. Node registration is serialized on the node map; ticks run on
/// the supplied executor.
///
/// @see ForestNode
/// @see ForestMiddleware
public class BehaviorForest implements AutoCloseable {

    public static final String EVENT_NODE_ADDED = "node_added";
    public static final String EVENT_NODE_REMOVED = "node_removed";
    public static final String EVENT_STARTED = "forest_started";
    public static final String EVENT_STOPPED = "forest_stopped";
    public static final String EVENT_RESET = "forest_reset";

    public static final Duration DEFAULT_MONITOR_INTERVAL = Duration.ofMillis(100);

    private static final Logger logger = Logger.getLogger(BehaviorForest.class.getName());

    private static final ExecutorService SHARED_EXECUTOR =
            Executors.newCachedThreadPool(new NamedThreadFactory("canopy-forest"));

    private static final long STOP_WARNING_SECONDS = 5;

    private final String name;
    private final Blackboard blackboard;
    private final EventDispatcher eventDispatcher;
    private final ExecutorService executor;
    private final Duration monitorInterval;
    private final Map<String, ForestNode> nodes = new LinkedHashMap<>();
    private final List<ForestMiddleware> middleware = new CopyOnWriteArrayList<>();
    private final Map<String, Future<Status>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong forestTicks = new AtomicLong();
    private final CommunicationMiddleware communication;

    private volatile boolean running;
    private ScheduledExecutorService monitor;

    public BehaviorForest(String name) {
        this(name, new Blackboard(), new EventDispatcher(), SHARED_EXECUTOR, DEFAULT_MONITOR_INTERVAL,
                CommunicationMiddleware.DEFAULT_LOG_LIMIT, CommunicationMiddleware.DEFAULT_STATE_HISTORY_LIMIT);
    }

    /// Creates a forest from explicit collaborators.
    ///
    /// @param name forest name, not null
    /// @param blackboard blackboard shared by the forest, not null
    /// @param eventDispatcher dispatcher shared by the forest, not null
    /// @param executor pool ticking the nodes concurrently, not null
    /// @param monitorInterval period of the monitor loop, positive
    /// @param logLimit capacity of the communication logs and queues, positive
    /// @param stateHistoryLimit capacity of each watched key's history, positive
    public BehaviorForest(
            String name,
            Blackboard blackboard,
            EventDispatcher eventDispatcher,
            ExecutorService executor,
            Duration monitorInterval,
            int logLimit,
            int stateHistoryLimit) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.blackboard = Objects.requireNonNull(blackboard, "blackboard must not be null");
        this.eventDispatcher = Objects.requireNonNull(eventDispatcher, "eventDispatcher must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.monitorInterval = Objects.requireNonNull(monitorInterval, "monitorInterval must not be null");
        if (monitorInterval.isNegative() || monitorInterval.isZero()) {
            throw new IllegalArgumentException("monitorInterval must be positive, got " + monitorInterval);
        }
        this.communication = new CommunicationMiddleware(
                CommunicationMiddleware.DEFAULT_NAME,
                blackboard,
                eventDispatcher,
                CommunicationMiddleware.defaultExecutor(),
                logLimit,
                stateHistoryLimit);
        addMiddleware(communication);
    }

    /// Creates a tree sharing this forest's blackboard and event dispatcher.
    ///
    /// The tree is not registered; wrap it in a {@link ForestNode} and add it.
    ///
    /// @param treeName tree name, not null
    /// @return a new tree, never null
    public BehaviorTree newTree(String treeName) {
        return new BehaviorTree(
                treeName, "", blackboard, eventDispatcher, new TickManager(treeName),
                LoggingFaultHandler.INSTANCE);
    }

    // -- Nodes ------------------------------------------------------------------------------

    /// Registers a node.
    ///
    /// @param node node to add, not null
    /// @throws IllegalArgumentException if a node with the same name is registered
    public void addNode(ForestNode node) {
        Objects.requireNonNull(node, "node must not be null");
        synchronized (nodes) {
            if (nodes.containsKey(node.getName())) {
                throw new IllegalArgumentException(
                        "Node '" + node.getName() + "' already exists in forest '" + name + "'");
            }
            nodes.put(node.getName(), node);
        }
        if (running) {
            startTree(node);
        }
        eventDispatcher.emit(EVENT_NODE_ADDED, node.getName(), node.getType());
        logger.info("Forest '" + name + "' added " + node);
    }

    /// Creates and registers a node.
    ///
    /// @return the registered node, never null
    /// @throws IllegalArgumentException if a node with the same name is registered
    public ForestNode addNode(
            String nodeName, BehaviorTree tree, ForestNodeType type, Collection<String> capabilities) {
        ForestNode node = new ForestNode(nodeName, tree, type, capabilities);
        addNode(node);
        return node;
    }

    /// Unregisters a node, cancelling its in-flight forest tick.
    ///
    /// The node's tree keeps its own state and is not stopped.
    ///
    /// @param nodeName node name, not null
    /// @return `true` if the node was registered
    public boolean removeNode(String nodeName) {
        ForestNode removed;
        synchronized (nodes) {
            removed = nodes.remove(nodeName);
        }
        if (removed == null) {
            return false;
        }
        Future<Status> pending = inFlight.remove(nodeName);
        if (pending != null) {
            pending.cancel(true);
        }
        eventDispatcher.emit(EVENT_NODE_REMOVED, nodeName, null);
        logger.info("Forest '" + name + "' removed node '" + nodeName + "'");
        return true;
    }

    public Optional<ForestNode> getNode(String nodeName) {
        synchronized (nodes) {
            return Optional.ofNullable(nodes.get(nodeName));
        }
    }

    /// Returns the registered nodes in registration order.
    ///
    /// @return snapshot copy, never null
    public List<ForestNode> getNodes() {
        synchronized (nodes) {
            return List.copyOf(nodes.values());
        }
    }

    public List<ForestNode> getNodesByType(ForestNodeType type) {
        return getNodes().stream().filter(n -> n.getType() == type).toList();
    }

    public List<ForestNode> getNodesByCapability(String capability) {
        return getNodes().stream().filter(n -> n.hasCapability(capability)).toList();
    }

    // -- Middleware -------------------------------------------------------------------------

    /// Attaches a middleware and initializes it with this forest.
    ///
    /// @param extension middleware to add, not null
    public void addMiddleware(ForestMiddleware extension) {
        Objects.requireNonNull(extension, "middleware must not be null");
        middleware.add(extension);
        extension.initialize(this);
    }

    public boolean removeMiddleware(ForestMiddleware extension) {
        return middleware.remove(extension);
    }

    public List<ForestMiddleware> getMiddleware() {
        return List.copyOf(middleware);
    }

    /// Returns the first attached middleware of a type.
    public <T extends ForestMiddleware> Optional<T> getMiddleware(Class<T> type) {
        return middleware.stream().filter(type::isInstance).map(type::cast).findFirst();
    }

    /// Returns the communication middleware attached at construction.
    public CommunicationMiddleware getCommunication() {
        return communication;
    }

    // -- Ticking ----------------------------------------------------------------------------

    /// Ticks every registered node once, concurrently.
    ///
    /// A node removed while its tick is in flight is cancelled and left out of the results.
    ///
    /// @return status per node name in registration order, never null
    public Map<String, Status> tick() {
        List<ForestNode> snapshot = getNodes();
        runHooks("preTick", ForestMiddleware::preTick);

        Map<ForestNode, Future<Status>> futures = new LinkedHashMap<>();
        for (ForestNode node : snapshot) {
            Future<Status> future = executor.submit(node::tick);
            futures.put(node, future);
            inFlight.put(node.getName(), future);
        }

        Map<String, Status> results = new LinkedHashMap<>();
        for (Map.Entry<ForestNode, Future<Status>> entry : futures.entrySet()) {
            String nodeName = entry.getKey().getName();
            Future<Status> future = entry.getValue();
            try {
                results.put(nodeName, future.get());
            } catch (CancellationException e) {
                logger.fine("Tick of forest node '" + nodeName + "' cancelled");
            } catch (ExecutionException e) {
                logger.log(Level.WARNING, "Forest node '" + nodeName + "' tick failed", e.getCause());
                results.put(nodeName, Status.FAILURE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                break;
            } finally {
                inFlight.remove(nodeName, future);
            }
        }
        forestTicks.incrementAndGet();

        Map<String, Status> view = Collections.unmodifiableMap(results);
        runHooks("postTick", m -> m.postTick(view));
        return view;
    }

    /// Starts every tree on its own tick manager and the monitor loop.
    ///
    /// Trees without a root are skipped with a warning. Starting a running forest has no
    /// effect.
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        getNodes().forEach(this::startTree);
        long periodMillis = Math.max(1, monitorInterval.toMillis());
        monitor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("canopy-monitor-" + name));
        monitor.scheduleWithFixedDelay(this::monitorOnce, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        eventDispatcher.emit(EVENT_STARTED, name, null);
        logger.info("Forest '" + name + "' started with " + getNodes().size() + " nodes");
    }

    /// Stops every tree, cancels in-flight ticks and the monitor, and waits for them.
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        for (ForestNode node : getNodes()) {
            node.getTree().stop();
        }
        inFlight.values().forEach(f -> f.cancel(true));
        inFlight.clear();
        ScheduledExecutorService current = monitor;
        monitor = null;
        current.shutdownNow();
        awaitMonitorExit(current);
        for (ForestNode node : getNodes()) {
            node.getTree().getTickManager().awaitIdle();
        }
        eventDispatcher.emit(EVENT_STOPPED, name, null);
        logger.info("Forest '" + name + "' stopped");
    }

    private void awaitMonitorExit(ScheduledExecutorService current) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    if (current.awaitTermination(STOP_WARNING_SECONDS, TimeUnit.SECONDS)) {
                        return;
                    }
                    logger.warning("Monitor of forest '" + name + "' still busy after stop");
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /// Resets every tree and node status.
    public void reset() {
        getNodes().forEach(ForestNode::reset);
        forestTicks.set(0);
        eventDispatcher.emit(EVENT_RESET, name, null);
    }

    public boolean isRunning() {
        return running;
    }

    private void startTree(ForestNode node) {
        try {
            node.getTree().start();
        } catch (IllegalStateException e) {
            logger.warning("Forest '" + name + "' cannot start node '" + node.getName() + "': " + e.getMessage());
        }
    }

    private void monitorOnce() {
        try {
            runHooks("preTick", ForestMiddleware::preTick);
            Map<String, Status> results = new LinkedHashMap<>();
            for (ForestNode node : getNodes()) {
                Status latest = node.getTree().getTickManager().getLastStatus();
                node.setStatus(latest);
                results.put(node.getName(), latest);
            }
            Map<String, Status> view = Collections.unmodifiableMap(results);
            runHooks("postTick", m -> m.postTick(view));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Monitor of forest '" + name + "' failed", e);
        }
    }

    private void runHooks(String phase, Consumer<ForestMiddleware> hook) {
        for (ForestMiddleware extension : middleware) {
            try {
                hook.accept(extension);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Middleware '" + extension.getName() + "' " + phase + " failed", e);
            }
        }
    }

    // -- External I/O -----------------------------------------------------------------------

    /// Feeds external data into the forest on a channel.
    public void input(String channel, Object data) {
        communication.externalInput(channel, data);
    }

    /// Sends data out of the forest on a channel.
    public void output(String channel, Object data) {
        communication.externalOutput(channel, data);
    }

    /// Registers a handler for data arriving on a channel.
    public void onInput(String channel, ChannelHandler handler) {
        communication.registerInputHandler(channel, handler);
    }

    /// Registers a handler for data leaving on a channel.
    public void onOutput(String channel, ChannelHandler handler) {
        communication.registerOutputHandler(channel, handler);
    }

    // -- Accessors --------------------------------------------------------------------------

    public String getName() {
        return name;
    }

    public Blackboard getBlackboard() {
        return blackboard;
    }

    public EventDispatcher getEventDispatcher() {
        return eventDispatcher;
    }

    public Duration getMonitorInterval() {
        return monitorInterval;
    }

    public ForestStats getStats() {
        List<ForestNode> snapshot = getNodes();
        Map<ForestNodeType, Integer> types = new EnumMap<>(ForestNodeType.class);
        Map<String, Status> statuses = new LinkedHashMap<>();
        for (ForestNode node : snapshot) {
            types.merge(node.getType(), 1, Integer::sum);
            statuses.put(node.getName(), node.getStatus());
        }
        List<String> middlewareNames = new ArrayList<>();
        middleware.forEach(m -> middlewareNames.add(m.getName()));
        return new ForestStats(
                name,
                running,
                snapshot.size(),
                Collections.unmodifiableMap(types),
                Collections.unmodifiableMap(statuses),
                List.copyOf(middlewareNames),
                forestTicks.get(),
                blackboard.size());
    }

    @Override
    public void close() {
        stop();
    }

    @Override
    public String toString() {
        return "BehaviorForest(" + name + ", " + getNodes().size() + " nodes)";
    }
}
