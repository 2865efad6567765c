package io.canopy.core.engine;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.event.EventDispatcher;
import io.canopy.core.exception.TreeStructureException;
import io.canopy.core.node.LoggingFaultHandler;
import io.canopy.core.node.Node;
import io.canopy.core.node.NodeFaultHandler;
import io.canopy.core.node.Status;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.logging.Logger;

/// A root node together with the blackboard, event dispatcher and tick manager that run it.
///
/// ### Events
/// The tree emits lifecycle events on its dispatcher with itself as source:
/// `tree_root_changed`, `tree_tick_start`, `tree_tick_end`, `tree_started`,
/// `tree_stopped`, `tree_status_changed` and `tree_reset`.
///
/// ### Usage
/// {@snippet :
/// try (BehaviorTree tree = new BehaviorTree("patrol")) {
///     tree.loadFromRoot(new Sequence("root", checkBattery, move));
///     tree.start(30);
///     // ...
/// }
/// }
///
/// @implNote Thread-safe. The tick manager serializes ticks; the blackboard and dispatcher
/// are concurrent.
///
/// @see TickManager
public class BehaviorTree implements AutoCloseable {

    public static final String EVENT_ROOT_CHANGED = "tree_root_changed";
    public static final String EVENT_TICK_START = "tree_tick_start";
    public static final String EVENT_TICK_END = "tree_tick_end";
    public static final String EVENT_STARTED = "tree_started";
    public static final String EVENT_STOPPED = "tree_stopped";
    public static final String EVENT_STATUS_CHANGED = "tree_status_changed";
    public static final String EVENT_RESET = "tree_reset";

    private static final Logger logger = Logger.getLogger(BehaviorTree.class.getName());

    private final String name;
    private final String description;
    private final Blackboard blackboard;
    private final EventDispatcher eventDispatcher;
    private final TickManager tickManager;
    private final NodeFaultHandler faultHandler;

    private volatile Node root;

    public BehaviorTree(String name) {
        this(name, "", new Blackboard(), new EventDispatcher(), new TickManager(name),
                LoggingFaultHandler.INSTANCE);
    }

    /// Creates a tree from explicit collaborators.
    ///
    /// @param name tree name, not null
    /// @param description free text, not null
    /// @param blackboard data store shared by the nodes, not null
    /// @param eventDispatcher dispatcher for lifecycle events, not null
    /// @param tickManager scheduler driving the root, not null
    /// @param faultHandler receiver of node faults, not null
    public BehaviorTree(
            String name,
            String description,
            Blackboard blackboard,
            EventDispatcher eventDispatcher,
            TickManager tickManager,
            NodeFaultHandler faultHandler) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
        this.blackboard = Objects.requireNonNull(blackboard, "blackboard must not be null");
        this.eventDispatcher = Objects.requireNonNull(eventDispatcher, "eventDispatcher must not be null");
        this.tickManager = Objects.requireNonNull(tickManager, "tickManager must not be null");
        this.faultHandler = Objects.requireNonNull(faultHandler, "faultHandler must not be null");
        tickManager.setBlackboard(blackboard);
        tickManager.addListener(
                new TickListener() {
                    @Override
                    public void onStatusChange(Status previous, Status current) {
                        eventDispatcher.emit(EVENT_STATUS_CHANGED, name, current);
                    }
                });
    }

    /// Validates a node hierarchy and installs it as the root.
    ///
    /// @param node the new root, not null
    /// @return this tree for chaining
    /// @throws TreeStructureException if the hierarchy is not a valid tree
    public BehaviorTree loadFromRoot(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        ValidationResult result = TreeValidator.validate(node);
        if (!result.isValid()) {
            throw new TreeStructureException(
                    "Cannot load tree '" + name + "': " + String.join("; ", result.errors()));
        }
        result.warnings().forEach(w -> logger.warning("Tree '" + name + "': " + w));
        setRoot(node);
        return this;
    }

    /// Installs a root without validation, binding it to this tree's context.
    ///
    /// @param node the new root, not null
    public void setRoot(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        node.bind(blackboard, faultHandler);
        this.root = node;
        tickManager.setRoot(node);
        eventDispatcher.emit(EVENT_ROOT_CHANGED, name, node.getName());
        logger.fine("Tree '" + name + "' root set to " + node);
    }

    /// Ticks the root once on the calling thread.
    ///
    /// @return the root's status, never null
    /// @throws IllegalStateException if no root is loaded
    public Status tick() {
        eventDispatcher.emit(EVENT_TICK_START, name, null);
        Status status = tickManager.tickOnce();
        eventDispatcher.emit(EVENT_TICK_END, name, status);
        return status;
    }

    /// Starts ticking at the current rate.
    ///
    /// @throws IllegalStateException if no root is loaded
    public void start() {
        tickManager.start();
        eventDispatcher.emit(EVENT_STARTED, name, tickManager.getTickRate());
        logger.info("Tree '" + name + "' started");
    }

    /// Starts ticking at the given rate.
    ///
    /// @param tickRate ticks per second, positive
    public void start(double tickRate) {
        tickManager.setTickRate(tickRate);
        start();
    }

    public void stop() {
        if (tickManager.isRunning()) {
            tickManager.stop();
            eventDispatcher.emit(EVENT_STOPPED, name, null);
            logger.info("Tree '" + name + "' stopped");
        }
    }

    /// Resets node state, clears the blackboard and tick counters.
    public void reset() {
        Node current = root;
        if (current != null) {
            current.reset();
        }
        blackboard.clear();
        tickManager.resetStats();
        eventDispatcher.emit(EVENT_RESET, name, null);
    }

    public boolean isRunning() {
        return tickManager.isRunning();
    }

    public Optional<Node> findNode(String nodeName) {
        Node current = root;
        return current == null ? Optional.empty() : current.findNode(nodeName);
    }

    /// Returns the root followed by all its descendants in pre-order.
    ///
    /// @return all nodes, empty without a root
    public List<Node> getAllNodes() {
        Node current = root;
        if (current == null) {
            return List.of();
        }
        List<Node> nodes = new ArrayList<>();
        nodes.add(current);
        nodes.addAll(current.getDescendants());
        return nodes;
    }

    /// Returns a snapshot of tree, tick and blackboard counters.
    ///
    /// @return the stats, never null
    public TreeStats getStats() {
        List<Node> nodes = getAllNodes();
        Map<String, Integer> types = new TreeMap<>();
        Map<Status, Integer> statuses = new EnumMap<>(Status.class);
        for (Node node : nodes) {
            types.merge(node.getTypeName(), 1, Integer::sum);
            statuses.merge(node.getStatus(), 1, Integer::sum);
        }
        return new TreeStats(
                name,
                nodes.size(),
                Map.copyOf(types),
                Map.copyOf(statuses),
                blackboard.size(),
                tickManager.getStats(),
                blackboard.getStats());
    }

    public Object getBlackboardData(String key) {
        return blackboard.get(key);
    }

    public void setBlackboardData(String key, Object value) {
        blackboard.set(key, value);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /// Returns the root node.
    ///
    /// @return the root, or null if none is loaded
    public Node getRoot() {
        return root;
    }

    public Blackboard getBlackboard() {
        return blackboard;
    }

    public EventDispatcher getEventDispatcher() {
        return eventDispatcher;
    }

    public TickManager getTickManager() {
        return tickManager;
    }

    @Override
    public void close() {
        stop();
    }

    @Override
    public String toString() {
        return "BehaviorTree(" + name + ")";
    }
}
