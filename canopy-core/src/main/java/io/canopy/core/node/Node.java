package io.canopy.core.node;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.exception.TreeStructureException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/// Base class for every behavior tree node.
///
/// A node owns an ordered list of children, knows its parent, and remembers the
/// status produced by its most recent tick. Subclasses supply the evaluation logic
/// through {@link #doTick()}; {@link #tick()} wraps it so that a fault inside user
/// code never propagates to the caller.
///
/// ### Structure
/// The {@link NodeKind} passed to the constructor fixes how many children the node
/// may own. Leaves reject children, decorators replace their single child, composites
/// append. A node belongs to at most one parent and can never become its own ancestor.
///
/// ### Context
/// Nodes read and write shared data through the {@link Blackboard} of the tree they are
/// bound to. {@link #bind(Blackboard, NodeFaultHandler)} pushes the context down the
/// whole subtree, and children added later inherit the context of their new parent.
///
/// @implNote Thread-safe. Children are held in a copy-on-write list so that
/// {@link io.canopy.core.node.composite.Parallel} may tick siblings concurrently
/// while the structure is inspected from other threads. Structural changes are
/// serialized on the node's monitor.
///
/// @see NodeKind
/// @see Status
public abstract class Node {

    private static final Logger logger = Logger.getLogger(Node.class.getName());

    private final String name;
    private final NodeKind kind;
    private final List<Node> children = new CopyOnWriteArrayList<>();
    private final AtomicLong tickCount = new AtomicLong();
    private final AtomicLong faultCount = new AtomicLong();

    private volatile Node parent;
    private volatile Status status = Status.FAILURE;
    private volatile Blackboard blackboard;
    private volatile NodeFaultHandler faultHandler = LoggingFaultHandler.INSTANCE;
    private volatile Instant lastTickTime;

    /// Creates a node.
    ///
    /// @param name human readable name, not null
    /// @param kind structural kind fixing the child limit, not null
    protected Node(String name, NodeKind kind) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Evaluates this node once and records the resulting status.
    ///
    /// Any exception thrown by {@link #doTick()} is reported to the bound
    /// {@link NodeFaultHandler} and converted to {@link Status#FAILURE}. An interrupted
    /// tick restores the thread's interrupt flag before reporting failure.
    ///
    /// @return the status of this tick, never null
    public final Status tick() {
        Status result;
        try {
            result = Objects.requireNonNull(doTick(), "doTick() returned null");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.fine("Tick of '" + name + "' interrupted");
            result = Status.FAILURE;
        } catch (Exception e) {
            faultCount.incrementAndGet();
            faultHandler.onFault(this, e);
            result = Status.FAILURE;
        }
        status = result;
        lastTickTime = Instant.now();
        tickCount.incrementAndGet();
        return result;
    }

    /// Performs the node specific evaluation.
    ///
    /// @return the status of this tick, not null
    /// @throws Exception if evaluation fails, converted to {@link Status#FAILURE} by {@link #tick()}
    protected abstract Status doTick() throws Exception;

    /// Returns the node to its initial state, children first.
    ///
    /// Status goes back to {@link Status#FAILURE} and timing state is cleared.
    /// Subclasses holding per-call state clear it in {@link #onReset()}.
    public void reset() {
        for (Node child : children) {
            child.reset();
        }
        status = Status.FAILURE;
        lastTickTime = null;
        onReset();
    }

    /// Hook for subclasses with per-call state such as counters or start times.
    protected void onReset() {}

    // -- Structure --------------------------------------------------------------------------

    /// Attaches a child to this node.
    ///
    /// Composites append, decorators replace their current child, leaves reject.
    ///
    /// @param child node to attach, not null and not attached elsewhere
    /// @throws TreeStructureException if the child cannot be attached here
    public synchronized void addChild(Node child) {
        Objects.requireNonNull(child, "child must not be null");
        if (kind == NodeKind.LEAF) {
            throw new TreeStructureException("Leaf node '" + name + "' cannot have children");
        }
        if (child.parent != null) {
            throw new TreeStructureException(
                    "Node '" + child.name + "' already belongs to '" + child.parent.name + "'");
        }
        for (Node ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == child) {
                throw new TreeStructureException(
                        "Adding '" + child.name + "' under '" + name + "' would create a cycle");
            }
        }
        if (children.size() >= kind.getMaxChildren()) {
            removeChild(children.get(0));
        }
        children.add(child);
        child.parent = this;
        if (blackboard != null) {
            child.bind(blackboard, faultHandler);
        }
    }

    /// Detaches a direct child.
    ///
    /// @param child node to detach, not null
    /// @return `true` if the node was a child of this node
    public synchronized boolean removeChild(Node child) {
        Objects.requireNonNull(child, "child must not be null");
        if (children.remove(child)) {
            child.parent = null;
            return true;
        }
        return false;
    }

    /// Returns the child at the given position.
    ///
    /// @param index zero based position
    /// @return the child, never null
    /// @throws IndexOutOfBoundsException if there is no child at that position
    public Node getChild(int index) {
        return children.get(index);
    }

    /// Returns a read-only live view of the children in order.
    ///
    /// @return the children, never null
    public List<Node> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getChildCount() {
        return children.size();
    }

    /// Returns the parent, or null for a detached node or a root.
    public Node getParent() {
        return parent;
    }

    /// Walks up the parent chain.
    ///
    /// @return the topmost ancestor, or this node if it has no parent
    public Node getRoot() {
        Node current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    /// Returns the distance to the root, `0` for the root itself.
    public int getDepth() {
        int depth = 0;
        for (Node p = parent; p != null; p = p.parent) {
            depth++;
        }
        return depth;
    }

    /// Returns the slash separated names from the root down to this node.
    ///
    /// @return path such as `root/patrol/move`, never null
    public String getPath() {
        List<String> names = new ArrayList<>();
        for (Node n = this; n != null; n = n.parent) {
            names.add(n.name);
        }
        Collections.reverse(names);
        return String.join("/", names);
    }

    /// Finds the first node with the given name in this subtree, depth first.
    ///
    /// @param nodeName name to search for, not null
    /// @return the node, or empty if no node in the subtree has that name
    public Optional<Node> findNode(String nodeName) {
        if (name.equals(nodeName)) {
            return Optional.of(this);
        }
        for (Node child : children) {
            Optional<Node> found = child.findNode(nodeName);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /// Returns every node below this one in depth first pre-order.
    ///
    /// @return descendants excluding this node, never null
    public List<Node> getDescendants() {
        List<Node> result = new ArrayList<>();
        for (Node child : children) {
            result.add(child);
            result.addAll(child.getDescendants());
        }
        return result;
    }

    /// Returns the ancestors from the parent up to the root.
    ///
    /// @return ancestors nearest first, never null
    public List<Node> getAncestors() {
        List<Node> result = new ArrayList<>();
        for (Node p = parent; p != null; p = p.parent) {
            result.add(p);
        }
        return result;
    }

    // -- Context ----------------------------------------------------------------------------

    /// Binds this subtree to a blackboard and fault handler.
    ///
    /// @param blackboard shared data store of the owning tree, not null
    /// @param faultHandler receiver of tick faults, not null
    public void bind(Blackboard blackboard, NodeFaultHandler faultHandler) {
        this.blackboard = Objects.requireNonNull(blackboard, "blackboard must not be null");
        this.faultHandler = Objects.requireNonNull(faultHandler, "faultHandler must not be null");
        for (Node child : children) {
            child.bind(blackboard, faultHandler);
        }
    }

    /// Binds this subtree to a blackboard, keeping the current fault handler.
    ///
    /// @param blackboard shared data store of the owning tree, not null
    public void bind(Blackboard blackboard) {
        bind(blackboard, faultHandler);
    }

    /// Returns the blackboard this node is bound to.
    ///
    /// @return the blackboard, or null if the node was never bound
    public Blackboard getBlackboard() {
        return blackboard;
    }

    /// Returns the blackboard this node is bound to, failing if there is none.
    ///
    /// @return the bound blackboard, never null
    /// @throws IllegalStateException if the node is not bound to a tree
    protected Blackboard requireBlackboard() {
        Blackboard current = blackboard;
        if (current == null) {
            throw new IllegalStateException("Node '" + name + "' is not bound to a blackboard");
        }
        return current;
    }

    public NodeFaultHandler getFaultHandler() {
        return faultHandler;
    }

    // -- Identity and state -----------------------------------------------------------------

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    /// Returns the name this node is registered under in a node registry.
    ///
    /// @return type name, defaults to the simple class name
    public String getTypeName() {
        return getClass().getSimpleName();
    }

    /// Returns the configurable attributes of this node.
    ///
    /// Used to export a live tree back into a definition. Keys match the attribute
    /// names understood by the node's registry factory.
    ///
    /// @return attribute map, never null (may be empty)
    public Map<String, Object> describeAttributes() {
        return Map.of();
    }

    /// Returns the status produced by the most recent tick.
    ///
    /// @return the status, {@link Status#FAILURE} before the first tick
    public Status getStatus() {
        return status;
    }

    /// Returns the wall-clock time of the most recent tick.
    ///
    /// @return the time, or null if the node was not ticked since construction or reset
    public Instant getLastTickTime() {
        return lastTickTime;
    }

    /// Returns a snapshot of this node's bookkeeping.
    ///
    /// @return the stats, never null
    public NodeStats getStats() {
        return new NodeStats(
                name,
                getTypeName(),
                kind,
                status,
                children.size(),
                getDepth(),
                tickCount.get(),
                faultCount.get(),
                lastTickTime);
    }

    @Override
    public String toString() {
        return getTypeName() + "(" + name + ")";
    }
}
