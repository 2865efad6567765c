package io.canopy.core.forest;

import io.canopy.core.engine.BehaviorTree;
import io.canopy.core.node.Status;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/// A behavior tree taking part in a forest, with its role and capabilities.
///
/// Capabilities decide which tasks the node can claim and which nodes a query by
/// capability returns. A node created without capabilities gets its type's default one.
/// Dependencies name other forest nodes this one relies on; they are informational.
public class ForestNode {

    private static final Logger logger = Logger.getLogger(ForestNode.class.getName());

    private final String name;
    private final BehaviorTree tree;
    private final ForestNodeType type;
    private final Set<String> capabilities = ConcurrentHashMap.newKeySet();
    private final Set<String> dependencies = ConcurrentHashMap.newKeySet();
    private final Map<String, Object> metadata = new ConcurrentHashMap<>();

    private volatile Status status = Status.FAILURE;

    /// Creates a forest node.
    ///
    /// @param name unique name within the forest, not null
    /// @param tree the tree this node runs, not null
    /// @param type role of the node, not null
    /// @param capabilities capabilities, the type's default one if empty, not null
    public ForestNode(String name, BehaviorTree tree, ForestNodeType type, Collection<String> capabilities) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.tree = Objects.requireNonNull(tree, "tree must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.capabilities.addAll(Objects.requireNonNull(capabilities, "capabilities must not be null"));
        if (this.capabilities.isEmpty()) {
            this.capabilities.add(type.defaultCapability());
        }
    }

    public ForestNode(String name, BehaviorTree tree, ForestNodeType type) {
        this(name, tree, type, Set.of());
    }

    public ForestNode(String name, BehaviorTree tree) {
        this(name, tree, ForestNodeType.WORKER);
    }

    /// Ticks the tree once. Never throws: a faulting tree reports FAILURE.
    ///
    /// @return the tree's status, never null
    public Status tick() {
        Status result;
        try {
            result = tree.tick();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Forest node '" + name + "' tick failed", e);
            result = Status.FAILURE;
        }
        status = result;
        return result;
    }

    /// Resets the tree and this node's status.
    public void reset() {
        tree.reset();
        status = Status.FAILURE;
    }

    public String getName() {
        return name;
    }

    public BehaviorTree getTree() {
        return tree;
    }

    public ForestNodeType getType() {
        return type;
    }

    /// Returns the status of the latest tick, or the latest status observed by the forest
    /// monitor while the tree runs on its own tick manager.
    public Status getStatus() {
        return status;
    }

    void setStatus(Status status) {
        this.status = status;
    }

    public Set<String> getCapabilities() {
        return Set.copyOf(capabilities);
    }

    public void addCapability(String capability) {
        capabilities.add(Objects.requireNonNull(capability, "capability must not be null"));
    }

    public boolean removeCapability(String capability) {
        return capabilities.remove(capability);
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public Set<String> getDependencies() {
        return Set.copyOf(dependencies);
    }

    public void addDependency(String dependency) {
        dependencies.add(Objects.requireNonNull(dependency, "dependency must not be null"));
    }

    public boolean removeDependency(String dependency) {
        return dependencies.remove(dependency);
    }

    /// Returns the live metadata map.
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "ForestNode(" + name + ", " + type + ", " + status + ")";
    }
}
