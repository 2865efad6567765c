package io.canopy.core.registry;

import io.canopy.core.engine.BehaviorTree;
import io.canopy.core.engine.TreeValidator;
import io.canopy.core.exception.NodeTypeNotFoundException;
import io.canopy.core.node.Node;
import io.canopy.core.node.leaf.LeafNode;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Builds node hierarchies from {@link NodeSpec} descriptions through a {@link NodeRegistry}.
///
/// Every type referenced anywhere in the spec is checked before any node is created, so
/// an unknown type never leaves a half-built tree behind. Each build creates fresh node
/// instances.
public class TreeBuilder {

    private static final Logger logger = Logger.getLogger(TreeBuilder.class.getName());

    private final NodeRegistry registry;

    public TreeBuilder(NodeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /// Builds the node hierarchy described by a spec.
    ///
    /// @param spec root description, not null
    /// @return the root of a new, validated hierarchy, never null
    /// @throws NodeTypeNotFoundException if any referenced type is not registered
    /// @throws io.canopy.core.exception.TreeStructureException if the hierarchy is malformed
    /// @throws IllegalArgumentException if attributes or bindings are invalid
    public Node build(NodeSpec spec) throws NodeTypeNotFoundException {
        Objects.requireNonNull(spec, "spec must not be null");
        Set<String> unknown = new TreeSet<>();
        collectUnknownTypes(spec, unknown);
        if (!unknown.isEmpty()) {
            throw new NodeTypeNotFoundException("Unregistered node types: " + unknown);
        }
        Node root = construct(spec);
        TreeValidator.requireValid(root);
        return root;
    }

    /// Builds a hierarchy and loads it into a new tree.
    ///
    /// @param treeName tree name, not null
    /// @param spec root description, not null
    /// @return the loaded tree, never null
    /// @throws NodeTypeNotFoundException if any referenced type is not registered
    public BehaviorTree buildTree(String treeName, NodeSpec spec) throws NodeTypeNotFoundException {
        return buildInto(new BehaviorTree(treeName), spec);
    }

    /// Builds a hierarchy and loads it into an existing tree.
    ///
    /// @param tree target tree, not null
    /// @param spec root description, not null
    /// @return the same tree, for chaining
    /// @throws NodeTypeNotFoundException if any referenced type is not registered
    public BehaviorTree buildInto(BehaviorTree tree, NodeSpec spec) throws NodeTypeNotFoundException {
        Node root = build(spec);
        tree.loadFromRoot(root);
        logger.fine("Built tree '" + tree.getName() + "' with root " + root);
        return tree;
    }

    private void collectUnknownTypes(NodeSpec spec, Set<String> unknown) {
        if (!registry.isRegistered(spec.type())) {
            unknown.add(spec.type());
        }
        for (NodeSpec child : spec.children()) {
            collectUnknownTypes(child, unknown);
        }
    }

    private Node construct(NodeSpec spec) throws NodeTypeNotFoundException {
        Node node = registry.create(spec);
        applyBindings(node, spec.bindings());
        for (NodeSpec childSpec : spec.children()) {
            node.addChild(construct(childSpec));
        }
        return node;
    }

    private static void applyBindings(Node node, Map<String, String> bindings) {
        if (bindings.isEmpty()) {
            return;
        }
        if (!(node instanceof LeafNode leaf)) {
            throw new IllegalArgumentException(
                    node.getTypeName() + " '" + node.getName() + "' is not a leaf and accepts no bindings");
        }
        bindings.forEach(leaf::bindParameter);
    }
}
