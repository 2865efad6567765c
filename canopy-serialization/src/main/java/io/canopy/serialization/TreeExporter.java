package io.canopy.serialization;

import io.canopy.core.engine.BehaviorTree;
import io.canopy.core.forest.BehaviorForest;
import io.canopy.core.forest.ForestNode;
import io.canopy.core.node.Node;
import io.canopy.core.node.leaf.LeafNode;
import io.canopy.core.registry.NodeSpec;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/// Converts live trees and forests into definitions.
///
/// A node is described by its type name, its name, {@link Node#describeAttributes()} and,
/// for leaves, its parameter bindings. Nodes created from lambdas export as `Action` or
/// `Condition`, which have no registry factory; rebuilding such a definition requires
/// registering a factory under that type first.
public final class TreeExporter {

    private TreeExporter() {}

    /// Describes a node and its subtree.
    ///
    /// @param node the subtree root, not null
    /// @return the description, never null
    public static NodeSpec export(Node node) {
        NodeSpec.Builder builder = NodeSpec.builder(node.getTypeName(), node.getName());
        node.describeAttributes().forEach(builder::attribute);
        if (node instanceof LeafNode leaf) {
            leaf.getParameterBindings().forEach(builder::binding);
        }
        for (Node child : node.getChildren()) {
            builder.child(export(child));
        }
        return builder.build();
    }

    /// Describes a tree without its blackboard content.
    ///
    /// @throws IllegalStateException if the tree has no root
    public static TreeDefinition export(BehaviorTree tree) {
        return export(tree, false);
    }

    /// Describes a tree.
    ///
    /// @param tree the tree, not null
    /// @param includeBlackboard whether the current blackboard entries are included
    /// @return the definition, never null
    /// @throws IllegalStateException if the tree has no root
    public static TreeDefinition export(BehaviorTree tree, boolean includeBlackboard) {
        Node root = tree.getRoot();
        if (root == null) {
            throw new IllegalStateException("Tree '" + tree.getName() + "' has no root to export");
        }
        Map<String, Object> blackboard = includeBlackboard ? tree.getBlackboard().snapshot() : Map.of();
        return new TreeDefinition(tree.getName(), tree.getDescription(), blackboard, export(root));
    }

    /// Describes a forest and all its trees.
    ///
    /// @param forest the forest, not null
    /// @param includeBlackboard whether the shared blackboard entries are included
    /// @return the definition, never null
    /// @throws IllegalStateException if a tree has no root
    public static ForestDefinition export(BehaviorForest forest, boolean includeBlackboard) {
        List<ForestNodeDefinition> nodes = new ArrayList<>();
        for (ForestNode node : forest.getNodes()) {
            nodes.add(new ForestNodeDefinition(
                    node.getName(),
                    node.getType(),
                    List.copyOf(new TreeSet<>(node.getCapabilities())),
                    List.copyOf(new TreeSet<>(node.getDependencies())),
                    export(node.getTree(), false)));
        }
        Map<String, Object> blackboard = includeBlackboard ? forest.getBlackboard().snapshot() : Map.of();
        return new ForestDefinition(forest.getName(), "", blackboard, nodes);
    }
}
