package io.canopy.serialization;

import io.canopy.core.communication.node.CommunicationNodes;
import io.canopy.core.engine.BehaviorTree;
import io.canopy.core.exception.NodeTypeNotFoundException;
import io.canopy.core.forest.BehaviorForest;
import io.canopy.core.forest.ForestNode;
import io.canopy.core.node.Node;
import io.canopy.core.registry.DefaultNodeRegistry;
import io.canopy.core.registry.NodeRegistry;
import io.canopy.core.registry.TreeBuilder;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Builds trees and forests from definitions.
///
/// Each forest is built against a copy of the registry extended with the communication
/// leaves bound to that forest's middleware, so definitions may use `CommPublisher`,
/// `CommTaskClaimer` and the other communication types. The registry passed in is never
/// modified.
///
/// All trees of a forest definition are built before the forest is touched; an unknown
/// type or a malformed tree leaves the target forest unchanged.
///
/// ### Example usage
/// {@snippet :
/// ForestLoader loader = new ForestLoader(new DefaultNodeRegistry());
/// BehaviorForest forest = loader.load(TreeDefinitionSerializer.readForest(Path.of("patrol.json")));
/// forest.start();
/// }
public class ForestLoader {

    private static final Logger logger = Logger.getLogger(ForestLoader.class.getName());

    private final NodeRegistry registry;

    public ForestLoader(NodeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /// Builds a standalone tree with its own blackboard.
    ///
    /// @param definition the tree, not null
    /// @return the loaded tree with its initial blackboard entries set, never null
    /// @throws NodeTypeNotFoundException if the definition references an unregistered type
    public BehaviorTree loadTree(TreeDefinition definition) throws NodeTypeNotFoundException {
        BehaviorTree tree = new BehaviorTree(definition.name());
        new TreeBuilder(registry).buildInto(tree, definition.root());
        definition.blackboard().forEach(tree::setBlackboardData);
        return tree;
    }

    /// Creates a forest from a definition.
    ///
    /// @param definition the forest, not null
    /// @return a new, stopped forest, never null
    /// @throws NodeTypeNotFoundException if a tree references an unregistered type
    /// @throws IllegalArgumentException if two forest nodes share a name
    public BehaviorForest load(ForestDefinition definition) throws NodeTypeNotFoundException {
        return loadInto(new BehaviorForest(definition.name()), definition);
    }

    /// Reads and loads a forest definition file.
    ///
    /// @throws NodeTypeNotFoundException if a tree references an unregistered type
    public BehaviorForest load(Path path) throws NodeTypeNotFoundException {
        return load(TreeDefinitionSerializer.readForest(path));
    }

    /// Adds the trees of a definition to an existing forest.
    ///
    /// Initial blackboard entries of the forest and of every tree go to the forest's
    /// shared blackboard.
    ///
    /// @param forest target forest, not null
    /// @param definition the forest, not null
    /// @return the same forest, for chaining
    /// @throws NodeTypeNotFoundException if a tree references an unregistered type
    /// @throws IllegalArgumentException if a node name is duplicated or already used
    public BehaviorForest loadInto(BehaviorForest forest, ForestDefinition definition)
            throws NodeTypeNotFoundException {
        NodeRegistry scoped = DefaultNodeRegistry.copyOf(registry);
        CommunicationNodes.register(scoped, forest.getCommunication());
        TreeBuilder builder = new TreeBuilder(scoped);

        Set<String> names = definition.nodes().stream()
                .map(ForestNodeDefinition::name)
                .collect(Collectors.toSet());
        if (names.size() != definition.nodes().size()) {
            throw new IllegalArgumentException("Forest definition '" + definition.name() + "' has duplicate node names");
        }
        for (String name : names) {
            if (forest.getNode(name).isPresent()) {
                throw new IllegalArgumentException(
                        "Node '" + name + "' already exists in forest '" + forest.getName() + "'");
            }
        }

        List<Node> roots = new ArrayList<>();
        for (ForestNodeDefinition nodeDefinition : definition.nodes()) {
            roots.add(builder.build(nodeDefinition.tree().root()));
        }

        definition.blackboard().forEach(forest.getBlackboard()::set);
        for (int i = 0; i < roots.size(); i++) {
            ForestNodeDefinition nodeDefinition = definition.nodes().get(i);
            BehaviorTree tree = forest.newTree(nodeDefinition.tree().name());
            tree.loadFromRoot(roots.get(i));
            nodeDefinition.tree().blackboard().forEach(tree::setBlackboardData);

            ForestNode node = new ForestNode(
                    nodeDefinition.name(), tree, nodeDefinition.type(), nodeDefinition.capabilities());
            nodeDefinition.dependencies().forEach(dependency -> {
                if (!names.contains(dependency) && forest.getNode(dependency).isEmpty()) {
                    logger.warning("Forest node '" + nodeDefinition.name() + "' depends on unknown node '"
                            + dependency + "'");
                }
                node.addDependency(dependency);
            });
            forest.addNode(node);
        }
        logger.info("Loaded " + roots.size() + " trees into forest '" + forest.getName() + "'");
        return forest;
    }
}
