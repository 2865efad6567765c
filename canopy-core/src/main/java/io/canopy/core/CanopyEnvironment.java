package io.canopy.core;

import io.canopy.core.engine.BehaviorTree;
import io.canopy.core.engine.TickManager;
import io.canopy.core.event.EventDispatcher;
import io.canopy.core.exception.NodeTypeNotFoundException;
import io.canopy.core.forest.BehaviorForest;
import io.canopy.core.node.LoggingFaultHandler;
import io.canopy.core.registry.NodeRegistry;
import io.canopy.core.registry.NodeSpec;
import io.canopy.core.registry.TreeBuilder;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/// Container holding the configuration, node registry and thread pool that trees and
/// forests are created from.
///
/// Trees created here use the configured tick rate and blackboard options. Forests
/// tick their nodes on the environment's pool and are not closed with it.
///
/// @implNote Safe for concurrent reads. All fields are final and set at construction.
///
/// @apiNote Create instances via {@link CanopyFactory} rather than direct construction.
///
/// @see CanopyFactory#createEnvironment()
public final class CanopyEnvironment implements AutoCloseable {

    private final CanopyConfig config;
    private final NodeRegistry nodeRegistry;
    private final ExecutorService executorService;
    private final TreeBuilder treeBuilder;

    /// Creates an environment.
    ///
    /// @param config configuration, not null
    /// @param nodeRegistry registry used to build trees, not null
    /// @param executorService pool ticking forest nodes, not null
    public CanopyEnvironment(CanopyConfig config, NodeRegistry nodeRegistry, ExecutorService executorService) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.nodeRegistry = Objects.requireNonNull(nodeRegistry, "nodeRegistry must not be null");
        this.executorService = Objects.requireNonNull(executorService, "executorService must not be null");
        this.treeBuilder = new TreeBuilder(nodeRegistry);
    }

    /// Creates an empty tree with its own blackboard and dispatcher.
    ///
    /// @param name tree name, not null
    /// @return a new tree, never null
    public BehaviorTree newTree(String name) {
        return new BehaviorTree(name, "", config.newBlackboard(), new EventDispatcher(),
                new TickManager(name, config.getTickRate()), LoggingFaultHandler.INSTANCE);
    }

    /// Creates a tree and builds its nodes from a spec.
    ///
    /// @param name tree name, not null
    /// @param spec root description, not null
    /// @return the loaded tree, never null
    /// @throws NodeTypeNotFoundException if the spec references an unregistered type
    public BehaviorTree buildTree(String name, NodeSpec spec) throws NodeTypeNotFoundException {
        return treeBuilder.buildInto(newTree(name), spec);
    }

    /// Creates an empty forest ticking on this environment's pool.
    ///
    /// @param name forest name, not null
    /// @return a new forest, never null
    public BehaviorForest newForest(String name) {
        return new BehaviorForest(name, config.newBlackboard(), new EventDispatcher(), executorService,
                config.getMonitorInterval(), config.getLogLimit(), config.getStateHistoryLimit());
    }

    public CanopyConfig getConfig() {
        return config;
    }

    public NodeRegistry getNodeRegistry() {
        return nodeRegistry;
    }

    public TreeBuilder getTreeBuilder() {
        return treeBuilder;
    }

    public ExecutorService getExecutorService() {
        return executorService;
    }

    /// Shuts down the thread pool. Submitted ticks finish; new ones are rejected.
    @Override
    public void close() {
        executorService.shutdown();
    }
}
