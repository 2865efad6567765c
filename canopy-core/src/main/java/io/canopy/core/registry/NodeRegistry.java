package io.canopy.core.registry;

import io.canopy.core.exception.NodeTypeNotFoundException;
import io.canopy.core.node.Node;
import java.util.Optional;
import java.util.Set;

/// Registry mapping node type names to factories.
///
/// Registries are explicit objects passed to whoever builds trees; there is no global
/// instance. Registering an existing type replaces its factory.
///
/// ### Example usage
/// {@snippet :
/// NodeRegistry registry = new DefaultNodeRegistry();
/// registry.register("MoveTo", "Moves the agent", spec -> new MoveTo(spec.name(), spec.requireString("target")));
/// Node node = registry.create(NodeSpec.builder("MoveTo", "go").attribute("target", "dock").build());
/// }
///
/// @see DefaultNodeRegistry
/// @see TreeBuilder
public interface NodeRegistry {

    /// Registers a factory under a type name.
    ///
    /// @param type type name, not null or blank
    /// @param description human readable description, not null
    /// @param factory node factory, not null
    void register(String type, String description, NodeFactory factory);

    default void register(String type, NodeFactory factory) {
        register(type, "", factory);
    }

    /// Removes a type.
    ///
    /// @return `true` if the type was registered
    boolean unregister(String type);

    boolean isRegistered(String type);

    Set<String> getRegisteredTypes();

    Optional<NodeTypeInfo> getTypeInfo(String type);

    Optional<NodeFactory> getFactory(String type);

    /// Returns the factory of a type.
    ///
    /// @throws NodeTypeNotFoundException if the type is not registered
    NodeFactory getFactoryOrThrow(String type) throws NodeTypeNotFoundException;

    /// Creates a single node, without children or bindings.
    ///
    /// @param spec node description, not null
    /// @return a new node instance, never shared with earlier calls
    /// @throws NodeTypeNotFoundException if the spec's type is not registered
    default Node create(NodeSpec spec) throws NodeTypeNotFoundException {
        return getFactoryOrThrow(spec.type()).create(spec);
    }

    /// Removes every registration, built-ins included.
    void clear();
}
