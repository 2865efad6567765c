package io.canopy.serialization;

import io.canopy.core.registry.NodeSpec;
import java.util.Map;
import java.util.Objects;

/// Declarative description of a behavior tree.
///
/// @param name tree name, not null
/// @param description free text, empty when absent
/// @param blackboard initial blackboard entries, empty when absent
/// @param root root node description, not null
public record TreeDefinition(String name, String description, Map<String, Object> blackboard, NodeSpec root) {

    public TreeDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(root, "root must not be null");
        description = description == null ? "" : description;
        blackboard = blackboard == null ? Map.of() : Map.copyOf(blackboard);
    }

    public static TreeDefinition of(String name, NodeSpec root) {
        return new TreeDefinition(name, "", Map.of(), root);
    }
}
