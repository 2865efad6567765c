package io.canopy.serialization;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Declarative description of a forest.
///
/// @param name forest name, not null
/// @param description free text, empty when absent
/// @param blackboard initial entries of the shared forest blackboard, empty when absent
/// @param nodes forest nodes in registration order, empty when absent
public record ForestDefinition(
        String name, String description, Map<String, Object> blackboard, List<ForestNodeDefinition> nodes) {

    public ForestDefinition {
        Objects.requireNonNull(name, "name must not be null");
        description = description == null ? "" : description;
        blackboard = blackboard == null ? Map.of() : Map.copyOf(blackboard);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }
}
