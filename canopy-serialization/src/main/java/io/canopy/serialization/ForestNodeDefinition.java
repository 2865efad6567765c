package io.canopy.serialization;

import io.canopy.core.forest.ForestNodeType;
import java.util.List;
import java.util.Objects;

/// Declarative description of one tree of a forest.
///
/// @param name forest node name, not null
/// @param type role in the forest, `WORKER` when absent
/// @param capabilities offered capabilities, the type's default capability when empty
/// @param dependencies names of forest nodes this one depends on, empty when absent
/// @param tree the tree, not null
public record ForestNodeDefinition(
        String name, ForestNodeType type, List<String> capabilities, List<String> dependencies, TreeDefinition tree) {

    public ForestNodeDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(tree, "tree must not be null");
        type = type == null ? ForestNodeType.WORKER : type;
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }
}
