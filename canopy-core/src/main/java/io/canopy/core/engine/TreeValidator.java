package io.canopy.core.engine;

import io.canopy.core.exception.TreeStructureException;
import io.canopy.core.node.Node;
import io.canopy.core.node.NodeKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/// Checks that a node hierarchy is a well formed tree.
///
/// ### Errors
/// - a node owns more children than its {@link NodeKind} allows
/// - a child does not point back to the node holding it
/// - the same node instance appears twice
/// - a node has a blank name
///
/// ### Warnings
/// - a decorator without a child, which fails every tick
/// - a composite without children
/// - several nodes sharing a name, which makes {@link Node#findNode} ambiguous
public final class TreeValidator {

    private TreeValidator() {}

    /// Validates the tree below a root.
    ///
    /// @param root tree root, not null
    /// @return the result, never null
    public static ValidationResult validate(Node root) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<String> names = new HashSet<>();
        Set<String> duplicates = new HashSet<>();
        visit(root, seen, names, duplicates, errors, warnings);
        if (!duplicates.isEmpty()) {
            warnings.add("Duplicate node names: " + duplicates);
        }
        return new ValidationResult(errors, warnings);
    }

    /// Validates and throws on the first error.
    ///
    /// @param root tree root, not null
    /// @throws TreeStructureException if the tree has errors
    public static void requireValid(Node root) {
        ValidationResult result = validate(root);
        if (!result.isValid()) {
            throw new TreeStructureException(
                    "Invalid tree under '" + root.getName() + "': " + String.join("; ", result.errors()));
        }
    }

    private static void visit(
            Node node,
            Set<Node> seen,
            Set<String> names,
            Set<String> duplicates,
            List<String> errors,
            List<String> warnings) {
        if (!seen.add(node)) {
            errors.add("Node '" + node.getName() + "' appears more than once");
            return;
        }
        if (node.getName().isBlank()) {
            errors.add("Node of type " + node.getTypeName() + " has a blank name");
        }
        if (!names.add(node.getName())) {
            duplicates.add(node.getName());
        }

        int childCount = node.getChildCount();
        NodeKind kind = node.getKind();
        if (childCount > kind.getMaxChildren()) {
            errors.add(kind + " node '" + node.getName() + "' has " + childCount
                    + " children, at most " + kind.getMaxChildren() + " allowed");
        }
        if (kind == NodeKind.DECORATOR && childCount == 0) {
            warnings.add("Decorator '" + node.getName() + "' has no child");
        }
        if (kind == NodeKind.COMPOSITE && childCount == 0) {
            warnings.add("Composite '" + node.getName() + "' has no children");
        }

        for (Node child : node.getChildren()) {
            if (child.getParent() != node) {
                errors.add("Child '" + child.getName() + "' of '" + node.getName()
                        + "' does not reference it as parent");
            }
            visit(child, seen, names, duplicates, errors, warnings);
        }
    }
}
