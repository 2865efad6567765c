package io.canopy.core.node;

/// Structural category of a node, fixing how many children it may own.
public enum NodeKind {
    /// Any number of ordered children.
    COMPOSITE(Integer.MAX_VALUE),
    /// At most one child.
    DECORATOR(1),
    /// No children.
    LEAF(0);

    private final int maxChildren;

    NodeKind(int maxChildren) {
        this.maxChildren = maxChildren;
    }

    /// Returns the largest number of children a node of this kind may own.
    ///
    /// @return the child limit, `Integer.MAX_VALUE` for composites
    public int getMaxChildren() {
        return maxChildren;
    }
}
