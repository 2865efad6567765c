package io.canopy.core.node.composite;

import io.canopy.core.node.Node;
import io.canopy.core.node.Status;

/// Ticks children left to right until one does not succeed.
///
/// The first child that fails or is still running decides the result and later
/// children are not ticked. An empty sequence succeeds.
public class Sequence extends CompositeNode {

    public Sequence(String name, Node... children) {
        super(name, children);
    }

    @Override
    protected Status doTick() {
        for (Node child : getChildren()) {
            Status result = child.tick();
            if (result != Status.SUCCESS) {
                return result;
            }
        }
        return Status.SUCCESS;
    }
}
