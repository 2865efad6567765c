package io.canopy.core.node.leaf;

import io.canopy.core.blackboard.Blackboard;

public class AlwaysFalse extends Condition {

    public AlwaysFalse(String name) {
        super(name);
    }

    @Override
    protected boolean evaluate(Blackboard blackboard) {
        return false;
    }
}
