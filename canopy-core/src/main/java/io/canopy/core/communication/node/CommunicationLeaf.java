package io.canopy.core.communication.node;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.exception.CommunicationException;
import io.canopy.core.node.Status;
import io.canopy.core.node.leaf.Action;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Base class for leaves that talk to a {@link CommunicationMiddleware}.
///
/// A {@link CommunicationException} raised by the middleware, such as an unknown service
/// or task, turns into {@link Status#FAILURE} and is logged at fine level. Other
/// exceptions follow the regular node fault handling.
public abstract class CommunicationLeaf extends Action {

    private static final Logger logger = Logger.getLogger(CommunicationLeaf.class.getName());

    /// Wait applied by leaves that block for a message when none is configured.
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1);

    private final CommunicationMiddleware middleware;

    protected CommunicationLeaf(String name, CommunicationMiddleware middleware, Set<String> parameters) {
        super(name, parameters);
        this.middleware = Objects.requireNonNull(middleware, "middleware must not be null");
    }

    @Override
    protected final Status execute(Blackboard blackboard) throws Exception {
        try {
            return communicate(blackboard);
        } catch (CommunicationException e) {
            logger.fine(getTypeName() + " '" + getName() + "' failed: " + e.getMessage());
            return Status.FAILURE;
        }
    }

    /// Performs one communication step.
    ///
    /// @param blackboard the tree's blackboard, not null
    /// @return the step's status, not null
    /// @throws Exception on failure
    protected abstract Status communicate(Blackboard blackboard) throws Exception;

    public CommunicationMiddleware getMiddleware() {
        return middleware;
    }

    /// Name reported to the middleware as the origin of messages sent by this leaf.
    protected String source() {
        return getName();
    }

    /// Reads a parameter map from the blackboard.
    ///
    /// @return a mutable copy, empty when the key is null, absent or not a map
    protected static Map<String, Object> readParams(Blackboard blackboard, String key) {
        Map<String, Object> params = new HashMap<>();
        if (key == null) {
            return params;
        }
        blackboard.getAs(key, Map.class).ifPresent(map -> map.forEach((k, v) -> params.put(String.valueOf(k), v)));
        return params;
    }

    /// Stores a value when both the key and the value are present.
    protected static void store(Blackboard blackboard, String key, Object value) {
        if (key != null && value != null) {
            blackboard.set(key, value);
        }
    }
}
