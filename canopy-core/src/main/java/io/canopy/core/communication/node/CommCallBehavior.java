package io.canopy.core.communication.node;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.exception.CommunicationException;
import io.canopy.core.node.Status;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Runs a behavior registered by another tree and stores its result.
public class CommCallBehavior extends CommunicationLeaf {

    public static final String BEHAVIOR = "behavior";
    public static final String PARAMS_KEY = "paramsKey";
    public static final String RESULT_KEY = "resultKey";

    private final String behavior;
    private final String paramsKey;
    private final String resultKey;

    public CommCallBehavior(
            String name, CommunicationMiddleware middleware, String behavior, String paramsKey, String resultKey) {
        super(name, middleware, Set.of(BEHAVIOR, PARAMS_KEY, RESULT_KEY));
        this.behavior = Objects.requireNonNull(behavior, "behavior must not be null");
        this.paramsKey = paramsKey;
        this.resultKey = resultKey;
    }

    @Override
    protected Status communicate(Blackboard blackboard) throws CommunicationException {
        Map<String, Object> params = readParams(blackboard, resolveKey(PARAMS_KEY, paramsKey));
        Object result = getMiddleware().callBehavior(String.valueOf(resolve(BEHAVIOR, behavior)), params, source());
        store(blackboard, resolveKey(RESULT_KEY, resultKey), result);
        return Status.SUCCESS;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(BEHAVIOR, behavior);
        if (paramsKey != null) {
            attributes.put(PARAMS_KEY, paramsKey);
        }
        if (resultKey != null) {
            attributes.put(RESULT_KEY, resultKey);
        }
        return attributes;
    }
}
