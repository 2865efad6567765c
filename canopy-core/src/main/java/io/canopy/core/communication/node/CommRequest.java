package io.canopy.core.communication.node;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.exception.CommunicationException;
import io.canopy.core.node.Status;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Calls a service and stores its response.
///
/// Request parameters are read from a map on the blackboard. Fails when the service is
/// unknown or its handler throws.
public class CommRequest extends CommunicationLeaf {

    public static final String SERVICE = "service";
    public static final String PARAMS_KEY = "paramsKey";
    public static final String RESPONSE_KEY = "responseKey";

    private final String service;
    private final String paramsKey;
    private final String responseKey;

    /// @param name node name, not null
    /// @param middleware middleware hosting the service, not null
    /// @param service service name, not null
    /// @param paramsKey key of the parameter map, may be null
    /// @param responseKey key receiving the response, may be null
    public CommRequest(
            String name, CommunicationMiddleware middleware, String service, String paramsKey, String responseKey) {
        super(name, middleware, Set.of(SERVICE, PARAMS_KEY, RESPONSE_KEY));
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.paramsKey = paramsKey;
        this.responseKey = responseKey;
    }

    @Override
    protected Status communicate(Blackboard blackboard) throws CommunicationException {
        Map<String, Object> params = readParams(blackboard, resolveKey(PARAMS_KEY, paramsKey));
        Object response = getMiddleware().request(String.valueOf(resolve(SERVICE, service)), params, source());
        store(blackboard, resolveKey(RESPONSE_KEY, responseKey), response);
        return Status.SUCCESS;
    }

    @Override
    public Map<String, Object> describeAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(SERVICE, service);
        if (paramsKey != null) {
            attributes.put(PARAMS_KEY, paramsKey);
        }
        if (responseKey != null) {
            attributes.put(RESPONSE_KEY, responseKey);
        }
        return attributes;
    }
}
