package io.canopy.core.communication;

import java.util.Map;

/// Serves requests made to a named service.
@FunctionalInterface
public interface ServiceHandler {

    /// @param params request parameters, shared by reference, not null
    /// @param source name of the requester, not null
    /// @return the response, may be null
    /// @throws Exception on failure, returned to the requester
    Object handle(Map<String, Object> params, String source) throws Exception;
}
