package io.canopy.core.communication;

import java.util.Map;

/// A behavior that one tree exposes for other trees to call directly.
@FunctionalInterface
public interface BehaviorHandler {

    /// @param params call parameters, shared by reference, not null
    /// @return the result, may be null
    /// @throws Exception on failure, returned to the caller
    Object call(Map<String, Object> params) throws Exception;
}
