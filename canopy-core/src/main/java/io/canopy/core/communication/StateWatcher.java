package io.canopy.core.communication;

@FunctionalInterface
public interface StateWatcher {

    /// Called after a watched key changed value.
    ///
    /// @param change the change, not null
    /// @throws Exception on failure, logged by the middleware
    void onChange(StateChange change) throws Exception;
}
