package io.canopy.core.communication;

/// Handles data arriving on, or leaving through, an external channel.
@FunctionalInterface
public interface ChannelHandler {

    /// @param entry the queued entry, not null
    /// @throws Exception on failure, logged by the middleware
    void handle(ChannelEntry entry) throws Exception;
}
