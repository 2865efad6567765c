package io.canopy.core.communication;

/// Receives messages published on a topic.
@FunctionalInterface
public interface TopicSubscriber {

    /// @param event the published message, not null
    /// @throws Exception on failure, logged by the middleware
    void onEvent(TopicEvent event) throws Exception;
}
