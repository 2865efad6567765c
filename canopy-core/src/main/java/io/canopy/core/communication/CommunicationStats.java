package io.canopy.core.communication;

/// Snapshot of communication middleware activity.
///
/// @param enabled whether the middleware currently accepts operations
/// @param topics topics with at least one subscriber registration
/// @param subscribers total subscriber registrations
/// @param publishedEvents events kept in the pub/sub history
/// @param services registered request/response services
/// @param sharedKeys keys on the shared blackboard
/// @param accessLogSize entries in the shared blackboard access log
/// @param watchedKeys state keys with watchers
/// @param behaviors registered callable behaviors
/// @param behaviorCalls entries in the behavior call log
/// @param tasks task board counts
/// @param inputQueueSize queued external input
/// @param outputQueueSize queued external output
public record CommunicationStats(
        boolean enabled,
        int topics,
        int subscribers,
        int publishedEvents,
        int services,
        int sharedKeys,
        int accessLogSize,
        int watchedKeys,
        int behaviors,
        int behaviorCalls,
        TaskStats tasks,
        int inputQueueSize,
        int outputQueueSize) {}
