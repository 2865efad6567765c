package io.canopy.core.event;

/// Synchronous receiver of emitted events.
///
/// Listeners run on the emitting thread, after waiters have been released.
@FunctionalInterface
public interface EventListener {

    /// Called for every emission of an event the listener is registered for.
    ///
    /// @param event the emission, not null
    void onEvent(EventInfo event);
}
