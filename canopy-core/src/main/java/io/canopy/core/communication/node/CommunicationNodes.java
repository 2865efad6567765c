package io.canopy.core.communication.node;

import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.node.leaf.WaitForEvent;
import io.canopy.core.registry.NodeRegistry;
import java.util.Objects;

/// Registers the communication leaves, bound to one middleware, in a node registry.
///
/// {@snippet :
/// NodeRegistry registry = new DefaultNodeRegistry();
/// CommunicationNodes.register(registry, forest.getCommunication());
/// }
public final class CommunicationNodes {

    private CommunicationNodes() {}

    /// Adds every communication leaf type and `WaitForEvent`, which waits on the
    /// middleware's event dispatcher.
    ///
    /// @param registry target registry, not null
    /// @param middleware middleware the created leaves talk to, not null
    public static void register(NodeRegistry registry, CommunicationMiddleware middleware) {
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(middleware, "middleware must not be null");

        registry.register("CommPublisher", "Publishes a blackboard value on a topic",
                spec -> new CommPublisher(spec.name(), middleware,
                        spec.requireString(CommPublisher.TOPIC),
                        spec.stringAttribute(CommPublisher.DATA_KEY, null)));
        registry.register("CommSubscriber", "Waits for a message on a topic",
                spec -> new CommSubscriber(spec.name(), middleware,
                        spec.requireString(CommSubscriber.TOPIC),
                        spec.stringAttribute(CommSubscriber.OUTPUT_KEY, null),
                        spec.durationAttribute(CommSubscriber.TIMEOUT, CommunicationLeaf.DEFAULT_TIMEOUT)));
        registry.register("CommRequest", "Calls a service",
                spec -> new CommRequest(spec.name(), middleware,
                        spec.requireString(CommRequest.SERVICE),
                        spec.stringAttribute(CommRequest.PARAMS_KEY, null),
                        spec.stringAttribute(CommRequest.RESPONSE_KEY, null)));
        registry.register("CommCallBehavior", "Runs a behavior exposed by another tree",
                spec -> new CommCallBehavior(spec.name(), middleware,
                        spec.requireString(CommCallBehavior.BEHAVIOR),
                        spec.stringAttribute(CommCallBehavior.PARAMS_KEY, null),
                        spec.stringAttribute(CommCallBehavior.RESULT_KEY, null)));
        registry.register("CommStateUpdate", "Updates watched state",
                spec -> new CommStateUpdate(spec.name(), middleware,
                        spec.requireString(CommStateUpdate.STATE_KEY),
                        spec.requireString(CommStateUpdate.VALUE_KEY)));
        registry.register("CommTaskPublisher", "Posts a task on the task board",
                spec -> new CommTaskPublisher(spec.name(), middleware,
                        spec.requireString(CommTaskPublisher.TITLE),
                        spec.stringAttribute(CommTaskPublisher.DESCRIPTION, ""),
                        spec.stringSetAttribute(CommTaskPublisher.REQUIREMENTS),
                        spec.intAttribute(CommTaskPublisher.PRIORITY, 0),
                        spec.stringAttribute(CommTaskPublisher.DATA_KEY, null),
                        spec.stringAttribute(CommTaskPublisher.TASK_ID_KEY, null)));
        registry.register("CommTaskClaimer", "Claims a task matching its capabilities",
                spec -> new CommTaskClaimer(spec.name(), middleware,
                        spec.stringSetAttribute(CommTaskClaimer.CAPABILITIES),
                        spec.stringAttribute(CommTaskClaimer.TASK_ID_KEY, null),
                        spec.stringAttribute(CommTaskClaimer.TASK_DATA_KEY, null)));
        registry.register("CommTaskComplete", "Completes a claimed task",
                spec -> new CommTaskComplete(spec.name(), middleware,
                        spec.requireString(CommTaskComplete.TASK_ID_KEY),
                        spec.stringAttribute(CommTaskComplete.RESULT_KEY, null)));
        registry.register("CommExternalInput", "Waits for data on an external channel",
                spec -> new CommExternalInput(spec.name(), middleware,
                        spec.requireString(CommExternalInput.CHANNEL),
                        spec.stringAttribute(CommExternalInput.OUTPUT_KEY, null),
                        spec.durationAttribute(CommExternalInput.TIMEOUT, CommunicationLeaf.DEFAULT_TIMEOUT)));
        registry.register("CommExternalOutput", "Sends data out through an external channel",
                spec -> new CommExternalOutput(spec.name(), middleware,
                        spec.requireString(CommExternalOutput.CHANNEL),
                        spec.requireString(CommExternalOutput.DATA_KEY)));
        registry.register("WaitForEvent", "Waits for an event",
                spec -> new WaitForEvent(spec.name(), middleware.getEventDispatcher(),
                        spec.requireString(WaitForEvent.EVENT),
                        spec.durationAttribute(WaitForEvent.TIMEOUT, CommunicationLeaf.DEFAULT_TIMEOUT),
                        spec.stringAttribute(WaitForEvent.OUTPUT, null)));
    }
}
