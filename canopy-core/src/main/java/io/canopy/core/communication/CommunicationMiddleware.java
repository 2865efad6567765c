package io.canopy.core.communication;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.event.EventDispatcher;
import io.canopy.core.exception.BehaviorNotFoundException;
import io.canopy.core.exception.InvocationFailedException;
import io.canopy.core.exception.ServiceNotFoundException;
import io.canopy.core.exception.TaskNotFoundException;
import io.canopy.core.forest.BehaviorForest;
import io.canopy.core.forest.ForestMiddleware;
import io.canopy.core.util.BoundedLog;
import io.canopy.core.util.NamedThreadFactory;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Forest middleware offering six ways for trees to cooperate.
///
/// ### Patterns
/// - **Publish/subscribe** - {@link #publish} fans a message out to topic subscribers
/// - **Request/response** - {@link #request} calls a named service and returns its answer
/// - **Shared blackboard** - {@link #set}, {@link #get}, {@link #has}, {@link #remove} with
///   an access log
/// - **State watching** - {@link #updateState} notifies watchers of real changes only
/// - **Behavior call** - {@link #callBehavior} runs a behavior another tree exposed
/// - **Task board** - {@link #publishTask}, {@link #claimTask}, {@link #completeTask},
///   {@link #failTask}
///
/// External input and output channels connect the forest to the outside world.
///
/// ### Delivery
/// Fan-out operations run every callback concurrently and return once each one finished
/// or failed. A failing callback is logged and never affects the others. Payloads are
/// passed by reference and never copied.
///
/// ### Disabling
/// While disabled, operations that publish, store or notify do nothing and return
/// neutral values. Lookups of unknown services and behaviors still fail.
///
/// @implNote Thread-safe.
///
/// @see TaskBoard
/// @see TopicBus
/// @see StateStore
/// @see ExternalChannels
public class CommunicationMiddleware implements ForestMiddleware {

    private static final Logger logger = Logger.getLogger(CommunicationMiddleware.class.getName());

    public static final String DEFAULT_NAME = "communication";
    public static final int DEFAULT_LOG_LIMIT = 1000;
    public static final int DEFAULT_STATE_HISTORY_LIMIT = 100;

    private static final ExecutorService SHARED_EXECUTOR =
            Executors.newCachedThreadPool(new NamedThreadFactory("canopy-comm"));

    private final String name;
    private final Blackboard sharedBlackboard;
    private final EventDispatcher eventDispatcher;

    private final TopicBus topics;
    private final StateStore states;
    private final TaskBoard taskBoard;
    private final ExternalChannels channels;
    private final Map<String, ServiceHandler> services = new ConcurrentHashMap<>();
    private final Map<String, BehaviorHandler> behaviors = new ConcurrentHashMap<>();
    private final BoundedLog<AccessLogEntry> accessLog;
    private final BoundedLog<BehaviorCall> callLog;

    private volatile boolean enabled = true;
    private volatile BehaviorForest forest;

    /// Creates a standalone middleware with its own blackboard and dispatcher.
    ///
    /// @param name middleware name, not null
    public CommunicationMiddleware(String name) {
        this(name, new Blackboard(), new EventDispatcher(), SHARED_EXECUTOR,
                DEFAULT_LOG_LIMIT, DEFAULT_STATE_HISTORY_LIMIT);
    }

    /// Creates a middleware on shared infrastructure.
    ///
    /// @param name middleware name, not null
    /// @param sharedBlackboard blackboard behind the shared blackboard pattern, not null
    /// @param eventDispatcher dispatcher announcing topics and external input, not null
    /// @param executor pool running fan-out callbacks, not null
    /// @param logLimit capacity of histories, logs and queues, positive
    /// @param stateHistoryLimit capacity of each key's state history, positive
    public CommunicationMiddleware(
            String name,
            Blackboard sharedBlackboard,
            EventDispatcher eventDispatcher,
            ExecutorService executor,
            int logLimit,
            int stateHistoryLimit) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.sharedBlackboard = Objects.requireNonNull(sharedBlackboard, "sharedBlackboard must not be null");
        this.eventDispatcher = Objects.requireNonNull(eventDispatcher, "eventDispatcher must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        this.topics = new TopicBus(eventDispatcher, executor, logLimit);
        this.states = new StateStore(executor, stateHistoryLimit);
        this.taskBoard = new TaskBoard(logLimit);
        this.channels = new ExternalChannels(eventDispatcher, executor, logLimit);
        this.accessLog = new BoundedLog<>(logLimit);
        this.callLog = new BoundedLog<>(logLimit);
    }

    /// Returns the shared pool used by middleware created without an explicit executor.
    public static ExecutorService defaultExecutor() {
        return SHARED_EXECUTOR;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void initialize(BehaviorForest forest) {
        this.forest = forest;
        logger.info("Communication middleware '" + name + "' attached to forest '" + forest.getName() + "'");
    }

    /// Returns the forest this middleware is attached to.
    public Optional<BehaviorForest> getForest() {
        return Optional.ofNullable(forest);
    }

    // -- Publish/subscribe ------------------------------------------------------------------

    public void subscribe(String topic, TopicSubscriber subscriber) {
        topics.subscribe(topic, subscriber);
    }

    public boolean unsubscribe(String topic, TopicSubscriber subscriber) {
        return topics.unsubscribe(topic, subscriber);
    }

    /// Publishes a message to every subscriber of a topic and waits for them.
    ///
    /// @param topic topic name, not null
    /// @param data payload, may be null
    /// @param source publisher name, not null
    public void publish(String topic, Object data, String source) {
        if (enabled) {
            topics.publish(topic, data, source);
        }
    }

    public List<TopicSubscriber> getSubscribers(String topic) {
        return topics.getSubscribers(topic);
    }

    /// Returns published messages oldest first.
    ///
    /// @param topic topic to filter by, null for all
    public List<TopicEvent> getEventHistory(String topic) {
        return topics.getHistory(topic);
    }

    // -- Request/response -------------------------------------------------------------------

    public void registerService(String serviceName, ServiceHandler handler) {
        Objects.requireNonNull(serviceName, "serviceName must not be null");
        services.put(serviceName, Objects.requireNonNull(handler, "handler must not be null"));
        logger.fine("Registered service '" + serviceName + "'");
    }

    public boolean unregisterService(String serviceName) {
        return services.remove(serviceName) != null;
    }

    /// Calls a service and returns its response.
    ///
    /// @param serviceName service name, not null
    /// @param params request parameters, not null
    /// @param source requester name, not null
    /// @return the handler's response, may be null
    /// @throws ServiceNotFoundException if no service has that name, or the middleware is disabled
    /// @throws InvocationFailedException if the handler failed
    public Object request(String serviceName, Map<String, Object> params, String source)
            throws ServiceNotFoundException, InvocationFailedException {
        ServiceHandler handler = services.get(Objects.requireNonNull(serviceName, "serviceName must not be null"));
        if (!enabled || handler == null) {
            throw new ServiceNotFoundException("Service not found: " + serviceName);
        }
        try {
            return handler.handle(params, source);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvocationFailedException("Service '" + serviceName + "' interrupted", e);
        } catch (Exception e) {
            throw new InvocationFailedException(
                    "Service '" + serviceName + "' failed: " + e.getMessage(), e);
        }
    }

    public Set<String> getAvailableServices() {
        return Set.copyOf(services.keySet());
    }

    // -- Shared blackboard ------------------------------------------------------------------

    public void set(String key, Object value, String source) {
        if (!enabled) {
            return;
        }
        sharedBlackboard.set(key, value);
        accessLog.add(new AccessLogEntry("set", key, value, source, Instant.now()));
    }

    /// Reads a shared value, logging the access.
    ///
    /// @param key the key, not null
    /// @param defaultValue returned when the key is absent or the middleware is disabled
    /// @param source reader name, not null
    /// @return the stored value or `defaultValue`
    public Object get(String key, Object defaultValue, String source) {
        if (!enabled) {
            return defaultValue;
        }
        Object value = sharedBlackboard.get(key, defaultValue);
        accessLog.add(new AccessLogEntry("get", key, value, source, Instant.now()));
        return value;
    }

    public boolean has(String key) {
        return enabled && sharedBlackboard.has(key);
    }

    public boolean remove(String key, String source) {
        if (!enabled) {
            return false;
        }
        boolean removed = sharedBlackboard.remove(key);
        if (removed) {
            accessLog.add(new AccessLogEntry("remove", key, null, source, Instant.now()));
        }
        return removed;
    }

    /// Returns shared blackboard accesses oldest first.
    ///
    /// @param source accessor to filter by, null for all
    public List<AccessLogEntry> getAccessLog(String source) {
        return source == null ? accessLog.snapshot() : accessLog.snapshot(e -> source.equals(e.source()));
    }

    public Blackboard getSharedBlackboard() {
        return sharedBlackboard;
    }

    // -- State watching ---------------------------------------------------------------------

    public void watchState(String key, StateWatcher watcher, String source) {
        states.watch(key, watcher, source);
    }

    public boolean unwatchState(String key, StateWatcher watcher) {
        return states.unwatch(key, watcher);
    }

    /// Updates a watched value, notifying watchers if it changed.
    ///
    /// @return `true` if the value changed
    public boolean updateState(String key, Object value, String source) {
        return enabled && states.update(key, value, source);
    }

    public Object getState(String key) {
        return states.get(key);
    }

    public List<StateChange> getStateHistory(String key) {
        return states.getHistory(key);
    }

    public Set<String> getWatchedKeys() {
        return states.getWatchedKeys();
    }

    // -- Behavior call ----------------------------------------------------------------------

    public void registerBehavior(String behaviorName, BehaviorHandler handler) {
        Objects.requireNonNull(behaviorName, "behaviorName must not be null");
        behaviors.put(behaviorName, Objects.requireNonNull(handler, "handler must not be null"));
        logger.fine("Registered behavior '" + behaviorName + "'");
    }

    public boolean unregisterBehavior(String behaviorName) {
        return behaviors.remove(behaviorName) != null;
    }

    /// Runs a registered behavior and records the call.
    ///
    /// @param behaviorName behavior name, not null
    /// @param params call parameters, not null
    /// @param source caller name, not null
    /// @return the behavior's result, may be null
    /// @throws BehaviorNotFoundException if no behavior has that name, or the middleware is disabled
    /// @throws InvocationFailedException if the behavior failed
    public Object callBehavior(String behaviorName, Map<String, Object> params, String source)
            throws BehaviorNotFoundException, InvocationFailedException {
        BehaviorHandler handler = behaviors.get(Objects.requireNonNull(behaviorName, "behaviorName must not be null"));
        if (!enabled || handler == null) {
            throw new BehaviorNotFoundException("Behavior not found: " + behaviorName);
        }
        Instant started = Instant.now();
        try {
            Object result = handler.call(params);
            callLog.add(new BehaviorCall(behaviorName, params, source, started, true, result, null));
            return result;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            callLog.add(new BehaviorCall(behaviorName, params, source, started, false, null, error));
            logger.warning("Behavior '" + behaviorName + "' called by " + source + " failed: " + e);
            throw new InvocationFailedException("Behavior '" + behaviorName + "' failed: " + e.getMessage(), e);
        }
    }

    public Set<String> getRegisteredBehaviors() {
        return Set.copyOf(behaviors.keySet());
    }

    /// Returns completed behavior calls oldest first.
    ///
    /// @param behaviorName behavior to filter by, null for all
    public List<BehaviorCall> getCallLog(String behaviorName) {
        return behaviorName == null
                ? callLog.snapshot()
                : callLog.snapshot(c -> c.behavior().equals(behaviorName));
    }

    // -- Task board -------------------------------------------------------------------------

    /// Publishes a task.
    ///
    /// @return the task id, or empty while the middleware is disabled
    public Optional<String> publishTask(
            String title, String description, Set<String> requirements, int priority, Map<String, Object> data) {
        if (!enabled) {
            return Optional.empty();
        }
        return Optional.of(taskBoard.publishTask(title, description, requirements, priority, data));
    }

    public boolean claimTask(String taskId, String claimant, Set<String> capabilities)
            throws TaskNotFoundException {
        return enabled && taskBoard.claimTask(taskId, claimant, capabilities);
    }

    public boolean completeTask(String taskId, Object result) throws TaskNotFoundException {
        return enabled && taskBoard.completeTask(taskId, result);
    }

    public boolean failTask(String taskId, String error) throws TaskNotFoundException {
        return enabled && taskBoard.failTask(taskId, error);
    }

    public List<Task> getAvailableTasks(Set<String> capabilities) {
        return taskBoard.getAvailableTasks(capabilities);
    }

    public List<Task> getClaimedTasks(String claimant) {
        return taskBoard.getClaimedTasks(claimant);
    }

    public TaskBoard getTaskBoard() {
        return taskBoard;
    }

    // -- External channels ------------------------------------------------------------------

    public void registerInputHandler(String channel, ChannelHandler handler) {
        channels.registerInputHandler(channel, handler);
    }

    public boolean unregisterInputHandler(String channel, ChannelHandler handler) {
        return channels.unregisterInputHandler(channel, handler);
    }

    public void registerOutputHandler(String channel, ChannelHandler handler) {
        channels.registerOutputHandler(channel, handler);
    }

    public boolean unregisterOutputHandler(String channel, ChannelHandler handler) {
        return channels.unregisterOutputHandler(channel, handler);
    }

    /// Accepts data from outside the forest.
    public void externalInput(String channel, Object data) {
        if (enabled) {
            channels.input(channel, data);
        }
    }

    /// Sends data out of the forest.
    public void externalOutput(String channel, Object data) {
        if (enabled) {
            channels.output(channel, data);
        }
    }

    public ExternalChannels getChannels() {
        return channels;
    }

    // -- Shared events ----------------------------------------------------------------------

    /// Emits an event on the dispatcher shared by the forest.
    public void emitSharedEvent(String eventName, String source, Object data) {
        if (enabled) {
            eventDispatcher.emit(eventName, source, data);
        }
    }

    public EventDispatcher getEventDispatcher() {
        return eventDispatcher;
    }

    // -- Lifecycle --------------------------------------------------------------------------

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        logger.info("Communication middleware '" + name + "' " + (enabled ? "enabled" : "disabled"));
    }

    public CommunicationStats getStats() {
        return new CommunicationStats(
                enabled,
                topics.getTopics().size(),
                topics.subscriberCount(),
                topics.historySize(),
                services.size(),
                sharedBlackboard.size(),
                accessLog.size(),
                states.getWatchedKeys().size(),
                behaviors.size(),
                callLog.size(),
                taskBoard.getStats(),
                channels.getInputQueue(null).size(),
                channels.getOutputQueue(null).size());
    }
}
