package io.canopy.core.communication;

import io.canopy.core.event.EventDispatcher;
import io.canopy.core.util.BoundedLog;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;

/// Publish/subscribe by topic name.
///
/// Publishing records the message in a bounded history, delivers it to every subscriber
/// concurrently and waits until each delivery finished or failed. The message is also
/// emitted as `topic_<topic>` on the event dispatcher so that waiting nodes wake up.
public class TopicBus {

    /// Prefix of the dispatcher event emitted for each published topic.
    public static final String EVENT_PREFIX = "topic_";

    private final Map<String, List<TopicSubscriber>> subscribers = new ConcurrentHashMap<>();
    private final BoundedLog<TopicEvent> history;
    private final EventDispatcher dispatcher;
    private final ExecutorService executor;

    TopicBus(EventDispatcher dispatcher, ExecutorService executor, int historyLimit) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.history = new BoundedLog<>(historyLimit);
    }

    public void subscribe(String topic, TopicSubscriber subscriber) {
        Objects.requireNonNull(topic, "topic must not be null");
        Objects.requireNonNull(subscriber, "subscriber must not be null");
        subscribers.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(subscriber);
    }

    public boolean unsubscribe(String topic, TopicSubscriber subscriber) {
        List<TopicSubscriber> registered = subscribers.get(topic);
        return registered != null && registered.remove(subscriber);
    }

    /// Publishes a message and waits for every subscriber.
    ///
    /// @param topic topic name, not null
    /// @param data payload, passed by reference, may be null
    /// @param source publisher name, not null
    /// @return the published event, never null
    public TopicEvent publish(String topic, Object data, String source) {
        Objects.requireNonNull(topic, "topic must not be null");
        TopicEvent event = new TopicEvent(topic, data, source, Instant.now());
        history.add(event);
        List<FanOut.Delivery> deliveries = subscribers.getOrDefault(topic, List.of()).stream()
                .map(s -> (FanOut.Delivery) () -> s.onEvent(event))
                .toList();
        FanOut.runAll(executor, "Subscriber of '" + topic + "'", deliveries);
        dispatcher.emit(EVENT_PREFIX + topic, source, data);
        return event;
    }

    public List<TopicSubscriber> getSubscribers(String topic) {
        return List.copyOf(subscribers.getOrDefault(topic, List.of()));
    }

    public Set<String> getTopics() {
        return Set.copyOf(subscribers.keySet());
    }

    /// Returns the published messages oldest first.
    ///
    /// @param topic topic to filter by, null for all
    /// @return history copy, never null
    public List<TopicEvent> getHistory(String topic) {
        return topic == null ? history.snapshot() : history.snapshot(e -> e.topic().equals(topic));
    }

    int subscriberCount() {
        return subscribers.values().stream().mapToInt(List::size).sum();
    }

    int historySize() {
        return history.size();
    }
}
