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

/// Named channels carrying data into and out of the forest.
///
/// Input arrives from outside, is queued, handed to the channel's input handlers and
/// announced as `external_input_<channel>` on the event dispatcher. Output is produced
/// by trees, queued and handed to the channel's output handlers. Both queues are bounded
/// and drop their oldest entries when full.
public class ExternalChannels {

    /// Prefix of the dispatcher event emitted for each input.
    public static final String INPUT_EVENT_PREFIX = "external_input_";

    private final Map<String, List<ChannelHandler>> inputHandlers = new ConcurrentHashMap<>();
    private final Map<String, List<ChannelHandler>> outputHandlers = new ConcurrentHashMap<>();
    private final BoundedLog<ChannelEntry> inputQueue;
    private final BoundedLog<ChannelEntry> outputQueue;
    private final EventDispatcher dispatcher;
    private final ExecutorService executor;

    ExternalChannels(EventDispatcher dispatcher, ExecutorService executor, int queueLimit) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.inputQueue = new BoundedLog<>(queueLimit);
        this.outputQueue = new BoundedLog<>(queueLimit);
    }

    public void registerInputHandler(String channel, ChannelHandler handler) {
        register(inputHandlers, channel, handler);
    }

    public boolean unregisterInputHandler(String channel, ChannelHandler handler) {
        List<ChannelHandler> registered = inputHandlers.get(channel);
        return registered != null && registered.remove(handler);
    }

    public void registerOutputHandler(String channel, ChannelHandler handler) {
        register(outputHandlers, channel, handler);
    }

    public boolean unregisterOutputHandler(String channel, ChannelHandler handler) {
        List<ChannelHandler> registered = outputHandlers.get(channel);
        return registered != null && registered.remove(handler);
    }

    /// Accepts data from outside the forest.
    ///
    /// @param channel channel name, not null
    /// @param data payload, may be null
    /// @return the queued entry, never null
    public ChannelEntry input(String channel, Object data) {
        ChannelEntry entry = new ChannelEntry(
                Objects.requireNonNull(channel, "channel must not be null"),
                data,
                ChannelEntry.EXTERNAL,
                Instant.now());
        inputQueue.add(entry);
        deliver(inputHandlers, entry, "Input handler of '" + channel + "'");
        dispatcher.emit(INPUT_EVENT_PREFIX + channel, ChannelEntry.EXTERNAL, data);
        return entry;
    }

    /// Sends data out of the forest.
    ///
    /// @param channel channel name, not null
    /// @param data payload, may be null
    /// @return the queued entry, never null
    public ChannelEntry output(String channel, Object data) {
        ChannelEntry entry = new ChannelEntry(
                Objects.requireNonNull(channel, "channel must not be null"),
                data,
                ChannelEntry.INTERNAL,
                Instant.now());
        outputQueue.add(entry);
        deliver(outputHandlers, entry, "Output handler of '" + channel + "'");
        return entry;
    }

    /// Returns queued input oldest first.
    ///
    /// @param channel channel to filter by, null for all
    public List<ChannelEntry> getInputQueue(String channel) {
        return channel == null ? inputQueue.snapshot() : inputQueue.snapshot(e -> e.channel().equals(channel));
    }

    /// Returns queued output oldest first.
    ///
    /// @param channel channel to filter by, null for all
    public List<ChannelEntry> getOutputQueue(String channel) {
        return channel == null ? outputQueue.snapshot() : outputQueue.snapshot(e -> e.channel().equals(channel));
    }

    public void clearInputQueue() {
        inputQueue.clear();
    }

    public void clearOutputQueue() {
        outputQueue.clear();
    }

    public Set<String> getInputChannels() {
        return Set.copyOf(inputHandlers.keySet());
    }

    public Set<String> getOutputChannels() {
        return Set.copyOf(outputHandlers.keySet());
    }

    private void deliver(Map<String, List<ChannelHandler>> handlers, ChannelEntry entry, String label) {
        List<FanOut.Delivery> deliveries = handlers.getOrDefault(entry.channel(), List.of()).stream()
                .map(h -> (FanOut.Delivery) () -> h.handle(entry))
                .toList();
        FanOut.runAll(executor, label, deliveries);
    }

    private static void register(
            Map<String, List<ChannelHandler>> handlers, String channel, ChannelHandler handler) {
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(handler, "handler must not be null");
        handlers.computeIfAbsent(channel, c -> new CopyOnWriteArrayList<>()).add(handler);
    }
}
