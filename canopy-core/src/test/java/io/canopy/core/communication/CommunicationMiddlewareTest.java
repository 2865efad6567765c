package io.canopy.core.communication;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.canopy.core.blackboard.Blackboard;
import io.canopy.core.event.EventDispatcher;
import io.canopy.core.exception.BehaviorNotFoundException;
import io.canopy.core.exception.InvocationFailedException;
import io.canopy.core.exception.ServiceNotFoundException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CommunicationMiddleware")
class CommunicationMiddlewareTest {

    private CommunicationMiddleware middleware;

    @BeforeEach
    void setUp() {
        middleware = new CommunicationMiddleware("comm");
    }

    @Nested
    @DisplayName("publish/subscribe")
    class PubSubTest {

        @Test
        void shouldDeliverToEverySubscriberBeforeReturning() {
            // Given
            List<TopicEvent> received = new CopyOnWriteArrayList<>();
            middleware.subscribe("alerts", received::add);
            middleware.subscribe("alerts", received::add);

            // When
            middleware.publish("alerts", "fire", "sensor");

            // Then
            assertThat(received).hasSize(2).allMatch(e -> e.data().equals("fire") && e.source().equals("sensor"));
            assertThat(middleware.getEventHistory("alerts")).hasSize(1);
            assertThat(middleware.getEventDispatcher().isPending(TopicBus.EVENT_PREFIX + "alerts")).isTrue();
        }

        @Test
        void shouldIsolateFailingSubscriber() {
            // Given
            List<TopicEvent> received = new CopyOnWriteArrayList<>();
            middleware.subscribe("alerts", e -> {
                throw new IllegalStateException("bad subscriber");
            });
            middleware.subscribe("alerts", received::add);

            // When
            middleware.publish("alerts", 1, "sensor");

            // Then
            assertThat(received).hasSize(1);
        }

        @Test
        void shouldStopDeliveringAfterUnsubscribe() {
            List<TopicEvent> received = new CopyOnWriteArrayList<>();
            TopicSubscriber subscriber = received::add;
            middleware.subscribe("alerts", subscriber);

            assertThat(middleware.unsubscribe("alerts", subscriber)).isTrue();
            middleware.publish("alerts", 1, "sensor");

            assertThat(received).isEmpty();
        }
    }

    @Nested
    @DisplayName("request/response")
    class RequestTest {

        @Test
        void shouldInvokeRegisteredService() throws Exception {
            middleware.registerService("add", (params, source) -> (Integer) params.get("a") + (Integer) params.get("b"));

            Object result = middleware.request("add", Map.of("a", 2, "b", 3), "caller");

            assertThat(result).isEqualTo(5);
            assertThat(middleware.getAvailableServices()).containsExactly("add");
        }

        @Test
        void shouldThrowForUnknownService() {
            assertThatThrownBy(() -> middleware.request("missing", Map.of(), "caller"))
                    .isInstanceOf(ServiceNotFoundException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        void shouldWrapServiceFailure() {
            middleware.registerService("broken", (params, source) -> {
                throw new IllegalArgumentException("bad input");
            });

            assertThatThrownBy(() -> middleware.request("broken", Map.of(), "caller"))
                    .isInstanceOf(InvocationFailedException.class)
                    .hasMessageContaining("bad input")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("shared blackboard")
    class SharedDataTest {

        @Test
        void shouldLogAccessPerSource() {
            // When
            middleware.set("target", "base", "planner");
            Object value = middleware.get("target", null, "driver");
            boolean removed = middleware.remove("target", "planner");

            // Then
            assertThat(value).isEqualTo("base");
            assertThat(removed).isTrue();
            assertThat(middleware.has("target")).isFalse();
            assertThat(middleware.getAccessLog("planner")).extracting(AccessLogEntry::operation)
                    .containsExactly("set", "remove");
            assertThat(middleware.getAccessLog(null)).hasSize(3);
        }
    }

    @Nested
    @DisplayName("state watching")
    class StateTest {

        @Test
        void shouldNotifyWatchersOnlyOnChange() {
            // Given
            List<StateChange> changes = new CopyOnWriteArrayList<>();
            middleware.watchState("mode", changes::add, "observer");

            // When
            boolean first = middleware.updateState("mode", "idle", "ctl");
            boolean same = middleware.updateState("mode", "idle", "ctl");
            boolean second = middleware.updateState("mode", "busy", "ctl");

            // Then
            assertThat(first).isTrue();
            assertThat(same).isFalse();
            assertThat(second).isTrue();
            assertThat(changes).extracting(StateChange::oldValue).containsExactly(null, "idle");
            assertThat(middleware.getState("mode")).isEqualTo("busy");
            assertThat(middleware.getStateHistory("mode")).hasSize(2);
            assertThat(middleware.getWatchedKeys()).containsExactly("mode");
        }

        @Test
        void shouldCapStateHistory() {
            CommunicationMiddleware small = new CommunicationMiddleware(
                    "small", new Blackboard(), new EventDispatcher(), CommunicationMiddleware.defaultExecutor(), 10, 3);

            for (int i = 0; i < 5; i++) {
                small.updateState("counter", i, "ctl");
            }

            assertThat(small.getStateHistory("counter")).extracting(StateChange::newValue).containsExactly(2, 3, 4);
        }
    }

    @Nested
    @DisplayName("behavior calls")
    class BehaviorTest {

        @Test
        void shouldRecordSuccessfulAndFailedCalls() throws Exception {
            // Given
            middleware.registerBehavior("double", params -> (Integer) params.get("n") * 2);
            middleware.registerBehavior("explode", params -> {
                throw new IllegalStateException("kaboom");
            });

            // When
            Object result = middleware.callBehavior("double", Map.of("n", 21), "caller");
            assertThatThrownBy(() -> middleware.callBehavior("explode", Map.of(), "caller"))
                    .isInstanceOf(InvocationFailedException.class);

            // Then
            assertThat(result).isEqualTo(42);
            assertThat(middleware.getCallLog("double")).singleElement().satisfies(call -> {
                assertThat(call.success()).isTrue();
                assertThat(call.result()).isEqualTo(42);
            });
            assertThat(middleware.getCallLog("explode")).singleElement().satisfies(call -> {
                assertThat(call.success()).isFalse();
                assertThat(call.error()).isEqualTo("kaboom");
            });
        }

        @Test
        void shouldThrowForUnknownBehavior() {
            assertThatThrownBy(() -> middleware.callBehavior("missing", Map.of(), "caller"))
                    .isInstanceOf(BehaviorNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("external channels")
    class ChannelTest {

        @Test
        void shouldQueueAndDispatchInput() throws InterruptedException {
            // Given
            List<ChannelEntry> handled = new CopyOnWriteArrayList<>();
            middleware.registerInputHandler("commands", handled::add);

            // When
            middleware.externalInput("commands", "go");

            // Then
            assertThat(handled).singleElement().extracting(ChannelEntry::source).isEqualTo(ChannelEntry.EXTERNAL);
            assertThat(middleware.getChannels().getInputQueue("commands")).hasSize(1);
            assertThat(middleware.getEventDispatcher()
                            .waitFor(ExternalChannels.INPUT_EVENT_PREFIX + "commands", Duration.ZERO))
                    .isTrue();
        }

        @Test
        void shouldQueueAndDispatchOutput() {
            List<ChannelEntry> handled = new CopyOnWriteArrayList<>();
            middleware.registerOutputHandler("status", handled::add);

            middleware.externalOutput("status", "ok");

            assertThat(handled).singleElement().extracting(ChannelEntry::data).isEqualTo("ok");
            assertThat(middleware.getChannels().getOutputQueue(null)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("enable switch")
    class EnabledTest {

        @Test
        void shouldIgnoreOperationsWhileDisabled() {
            // Given
            List<TopicEvent> received = new CopyOnWriteArrayList<>();
            middleware.subscribe("alerts", received::add);
            middleware.setEnabled(false);

            // When
            middleware.publish("alerts", 1, "sensor");
            middleware.set("key", "value", "src");
            Optional<String> taskId = middleware.publishTask("t", "", Set.of(), 0, Map.of());

            // Then
            assertThat(received).isEmpty();
            assertThat(middleware.get("key", "default", "src")).isEqualTo("default");
            assertThat(taskId).isEmpty();
            assertThat(middleware.updateState("k", 1, "src")).isFalse();
            assertThat(middleware.getStats().enabled()).isFalse();
        }

        @Test
        void shouldReportStats() throws Exception {
            middleware.subscribe("a", e -> {});
            middleware.publish("a", 1, "x");
            middleware.registerService("svc", (p, s) -> null);
            String id = middleware.publishTask("t", "", Set.of(), 0, Map.of()).orElseThrow();
            middleware.claimTask(id, "w", Set.of());

            CommunicationStats stats = middleware.getStats();

            assertThat(stats.topics()).isEqualTo(1);
            assertThat(stats.subscribers()).isEqualTo(1);
            assertThat(stats.publishedEvents()).isEqualTo(1);
            assertThat(stats.services()).isEqualTo(1);
            assertThat(stats.tasks().claimed()).isEqualTo(1);
        }
    }
}
