package io.canopy.core.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EventDispatcherTest {

    @Mock private EventListener listener;

    private EventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new EventDispatcher();
    }

    @Nested
    class EmitTest {

        @Test
        void shouldRecordOccurrencesAndCount() {
            // When
            dispatcher.emit("tick", "tree", 1);
            EventInfo second = dispatcher.emit("tick", "tree", 2);

            // Then
            assertThat(second.triggerCount()).isEqualTo(2);
            assertThat(dispatcher.getEventInfo("tick")).get().extracting(EventInfo::data).isEqualTo(2);
            assertThat(dispatcher.getStats()).containsEntry("tick", 2L);
            assertThat(dispatcher.getEventNames()).containsExactly("tick");
        }

        @Test
        void shouldNotifyListeners() {
            // Given
            dispatcher.addListener("ready", listener);

            // When
            dispatcher.emit("ready", "source", "payload");

            // Then
            ArgumentCaptor<EventInfo> captor = ArgumentCaptor.forClass(EventInfo.class);
            verify(listener).onEvent(captor.capture());
            assertThat(captor.getValue().source()).isEqualTo("source");
            assertThat(captor.getValue().data()).isEqualTo("payload");
        }

        @Test
        void shouldKeepNotifyingAfterListenerFailure() {
            // Given
            EventListener failing = info -> {
                throw new IllegalStateException("listener failed");
            };
            dispatcher.addListener("ready", failing);
            dispatcher.addListener("ready", listener);

            // When
            dispatcher.emit("ready");

            // Then
            verify(listener).onEvent(any());
            assertThat(dispatcher.isPending("ready")).isTrue();
        }

        @Test
        void shouldStopNotifyingRemovedListener() {
            dispatcher.addListener("ready", listener);

            assertThat(dispatcher.removeListener("ready", listener)).isTrue();
            dispatcher.emit("ready");

            verify(listener, never()).onEvent(any());
        }
    }

    @Nested
    class WaitTest {

        @Test
        void shouldConsumePendingFlag() throws InterruptedException {
            dispatcher.emit("done");

            assertThat(dispatcher.waitFor("done", Duration.ZERO)).isTrue();
            assertThat(dispatcher.waitFor("done", Duration.ofMillis(10))).isFalse();
        }

        @Test
        void shouldWakeWaiterOnEmit() throws Exception {
            // Given
            CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
                try {
                    return dispatcher.waitFor("later", Duration.ofSeconds(5));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            });

            // When
            Thread.sleep(50);
            dispatcher.emit("later");

            // Then
            assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        void shouldReleaseEveryWaiterOnSingleEmit() throws Exception {
            // Given
            CompletableFuture<Boolean> first = waitAsync("alarm");
            CompletableFuture<Boolean> second = waitAsync("alarm");
            awaitWaiters("alarm", 2);

            // When
            dispatcher.emit("alarm");

            // Then
            assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(second.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(dispatcher.isPending("alarm")).isFalse();
            assertThat(dispatcher.getWaiterCount("alarm")).isZero();
        }

        @Test
        void shouldCountEmissionDuringWaitForAll() throws Exception {
            // Given
            dispatcher.emit("a");
            CompletableFuture<Boolean> both = CompletableFuture.supplyAsync(() -> {
                try {
                    return dispatcher.waitForAll(List.of("a", "b"), Duration.ofSeconds(5));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            });
            awaitWaiters("b", 1);

            // When
            dispatcher.emit("b");

            // Then
            assertThat(both.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(dispatcher.isPending("a")).isFalse();
            assertThat(dispatcher.isPending("b")).isFalse();
        }

        @Test
        void shouldReturnFirstPendingOfAny() throws InterruptedException {
            dispatcher.emit("b");

            assertThat(dispatcher.waitForAny(List.of("a", "b"), Duration.ofMillis(10))).contains("b");
            assertThat(dispatcher.waitForAny(List.of("a", "b"), Duration.ofMillis(10))).isEmpty();
        }

        @Test
        void shouldLeaveFlagsUntouchedWhenNotAllFired() throws InterruptedException {
            // Given
            dispatcher.emit("a");

            // When
            boolean all = dispatcher.waitForAll(List.of("a", "b"), Duration.ofMillis(10));

            // Then
            assertThat(all).isFalse();
            assertThat(dispatcher.isPending("a")).isTrue();

            dispatcher.emit("b");
            assertThat(dispatcher.waitForAll(List.of("a", "b"), Duration.ofMillis(10))).isTrue();
            assertThat(dispatcher.isPending("a")).isFalse();
        }

        @Test
        void shouldClearAndRemoveEvents() {
            dispatcher.emit("x");

            dispatcher.clearEvent("x");
            assertThat(dispatcher.isPending("x")).isFalse();
            assertThat(dispatcher.getEventInfo("x")).isPresent();

            assertThat(dispatcher.removeEvent("x")).isTrue();
            assertThat(dispatcher.getEventInfo("x")).isEmpty();
        }
    }

    private CompletableFuture<Boolean> waitAsync(String name) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return dispatcher.waitFor(name, Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });
    }

    private void awaitWaiters(String name, int count) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (dispatcher.getWaiterCount(name) < count && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(dispatcher.getWaiterCount(name)).isEqualTo(count);
    }
}
