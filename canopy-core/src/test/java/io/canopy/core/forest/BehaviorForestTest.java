package io.canopy.core.forest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.canopy.core.communication.ChannelEntry;
import io.canopy.core.communication.TaskStatus;
import io.canopy.core.communication.TopicBus;
import io.canopy.core.communication.node.CommSubscriber;
import io.canopy.core.communication.node.CommTaskClaimer;
import io.canopy.core.communication.node.CommTaskPublisher;
import io.canopy.core.engine.BehaviorTree;
import io.canopy.core.event.EventDispatcher;
import io.canopy.core.node.Node;
import io.canopy.core.node.Status;
import io.canopy.core.node.StubbornNode;
import io.canopy.core.node.leaf.Action;
import io.canopy.core.node.leaf.AlwaysFalse;
import io.canopy.core.node.leaf.AlwaysTrue;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("BehaviorForest")
class BehaviorForestTest {

    @Mock private ForestMiddleware extension;

    private BehaviorForest forest;

    @BeforeEach
    void setUp() {
        forest = new BehaviorForest("fleet");
    }

    @AfterEach
    void tearDown() {
        forest.close();
    }

    private ForestNode addLeafNode(String name, ForestNodeType type, Node root) {
        BehaviorTree tree = forest.newTree(name);
        tree.loadFromRoot(root);
        return forest.addNode(name, tree, type, Set.of());
    }

    @Nested
    @DisplayName("membership")
    class MembershipTest {

        @Test
        void shouldShareBlackboardAndEventsWithNewTrees() {
            BehaviorTree tree = forest.newTree("scout");

            assertThat(tree.getBlackboard()).isSameAs(forest.getBlackboard());
            assertThat(tree.getEventDispatcher()).isSameAs(forest.getEventDispatcher());
        }

        @Test
        void shouldAddAndRemoveNodes() {
            // Given
            ForestNode node = addLeafNode("scout", ForestNodeType.WORKER, new AlwaysTrue("ok"));

            // Then
            assertThat(forest.getNode("scout")).containsSame(node);
            assertThat(node.getCapabilities()).containsExactly("worker");
            assertThat(forest.getEventDispatcher().isPending(BehaviorForest.EVENT_NODE_ADDED)).isTrue();

            assertThat(forest.removeNode("scout")).isTrue();
            assertThat(forest.removeNode("scout")).isFalse();
            assertThat(forest.getNodes()).isEmpty();
        }

        @Test
        void shouldRejectDuplicateNodeNames() {
            addLeafNode("scout", ForestNodeType.WORKER, new AlwaysTrue("ok"));

            assertThatThrownBy(() -> addLeafNode("scout", ForestNodeType.MASTER, new AlwaysTrue("again")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("scout");
        }

        @Test
        void shouldFilterByTypeAndCapability() {
            // Given
            addLeafNode("boss", ForestNodeType.MASTER, new AlwaysTrue("a"));
            ForestNode worker = addLeafNode("hand", ForestNodeType.WORKER, new AlwaysTrue("b"));
            worker.addCapability("welding");

            // Then
            assertThat(forest.getNodesByType(ForestNodeType.MASTER)).extracting(ForestNode::getName)
                    .containsExactly("boss");
            assertThat(forest.getNodesByCapability("welding")).containsExactly(worker);
        }
    }

    @Nested
    @DisplayName("ticking")
    class TickTest {

        @Test
        void shouldTickEveryNodeAndReportStatuses() {
            // Given
            addLeafNode("good", ForestNodeType.WORKER, new AlwaysTrue("ok"));
            addLeafNode("bad", ForestNodeType.WORKER, new AlwaysFalse("no"));

            // When
            Map<String, Status> results = forest.tick();

            // Then
            assertThat(results).containsEntry("good", Status.SUCCESS).containsEntry("bad", Status.FAILURE);
            assertThat(forest.getNode("good")).get().extracting(ForestNode::getStatus).isEqualTo(Status.SUCCESS);
            assertThat(forest.getStats().forestTicks()).isEqualTo(1);
        }

        @Test
        void shouldRunMiddlewareHooksAroundTick() {
            // Given
            when(extension.getName()).thenReturn("audit");
            forest.addMiddleware(extension);
            addLeafNode("good", ForestNodeType.WORKER, new AlwaysTrue("ok"));

            // When
            forest.tick();

            // Then
            InOrder order = inOrder(extension);
            order.verify(extension).initialize(forest);
            order.verify(extension).preTick();
            order.verify(extension).postTick(Map.of("good", Status.SUCCESS));
            assertThat(forest.getStats().middleware()).containsExactly("communication", "audit");
            assertThat(forest.getMiddleware(ForestMiddleware.class)).containsSame(forest.getCommunication());
        }

        @Test
        void shouldCoordinateNodesThroughTaskBoard() {
            // Given
            addLeafNode("master", ForestNodeType.MASTER, new CommTaskPublisher(
                    "post", forest.getCommunication(), "Patrol", "", Set.of("legs"), 1, null, "postedId"));
            ForestNode worker = addLeafNode("walker", ForestNodeType.WORKER, new CommTaskClaimer(
                    "claim", forest.getCommunication(), Set.of("legs"), "claimedId", null));
            worker.addCapability("legs");

            // When
            forest.getNode("master").orElseThrow().tick();
            Status claimed = worker.tick();

            // Then
            assertThat(claimed).isEqualTo(Status.SUCCESS);
            String taskId = (String) forest.getBlackboard().get("claimedId");
            assertThat(taskId).isEqualTo(forest.getBlackboard().get("postedId"));
            assertThat(forest.getCommunication().getTaskBoard().getTask(taskId)).get()
                    .extracting(t -> t.getStatus())
                    .isEqualTo(TaskStatus.CLAIMED);
        }

        @Test
        void shouldDeliverOnePublishToEverySubscribingTree() throws Exception {
            // Given
            addLeafNode("north", ForestNodeType.WORKER, new CommSubscriber(
                    "listen", forest.getCommunication(), "alerts", "northAlert", Duration.ofSeconds(5)));
            addLeafNode("south", ForestNodeType.WORKER, new CommSubscriber(
                    "listen", forest.getCommunication(), "alerts", "southAlert", Duration.ofSeconds(5)));
            CompletableFuture<Map<String, Status>> tick = CompletableFuture.supplyAsync(forest::tick);
            EventDispatcher events = forest.getCommunication().getEventDispatcher();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (events.getWaiterCount(TopicBus.EVENT_PREFIX + "alerts") < 2 && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }

            // When
            forest.getCommunication().publish("alerts", "fire", "hq");

            // Then
            assertThat(tick.get(5, TimeUnit.SECONDS))
                    .containsEntry("north", Status.SUCCESS)
                    .containsEntry("south", Status.SUCCESS);
            assertThat(forest.getBlackboard().get("northAlert")).isEqualTo("fire");
            assertThat(forest.getBlackboard().get("southAlert")).isEqualTo("fire");
        }

        @Test
        void shouldResetNodesAndCounters() {
            addLeafNode("good", ForestNodeType.WORKER, new AlwaysTrue("ok"));
            forest.tick();

            forest.reset();

            assertThat(forest.getNode("good")).get().extracting(ForestNode::getStatus).isEqualTo(Status.FAILURE);
            assertThat(forest.getStats().forestTicks()).isZero();
            assertThat(forest.getEventDispatcher().isPending(BehaviorForest.EVENT_RESET)).isTrue();
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTest {

        @Test
        void shouldRunTreesAndMonitorUntilStopped() throws InterruptedException {
            // Given
            forest.addMiddleware(extension);
            addLeafNode("busy", ForestNodeType.WORKER, Action.of("spin", bb -> Status.RUNNING));

            // When
            forest.start();
            Thread.sleep(300);
            boolean treeRunning = forest.getNode("busy").orElseThrow().getTree().isRunning();
            forest.stop();

            // Then
            assertThat(treeRunning).isTrue();
            assertThat(forest.isRunning()).isFalse();
            assertThat(forest.getNode("busy").orElseThrow().getTree().isRunning()).isFalse();
            assertThat(forest.getNode("busy")).get().extracting(ForestNode::getStatus).isEqualTo(Status.RUNNING);
            verify(extension, atLeastOnce()).postTick(anyMap());
            assertThat(forest.getEventDispatcher().isPending(BehaviorForest.EVENT_STARTED)).isTrue();
            assertThat(forest.getEventDispatcher().isPending(BehaviorForest.EVENT_STOPPED)).isTrue();
        }

        @Test
        void shouldLeaveNoTickRunningAfterStop() throws InterruptedException {
            // Given
            StubbornNode slow = new StubbornNode("slow", Duration.ofMillis(300));
            addLeafNode("slow", ForestNodeType.WORKER, slow);
            forest.start();
            assertThat(slow.awaitEntered(Duration.ofSeconds(5))).isTrue();

            // When
            Thread.currentThread().interrupt();
            forest.stop();

            // Then
            assertThat(Thread.interrupted()).isTrue();
            assertThat(slow.isBusy()).isFalse();
            assertThat(forest.isRunning()).isFalse();
        }

        @Test
        void shouldStartNodesAddedWhileRunning() {
            forest.start();

            ForestNode late = addLeafNode("late", ForestNodeType.MONITOR, Action.of("spin", bb -> Status.RUNNING));

            assertThat(late.getTree().isRunning()).isTrue();
        }

        @Test
        void shouldRouteExternalInputAndOutput() {
            // Given
            List<ChannelEntry> inputs = new CopyOnWriteArrayList<>();
            List<ChannelEntry> outputs = new CopyOnWriteArrayList<>();
            forest.onInput("radio", inputs::add);
            forest.onOutput("radio", outputs::add);

            // When
            forest.input("radio", "ping");
            forest.output("radio", "pong");

            // Then
            assertThat(inputs).extracting(ChannelEntry::data).containsExactly("ping");
            assertThat(outputs).extracting(ChannelEntry::data).containsExactly("pong");
        }

        @Test
        void shouldRejectNonPositiveMonitorInterval() {
            assertThatThrownBy(() -> new BehaviorForest(
                            "bad",
                            forest.getBlackboard(),
                            forest.getEventDispatcher(),
                            ForkJoinPool.commonPool(),
                            Duration.ZERO,
                            10,
                            10))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
