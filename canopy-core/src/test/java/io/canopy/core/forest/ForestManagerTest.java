package io.canopy.core.forest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.canopy.core.communication.StateChange;
import io.canopy.core.communication.TopicEvent;
import io.canopy.core.engine.BehaviorTree;
import io.canopy.core.event.EventDispatcher;
import io.canopy.core.exception.CommunicationException;
import io.canopy.core.node.leaf.AlwaysTrue;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ForestManagerTest {

    private ForestManager manager;
    private BehaviorForest alpha;
    private BehaviorForest beta;

    @BeforeEach
    void setUp() {
        manager = new ForestManager("hq");
        alpha = new BehaviorForest("alpha");
        beta = new BehaviorForest("beta");
        manager.addForest(alpha);
        manager.addForest(beta);
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    @Nested
    class RegistryTest {

        @Test
        void shouldRejectDuplicateForest() {
            assertThatThrownBy(() -> manager.addForest(new BehaviorForest("alpha")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("alpha");
        }

        @Test
        void shouldListAndRemoveForests() {
            assertThat(manager.getForests()).containsExactly(alpha, beta);
            assertThat(manager.getForest("beta")).containsSame(beta);

            assertThat(manager.removeForest("beta")).isTrue();
            assertThat(manager.removeForest("beta")).isFalse();
            assertThat(manager.getForests()).containsExactly(alpha);
        }

        @Test
        void shouldDescribeForests() {
            BehaviorTree tree = alpha.newTree("t");
            tree.loadFromRoot(new AlwaysTrue("ok"));
            alpha.addNode("node", tree, ForestNodeType.WORKER, Set.of());

            assertThat(manager.getForestInfo("alpha")).get().satisfies(info -> {
                assertThat(info.nodeCount()).isEqualTo(1);
                assertThat(info.middlewareCount()).isEqualTo(1);
                assertThat(info.running()).isFalse();
            });
            assertThat(manager.getForestInfo("missing")).isEmpty();
            assertThat(manager.getAllForestInfo()).extracting(ForestInfo::name).containsExactly("alpha", "beta");
        }
    }

    @Nested
    class LifecycleTest {

        @Test
        void shouldStartAndStopAllForests() {
            // When
            manager.start();

            // Then
            assertThat(alpha.isRunning()).isTrue();
            assertThat(beta.isRunning()).isTrue();
            assertThat(manager.getForests(true)).hasSize(2);
            assertThat(manager.getStats().runningForests()).isEqualTo(2);
            assertThat(manager.getCommunication().getEventDispatcher().getEventInfo(ForestManager.EVENT_MANAGER_STARTED))
                    .get()
                    .extracting(info -> info.data())
                    .isEqualTo(2);

            manager.stop();

            assertThat(manager.getForests(false)).hasSize(2);
            assertThat(manager.isRunning()).isFalse();
        }

        @Test
        void shouldForwardForestEventsToGlobalDispatcher() {
            // Given
            EventDispatcher global = manager.getCommunication().getEventDispatcher();

            // When
            alpha.start();
            alpha.stop();
            alpha.reset();

            // Then
            assertThat(global.isPending(BehaviorForest.EVENT_STARTED + ForestManager.GLOBAL_SUFFIX)).isTrue();
            assertThat(global.isPending(BehaviorForest.EVENT_STOPPED + ForestManager.GLOBAL_SUFFIX)).isTrue();
            assertThat(global.getEventInfo(BehaviorForest.EVENT_RESET + ForestManager.GLOBAL_SUFFIX)).get()
                    .extracting(info -> info.source())
                    .isEqualTo("alpha");
        }

        @Test
        void shouldStopForwardingForRemovedForest() {
            EventDispatcher global = manager.getCommunication().getEventDispatcher();
            manager.removeForest("beta");

            beta.reset();

            assertThat(global.isPending(BehaviorForest.EVENT_RESET + ForestManager.GLOBAL_SUFFIX)).isFalse();
        }
    }

    @Nested
    class GlobalCommunicationTest {

        @Test
        void shouldShareDataAndState() {
            // Given
            List<StateChange> changes = new CopyOnWriteArrayList<>();
            manager.watchGlobalState("alert", changes::add);

            // When
            manager.setGlobalData("target", "depot");
            boolean updated = manager.updateGlobalState("alert", "red");

            // Then
            assertThat(manager.getGlobalData("target", null)).isEqualTo("depot");
            assertThat(manager.getGlobalData("missing", "none")).isEqualTo("none");
            assertThat(updated).isTrue();
            assertThat(changes).extracting(StateChange::source).containsExactly("hq");
        }

        @Test
        void shouldPublishGlobally() {
            List<TopicEvent> events = new CopyOnWriteArrayList<>();
            manager.getCommunication().subscribe("news", events::add);

            manager.publishGlobal("news", "hello");

            assertThat(events).extracting(TopicEvent::source).containsExactly("hq");
        }

        @Test
        void shouldPublishGlobalTaskOrFailWhenDisabled() throws CommunicationException {
            String id = manager.publishGlobalTask("Audit", "", Set.of(), 2, Map.of());
            assertThat(id).startsWith("task_");

            manager.getCommunication().setEnabled(false);

            assertThatThrownBy(() -> manager.publishGlobalTask("Audit", "", Set.of(), 2, Map.of()))
                    .isInstanceOf(CommunicationException.class)
                    .hasMessageContaining("disabled");
        }
    }
}
