package io.canopy.core.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.canopy.core.communication.CommunicationMiddleware;
import io.canopy.core.communication.node.CommunicationNodes;
import io.canopy.core.exception.NodeTypeNotFoundException;
import io.canopy.core.node.Node;
import io.canopy.core.node.Policy;
import io.canopy.core.node.ScriptedNode;
import io.canopy.core.node.Status;
import io.canopy.core.node.composite.Parallel;
import io.canopy.core.node.decorator.Repeater;
import io.canopy.core.node.leaf.AlwaysTrue;
import io.canopy.core.node.leaf.CheckBlackboard;
import io.canopy.core.node.leaf.Wait;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DefaultNodeRegistryTest {

    private DefaultNodeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultNodeRegistry();
    }

    @Nested
    class BuiltinTest {

        @Test
        void shouldRegisterAllBuiltinTypes() {
            assertThat(registry.getRegisteredTypes())
                    .containsExactlyInAnyOrder(
                            "Sequence", "Selector", "Parallel",
                            "Inverter", "Repeater", "UntilSuccess", "UntilFailure",
                            "Wait", "Log", "SetBlackboard", "CheckBlackboard",
                            "IsTrue", "IsFalse", "Compare", "AlwaysTrue", "AlwaysFalse");
            assertThat(registry.getTypeInfo("Sequence")).get().extracting(NodeTypeInfo::builtin).isEqualTo(true);
        }

        @Test
        void shouldCreateNodesFromAttributes() throws NodeTypeNotFoundException {
            // When
            Node parallel = registry.create(NodeSpec.builder("Parallel", "par").attribute("policy", "succeed_on_one").build());
            Node repeater = registry.create(NodeSpec.builder("Repeater", "rep").attribute("repeatCount", "3").build());
            Node wait = registry.create(NodeSpec.builder("Wait", "wait").attribute("duration", 0.5).build());

            // Then
            assertThat(parallel).isInstanceOfSatisfying(Parallel.class,
                    p -> assertThat(p.getPolicy()).isEqualTo(Policy.SUCCEED_ON_ONE));
            assertThat(repeater).isInstanceOfSatisfying(Repeater.class,
                    r -> assertThat(r.getRepeatCount()).isEqualTo(3));
            assertThat(wait).isInstanceOfSatisfying(Wait.class,
                    w -> assertThat(w.getDuration()).isEqualTo(Duration.ofMillis(500)));
        }

        @Test
        void shouldRunParallelOnSuppliedExecutor() throws Exception {
            // Given
            AtomicInteger threads = new AtomicInteger();
            ExecutorService pool = Executors.newFixedThreadPool(2, task -> {
                threads.incrementAndGet();
                Thread thread = new Thread(task);
                thread.setDaemon(true);
                return thread;
            });
            try {
                Node parallel = new DefaultNodeRegistry(pool).create(NodeSpec.builder("Parallel", "par").build());
                parallel.addChild(new ScriptedNode("a", Status.SUCCESS));
                parallel.addChild(new ScriptedNode("b", Status.SUCCESS));

                // When
                Status status = parallel.tick();

                // Then
                assertThat(status).isEqualTo(Status.SUCCESS);
                assertThat(threads.get()).isPositive();
                assertThat(new DefaultNodeRegistry().getRegisteredTypes())
                        .isEqualTo(new DefaultNodeRegistry(pool).getRegisteredTypes());
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        void shouldCreateExistenceCheck() throws NodeTypeNotFoundException {
            Node node = registry.create(
                    NodeSpec.builder("CheckBlackboard", "has").attribute("key", "k").attribute("existsOnly", true).build());

            assertThat(node).isInstanceOfSatisfying(CheckBlackboard.class,
                    c -> assertThat(c.isExistsOnly()).isTrue());
        }

        @Test
        void shouldReportMissingAttribute() {
            NodeSpec spec = NodeSpec.builder("Log", "log").build();

            assertThatThrownBy(() -> registry.create(spec))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("requires attribute 'message'");
        }
    }

    @Nested
    class RegistrationTest {

        @Test
        void shouldRegisterCustomType() throws NodeTypeNotFoundException {
            registry.register("Ping", "Always answers", spec -> new AlwaysTrue(spec.name()));

            Node node = registry.create(NodeSpec.builder("Ping", "ping").build());

            assertThat(node.getName()).isEqualTo("ping");
            assertThat(registry.getTypeInfo("Ping")).get().extracting(NodeTypeInfo::builtin).isEqualTo(false);
        }

        @Test
        void shouldRejectInvalidRegistration() {
            assertThatThrownBy(() -> registry.register(" ", spec -> null)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.register("X", null)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldThrowForUnknownType() {
            assertThatThrownBy(() -> registry.getFactoryOrThrow("Teleport"))
                    .isInstanceOf(NodeTypeNotFoundException.class)
                    .hasMessage("No node type registered as: Teleport");
        }

        @Test
        void shouldUnregisterAndClear() {
            assertThat(registry.unregister("Wait")).isTrue();
            assertThat(registry.unregister("Wait")).isFalse();
            assertThat(registry.isRegistered("Wait")).isFalse();

            registry.clear();

            assertThat(registry.getRegisteredTypes()).isEmpty();
        }

        @Test
        void shouldCopyWithoutAffectingSource() {
            // Given
            DefaultNodeRegistry copy = DefaultNodeRegistry.copyOf(registry);

            // When
            CommunicationNodes.register(copy, new CommunicationMiddleware("comm"));

            // Then
            assertThat(copy.getRegisteredTypes())
                    .containsAll(registry.getRegisteredTypes())
                    .contains("CommPublisher", "CommTaskClaimer", "WaitForEvent");
            assertThat(registry.isRegistered("CommPublisher")).isFalse();
            assertThat(copy.getTypeInfo("Sequence")).get().extracting(NodeTypeInfo::builtin).isEqualTo(true);
        }
    }

    @Test
    void shouldParseStringSetAttributes() {
        NodeSpec fromText = NodeSpec.builder("X", "x").attribute("caps", " a, b ,,c ").build();
        NodeSpec fromList = NodeSpec.builder("X", "x").attribute("caps", List.of("a", " b")).build();

        assertThat(fromText.stringSetAttribute("caps")).containsExactly("a", "b", "c");
        assertThat(fromList.stringSetAttribute("caps")).containsExactly("a", "b");
        assertThat(fromText.stringSetAttribute("missing")).isEmpty();
    }
}
