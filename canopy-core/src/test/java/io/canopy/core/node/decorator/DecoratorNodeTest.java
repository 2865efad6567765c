package io.canopy.core.node.decorator;

import static org.assertj.core.api.Assertions.assertThat;

import io.canopy.core.node.ScriptedNode;
import io.canopy.core.node.Status;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DecoratorNodeTest {

    @Test
    void shouldFailWithoutChild() {
        assertThat(new Inverter("empty").tick()).isEqualTo(Status.FAILURE);
        assertThat(new UntilSuccess("empty").tick()).isEqualTo(Status.FAILURE);
        assertThat(new UntilFailure("empty").getDecorated()).isNull();
    }

    @Nested
    class InverterTest {

        @ParameterizedTest
        @CsvSource({"SUCCESS, FAILURE", "FAILURE, SUCCESS", "RUNNING, RUNNING"})
        void shouldInvertChildStatus(Status child, Status expected) {
            Inverter inverter = new Inverter("not", new ScriptedNode("child", child));

            assertThat(inverter.tick()).isEqualTo(expected);
        }
    }

    @Nested
    class UntilSuccessTest {

        @Test
        void shouldRetryFailuresUntilSuccess() {
            // Given
            ScriptedNode child = new ScriptedNode("child", Status.FAILURE, Status.FAILURE, Status.SUCCESS);
            UntilSuccess until = new UntilSuccess("retry", child);

            // When / Then
            assertThat(until.tick()).isEqualTo(Status.RUNNING);
            assertThat(until.tick()).isEqualTo(Status.RUNNING);
            assertThat(until.tick()).isEqualTo(Status.SUCCESS);
            assertThat(child.getResets()).isEqualTo(2);
        }
    }

    @Nested
    class UntilFailureTest {

        @Test
        void shouldRepeatSuccessesUntilFailure() {
            // Given
            ScriptedNode child = new ScriptedNode("child", Status.SUCCESS, Status.RUNNING, Status.FAILURE);
            UntilFailure until = new UntilFailure("loop", child);

            // When / Then
            assertThat(until.tick()).isEqualTo(Status.RUNNING);
            assertThat(until.tick()).isEqualTo(Status.RUNNING);
            assertThat(until.tick()).isEqualTo(Status.SUCCESS);
            assertThat(child.getResets()).isEqualTo(1);
        }
    }
}
