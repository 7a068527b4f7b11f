package com.chainflow.chainflow_backend.model.context;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionContextTest {

    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        context = ExecutionContext.create("flow-1", "exec-1");
    }

    @Nested
    class NodeStates {

        @Test
        void shouldReadUntouchedNodeAsIdle() {
            assertThat(context.getNodeState("n1").getStatus()).isEqualTo(NodeStatus.IDLE);
            assertThat(context.getOutput("n1")).isEmpty();
        }

        @Test
        void shouldAppendOutputsUnlessReplacing() {
            context.markRunning("n1", "merger");
            context.markSuccess("n1", List.of("a"));
            context.markSuccess("n1", List.of("b"));
            assertThat(context.getOutput("n1")).containsExactly("a", "b");

            context.markSuccess("n1", List.of("c"), true);
            assertThat(context.getOutput("n1")).containsExactly("c");
        }

        @Test
        void shouldRecordErrorMessage() {
            context.markRunning("n1", "api");
            context.markError("n1", "boom");

            NodeState state = context.getNodeState("n1");
            assertThat(state.getStatus()).isEqualTo(NodeStatus.ERROR);
            assertThat(state.getErrorMessage()).isEqualTo("boom");
            assertThat(context.hasErrors()).isTrue();
        }

        @Test
        void shouldClearRunningFlagsOnTeardown() {
            context.markRunning("n1", "llm");

            context.teardown();

            assertThat(context.getNodeState("n1").getStatus()).isEqualTo(NodeStatus.IDLE);
            assertThat(context.isClosed()).isTrue();
        }
    }

    @Nested
    class Accumulators {

        @Test
        void shouldAccumulateWithinOneExecution() {
            context.accumulate("m", "exec-1", List.of("a"));

            List<Object> acc = context.accumulate("m", "exec-1", List.of("b"));

            assertThat(acc).containsExactly("a", "b");
        }

        @Test
        void shouldDiscardValuesFromAnotherExecution() {
            // Given values accumulated under E1
            context.accumulate("m", "E1", List.of("a", "b"));

            // When the first call under E2 arrives
            List<Object> acc = context.accumulate("m", "E2", List.of("c"));

            // Then nothing of E1 is retained
            assertThat(acc).containsExactly("c");
        }

        @Test
        void shouldTreatAccumulatorsAsStaleAfterRestart() {
            context.accumulate("m", context.getExecutionId(), List.of("old"));

            String newId = context.restart();

            assertThat(newId).isNotEqualTo("exec-1");
            assertThat(context.getAccumulated("m", newId)).isEmpty();
        }
    }

    @Test
    void shouldCopyInputsDefensively() {
        List<Object> inputs = new java.util.ArrayList<>(List.of("x"));
        context.setInputs(inputs);
        inputs.add("y");

        assertThat(context.getInputs()).containsExactly("x");
    }
}
