package com.chainflow.chainflow_backend.repository;

import com.chainflow.chainflow_backend.model.context.ExecutionStatus;
import com.chainflow.chainflow_backend.model.domain.Flow;
import com.chainflow.chainflow_backend.model.domain.FlowChain;
import com.chainflow.chainflow_backend.model.domain.NodeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryFlowChainRepositoryTest {

    private InMemoryFlowRepository flowRepository;
    private InMemoryFlowChainRepository repository;

    @BeforeEach
    void setUp() {
        flowRepository = new InMemoryFlowRepository();
        repository = new InMemoryFlowChainRepository(flowRepository);
        flowRepository.save(Flow.builder().id("F1").name("one").build());
        repository.save(FlowChain.builder().id("c1").name("chain").flowIds(new ArrayList<>(List.of("F1"))).build());
    }

    @Nested
    class FlowAccess {

        @Test
        void shouldOnlyExposeFlowsBelongingToChain() {
            flowRepository.save(Flow.builder().id("F2").build());

            assertThat(repository.getFlow("c1", "F1")).isPresent();
            assertThat(repository.getFlow("c1", "F2")).isEmpty();
            assertThat(repository.getFlow("unknown", "F1")).isEmpty();
        }

        @Test
        void shouldStoreResultsOnSharedFlow() {
            repository.setFlowResult("c1", "F1", List.of(NodeResult.builder().nodeId("n").result(1).build()));
            repository.setFlowStatus("c1", "F1", ExecutionStatus.SUCCESS);

            Flow flow = flowRepository.findById("F1").orElseThrow();
            assertThat(flow.getResultValue()).isEqualTo(1);
            assertThat(flow.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
            assertThat(flow.getLastRunAt()).isNotNull();
        }
    }

    @Nested
    class ChainState {

        @Test
        void shouldRecordStatusAndError() {
            repository.setChainStatus("c1", ExecutionStatus.ERROR, "Node x failed: y");

            FlowChain chain = repository.findById("c1").orElseThrow();
            assertThat(chain.getStatus()).isEqualTo(ExecutionStatus.ERROR);
            assertThat(chain.getErrorMessage()).isEqualTo("Node x failed: y");
        }

        @Test
        void shouldDeleteChains() {
            assertThat(repository.deleteById("c1")).isTrue();
            assertThat(repository.deleteById("c1")).isFalse();
            assertThat(repository.findAll()).isEmpty();
        }
    }
}
