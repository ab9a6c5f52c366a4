package io.kvoperator.lifecycle.steps;

import io.kvoperator.consensus.ConsensusClient;
import io.kvoperator.enums.InstanceState;
import io.kvoperator.enums.StepOutcome;
import io.kvoperator.enums.StoreState;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.ConsensusMember;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.quorum.QuorumCoordinator;
import io.kvoperator.runtime.WorkloadRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static io.kvoperator.config.Constants.*;
import static io.kvoperator.lifecycle.steps.StepFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RemoveInstanceStepTest {

    @Mock
    private ConsensusClient consensusClient;

    @Mock
    private WorkloadRuntime runtime;

    private QuorumCoordinator quorum;
    private final RemoveInstanceStep step = new RemoveInstanceStep();

    @BeforeEach
    void setUp() {
        quorum = new QuorumCoordinator(consensusClient);
    }

    @Test
    void testCoordinatorLeavesMembershipBeforeWorkloadIsDeleted() throws Exception {
        // Given
        InstanceRecord pd0 = coordinator(0, InstanceState.ACTIVE);
        InstanceRecord pd1 = coordinator(1, InstanceState.ACTIVE);
        InstanceRecord pd2 = coordinator(2, InstanceState.REMOVABLE).toBuilder().markedForRemoval(true).build();
        List<ConsensusMember> members = List.of(member(pd0, true, true), member(pd1, true, false), member(pd2, true, false));

        // When
        StepResult result = step.apply(context(pd2, List.of(pd0, pd1, pd2), members, runtime, quorum).build());

        // Then
        InOrder order = inOrder(consensusClient, runtime);
        order.verify(consensusClient).removeMember("pd-pd-2");
        order.verify(runtime).deleteInstance(CLUSTER, "pd", 2);
        assertThat(result.getOutcome()).isEqualTo(StepOutcome.ADVANCE);
        assertThat(result.getReason()).isEqualTo(REASON_REMOVED);
        assertThat(result.getRecord().getState()).isEqualTo(InstanceState.REMOVED);
    }

    @Test
    void testCoordinatorRemovalRecheckedAgainstQuorum() throws Exception {
        // Given membership degraded after the instance became removable
        InstanceRecord pd0 = coordinator(0, InstanceState.ACTIVE);
        InstanceRecord pd1 = coordinator(1, InstanceState.REMOVABLE).toBuilder().markedForRemoval(true).build();
        List<ConsensusMember> members = List.of(member(pd0, false, false), member(pd1, true, true));

        // When
        StepResult result = step.apply(context(pd1, List.of(pd0, pd1), members, runtime, quorum).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(StepOutcome.WAIT);
        assertThat(result.getReason()).isEqualTo(REASON_QUORUM_AT_RISK);
        verifyNoInteractions(consensusClient, runtime);
    }

    @Test
    void testTombstonedStoreOnlyDeletesWorkload() throws Exception {
        InstanceRecord store = store(2, InstanceState.REMOVABLE).toBuilder().markedForRemoval(true).build();

        StepResult result = step.apply(context(store, List.of(store),
                List.of(storeMember(store, 0, StoreState.REMOVED)), runtime, quorum).build());

        verify(runtime).deleteInstance(CLUSTER, "tikv", 2);
        verifyNoInteractions(consensusClient);
        assertThat(result.getRecord().getState()).isEqualTo(InstanceState.REMOVED);
    }
}
