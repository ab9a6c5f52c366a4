package io.kvoperator.lifecycle.steps;

import io.kvoperator.consensus.ConsensusClient;
import io.kvoperator.enums.InstanceState;
import io.kvoperator.enums.StepOutcome;
import io.kvoperator.enums.StoreState;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.ConsensusMember;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.quorum.QuorumCoordinator;
import io.kvoperator.runtime.WorkloadRuntime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static io.kvoperator.config.Constants.*;
import static io.kvoperator.lifecycle.steps.StepFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CompleteOfflineStepTest {

    @Mock
    private ConsensusClient consensusClient;

    @Mock
    private WorkloadRuntime runtime;

    private QuorumCoordinator quorum;
    private final CompleteOfflineStep step = new CompleteOfflineStep();

    private InstanceRecord pd0;
    private InstanceRecord pd1;
    private InstanceRecord pd2;

    @BeforeEach
    void setUp() {
        quorum = new QuorumCoordinator(consensusClient);
        pd0 = coordinator(0, InstanceState.ACTIVE);
        pd1 = coordinator(1, InstanceState.ACTIVE);
        pd2 = offlining(coordinator(2, InstanceState.OFFLINING));
    }

    @Test
    void testAppliesOnlyToMarkedOfflining() {
        assertThat(step.appliesTo(context(pd2, List.of()).build())).isTrue();
        assertThat(step.appliesTo(context(pd2.toBuilder().markedForRemoval(false).build(), List.of()).build())).isFalse();
        assertThat(step.appliesTo(context(pd0, List.of()).build())).isFalse();
        assertThat(step.isDisruptive()).isTrue();
    }

    @Test
    void testLeaderWithoutTransferTargetWaits() throws Exception {
        // Given every peer is unhealthy
        List<ConsensusMember> members = List.of(member(pd0, false, false), member(pd1, false, false), member(pd2, true, true));

        // When
        StepResult result = step.apply(context(pd2, members).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(StepOutcome.WAIT);
        assertThat(result.getReason()).isEqualTo(REASON_NO_TRANSFER_TARGET);
        assertThat(result.getRecord().getState()).isEqualTo(InstanceState.OFFLINING);
        verify(consensusClient, never()).transferLeader(anyString());
    }

    @Test
    void testLeaderRequestsTransferToLowestHealthyPeer() throws Exception {
        // Given
        List<ConsensusMember> members = List.of(member(pd0, true, false), member(pd1, true, false), member(pd2, true, true));

        // When
        StepResult result = step.apply(context(pd2, members).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(StepOutcome.WAIT);
        assertThat(result.getReason()).isEqualTo(REASON_LEADER_TRANSFER_PENDING);
        verify(consensusClient).transferLeader("pd-pd-0");
    }

    @Test
    void testLeaderProceedsAfterTransferTimeout() throws Exception {
        // Given the transfer was requested longer ago than the leader transfer timeout
        InstanceRecord stuck = pd2.toBuilder().transitionStartedAt(NOW.minusSeconds(31)).build();
        List<ConsensusMember> members = List.of(member(pd0, true, false), member(pd1, true, false), member(stuck, true, true));

        // When
        StepResult result = step.apply(context(stuck, members).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(StepOutcome.ADVANCE);
        assertThat(result.getRecord().getState()).isEqualTo(InstanceState.REMOVABLE);
    }

    @Test
    void testFollowerBecomesRemovable() throws Exception {
        // Given
        List<ConsensusMember> members = List.of(member(pd0, true, true), member(pd1, true, false), member(pd2, true, false));

        // When
        StepResult result = step.apply(context(pd2, members).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(StepOutcome.ADVANCE);
        assertThat(result.getRecord().getState()).isEqualTo(InstanceState.REMOVABLE);
        verifyNoInteractions(consensusClient);
    }

    @Test
    void testFollowerWaitsWhenQuorumAtRisk() throws Exception {
        // Given only the target itself is healthy
        List<ConsensusMember> members = List.of(member(pd0, false, true), member(pd1, false, false), member(pd2, true, false));

        // When
        StepResult result = step.apply(context(pd2, members).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(StepOutcome.WAIT);
        assertThat(result.getReason()).isEqualTo(REASON_QUORUM_AT_RISK);
    }

    @Test
    void testTombstonedStoreBecomesRemovable() throws Exception {
        // Given
        InstanceRecord store = offlining(store(2, InstanceState.OFFLINING)).toBuilder().dataMigrating(true).build();

        // When
        StepResult result = step.apply(context(store, List.of(storeMember(store, 0, StoreState.REMOVED))).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(StepOutcome.ADVANCE);
        assertThat(result.getReason()).isEqualTo(REASON_STORE_TOMBSTONED);
        assertThat(result.getRecord().getState()).isEqualTo(InstanceState.REMOVABLE);
        assertThat(result.getRecord().isDataMigrating()).isFalse();
    }

    @Test
    void testStoreMissingFromMembershipBecomesRemovable() throws Exception {
        InstanceRecord store = offlining(store(2, InstanceState.OFFLINING));

        StepResult result = step.apply(context(store, List.of()).build());

        assertThat(result.getRecord().getState()).isEqualTo(InstanceState.REMOVABLE);
    }

    @Test
    void testStoreHoldingLeadersWaitsForEviction() throws Exception {
        // Given
        InstanceRecord store = offlining(store(2, InstanceState.OFFLINING));

        // When
        StepResult result = step.apply(context(store, List.of(storeMember(store, 12, StoreState.REMOVING))).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(StepOutcome.WAIT);
        assertThat(result.getReason()).isEqualTo(REASON_EVICTING);
        assertThat(result.getMessage()).contains("12 region leaders");
        verifyNoInteractions(consensusClient);
    }

    @Test
    void testDrainedStoreReissuesLostOffline() throws Exception {
        // Given the store drained but still serves, the offline request was lost
        InstanceRecord store = offlining(store(2, InstanceState.OFFLINING));

        // When
        StepResult result = step.apply(context(store, List.of(storeMember(store, 0, StoreState.SERVING))).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(StepOutcome.WAIT);
        assertThat(result.getReason()).isEqualTo(REASON_STORE_OFFLINING);
        verify(consensusClient).removeStore("3");
    }

    @Test
    void testEvictionTimeoutKeepsWaitingForMigration() throws Exception {
        // Given eviction timed out but data is still migrating
        InstanceRecord store = offlining(store(2, InstanceState.OFFLINING)).toBuilder()
                .transitionStartedAt(NOW.minusSeconds(600))
                .build();

        // When
        StepResult result = step.apply(context(store, List.of(storeMember(store, 3, StoreState.REMOVING))).build());

        // Then
        assertThat(result.getOutcome()).isEqualTo(StepOutcome.WAIT);
        assertThat(result.getReason()).isEqualTo(REASON_STORE_OFFLINING);
        verify(consensusClient, never()).removeStore(anyString());
    }

    private static InstanceRecord offlining(InstanceRecord record) {
        return record.toBuilder()
                .markedForRemoval(true)
                .transitionStartedAt(NOW.minusSeconds(5))
                .build();
    }

    private LifecycleContext.LifecycleContextBuilder context(InstanceRecord record, List<ConsensusMember> members) {
        return StepFixtures.context(record, List.of(pd0, pd1, record), members, runtime, quorum);
    }
}
