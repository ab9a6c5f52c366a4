package io.kvoperator.lifecycle.steps;

import io.kvoperator.consensus.ConsensusClient;
import io.kvoperator.enums.InstanceState;
import io.kvoperator.enums.StoreState;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.quorum.QuorumCoordinator;
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
class ReleaseEvictionStepTest {

    @Mock
    private ConsensusClient consensusClient;

    private QuorumCoordinator quorum;
    private final ReleaseEvictionStep step = new ReleaseEvictionStep();

    @BeforeEach
    void setUp() {
        quorum = new QuorumCoordinator(consensusClient);
    }

    @Test
    void testEvictionIsKeptWhileDraining() {
        InstanceRecord upgrading = store(0, InstanceState.UPGRADING).toBuilder().evicting(true).build();
        InstanceRecord offlining = store(0, InstanceState.OFFLINING).toBuilder().evicting(true).build();

        assertThat(step.appliesTo(context(upgrading, List.of(), List.of(), null, quorum).build())).isFalse();
        assertThat(step.appliesTo(context(offlining, List.of(), List.of(), null, quorum).build())).isFalse();
    }

    @Test
    void testLeftoverEvictionIsReleased() throws Exception {
        // Given an active store still marked as evicting after its upgrade
        InstanceRecord store = store(0, InstanceState.ACTIVE).toBuilder().evicting(true).build();

        // When
        StepResult result = step.apply(context(store, List.of(store),
                List.of(storeMember(store, 0, StoreState.SERVING)), null, quorum).build());

        // Then
        verify(consensusClient).endEvictLeader("1");
        assertThat(result.getReason()).isEqualTo(REASON_EVICTION_RELEASED);
        assertThat(result.getRecord().isEvicting()).isFalse();
    }

    @Test
    void testStoreWithoutIdOnlyClearsFlag() throws Exception {
        InstanceRecord store = store(0, InstanceState.ACTIVE).toBuilder().evicting(true).memberId(null).build();

        StepResult result = step.apply(context(store, List.of(store), List.of(), null, quorum).build());

        assertThat(result.getRecord().isEvicting()).isFalse();
        verifyNoInteractions(consensusClient);
    }
}
