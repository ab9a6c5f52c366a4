package io.kvoperator.lifecycle;

import io.kvoperator.enums.InstanceRole;
import io.kvoperator.enums.InstanceState;
import io.kvoperator.enums.StepOutcome;
import io.kvoperator.enums.StoreState;
import io.kvoperator.metrics.MetricsProvider;
import io.kvoperator.models.ConsensusMember;
import io.kvoperator.models.DesiredSpec;
import io.kvoperator.models.InstanceObservation;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.models.InstanceTemplate;
import io.kvoperator.models.OrchestrationPolicy;
import io.kvoperator.quorum.MembershipView;
import io.kvoperator.quorum.QuorumCoordinator;
import io.kvoperator.runtime.WorkloadRuntime;
import io.kvoperator.store.MetadataStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static io.kvoperator.config.Constants.REASON_DISRUPTION_HALTED;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InstanceLifecycleTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private MetadataStore metadataStore;

    @Mock
    private WorkloadRuntime runtime;

    @Mock
    private QuorumCoordinator quorum;

    private MetricsProvider metricsProvider;
    private InstanceRecord record;

    @BeforeEach
    void setUp() {
        metricsProvider = new MetricsProvider(new SimpleMeterRegistry(), "test-operator");
        record = InstanceRecord.builder()
                .index(1)
                .name("basic-tikv-1")
                .role(InstanceRole.STORE)
                .state(InstanceState.ACTIVE)
                .build();
    }

    @Test
    void testDefaultStepOrder() {
        InstanceLifecycle lifecycle = new InstanceLifecycle(metadataStore, metricsProvider);

        assertThat(lifecycle.getSteps()).extracting(LifecycleStep::name).containsExactly(
                "release-eviction", "request-instance", "abandon-unjoined", "await-join", "cancel-removal",
                "begin-removal", "hot-reload", "begin-upgrade", "complete-offline", "restart-instance",
                "await-rejoin", "remove-instance");
    }

    @Test
    void testNothingApplicableWritesNothing() throws Exception {
        // Given
        InstanceLifecycle lifecycle = new InstanceLifecycle(metadataStore, metricsProvider, List.of(idle("idle")));

        // When
        LifecyclePassResult result = lifecycle.advance(context(false), 12);

        // Then
        assertThat(result.getModRevision()).isEqualTo(12);
        assertThat(result.getLastOutcome()).isNull();
        assertThat(result.needsRecheck()).isFalse();
        verifyNoInteractions(metadataStore);
    }

    @Test
    void testAdvancePersistsAndContinuesWithFreshObservation() throws Exception {
        // Given
        LifecycleStep toUpgrading = step("to-upgrading", InstanceState.ACTIVE, InstanceState.UPGRADING, StepOutcome.ADVANCE);
        LifecycleStep waitThere = step("wait", InstanceState.UPGRADING, InstanceState.UPGRADING, StepOutcome.WAIT);
        InstanceLifecycle lifecycle = new InstanceLifecycle(metadataStore, metricsProvider, List.of(toUpgrading, waitThere));
        when(metadataStore.updateInstance(eq("basic"), eq("tikv"), any(InstanceRecord.class), eq(12L))).thenReturn(13L);
        when(metadataStore.updateInstance(eq("basic"), eq("tikv"), any(InstanceRecord.class), eq(13L))).thenReturn(14L);
        when(runtime.observeInstance("basic", "tikv", 1)).thenReturn(readyObservation());
        when(quorum.inspect(InstanceRole.STORE)).thenReturn(storeView());

        // When
        LifecyclePassResult result = lifecycle.advance(context(false), 12);

        // Then
        assertThat(result.getTransitions()).isEqualTo(1);
        assertThat(result.getLastOutcome()).isEqualTo(StepOutcome.WAIT);
        assertThat(result.getModRevision()).isEqualTo(14);
        assertThat(result.getRecord().getState()).isEqualTo(InstanceState.UPGRADING);
        assertThat(result.getRecord().getGuardWaitCount()).isEqualTo(1);
        assertThat(result.getRecord().getLastUpdated()).isNull();
        assertThat(result.needsRecheck()).isTrue();
        verify(runtime).observeInstance("basic", "tikv", 1);
    }

    @Test
    void testHaltedGroupSuppressesDisruptiveSteps() throws Exception {
        // Given
        LifecycleStep disruptive = spy(step("disrupt", InstanceState.ACTIVE, InstanceState.OFFLINING, StepOutcome.ADVANCE));
        when(disruptive.isDisruptive()).thenReturn(true);
        InstanceLifecycle lifecycle = new InstanceLifecycle(metadataStore, metricsProvider, List.of(disruptive));
        ArgumentCaptor<InstanceRecord> written = ArgumentCaptor.forClass(InstanceRecord.class);
        when(metadataStore.updateInstance(eq("basic"), eq("tikv"), written.capture(), eq(12L))).thenReturn(13L);

        // When
        LifecyclePassResult result = lifecycle.advance(context(true), 12);

        // Then
        verify(disruptive, never()).apply(any());
        assertThat(result.getLastOutcome()).isEqualTo(StepOutcome.WAIT);
        assertThat(written.getValue().getState()).isEqualTo(InstanceState.ACTIVE);
        assertThat(written.getValue().getLastReason()).isEqualTo(REASON_DISRUPTION_HALTED);
        assertThat(written.getValue().getLastUpdated()).isEqualTo(NOW);
    }

    @Test
    void testTransitionLimitTruncatesPass() throws Exception {
        // Given
        LifecycleStep loop = new LifecycleStep() {
            @Override
            public String name() {
                return "loop";
            }

            @Override
            public boolean appliesTo(LifecycleContext context) {
                return true;
            }

            @Override
            public StepResult apply(LifecycleContext context) {
                InstanceRecord r = context.getRecord();
                return StepResult.advance(r.toBuilder().restartIssued(!r.isRestartIssued()).build(), "Loop", "again");
            }
        };
        InstanceLifecycle lifecycle = new InstanceLifecycle(metadataStore, metricsProvider, List.of(loop));
        when(metadataStore.updateInstance(eq("basic"), eq("tikv"), any(InstanceRecord.class), anyLong()))
                .thenAnswer(invocation -> invocation.<Long>getArgument(3) + 1);
        when(runtime.observeInstance("basic", "tikv", 1)).thenReturn(readyObservation());
        when(quorum.inspect(InstanceRole.STORE)).thenReturn(storeView());

        // When
        LifecyclePassResult result = lifecycle.advance(context(false), 12);

        // Then
        assertThat(result.getTransitions()).isEqualTo(3);
        assertThat(result.isTruncated()).isTrue();
        assertThat(result.needsRecheck()).isTrue();
        assertThat(result.getModRevision()).isEqualTo(15);
    }

    @Test
    void testRemovedRecordIsDeleted() throws Exception {
        // Given
        LifecycleStep remove = step("remove", InstanceState.ACTIVE, InstanceState.REMOVED, StepOutcome.ADVANCE);
        InstanceLifecycle lifecycle = new InstanceLifecycle(metadataStore, metricsProvider, List.of(remove));

        // When
        LifecyclePassResult result = lifecycle.advance(context(false), 12);

        // Then
        verify(metadataStore).deleteInstance("basic", "tikv", 1, 12);
        verify(metadataStore, never()).updateInstance(anyString(), anyString(), any(), anyLong());
        assertThat(result.isRemoved()).isTrue();
    }

    @Test
    void testObserveCopiesObservedFacts() {
        // Given
        ConsensusMember store = ConsensusMember.builder()
                .id("7").name("basic-tikv-1:20160").address("basic-tikv-1:20160")
                .healthy(true).leaderCount(42).storeState(StoreState.REMOVING).build();
        MembershipView view = new MembershipView(InstanceRole.STORE, List.of(store));

        // When
        InstanceRecord observed = InstanceLifecycle.observe(record, readyObservation(), view);
        InstanceRecord unregistered = InstanceLifecycle.observe(observed, InstanceObservation.absent(),
                MembershipView.empty(InstanceRole.STORE));

        // Then
        assertThat(observed.isRegistered()).isTrue();
        assertThat(observed.getMemberId()).isEqualTo("7");
        assertThat(observed.getLeaderCount()).isEqualTo(42);
        assertThat(observed.isDataMigrating()).isTrue();
        assertThat(observed.isObservedReady()).isTrue();
        assertThat(observed.getVersion()).isEqualTo("v7.5.0");
        assertThat(observed.getState()).isEqualTo(InstanceState.ACTIVE);

        assertThat(unregistered.isRegistered()).isFalse();
        assertThat(unregistered.isObservedReady()).isFalse();
        assertThat(unregistered.getLeaderCount()).isZero();
        // the member id survives so the store can still be found after its address changes
        assertThat(unregistered.getMemberId()).isEqualTo("7");
    }

    private LifecycleContext context(boolean halted) {
        OrchestrationPolicy policy = new OrchestrationPolicy();
        policy.setMaxTransitionsPerPass(3);
        policy.setCrashLoopRestartThreshold(5);
        policy.setLeaderTransferTimeoutSeconds(30L);
        policy.setEvictionTimeoutSeconds(120L);
        return LifecycleContext.builder()
                .clusterId("basic")
                .spec(DesiredSpec.builder()
                        .name("tikv")
                        .role(InstanceRole.STORE)
                        .replicas(3)
                        .template(InstanceTemplate.builder().version("v7.5.0").build())
                        .build())
                .record(record)
                .peers(List.of(record))
                .observation(InstanceObservation.absent())
                .view(MembershipView.empty(InstanceRole.STORE))
                .policy(policy)
                .updateRevision("r1")
                .halted(halted)
                .now(NOW)
                .runtime(runtime)
                .quorum(quorum)
                .build();
    }

    private static InstanceObservation readyObservation() {
        return InstanceObservation.builder()
                .exists(true).running(true).ready(true)
                .version("v7.5.0").address("basic-tikv-1:20160")
                .build();
    }

    private static MembershipView storeView() {
        return MembershipView.empty(InstanceRole.STORE);
    }

    private static LifecycleStep idle(String name) {
        return new FixedStep(name, null, null, StepOutcome.WAIT);
    }

    private static LifecycleStep step(String name, InstanceState from, InstanceState to, StepOutcome outcome) {
        return new FixedStep(name, from, to, outcome);
    }

    /**
     * Moves from one state to another with a fixed outcome.
     */
    static class FixedStep implements LifecycleStep {
        private final String name;
        private final InstanceState from;
        private final InstanceState to;
        private final StepOutcome outcome;

        FixedStep(String name, InstanceState from, InstanceState to, StepOutcome outcome) {
            this.name = name;
            this.from = from;
            this.to = to;
            this.outcome = outcome;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean appliesTo(LifecycleContext context) {
            return from != null && context.getRecord().getState() == from;
        }

        @Override
        public StepResult apply(LifecycleContext context) {
            InstanceRecord next = context.getRecord().toBuilder().state(to).build();
            switch (outcome) {
                case ADVANCE:
                    return StepResult.advance(next, "Moved", name);
                case WAIT:
                    return StepResult.waitFor(next, "Waiting", name);
                default:
                    return StepResult.fail(next, "Failed", name);
            }
        }
    }
}
