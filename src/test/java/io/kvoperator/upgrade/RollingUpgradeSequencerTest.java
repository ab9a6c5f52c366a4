package io.kvoperator.upgrade;

import io.kvoperator.enums.InstanceState;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.models.InstanceTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.kvoperator.config.Constants.REASON_LEADER_TRANSFER_PENDING;
import static org.assertj.core.api.Assertions.*;

class RollingUpgradeSequencerTest {

    private final RevisionHasher hasher = new RevisionHasher();
    private final RollingUpgradeSequencer sequencer = new RollingUpgradeSequencer(hasher);

    private InstanceTemplate oldTemplate;
    private InstanceTemplate newTemplate;

    @BeforeEach
    void setUp() {
        oldTemplate = InstanceTemplate.builder().version("v7.5.0").build();
        newTemplate = InstanceTemplate.builder().version("v7.5.1").build();
    }

    @Test
    void testSelectsHighestLaggingIndex() {
        List<InstanceRecord> records = List.of(current(0), current(1), current(2));

        UpgradePlan plan = sequencer.plan(records, newTemplate, 4);

        assertThat(plan.getSelectedIndex()).isEqualTo(2);
        assertThat(plan.getLaggingIndices()).containsExactly(2, 1, 0);
        assertThat(plan.getUpdatedCount()).isZero();
        assertThat(plan.isInFlight()).isFalse();
        assertThat(plan.isComplete()).isFalse();
        assertThat(plan.getUpdateRevision()).isEqualTo(hasher.revision(newTemplate));
    }

    @Test
    void testInstanceMidUpgradeKeepsTheSlot() {
        InstanceRecord upgrading = current(1).toBuilder().state(InstanceState.UPGRADING).build();
        List<InstanceRecord> records = List.of(current(0), upgrading, updated(2));

        UpgradePlan plan = sequencer.plan(records, newTemplate, 4);

        assertThat(plan.getSelectedIndex()).isEqualTo(1);
        assertThat(plan.isInFlight()).isTrue();
        assertThat(plan.getUpdatedCount()).isEqualTo(1);
    }

    @Test
    void testPushedRevisionAwaitingObservationKeepsTheSlot() {
        // revision written but instance still reports the old version
        InstanceRecord pushed = current(1).toBuilder().revision(hasher.revision(newTemplate)).build();
        List<InstanceRecord> records = List.of(current(0), pushed, updated(2));

        UpgradePlan plan = sequencer.plan(records, newTemplate, 4);

        assertThat(plan.getSelectedIndex()).isEqualTo(1);
        assertThat(plan.isInFlight()).isTrue();
    }

    @Test
    void testNothingSelectedWhileAnInstanceIsOfflining() {
        InstanceRecord offlining = current(3).toBuilder().state(InstanceState.OFFLINING).markedForRemoval(true).build();
        List<InstanceRecord> records = List.of(current(0), current(1), current(2), offlining);

        UpgradePlan plan = sequencer.plan(records, newTemplate, 4);

        assertThat(plan.selected()).isEmpty();
        assertThat(plan.isInFlight()).isTrue();
        assertThat(plan.getLaggingIndices()).containsExactly(2, 1, 0);
    }

    @Test
    void testUpgradingInstanceMarkedForRemovalStillHoldsTheSlot() {
        InstanceRecord leaving = current(2).toBuilder().state(InstanceState.UPGRADING).markedForRemoval(true).build();
        List<InstanceRecord> records = List.of(current(0), current(1), leaving);

        UpgradePlan plan = sequencer.plan(records, newTemplate, 4);

        assertThat(plan.selected()).isEmpty();
        assertThat(plan.isInFlight()).isTrue();
        assertThat(plan.getLaggingIndices()).containsExactly(1, 0);
    }

    @Test
    void testMarkedAndJoiningInstancesAreNotUpgraded() {
        InstanceRecord leaving = current(2).toBuilder().markedForRemoval(true).build();
        InstanceRecord joining = current(1).toBuilder().state(InstanceState.JOINING).build();
        List<InstanceRecord> records = List.of(current(0), joining, leaving);

        UpgradePlan plan = sequencer.plan(records, newTemplate, 4);

        assertThat(plan.getLaggingIndices()).containsExactly(0);
        assertThat(plan.getSelectedIndex()).isZero();
    }

    @Test
    void testCompleteWhenEverythingIsUpdated() {
        List<InstanceRecord> records = List.of(updated(0), updated(1));

        UpgradePlan plan = sequencer.plan(records, newTemplate, 4);

        assertThat(plan.isComplete()).isTrue();
        assertThat(plan.selected()).isEmpty();
        assertThat(plan.getUpdatedCount()).isEqualTo(2);
    }

    @Test
    void testStalledWhenSelectedInstanceWaitedTooLong() {
        InstanceRecord waiting = current(2).toBuilder()
                .state(InstanceState.UPGRADING)
                .guardWaitCount(4)
                .lastReason(REASON_LEADER_TRANSFER_PENDING)
                .build();

        UpgradePlan plan = sequencer.plan(List.of(current(0), current(1), waiting), newTemplate, 4);

        assertThat(plan.isStalled()).isTrue();
        assertThat(plan.isSelected(2)).isTrue();
    }

    private InstanceRecord current(int index) {
        return InstanceRecord.builder()
                .index(index)
                .name("basic-tikv-" + index)
                .state(InstanceState.ACTIVE)
                .revision(hasher.revision(oldTemplate))
                .version(oldTemplate.getVersion())
                .configHash(hasher.configHash(oldTemplate))
                .build();
    }

    private InstanceRecord updated(int index) {
        return current(index).toBuilder()
                .revision(hasher.revision(newTemplate))
                .version(newTemplate.getVersion())
                .configHash(hasher.configHash(newTemplate))
                .build();
    }
}
