package io.kvoperator.lifecycle.steps;

import io.kvoperator.consensus.ConsensusException;
import io.kvoperator.enums.InstanceState;
import io.kvoperator.enums.StoreState;
import io.kvoperator.lifecycle.DrainGuard;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.LifecycleStep;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.ConsensusMember;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.quorum.NoTransferTargetException;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

import static io.kvoperator.config.Constants.*;

/**
 * Finishes draining an offlining instance and marks it REMOVABLE.
 * <p>
 * A coordinator leader first hands over leadership. With no healthy peer to take it the
 * instance stays here indefinitely. A store waits for its region leaders to move (bounded by
 * the eviction timeout) and for the coordinator to tombstone it (unbounded, data must not be lost).
 */
@Slf4j
public class CompleteOfflineStep implements LifecycleStep {

    @Override
    public String name() {
        return "complete-offline";
    }

    @Override
    public boolean appliesTo(LifecycleContext context) {
        InstanceRecord record = context.getRecord();
        return record.getState() == InstanceState.OFFLINING && record.isMarkedForRemoval();
    }

    @Override
    public boolean isDisruptive() {
        return true;
    }

    @Override
    public StepResult apply(LifecycleContext context) throws ConsensusException {
        return context.isCoordinator() ? completeCoordinator(context) : completeStore(context);
    }

    private StepResult completeCoordinator(LifecycleContext context) throws ConsensusException {
        InstanceRecord record = context.getRecord();

        if (context.isLeader()) {
            try {
                InstanceRecord target = context.getQuorum().transferLeadership(record, context.getPeers(), context.getView());
                if (DrainGuard.evaluate(context) != DrainGuard.Decision.TIMED_OUT) {
                    return StepResult.waitFor(record, REASON_LEADER_TRANSFER_PENDING,
                            "Waiting for leadership to move to " + target.getName());
                }
            } catch (NoTransferTargetException e) {
                return StepResult.waitFor(record, REASON_NO_TRANSFER_TARGET, e.getMessage());
            }
        }

        if (!context.getQuorum().safeToRemove(record, context.getView())) {
            return StepResult.waitFor(record, REASON_QUORUM_AT_RISK,
                    "Removing " + record.getName() + " would leave the coordinators without quorum");
        }

        InstanceRecord next = record.toBuilder().state(InstanceState.REMOVABLE).build();
        return StepResult.advance(next, REASON_REMOVING, "Coordinator drained");
    }

    private StepResult completeStore(LifecycleContext context) throws ConsensusException {
        InstanceRecord record = context.getRecord();
        Optional<ConsensusMember> member = context.member();

        if (member.isEmpty() || member.get().getStoreState() == StoreState.REMOVED) {
            InstanceRecord next = record.toBuilder()
                    .state(InstanceState.REMOVABLE)
                    .dataMigrating(false)
                    .build();
            return StepResult.advance(next, REASON_STORE_TOMBSTONED, "Store data fully migrated");
        }

        if (DrainGuard.evaluate(context) == DrainGuard.Decision.WAITING) {
            return StepResult.waitFor(record, REASON_EVICTING,
                    "Store still holds " + member.get().getLeaderCount() + " region leaders");
        }

        if (member.get().getStoreState() != StoreState.REMOVING) {
            // offline request did not take, or was canceled out of band
            context.getQuorum().offlineStore(record);
        }
        return StepResult.waitFor(record, REASON_STORE_OFFLINING, "Waiting for store data to migrate");
    }
}
