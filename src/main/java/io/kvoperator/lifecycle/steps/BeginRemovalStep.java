package io.kvoperator.lifecycle.steps;

import io.kvoperator.consensus.ConsensusException;
import io.kvoperator.enums.InstanceState;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.LifecycleStep;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.InstanceRecord;

import static io.kvoperator.config.Constants.*;

/**
 * Starts removing an active instance.
 * <ul>
 *   <li>coordinator follower: straight to REMOVABLE once quorum allows it</li>
 *   <li>coordinator leader: OFFLINING, leadership is transferred before removal</li>
 *   <li>store: leaders evicted and the store offlined, data migrates during OFFLINING</li>
 * </ul>
 */
public class BeginRemovalStep implements LifecycleStep {

    @Override
    public String name() {
        return "begin-removal";
    }

    @Override
    public boolean appliesTo(LifecycleContext context) {
        InstanceRecord record = context.getRecord();
        return record.getState() == InstanceState.ACTIVE && record.isMarkedForRemoval();
    }

    @Override
    public boolean isDisruptive() {
        return true;
    }

    @Override
    public StepResult apply(LifecycleContext context) throws ConsensusException {
        return context.isCoordinator() ? beginCoordinatorRemoval(context) : beginStoreRemoval(context);
    }

    private StepResult beginCoordinatorRemoval(LifecycleContext context) {
        InstanceRecord record = context.getRecord();
        if (!context.getQuorum().safeToRemove(record, context.getView())) {
            return StepResult.waitFor(record, REASON_QUORUM_AT_RISK,
                    "Removing " + record.getName() + " would leave the coordinators without quorum");
        }

        if (context.isLeader()) {
            InstanceRecord next = record.toBuilder()
                    .state(InstanceState.OFFLINING)
                    .transitionStartedAt(context.getNow())
                    .build();
            return StepResult.advance(next, REASON_LEADER_TRANSFER_PENDING, "Leader must hand over before removal");
        }

        InstanceRecord next = record.toBuilder()
                .state(InstanceState.REMOVABLE)
                .transitionStartedAt(context.getNow())
                .build();
        return StepResult.advance(next, REASON_REMOVING, "Follower removable without transfer");
    }

    private StepResult beginStoreRemoval(LifecycleContext context) throws ConsensusException {
        InstanceRecord record = context.getRecord();
        if (!context.isRegistered()) {
            InstanceRecord next = record.toBuilder()
                    .state(InstanceState.REMOVABLE)
                    .transitionStartedAt(context.getNow())
                    .build();
            return StepResult.advance(next, REASON_REMOVING, "Store not registered, nothing to migrate");
        }

        InstanceRecord.InstanceRecordBuilder next = record.toBuilder();
        if (!record.isEvicting()) {
            context.getQuorum().beginEvict(record);
            next.evicting(true);
        }
        context.getQuorum().offlineStore(record);

        next.state(InstanceState.OFFLINING)
                .dataMigrating(true)
                .transitionStartedAt(context.getNow());
        return StepResult.advance(next.build(), REASON_STORE_OFFLINING, "Store offline started");
    }
}
