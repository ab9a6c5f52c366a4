package io.kvoperator.lifecycle.steps;

import io.kvoperator.consensus.ConsensusException;
import io.kvoperator.enums.InstanceState;
import io.kvoperator.enums.StoreState;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.LifecycleStep;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.ConsensusMember;
import io.kvoperator.models.InstanceRecord;

import java.util.Optional;

import static io.kvoperator.config.Constants.REASON_OFFLINE_CANCELED;
import static io.kvoperator.config.Constants.REASON_STORE_TOMBSTONED;

/**
 * Returns an offlining instance to service after a scale-out cleared its removal mark.
 * A store that is already tombstoned cannot come back and is removed after all.
 */
public class CancelRemovalStep implements LifecycleStep {

    @Override
    public String name() {
        return "cancel-removal";
    }

    @Override
    public boolean appliesTo(LifecycleContext context) {
        InstanceRecord record = context.getRecord();
        return record.getState() == InstanceState.OFFLINING && !record.isMarkedForRemoval();
    }

    @Override
    public StepResult apply(LifecycleContext context) throws ConsensusException {
        InstanceRecord record = context.getRecord();
        Optional<ConsensusMember> member = context.member();

        if (!context.isCoordinator()) {
            if (member.isEmpty() || member.get().getStoreState() == StoreState.REMOVED) {
                return StepResult.advance(record.toBuilder().markedForRemoval(true).build(), REASON_STORE_TOMBSTONED,
                        "Store already removed, offline cannot be canceled");
            }
            if (member.get().getStoreState() == StoreState.REMOVING) {
                context.getQuorum().cancelOffline(record);
            }
        }

        InstanceRecord.InstanceRecordBuilder next = record.toBuilder()
                .state(InstanceState.ACTIVE)
                .dataMigrating(false)
                .transitionStartedAt(null);
        if (record.isEvicting()) {
            context.getQuorum().endEvict(record);
            next.evicting(false);
        }
        return StepResult.advance(next.build(), REASON_OFFLINE_CANCELED, "Removal canceled, instance back in service");
    }
}
