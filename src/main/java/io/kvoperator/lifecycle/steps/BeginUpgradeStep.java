package io.kvoperator.lifecycle.steps;

import io.kvoperator.consensus.ConsensusException;
import io.kvoperator.enums.InstanceState;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.LifecycleStep;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.quorum.NoTransferTargetException;
import lombok.extern.slf4j.Slf4j;

import static io.kvoperator.config.Constants.*;

/**
 * Moves the instance selected by the sequencer into UPGRADING and starts draining it.
 */
@Slf4j
public class BeginUpgradeStep implements LifecycleStep {

    @Override
    public String name() {
        return "begin-upgrade";
    }

    @Override
    public boolean appliesTo(LifecycleContext context) {
        InstanceRecord record = context.getRecord();
        return record.getState() == InstanceState.ACTIVE
                && context.isSelectedForUpgrade()
                && !record.isMarkedForRemoval()
                && !context.isUpToDate()
                && !HotReloadStep.isHotReloadCandidate(context);
    }

    @Override
    public boolean isDisruptive() {
        return true;
    }

    @Override
    public StepResult apply(LifecycleContext context) throws ConsensusException {
        InstanceRecord record = context.getRecord();

        // restarting takes the member offline for a while, same arithmetic as removing it
        if (context.isCoordinator() && context.getView().size() > 1
                && !context.getQuorum().safeToRemove(record, context.getView())) {
            return StepResult.waitFor(record, REASON_QUORUM_AT_RISK,
                    "Restarting " + record.getName() + " would leave the coordinators without quorum");
        }

        InstanceRecord.InstanceRecordBuilder next = record.toBuilder()
                .state(InstanceState.UPGRADING)
                .targetRevision(context.getUpdateRevision())
                .restartIssued(false)
                .transitionStartedAt(context.getNow());

        if (context.isCoordinator()) {
            if (!context.isLeader()) {
                return StepResult.advance(next.build(), REASON_UPGRADING, "Upgrading follower");
            }
            try {
                InstanceRecord target = context.getQuorum().transferLeadership(record, context.getPeers(), context.getView());
                return StepResult.advance(next.build(), REASON_LEADER_TRANSFER_PENDING,
                        "Leadership transfer to " + target.getName() + " requested");
            } catch (NoTransferTargetException e) {
                log.warn("[Cluster: {}] {}", context.getClusterId(), e.getMessage());
                return StepResult.advance(next.build(), REASON_NO_TRANSFER_TARGET, e.getMessage());
            }
        }

        if (context.isRegistered() && !record.isEvicting()) {
            context.getQuorum().beginEvict(record);
            next.evicting(true);
        }
        return StepResult.advance(next.build(), REASON_EVICTING, "Evicting region leaders before restart");
    }
}
