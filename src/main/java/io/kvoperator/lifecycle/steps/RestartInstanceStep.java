package io.kvoperator.lifecycle.steps;

import io.kvoperator.enums.InstanceState;
import io.kvoperator.exceptions.TransientCollaboratorException;
import io.kvoperator.lifecycle.DrainGuard;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.LifecycleStep;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.quorum.NoTransferTargetException;

import static io.kvoperator.config.Constants.*;

/**
 * Restarts an upgrading instance with the new template once it is drained, or once the drain
 * timeout has passed. A coordinator leader with no peer to take over is never restarted.
 */
public class RestartInstanceStep implements LifecycleStep {

    @Override
    public String name() {
        return "restart-instance";
    }

    @Override
    public boolean appliesTo(LifecycleContext context) {
        InstanceRecord record = context.getRecord();
        return record.getState() == InstanceState.UPGRADING && !record.isRestartIssued();
    }

    @Override
    public boolean isDisruptive() {
        return true;
    }

    @Override
    public StepResult apply(LifecycleContext context) throws TransientCollaboratorException {
        InstanceRecord record = context.getRecord();

        // a single coordinator has nobody to hand leadership to
        boolean soleMember = context.isCoordinator() && context.getView().size() <= 1;
        DrainGuard.Decision drain = soleMember ? DrainGuard.Decision.DRAINED : DrainGuard.evaluate(context);
        if (drain == DrainGuard.Decision.WAITING) {
            if (!context.isCoordinator()) {
                return StepResult.waitFor(record, REASON_EVICTING,
                        "Waiting for region leaders to leave " + record.getName());
            }
            try {
                InstanceRecord target = context.getQuorum().transferLeadership(record, context.getPeers(), context.getView());
                return StepResult.waitFor(record, REASON_LEADER_TRANSFER_PENDING,
                        "Waiting for leadership to move to " + target.getName());
            } catch (NoTransferTargetException e) {
                return StepResult.waitFor(record, REASON_NO_TRANSFER_TARGET, e.getMessage());
            }
        }

        // the timeout only covers a transfer that has not landed yet, never a leader nobody can replace
        if (drain == DrainGuard.Decision.TIMED_OUT && context.isCoordinator()
                && context.getQuorum().transferTarget(record, context.getPeers(), context.getView()).isEmpty()) {
            return StepResult.waitFor(record, REASON_NO_TRANSFER_TARGET,
                    "No healthy active peer to take leadership from " + record.getName() + ", not restarting");
        }

        context.getRuntime().ensureInstanceRunning(context.getClusterId(), context.getGroup(), record.getIndex(),
                context.getTemplate(), context.getUpdateRevision());

        InstanceRecord next = record.toBuilder()
                .restartIssued(true)
                .revision(context.getUpdateRevision())
                .baseRevision(context.getUpdateBaseRevision())
                .targetRevision(context.getUpdateRevision())
                .transitionStartedAt(context.getNow())
                .build();
        return StepResult.advance(next, REASON_RESTARTED, "Restarted at revision " + context.getUpdateRevision());
    }
}
