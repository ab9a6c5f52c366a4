package io.kvoperator.lifecycle.steps;

import io.kvoperator.enums.InstanceState;
import io.kvoperator.exceptions.TransientCollaboratorException;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.LifecycleStep;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.InstanceRecord;

import static io.kvoperator.config.Constants.REASON_QUORUM_AT_RISK;
import static io.kvoperator.config.Constants.REASON_REMOVED;

/**
 * Removes a REMOVABLE instance from consensus and deletes its workload.
 */
public class RemoveInstanceStep implements LifecycleStep {

    @Override
    public String name() {
        return "remove-instance";
    }

    @Override
    public boolean appliesTo(LifecycleContext context) {
        return context.getRecord().getState() == InstanceState.REMOVABLE;
    }

    @Override
    public boolean isDisruptive() {
        return true;
    }

    @Override
    public StepResult apply(LifecycleContext context) throws TransientCollaboratorException {
        InstanceRecord record = context.getRecord();

        if (context.isCoordinator()) {
            // membership may have degraded since the instance became removable
            if (!context.getQuorum().safeToRemove(record, context.getView())) {
                return StepResult.waitFor(record, REASON_QUORUM_AT_RISK,
                        "Removing " + record.getName() + " would leave the coordinators without quorum");
            }
            context.getQuorum().removeMember(record, context.getView());
        }
        context.getRuntime().deleteInstance(context.getClusterId(), context.getGroup(), record.getIndex());

        InstanceRecord next = record.toBuilder().state(InstanceState.REMOVED).build();
        return StepResult.advance(next, REASON_REMOVED, "Instance removed");
    }
}
