package io.kvoperator.lifecycle.steps;

import io.kvoperator.enums.InstanceState;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.LifecycleStep;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.runtime.WorkloadRuntimeException;

import static io.kvoperator.config.Constants.REASON_INSTANCE_REQUESTED;

public class RequestInstanceStep implements LifecycleStep {

    @Override
    public String name() {
        return "request-instance";
    }

    @Override
    public boolean appliesTo(LifecycleContext context) {
        InstanceRecord record = context.getRecord();
        return record.getState() == InstanceState.PENDING && !record.isMarkedForRemoval();
    }

    @Override
    public StepResult apply(LifecycleContext context) throws WorkloadRuntimeException {
        InstanceRecord record = context.getRecord();
        context.getRuntime().ensureInstanceRunning(context.getClusterId(), context.getGroup(), record.getIndex(),
                context.getTemplate(), context.getUpdateRevision());

        InstanceRecord next = record.toBuilder()
                .state(InstanceState.JOINING)
                .revision(context.getUpdateRevision())
                .baseRevision(context.getUpdateBaseRevision())
                .transitionStartedAt(context.getNow())
                .build();
        return StepResult.advance(next, REASON_INSTANCE_REQUESTED,
                "Requested instance at revision " + context.getUpdateRevision());
    }
}
