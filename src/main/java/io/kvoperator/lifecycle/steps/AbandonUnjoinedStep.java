package io.kvoperator.lifecycle.steps;

import io.kvoperator.enums.InstanceState;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.LifecycleStep;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.InstanceRecord;

import static io.kvoperator.config.Constants.REASON_ABANDONED;

/**
 * An instance that never registered with the consensus API holds no leadership or data and
 * can be removed without any guard.
 */
public class AbandonUnjoinedStep implements LifecycleStep {

    @Override
    public String name() {
        return "abandon-unjoined";
    }

    @Override
    public boolean appliesTo(LifecycleContext context) {
        InstanceRecord record = context.getRecord();
        return (record.getState() == InstanceState.PENDING || record.getState() == InstanceState.JOINING)
                && record.isMarkedForRemoval()
                && !context.isRegistered();
    }

    @Override
    public StepResult apply(LifecycleContext context) {
        InstanceRecord next = context.getRecord().toBuilder()
                .state(InstanceState.REMOVABLE)
                .transitionStartedAt(context.getNow())
                .build();
        return StepResult.advance(next, REASON_ABANDONED, "Instance removed before joining");
    }
}
