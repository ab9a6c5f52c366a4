package io.kvoperator.lifecycle.steps;

import io.kvoperator.consensus.ConsensusException;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.LifecycleStep;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.InstanceRecord;

import static io.kvoperator.config.Constants.REASON_EVICTION_RELEASED;

/**
 * Ends an outstanding leader eviction once the instance is no longer draining.
 * Runs first so a crash between restart and release never leaves a store evicted for good.
 */
public class ReleaseEvictionStep implements LifecycleStep {

    @Override
    public String name() {
        return "release-eviction";
    }

    @Override
    public boolean appliesTo(LifecycleContext context) {
        InstanceRecord record = context.getRecord();
        return record.isEvicting() && !record.getState().isDraining();
    }

    @Override
    public StepResult apply(LifecycleContext context) throws ConsensusException {
        InstanceRecord record = context.getRecord();
        if (record.getMemberId() != null) {
            context.getQuorum().endEvict(record);
        }
        return StepResult.advance(record.toBuilder().evicting(false).build(),
                REASON_EVICTION_RELEASED, "Leader eviction ended");
    }
}
