package io.kvoperator.lifecycle.steps;

import io.kvoperator.enums.InstanceState;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.LifecycleStep;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.InstanceObservation;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.runtime.WorkloadRuntimeException;

import static io.kvoperator.config.Constants.*;

public class AwaitJoinStep implements LifecycleStep {

    @Override
    public String name() {
        return "await-join";
    }

    @Override
    public boolean appliesTo(LifecycleContext context) {
        return context.getRecord().getState() == InstanceState.JOINING;
    }

    @Override
    public StepResult apply(LifecycleContext context) throws WorkloadRuntimeException {
        InstanceRecord record = context.getRecord();
        InstanceObservation observation = context.getObservation();

        if (!observation.isExists()) {
            context.getRuntime().ensureInstanceRunning(context.getClusterId(), context.getGroup(), record.getIndex(),
                    context.getTemplate(), context.getUpdateRevision());
            InstanceRecord next = record.toBuilder()
                    .revision(context.getUpdateRevision())
                    .baseRevision(context.getUpdateBaseRevision())
                    .build();
            return StepResult.waitFor(next, REASON_NOT_READY, "Workload missing, requested again");
        }
        if (context.isCrashLooping()) {
            return StepResult.fail(record, REASON_CRASH_LOOPING,
                    "Instance restarted " + observation.getRestartCount() + " times while joining");
        }
        if (!observation.isReady()) {
            return StepResult.waitFor(record, REASON_NOT_READY, "Waiting for instance to become ready");
        }
        if (!context.isRegistered()) {
            return StepResult.waitFor(record, REASON_NOT_REGISTERED, "Waiting for instance to register with the coordinator");
        }

        InstanceRecord next = record.toBuilder()
                .state(InstanceState.ACTIVE)
                .transitionStartedAt(null)
                .build();
        return StepResult.advance(next, REASON_JOINED, "Instance joined as member " + context.member().get().getId());
    }
}
