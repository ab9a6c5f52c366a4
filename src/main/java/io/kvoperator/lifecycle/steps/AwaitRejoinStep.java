package io.kvoperator.lifecycle.steps;

import io.kvoperator.enums.InstanceState;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.LifecycleStep;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.ConsensusMember;
import io.kvoperator.models.InstanceObservation;
import io.kvoperator.models.InstanceRecord;

import java.util.Objects;

import static io.kvoperator.config.Constants.*;

/**
 * Returns a restarted instance to ACTIVE once it runs the new version and configuration and
 * is healthy in consensus again.
 */
public class AwaitRejoinStep implements LifecycleStep {

    @Override
    public String name() {
        return "await-rejoin";
    }

    @Override
    public boolean appliesTo(LifecycleContext context) {
        InstanceRecord record = context.getRecord();
        return record.getState() == InstanceState.UPGRADING && record.isRestartIssued();
    }

    @Override
    public StepResult apply(LifecycleContext context) {
        InstanceRecord record = context.getRecord();
        InstanceObservation observation = context.getObservation();

        if (!Objects.equals(record.getTargetRevision(), context.getUpdateRevision())) {
            // template changed again while this instance was restarting
            InstanceRecord next = record.toBuilder()
                    .restartIssued(false)
                    .targetRevision(context.getUpdateRevision())
                    .build();
            return StepResult.advance(next, REASON_UPGRADING, "Template changed during restart, restarting again");
        }
        if (context.isCrashLooping()) {
            return StepResult.fail(record, REASON_CRASH_LOOPING,
                    "Instance restarted " + observation.getRestartCount() + " times after upgrade");
        }
        if (!observation.isReady()) {
            return StepResult.waitFor(record, REASON_NOT_READY, "Waiting for restarted instance to become ready");
        }
        if (!Objects.equals(observation.getVersion(), context.getTemplate().getVersion())
                || !Objects.equals(observation.getConfigHash(), context.getUpdateConfigHash())) {
            return StepResult.waitFor(record, REASON_NOT_READY,
                    "Instance reports version " + observation.getVersion() + ", expected " + context.getTemplate().getVersion());
        }
        if (!context.member().map(ConsensusMember::isHealthy).orElse(false)) {
            return StepResult.waitFor(record, REASON_NOT_REGISTERED, "Waiting for instance to rejoin consensus");
        }

        InstanceRecord next = record.toBuilder()
                .state(InstanceState.ACTIVE)
                .restartIssued(false)
                .targetRevision(null)
                .transitionStartedAt(null)
                .build();
        return StepResult.advance(next, REASON_REJOINED, "Instance rejoined at revision " + context.getUpdateRevision());
    }
}
