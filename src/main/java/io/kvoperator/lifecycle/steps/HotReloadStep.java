package io.kvoperator.lifecycle.steps;

import io.kvoperator.enums.ConfigUpdateStrategy;
import io.kvoperator.enums.InstanceState;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.LifecycleStep;
import io.kvoperator.lifecycle.StepResult;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.runtime.WorkloadRuntimeException;

import static io.kvoperator.config.Constants.REASON_CONFIG_RELOADED;

/**
 * Pushes a configuration-only change to a running instance without restarting it.
 * The instance stays ACTIVE; the step waits until the instance reports the new config hash.
 */
public class HotReloadStep implements LifecycleStep {

    @Override
    public String name() {
        return "hot-reload";
    }

    @Override
    public boolean appliesTo(LifecycleContext context) {
        return isHotReloadCandidate(context);
    }

    static boolean isHotReloadCandidate(LifecycleContext context) {
        InstanceRecord record = context.getRecord();
        return record.getState() == InstanceState.ACTIVE
                && context.isSelectedForUpgrade()
                && !record.isMarkedForRemoval()
                && !context.isUpToDate()
                && context.getTemplate().effectiveConfigUpdateStrategy() == ConfigUpdateStrategy.HOT_RELOAD
                && context.isConfigOnlyChange();
    }

    @Override
    public StepResult apply(LifecycleContext context) throws WorkloadRuntimeException {
        InstanceRecord record = context.getRecord();
        context.getRuntime().ensureInstanceRunning(context.getClusterId(), context.getGroup(), record.getIndex(),
                context.getTemplate(), context.getUpdateRevision());

        InstanceRecord next = record.toBuilder()
                .revision(context.getUpdateRevision())
                .baseRevision(context.getUpdateBaseRevision())
                .build();
        return StepResult.waitFor(next, REASON_CONFIG_RELOADED,
                "Configuration pushed, waiting for config hash " + context.getUpdateConfigHash());
    }
}
