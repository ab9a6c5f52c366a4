package io.kvoperator.lifecycle;

import io.kvoperator.enums.InstanceRole;
import io.kvoperator.enums.InstanceState;
import io.kvoperator.enums.StepOutcome;
import io.kvoperator.enums.StoreState;
import io.kvoperator.lifecycle.steps.AbandonUnjoinedStep;
import io.kvoperator.lifecycle.steps.AwaitJoinStep;
import io.kvoperator.lifecycle.steps.AwaitRejoinStep;
import io.kvoperator.lifecycle.steps.BeginRemovalStep;
import io.kvoperator.lifecycle.steps.BeginUpgradeStep;
import io.kvoperator.lifecycle.steps.CancelRemovalStep;
import io.kvoperator.lifecycle.steps.CompleteOfflineStep;
import io.kvoperator.lifecycle.steps.HotReloadStep;
import io.kvoperator.lifecycle.steps.ReleaseEvictionStep;
import io.kvoperator.lifecycle.steps.RemoveInstanceStep;
import io.kvoperator.lifecycle.steps.RequestInstanceStep;
import io.kvoperator.lifecycle.steps.RestartInstanceStep;
import io.kvoperator.metrics.MetricsProvider;
import io.kvoperator.metrics.MetricsUtils;
import io.kvoperator.models.ConsensusMember;
import io.kvoperator.models.InstanceObservation;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.quorum.MembershipView;
import io.kvoperator.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.kvoperator.config.Constants.REASON_DISRUPTION_HALTED;
import static io.kvoperator.metrics.MetricsConstants.LIFECYCLE_TRANSITIONS_METRIC_NAME;

/**
 * Drives one instance through its lifecycle.
 * <p>
 * Each pass refreshes the record from observation, then repeatedly applies the first step
 * that applies until a step waits or fails, nothing applies, or the per-pass transition limit
 * is hit. Every change is written with compare-and-set before the next step runs, so a
 * crashed or abandoned pass resumes from the last persisted state.
 */
@Slf4j
public class InstanceLifecycle {

    private final MetadataStore metadataStore;
    private final MetricsProvider metricsProvider;
    private final List<LifecycleStep> steps;

    public InstanceLifecycle(MetadataStore metadataStore, MetricsProvider metricsProvider) {
        this(metadataStore, metricsProvider, defaultSteps());
    }

    InstanceLifecycle(MetadataStore metadataStore, MetricsProvider metricsProvider, List<LifecycleStep> steps) {
        this.metadataStore = metadataStore;
        this.metricsProvider = metricsProvider;
        this.steps = List.copyOf(steps);
    }

    /**
     * The ordered transition table. The first step whose precondition holds is applied.
     */
    public static List<LifecycleStep> defaultSteps() {
        List<LifecycleStep> steps = new ArrayList<>();
        steps.add(new ReleaseEvictionStep());
        steps.add(new RequestInstanceStep());
        steps.add(new AbandonUnjoinedStep());
        steps.add(new AwaitJoinStep());
        steps.add(new CancelRemovalStep());
        steps.add(new BeginRemovalStep());
        steps.add(new HotReloadStep());
        steps.add(new BeginUpgradeStep());
        steps.add(new CompleteOfflineStep());
        steps.add(new RestartInstanceStep());
        steps.add(new AwaitRejoinStep());
        steps.add(new RemoveInstanceStep());
        return steps;
    }

    public List<LifecycleStep> getSteps() {
        return steps;
    }

    /**
     * Runs one pass for the instance in {@code context}.
     *
     * @param modRevision mod revision the record was read at
     */
    public LifecyclePassResult advance(LifecycleContext context, long modRevision) throws Exception {
        String clusterId = context.getClusterId();
        String group = context.getGroup();
        int maxTransitions = context.getPolicy().getMaxTransitionsPerPass();

        InstanceRecord stored = context.getRecord();
        LifecycleContext current = context.toBuilder()
                .record(observe(stored, context.getObservation(), context.getView()))
                .build();
        long revision = modRevision;
        StepOutcome lastOutcome = null;
        int transitions = 0;

        while (true) {
            Optional<LifecycleStep> applicable = firstApplicable(current);
            if (applicable.isEmpty()) {
                break;
            }
            LifecycleStep step = applicable.get();
            InstanceRecord record = current.getRecord();

            if (step.isDisruptive() && current.isHalted()) {
                log.warn("[Cluster: {}] Group {} halted, not running {} for {}", clusterId, group, step.name(), record.getName());
                InstanceRecord next = annotate(record, StepResult.waitFor(record, REASON_DISRUPTION_HALTED,
                        "Disruptive step " + step.name() + " suppressed until membership anomalies clear"));
                revision = persistIfChanged(current, stored, next, revision);
                return new LifecyclePassResult(next, revision, StepOutcome.WAIT, transitions, false, current.getView());
            }

            if (transitions >= maxTransitions) {
                log.debug("[Cluster: {}] {} reached {} transitions this pass, continuing next pass",
                        clusterId, record.getName(), transitions);
                revision = persistIfChanged(current, stored, record, revision);
                return new LifecyclePassResult(record, revision, lastOutcome, transitions, true, current.getView());
            }

            StepResult result = step.apply(current);
            lastOutcome = result.getOutcome();
            InstanceRecord next = annotate(record, result);
            logStep(current, step, result);

            if (result.getOutcome() != StepOutcome.ADVANCE) {
                revision = persistIfChanged(current, stored, next, revision);
                return new LifecyclePassResult(next, revision, lastOutcome, transitions, false, current.getView());
            }

            transitions++;
            metricsProvider.counter(LIFECYCLE_TRANSITIONS_METRIC_NAME,
                    MetricsUtils.buildStepTags(clusterId, group, step.name())).increment();

            if (next.getState() == InstanceState.REMOVED) {
                metadataStore.deleteInstance(clusterId, group, next.getIndex(), revision);
                log.info("[Cluster: {}] Deleted record of {} from group {}", clusterId, next.getName(), group);
                return new LifecyclePassResult(next, 0, lastOutcome, transitions, false, current.getView());
            }

            revision = persist(current, next, revision);
            stored = next;
            current = refresh(current, next);
        }

        revision = persistIfChanged(current, stored, current.getRecord(), revision);
        return new LifecyclePassResult(current.getRecord(), revision, lastOutcome, transitions, false, current.getView());
    }

    private Optional<LifecycleStep> firstApplicable(LifecycleContext context) {
        return steps.stream().filter(s -> s.appliesTo(context)).findFirst();
    }

    /**
     * Re-reads observation and membership after an advance so the next guard sees fresh facts.
     */
    private LifecycleContext refresh(LifecycleContext context, InstanceRecord next) throws Exception {
        InstanceObservation observation = context.getRuntime()
                .observeInstance(context.getClusterId(), context.getGroup(), next.getIndex());
        MembershipView view = context.getQuorum().inspect(context.getRole());
        List<InstanceRecord> peers = new ArrayList<>();
        for (InstanceRecord peer : context.getPeers()) {
            peers.add(peer.getIndex() == next.getIndex() ? next : peer);
        }
        return context.toBuilder()
                .record(observe(next, observation, view))
                .observation(observation)
                .view(view)
                .peers(peers)
                .build();
    }

    /**
     * Copies observed facts onto the record. Orchestration fields are left alone.
     */
    static InstanceRecord observe(InstanceRecord record, InstanceObservation observation, MembershipView view) {
        InstanceRecord.InstanceRecordBuilder next = record.toBuilder()
                .observedReady(observation.isExists() && observation.isReady())
                .restartCount(observation.getRestartCount())
                .version(observation.getVersion())
                .configHash(observation.getConfigHash());
        if (observation.getAddress() != null) {
            next.address(observation.getAddress());
        }

        Optional<ConsensusMember> member = view.find(next.build());
        if (member.isPresent()) {
            ConsensusMember m = member.get();
            next.registered(true)
                    .memberId(m.getId())
                    .leader(m.isLeader())
                    .leaderCount(view.getRole() == InstanceRole.COORDINATOR ? (m.isLeader() ? 1 : 0) : m.getLeaderCount())
                    .dataMigrating(m.getStoreState() == StoreState.REMOVING);
        } else {
            next.registered(false)
                    .leader(false)
                    .leaderCount(0)
                    .dataMigrating(false);
        }
        return next.build();
    }

    private static InstanceRecord annotate(InstanceRecord record, StepResult result) {
        InstanceRecord.InstanceRecordBuilder next = result.getRecord().toBuilder()
                .lastOutcome(result.getOutcome())
                .lastReason(result.getReason())
                .lastMessage(result.getMessage());
        if (result.getOutcome() == StepOutcome.ADVANCE) {
            next.guardWaitCount(0);
        } else {
            next.guardWaitCount(record.getGuardWaitCount() + 1);
        }
        return next.build();
    }

    private long persistIfChanged(LifecycleContext context, InstanceRecord stored, InstanceRecord next, long revision)
            throws Exception {
        if (withoutTimestamp(stored).equals(withoutTimestamp(next))) {
            return revision;
        }
        return persist(context, next, revision);
    }

    private long persist(LifecycleContext context, InstanceRecord next, long revision) throws Exception {
        InstanceRecord stamped = next.toBuilder().lastUpdated(context.getNow()).build();
        return metadataStore.updateInstance(context.getClusterId(), context.getGroup(), stamped, revision);
    }

    private static InstanceRecord withoutTimestamp(InstanceRecord record) {
        return record.toBuilder().lastUpdated(null).build();
    }

    private void logStep(LifecycleContext context, LifecycleStep step, StepResult result) {
        InstanceRecord record = context.getRecord();
        if (result.getOutcome() == StepOutcome.ADVANCE) {
            log.info("[Cluster: {}] {} {} -> {} via {}: {}", context.getClusterId(), record.getName(),
                    record.getState(), result.getRecord().getState(), step.name(), result.getMessage());
        } else {
            log.debug("[Cluster: {}] {} {} at {}: {} ({})", context.getClusterId(), record.getName(),
                    result.getOutcome(), step.name(), result.getReason(), result.getMessage());
        }
    }
}
