package io.kvoperator.reconcile;

import io.kvoperator.consensus.ConsensusClientFactory;
import io.kvoperator.diff.DiffEngine;
import io.kvoperator.diff.ReplicaAction;
import io.kvoperator.enums.ConditionStatus;
import io.kvoperator.lifecycle.InstanceLifecycle;
import io.kvoperator.lifecycle.LifecycleContext;
import io.kvoperator.lifecycle.LifecyclePassResult;
import io.kvoperator.metrics.MetricsProvider;
import io.kvoperator.metrics.MetricsUtils;
import io.kvoperator.models.ClusterSpec;
import io.kvoperator.models.Condition;
import io.kvoperator.models.DesiredSpec;
import io.kvoperator.models.GroupStatus;
import io.kvoperator.models.InstanceObservation;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.models.OrchestrationPolicy;
import io.kvoperator.models.Versioned;
import io.kvoperator.quorum.MembershipView;
import io.kvoperator.quorum.QuorumCoordinator;
import io.kvoperator.runtime.WorkloadRuntime;
import io.kvoperator.status.StatusAggregator;
import io.kvoperator.store.MetadataStore;
import io.kvoperator.upgrade.RollingUpgradeSequencer;
import io.kvoperator.upgrade.UpgradePlan;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static io.kvoperator.config.Constants.COND_PROGRESSING;
import static io.kvoperator.config.Constants.COND_SYNCED;
import static io.kvoperator.metrics.MetricsConstants.READY_REPLICAS_METRIC_NAME;
import static io.kvoperator.metrics.MetricsConstants.UPGRADE_PROGRESS_PERCENTAGE_METRIC_NAME;

/**
 * Runs one reconciliation pass for one replica group.
 * <p>
 * A pass reads everything fresh, applies the replica diff, drives every instance through its
 * lifecycle and writes the group status. It holds no state between passes; any write may be
 * rejected with {@link io.kvoperator.store.StaleRevisionException}, in which case the caller
 * starts a new pass.
 */
@Slf4j
public class GroupReconciler {

    private final MetadataStore metadataStore;
    private final WorkloadRuntime runtime;
    private final ConsensusClientFactory consensusClientFactory;
    private final DiffEngine diffEngine;
    private final RollingUpgradeSequencer sequencer;
    private final InstanceLifecycle lifecycle;
    private final StatusAggregator statusAggregator;
    private final MetricsProvider metricsProvider;
    private final OrchestrationPolicy defaultPolicy;
    private final Duration recheckInterval;
    private final Clock clock;

    public GroupReconciler(MetadataStore metadataStore,
                           WorkloadRuntime runtime,
                           ConsensusClientFactory consensusClientFactory,
                           DiffEngine diffEngine,
                           RollingUpgradeSequencer sequencer,
                           InstanceLifecycle lifecycle,
                           StatusAggregator statusAggregator,
                           MetricsProvider metricsProvider,
                           OrchestrationPolicy defaultPolicy,
                           Duration recheckInterval,
                           Clock clock) {
        this.metadataStore = metadataStore;
        this.runtime = runtime;
        this.consensusClientFactory = consensusClientFactory;
        this.diffEngine = diffEngine;
        this.sequencer = sequencer;
        this.lifecycle = lifecycle;
        this.statusAggregator = statusAggregator;
        this.metricsProvider = metricsProvider;
        this.defaultPolicy = defaultPolicy;
        this.recheckInterval = recheckInterval;
        this.clock = clock;
    }

    public ReconcileResult reconcile(String clusterId, String group) throws Exception {
        Optional<Versioned<DesiredSpec>> specEntry = metadataStore.getGroupSpec(clusterId, group);
        if (specEntry.isEmpty()) {
            log.debug("[Cluster: {}] Group {} has no desired spec, nothing to do", clusterId, group);
            return ReconcileResult.done();
        }
        DesiredSpec spec = specEntry.get().getValue();
        ClusterSpec clusterSpec = metadataStore.getClusterSpec(clusterId)
                .map(Versioned::getValue)
                .orElseGet(ClusterSpec::new);
        if (clusterSpec.getCoordinatorEndpoint() == null || clusterSpec.getCoordinatorEndpoint().isBlank()) {
            log.warn("[Cluster: {}] No coordinator endpoint configured, skipping group {}", clusterId, group);
            return ReconcileResult.done();
        }

        OrchestrationPolicy policy = defaultPolicy.overriddenBy(spec.getPolicy());
        QuorumCoordinator quorum = new QuorumCoordinator(consensusClientFactory.forEndpoint(clusterSpec.getCoordinatorEndpoint()));
        Instant now = clock.instant();

        List<Versioned<InstanceRecord>> records = metadataStore.getInstances(clusterId, group);

        if (clusterSpec.isPaused()) {
            log.info("[Cluster: {}] Paused, refreshing status of group {} only", clusterId, group);
            writeStatus(clusterId, spec, values(records), true, policy, now);
            return ReconcileResult.done();
        }

        MembershipView view = quorum.inspect(spec.getRole());

        if (applyReplicaActions(clusterId, spec, records, now)) {
            records = metadataStore.getInstances(clusterId, group);
        }

        boolean halted = view.hasAnomalies();
        if (halted) {
            log.warn("[Cluster: {}] Group {} membership anomalies {}, halting disruptive steps",
                    clusterId, group, view.getAnomalies());
        }

        UpgradePlan plan = sequencer.plan(values(records), spec.getTemplate(), policy.getStallThresholdPasses());
        log.debug("[Cluster: {}] Group {} upgrade plan {}", clusterId, group, plan);

        Map<Integer, InstanceRecord> peers = new TreeMap<>();
        records.forEach(r -> peers.put(r.getValue().getIndex(), r.getValue()));

        boolean recheck = false;
        for (Versioned<InstanceRecord> entry : driveOrder(records)) {
            InstanceRecord record = entry.getValue();
            InstanceObservation observation = runtime.observeInstance(clusterId, group, record.getIndex());
            LifecycleContext context = LifecycleContext.builder()
                    .clusterId(clusterId)
                    .spec(spec)
                    .record(record)
                    .peers(new ArrayList<>(peers.values()))
                    .observation(observation)
                    .view(view)
                    .policy(policy)
                    .updateRevision(plan.getUpdateRevision())
                    .updateConfigHash(plan.getUpdateConfigHash())
                    .updateBaseRevision(plan.getUpdateBaseRevision())
                    .selectedForUpgrade(plan.isSelected(record.getIndex()))
                    .halted(halted)
                    .now(now)
                    .runtime(runtime)
                    .quorum(quorum)
                    .build();

            LifecyclePassResult result = lifecycle.advance(context, entry.getModRevision());
            if (result.isRemoved()) {
                peers.remove(record.getIndex());
            } else {
                peers.put(record.getIndex(), result.getRecord());
            }
            view = result.getView();
            recheck |= result.needsRecheck();
        }

        GroupStatus status = writeStatus(clusterId, spec, new ArrayList<>(peers.values()), false, policy, now);
        if (recheck || !isConverged(status)) {
            return ReconcileResult.requeueAfter(recheckInterval);
        }
        return ReconcileResult.done();
    }

    // =================================================================
    // REPLICA ACTIONS
    // =================================================================

    /**
     * @return true when any record was created or changed
     */
    private boolean applyReplicaActions(String clusterId, DesiredSpec spec, List<Versioned<InstanceRecord>> records,
                                        Instant now) throws Exception {
        Map<Integer, Versioned<InstanceRecord>> byIndex = records.stream()
                .collect(Collectors.toMap(r -> r.getValue().getIndex(), r -> r));
        List<ReplicaAction> actions = diffEngine.plan(spec.getReplicas(), values(records));
        if (actions.isEmpty()) {
            return false;
        }
        log.info("[Cluster: {}] Group {} replica actions: {}", clusterId, spec.getName(), actions);

        for (ReplicaAction action : actions) {
            int index = action.getIndex();
            switch (action.getType()) {
                case CREATE -> metadataStore.createInstance(clusterId, spec.getName(),
                        InstanceRecord.pending(spec.getName(), spec.getRole(), index, now));
                case REMOVE -> mark(clusterId, spec, byIndex.get(index), true, now);
                case CANCEL_REMOVAL -> mark(clusterId, spec, byIndex.get(index), false, now);
                default -> throw new IllegalStateException("Unhandled replica action " + action);
            }
        }
        return true;
    }

    private void mark(String clusterId, DesiredSpec spec, Versioned<InstanceRecord> entry, boolean marked, Instant now)
            throws Exception {
        InstanceRecord next = entry.getValue().toBuilder()
                .markedForRemoval(marked)
                .guardWaitCount(0)
                .lastUpdated(now)
                .build();
        metadataStore.updateInstance(clusterId, spec.getName(), next, entry.getModRevision());
    }

    /**
     * Staying instances in ascending index order, then the single highest instance on its way out.
     * Lower marked instances wait until the one above them is gone.
     */
    static List<Versioned<InstanceRecord>> driveOrder(List<Versioned<InstanceRecord>> records) {
        List<Versioned<InstanceRecord>> order = records.stream()
                .filter(r -> !r.getValue().isMarkedForRemoval())
                .sorted(Comparator.comparingInt(r -> r.getValue().getIndex()))
                .collect(Collectors.toCollection(ArrayList::new));
        records.stream()
                .filter(r -> r.getValue().isMarkedForRemoval())
                .max(Comparator.comparingInt(r -> r.getValue().getIndex()))
                .ifPresent(order::add);
        return order;
    }

    // =================================================================
    // STATUS
    // =================================================================

    private GroupStatus writeStatus(String clusterId, DesiredSpec spec, List<InstanceRecord> records, boolean paused,
                                    OrchestrationPolicy policy, Instant now) throws Exception {
        String group = spec.getName();
        Optional<Versioned<GroupStatus>> previous = metadataStore.getGroupStatus(clusterId, group);
        UpgradePlan plan = sequencer.plan(records, spec.getTemplate(), policy.getStallThresholdPasses());
        GroupStatus status = statusAggregator.aggregateGroup(spec, records, plan, paused, policy,
                previous.map(Versioned::getValue).orElse(null), now);

        Map<String, String> tags = MetricsUtils.buildGroupTags(clusterId, group, spec.getRole());
        metricsProvider.gauge(READY_REPLICAS_METRIC_NAME, tags).set(status.getReadyReplicas());
        double progress = spec.getReplicas() == 0 ? 100.0 : 100.0 * status.getUpdatedReplicas() / spec.getReplicas();
        metricsProvider.gauge(UPGRADE_PROGRESS_PERCENTAGE_METRIC_NAME, tags).set(Math.min(100.0, progress));

        if (previous.isPresent() && sameStatus(previous.get().getValue(), status)) {
            return previous.get().getValue();
        }
        metadataStore.putGroupStatus(clusterId, group, status, previous.map(Versioned::getModRevision).orElse(0L));
        log.info("[Cluster: {}] Group {} status: {}/{} ready, revision {} -> {}, conditions {}", clusterId, group,
                status.getReadyReplicas(), spec.getReplicas(), status.getCurrentRevision(), status.getUpdateRevision(),
                summarize(status.getConditions()));
        return status;
    }

    private static boolean sameStatus(GroupStatus a, GroupStatus b) {
        GroupStatus left = copyWithoutTimestamp(a);
        GroupStatus right = copyWithoutTimestamp(b);
        return left.equals(right);
    }

    private static GroupStatus copyWithoutTimestamp(GroupStatus status) {
        GroupStatus copy = new GroupStatus();
        copy.setName(status.getName());
        copy.setRole(status.getRole());
        copy.setObservedGeneration(status.getObservedGeneration());
        copy.setReplicas(status.getReplicas());
        copy.setReadyReplicas(status.getReadyReplicas());
        copy.setCurrentReplicas(status.getCurrentReplicas());
        copy.setUpdatedReplicas(status.getUpdatedReplicas());
        copy.setCurrentRevision(status.getCurrentRevision());
        copy.setUpdateRevision(status.getUpdateRevision());
        copy.setVersion(status.getVersion());
        copy.setLeader(status.getLeader());
        copy.setConditions(status.getConditions());
        return copy;
    }

    static boolean isConverged(GroupStatus status) {
        boolean synced = status.findCondition(COND_SYNCED)
                .map(c -> c.getStatus() == ConditionStatus.TRUE)
                .orElse(false);
        boolean progressing = status.findCondition(COND_PROGRESSING)
                .map(c -> c.getStatus() == ConditionStatus.TRUE)
                .orElse(false);
        return synced && !progressing;
    }

    private static String summarize(List<Condition> conditions) {
        return conditions.stream()
                .map(c -> c.getType() + "=" + c.getStatus().getValue() + "/" + c.getReason())
                .collect(Collectors.joining(", "));
    }

    private static List<InstanceRecord> values(List<Versioned<InstanceRecord>> records) {
        return records.stream().map(Versioned::getValue).collect(Collectors.toList());
    }
}
