package io.kvoperator.status;

import io.kvoperator.enums.ConditionStatus;
import io.kvoperator.enums.InstanceRole;
import io.kvoperator.enums.InstanceState;
import io.kvoperator.enums.StepOutcome;
import io.kvoperator.models.ClusterSpec;
import io.kvoperator.models.ClusterStatus;
import io.kvoperator.models.ComponentStatus;
import io.kvoperator.models.Condition;
import io.kvoperator.models.DesiredSpec;
import io.kvoperator.models.GroupStatus;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.models.OrchestrationPolicy;
import io.kvoperator.upgrade.UpgradePlan;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.kvoperator.config.Constants.*;

/**
 * Rolls instance records up into group status, and group statuses up into cluster status.
 * Both are pure functions of their inputs; the previous status only supplies the current
 * revision and condition transition times.
 */
public class StatusAggregator {

    // =================================================================
    // GROUP STATUS
    // =================================================================

    public GroupStatus aggregateGroup(DesiredSpec spec, List<InstanceRecord> records, UpgradePlan plan,
                                      boolean paused, OrchestrationPolicy policy, GroupStatus previous, Instant now) {
        List<InstanceRecord> live = records.stream()
                .filter(r -> r.getState() != InstanceState.REMOVED)
                .collect(Collectors.toList());

        GroupStatus status = new GroupStatus();
        status.setName(spec.getName());
        status.setRole(spec.getRole());
        status.setObservedGeneration(spec.getGeneration());
        status.setReplicas(live.size());
        status.setReadyReplicas((int) live.stream().filter(StatusAggregator::isReady).count());
        status.setUpdatedReplicas(plan.getUpdatedCount());
        status.setUpdateRevision(plan.getUpdateRevision());

        String currentRevision = currentRevision(live, plan, previous);
        status.setCurrentRevision(currentRevision);
        status.setCurrentReplicas((int) live.stream()
                .filter(r -> !r.isMarkedForRemoval())
                .filter(r -> Objects.equals(r.getRevision(), currentRevision))
                .count());

        status.setVersion(runningVersion(live));
        status.setLeader(live.stream().filter(InstanceRecord::isLeader).map(InstanceRecord::getName)
                .sorted().findFirst().orElse(null));

        List<Condition> conditions = new ArrayList<>();
        conditions.add(availableCondition(spec, live, status));
        conditions.add(progressingCondition(spec, live, plan, policy));
        conditions.add(syncedCondition(spec, plan, status));
        conditions.add(suspendedCondition(paused));
        status.setConditions(carryTransitionTimes(conditions, previous != null ? previous.getConditions() : null, now));
        status.setLastUpdated(now);
        return status;
    }

    /**
     * Ready means serving: active, ready, staying, and not failing a step.
     */
    public static boolean isReady(InstanceRecord record) {
        return record.getState() == InstanceState.ACTIVE
                && record.isObservedReady()
                && !record.isMarkedForRemoval()
                && record.getLastOutcome() != StepOutcome.FAIL;
    }

    private String currentRevision(List<InstanceRecord> live, UpgradePlan plan, GroupStatus previous) {
        if (plan.isComplete()) {
            return plan.getUpdateRevision();
        }
        if (previous != null && previous.getCurrentRevision() != null) {
            return previous.getCurrentRevision();
        }
        // first status of a group that is already mid-rollout: the revision most instances run
        return mostCommon(live.stream().map(InstanceRecord::getRevision).filter(Objects::nonNull).collect(Collectors.toList()))
                .orElse(plan.getUpdateRevision());
    }

    private String runningVersion(List<InstanceRecord> live) {
        return mostCommon(live.stream()
                .filter(r -> r.getState() == InstanceState.ACTIVE)
                .map(InstanceRecord::getVersion)
                .filter(Objects::nonNull)
                .collect(Collectors.toList()))
                .orElse(null);
    }

    private Condition availableCondition(DesiredSpec spec, List<InstanceRecord> live, GroupStatus status) {
        long leaders = live.stream().filter(InstanceRecord::isLeader).count();
        if (spec.getRole() == InstanceRole.COORDINATOR && leaders > 1) {
            return condition(COND_AVAILABLE, ConditionStatus.FALSE, REASON_MULTIPLE_LEADERS,
                    leaders + " instances report leadership");
        }

        if (spec.getRole() == InstanceRole.COORDINATOR) {
            long members = live.stream().filter(InstanceRecord::isRegistered).count();
            long healthy = live.stream().filter(r -> r.isRegistered() && r.isObservedReady()).count();
            if (members == 0) {
                return spec.getReplicas() == 0
                        ? condition(COND_AVAILABLE, ConditionStatus.TRUE, REASON_QUORUM_HEALTHY, "No coordinators desired")
                        : condition(COND_AVAILABLE, ConditionStatus.FALSE, REASON_NO_READY_INSTANCES, "No coordinator has joined");
            }
            if (healthy < members / 2 + 1) {
                return condition(COND_AVAILABLE, ConditionStatus.FALSE, REASON_QUORUM_AT_RISK,
                        healthy + " of " + members + " coordinators healthy");
            }
            return condition(COND_AVAILABLE, ConditionStatus.TRUE, REASON_QUORUM_HEALTHY,
                    healthy + " of " + members + " coordinators healthy");
        }

        if (status.getReadyReplicas() > 0 || spec.getReplicas() == 0) {
            return condition(COND_AVAILABLE, ConditionStatus.TRUE, REASON_INSTANCES_READY,
                    status.getReadyReplicas() + " of " + spec.getReplicas() + " instances ready");
        }
        return condition(COND_AVAILABLE, ConditionStatus.FALSE, REASON_NO_READY_INSTANCES, "No instance is ready");
    }

    private Condition progressingCondition(DesiredSpec spec, List<InstanceRecord> live, UpgradePlan plan,
                                           OrchestrationPolicy policy) {
        Optional<InstanceRecord> crashLooping = live.stream()
                .filter(r -> r.getRestartCount() >= policy.getCrashLoopRestartThreshold()
                        || REASON_CRASH_LOOPING.equals(r.getLastReason()) && r.getLastOutcome() == StepOutcome.FAIL)
                .findFirst();
        if (crashLooping.isPresent()) {
            return condition(COND_PROGRESSING, ConditionStatus.FALSE, REASON_CRASH_LOOPING,
                    crashLooping.get().getName() + " restarted " + crashLooping.get().getRestartCount() + " times");
        }
        if (plan.isStalled()) {
            InstanceRecord stalled = byIndex(live).get(plan.getSelectedIndex());
            return condition(COND_PROGRESSING, ConditionStatus.FALSE, REASON_UPGRADE_STALLED,
                    stalledMessage(stalled));
        }

        List<InstanceRecord> removing = live.stream()
                .filter(InstanceRecord::isMarkedForRemoval)
                .sorted(Comparator.comparingInt(InstanceRecord::getIndex).reversed())
                .collect(Collectors.toList());
        if (!removing.isEmpty()) {
            InstanceRecord head = removing.get(0);
            if (head.getGuardWaitCount() >= policy.getStallThresholdPasses()) {
                return condition(COND_PROGRESSING, ConditionStatus.FALSE, REASON_REMOVAL_STALLED, stalledMessage(head));
            }
            return condition(COND_PROGRESSING, ConditionStatus.TRUE, REASON_REMOVING,
                    "Removing " + removing.size() + " instance(s), next " + head.getName());
        }

        long joining = live.stream()
                .filter(r -> r.getState() == InstanceState.PENDING || r.getState() == InstanceState.JOINING)
                .count();
        if (live.size() != spec.getReplicas() || joining > 0) {
            return condition(COND_PROGRESSING, ConditionStatus.TRUE, REASON_SCALING,
                    "Scaling to " + spec.getReplicas() + " replicas, " + joining + " joining");
        }
        if (!plan.isComplete()) {
            return condition(COND_PROGRESSING, ConditionStatus.TRUE, REASON_UPGRADING,
                    plan.getLaggingIndices().size() + " instance(s) to update to revision " + plan.getUpdateRevision());
        }
        return condition(COND_PROGRESSING, ConditionStatus.FALSE, REASON_CONVERGED, "Group matches desired state");
    }

    private Condition syncedCondition(DesiredSpec spec, UpgradePlan plan, GroupStatus status) {
        if (plan.isComplete() && status.getReplicas() == spec.getReplicas()
                && status.getReadyReplicas() == spec.getReplicas()) {
            return condition(COND_SYNCED, ConditionStatus.TRUE, REASON_SYNCED, "All instances up to date");
        }
        return condition(COND_SYNCED, ConditionStatus.FALSE, REASON_NOT_ALL_UP_TO_DATE,
                status.getUpdatedReplicas() + " updated, " + status.getReadyReplicas() + " ready of "
                        + spec.getReplicas() + " desired");
    }

    private static Condition suspendedCondition(boolean paused) {
        return paused
                ? condition(COND_SUSPENDED, ConditionStatus.TRUE, REASON_SUSPENDED, "Reconciliation paused")
                : condition(COND_SUSPENDED, ConditionStatus.FALSE, REASON_UNSUSPENDED, "Reconciliation active");
    }

    private static String stalledMessage(InstanceRecord record) {
        if (record == null) {
            return "Instance stalled";
        }
        return record.getName() + " waiting for " + record.getGuardWaitCount() + " passes: "
                + record.getLastReason() + " " + Optional.ofNullable(record.getLastMessage()).orElse("");
    }

    // =================================================================
    // CLUSTER STATUS
    // =================================================================

    public ClusterStatus aggregateCluster(ClusterSpec spec, List<GroupStatus> groups, ClusterStatus previous, Instant now) {
        ClusterStatus status = new ClusterStatus();
        status.setObservedGeneration(spec.getGeneration());
        status.setCoordinatorEndpoint(spec.getCoordinatorEndpoint());

        List<ComponentStatus> components = new ArrayList<>();
        components.add(component(COMPONENT_COORDINATOR, InstanceRole.COORDINATOR, groups));
        components.add(component(COMPONENT_STORE, InstanceRole.STORE, groups));
        status.setComponents(components);

        List<Condition> conditions = new ArrayList<>();
        if (groups.isEmpty()) {
            conditions.add(condition(COND_AVAILABLE, ConditionStatus.FALSE, REASON_NO_GROUPS, "No groups defined"));
        } else {
            List<String> unavailable = groupsWhere(groups, COND_AVAILABLE, ConditionStatus.FALSE);
            conditions.add(unavailable.isEmpty()
                    ? condition(COND_AVAILABLE, ConditionStatus.TRUE, REASON_GROUPS_AVAILABLE, "All groups available")
                    : condition(COND_AVAILABLE, ConditionStatus.FALSE, REASON_GROUPS_NOT_AVAILABLE,
                            "Unavailable: " + String.join(", ", unavailable)));
        }
        conditions.add(clusterProgressing(groups));

        List<String> unsynced = groupsWhere(groups, COND_SYNCED, ConditionStatus.FALSE);
        conditions.add(unsynced.isEmpty() && !groups.isEmpty()
                ? condition(COND_SYNCED, ConditionStatus.TRUE, REASON_SYNCED, "All groups synced")
                : condition(COND_SYNCED, ConditionStatus.FALSE, REASON_NOT_ALL_UP_TO_DATE,
                        "Not synced: " + String.join(", ", unsynced)));
        conditions.add(suspendedCondition(spec.isPaused()));

        status.setConditions(carryTransitionTimes(conditions, previous != null ? previous.getConditions() : null, now));
        status.setLastUpdated(now);
        return status;
    }

    private Condition clusterProgressing(List<GroupStatus> groups) {
        for (GroupStatus group : groups) {
            Optional<Condition> progressing = group.findCondition(COND_PROGRESSING);
            if (progressing.isPresent() && progressing.get().getStatus() == ConditionStatus.FALSE
                    && !REASON_CONVERGED.equals(progressing.get().getReason())) {
                return condition(COND_PROGRESSING, ConditionStatus.FALSE, progressing.get().getReason(),
                        group.getName() + ": " + progressing.get().getMessage());
            }
        }
        for (GroupStatus group : groups) {
            Optional<Condition> progressing = group.findCondition(COND_PROGRESSING);
            if (progressing.isPresent() && progressing.get().getStatus() == ConditionStatus.TRUE) {
                return condition(COND_PROGRESSING, ConditionStatus.TRUE, progressing.get().getReason(),
                        group.getName() + ": " + progressing.get().getMessage());
            }
        }
        return condition(COND_PROGRESSING, ConditionStatus.FALSE, REASON_CONVERGED, "All groups converged");
    }

    private static ComponentStatus component(String kind, InstanceRole role, List<GroupStatus> groups) {
        int replicas = 0;
        int ready = 0;
        for (GroupStatus group : groups) {
            if (group.getRole() == role) {
                replicas += group.getReplicas();
                ready += group.getReadyReplicas();
            }
        }
        return new ComponentStatus(kind, replicas, ready);
    }

    private static List<String> groupsWhere(List<GroupStatus> groups, String type, ConditionStatus status) {
        return groups.stream()
                .filter(g -> g.findCondition(type).map(c -> c.getStatus() == status).orElse(true))
                .map(GroupStatus::getName)
                .collect(Collectors.toList());
    }

    // =================================================================
    // HELPERS
    // =================================================================

    private static Condition condition(String type, ConditionStatus status, String reason, String message) {
        return new Condition(type, status, reason, message, null);
    }

    /**
     * Keeps the previous transition time for conditions whose status did not change.
     */
    static List<Condition> carryTransitionTimes(List<Condition> conditions, List<Condition> previous, Instant now) {
        Map<String, Condition> before = previous == null ? Map.of() : previous.stream()
                .collect(Collectors.toMap(Condition::getType, Function.identity(), (a, b) -> a));
        for (Condition condition : conditions) {
            Condition old = before.get(condition.getType());
            if (old != null && old.getStatus() == condition.getStatus() && old.getLastTransitionTime() != null) {
                condition.setLastTransitionTime(old.getLastTransitionTime());
            } else {
                condition.setLastTransitionTime(now);
            }
        }
        return conditions;
    }

    private static Map<Integer, InstanceRecord> byIndex(List<InstanceRecord> records) {
        return records.stream().collect(Collectors.toMap(InstanceRecord::getIndex, Function.identity()));
    }

    private static Optional<String> mostCommon(List<String> values) {
        Map<String, Long> counts = values.stream().collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .findFirst();
    }
}
