package io.kvoperator.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final long DEFAULT_TASK_INTERVAL_SECONDS = 30L;
    public static final int DEFAULT_RECONCILE_POOL_SIZE = 4;
    public static final long DEFAULT_RECHECK_INTERVAL_SECONDS = 5L;
    public static final long DEFAULT_BACKOFF_BASE_MILLIS = 500L;
    public static final long DEFAULT_BACKOFF_MAX_MILLIS = 60_000L;
    public static final int DEFAULT_MAX_CONFLICT_RETRIES = 3;

    // Default orchestration policy
    // TODO: Tune the eviction default once store drain times are measured on large regions
    public static final long DEFAULT_LEADER_TRANSFER_TIMEOUT_SECONDS = 300L;
    public static final long DEFAULT_EVICTION_TIMEOUT_SECONDS = 600L;
    public static final int DEFAULT_STALL_THRESHOLD_PASSES = 20;
    public static final int DEFAULT_CRASH_LOOP_RESTART_THRESHOLD = 5;
    public static final int DEFAULT_MAX_TRANSITIONS_PER_PASS = 6;

    // Task statuses
    public static final String TASK_STATUS_PENDING = "PENDING";
    public static final String TASK_STATUS_RUNNING = "RUNNING";
    public static final String TASK_STATUS_COMPLETED = "COMPLETED";
    public static final String TASK_STATUS_FAILED = "FAILED";

    // Task schedule types
    public static final String TASK_SCHEDULE_ONCE = "once";
    public static final String TASK_SCHEDULE_REPEAT = "repeat";

    // Task actions
    public static final String TASK_ACTION_RECONCILE_GROUPS = "reconcile_groups";
    public static final String TASK_ACTION_AGGREGATE_CLUSTER_STATUS = "aggregate_cluster_status";

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_CTL_TASKS = "ctl-tasks";
    public static final String PATH_CLUSTER = "cluster";
    public static final String PATH_GROUPS = "groups";
    public static final String PATH_INSTANCES = "instances";

    // etcd path suffixes
    public static final String SUFFIX_SPEC = "spec";
    public static final String SUFFIX_STATUS = "status";
    public static final String SUFFIX_RECORD = "record";
    public static final String SUFFIX_GOAL_STATE = "goal-state";
    public static final String SUFFIX_ACTUAL_STATE = "actual-state";

    // Condition types
    public static final String COND_AVAILABLE = "Available";
    public static final String COND_PROGRESSING = "Progressing";
    public static final String COND_SYNCED = "Synced";
    public static final String COND_SUSPENDED = "Suspended";

    // Condition reasons
    public static final String REASON_QUORUM_HEALTHY = "QuorumHealthy";
    public static final String REASON_QUORUM_AT_RISK = "QuorumAtRisk";
    public static final String REASON_INSTANCES_READY = "InstancesReady";
    public static final String REASON_NO_READY_INSTANCES = "NoReadyInstances";
    public static final String REASON_MULTIPLE_LEADERS = "MultipleLeaders";
    public static final String REASON_SCALING = "Scaling";
    public static final String REASON_UPGRADING = "Upgrading";
    public static final String REASON_REMOVING = "Removing";
    public static final String REASON_UPGRADE_STALLED = "UpgradeStalled";
    public static final String REASON_REMOVAL_STALLED = "RemovalStalled";
    public static final String REASON_CRASH_LOOPING = "InstanceCrashLooping";
    public static final String REASON_CONVERGED = "Converged";
    public static final String REASON_SYNCED = "Synced";
    public static final String REASON_NOT_ALL_UP_TO_DATE = "NotAllInstancesUpToDate";
    public static final String REASON_SUSPENDED = "Suspended";
    public static final String REASON_UNSUSPENDED = "Unsuspended";
    public static final String REASON_GROUPS_NOT_AVAILABLE = "NotAllGroupsAvailable";
    public static final String REASON_GROUPS_AVAILABLE = "AllGroupsAvailable";
    public static final String REASON_NO_GROUPS = "NoGroups";

    // Instance step reasons
    public static final String REASON_INSTANCE_REQUESTED = "InstanceRequested";
    public static final String REASON_NOT_READY = "InstanceNotReady";
    public static final String REASON_NOT_REGISTERED = "NotRegistered";
    public static final String REASON_JOINED = "Joined";
    public static final String REASON_LEADER_TRANSFER_PENDING = "LeaderTransferPending";
    public static final String REASON_NO_TRANSFER_TARGET = "NoHealthyTransferTarget";
    public static final String REASON_EVICTING = "Evicting";
    public static final String REASON_EVICTED = "Evicted";
    public static final String REASON_EVICTION_TIMED_OUT = "EvictionTimedOut";
    public static final String REASON_STORE_OFFLINING = "StoreOfflining";
    public static final String REASON_OFFLINE_CANCELED = "OfflineCanceled";
    public static final String REASON_DISRUPTION_HALTED = "DisruptionHalted";
    public static final String REASON_RESTARTED = "Restarted";
    public static final String REASON_REJOINED = "Rejoined";
    public static final String REASON_CONFIG_RELOADED = "ConfigReloaded";
    public static final String REASON_REMOVED = "Removed";
    public static final String REASON_ABANDONED = "AbandonedBeforeJoin";
    public static final String REASON_STORE_TOMBSTONED = "StoreTombstoned";
    public static final String REASON_EVICTION_RELEASED = "EvictionReleased";

    // Component kinds reported in cluster status
    public static final String COMPONENT_COORDINATOR = "Coordinator";
    public static final String COMPONENT_STORE = "Store";
}
