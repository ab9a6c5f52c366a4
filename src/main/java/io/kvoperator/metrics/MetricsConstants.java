package io.kvoperator.metrics;

/**
 * Constants for metrics names and tags used by the operator.
 */
public class MetricsConstants {
    public final static String RECONCILE_PASSES_METRIC_NAME = "reconcile_passes_total";
    public final static String RECONCILE_FAILURES_METRIC_NAME = "reconcile_failures_total";
    public final static String RECONCILE_CONFLICTS_METRIC_NAME = "reconcile_conflicts_total";
    public final static String RECONCILE_DURATION_METRIC_NAME = "reconcile_duration";
    public final static String LIFECYCLE_TRANSITIONS_METRIC_NAME = "lifecycle_transitions_total";
    public final static String UPGRADE_PROGRESS_PERCENTAGE_METRIC_NAME = "rolling_upgrade_progress_percentage";
    public final static String READY_REPLICAS_METRIC_NAME = "group_ready_replicas";
    public final static String CLUSTER_ID_TAG = "clusterId";
    public final static String GROUP_TAG = "group";
    public final static String ROLE_TAG = "role";
    public final static String STEP_TAG = "step";

    private MetricsConstants() {}
}
