package io.kvoperator.metrics;

import io.kvoperator.enums.InstanceRole;

import java.util.HashMap;
import java.util.Map;

import static io.kvoperator.metrics.MetricsConstants.CLUSTER_ID_TAG;
import static io.kvoperator.metrics.MetricsConstants.GROUP_TAG;
import static io.kvoperator.metrics.MetricsConstants.ROLE_TAG;
import static io.kvoperator.metrics.MetricsConstants.STEP_TAG;

/**
 * Utility class for handling metrics.
 */
public class MetricsUtils {

    /**
     * Builds a map of metrics tags including cluster ID, group name and role.
     */
    public static Map<String, String> buildGroupTags(String clusterId, String group, InstanceRole role) {
        Map<String, String> tags = buildGroupTags(clusterId, group);
        tags.put(ROLE_TAG, role != null ? role.name() : "UNKNOWN");
        return tags;
    }

    public static Map<String, String> buildGroupTags(String clusterId, String group) {
        Map<String, String> tags = new HashMap<>();
        tags.put(CLUSTER_ID_TAG, clusterId);
        tags.put(GROUP_TAG, group);
        return tags;
    }

    public static Map<String, String> buildStepTags(String clusterId, String group, String step) {
        Map<String, String> tags = buildGroupTags(clusterId, group);
        tags.put(STEP_TAG, step);
        return tags;
    }
}
