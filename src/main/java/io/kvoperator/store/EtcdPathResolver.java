package io.kvoperator.store;

import org.springframework.stereotype.Component;

import java.nio.file.Paths;

import static io.kvoperator.config.Constants.*;

/**
 * Centralized etcd path resolver for all operator keys.
 * All methods accept the cluster id so one operator can manage several clusters.
 * Stateless singleton.
 */
@Component
public class EtcdPathResolver {

    private static final EtcdPathResolver INSTANCE = new EtcdPathResolver();

    private EtcdPathResolver() {
        // Private constructor for singleton
    }

    public static EtcdPathResolver getInstance() {
        return INSTANCE;
    }

    // =================================================================
    // CONTROLLER TASKS PATHS
    // =================================================================

    /**
     * Pattern: /<cluster-id>/ctl-tasks
     */
    public String getControllerTasksPrefix(String clusterId) {
        return Paths.get(PATH_DELIMITER, clusterId, PATH_CTL_TASKS).toString();
    }

    /**
     * Pattern: /<cluster-id>/ctl-tasks/<task-name>
     */
    public String getControllerTaskPath(String clusterId, String taskName) {
        return Paths.get(getControllerTasksPrefix(clusterId), taskName).toString();
    }

    // =================================================================
    // CLUSTER PATHS
    // =================================================================

    /**
     * Pattern: /<cluster-id>
     */
    public String getClusterRoot(String clusterId) {
        return Paths.get(PATH_DELIMITER, clusterId).toString();
    }

    /**
     * Pattern: /<cluster-id>/cluster/spec
     */
    public String getClusterSpecPath(String clusterId) {
        return Paths.get(PATH_DELIMITER, clusterId, PATH_CLUSTER, SUFFIX_SPEC).toString();
    }

    /**
     * Pattern: /<cluster-id>/cluster/status
     */
    public String getClusterStatusPath(String clusterId) {
        return Paths.get(PATH_DELIMITER, clusterId, PATH_CLUSTER, SUFFIX_STATUS).toString();
    }

    // =================================================================
    // GROUP PATHS
    // =================================================================

    /**
     * Pattern: /<cluster-id>/groups
     */
    public String getGroupsPrefix(String clusterId) {
        return Paths.get(PATH_DELIMITER, clusterId, PATH_GROUPS).toString();
    }

    /**
     * Pattern: /<cluster-id>/groups/<group>/spec
     */
    public String getGroupSpecPath(String clusterId, String group) {
        return Paths.get(getGroupsPrefix(clusterId), group, SUFFIX_SPEC).toString();
    }

    /**
     * Pattern: /<cluster-id>/groups/<group>/status
     */
    public String getGroupStatusPath(String clusterId, String group) {
        return Paths.get(getGroupsPrefix(clusterId), group, SUFFIX_STATUS).toString();
    }

    // =================================================================
    // INSTANCE PATHS
    // =================================================================

    /**
     * Pattern: /<cluster-id>/groups/<group>/instances
     */
    public String getInstancesPrefix(String clusterId, String group) {
        return Paths.get(getGroupsPrefix(clusterId), group, PATH_INSTANCES).toString();
    }

    /**
     * Pattern: /<cluster-id>/groups/<group>/instances/<index>/record
     */
    public String getInstanceRecordPath(String clusterId, String group, int index) {
        return Paths.get(getInstancesPrefix(clusterId, group), String.valueOf(index), SUFFIX_RECORD).toString();
    }

    /**
     * Pattern: /<cluster-id>/groups/<group>/instances/<index>/goal-state
     */
    public String getInstanceGoalStatePath(String clusterId, String group, int index) {
        return Paths.get(getInstancesPrefix(clusterId, group), String.valueOf(index), SUFFIX_GOAL_STATE).toString();
    }

    /**
     * Pattern: /<cluster-id>/groups/<group>/instances/<index>/actual-state
     */
    public String getInstanceActualStatePath(String clusterId, String group, int index) {
        return Paths.get(getInstancesPrefix(clusterId, group), String.valueOf(index), SUFFIX_ACTUAL_STATE).toString();
    }
}
