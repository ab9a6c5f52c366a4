package io.kvoperator.store;

import io.kvoperator.models.ClusterSpec;
import io.kvoperator.models.ClusterStatus;
import io.kvoperator.models.DesiredSpec;
import io.kvoperator.models.GroupStatus;
import io.kvoperator.models.InstanceActualState;
import io.kvoperator.models.InstanceGoalState;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.models.TaskMetadata;
import io.kvoperator.models.Versioned;

import java.util.List;
import java.util.Optional;

/**
 * Abstraction over the desired-state store.
 * <p>
 * Spec, status and record writes are compare-and-set on the mod revision returned with the
 * last read. An expected revision of {@code 0} means the key must not exist yet. A rejected
 * write raises {@link StaleRevisionException}. Successful writes return the new mod revision.
 */
public interface MetadataStore {

    // =================================================================
    // CONTROLLER TASKS OPERATIONS
    // =================================================================

    /**
     * Get all controller tasks sorted by priority
     */
    List<TaskMetadata> getAllTasks(String clusterId) throws Exception;

    Optional<TaskMetadata> getTask(String clusterId, String taskName) throws Exception;

    String createTask(String clusterId, TaskMetadata task) throws Exception;

    void updateTask(String clusterId, TaskMetadata task) throws Exception;

    void deleteTask(String clusterId, String taskName) throws Exception;

    // =================================================================
    // CLUSTER OPERATIONS
    // =================================================================

    Optional<Versioned<ClusterSpec>> getClusterSpec(String clusterId) throws Exception;

    long putClusterSpec(String clusterId, ClusterSpec spec, long expectedModRevision) throws Exception;

    Optional<Versioned<ClusterStatus>> getClusterStatus(String clusterId) throws Exception;

    long putClusterStatus(String clusterId, ClusterStatus status, long expectedModRevision) throws Exception;

    // =================================================================
    // GROUP OPERATIONS
    // =================================================================

    /**
     * Get all group specs of a cluster, sorted by group name
     */
    List<Versioned<DesiredSpec>> getGroupSpecs(String clusterId) throws Exception;

    Optional<Versioned<DesiredSpec>> getGroupSpec(String clusterId, String group) throws Exception;

    long putGroupSpec(String clusterId, String group, DesiredSpec spec, long expectedModRevision) throws Exception;

    Optional<Versioned<GroupStatus>> getGroupStatus(String clusterId, String group) throws Exception;

    long putGroupStatus(String clusterId, String group, GroupStatus status, long expectedModRevision) throws Exception;

    // =================================================================
    // INSTANCE RECORD OPERATIONS
    // =================================================================

    /**
     * Get all instance records of a group, sorted by index
     */
    List<Versioned<InstanceRecord>> getInstances(String clusterId, String group) throws Exception;

    /**
     * Create a record; fails with {@link StaleRevisionException} when the index already exists
     */
    long createInstance(String clusterId, String group, InstanceRecord record) throws Exception;

    long updateInstance(String clusterId, String group, InstanceRecord record, long expectedModRevision) throws Exception;

    void deleteInstance(String clusterId, String group, int index, long expectedModRevision) throws Exception;

    // =================================================================
    // INSTANCE GOAL / ACTUAL STATE OPERATIONS
    // =================================================================

    Optional<InstanceGoalState> getInstanceGoalState(String clusterId, String group, int index) throws Exception;

    void setInstanceGoalState(String clusterId, String group, int index, InstanceGoalState goalState) throws Exception;

    Optional<InstanceActualState> getInstanceActualState(String clusterId, String group, int index) throws Exception;

    /**
     * Remove goal state and actual state of an instance. Deleting absent keys is a no-op.
     */
    void deleteInstanceState(String clusterId, String group, int index) throws Exception;

    // =================================================================
    // LIFECYCLE
    // =================================================================

    void initialize() throws Exception;

    void close() throws Exception;
}
