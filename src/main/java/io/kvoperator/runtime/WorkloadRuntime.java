package io.kvoperator.runtime;

import io.kvoperator.models.InstanceObservation;
import io.kvoperator.models.InstanceTemplate;

/**
 * Narrow interface to whatever actually runs instance processes.
 * All operations are idempotent.
 */
public interface WorkloadRuntime {

    /**
     * Make sure the instance runs {@code template} at {@code revision}. Starts it when absent,
     * restarts or reloads it when the running revision differs.
     */
    void ensureInstanceRunning(String clusterId, String group, int index, InstanceTemplate template, String revision)
            throws WorkloadRuntimeException;

    /**
     * Delete the instance workload. Deleting an absent instance succeeds.
     */
    void deleteInstance(String clusterId, String group, int index) throws WorkloadRuntimeException;

    InstanceObservation observeInstance(String clusterId, String group, int index) throws WorkloadRuntimeException;
}
