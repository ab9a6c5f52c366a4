package io.kvoperator.runtime;

import io.kvoperator.models.InstanceActualState;
import io.kvoperator.models.InstanceGoalState;
import io.kvoperator.models.InstanceObservation;
import io.kvoperator.models.InstanceTemplate;
import io.kvoperator.store.MetadataStore;
import io.kvoperator.upgrade.RevisionHasher;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Workload runtime backed by the goal-state / actual-state handshake in etcd.
 * The operator publishes a goal state per instance; the node agent running the instance
 * converges to it and reports its actual state next to it.
 */
@Slf4j
public class EtcdWorkloadRuntime implements WorkloadRuntime {

    private final MetadataStore metadataStore;
    private final RevisionHasher revisionHasher;

    public EtcdWorkloadRuntime(MetadataStore metadataStore, RevisionHasher revisionHasher) {
        this.metadataStore = metadataStore;
        this.revisionHasher = revisionHasher;
    }

    @Override
    public void ensureInstanceRunning(String clusterId, String group, int index, InstanceTemplate template, String revision)
            throws WorkloadRuntimeException {
        try {
            String configHash = revisionHasher.configHash(template);
            Optional<InstanceGoalState> current = metadataStore.getInstanceGoalState(clusterId, group, index);
            if (current.isPresent()
                    && Objects.equals(current.get().getRevision(), revision)
                    && Objects.equals(current.get().getConfigHash(), configHash)) {
                log.debug("[Cluster: {}] Goal state of {}/{} already at revision {}", clusterId, group, index, revision);
                return;
            }

            InstanceGoalState goalState = new InstanceGoalState();
            goalState.setGroup(group);
            goalState.setIndex(index);
            goalState.setRevision(revision);
            goalState.setConfigHash(configHash);
            goalState.setTemplate(template);
            goalState.setConfigUpdateStrategy(template.effectiveConfigUpdateStrategy());
            goalState.setLastUpdated(Instant.now());
            metadataStore.setInstanceGoalState(clusterId, group, index, goalState);

            log.info("[Cluster: {}] Published goal state for {}/{} at revision {}", clusterId, group, index, revision);
        } catch (Exception e) {
            throw new WorkloadRuntimeException("Failed to publish goal state for " + group + "/" + index, e);
        }
    }

    @Override
    public void deleteInstance(String clusterId, String group, int index) throws WorkloadRuntimeException {
        try {
            metadataStore.deleteInstanceState(clusterId, group, index);
            log.info("[Cluster: {}] Deleted workload state for {}/{}", clusterId, group, index);
        } catch (Exception e) {
            throw new WorkloadRuntimeException("Failed to delete workload state for " + group + "/" + index, e);
        }
    }

    @Override
    public InstanceObservation observeInstance(String clusterId, String group, int index) throws WorkloadRuntimeException {
        try {
            if (metadataStore.getInstanceGoalState(clusterId, group, index).isEmpty()) {
                return InstanceObservation.absent();
            }

            Optional<InstanceActualState> actual = metadataStore.getInstanceActualState(clusterId, group, index);
            if (actual.isEmpty()) {
                // goal published, agent has not reported yet
                return InstanceObservation.builder().exists(true).build();
            }

            InstanceActualState state = actual.get();
            return InstanceObservation.builder()
                    .exists(true)
                    .running(state.isRunning())
                    .ready(state.isRunning() && state.isReady())
                    .version(state.getVersion())
                    .configHash(state.getConfigHash())
                    .revision(state.getRevision())
                    .address(state.getAddress())
                    .restartCount(state.getRestartCount())
                    .build();
        } catch (Exception e) {
            throw new WorkloadRuntimeException("Failed to observe instance " + group + "/" + index, e);
        }
    }
}
