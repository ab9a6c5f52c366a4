package io.kvoperator.desired;

import io.kvoperator.enums.InstanceRole;
import io.kvoperator.models.ClusterSpec;
import io.kvoperator.models.ClusterStatus;
import io.kvoperator.models.DesiredSpec;
import io.kvoperator.models.GroupStatus;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.models.Versioned;
import io.kvoperator.reconcile.ReconcileDispatcher;
import io.kvoperator.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Validates and stores edits to the desired state of clusters and groups, and triggers a
 * reconciliation of whatever the edit affects.
 * <p>
 * Writes are read-modify-write with compare-and-set; a concurrent edit surfaces as
 * {@link io.kvoperator.store.StaleRevisionException}.
 */
@Slf4j
@Component
public class DesiredStateManager {

    private final MetadataStore metadataStore;
    private final ReconcileDispatcher reconcileDispatcher;

    public DesiredStateManager(MetadataStore metadataStore, ReconcileDispatcher reconcileDispatcher) {
        this.metadataStore = metadataStore;
        this.reconcileDispatcher = reconcileDispatcher;
    }

    // =================================================================
    // CLUSTER
    // =================================================================

    public Optional<ClusterSpec> getClusterSpec(String clusterId) throws Exception {
        return metadataStore.getClusterSpec(clusterId).map(Versioned::getValue);
    }

    public Optional<ClusterStatus> getClusterStatus(String clusterId) throws Exception {
        return metadataStore.getClusterStatus(clusterId).map(Versioned::getValue);
    }

    public ClusterSpec putClusterSpec(String clusterId, ClusterSpec request) throws Exception {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        if (request.getCoordinatorEndpoint() == null || request.getCoordinatorEndpoint().isBlank()) {
            throw new IllegalArgumentException("coordinator_endpoint is required");
        }

        Optional<Versioned<ClusterSpec>> existing = metadataStore.getClusterSpec(clusterId);
        long generation = existing
                .map(e -> sameCluster(e.getValue(), request) ? e.getValue().getGeneration() : e.getValue().getGeneration() + 1)
                .orElse(1L);
        ClusterSpec next = new ClusterSpec(request.isPaused(), request.getCoordinatorEndpoint(), generation);
        metadataStore.putClusterSpec(clusterId, next, existing.map(Versioned::getModRevision).orElse(0L));
        log.info("[Cluster: {}] Stored cluster spec generation {} (paused: {})", clusterId, generation, next.isPaused());

        // pausing and resuming both change what every group pass does
        for (Versioned<DesiredSpec> group : metadataStore.getGroupSpecs(clusterId)) {
            reconcileDispatcher.submit(clusterId, group.getValue().getName());
        }
        return next;
    }

    private static boolean sameCluster(ClusterSpec a, ClusterSpec b) {
        return a.isPaused() == b.isPaused() && Objects.equals(a.getCoordinatorEndpoint(), b.getCoordinatorEndpoint());
    }

    // =================================================================
    // GROUPS
    // =================================================================

    public List<DesiredSpec> listGroups(String clusterId) throws Exception {
        return metadataStore.getGroupSpecs(clusterId).stream()
                .map(Versioned::getValue)
                .collect(Collectors.toList());
    }

    public Optional<DesiredSpec> getGroupSpec(String clusterId, String group) throws Exception {
        return metadataStore.getGroupSpec(clusterId, group).map(Versioned::getValue);
    }

    public Optional<GroupStatus> getGroupStatus(String clusterId, String group) throws Exception {
        return metadataStore.getGroupStatus(clusterId, group).map(Versioned::getValue);
    }

    public List<InstanceRecord> listInstances(String clusterId, String group) throws Exception {
        return metadataStore.getInstances(clusterId, group).stream()
                .map(Versioned::getValue)
                .collect(Collectors.toList());
    }

    /**
     * Creates or replaces the desired spec of {@code group}. The generation is bumped whenever
     * replicas, template or policy change.
     *
     * @throws IllegalArgumentException when the request is invalid
     */
    public DesiredSpec putGroupSpec(String clusterId, String group, DesiredSpec request) throws Exception {
        Optional<Versioned<DesiredSpec>> existing = metadataStore.getGroupSpec(clusterId, group);
        validateGroupSpec(group, request, existing.map(Versioned::getValue).orElse(null));

        long generation = existing
                .map(e -> sameGroup(e.getValue(), request) ? e.getValue().getGeneration() : e.getValue().getGeneration() + 1)
                .orElse(1L);
        DesiredSpec next = request.toBuilder()
                .name(group)
                .generation(generation)
                .build();
        metadataStore.putGroupSpec(clusterId, group, next, existing.map(Versioned::getModRevision).orElse(0L));
        log.info("[Cluster: {}] Stored spec of group {} generation {}: {} x {} {}", clusterId, group, generation,
                next.getReplicas(), next.getRole(), next.getTemplate().getVersion());

        reconcileDispatcher.submit(clusterId, group);
        return next;
    }

    static void validateGroupSpec(String group, DesiredSpec request, DesiredSpec existing) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        if (request.getName() != null && !request.getName().equals(group)) {
            throw new IllegalArgumentException("Group name '" + request.getName() + "' does not match path '" + group + "'");
        }
        if (request.getRole() == null) {
            throw new IllegalArgumentException("role is required");
        }
        if (request.getReplicas() < 0) {
            throw new IllegalArgumentException("replicas must not be negative: " + request.getReplicas());
        }
        if (request.getRole() == InstanceRole.COORDINATOR && request.getReplicas() == 0) {
            throw new IllegalArgumentException("A coordinator group needs at least one replica to keep quorum");
        }
        if (request.getTemplate() == null || request.getTemplate().getVersion() == null
                || request.getTemplate().getVersion().isBlank()) {
            throw new IllegalArgumentException("template.version is required");
        }
        if (existing != null && existing.getRole() != request.getRole()) {
            throw new IllegalArgumentException("role of group '" + group + "' is " + existing.getRole()
                    + " and cannot be changed");
        }
    }

    private static boolean sameGroup(DesiredSpec a, DesiredSpec b) {
        return a.getReplicas() == b.getReplicas()
                && Objects.equals(a.getTemplate(), b.getTemplate())
                && Objects.equals(a.getPolicy(), b.getPolicy());
    }
}
