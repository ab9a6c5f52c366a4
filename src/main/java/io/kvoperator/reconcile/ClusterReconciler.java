package io.kvoperator.reconcile;

import io.kvoperator.models.ClusterSpec;
import io.kvoperator.models.ClusterStatus;
import io.kvoperator.models.DesiredSpec;
import io.kvoperator.models.GroupStatus;
import io.kvoperator.models.Versioned;
import io.kvoperator.status.StatusAggregator;
import io.kvoperator.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rolls the stored group statuses of a cluster up into the cluster status.
 */
@Slf4j
public class ClusterReconciler {

    private final MetadataStore metadataStore;
    private final StatusAggregator statusAggregator;
    private final Clock clock;

    public ClusterReconciler(MetadataStore metadataStore, StatusAggregator statusAggregator, Clock clock) {
        this.metadataStore = metadataStore;
        this.statusAggregator = statusAggregator;
        this.clock = clock;
    }

    /**
     * @return the cluster status now stored, empty when the cluster has no spec
     */
    public Optional<ClusterStatus> aggregate(String clusterId) throws Exception {
        Optional<Versioned<ClusterSpec>> spec = metadataStore.getClusterSpec(clusterId);
        if (spec.isEmpty()) {
            log.debug("[Cluster: {}] No cluster spec, skipping status aggregation", clusterId);
            return Optional.empty();
        }

        List<GroupStatus> groups = new ArrayList<>();
        for (Versioned<DesiredSpec> group : metadataStore.getGroupSpecs(clusterId)) {
            String name = group.getValue().getName();
            Optional<Versioned<GroupStatus>> status = metadataStore.getGroupStatus(clusterId, name);
            if (status.isPresent()) {
                groups.add(status.get().getValue());
            } else {
                log.debug("[Cluster: {}] Group {} has not reported status yet", clusterId, name);
            }
        }

        Optional<Versioned<ClusterStatus>> previous = metadataStore.getClusterStatus(clusterId);
        ClusterStatus status = statusAggregator.aggregateCluster(spec.get().getValue(), groups,
                previous.map(Versioned::getValue).orElse(null), clock.instant());

        if (previous.isPresent() && sameStatus(previous.get().getValue(), status)) {
            return Optional.of(previous.get().getValue());
        }
        metadataStore.putClusterStatus(clusterId, status, previous.map(Versioned::getModRevision).orElse(0L));
        log.info("[Cluster: {}] Cluster status updated from {} groups", clusterId, groups.size());
        return Optional.of(status);
    }

    private static boolean sameStatus(ClusterStatus before, ClusterStatus after) {
        return before.getObservedGeneration() == after.getObservedGeneration()
                && Objects.equals(before.getCoordinatorEndpoint(), after.getCoordinatorEndpoint())
                && Objects.equals(before.getComponents(), after.getComponents())
                && Objects.equals(before.getConditions(), after.getConditions());
    }
}
