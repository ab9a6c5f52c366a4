package io.kvoperator.tasks;

import io.kvoperator.reconcile.ClusterReconciler;
import io.kvoperator.reconcile.ReconcileDispatcher;
import io.kvoperator.store.MetadataStore;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Services shared by all task executions. The cluster id is passed separately.
 */
@Getter
@AllArgsConstructor
public class TaskContext {

    private final MetadataStore metadataStore;
    private final ReconcileDispatcher reconcileDispatcher;
    private final ClusterReconciler clusterReconciler;
}
