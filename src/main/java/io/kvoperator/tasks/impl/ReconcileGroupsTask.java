package io.kvoperator.tasks.impl;

import io.kvoperator.models.DesiredSpec;
import io.kvoperator.models.Versioned;
import io.kvoperator.tasks.Task;
import io.kvoperator.tasks.TaskContext;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

import static io.kvoperator.config.Constants.*;

/**
 * Periodic sweep that submits every group of the cluster to the reconcile dispatcher.
 * Catches groups whose requeue was lost, e.g. after an operator restart.
 */
@Slf4j
@Getter
@AllArgsConstructor
public class ReconcileGroupsTask implements Task {

    private final String name;
    private final int priority;
    private final String input;
    private final String schedule;

    @Override
    public String execute(TaskContext context, String clusterId) {
        log.info("[Cluster: {}] Executing reconcile groups task: {}", clusterId, name);

        try {
            List<Versioned<DesiredSpec>> groups = context.getMetadataStore().getGroupSpecs(clusterId);
            for (Versioned<DesiredSpec> group : groups) {
                context.getReconcileDispatcher().submit(clusterId, group.getValue().getName());
            }
            log.info("[Cluster: {}] Submitted {} groups for reconciliation", clusterId, groups.size());
            return TASK_STATUS_COMPLETED;
        } catch (Exception e) {
            log.error("[Cluster: {}] Failed to execute reconcile groups task: {}", clusterId, e.getMessage(), e);
            return TASK_STATUS_FAILED;
        }
    }
}
