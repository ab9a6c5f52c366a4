package io.kvoperator.tasks.impl;

import io.kvoperator.tasks.Task;
import io.kvoperator.tasks.TaskContext;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import static io.kvoperator.config.Constants.*;

/**
 * Task to roll group statuses up into the cluster status
 */
@Slf4j
@Getter
@AllArgsConstructor
public class AggregateClusterStatusTask implements Task {

    private final String name;
    private final int priority;
    private final String input;
    private final String schedule;

    @Override
    public String execute(TaskContext context, String clusterId) {
        log.info("[Cluster: {}] Executing aggregate cluster status task: {}", clusterId, name);

        try {
            context.getClusterReconciler().aggregate(clusterId);
            return TASK_STATUS_COMPLETED;
        } catch (Exception e) {
            log.error("[Cluster: {}] Failed to aggregate cluster status: {}", clusterId, e.getMessage(), e);
            return TASK_STATUS_FAILED;
        }
    }
}
