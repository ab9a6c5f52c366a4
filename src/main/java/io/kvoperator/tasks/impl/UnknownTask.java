package io.kvoperator.tasks.impl;

import io.kvoperator.tasks.Task;
import io.kvoperator.tasks.TaskContext;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import static io.kvoperator.config.Constants.TASK_STATUS_FAILED;

/**
 * Placeholder for task names this operator does not know, e.g. left behind by an older version.
 */
@Slf4j
@Getter
@AllArgsConstructor
public class UnknownTask implements Task {

    private final String name;
    private final int priority;
    private final String input;
    private final String schedule;

    @Override
    public String execute(TaskContext context, String clusterId) {
        log.warn("[Cluster: {}] Unknown task type {}, marking failed", clusterId, name);
        return TASK_STATUS_FAILED;
    }
}
