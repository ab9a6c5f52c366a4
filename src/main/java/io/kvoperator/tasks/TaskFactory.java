package io.kvoperator.tasks;

import io.kvoperator.models.TaskMetadata;
import io.kvoperator.tasks.impl.AggregateClusterStatusTask;
import io.kvoperator.tasks.impl.ReconcileGroupsTask;
import io.kvoperator.tasks.impl.UnknownTask;
import lombok.extern.slf4j.Slf4j;

import static io.kvoperator.config.Constants.*;

/**
 * Factory for creating Task implementations from TaskMetadata.
 */
@Slf4j
public class TaskFactory {

    private TaskFactory() {
    }

    public static Task createTask(TaskMetadata metadata) {
        String taskName = metadata.getName();

        return switch (taskName) {
            case TASK_ACTION_RECONCILE_GROUPS -> new ReconcileGroupsTask(
                metadata.getName(),
                metadata.getPriority(),
                metadata.getInput(),
                metadata.getSchedule()
            );
            case TASK_ACTION_AGGREGATE_CLUSTER_STATUS -> new AggregateClusterStatusTask(
                metadata.getName(),
                metadata.getPriority(),
                metadata.getInput(),
                metadata.getSchedule()
            );
            default -> {
                log.warn("Unknown task type: {}", taskName);
                yield new UnknownTask(metadata.getName(), metadata.getPriority(), metadata.getInput(), metadata.getSchedule());
            }
        };
    }
}
