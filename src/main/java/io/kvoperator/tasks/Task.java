package io.kvoperator.tasks;

/**
 * Unit of recurring work executed by the task manager for one cluster.
 */
public interface Task {

    /**
     * Execute the task
     *
     * @param context   shared services, not bound to any cluster
     * @param clusterId cluster this execution works on
     * @return task status after execution
     */
    String execute(TaskContext context, String clusterId);

    String getName();

    /**
     * Get task priority (0 = highest)
     */
    int getPriority();

    String getInput();

    String getSchedule();
}
