package io.kvoperator;

import io.kvoperator.models.TaskMetadata;
import io.kvoperator.store.MetadataStore;
import io.kvoperator.tasks.Task;
import io.kvoperator.tasks.TaskContext;
import io.kvoperator.tasks.TaskFactory;
import lombok.extern.slf4j.Slf4j;

import static io.kvoperator.config.Constants.*;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the etcd-persisted recurring tasks of one managed cluster.
 * Agnostic to specific task types - delegates execution to Task implementations.
 */
@Slf4j
public class TaskManager {

    private final MetadataStore metadataStore;
    private final TaskContext taskContext;
    private final String clusterId;

    private final ScheduledExecutorService scheduler;
    private final long intervalSeconds;
    private volatile boolean isRunning = false;

    public TaskManager(MetadataStore metadataStore, TaskContext taskContext, String clusterId, long intervalSeconds) {
        this(metadataStore, taskContext, clusterId, intervalSeconds, Executors.newSingleThreadScheduledExecutor());
    }

    TaskManager(MetadataStore metadataStore, TaskContext taskContext, String clusterId, long intervalSeconds,
                ScheduledExecutorService scheduler) {
        this.metadataStore = metadataStore;
        this.taskContext = taskContext;
        this.clusterId = clusterId;
        this.intervalSeconds = intervalSeconds;
        this.scheduler = scheduler;
    }

    public TaskMetadata createTask(String taskName, String input, int priority) {
        log.info("[Cluster: {}] Creating task: name={}, priority={}", clusterId, taskName, priority);
        TaskMetadata taskMetadata = new TaskMetadata(taskName, priority);
        taskMetadata.setInput(input);
        try {
            metadataStore.createTask(clusterId, taskMetadata);
        } catch (Exception e) {
            log.error("Failed to create task: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to create task", e);
        }
        return taskMetadata;
    }

    public List<TaskMetadata> getAllTasks() {
        try {
            return metadataStore.getAllTasks(clusterId);
        } catch (Exception e) {
            log.error("Failed to get all tasks: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to get tasks", e);
        }
    }

    public Optional<TaskMetadata> getTask(String taskName) {
        try {
            return metadataStore.getTask(clusterId, taskName);
        } catch (Exception e) {
            log.error("Failed to get task {}: {}", taskName, e.getMessage(), e);
            throw new RuntimeException("Failed to get task", e);
        }
    }

    public void updateTask(TaskMetadata taskMetadata) {
        try {
            metadataStore.updateTask(clusterId, taskMetadata);
        } catch (Exception e) {
            log.error("Failed to update task {}: {}", taskMetadata.getName(), e.getMessage(), e);
            throw new RuntimeException("Failed to update task", e);
        }
    }

    public void start() {
        log.info("[Cluster: {}] Starting task manager, interval {}s", clusterId, intervalSeconds);

        bootstrapRecurringTasks();

        isRunning = true;
        scheduler.scheduleWithFixedDelay(
                this::processTaskLoop,
                0,
                intervalSeconds,
                TimeUnit.SECONDS
        );
    }

    /**
     * Creates the recurring tasks every managed cluster needs if they are missing.
     */
    private void bootstrapRecurringTasks() {
        log.info("[Cluster: {}] Bootstrapping recurring tasks", clusterId);
        ensureRecurringTask(TASK_ACTION_RECONCILE_GROUPS, 1, "Submit every group for reconciliation");
        ensureRecurringTask(TASK_ACTION_AGGREGATE_CLUSTER_STATUS, 2, "Roll group statuses up into cluster status");
    }

    private void ensureRecurringTask(String taskName, int priority, String description) {
        try {
            if (getTask(taskName).isPresent()) {
                log.debug("[Cluster: {}] Task {} already exists", clusterId, taskName);
                return;
            }

            TaskMetadata task = new TaskMetadata(taskName, priority);
            task.setSchedule(TASK_SCHEDULE_REPEAT);
            task.setInput(description);

            metadataStore.createTask(clusterId, task);
            log.info("[Cluster: {}] Created recurring task: {} (priority: {})", clusterId, taskName, priority);
        } catch (Exception e) {
            // the loop still runs whatever tasks exist; the next start retries the bootstrap
            log.error("[Cluster: {}] Failed to ensure recurring task {}: {}", clusterId, taskName, e.getMessage(), e);
        }
    }

    public void stop() {
        log.info("[Cluster: {}] Stopping task manager", clusterId);
        isRunning = false;
        scheduler.shutdown();
        // metadataStore is shared by all task managers and closed with the application
    }

    public boolean isRunning() {
        return isRunning;
    }

    public String getClusterId() {
        return clusterId;
    }

    void processTaskLoop() {
        try {
            List<TaskMetadata> tasks = getAllTasks();
            log.debug("[Cluster: {}] Found {} tasks in etcd", clusterId, tasks.size());

            TaskMetadata next = selectNextTask(tasks);
            if (next != null) {
                String result = executeTask(next);
                log.info("[Cluster: {}] Task {} completed with result: {}", clusterId, next.getName(), result);
            } else {
                log.debug("[Cluster: {}] No pending tasks to process", clusterId);
            }
        } catch (Exception e) {
            log.error("[Cluster: {}] Error in task processing loop: {}", clusterId, e.getMessage(), e);
        }
    }

    private String executeTask(TaskMetadata taskMetadata) {
        try {
            taskMetadata.setStatus(TASK_STATUS_RUNNING);
            updateTask(taskMetadata);

            Task task = TaskFactory.createTask(taskMetadata);
            String result = task.execute(taskContext, clusterId);

            // repeat tasks become eligible again
            if (TASK_SCHEDULE_REPEAT.equalsIgnoreCase(taskMetadata.getSchedule())) {
                taskMetadata.setStatus(TASK_STATUS_PENDING);
            } else {
                taskMetadata.setStatus(result);
            }
            taskMetadata.setOutput(result);
            taskMetadata.setLastUpdated(OffsetDateTime.now(ZoneOffset.UTC));
            updateTask(taskMetadata);
            return result;

        } catch (Exception e) {
            log.error("[Cluster: {}] Failed to execute task {}: {}", clusterId, taskMetadata.getName(), e.getMessage(), e);
            taskMetadata.setStatus(TASK_STATUS_FAILED);
            try {
                updateTask(taskMetadata);
            } catch (Exception updateException) {
                log.error("[Cluster: {}] Failed to update task status to failed: {}", clusterId, updateException.getMessage(), updateException);
            }
            return TASK_STATUS_FAILED;
        }
    }

    /**
     * Lowest "effective time" wins: last run plus one second per priority level,
     * so repeat tasks alternate by priority and age.
     */
    static TaskMetadata selectNextTask(List<TaskMetadata> tasks) {
        return tasks.stream()
                .filter(t -> TASK_SCHEDULE_REPEAT.equals(t.getSchedule()) || TASK_STATUS_PENDING.equals(t.getStatus()))
                .min(Comparator.comparingLong(t -> {
                    long lastUpdated = t.getLastUpdated() != null
                            ? t.getLastUpdated().toInstant().toEpochMilli()
                            : 0;
                    return lastUpdated + t.getPriority() * 1000L;
                }))
                .orElse(null);
    }
}
