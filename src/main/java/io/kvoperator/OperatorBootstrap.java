package io.kvoperator;

import io.kvoperator.config.KvOperatorConfig;
import io.kvoperator.store.MetadataStore;
import io.kvoperator.tasks.TaskContext;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Starts one task manager per configured cluster and stops them on shutdown.
 */
@Slf4j
@Component
public class OperatorBootstrap {

    private final KvOperatorConfig config;
    private final String operatorId;
    private final Function<String, TaskManager> taskManagerFactory;
    private final List<TaskManager> taskManagers = new ArrayList<>();

    @Autowired
    public OperatorBootstrap(KvOperatorConfig config,
                             MetadataStore metadataStore,
                             TaskContext taskContext,
                             @Value("${controller.id}") String operatorId) {
        this(config, operatorId,
                clusterId -> new TaskManager(metadataStore, taskContext, clusterId, config.getTaskIntervalSeconds()));
    }

    OperatorBootstrap(KvOperatorConfig config, String operatorId, Function<String, TaskManager> taskManagerFactory) {
        this.config = config;
        this.operatorId = operatorId;
        this.taskManagerFactory = taskManagerFactory;
    }

    @PostConstruct
    public void start() {
        log.info("========================================");
        log.info("Starting kv operator {}", operatorId);
        log.info("Managing {} cluster(s): {}", config.getClusters().size(), config.getClusters());
        log.info("========================================");

        if (config.getClusters().isEmpty()) {
            log.warn("No clusters configured under operator.clusters, only the REST API is served");
        }
        for (String clusterId : config.getClusters()) {
            TaskManager taskManager = taskManagerFactory.apply(clusterId);
            taskManager.start();
            taskManagers.add(taskManager);
        }
    }

    @PreDestroy
    public void stop() {
        log.info("Stopping {} task manager(s)", taskManagers.size());
        for (TaskManager taskManager : taskManagers) {
            try {
                taskManager.stop();
            } catch (Exception e) {
                log.error("[Cluster: {}] Failed to stop task manager: {}", taskManager.getClusterId(), e.getMessage(), e);
            }
        }
        taskManagers.clear();
    }

    public List<TaskManager> getTaskManagers() {
        return Collections.unmodifiableList(taskManagers);
    }
}
