package io.kvoperator.config;

import io.kvoperator.models.OrchestrationPolicy;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static io.kvoperator.config.Constants.*;

/**
 * Configuration for the operator.
 * Loads configuration from application.yml with fallbacks to constants.
 * <p>
 * The orchestration section is the global default policy; a group may override any
 * field through its desired spec.
 */
@Slf4j
@Getter
public class KvOperatorConfig {

    private final String[] etcdEndpoints;
    private final List<String> clusters;
    private final long taskIntervalSeconds;
    private final int reconcilePoolSize;
    private final Duration recheckInterval;
    private final Duration backoffBase;
    private final Duration backoffMax;
    private final int maxConflictRetries;
    private final OrchestrationPolicy defaultPolicy;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "KV_OPERATOR_CONFIG_FILE";

    public KvOperatorConfig() {
        this(DEFAULT_CONFIG_FILE_CLASSPATH);
    }

    KvOperatorConfig(String classpathResource) {
        ConfigModel config = loadYamlConfig(classpathResource);

        this.etcdEndpoints = parseEndpoints(config);
        this.clusters = parseClusters(config);
        this.taskIntervalSeconds = parseTaskIntervalSeconds(config);

        Reconcile reconcile = config.getReconcile() != null ? config.getReconcile() : new Reconcile();
        this.reconcilePoolSize = positiveOr(reconcile.getPoolSize(), DEFAULT_RECONCILE_POOL_SIZE);
        this.recheckInterval = Duration.ofSeconds(positiveOr(reconcile.getRecheckIntervalSeconds(), DEFAULT_RECHECK_INTERVAL_SECONDS));
        this.backoffBase = Duration.ofMillis(positiveOr(reconcile.getBackoffBaseMillis(), DEFAULT_BACKOFF_BASE_MILLIS));
        this.backoffMax = Duration.ofMillis(positiveOr(reconcile.getBackoffMaxMillis(), DEFAULT_BACKOFF_MAX_MILLIS));
        this.maxConflictRetries = positiveOr(reconcile.getMaxConflictRetries(), DEFAULT_MAX_CONFLICT_RETRIES);
        this.defaultPolicy = parseDefaultPolicy(config);

        log.info("Loaded kv-operator config - etcd endpoints: {}, clusters: {}, task interval: {}s, policy: {}",
                String.join(", ", etcdEndpoints), clusters, taskIntervalSeconds, defaultPolicy);
    }

    private ConfigModel loadYamlConfig(String classpathResource) {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            }
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", classpathResource);
            inputStream = getClass().getClassLoader().getResourceAsStream(classpathResource);
            loadedFrom = "classpath (" + classpathResource + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", classpathResource);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try (InputStream in = inputStream) {
            ConfigModel config = yaml.load(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private String[] parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null
                && !config.getEtcd().getEndpoints().isEmpty()) {
            return config.getEtcd().getEndpoints().toArray(new String[0]);
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private List<String> parseClusters(ConfigModel config) {
        if (config.getOperator() != null && config.getOperator().getClusters() != null) {
            return List.copyOf(config.getOperator().getClusters());
        }
        return List.of();
    }

    private long parseTaskIntervalSeconds(ConfigModel config) {
        if (config.getTask() != null && config.getTask().getIntervalSeconds() != null) {
            return config.getTask().getIntervalSeconds();
        }
        return DEFAULT_TASK_INTERVAL_SECONDS;
    }

    private OrchestrationPolicy parseDefaultPolicy(ConfigModel config) {
        Orchestration o = config.getOrchestration() != null ? config.getOrchestration() : new Orchestration();
        OrchestrationPolicy policy = new OrchestrationPolicy();
        policy.setLeaderTransferTimeoutSeconds(positiveOr(o.getLeaderTransferTimeoutSeconds(), DEFAULT_LEADER_TRANSFER_TIMEOUT_SECONDS));
        policy.setEvictionTimeoutSeconds(positiveOr(o.getEvictionTimeoutSeconds(), DEFAULT_EVICTION_TIMEOUT_SECONDS));
        policy.setStallThresholdPasses(positiveOr(o.getStallThresholdPasses(), DEFAULT_STALL_THRESHOLD_PASSES));
        policy.setCrashLoopRestartThreshold(positiveOr(o.getCrashLoopRestartThreshold(), DEFAULT_CRASH_LOOP_RESTART_THRESHOLD));
        policy.setMaxTransitionsPerPass(positiveOr(o.getMaxTransitionsPerPass(), DEFAULT_MAX_TRANSITIONS_PER_PASS));
        return policy;
    }

    private static long positiveOr(Long value, long fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Etcd etcd;
        private Task task;
        private Operator operator;
        private Reconcile reconcile;
        private Orchestration orchestration;
        private Controller controller; // used by Spring @Value
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Task {
        private Long intervalSeconds;
    }

    @Data
    public static class Operator {
        private List<String> clusters;
    }

    @Data
    public static class Reconcile {
        private Integer poolSize;
        private Long recheckIntervalSeconds;
        private Long backoffBaseMillis;
        private Long backoffMaxMillis;
        private Integer maxConflictRetries;
    }

    @Data
    public static class Orchestration {
        private Long leaderTransferTimeoutSeconds;
        private Long evictionTimeoutSeconds;
        private Integer stallThresholdPasses;
        private Integer crashLoopRestartThreshold;
        private Integer maxTransitionsPerPass;
    }

    @Data
    public static class Controller {
        private String id;
    }
}
