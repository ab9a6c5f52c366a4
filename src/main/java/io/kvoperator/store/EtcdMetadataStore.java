package io.kvoperator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import io.kvoperator.models.ClusterSpec;
import io.kvoperator.models.ClusterStatus;
import io.kvoperator.models.DesiredSpec;
import io.kvoperator.models.GroupStatus;
import io.kvoperator.models.InstanceActualState;
import io.kvoperator.models.InstanceGoalState;
import io.kvoperator.models.InstanceRecord;
import io.kvoperator.models.TaskMetadata;
import io.kvoperator.models.Versioned;
import lombok.extern.slf4j.Slf4j;

import jakarta.annotation.PreDestroy;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static io.kvoperator.config.Constants.PATH_DELIMITER;
import static io.kvoperator.config.Constants.SUFFIX_RECORD;
import static io.kvoperator.config.Constants.SUFFIX_SPEC;

/**
 * etcd-based implementation of MetadataStore.
 * Singleton to ensure single etcd client connection.
 */
@Slf4j
public class EtcdMetadataStore implements MetadataStore {

    // TODO: Make etcd timeout configurable once the config model grows an etcd client section
    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private static EtcdMetadataStore instance;

    private final String[] etcdEndpoints;
    private final Client etcdClient;
    private final KV kvClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;

    private EtcdMetadataStore(String[] etcdEndpoints) {
        this(etcdEndpoints, Client.builder().endpoints(etcdEndpoints).build());
        log.info("EtcdMetadataStore initialized with endpoints: {}", String.join(",", etcdEndpoints));
    }

    private EtcdMetadataStore(String[] etcdEndpoints, Client etcdClient) {
        this(etcdEndpoints, etcdClient, etcdClient.getKVClient());
    }

    private EtcdMetadataStore(String[] etcdEndpoints, Client etcdClient, KV kvClient) {
        this.etcdEndpoints = etcdEndpoints;
        this.etcdClient = etcdClient;
        this.kvClient = kvClient;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.pathResolver = EtcdPathResolver.getInstance();
    }

    // =================================================================
    // SINGLETON MANAGEMENT
    // =================================================================

    public static synchronized EtcdMetadataStore getInstance(String[] etcdEndpoints) {
        if (instance == null) {
            instance = new EtcdMetadataStore(etcdEndpoints);
        }
        return instance;
    }

    /**
     * Get existing instance (throws if not initialized)
     */
    public static EtcdMetadataStore getInstance() {
        if (instance == null) {
            throw new IllegalStateException("EtcdMetadataStore not initialized. Call getInstance(etcdEndpoints) first.");
        }
        return instance;
    }

    /**
     * Reset singleton instance (for testing only)
     */
    public static synchronized void resetInstance() {
        instance = null;
    }

    /**
     * Create test instance with mocked dependencies (for testing only)
     */
    public static synchronized EtcdMetadataStore createTestInstance(String[] etcdEndpoints, Client etcdClient, KV kvClient) {
        resetInstance();
        instance = new EtcdMetadataStore(etcdEndpoints, etcdClient, kvClient);
        return instance;
    }

    // =================================================================
    // CONTROLLER TASKS OPERATIONS
    // =================================================================

    @Override
    public List<TaskMetadata> getAllTasks(String clusterId) throws Exception {
        log.debug("Getting all tasks for cluster {} from etcd", clusterId);

        try {
            String tasksPrefix = pathResolver.getControllerTasksPrefix(clusterId);
            GetResponse response = executeEtcdPrefixQuery(tasksPrefix);

            List<TaskMetadata> tasks = new ArrayList<>();
            for (KeyValue kv : response.getKvs()) {
                tasks.add(objectMapper.readValue(kv.getValue().toString(StandardCharsets.UTF_8), TaskMetadata.class));
            }
            // Sort by priority (0 = highest priority)
            tasks.sort(Comparator.comparingInt(TaskMetadata::getPriority));

            log.debug("Retrieved {} tasks from etcd", tasks.size());
            return tasks;

        } catch (Exception e) {
            log.error("Failed to get all tasks from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to retrieve tasks from etcd", e);
        }
    }

    @Override
    public Optional<TaskMetadata> getTask(String clusterId, String taskName) throws Exception {
        try {
            return getObjectByPath(pathResolver.getControllerTaskPath(clusterId, taskName), TaskMetadata.class)
                    .map(Versioned::getValue);
        } catch (Exception e) {
            log.error("Failed to get task {} from etcd: {}", taskName, e.getMessage(), e);
            throw new Exception("Failed to retrieve task from etcd", e);
        }
    }

    @Override
    public String createTask(String clusterId, TaskMetadata task) throws Exception {
        log.info("Creating task {} for cluster {} in etcd", task.getName(), clusterId);

        try {
            storeObjectAsJson(pathResolver.getControllerTaskPath(clusterId, task.getName()), task);
            return task.getName();
        } catch (Exception e) {
            log.error("Failed to create task {} in etcd: {}", task.getName(), e.getMessage(), e);
            throw new Exception("Failed to create task in etcd", e);
        }
    }

    @Override
    public void updateTask(String clusterId, TaskMetadata task) throws Exception {
        log.debug("Updating task {} in etcd", task.getName());

        try {
            storeObjectAsJson(pathResolver.getControllerTaskPath(clusterId, task.getName()), task);
        } catch (Exception e) {
            log.error("Failed to update task {} in etcd: {}", task.getName(), e.getMessage(), e);
            throw new Exception("Failed to update task in etcd", e);
        }
    }

    @Override
    public void deleteTask(String clusterId, String taskName) throws Exception {
        log.info("Deleting task {} from etcd", taskName);

        try {
            executeEtcdDelete(pathResolver.getControllerTaskPath(clusterId, taskName));
        } catch (Exception e) {
            log.error("Failed to delete task {} from etcd: {}", taskName, e.getMessage(), e);
            throw new Exception("Failed to delete task from etcd", e);
        }
    }

    // =================================================================
    // CLUSTER OPERATIONS
    // =================================================================

    @Override
    public Optional<Versioned<ClusterSpec>> getClusterSpec(String clusterId) throws Exception {
        try {
            return getObjectByPath(pathResolver.getClusterSpecPath(clusterId), ClusterSpec.class);
        } catch (Exception e) {
            log.error("Failed to get cluster spec for {} from etcd: {}", clusterId, e.getMessage(), e);
            throw new Exception("Failed to retrieve cluster spec from etcd", e);
        }
    }

    @Override
    public long putClusterSpec(String clusterId, ClusterSpec spec, long expectedModRevision) throws Exception {
        return compareAndStore(pathResolver.getClusterSpecPath(clusterId), spec, expectedModRevision, "cluster spec");
    }

    @Override
    public Optional<Versioned<ClusterStatus>> getClusterStatus(String clusterId) throws Exception {
        try {
            return getObjectByPath(pathResolver.getClusterStatusPath(clusterId), ClusterStatus.class);
        } catch (Exception e) {
            log.error("Failed to get cluster status for {} from etcd: {}", clusterId, e.getMessage(), e);
            throw new Exception("Failed to retrieve cluster status from etcd", e);
        }
    }

    @Override
    public long putClusterStatus(String clusterId, ClusterStatus status, long expectedModRevision) throws Exception {
        return compareAndStore(pathResolver.getClusterStatusPath(clusterId), status, expectedModRevision, "cluster status");
    }

    // =================================================================
    // GROUP OPERATIONS
    // =================================================================

    @Override
    public List<Versioned<DesiredSpec>> getGroupSpecs(String clusterId) throws Exception {
        log.debug("Getting all group specs for cluster {} from etcd", clusterId);

        try {
            GetResponse response = executeEtcdPrefixQuery(pathResolver.getGroupsPrefix(clusterId));

            List<Versioned<DesiredSpec>> specs = new ArrayList<>();
            for (KeyValue kv : response.getKvs()) {
                String key = kv.getKey().toString(StandardCharsets.UTF_8);
                // Only /groups/<group>/spec, skipping status and instance keys
                if (key.endsWith(PATH_DELIMITER + SUFFIX_SPEC)) {
                    specs.add(deserializeVersioned(kv, DesiredSpec.class));
                }
            }
            specs.sort(Comparator.comparing(v -> v.getValue().getName()));
            return specs;

        } catch (Exception e) {
            log.error("Failed to get group specs for {} from etcd: {}", clusterId, e.getMessage(), e);
            throw new Exception("Failed to retrieve group specs from etcd", e);
        }
    }

    @Override
    public Optional<Versioned<DesiredSpec>> getGroupSpec(String clusterId, String group) throws Exception {
        try {
            return getObjectByPath(pathResolver.getGroupSpecPath(clusterId, group), DesiredSpec.class);
        } catch (Exception e) {
            log.error("Failed to get group spec {} from etcd: {}", group, e.getMessage(), e);
            throw new Exception("Failed to retrieve group spec from etcd", e);
        }
    }

    @Override
    public long putGroupSpec(String clusterId, String group, DesiredSpec spec, long expectedModRevision) throws Exception {
        return compareAndStore(pathResolver.getGroupSpecPath(clusterId, group), spec, expectedModRevision, "group spec " + group);
    }

    @Override
    public Optional<Versioned<GroupStatus>> getGroupStatus(String clusterId, String group) throws Exception {
        try {
            return getObjectByPath(pathResolver.getGroupStatusPath(clusterId, group), GroupStatus.class);
        } catch (Exception e) {
            log.error("Failed to get group status {} from etcd: {}", group, e.getMessage(), e);
            throw new Exception("Failed to retrieve group status from etcd", e);
        }
    }

    @Override
    public long putGroupStatus(String clusterId, String group, GroupStatus status, long expectedModRevision) throws Exception {
        return compareAndStore(pathResolver.getGroupStatusPath(clusterId, group), status, expectedModRevision, "group status " + group);
    }

    // =================================================================
    // INSTANCE RECORD OPERATIONS
    // =================================================================

    @Override
    public List<Versioned<InstanceRecord>> getInstances(String clusterId, String group) throws Exception {
        log.debug("Getting instance records of group {} from etcd", group);

        try {
            GetResponse response = executeEtcdPrefixQuery(pathResolver.getInstancesPrefix(clusterId, group));

            List<Versioned<InstanceRecord>> records = new ArrayList<>();
            for (KeyValue kv : response.getKvs()) {
                String key = kv.getKey().toString(StandardCharsets.UTF_8);
                // goal-state and actual-state live next to the record
                if (key.endsWith(PATH_DELIMITER + SUFFIX_RECORD)) {
                    records.add(deserializeVersioned(kv, InstanceRecord.class));
                }
            }
            records.sort(Comparator.comparingInt(v -> v.getValue().getIndex()));
            return records;

        } catch (Exception e) {
            log.error("Failed to get instance records of group {} from etcd: {}", group, e.getMessage(), e);
            throw new Exception("Failed to retrieve instance records from etcd", e);
        }
    }

    @Override
    public long createInstance(String clusterId, String group, InstanceRecord record) throws Exception {
        String path = pathResolver.getInstanceRecordPath(clusterId, group, record.getIndex());
        return compareAndStore(path, record, 0, "instance record " + record.getName());
    }

    @Override
    public long updateInstance(String clusterId, String group, InstanceRecord record, long expectedModRevision) throws Exception {
        String path = pathResolver.getInstanceRecordPath(clusterId, group, record.getIndex());
        return compareAndStore(path, record, expectedModRevision, "instance record " + record.getName());
    }

    @Override
    public void deleteInstance(String clusterId, String group, int index, long expectedModRevision) throws Exception {
        String path = pathResolver.getInstanceRecordPath(clusterId, group, index);
        try {
            ByteSequence keyBytes = ByteSequence.from(path, StandardCharsets.UTF_8);
            TxnResponse txnResponse = kvClient.txn()
                    .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(expectedModRevision)))
                    .Then(Op.delete(keyBytes, DeleteOption.DEFAULT))
                    .Else(Op.get(keyBytes, GetOption.DEFAULT))
                    .commit()
                    .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            if (!txnResponse.isSucceeded()) {
                throw new StaleRevisionException(path, expectedModRevision);
            }
            log.debug("Deleted instance record {} at mod revision {}", path, expectedModRevision);

        } catch (StaleRevisionException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to delete instance record {} from etcd: {}", path, e.getMessage(), e);
            throw new Exception("Failed to delete instance record from etcd", e);
        }
    }

    // =================================================================
    // INSTANCE GOAL / ACTUAL STATE OPERATIONS
    // =================================================================

    @Override
    public Optional<InstanceGoalState> getInstanceGoalState(String clusterId, String group, int index) throws Exception {
        return getObjectByPath(pathResolver.getInstanceGoalStatePath(clusterId, group, index), InstanceGoalState.class)
                .map(Versioned::getValue);
    }

    @Override
    public void setInstanceGoalState(String clusterId, String group, int index, InstanceGoalState goalState) throws Exception {
        storeObjectAsJson(pathResolver.getInstanceGoalStatePath(clusterId, group, index), goalState);
        log.debug("Set goal state for instance {} of group {} with revision {}", index, group, goalState.getRevision());
    }

    @Override
    public Optional<InstanceActualState> getInstanceActualState(String clusterId, String group, int index) throws Exception {
        return getObjectByPath(pathResolver.getInstanceActualStatePath(clusterId, group, index), InstanceActualState.class)
                .map(Versioned::getValue);
    }

    @Override
    public void deleteInstanceState(String clusterId, String group, int index) throws Exception {
        executeEtcdDelete(pathResolver.getInstanceGoalStatePath(clusterId, group, index));
        executeEtcdDelete(pathResolver.getInstanceActualStatePath(clusterId, group, index));
        log.debug("Deleted goal and actual state of instance {} in group {}", index, group);
    }

    // =================================================================
    // LIFECYCLE
    // =================================================================

    @Override
    public void initialize() throws Exception {
        log.info("Initialize called - etcd client already connected to {}", String.join(",", etcdEndpoints));
    }

    @Override
    @PreDestroy
    public void close() throws Exception {
        log.info("Closing etcd metadata store");

        try {
            if (etcdClient != null) {
                etcdClient.close();
                log.info("etcd client closed successfully");
            }
        } catch (Exception e) {
            log.error("Error closing etcd client: {}", e.getMessage(), e);
            throw new Exception("Failed to close etcd client", e);
        }
    }

    public EtcdPathResolver getPathResolver() {
        return pathResolver;
    }

    // =================================================================
    // PRIVATE HELPER METHODS FOR ETCD OPERATIONS
    // =================================================================

    /**
     * Executes etcd prefix query to retrieve all keys matching the given prefix
     */
    private GetResponse executeEtcdPrefixQuery(String prefix) throws Exception {
        // Add trailing slash for etcd prefix queries to ensure precise matching
        String prefixWithSlash = prefix + PATH_DELIMITER;
        ByteSequence prefixBytes = ByteSequence.from(prefixWithSlash, StandardCharsets.UTF_8);
        return kvClient.get(
                prefixBytes,
                GetOption.newBuilder().withPrefix(prefixBytes).build()
        ).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private GetResponse executeEtcdGet(String key) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, StandardCharsets.UTF_8);
        return kvClient.get(keyBytes).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private void executeEtcdPut(String key, String value) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, StandardCharsets.UTF_8);
        ByteSequence valueBytes = ByteSequence.from(value, StandardCharsets.UTF_8);
        kvClient.put(keyBytes, valueBytes).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private void executeEtcdDelete(String key) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, StandardCharsets.UTF_8);
        kvClient.delete(keyBytes).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Writes the JSON of {@code object} only if the key's mod revision still equals
     * {@code expectedModRevision}. etcd reports mod revision 0 for absent keys, so 0 means create.
     */
    private long compareAndStore(String path, Object object, long expectedModRevision, String description) throws Exception {
        try {
            ByteSequence keyBytes = ByteSequence.from(path, StandardCharsets.UTF_8);
            ByteSequence valueBytes = ByteSequence.from(objectMapper.writeValueAsString(object), StandardCharsets.UTF_8);

            TxnResponse txnResponse = kvClient.txn()
                    .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(expectedModRevision)))
                    .Then(Op.put(keyBytes, valueBytes, PutOption.DEFAULT))
                    .Else(Op.get(keyBytes, GetOption.DEFAULT))
                    .commit()
                    .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            if (!txnResponse.isSucceeded()) {
                log.debug("Rejected write of {} at {}: expected mod revision {}", description, path, expectedModRevision);
                throw new StaleRevisionException(path, expectedModRevision);
            }

            long newRevision = txnResponse.getHeader().getRevision();
            log.debug("Stored {} at {} with mod revision {}", description, path, newRevision);
            return newRevision;

        } catch (StaleRevisionException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to store {} in etcd: {}", description, e.getMessage(), e);
            throw new Exception("Failed to store " + description + " in etcd", e);
        }
    }

    private <T> Versioned<T> deserializeVersioned(KeyValue kv, Class<T> clazz) throws Exception {
        String json = kv.getValue().toString(StandardCharsets.UTF_8);
        return new Versioned<>(objectMapper.readValue(json, clazz), kv.getModRevision());
    }

    private <T> Optional<Versioned<T>> getObjectByPath(String path, Class<T> clazz) throws Exception {
        GetResponse response = executeEtcdGet(path);
        if (response.getKvs().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(deserializeVersioned(response.getKvs().get(0), clazz));
    }

    private void storeObjectAsJson(String path, Object object) throws Exception {
        executeEtcdPut(path, objectMapper.writeValueAsString(object));
    }
}
