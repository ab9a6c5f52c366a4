package io.kvoperator;

import io.kvoperator.config.KvOperatorConfig;
import io.kvoperator.consensus.ConsensusClientFactory;
import io.kvoperator.diff.DiffEngine;
import io.kvoperator.lifecycle.InstanceLifecycle;
import io.kvoperator.metrics.MetricsProvider;
import io.kvoperator.reconcile.Backoff;
import io.kvoperator.reconcile.ClusterReconciler;
import io.kvoperator.reconcile.GroupReconciler;
import io.kvoperator.reconcile.ReconcileDispatcher;
import io.kvoperator.runtime.EtcdWorkloadRuntime;
import io.kvoperator.runtime.WorkloadRuntime;
import io.kvoperator.status.StatusAggregator;
import io.kvoperator.store.EtcdMetadataStore;
import io.kvoperator.store.MetadataStore;
import io.kvoperator.tasks.TaskContext;
import io.kvoperator.upgrade.RevisionHasher;
import io.kvoperator.upgrade.RollingUpgradeSequencer;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main Spring Boot application class for the kv operator.
 *
 * Drives coordinator and store replica groups of every configured cluster toward the desired
 * state stored in etcd, and serves the REST API used to edit that desired state.
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "io.kvoperator")
public class KvOperatorApplication {

    public static void main(String[] args) {
        log.info("Starting kv operator");

        try {
            SpringApplication.run(KvOperatorApplication.class, args);
            log.info("kv operator started successfully");
        } catch (Exception e) {
            log.error("Failed to start kv operator: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public KvOperatorConfig config() {
        KvOperatorConfig config = new KvOperatorConfig();
        log.info("Loaded configuration");
        return config;
    }

    /**
     * MetadataStore bean - shared by all managed clusters.
     */
    @Bean
    public MetadataStore metadataStore(KvOperatorConfig config) {
        log.info("Initializing MetadataStore connection to etcd");
        try {
            EtcdMetadataStore store = EtcdMetadataStore.getInstance(config.getEtcdEndpoints());
            store.initialize();
            log.info("MetadataStore initialized successfully");
            return store;
        } catch (Exception e) {
            log.error("Failed to initialize MetadataStore: {}", e.getMessage(), e);
            throw new RuntimeException("MetadataStore initialization failed", e);
        }
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry registry, @Value("${controller.id}") String operatorId) {
        return new MetricsProvider(registry, operatorId);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RevisionHasher revisionHasher() {
        return new RevisionHasher();
    }

    /**
     * Workload runtime publishing instance goal states to etcd for the node agents.
     */
    @Bean
    public WorkloadRuntime workloadRuntime(MetadataStore metadataStore, RevisionHasher revisionHasher) {
        log.info("Initializing etcd goal-state workload runtime");
        return new EtcdWorkloadRuntime(metadataStore, revisionHasher);
    }

    @Bean
    public ConsensusClientFactory consensusClientFactory() {
        return new ConsensusClientFactory();
    }

    @Bean
    public StatusAggregator statusAggregator() {
        return new StatusAggregator();
    }

    @Bean
    public GroupReconciler groupReconciler(MetadataStore metadataStore,
                                           WorkloadRuntime workloadRuntime,
                                           ConsensusClientFactory consensusClientFactory,
                                           RevisionHasher revisionHasher,
                                           StatusAggregator statusAggregator,
                                           MetricsProvider metricsProvider,
                                           KvOperatorConfig config,
                                           Clock clock) {
        log.info("Initializing GroupReconciler with default policy {}", config.getDefaultPolicy());
        return new GroupReconciler(
                metadataStore,
                workloadRuntime,
                consensusClientFactory,
                new DiffEngine(),
                new RollingUpgradeSequencer(revisionHasher),
                new InstanceLifecycle(metadataStore, metricsProvider),
                statusAggregator,
                metricsProvider,
                config.getDefaultPolicy(),
                config.getRecheckInterval(),
                clock);
    }

    @Bean
    public ClusterReconciler clusterReconciler(MetadataStore metadataStore, StatusAggregator statusAggregator, Clock clock) {
        return new ClusterReconciler(metadataStore, statusAggregator, clock);
    }

    /**
     * Dispatcher running group reconciliations on a fixed worker pool.
     */
    @Bean(destroyMethod = "shutdown")
    public ReconcileDispatcher reconcileDispatcher(GroupReconciler groupReconciler,
                                                   MetricsProvider metricsProvider,
                                                   KvOperatorConfig config) {
        log.info("Initializing ReconcileDispatcher with {} workers", config.getReconcilePoolSize());
        ExecutorService workers = Executors.newFixedThreadPool(config.getReconcilePoolSize(), daemonThreads("reconcile-worker"));
        ScheduledExecutorService requeue = Executors.newSingleThreadScheduledExecutor(daemonThreads("reconcile-requeue"));
        return new ReconcileDispatcher(
                groupReconciler,
                workers,
                requeue,
                new Backoff(config.getBackoffBase(), config.getBackoffMax()),
                config.getMaxConflictRetries(),
                metricsProvider);
    }

    /**
     * TaskContext bean - shared by the task managers of all clusters.
     */
    @Bean
    public TaskContext taskContext(MetadataStore metadataStore,
                                   ReconcileDispatcher reconcileDispatcher,
                                   ClusterReconciler clusterReconciler) {
        return new TaskContext(metadataStore, reconcileDispatcher, clusterReconciler);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
