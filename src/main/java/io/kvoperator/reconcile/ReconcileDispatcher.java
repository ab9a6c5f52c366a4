package io.kvoperator.reconcile;

import io.kvoperator.exceptions.TransientCollaboratorException;
import io.kvoperator.metrics.MetricsProvider;
import io.kvoperator.metrics.MetricsUtils;
import io.kvoperator.store.StaleRevisionException;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static io.kvoperator.metrics.MetricsConstants.RECONCILE_CONFLICTS_METRIC_NAME;
import static io.kvoperator.metrics.MetricsConstants.RECONCILE_DURATION_METRIC_NAME;
import static io.kvoperator.metrics.MetricsConstants.RECONCILE_FAILURES_METRIC_NAME;
import static io.kvoperator.metrics.MetricsConstants.RECONCILE_PASSES_METRIC_NAME;

/**
 * Runs group reconciliations on a worker pool.
 * <p>
 * Different groups run in parallel, a single group never runs twice at once. Submitting a
 * group that is already running records one follow-up run. Stale-revision conflicts restart
 * the pass right away a bounded number of times; every other failure is retried after an
 * exponential backoff.
 */
@Slf4j
public class ReconcileDispatcher {

    private final GroupReconciler reconciler;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final Backoff backoff;
    private final int maxConflictRetries;
    private final MetricsProvider metricsProvider;

    private final Map<GroupKey, KeyState> states = new ConcurrentHashMap<>();

    public ReconcileDispatcher(GroupReconciler reconciler,
                               ExecutorService workers,
                               ScheduledExecutorService scheduler,
                               Backoff backoff,
                               int maxConflictRetries,
                               MetricsProvider metricsProvider) {
        this.reconciler = reconciler;
        this.workers = workers;
        this.scheduler = scheduler;
        this.backoff = backoff;
        this.maxConflictRetries = maxConflictRetries;
        this.metricsProvider = metricsProvider;
    }

    public void submit(String clusterId, String group) {
        submit(new GroupKey(clusterId, group));
    }

    public void submit(GroupKey key) {
        KeyState state = states.computeIfAbsent(key, k -> new KeyState());
        synchronized (state) {
            if (state.running) {
                state.dirty = true;
                log.debug("[Cluster: {}] Group {} already reconciling, queued follow-up", key.getClusterId(), key.getGroup());
                return;
            }
            state.running = true;
        }
        workers.execute(() -> run(key, state));
    }

    /**
     * Whether a pass for {@code key} is running right now.
     */
    public boolean isRunning(GroupKey key) {
        KeyState state = states.get(key);
        if (state == null) {
            return false;
        }
        synchronized (state) {
            return state.running;
        }
    }

    /**
     * Consecutive failed passes of {@code key}, reset by the next successful pass.
     */
    public int failureCount(GroupKey key) {
        KeyState state = states.get(key);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.failures;
        }
    }

    public void shutdown() {
        log.info("Shutting down reconcile dispatcher with {} known groups", states.size());
        scheduler.shutdownNow();
        workers.shutdown();
    }

    private void run(GroupKey key, KeyState state) {
        Map<String, String> tags = MetricsUtils.buildGroupTags(key.getClusterId(), key.getGroup());
        Duration requeue = null;
        boolean failed = false;
        int conflicts = 0;

        while (true) {
            Timer.Sample sample = Timer.start();
            try {
                ReconcileResult result = reconciler.reconcile(key.getClusterId(), key.getGroup());
                metricsProvider.counter(RECONCILE_PASSES_METRIC_NAME, tags).increment();
                synchronized (state) {
                    state.failures = 0;
                }
                requeue = result.getRequeueAfter();
                break;
            } catch (StaleRevisionException e) {
                conflicts++;
                metricsProvider.counter(RECONCILE_CONFLICTS_METRIC_NAME, tags).increment();
                if (conflicts <= maxConflictRetries) {
                    log.debug("[Cluster: {}] Group {} conflict on {}, retrying from fresh reads ({}/{})",
                            key.getClusterId(), key.getGroup(), e.getKey(), conflicts, maxConflictRetries);
                    continue;
                }
                requeue = recordFailure(key, state, tags);
                failed = true;
                log.warn("[Cluster: {}] Group {} kept conflicting after {} retries, backing off {}",
                        key.getClusterId(), key.getGroup(), maxConflictRetries, requeue);
                break;
            } catch (TransientCollaboratorException e) {
                requeue = recordFailure(key, state, tags);
                failed = true;
                log.warn("[Cluster: {}] Group {} collaborator unavailable: {}, retrying in {}",
                        key.getClusterId(), key.getGroup(), e.getMessage(), requeue);
                break;
            } catch (Exception e) {
                requeue = recordFailure(key, state, tags);
                failed = true;
                log.error("[Cluster: {}] Failed to reconcile group {}: {}, retrying in {}",
                        key.getClusterId(), key.getGroup(), e.getMessage(), requeue, e);
                break;
            } finally {
                sample.stop(metricsProvider.timer(RECONCILE_DURATION_METRIC_NAME, tags));
            }
        }

        boolean rerun;
        synchronized (state) {
            state.running = false;
            rerun = state.dirty;
            state.dirty = false;
        }
        if (rerun && !failed) {
            submit(key);
        } else {
            // a follow-up after a failure waits out the backoff like any other retry
            Optional.ofNullable(requeue).ifPresent(delay -> scheduleRequeue(key, state, delay));
        }
    }

    private Duration recordFailure(GroupKey key, KeyState state, Map<String, String> tags) {
        metricsProvider.counter(RECONCILE_FAILURES_METRIC_NAME, tags).increment();
        int failures;
        synchronized (state) {
            failures = ++state.failures;
        }
        return backoff.delay(failures);
    }

    private void scheduleRequeue(GroupKey key, KeyState state, Duration delay) {
        synchronized (state) {
            if (state.requeue != null && !state.requeue.isDone()) {
                return;
            }
            if (scheduler.isShutdown()) {
                log.debug("[Cluster: {}] Dispatcher stopped, not requeueing group {}", key.getClusterId(), key.getGroup());
                return;
            }
            log.debug("[Cluster: {}] Requeueing group {} in {}", key.getClusterId(), key.getGroup(), delay);
            state.requeue = scheduler.schedule(() -> submit(key), delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private static final class KeyState {
        private boolean running;
        private boolean dirty;
        private int failures;
        private ScheduledFuture<?> requeue;
    }
}
