package io.kvoperator.reconcile;

import com.google.common.util.concurrent.MoreExecutors;
import io.kvoperator.exceptions.TransientCollaboratorException;
import io.kvoperator.metrics.MetricsProvider;
import io.kvoperator.store.StaleRevisionException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReconcileDispatcherTest {

    private static final GroupKey KEY = new GroupKey("basic", "tikv");

    @Mock
    private GroupReconciler reconciler;

    @Mock
    private ScheduledExecutorService scheduler;

    private ReconcileDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new ReconcileDispatcher(
                reconciler,
                MoreExecutors.newDirectExecutorService(),
                scheduler,
                new Backoff(Duration.ofMillis(100), Duration.ofMillis(1600)),
                2,
                new MetricsProvider(new SimpleMeterRegistry(), "test-operator"));
    }

    @Test
    void testRequeueRequestedByPassIsScheduled() throws Exception {
        // Given
        when(reconciler.reconcile("basic", "tikv")).thenReturn(ReconcileResult.requeueAfter(Duration.ofSeconds(5)));

        // When
        dispatcher.submit("basic", "tikv");

        // Then
        verify(scheduler).schedule(any(Runnable.class), eq(5000L), eq(TimeUnit.MILLISECONDS));
        assertThat(dispatcher.isRunning(KEY)).isFalse();
        assertThat(dispatcher.failureCount(KEY)).isZero();
    }

    @Test
    void testConvergedPassIsNotRequeued() throws Exception {
        // Given
        when(reconciler.reconcile("basic", "tikv")).thenReturn(ReconcileResult.done());

        // When
        dispatcher.submit(KEY);

        // Then
        verify(reconciler, times(1)).reconcile("basic", "tikv");
        verifyNoInteractions(scheduler);
    }

    @Test
    void testConflictRestartsPassImmediately() throws Exception {
        // Given
        when(reconciler.reconcile("basic", "tikv"))
                .thenThrow(new StaleRevisionException("/basic/groups/tikv/instances/2", 41))
                .thenReturn(ReconcileResult.done());

        // When
        dispatcher.submit(KEY);

        // Then
        verify(reconciler, times(2)).reconcile("basic", "tikv");
        assertThat(dispatcher.failureCount(KEY)).isZero();
        verifyNoInteractions(scheduler);
    }

    @Test
    void testPersistentConflictsBackOff() throws Exception {
        // Given
        when(reconciler.reconcile("basic", "tikv"))
                .thenThrow(new StaleRevisionException("/basic/groups/tikv/spec", 7));

        // When
        dispatcher.submit(KEY);

        // Then
        verify(reconciler, times(3)).reconcile("basic", "tikv");
        assertThat(dispatcher.failureCount(KEY)).isEqualTo(1);
        verify(scheduler).schedule(any(Runnable.class), eq(100L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void testFailuresBackOffExponentially() throws Exception {
        // Given
        when(reconciler.reconcile("basic", "tikv"))
                .thenThrow(new TransientCollaboratorException("pd unreachable"));
        ArgumentCaptor<Runnable> requeue = ArgumentCaptor.forClass(Runnable.class);

        // When
        dispatcher.submit(KEY);
        verify(scheduler).schedule(requeue.capture(), eq(100L), eq(TimeUnit.MILLISECONDS));
        requeue.getValue().run();

        // Then
        verify(scheduler).schedule(any(Runnable.class), eq(200L), eq(TimeUnit.MILLISECONDS));
        assertThat(dispatcher.failureCount(KEY)).isEqualTo(2);
    }

    @Test
    void testSuccessResetsFailureCount() throws Exception {
        // Given
        when(reconciler.reconcile("basic", "tikv"))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(ReconcileResult.done());

        // When
        dispatcher.submit(KEY);
        int afterFailure = dispatcher.failureCount(KEY);
        dispatcher.submit(KEY);

        // Then
        assertThat(afterFailure).isEqualTo(1);
        assertThat(dispatcher.failureCount(KEY)).isZero();
    }

    @Test
    void testSubmissionDuringRunCausesOneFollowUp() throws Exception {
        // Given
        AtomicInteger passes = new AtomicInteger();
        AtomicBoolean runningDuringPass = new AtomicBoolean();
        when(reconciler.reconcile("basic", "tikv")).thenAnswer(invocation -> {
            if (passes.incrementAndGet() == 1) {
                runningDuringPass.set(dispatcher.isRunning(KEY));
                dispatcher.submit(KEY);
                dispatcher.submit(KEY);
            }
            return ReconcileResult.done();
        });

        // When
        dispatcher.submit(KEY);

        // Then
        assertThat(passes.get()).isEqualTo(2);
        assertThat(runningDuringPass.get()).isTrue();
        assertThat(dispatcher.isRunning(KEY)).isFalse();
    }

    @Test
    void testSubmissionDuringFailedRunWaitsForBackoff() throws Exception {
        // Given
        AtomicInteger passes = new AtomicInteger();
        when(reconciler.reconcile("basic", "tikv")).thenAnswer(invocation -> {
            passes.incrementAndGet();
            dispatcher.submit(KEY);
            throw new TransientCollaboratorException("pd unreachable");
        });

        // When
        dispatcher.submit(KEY);

        // Then
        assertThat(passes.get()).isEqualTo(1);
        assertThat(dispatcher.failureCount(KEY)).isEqualTo(1);
        assertThat(dispatcher.isRunning(KEY)).isFalse();
        verify(scheduler).schedule(any(Runnable.class), eq(100L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void testNoRequeueAfterShutdown() throws Exception {
        // Given
        when(reconciler.reconcile("basic", "tikv")).thenReturn(ReconcileResult.requeueAfter(Duration.ofSeconds(5)));
        when(scheduler.isShutdown()).thenReturn(true);

        // When
        dispatcher.submit(KEY);

        // Then
        verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    @Test
    void testShutdownStopsScheduler() {
        dispatcher.shutdown();

        verify(scheduler).shutdownNow();
    }

    @Test
    void testUnknownKeyIsIdle() {
        assertThat(dispatcher.isRunning(new GroupKey("other", "pd"))).isFalse();
        assertThat(dispatcher.failureCount(new GroupKey("other", "pd"))).isZero();
    }
}
