package io.kvoperator.tasks.impl;

import io.kvoperator.reconcile.ClusterReconciler;
import io.kvoperator.tasks.TaskContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Optional;

import static io.kvoperator.config.Constants.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for AggregateClusterStatusTask.
 */
class AggregateClusterStatusTaskTest {

    @Mock
    private TaskContext taskContext;

    @Mock
    private ClusterReconciler clusterReconciler;

    private AggregateClusterStatusTask task;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(taskContext.getClusterReconciler()).thenReturn(clusterReconciler);
        task = new AggregateClusterStatusTask(TASK_ACTION_AGGREGATE_CLUSTER_STATUS, 2, null, TASK_SCHEDULE_REPEAT);
    }

    @Test
    void testAggregatesCluster() throws Exception {
        when(clusterReconciler.aggregate("basic")).thenReturn(Optional.empty());

        assertThat(task.execute(taskContext, "basic")).isEqualTo(TASK_STATUS_COMPLETED);
        verify(clusterReconciler).aggregate("basic");
    }

    @Test
    void testAggregationFailureFailsTask() throws Exception {
        when(clusterReconciler.aggregate("basic")).thenThrow(new Exception("etcd down"));

        assertThat(task.execute(taskContext, "basic")).isEqualTo(TASK_STATUS_FAILED);
    }
}
