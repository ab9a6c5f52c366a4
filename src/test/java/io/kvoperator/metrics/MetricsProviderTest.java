package io.kvoperator.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class MetricsProviderTest {

    private static final String TEST_OPERATOR_ID = "test-operator-01";

    private MeterRegistry registry;
    private MetricsProvider provider;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        provider = new MetricsProvider(registry, TEST_OPERATOR_ID);
    }

    @Test
    void testCounterTaggedWithHostname() {
        Counter counter = provider.counter("reconcile_passes_total", Map.of("group", "tikv"));

        counter.increment();
        counter.increment(2.0);

        assertThat(counter.getId().getTag("hostname")).isEqualTo(TEST_OPERATOR_ID);
        assertThat(counter.getId().getTag("group")).isEqualTo("tikv");
        assertThat(provider.counter("reconcile_passes_total", Map.of("group", "tikv")).count()).isEqualTo(3.0);
    }

    @Test
    void testGaugeHolderIsSharedPerNameAndTags() {
        // Given
        AtomicDouble first = provider.gauge("group_ready_replicas", Map.of("group", "tikv"));
        first.set(3);

        // When
        AtomicDouble again = provider.gauge("group_ready_replicas", Map.of("group", "tikv"));
        AtomicDouble other = provider.gauge("group_ready_replicas", Map.of("group", "pd"));
        other.set(1);

        // Then
        assertThat(again).isSameAs(first);
        assertThat(other).isNotSameAs(first);
        assertThat(registry.find("group_ready_replicas").gauges()).hasSize(2);
        Gauge gauge = registry.find("group_ready_replicas").tag("group", "tikv").gauge();
        assertThat(gauge).isNotNull();
        assertThat(gauge.value()).isEqualTo(3.0);
    }

    @Test
    void testTimerRecords() {
        Timer timer = provider.timer("reconcile_duration", Map.of("group", "pd"));

        timer.record(250, TimeUnit.MILLISECONDS);

        assertThat(timer.getId().getTag("hostname")).isEqualTo(TEST_OPERATOR_ID);
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250);
    }
}
