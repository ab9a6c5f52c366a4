package io.kvoperator.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/*
 * MetricsProvider is a utility class for creating and managing counters, gauges and timers
 * tagged with the operator instance id.
 */
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String HOST_NAME_TAG = "hostname";

    private final MeterRegistry registry;
    private final String hostname;
    // gauges hold a weak reference to their value holder, so keep one holder per meter
    private final Map<String, AtomicDouble> gaugeValues = new ConcurrentHashMap<>();

    public MetricsProvider(MeterRegistry registry, String operatorId) {
        this.registry = registry;
        this.hostname = operatorId;
        log.info("MetricsProvider initialized for the operator: {}", hostname);
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Create or retrieve a Gauge metric with the given name and tags.
     *
     * @return the AtomicDouble holding the gauge value
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        String meterKey = name + new TreeMap<>(tags);
        return gaugeValues.computeIfAbsent(meterKey, k -> {
            AtomicDouble value = new AtomicDouble(0);
            Gauge.builder(name, value::get).tags(mapToTagArray(tags)).register(registry);
            return value;
        });
    }

    /**
     * Create or retrieve a Timer metric with the given name and tags.
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
            .publishPercentileHistogram()
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    /**
     * Convert a map of tags to an array of alternating keys and values, including hostname.
     */
    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = HOST_NAME_TAG;
        tagArray[index] = hostname;
        return tagArray;
    }
}
