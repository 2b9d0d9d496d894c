package com.lexis.activation.infra.metrics.impl.prometheus;

import com.lexis.activation.infra.metrics.Counter;
import com.lexis.activation.infra.metrics.Gauge;
import com.lexis.activation.infra.metrics.MetricsRegistry;
import com.lexis.activation.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MetricsRegistry} backed by the Prometheus simpleclient.
 *
 * <p>One collector is registered per metric name; each distinct tag-value combination is
 * a child of that collector. The label names of the first registration win for a name.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private final CollectorRegistry registry;
    private final Map<String, io.prometheus.client.Counter> counterCollectors = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Gauge> gaugeCollectors = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Histogram> histogramCollectors = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> {
            io.prometheus.client.Counter collector = counterCollectors.computeIfAbsent(name, n ->
                    io.prometheus.client.Counter.build()
                            .name(sanitizeName(n))
                            .help("Counter " + n)
                            .labelNames(labelNames(tags))
                            .register(registry));
            return new PrometheusCounterAdapter(collector, labelValues(tags));
        });
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(key(name, tags), k -> {
            io.prometheus.client.Gauge collector = gaugeCollectors.computeIfAbsent(name, n ->
                    io.prometheus.client.Gauge.build()
                            .name(sanitizeName(n))
                            .help("Gauge " + n)
                            .labelNames(labelNames(tags))
                            .register(registry));
            return new PrometheusGaugeAdapter(collector, labelValues(tags));
        });
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), k -> {
            io.prometheus.client.Histogram collector = histogramCollectors.computeIfAbsent(name, n ->
                    io.prometheus.client.Histogram.build()
                            .name(sanitizeName(n) + "_seconds")
                            .help("Timer " + n)
                            // reasoner calls sit in the seconds range, local planning in micros
                            .buckets(0.0001, 0.001, 0.01, 0.1, 0.5, 1.0, 5.0, 15.0, 30.0, 60.0)
                            .labelNames(labelNames(tags))
                            .register(registry));
            return new PrometheusTimerAdapter(collector, labelValues(tags));
        });
    }

    static String sanitizeName(String name) {
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String key(String name, String[] tags) {
        return name + Arrays.toString(tags);
    }

    private static String[] labelNames(String[] tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be name/value pairs: " + Arrays.toString(tags));
        }
        String[] names = new String[tags.length / 2];
        for (int i = 0; i < names.length; i++) {
            names[i] = tags[i * 2];
        }
        return names;
    }

    private static String[] labelValues(String[] tags) {
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }
}
