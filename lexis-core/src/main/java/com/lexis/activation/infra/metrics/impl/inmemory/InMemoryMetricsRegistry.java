package com.lexis.activation.infra.metrics.impl.inmemory;

import com.lexis.activation.infra.metrics.Counter;
import com.lexis.activation.infra.metrics.Gauge;
import com.lexis.activation.infra.metrics.MetricsRegistry;
import com.lexis.activation.infra.metrics.Timer;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry that keeps everything on the heap. Used by tests to assert on counters such as
 * reasoner invocations and cache hits.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> new InMemoryCounter());
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(key(name, tags), k -> new InMemoryGauge());
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), k -> new InMemoryTimer());
    }

    public long getCounterValue(String name, String... tags) {
        Counter counter = counters.get(key(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    /**
     * Sum of a counter across every tag combination.
     */
    public long getCounterTotal(String name) {
        return counters.entrySet().stream()
                .filter(e -> e.getKey().equals(name) || e.getKey().startsWith(name + "{"))
                .mapToLong(e -> e.getValue().count())
                .sum();
    }

    public double getGaugeValue(String name, String... tags) {
        Gauge gauge = gauges.get(key(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(key(name, tags));
        return timer != null ? timer.recordings() : List.of();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    private static String key(String name, String[] tags) {
        return tags.length == 0 ? name : name + "{" + String.join(",", Arrays.asList(tags)) + "}";
    }
}
