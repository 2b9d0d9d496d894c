package com.lexis.activation.infra.metrics.impl.prometheus;

import com.lexis.activation.infra.metrics.Counter;

/**
 * Binds one label combination of a Prometheus counter to the engine's {@link Counter}.
 */
final class PrometheusCounterAdapter implements Counter {

    private final io.prometheus.client.Counter.Child child;

    PrometheusCounterAdapter(io.prometheus.client.Counter counter, String[] labelValues) {
        if (counter == null) {
            throw new IllegalArgumentException("Counter cannot be null");
        }
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.child = counter.labels(labelValues);
    }

    @Override
    public void increment() {
        child.inc();
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter increment cannot be negative: " + amount);
        }
        child.inc(amount);
    }

    @Override
    public long count() {
        return (long) child.get();
    }
}
