package com.lexis.activation.infra.metrics.impl.prometheus;

import com.lexis.activation.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Maps the engine's {@link Timer} onto a Prometheus histogram measured in seconds.
 *
 * <p>Percentiles are computed server-side with {@code histogram_quantile()}, so
 * {@link #percentile(double)} is not supported here.
 */
final class PrometheusTimerAdapter implements Timer {

    private final io.prometheus.client.Histogram.Child child;

    PrometheusTimerAdapter(io.prometheus.client.Histogram histogram, String[] labelValues) {
        if (histogram == null) {
            throw new IllegalArgumentException("Histogram cannot be null");
        }
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.child = histogram.labels(labelValues);
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        if (callable == null) {
            throw new IllegalArgumentException("Callable cannot be null");
        }
        io.prometheus.client.Histogram.Timer timer = child.startTimer();
        try {
            return callable.call();
        } finally {
            timer.observeDuration();
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("Duration cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        child.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public Duration percentile(double percentile) {
        throw new UnsupportedOperationException(String.format(
                "Percentiles are computed by Prometheus: histogram_quantile(%.2f, rate(<name>_bucket[5m]))",
                percentile));
    }

    long observationCount() {
        return (long) child.get().buckets[child.get().buckets.length - 1];
    }
}
