package com.lexis.activation.infra.metrics.impl.inmemory;

import com.lexis.activation.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every recorded duration so tests can assert on them and compute exact percentiles.
 */
final class InMemoryTimer implements Timer {

    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        long start = System.nanoTime();
        try {
            return callable.call();
        } finally {
            recordings.add(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        recordings.add(duration);
    }

    /**
     * Nearest-rank percentile with linear interpolation between neighbours.
     */
    @Override
    public Duration percentile(double percentile) {
        if (recordings.isEmpty()) {
            return Duration.ZERO;
        }
        List<Duration> sorted = new ArrayList<>(recordings);
        Collections.sort(sorted);

        double p = Math.max(0.0, Math.min(1.0, percentile));
        double index = (sorted.size() - 1) * p;
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted.get(lower);
        }
        long lo = sorted.get(lower).toNanos();
        long hi = sorted.get(upper).toNanos();
        return Duration.ofNanos(lo + (long) ((hi - lo) * (index - lower)));
    }

    List<Duration> recordings() {
        return List.copyOf(recordings);
    }

    @Override
    public String toString() {
        return "InMemoryTimer{count=" + recordings.size() + ", p99=" + percentile(0.99) + "}";
    }
}
