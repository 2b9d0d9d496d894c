package com.lexis.activation.infra.metrics;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Latency histogram.
 * Thread-safe.
 */
public interface Timer {

    /**
     * Times execution of the callable. The duration is recorded even if it throws.
     */
    <T> T record(Callable<T> callable) throws Exception;

    void record(Duration duration);

    /**
     * @param percentile value between 0.0 and 1.0
     * @throws UnsupportedOperationException for backends that compute percentiles server-side
     */
    Duration percentile(double percentile);
}
