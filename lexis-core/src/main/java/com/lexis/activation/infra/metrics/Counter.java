package com.lexis.activation.infra.metrics;

/**
 * Monotonically increasing count of events, such as reasoner calls or cache hits.
 * Thread-safe.
 */
public interface Counter {
    void increment();
    void increment(long amount);
    long count();
}
