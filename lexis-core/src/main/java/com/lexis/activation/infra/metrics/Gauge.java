package com.lexis.activation.infra.metrics;

/**
 * Instantaneous value, such as the number of in-flight reasoner dispatches.
 * Thread-safe.
 */
public interface Gauge {
    void set(double value);
    double value();
}
