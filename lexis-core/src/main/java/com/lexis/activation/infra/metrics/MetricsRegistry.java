package com.lexis.activation.infra.metrics;

import com.lexis.activation.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Backend-agnostic metrics registry.
 *
 * <p>Components receive their registry through their constructor; {@link #getInstance()}
 * exists for wiring code that wants the ServiceLoader-discovered default.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * Counter misconfigured = metrics.counter("lexis_misconfigured_modules_total",
 *         "module", "preliminar_ilegitimidade");
 * misconfigured.increment();
 * }</pre>
 *
 * <p>Tags are alternating label names and values. Two calls with the same name and the
 * same tag values return the same metric.
 */
public interface MetricsRegistry {

    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    /**
     * Registry selected by {@link java.util.ServiceLoader}, or a no-op registry when no
     * provider is on the classpath.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }

    static MetricsRegistry noop() {
        return MetricsRegistryHolder.NO_OP;
    }
}
