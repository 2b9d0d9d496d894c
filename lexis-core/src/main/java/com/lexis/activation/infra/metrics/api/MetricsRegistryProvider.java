package com.lexis.activation.infra.metrics.api;

import com.lexis.activation.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} backends.
 *
 * <p>Implementations need a public no-arg constructor and a
 * {@code META-INF/services/com.lexis.activation.infra.metrics.api.MetricsRegistryProvider}
 * entry. When several are found, the highest {@link #priority()} wins.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
