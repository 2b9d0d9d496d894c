package com.lexis.activation.infra.metrics.impl.inmemory;

import com.lexis.activation.infra.metrics.MetricsRegistry;
import com.lexis.activation.infra.metrics.api.MetricsRegistryProvider;

/**
 * Heap-backed provider. Outranks Prometheus when both are registered, which is the case
 * in test classpaths that add their own service entry.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory";
    }
}
