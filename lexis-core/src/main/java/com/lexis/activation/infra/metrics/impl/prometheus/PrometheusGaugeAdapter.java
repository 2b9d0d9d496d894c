package com.lexis.activation.infra.metrics.impl.prometheus;

import com.lexis.activation.infra.metrics.Gauge;

final class PrometheusGaugeAdapter implements Gauge {

    private final io.prometheus.client.Gauge.Child child;

    PrometheusGaugeAdapter(io.prometheus.client.Gauge gauge, String[] labelValues) {
        if (gauge == null) {
            throw new IllegalArgumentException("Gauge cannot be null");
        }
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.child = gauge.labels(labelValues);
    }

    @Override
    public void set(double value) {
        child.set(value);
    }

    @Override
    public double value() {
        return child.get();
    }
}
