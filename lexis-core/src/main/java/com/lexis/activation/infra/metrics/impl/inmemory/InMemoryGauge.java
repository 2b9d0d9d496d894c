package com.lexis.activation.infra.metrics.impl.inmemory;

import com.lexis.activation.infra.metrics.Gauge;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryGauge implements Gauge {

    // double stored as raw long bits so set/get stay lock-free
    private final AtomicLong bits = new AtomicLong(Double.doubleToRawLongBits(0.0));

    @Override
    public void set(double value) {
        bits.set(Double.doubleToRawLongBits(value));
    }

    @Override
    public double value() {
        return Double.longBitsToDouble(bits.get());
    }

    @Override
    public String toString() {
        return String.format("InMemoryGauge{%.2f}", value());
    }
}
