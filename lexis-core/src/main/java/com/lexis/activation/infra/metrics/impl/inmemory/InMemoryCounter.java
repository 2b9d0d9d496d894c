package com.lexis.activation.infra.metrics.impl.inmemory;

import com.lexis.activation.infra.metrics.Counter;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryCounter implements Counter {

    private final AtomicLong value = new AtomicLong();

    @Override
    public void increment() {
        value.incrementAndGet();
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter increment cannot be negative: " + amount);
        }
        value.addAndGet(amount);
    }

    @Override
    public long count() {
        return value.get();
    }

    @Override
    public String toString() {
        return "InMemoryCounter{" + count() + "}";
    }
}
