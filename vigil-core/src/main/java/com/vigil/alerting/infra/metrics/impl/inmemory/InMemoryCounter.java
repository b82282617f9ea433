/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics.impl.inmemory;

import com.vigil.alerting.infra.metrics.Counter;

import java.util.concurrent.atomic.AtomicLong;

final class InMemoryCounter implements Counter {

    private final String key;
    private final AtomicLong value = new AtomicLong();

    InMemoryCounter(String key) {
        this.key = key;
    }

    @Override
    public void increment() {
        increment(1);
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter increment amount cannot be negative: " + amount);
        }
        value.addAndGet(amount);
    }

    @Override
    public long count() {
        return value.get();
    }

    @Override
    public String toString() {
        return String.format("InMemoryCounter{key='%s', value=%d}", key, count());
    }
}
