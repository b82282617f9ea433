/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics;

/**
 * Monotonic counter. Thread-safe.
 */
public interface Counter {

    void increment();

    void increment(long amount);

    long count();
}
