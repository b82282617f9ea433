/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.metrics;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Latency histogram. Thread-safe.
 */
public interface Timer {

    /**
     * Times execution of a callable. The duration is recorded even if it throws.
     *
     * @return callable result
     * @throws Exception if the callable throws
     */
    <T> T record(Callable<T> callable) throws Exception;

    /**
     * Records a pre-measured duration.
     *
     * @throws IllegalArgumentException if the duration is negative
     */
    void record(Duration duration);

    /**
     * @param percentile value between 0.0 and 1.0
     * @return duration at percentile
     * @throws UnsupportedOperationException if the backend computes percentiles server side
     */
    Duration percentile(double percentile);
}
