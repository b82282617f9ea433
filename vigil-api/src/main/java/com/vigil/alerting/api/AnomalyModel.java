/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api;

import com.vigil.alerting.api.model.AnomalyVerdict;

/**
 * Per-source outlier detector over a bounded rolling buffer of two-dimensional samples.
 *
 * <p>The model stays untrained (and answers {@link AnomalyVerdict#NONE}) until the
 * buffer holds the minimum number of samples and a fit succeeded. After that it is
 * refit periodically on the current buffer contents.
 */
public interface AnomalyModel {

    /**
     * Records a sample, refits if due, and scores the sample.
     */
    AnomalyVerdict observe(double x1, double x2);

    /**
     * Scores a sample against the current fit without recording it.
     */
    AnomalyVerdict verdict(double x1, double x2);

    boolean isTrained();

    long samplesSeen();

    int bufferedSamples();
}
