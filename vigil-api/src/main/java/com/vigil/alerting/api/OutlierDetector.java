/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api;

/**
 * Unsupervised outlier algorithm used by an {@link AnomalyModel}.
 *
 * <p>Scores follow the decision-function convention: lower is more anomalous and
 * negative values are outliers.
 */
public interface OutlierDetector {

    /**
     * Replaces the current fit with one trained on {@code samples}.
     *
     * @param samples rows of {@code [x1, x2]}
     * @throws com.vigil.alerting.api.exception.AnomalyModelException if the samples cannot be fit
     */
    void fit(double[][] samples);

    /**
     * @throws IllegalStateException if called before a successful fit
     */
    double score(double x1, double x2);

    default boolean isOutlier(double score) {
        return score < 0.0;
    }

    boolean isFitted();

    default String name() {
        return getClass().getSimpleName();
    }
}
