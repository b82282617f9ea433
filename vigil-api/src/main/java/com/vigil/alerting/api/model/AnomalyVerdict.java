/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.model;

/**
 * Result of scoring one sample against a per-source anomaly model.
 *
 * <p>Lower scores are more anomalous; a negative score is an anomaly.
 * {@link Kind#NO_VERDICT} carries {@code NaN}.
 *
 * @param kind  verdict kind
 * @param score decision score
 */
public record AnomalyVerdict(Kind kind, double score) {

    public enum Kind {
        /** Model not trained yet, or the last refit failed. */
        NO_VERDICT,
        NORMAL,
        ANOMALY
    }

    public static final AnomalyVerdict NONE = new AnomalyVerdict(Kind.NO_VERDICT, Double.NaN);

    public static AnomalyVerdict normal(double score) {
        return new AnomalyVerdict(Kind.NORMAL, score);
    }

    public static AnomalyVerdict anomaly(double score) {
        return new AnomalyVerdict(Kind.ANOMALY, score);
    }

    public boolean isAnomaly() {
        return kind == Kind.ANOMALY;
    }

    public boolean hasVerdict() {
        return kind != Kind.NO_VERDICT;
    }
}
