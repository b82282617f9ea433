/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.anomaly;

import com.vigil.alerting.api.OutlierDetector;
import com.vigil.alerting.api.exception.AnomalyModelException;

/**
 * Per-dimension z-score detector.
 *
 * <p>Fit computes the mean and sample standard deviation of each dimension.
 * The decision score is {@code threshold - max(|z1|, |z2|)}, negative beyond the
 * threshold. A dimension with zero spread only matters when the query differs
 * from its mean; such a query scores {@code -threshold}.
 */
public final class ZScoreDetector implements OutlierDetector {

    private final double threshold;

    private Stats[] stats;

    public ZScoreDetector(double threshold) {
        if (!(threshold > 0.0)) {
            throw new IllegalArgumentException("threshold must be > 0: " + threshold);
        }
        this.threshold = threshold;
    }

    /**
     * @throws AnomalyModelException if fewer than 2 samples or every dimension is constant
     */
    @Override
    public void fit(double[][] samples) {
        if (samples == null || samples.length < 2) {
            throw new AnomalyModelException("Z-score fit needs at least 2 samples");
        }
        Stats[] fitted = {computeStats(samples, 0), computeStats(samples, 1)};
        if (fitted[0].stddev() <= 0.0 && fitted[1].stddev() <= 0.0) {
            throw new AnomalyModelException("Degenerate sample buffer: zero variance in every dimension");
        }
        this.stats = fitted;
    }

    /**
     * Scores against the fitted statistics. A deviation along a zero-spread
     * dimension yields {@code -threshold}.
     */
    @Override
    public double score(double x1, double x2) {
        if (stats == null) {
            throw new IllegalStateException("Z-score detector is not fitted");
        }
        double z = Math.max(absZ(x1, stats[0]), absZ(x2, stats[1]));
        return Double.isInfinite(z) ? -threshold : threshold - z;
    }

    @Override
    public boolean isFitted() {
        return stats != null;
    }

    @Override
    public String name() {
        return "z-score";
    }

    private static double absZ(double x, Stats s) {
        if (s.stddev() <= 0.0) {
            return x == s.mean() ? 0.0 : Double.POSITIVE_INFINITY;
        }
        return Math.abs(x - s.mean()) / s.stddev();
    }

    private static Stats computeStats(double[][] samples, int dimension) {
        int n = samples.length;
        double sum = 0.0;
        for (double[] sample : samples) {
            sum += sample[dimension];
        }
        double mean = sum / n;
        double var = 0.0;
        for (double[] sample : samples) {
            double d = sample[dimension] - mean;
            var += d * d;
        }
        return new Stats(mean, Math.sqrt(var / (n - 1)));
    }

    private record Stats(double mean, double stddev) {
    }
}
