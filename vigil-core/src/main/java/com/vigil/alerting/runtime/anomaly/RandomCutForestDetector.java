/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.anomaly;

import com.amazon.randomcutforest.RandomCutForest;
import com.vigil.alerting.api.OutlierDetector;
import com.vigil.alerting.api.exception.AnomalyModelException;

/**
 * Random cut forest over two-dimensional samples.
 *
 * <p>Every fit builds a fresh forest from the configured seed and streams the whole
 * buffer into it, so the same buffer always yields the same forest. The forest's
 * normalized anomaly score sits near 1 for points like the training data and grows
 * towards {@code log2(samples + 1)} for points far from all of it.
 *
 * <p>The decision score is {@code scoreThreshold - anomalyScore}: negative for
 * outliers, positive for inliers. Not thread-safe; the owning model serializes access.
 */
public final class RandomCutForestDetector implements OutlierDetector {

    private static final int DIMENSIONS = 2;

    private final int treeCount;
    private final int sampleSize;
    private final long seed;
    private final double scoreThreshold;

    private RandomCutForest forest;

    /**
     * @param treeCount      trees in each forest
     * @param sampleSize     points each tree keeps
     * @param seed           seed for every rebuild
     * @param scoreThreshold anomaly score above which a point is an outlier
     */
    public RandomCutForestDetector(int treeCount, int sampleSize, long seed, double scoreThreshold) {
        if (treeCount < 1) {
            throw new IllegalArgumentException("treeCount must be >= 1: " + treeCount);
        }
        if (sampleSize < 2) {
            throw new IllegalArgumentException("sampleSize must be >= 2: " + sampleSize);
        }
        if (!(scoreThreshold > 0.0) || Double.isInfinite(scoreThreshold)) {
            throw new IllegalArgumentException("scoreThreshold must be a positive number: " + scoreThreshold);
        }
        this.treeCount = treeCount;
        this.sampleSize = sampleSize;
        this.seed = seed;
        this.scoreThreshold = scoreThreshold;
    }

    @Override
    public void fit(double[][] samples) {
        if (samples == null || samples.length < 2) {
            throw new AnomalyModelException("Random cut forest needs at least 2 samples, got "
                    + (samples == null ? 0 : samples.length));
        }
        for (double[] sample : samples) {
            if (sample.length != DIMENSIONS || !Double.isFinite(sample[0]) || !Double.isFinite(sample[1])) {
                throw new AnomalyModelException("Samples must be finite pairs");
            }
        }

        RandomCutForest rebuilt = RandomCutForest.builder()
                .dimensions(DIMENSIONS)
                .numberOfTrees(treeCount)
                .sampleSize(sampleSize)
                .randomSeed(seed)
                .outputAfter(1)
                // keep every buffered sample while a tree has room
                .initialAcceptFraction(1.0)
                .build();
        for (double[] sample : samples) {
            rebuilt.update(sample);
        }
        if (!rebuilt.isOutputReady()) {
            throw new AnomalyModelException("Random cut forest not ready after " + samples.length + " samples");
        }
        this.forest = rebuilt;
    }

    @Override
    public double score(double x1, double x2) {
        if (forest == null) {
            throw new IllegalStateException("Random cut forest is not fitted");
        }
        return scoreThreshold - forest.getAnomalyScore(new double[]{x1, x2});
    }

    @Override
    public boolean isFitted() {
        return forest != null;
    }

    @Override
    public String name() {
        return "random-cut-forest";
    }
}
