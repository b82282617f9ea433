/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.anomaly;

import com.vigil.alerting.api.AnomalyModel;
import com.vigil.alerting.api.OutlierDetector;
import com.vigil.alerting.api.model.AnomalyVerdict;
import com.vigil.alerting.infra.metrics.Counter;
import com.vigil.alerting.infra.metrics.MetricsRegistry;
import com.vigil.alerting.infra.metrics.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link AnomalyModel} backed by a bounded FIFO sample buffer and a pluggable
 * {@link OutlierDetector}.
 *
 * <p>Refit rule: once the buffer holds at least {@code minFitSamples} samples, the
 * detector is refit on the whole buffer on the first such sample and then every
 * {@code retrainPeriod} samples seen. A failed refit is logged and counted, the call
 * returns {@link AnomalyVerdict#NONE}, and any earlier fit stays in use.
 *
 * <p>All methods synchronize on the model, so a refit only blocks its own source.
 */
public final class RollingAnomalyModel implements AnomalyModel {

    private static final Logger logger = Logger.getLogger(RollingAnomalyModel.class.getName());

    private final String sourceId;
    private final OutlierDetector detector;
    private final int capacity;
    private final int minFitSamples;
    private final int retrainPeriod;
    private final Tracer tracer;

    private final Counter refits;
    private final Counter refitFailures;
    private final Timer refitTimer;

    private final Deque<double[]> buffer;
    private long samplesSeen;
    private boolean trained;

    public RollingAnomalyModel(String sourceId,
                               OutlierDetector detector,
                               int capacity,
                               int minFitSamples,
                               int retrainPeriod,
                               MetricsRegistry metrics,
                               Tracer tracer) {
        if (minFitSamples < 1 || capacity < minFitSamples) {
            throw new IllegalArgumentException(
                    "Require 1 <= minFitSamples <= capacity, got " + minFitSamples + " / " + capacity);
        }
        if (retrainPeriod < 1) {
            throw new IllegalArgumentException("retrainPeriod must be >= 1: " + retrainPeriod);
        }
        this.sourceId = sourceId;
        this.detector = detector;
        this.capacity = capacity;
        this.minFitSamples = minFitSamples;
        this.retrainPeriod = retrainPeriod;
        this.tracer = tracer;
        this.refits = metrics.counter("anomaly_refits_total");
        this.refitFailures = metrics.counter("anomaly_refit_failures_total");
        this.refitTimer = metrics.timer("anomaly_refit");
        this.buffer = new ArrayDeque<>(capacity);
    }

    @Override
    public synchronized AnomalyVerdict observe(double x1, double x2) {
        buffer.addLast(new double[]{x1, x2});
        if (buffer.size() > capacity) {
            buffer.pollFirst();
        }
        samplesSeen++;

        if (buffer.size() >= minFitSamples && (samplesSeen % retrainPeriod == 0 || !trained)) {
            if (!refit()) {
                return AnomalyVerdict.NONE;
            }
        }
        return trained ? classify(x1, x2) : AnomalyVerdict.NONE;
    }

    @Override
    public synchronized AnomalyVerdict verdict(double x1, double x2) {
        return trained ? classify(x1, x2) : AnomalyVerdict.NONE;
    }

    @Override
    public synchronized boolean isTrained() {
        return trained;
    }

    @Override
    public synchronized long samplesSeen() {
        return samplesSeen;
    }

    @Override
    public synchronized int bufferedSamples() {
        return buffer.size();
    }

    public String sourceId() {
        return sourceId;
    }

    private AnomalyVerdict classify(double x1, double x2) {
        double score = detector.score(x1, x2);
        return detector.isOutlier(score) ? AnomalyVerdict.anomaly(score) : AnomalyVerdict.normal(score);
    }

    private boolean refit() {
        Span span = tracer.spanBuilder("anomaly-refit").startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("source.id", sourceId);
            span.setAttribute("detector", detector.name());
            span.setAttribute("samples", buffer.size());

            detector.fit(buffer.toArray(new double[0][]));
            trained = true;
            refits.increment();
            logger.fine(() -> String.format("Refit %s model for %s on %d samples (seen=%d)",
                    detector.name(), sourceId, buffer.size(), samplesSeen));
            return true;
        } catch (RuntimeException e) {
            refitFailures.increment();
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Refit failed");
            logger.log(Level.WARNING, "Anomaly model refit failed for " + sourceId
                    + " (" + (trained ? "keeping previous fit" : "model stays untrained") + ")", e);
            return false;
        } finally {
            refitTimer.record(Duration.ofNanos(System.nanoTime() - start));
            span.end();
        }
    }

    @Override
    public synchronized String toString() {
        return "RollingAnomalyModel{source=" + sourceId + ", detector=" + detector.name()
                + ", buffered=" + buffer.size() + ", seen=" + samplesSeen + ", trained=" + trained + '}';
    }
}
