/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.actions;

import com.vigil.alerting.api.ActionExecutor;
import com.vigil.alerting.api.exception.ActionExecutionException;
import com.vigil.alerting.api.model.ActionOutcome;
import com.vigil.alerting.api.model.Alert;
import com.vigil.alerting.api.model.AlertCategory;
import com.vigil.alerting.api.model.RemediationAction;
import com.vigil.alerting.infra.metrics.MetricsRegistry;
import com.vigil.alerting.infra.metrics.Timer;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Maps an alert to exactly one remediation and invokes it on the {@link ActionExecutor}.
 *
 * <p>Failures never escape: an executor exception, a timeout or a missing target
 * becomes a failed {@link ActionOutcome}, is logged and counted, and is not retried.
 *
 * <p>With a positive timeout each call runs on a daemon worker and is cancelled
 * (interrupted) when it overruns. With a zero timeout the call runs on the caller's
 * thread.
 */
public final class ActionDispatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ActionDispatcher.class);

    /** Remediation per category; anything missing falls back to {@link RemediationAction#NOTIFY}. */
    public static final Map<AlertCategory, RemediationAction> DEFAULT_ACTIONS;

    static {
        Map<AlertCategory, RemediationAction> defaults = new EnumMap<>(AlertCategory.class);
        defaults.put(AlertCategory.HIGH_CPU_UTILIZATION, RemediationAction.SCALE_OUT);
        defaults.put(AlertCategory.BRUTE_FORCE, RemediationAction.BLOCK_SOURCE);
        defaults.put(AlertCategory.HIGH_ERROR_RATE, RemediationAction.RESTART);
        defaults.put(AlertCategory.HIGH_MEMORY_UTILIZATION, RemediationAction.CAPTURE_DIAGNOSTICS_AND_RESTART);
        DEFAULT_ACTIONS = Collections.unmodifiableMap(defaults);
    }

    private final ActionExecutor executor;
    private final Map<AlertCategory, RemediationAction> actions;
    private final Duration timeout;
    private final ExecutorService worker;
    private final MetricsRegistry metrics;
    private final Timer dispatchTimer;
    private final Tracer tracer;

    public ActionDispatcher(ActionExecutor executor) {
        this(executor, Map.of(), Duration.ZERO, MetricsRegistry.noop(),
                OpenTelemetry.noop().getTracer("com.vigil.alerting"));
    }

    /**
     * @param overrides per-category replacements for {@link #DEFAULT_ACTIONS}
     * @param timeout   upper bound for one executor call; zero disables it
     */
    public ActionDispatcher(ActionExecutor executor,
                            Map<AlertCategory, RemediationAction> overrides,
                            Duration timeout,
                            MetricsRegistry metrics,
                            Tracer tracer) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");

        Map<AlertCategory, RemediationAction> mapping = new EnumMap<>(AlertCategory.class);
        mapping.putAll(DEFAULT_ACTIONS);
        mapping.putAll(overrides);
        this.actions = Collections.unmodifiableMap(mapping);

        this.dispatchTimer = metrics.timer("action_dispatch");
        this.worker = timeout.isZero() ? null : Executors.newCachedThreadPool(new WorkerThreadFactory());
    }

    public RemediationAction actionFor(AlertCategory category) {
        return actions.getOrDefault(category, RemediationAction.NOTIFY);
    }

    /**
     * Runs the remediation for one alert.
     *
     * @return the outcome; never throws for executor failures
     */
    public ActionOutcome dispatch(Alert alert) {
        RemediationAction action = actionFor(alert.category());
        String target = targetOf(action, alert);
        String tag = action.name().toLowerCase(Locale.ROOT);

        Span span = tracer.spanBuilder("dispatch-action").startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("alert.id", alert.alertId());
            span.setAttribute("action", action.name());
            if (target != null) {
                span.setAttribute("action.target", target);
            }

            if (target == null) {
                throw new ActionExecutionException("No offending IP on alert " + alert.alertId());
            }
            invoke(action, alert, target);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.counter("actions_dispatched_total", "action", tag).increment();
            logger.debug("Dispatched {} for {} ({}) in {} ms", action, alert.alertId(), target, elapsed.toMillis());
            return ActionOutcome.succeeded(alert.alertId(), action, target, elapsed);

        } catch (ActionExecutionException e) {
            return failed(alert, action, target, e, start, span, tag);
        } catch (RuntimeException e) {
            return failed(alert, action, target,
                    new ActionExecutionException(describe(e), e), start, span, tag);
        } finally {
            dispatchTimer.record(Duration.ofNanos(System.nanoTime() - start));
            span.end();
        }
    }

    @Override
    public void close() {
        if (worker != null) {
            worker.shutdownNow();
        }
    }

    private ActionOutcome failed(Alert alert, RemediationAction action, String target,
                                 ActionExecutionException error, long start, Span span, String tag) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        span.recordException(error);
        span.setStatus(StatusCode.ERROR, error.getMessage());
        metrics.counter("action_failures_total", "action", tag).increment();
        logger.warn("Action {} for alert {} failed: {}", action, alert.alertId(), error.getMessage());
        return ActionOutcome.failed(alert.alertId(), action, target, error.getMessage(), elapsed);
    }

    private static String describe(Duration timeout) {
        long millis = timeout.toMillis();
        return millis > 0 ? millis + " ms" : TimeUnit.NANOSECONDS.toMicros(timeout.toNanos()) + " us";
    }

    private void invoke(RemediationAction action, Alert alert, String target) {
        if (worker == null) {
            call(action, alert, target);
            return;
        }

        Future<?> future = worker.submit(() -> call(action, alert, target));
        try {
            future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ActionExecutionException(action + " timed out after " + describe(timeout), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ActionExecutionException actionError) {
                throw actionError;
            }
            throw new ActionExecutionException(describe(cause), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ActionExecutionException("Interrupted while waiting for " + action, e);
        }
    }

    private void call(RemediationAction action, Alert alert, String target) {
        switch (action) {
            case SCALE_OUT -> executor.scaleOut(target);
            case BLOCK_SOURCE -> executor.blockSource(target);
            case RESTART -> executor.restart(target);
            case CAPTURE_DIAGNOSTICS_AND_RESTART -> executor.captureDiagnosticsAndRestart(target);
            case NOTIFY -> executor.notify(alert);
        }
    }

    private static String targetOf(RemediationAction action, Alert alert) {
        return action == RemediationAction.BLOCK_SOURCE ? alert.offendingIp() : alert.sourceId();
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "vigil-action-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
