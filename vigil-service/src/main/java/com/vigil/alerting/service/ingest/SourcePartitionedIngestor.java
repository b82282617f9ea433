/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.ingest;

import com.vigil.alerting.api.IAlertEngine;
import com.vigil.alerting.api.model.Alert;
import com.vigil.alerting.api.model.Event;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Feeds events to an engine from several threads while keeping each source in order.
 *
 * <p>Events are routed to one of N single-thread lanes by a hash of their source id,
 * so all events of a source are processed sequentially in submission order while
 * different sources proceed in parallel. Events without a source id go to lane 0
 * and are rejected there by the engine's validation.
 */
public final class SourcePartitionedIngestor implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(SourcePartitionedIngestor.class.getName());
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final IAlertEngine engine;
    private final List<ExecutorService> lanes;

    public SourcePartitionedIngestor(IAlertEngine engine, int laneCount) {
        if (laneCount < 1) {
            throw new IllegalArgumentException("laneCount must be >= 1: " + laneCount);
        }
        this.engine = engine;
        List<ExecutorService> created = new ArrayList<>(laneCount);
        for (int i = 0; i < laneCount; i++) {
            String name = "vigil-ingest-" + i;
            created.add(Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, name);
                thread.setDaemon(true);
                return thread;
            }));
        }
        this.lanes = List.copyOf(created);
        logger.info(() -> "Ingestor started with " + laneCount + " lanes");
    }

    /**
     * Queues an event on its source's lane.
     *
     * @return completes with the raised alert, or exceptionally with the engine's error
     */
    public CompletableFuture<Optional<Alert>> submit(Event event) {
        return CompletableFuture.supplyAsync(() -> engine.process(event), lanes.get(laneOf(event)));
    }

    int laneOf(Event event) {
        String sourceId = event == null ? null : event.sourceId();
        return sourceId == null ? 0 : Math.floorMod(sourceId.hashCode(), lanes.size());
    }

    public int laneCount() {
        return lanes.size();
    }

    /**
     * Stops accepting events and waits for queued ones to finish.
     *
     * @return true if every lane drained within the timeout
     */
    public boolean shutdown(Duration timeout) throws InterruptedException {
        lanes.forEach(ExecutorService::shutdown);
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean drained = true;
        for (ExecutorService lane : lanes) {
            long remaining = deadline - System.nanoTime();
            if (!lane.awaitTermination(Math.max(0L, remaining), TimeUnit.NANOSECONDS)) {
                drained = false;
            }
        }
        if (!drained) {
            logger.warning("Ingestor lanes did not drain in " + timeout + ", cancelling remaining events");
            lanes.forEach(ExecutorService::shutdownNow);
        }
        return drained;
    }

    @Override
    public void close() {
        try {
            shutdown(DEFAULT_SHUTDOWN_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lanes.forEach(ExecutorService::shutdownNow);
        }
    }
}
