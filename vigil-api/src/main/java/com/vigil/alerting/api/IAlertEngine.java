/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api;

import com.vigil.alerting.api.model.Alert;
import com.vigil.alerting.api.model.EngineStats;
import com.vigil.alerting.api.model.Event;

import java.util.List;
import java.util.Optional;

/**
 * Contract for feeding events to the alerting engine.
 *
 * <p>Each call validates the event, updates the sliding windows and the anomaly
 * model of the event's source, and evaluates every detection rule. At most one
 * alert is raised per event.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IAlertEngine engine = // obtain from factory or DI
 *
 * Event event = Event.builder()
 *     .timestamp(Instant.now())
 *     .sourceId("web-server")
 *     .category("cpu_utilization_spike")
 *     .metric("cpu_usage", 95.0)
 *     .build();
 *
 * engine.process(event).ifPresent(alert -> System.out.println(alert.title()));
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations are thread-safe. Callers must still submit events of the
 * same source in arrival order.
 */
public interface IAlertEngine {

    /**
     * Processes one event.
     *
     * @param event the event (must not be null)
     * @return the alert raised for this event, if any
     * @throws com.vigil.alerting.api.exception.EventValidationException if the event is malformed
     */
    Optional<Alert> process(Event event);

    /**
     * Processes events one by one in the given order.
     *
     * @param events events to process
     * @return raised alerts, in the order of their triggering events
     */
    default List<Alert> processBatch(List<Event> events) {
        return events.stream()
                .map(this::process)
                .flatMap(Optional::stream)
                .toList();
    }

    /**
     * @return a snapshot of the engine counters
     */
    EngineStats stats();
}
