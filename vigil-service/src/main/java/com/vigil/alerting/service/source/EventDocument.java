/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.source;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.api.model.EventLevel;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;

/**
 * Wire form of a log event, one JSON object per line.
 *
 * <pre>{@code
 * {"timestamp": "2025-01-01T12:00:00.123", "service": "web-server", "level": "WARNING",
 *  "event_type": "cpu_utilization_spike", "message": "High CPU utilization detected",
 *  "metrics": {"cpu_usage": 93.4, "response_time_ms": 120.5},
 *  "trace_id": "trace-48213", "source_ip": "10.0.1.17"}
 * }</pre>
 */
public record EventDocument(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("service") String service,
        @JsonProperty("level") String level,
        @JsonProperty("event_type") String eventType,
        @JsonProperty("message") String message,
        @JsonProperty("metrics") Map<String, Double> metrics,
        @JsonProperty("trace_id") String traceId,
        @JsonProperty("source_ip") String sourceIp) {

    /**
     * Converts to the engine's event type. Missing level means INFO and missing
     * metrics an empty map; everything else is left for the engine to validate.
     *
     * @throws IllegalArgumentException if the timestamp or level cannot be parsed
     */
    public Event toEvent() {
        return new Event(
                parseTimestamp(timestamp),
                service,
                eventType,
                level == null ? EventLevel.INFO : EventLevel.valueOf(level.trim().toUpperCase(Locale.ROOT)),
                metrics == null ? Map.of() : metrics,
                traceId,
                sourceIp);
    }

    public static EventDocument from(Event event, String message) {
        return new EventDocument(
                event.timestamp().toString(),
                event.sourceId(),
                event.level().name(),
                event.category(),
                message,
                event.numericFields(),
                event.correlationId(),
                event.originIp());
    }

    /**
     * Accepts ISO instants and zone-less local date-times, the latter read as UTC.
     */
    static Instant parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException nested) {
                throw new IllegalArgumentException("Unparseable timestamp: " + value, nested);
            }
        }
    }
}
