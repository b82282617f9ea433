/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.api.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Immutable telemetry record fed to the alerting engine.
 *
 * <p>
 * An event consists of:
 * <ul>
 * <li><b>timestamp</b>: when the event happened at its source.</li>
 * <li><b>sourceId</b>: emitting service or host, used to key per-source anomaly models.</li>
 * <li><b>category</b>: event type, e.g. {@code auth_failure} or {@code cpu_utilization_spike}.</li>
 * <li><b>level</b>: log level reported by the source.</li>
 * <li><b>numericFields</b>: metric name to value, e.g. {@code cpu_usage -> 93.4}.</li>
 * <li><b>correlationId</b>, <b>originIp</b>: optional, may be null.</li>
 * </ul>
 *
 * <p>
 * The record does not reject malformed content on construction; the engine validates
 * every event before it touches any state and reports all violations at once.
 *
 * @param timestamp     event time
 * @param sourceId      emitting source
 * @param category      event type
 * @param level         log level
 * @param numericFields metrics carried by the event (copied, unmodifiable)
 * @param correlationId optional trace identifier
 * @param originIp      optional network origin
 */
public record Event(
        Instant timestamp,
        String sourceId,
        String category,
        EventLevel level,
        Map<String, Double> numericFields,
        String correlationId,
        String originIp) {

    public Event {
        // LinkedHashMap tolerates null keys so validation can report them
        numericFields = numericFields == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(numericFields));
    }

    /**
     * Looks up a numeric field.
     *
     * @param name metric name
     * @return the value, or empty when absent or null
     */
    public OptionalDouble metric(String name) {
        if (numericFields == null) {
            return OptionalDouble.empty();
        }
        Double value = numericFields.get(name);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public Optional<String> origin() {
        return Optional.ofNullable(originIp);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Instant timestamp;
        private String sourceId;
        private String category;
        private EventLevel level = EventLevel.INFO;
        private final Map<String, Double> numericFields = new LinkedHashMap<>();
        private String correlationId;
        private String originIp;

        private Builder() {
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder level(EventLevel level) {
            this.level = level;
            return this;
        }

        public Builder metric(String name, double value) {
            this.numericFields.put(name, value);
            return this;
        }

        public Builder metrics(Map<String, Double> metrics) {
            this.numericFields.putAll(metrics);
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder originIp(String originIp) {
            this.originIp = originIp;
            return this;
        }

        public Event build() {
            return new Event(timestamp, sourceId, category, level, numericFields, correlationId, originIp);
        }
    }
}
