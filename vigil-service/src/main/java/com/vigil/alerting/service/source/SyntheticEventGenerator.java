/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.source;

import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.api.model.EventLevel;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Simulated cloud-service log traffic.
 *
 * <p>Event types are drawn by weight: mostly normal operation, with occasional
 * authentication failures, timeouts, database errors and resource spikes. The same
 * seed and clock give the same stream.
 */
public final class SyntheticEventGenerator {

    public static final List<String> SERVICES = List.of("web-server", "auth-service", "database", "analytics-engine");

    /** Simulated event types with their draw weights. */
    public enum SimulatedEventType {
        NORMAL("normal_operation", 0.70, EventLevel.INFO, "Processed request successfully"),
        AUTH_SUCCESS("auth_success", 0.10, EventLevel.INFO, "User authentication successful"),
        AUTH_FAILURE("auth_failure", 0.05, EventLevel.WARNING, "Authentication failed: Invalid credentials"),
        TIMEOUT("connection_timeout", 0.05, EventLevel.ERROR, "Upstream service request timed out after 5000ms"),
        DATABASE_ERROR("database_error", 0.05, EventLevel.ERROR, "Connection to primary database failed"),
        CPU_SPIKE("cpu_utilization_spike", 0.025, EventLevel.WARNING, "High CPU utilization detected"),
        MEMORY_SPIKE("memory_utilization_spike", 0.025, EventLevel.WARNING, "High Memory utilization detected");

        private final String category;
        private final double weight;
        private final EventLevel level;
        private final String message;

        SimulatedEventType(String category, double weight, EventLevel level, String message) {
            this.category = category;
            this.weight = weight;
            this.level = level;
            this.message = message;
        }

        public String category() {
            return category;
        }

        public double weight() {
            return weight;
        }
    }

    private static final SimulatedEventType[] TYPES = SimulatedEventType.values();
    private static final double TOTAL_WEIGHT;

    static {
        double total = 0.0;
        for (SimulatedEventType type : TYPES) {
            total += type.weight;
        }
        TOTAL_WEIGHT = total;
    }

    private final Random random;
    private final Clock clock;

    public SyntheticEventGenerator() {
        this(new Random(), Clock.systemUTC());
    }

    public SyntheticEventGenerator(long seed, Clock clock) {
        this(new Random(seed), clock);
    }

    SyntheticEventGenerator(Random random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }

    public Event next() {
        return nextDocument().toEvent();
    }

    /**
     * Next event in wire form, with a zone-less local timestamp as the simulator writes it.
     */
    public EventDocument nextDocument() {
        return generate(pickType());
    }

    EventDocument generate(SimulatedEventType type) {
        return new EventDocument(
                LocalDateTime.now(clock).toString(),
                SERVICES.get(random.nextInt(SERVICES.size())),
                type.level.name(),
                type.category,
                type.message,
                metricsFor(type),
                "trace-" + (10000 + random.nextInt(90000)),
                sourceIpFor(type));
    }

    SimulatedEventType pickType() {
        double draw = random.nextDouble() * TOTAL_WEIGHT;
        for (SimulatedEventType type : TYPES) {
            draw -= type.weight;
            if (draw < 0) {
                return type;
            }
        }
        return TYPES[TYPES.length - 1];
    }

    private Map<String, Double> metricsFor(SimulatedEventType type) {
        Map<String, Double> metrics = new LinkedHashMap<>();
        switch (type) {
            case CPU_SPIKE -> metrics.put("cpu_usage", uniform(85.0, 99.9));
            case MEMORY_SPIKE -> metrics.put("memory_usage", uniform(85.0, 99.9));
            default -> {
                metrics.put("cpu_usage", uniform(10.0, 40.0));
                metrics.put("memory_usage", uniform(20.0, 50.0));
            }
        }
        metrics.put("response_time_ms", type == SimulatedEventType.TIMEOUT
                ? uniform(5000.0, 10000.0)
                : uniform(10.0, 200.0));
        return metrics;
    }

    private String sourceIpFor(SimulatedEventType type) {
        int host = 1 + random.nextInt(254);
        return type == SimulatedEventType.AUTH_FAILURE || type == SimulatedEventType.AUTH_SUCCESS
                ? "203.0.113." + host
                : "10.0.1." + host;
    }

    private double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }
}
