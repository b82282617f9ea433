/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.repository;

import com.vigil.alerting.api.model.Event;

import java.util.List;

/**
 * Log of the events the engine has processed.
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe.
 */
public interface EventLogRepository {

    int MAX_PAGE_SIZE = 2000;

    EventLogEntry record(Event event);

    /**
     * Newest event timestamp first; events with equal timestamps come in reverse
     * insertion order.
     *
     * @param limit clamped to 1..{@value #MAX_PAGE_SIZE}
     */
    List<EventLogEntry> findRecent(int limit);

    long count();

    static int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
    }
}
