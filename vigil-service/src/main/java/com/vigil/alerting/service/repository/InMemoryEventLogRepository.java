/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.repository;

import com.vigil.alerting.api.model.Event;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Bounded in-memory event log. Once full, the oldest inserted entry is dropped for
 * each new one. Entries are lost on restart.
 */
public class InMemoryEventLogRepository implements EventLogRepository {

    private static final Logger logger = Logger.getLogger(InMemoryEventLogRepository.class.getName());

    public static final int DEFAULT_CAPACITY = 10_000;

    private static final Comparator<EventLogEntry> NEWEST_FIRST = Comparator
            .comparing((EventLogEntry entry) -> entry.event().timestamp(),
                    Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparingLong(EventLogEntry::sequenceId)
            .reversed();

    private final Deque<EventLogEntry> entries = new ArrayDeque<>();
    private final int capacity;
    private long sequence;
    private long evicted;

    public InMemoryEventLogRepository() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryEventLogRepository(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized EventLogEntry record(Event event) {
        Objects.requireNonNull(event, "event must not be null");
        if (entries.size() == capacity) {
            entries.removeFirst();
            if (evicted++ == 0) {
                logger.info("Event log reached " + capacity + " entries, dropping the oldest");
            }
        }
        EventLogEntry entry = new EventLogEntry(++sequence, event);
        entries.addLast(entry);
        return entry;
    }

    @Override
    public synchronized List<EventLogEntry> findRecent(int limit) {
        return entries.stream()
                .sorted(NEWEST_FIRST)
                .limit(EventLogRepository.clampLimit(limit))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized long count() {
        return entries.size();
    }
}
