/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.window;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Time-ordered sequence of timestamps with lazy eviction.
 *
 * <p>Entries are appended at the tail and evicted from the head while they are
 * strictly older than the retention horizon. Eviction only happens when
 * {@link #evictOlderThan(Instant, Duration)} is called; there is no timer.
 * Out-of-order timestamps are accepted and may transiently over- or under-trim.
 *
 * <p>Not thread-safe. The owner guards access.
 */
public final class TimeWindow {

    private final Deque<Instant> entries = new ArrayDeque<>();

    public void append(Instant timestamp) {
        entries.addLast(timestamp);
    }

    /**
     * Pops entries from the head while {@code now - head > retention}.
     *
     * @return number of evicted entries
     */
    public int evictOlderThan(Instant now, Duration retention) {
        int evicted = 0;
        Instant head;
        while ((head = entries.peekFirst()) != null
                && Duration.between(head, now).compareTo(retention) > 0) {
            entries.pollFirst();
            evicted++;
        }
        return evicted;
    }

    public int count() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void clear() {
        entries.clear();
    }

    public Optional<Instant> oldest() {
        return Optional.ofNullable(entries.peekFirst());
    }

    @Override
    public String toString() {
        return "TimeWindow{count=" + entries.size() + ", oldest=" + entries.peekFirst() + '}';
    }
}
