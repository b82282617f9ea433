/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.repository;

import com.vigil.alerting.api.AlertSink;
import com.vigil.alerting.api.exception.InvalidStatusTransitionException;
import com.vigil.alerting.api.model.Alert;
import com.vigil.alerting.api.model.AlertStatus;
import com.vigil.alerting.api.model.Severity;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * In-memory implementation of AlertRepository.
 *
 * <p>Records are kept in a skip list keyed by sequence id, with a side index from
 * alert id to the latest sequence id. Alerts are lost on restart.
 *
 * <p>Also an {@link AlertSink}, so it can be handed straight to the engine.
 *
 * <p><b>Thread Safety:</b> Writes are serialized; reads see a consistent record but
 * not necessarily the latest write.
 */
public class InMemoryAlertRepository implements AlertRepository, AlertSink {

    private static final Logger logger = Logger.getLogger(InMemoryAlertRepository.class.getName());
    private static final int SUMMARY_BUCKETS = 20;

    private final ConcurrentNavigableMap<Long, AlertRecord> records = new ConcurrentSkipListMap<>();
    private final ConcurrentMap<String, Long> latestByAlertId = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryAlertRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryAlertRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void publish(Alert alert) {
        save(alert);
    }

    @Override
    public synchronized AlertRecord save(Alert alert) {
        long id = sequence.incrementAndGet();
        AlertRecord record = AlertRecord.open(id, alert, clock.instant());
        records.put(id, record);
        latestByAlertId.put(alert.alertId(), id);
        logger.fine(() -> "Stored alert #" + id + " " + alert.alertId());
        return record;
    }

    @Override
    public Optional<AlertRecord> findByAlertId(String alertId) {
        Long id = latestByAlertId.get(alertId);
        return id == null ? Optional.empty() : Optional.ofNullable(records.get(id));
    }

    @Override
    public List<AlertRecord> findRecent(int limit) {
        return records.descendingMap().values().stream()
                .limit(AlertRepository.clampLimit(limit))
                .collect(Collectors.toList());
    }

    @Override
    public List<AlertRecord> findSince(long afterSequenceId, int limit) {
        return records.tailMap(afterSequenceId, false).values().stream()
                .limit(AlertRepository.clampLimit(limit))
                .collect(Collectors.toList());
    }

    @Override
    public long latestSequenceId() {
        return sequence.get();
    }

    @Override
    public synchronized Optional<AlertRecord> updateStatus(String alertId, String status) {
        AlertStatus target = AlertStatus.parse(status)
                .orElseThrow(() -> new InvalidStatusTransitionException(
                        status == null ? "null" : status.toUpperCase(Locale.ROOT)));

        Long id = latestByAlertId.get(alertId);
        if (id == null) {
            return Optional.empty();
        }
        AlertRecord updated = records.get(id).withStatus(target, clock.instant());
        records.put(id, updated);
        logger.info(() -> "Alert " + alertId + " -> " + target);
        return Optional.of(updated);
    }

    @Override
    public AlertSummary summary() {
        List<AlertRecord> snapshot = new ArrayList<>(records.values());

        long critical = 0;
        Map<AlertStatus, Long> byStatus = new EnumMap<>(AlertStatus.class);
        Map<String, Long> bySource = new HashMap<>();
        TreeMap<Instant, Long> byMinute = new TreeMap<>();
        for (AlertRecord record : snapshot) {
            Alert alert = record.alert();
            if (alert.severity() == Severity.CRITICAL) {
                critical++;
            }
            byStatus.merge(record.status(), 1L, Long::sum);
            bySource.merge(alert.sourceId(), 1L, Long::sum);
            byMinute.merge(alert.createdAt().truncatedTo(ChronoUnit.MINUTES), 1L, Long::sum);
        }

        Optional<Map.Entry<String, Long>> top = bySource.entrySet().stream()
                .max(Comparator.<Map.Entry<String, Long>>comparingLong(Map.Entry::getValue)
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()));

        List<AlertSummary.MinuteBucket> buckets = byMinute.descendingMap().entrySet().stream()
                .limit(SUMMARY_BUCKETS)
                .map(e -> new AlertSummary.MinuteBucket(e.getKey(), e.getValue()))
                .sorted(Comparator.comparing(AlertSummary.MinuteBucket::minute))
                .collect(Collectors.toList());

        return new AlertSummary(
                snapshot.size(),
                critical,
                byStatus.getOrDefault(AlertStatus.OPEN, 0L),
                byStatus.getOrDefault(AlertStatus.ACKNOWLEDGED, 0L),
                byStatus.getOrDefault(AlertStatus.SUPPRESSED, 0L),
                top.map(Map.Entry::getKey).orElse(null),
                top.map(Map.Entry::getValue).orElse(0L),
                buckets);
    }

    @Override
    public long count() {
        return records.size();
    }

    public synchronized void clear() {
        records.clear();
        latestByAlertId.clear();
        sequence.set(0);
    }
}
