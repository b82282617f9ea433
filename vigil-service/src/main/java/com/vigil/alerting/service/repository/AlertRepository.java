/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.repository;

import com.vigil.alerting.api.model.Alert;

import java.util.List;
import java.util.Optional;

/**
 * Storage for raised alerts and their acknowledge / suppress lifecycle.
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe.
 */
public interface AlertRepository {

    int MAX_PAGE_SIZE = 1000;

    /**
     * Stores a new alert with status OPEN.
     *
     * @return the stored record
     */
    AlertRecord save(Alert alert);

    /**
     * Latest record stored under the given alert id.
     */
    Optional<AlertRecord> findByAlertId(String alertId);

    /**
     * Newest first.
     *
     * @param limit clamped to 1..{@value #MAX_PAGE_SIZE}
     */
    List<AlertRecord> findRecent(int limit);

    /**
     * Records with a sequence id greater than {@code afterSequenceId}, oldest first.
     *
     * @param limit clamped to 1..{@value #MAX_PAGE_SIZE}
     */
    List<AlertRecord> findSince(long afterSequenceId, int limit);

    /**
     * @return the highest sequence id handed out, 0 when empty
     */
    long latestSequenceId();

    /**
     * Moves an alert to a new status.
     *
     * @param status OPEN, ACKNOWLEDGED or SUPPRESSED, case-insensitive
     * @return the updated record, or empty if no alert has this id
     * @throws com.vigil.alerting.api.exception.InvalidStatusTransitionException for any other status
     */
    Optional<AlertRecord> updateStatus(String alertId, String status);

    AlertSummary summary();

    long count();

    static int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
    }
}
