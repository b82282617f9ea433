/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.service.repository;

import com.vigil.alerting.api.model.Event;

/**
 * A processed event as kept in the event log.
 *
 * @param sequenceId insertion number, starting at 1
 */
public record EventLogEntry(long sequenceId, Event event) {
}
