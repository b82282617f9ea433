/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.evaluation;

import com.vigil.alerting.api.model.Event;

/**
 * Inputs of one rule invocation.
 *
 * @param slotTaken whether an earlier rule already fired for this event
 */
public record RuleContext(Event event, AnomalySample anomaly, DetectionState state, boolean slotTaken) {
}
