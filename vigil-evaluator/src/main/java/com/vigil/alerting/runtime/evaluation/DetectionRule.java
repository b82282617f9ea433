/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.evaluation;

import java.util.Optional;

/**
 * One detection rule in the per-event pass.
 *
 * <p>Rules run in a fixed order and each sees whether the alert slot is already
 * taken. A rule that must not displace an earlier firing returns empty when
 * {@link RuleContext#slotTaken()} is set; a rule that returns a firing while the
 * slot is taken replaces the earlier one. Rules still update their windows and
 * flags when they stay silent.
 */
public interface DetectionRule {

    String name();

    Optional<RuleFiring> evaluate(RuleContext context);
}
