/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.evaluation.rules;

import com.vigil.alerting.api.model.AlertCategory;
import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.api.model.Severity;
import com.vigil.alerting.infra.config.EngineConfig;
import com.vigil.alerting.runtime.evaluation.DetectionRule;
import com.vigil.alerting.runtime.evaluation.RuleContext;
import com.vigil.alerting.runtime.evaluation.RuleFiring;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Fires immediately on a CPU or memory spike event whose metric is strictly above
 * its threshold. Claims the alert slot.
 *
 * <p>A spike event without the matching metric is not applicable.
 */
public final class ResourceUtilizationRule implements DetectionRule {

    private final String cpuCategory;
    private final String memoryCategory;
    private final String cpuMetric;
    private final String memoryMetric;
    private final double cpuThreshold;
    private final double memoryThreshold;

    public ResourceUtilizationRule(EngineConfig config) {
        this.cpuCategory = config.getCpuSpikeCategory();
        this.memoryCategory = config.getMemorySpikeCategory();
        this.cpuMetric = config.getCpuMetric();
        this.memoryMetric = config.getMemoryMetric();
        this.cpuThreshold = config.getCpuThresholdPct();
        this.memoryThreshold = config.getMemoryThresholdPct();
    }

    @Override
    public String name() {
        return "resource-utilization";
    }

    @Override
    public Optional<RuleFiring> evaluate(RuleContext context) {
        Event event = context.event();
        if (cpuCategory.equals(event.category())) {
            OptionalDouble cpu = event.metric(cpuMetric);
            if (cpu.isPresent() && cpu.getAsDouble() > cpuThreshold) {
                return Optional.of(RuleFiring.of(AlertCategory.HIGH_CPU_UTILIZATION, Severity.CRITICAL,
                        String.format(Locale.ROOT, "CPU usage at %.2f%%", cpu.getAsDouble())));
            }
        } else if (memoryCategory.equals(event.category())) {
            OptionalDouble memory = event.metric(memoryMetric);
            if (memory.isPresent() && memory.getAsDouble() > memoryThreshold) {
                return Optional.of(RuleFiring.of(AlertCategory.HIGH_MEMORY_UTILIZATION, Severity.WARNING,
                        String.format(Locale.ROOT, "Memory usage at %.2f%%", memory.getAsDouble())));
            }
        }
        return Optional.empty();
    }
}
