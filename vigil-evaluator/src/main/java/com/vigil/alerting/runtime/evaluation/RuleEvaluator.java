/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.runtime.evaluation;

import com.vigil.alerting.api.AnomalyModel;
import com.vigil.alerting.api.model.AnomalyVerdict;
import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.infra.config.EngineConfig;
import com.vigil.alerting.runtime.anomaly.AnomalyModelRegistry;
import com.vigil.alerting.runtime.evaluation.rules.AnomalyRule;
import com.vigil.alerting.runtime.evaluation.rules.BruteForceRule;
import com.vigil.alerting.runtime.evaluation.rules.ErrorRateRule;
import com.vigil.alerting.runtime.evaluation.rules.ResourceUtilizationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Runs the detection rules over one event and resolves them to at most one firing.
 *
 * <p>Evaluation is split in two steps so the caller can keep the anomaly model
 * outside its lock:
 * <ol>
 *   <li>{@link #observeAnomaly(Event)} feeds the source's model; safe to call
 *       concurrently for different sources.</li>
 *   <li>{@link #evaluate(Event, AnomalySample)} runs the rules against the shared
 *       {@link DetectionState}; the caller must serialize these calls.</li>
 * </ol>
 *
 * <p>Rule order is utilization, anomaly, brute force, error rate. The last firing
 * wins; rules that only fill an empty slot stay silent when it is taken.
 */
public final class RuleEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(RuleEvaluator.class);

    private final EngineConfig config;
    private final AnomalyModelRegistry anomalyModels;
    private final DetectionState state = new DetectionState();
    private final List<DetectionRule> rules;

    public RuleEvaluator(EngineConfig config, AnomalyModelRegistry anomalyModels) {
        this(config, anomalyModels, List.of(
                new ResourceUtilizationRule(config),
                new AnomalyRule(),
                new BruteForceRule(config),
                new ErrorRateRule(config)));
    }

    RuleEvaluator(EngineConfig config, AnomalyModelRegistry anomalyModels, List<DetectionRule> rules) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.anomalyModels = Objects.requireNonNull(anomalyModels, "anomalyModels must not be null");
        this.rules = List.copyOf(rules);
        logger.info("Rule evaluator initialized with {} rules: {}", this.rules.size(),
                this.rules.stream().map(DetectionRule::name).toList());
    }

    /**
     * Feeds the event's (cpu, memory) pair to its source's anomaly model.
     *
     * <p>A missing metric is replaced by its configured nominal value; an event with
     * neither metric leaves the model untouched.
     */
    public AnomalySample observeAnomaly(Event event) {
        OptionalDouble cpu = event.metric(config.getCpuMetric());
        OptionalDouble memory = event.metric(config.getMemoryMetric());
        if (cpu.isEmpty() && memory.isEmpty()) {
            return AnomalySample.ABSENT;
        }
        double cpuPct = cpu.orElse(config.getAnomalyDefaultCpuPct());
        double memoryPct = memory.orElse(config.getAnomalyDefaultMemoryPct());

        AnomalyModel model = anomalyModels.modelFor(event.sourceId());
        AnomalyVerdict verdict = model.observe(cpuPct, memoryPct);
        if (verdict.isAnomaly()) {
            logger.debug("Anomaly for {}: score={} cpu={} mem={}", event.sourceId(), verdict.score(),
                    cpuPct, memoryPct);
        }
        return new AnomalySample(cpuPct, memoryPct, verdict);
    }

    /**
     * Runs every rule in order. Callers must hold the lock that guards {@link #state()}.
     *
     * @return the firing that holds the slot after all rules ran
     */
    public Optional<RuleFiring> evaluate(Event event, AnomalySample anomaly) {
        RuleFiring slot = null;
        for (DetectionRule rule : rules) {
            Optional<RuleFiring> firing = rule.evaluate(new RuleContext(event, anomaly, state, slot != null));
            if (firing.isPresent()) {
                if (slot != null) {
                    logger.debug("Rule {} replaced {} for event from {}", rule.name(), slot.category(),
                            event.sourceId());
                }
                slot = firing.get();
            }
        }
        return Optional.ofNullable(slot);
    }

    public DetectionState state() {
        return state;
    }

    public AnomalyModelRegistry anomalyModels() {
        return anomalyModels;
    }

    public List<DetectionRule> rules() {
        return rules;
    }
}
