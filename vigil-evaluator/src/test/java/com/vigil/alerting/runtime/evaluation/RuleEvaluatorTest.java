package com.vigil.alerting.runtime.evaluation;

import com.vigil.alerting.api.model.AlertCategory;
import com.vigil.alerting.api.model.AnomalyVerdict;
import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.infra.config.EngineConfig;
import com.vigil.alerting.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.vigil.alerting.runtime.anomaly.AnomalyModelRegistry;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.vigil.alerting.runtime.evaluation.TestEvents.authFailure;
import static com.vigil.alerting.runtime.evaluation.TestEvents.cpuSpike;
import static com.vigil.alerting.runtime.evaluation.TestEvents.error;
import static com.vigil.alerting.runtime.evaluation.TestEvents.normal;
import static com.vigil.alerting.runtime.evaluation.TestEvents.usage;
import static org.assertj.core.api.Assertions.assertThat;

class RuleEvaluatorTest {

    private static final AnomalySample FLAGGED = new AnomalySample(95.0, 95.0, AnomalyVerdict.anomaly(-0.41));

    private EngineConfig config;
    private AnomalyModelRegistry registry;
    private RuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        config = EngineConfig.defaults();
        registry = new AnomalyModelRegistry(config, new InMemoryMetricsRegistry(),
                OpenTelemetry.noop().getTracer("test"));
        evaluator = new RuleEvaluator(config, registry);
    }

    @Test
    void runsRulesInDocumentedOrder() {
        assertThat(evaluator.rules()).extracting(DetectionRule::name)
                .containsExactly("resource-utilization", "ml-anomaly", "brute-force", "error-rate");
    }

    @Nested
    @DisplayName("alert slot precedence")
    class SlotPrecedence {

        @Test
        @DisplayName("a utilization alert suppresses an anomaly on the same event")
        void utilizationBeatsAnomaly() {
            Optional<RuleFiring> firing = evaluator.evaluate(cpuSpike(97.0, 0), FLAGGED);

            assertThat(firing).map(RuleFiring::category).contains(AlertCategory.HIGH_CPU_UTILIZATION);
        }

        @Test
        @DisplayName("brute force replaces an anomaly already in the slot")
        void bruteForceOverrides() {
            for (int i = 0; i < 4; i++) {
                evaluator.evaluate(authFailure("203.0.113.5", i), AnomalySample.ABSENT);
            }

            Optional<RuleFiring> firing = evaluator.evaluate(authFailure("203.0.113.5", 4), FLAGGED);

            assertThat(firing).map(RuleFiring::category).contains(AlertCategory.BRUTE_FORCE);
        }

        @Test
        @DisplayName("an error-rate crossing swallowed by another alert does not fire later")
        void errorRateSwallowed() {
            for (int i = 0; i < 8; i++) {
                evaluator.evaluate(normal(i), AnomalySample.ABSENT);
            }
            evaluator.evaluate(error(8), AnomalySample.ABSENT);

            Optional<RuleFiring> crossing = evaluator.evaluate(error(9), FLAGGED);

            assertThat(crossing).map(RuleFiring::category).contains(AlertCategory.ML_ANOMALY);
            assertThat(evaluator.state().isErrorRateAlertActive()).isTrue();
            assertThat(evaluator.evaluate(error(10), AnomalySample.ABSENT)).isEmpty();
        }

        @Test
        void quietEventRaisesNothing() {
            assertThat(evaluator.evaluate(normal(0), AnomalySample.ABSENT)).isEmpty();
        }
    }

    @Nested
    @DisplayName("anomaly model feeding")
    class AnomalyFeeding {

        @Test
        @DisplayName("events without either metric never create a model")
        void noMetricsNoModel() {
            Event bare = Event.builder()
                    .timestamp(TestEvents.T0)
                    .sourceId("auth-service")
                    .category("auth_success")
                    .build();

            assertThat(evaluator.observeAnomaly(bare)).isSameAs(AnomalySample.ABSENT);
            assertThat(registry.activeModels()).isZero();
        }

        @Test
        @DisplayName("a missing metric is filled with its nominal default")
        void defaultsForMissingMetric() {
            AnomalySample sample = evaluator.observeAnomaly(TestEvents.memorySpike(92.0, 0));

            assertThat(sample.cpuPct()).isEqualTo(config.getAnomalyDefaultCpuPct());
            assertThat(sample.memoryPct()).isEqualTo(92.0);
            assertThat(registry.modelFor("analytics-engine").samplesSeen()).isEqualTo(1L);
        }

        @Test
        @DisplayName("each source gets its own model")
        void perSourceModels() {
            evaluator.observeAnomaly(usage("web-server", 20, 40, 0));
            evaluator.observeAnomaly(usage("database", 30, 45, 1));
            evaluator.observeAnomaly(usage("web-server", 21, 41, 2));

            assertThat(registry.activeModels()).isEqualTo(2);
            assertThat(registry.modelFor("web-server").samplesSeen()).isEqualTo(2L);
        }

        @Test
        @DisplayName("no verdict before the model is trained")
        void untrainedModel() {
            AnomalySample sample = evaluator.observeAnomaly(usage("web-server", 99, 99, 0));

            assertThat(sample.isPresent()).isTrue();
            assertThat(sample.verdict().hasVerdict()).isFalse();
        }
    }
}
