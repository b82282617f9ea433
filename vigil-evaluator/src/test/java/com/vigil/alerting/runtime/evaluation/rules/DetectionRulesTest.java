package com.vigil.alerting.runtime.evaluation.rules;

import com.vigil.alerting.api.model.AlertCategory;
import com.vigil.alerting.api.model.AnomalyVerdict;
import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.api.model.Severity;
import com.vigil.alerting.infra.config.EngineConfig;
import com.vigil.alerting.runtime.evaluation.AnomalySample;
import com.vigil.alerting.runtime.evaluation.DetectionRule;
import com.vigil.alerting.runtime.evaluation.DetectionState;
import com.vigil.alerting.runtime.evaluation.RuleContext;
import com.vigil.alerting.runtime.evaluation.RuleFiring;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static com.vigil.alerting.runtime.evaluation.TestEvents.authFailure;
import static com.vigil.alerting.runtime.evaluation.TestEvents.cpuSpike;
import static com.vigil.alerting.runtime.evaluation.TestEvents.error;
import static com.vigil.alerting.runtime.evaluation.TestEvents.memorySpike;
import static com.vigil.alerting.runtime.evaluation.TestEvents.normal;
import static org.assertj.core.api.Assertions.assertThat;

class DetectionRulesTest {

    private final EngineConfig config = EngineConfig.defaults();
    private final DetectionState state = new DetectionState();

    private Optional<RuleFiring> run(DetectionRule rule, Event event) {
        return rule.evaluate(new RuleContext(event, AnomalySample.ABSENT, state, false));
    }

    private Optional<RuleFiring> runWithSlotTaken(DetectionRule rule, Event event) {
        return rule.evaluate(new RuleContext(event, AnomalySample.ABSENT, state, true));
    }

    @Nested
    @DisplayName("resource utilization")
    class ResourceUtilization {

        private final ResourceUtilizationRule rule = new ResourceUtilizationRule(config);

        @Test
        @DisplayName("CPU exactly at the threshold does not fire")
        void thresholdIsStrict() {
            assertThat(run(rule, cpuSpike(80.0, 0))).isEmpty();
        }

        @Test
        void cpuAboveThresholdIsCritical() {
            RuleFiring firing = run(rule, cpuSpike(95.0, 0)).orElseThrow();

            assertThat(firing.category()).isEqualTo(AlertCategory.HIGH_CPU_UTILIZATION);
            assertThat(firing.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(firing.description()).isEqualTo("CPU usage at 95.00%");
        }

        @Test
        void memoryAboveThresholdIsWarning() {
            RuleFiring firing = run(rule, memorySpike(91.2, 0)).orElseThrow();

            assertThat(firing.category()).isEqualTo(AlertCategory.HIGH_MEMORY_UTILIZATION);
            assertThat(firing.severity()).isEqualTo(Severity.WARNING);
            assertThat(firing.description()).isEqualTo("Memory usage at 91.20%");
        }

        @Test
        @DisplayName("a spike event without its metric is not applicable")
        void missingMetric() {
            Event noMetric = Event.builder()
                    .timestamp(normal(0).timestamp())
                    .sourceId("web-server")
                    .category("cpu_utilization_spike")
                    .build();

            assertThat(run(rule, noMetric)).isEmpty();
        }

        @Test
        @DisplayName("high CPU on a non-spike event is left to the anomaly model")
        void onlySpikeCategories() {
            Event busy = Event.builder()
                    .timestamp(normal(0).timestamp())
                    .sourceId("web-server")
                    .category("normal_operation")
                    .metric("cpu_usage", 99.0)
                    .build();

            assertThat(run(rule, busy)).isEmpty();
        }

        @Test
        void honoursConfiguredThreshold() {
            ResourceUtilizationRule strict = new ResourceUtilizationRule(
                    config.toBuilder().cpuThresholdPct(60.0).build());

            assertThat(run(strict, cpuSpike(65.0, 0))).isPresent();
        }
    }

    @Nested
    @DisplayName("anomaly")
    class Anomaly {

        private final AnomalyRule rule = new AnomalyRule();

        @Test
        void describesScoreAndSample() {
            AnomalySample sample = new AnomalySample(95.0, 95.0, AnomalyVerdict.anomaly(-0.4099));

            RuleFiring firing = rule.evaluate(new RuleContext(normal(0), sample, state, false)).orElseThrow();

            assertThat(firing.category()).isEqualTo(AlertCategory.ML_ANOMALY);
            assertThat(firing.severity()).isEqualTo(Severity.WARNING);
            assertThat(firing.description())
                    .isEqualTo("ML model detected anomaly (score -0.41) [CPU 95.0%, Mem 95.0%] for web-server");
        }

        @Test
        void staysSilentWhenSlotTaken() {
            AnomalySample sample = new AnomalySample(95.0, 95.0, AnomalyVerdict.anomaly(-0.3));

            assertThat(rule.evaluate(new RuleContext(normal(0), sample, state, true))).isEmpty();
        }

        @Test
        void ignoresNormalAndMissingVerdicts() {
            AnomalySample normalSample = new AnomalySample(20.0, 40.0, AnomalyVerdict.normal(0.05));

            assertThat(rule.evaluate(new RuleContext(normal(0), normalSample, state, false))).isEmpty();
            assertThat(rule.evaluate(new RuleContext(normal(0), AnomalySample.ABSENT, state, false))).isEmpty();
        }
    }

    @Nested
    @DisplayName("brute force")
    class BruteForce {

        private final BruteForceRule rule = new BruteForceRule(config);

        @Test
        @DisplayName("N-1 failures stay silent, the Nth fires and clears the window")
        void firesOnNthFailure() {
            for (int i = 0; i < 4; i++) {
                assertThat(run(rule, authFailure("203.0.113.7", i * 10L))).isEmpty();
            }

            RuleFiring firing = run(rule, authFailure("203.0.113.7", 40)).orElseThrow();

            assertThat(firing.category()).isEqualTo(AlertCategory.BRUTE_FORCE);
            assertThat(firing.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(firing.description()).isEqualTo("5 failed login attempts in 60s");
            assertThat(firing.offendingIp()).isEqualTo("203.0.113.7");
            assertThat(state.authFailures().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("the offending IP is the one on the triggering event")
        void blamesTriggeringEvent() {
            for (int i = 0; i < 4; i++) {
                run(rule, authFailure("203.0.113.1" + i, i));
            }

            assertThat(run(rule, authFailure("203.0.113.99", 5)).orElseThrow().offendingIp())
                    .isEqualTo("203.0.113.99");
        }

        @Test
        @DisplayName("failures more than the window apart never accumulate")
        void spreadOutFailures() {
            for (int i = 0; i < 10; i++) {
                assertThat(run(rule, authFailure("203.0.113.7", i * 61L))).isEmpty();
            }
            assertThat(state.authFailures().count()).isEqualTo(1);
        }

        @Test
        @DisplayName("a failure exactly one window old still counts")
        void windowBoundaryIsInclusive() {
            for (int i = 0; i < 4; i++) {
                run(rule, authFailure("203.0.113.7", i * 15L));
            }

            assertThat(run(rule, authFailure("203.0.113.7", 60))).isPresent();
        }

        @Test
        void overridesAnOccupiedSlot() {
            for (int i = 0; i < 4; i++) {
                runWithSlotTaken(rule, authFailure("203.0.113.7", i));
            }

            assertThat(runWithSlotTaken(rule, authFailure("203.0.113.7", 4))).isPresent();
        }

        @Test
        void otherCategoriesLeaveTheWindowAlone() {
            run(rule, authFailure("203.0.113.7", 0));
            run(rule, normal(1));
            run(rule, error(2));

            assertThat(state.authFailures().count()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("error rate")
    class ErrorRate {

        private final ErrorRateRule rule = new ErrorRateRule(config);

        @Test
        @DisplayName("nothing happens below the minimum sample count")
        void minimumSamples() {
            for (int i = 0; i < 9; i++) {
                assertThat(run(rule, error(i))).isEmpty();
            }
            assertThat(state.isErrorRateAlertActive()).isFalse();

            assertThat(run(rule, error(9))).isPresent();
        }

        @Test
        @DisplayName("2 errors in 10 events reach the 20% threshold")
        void firesAtThreshold() {
            for (int i = 0; i < 8; i++) {
                run(rule, normal(i));
            }
            assertThat(run(rule, error(8))).isEmpty();

            RuleFiring firing = run(rule, error(9)).orElseThrow();

            assertThat(firing.category()).isEqualTo(AlertCategory.HIGH_ERROR_RATE);
            assertThat(firing.severity()).isEqualTo(Severity.ERROR);
            assertThat(firing.description()).isEqualTo("Error rate 20.00% over last 10 events in 60s");
            assertThat(state.isErrorRateAlertActive()).isTrue();
        }

        @Test
        @DisplayName("fires once per crossing, re-arms after dropping below")
        void hysteresis() {
            for (int i = 0; i < 8; i++) {
                run(rule, normal(i));
            }
            run(rule, error(8));
            assertThat(run(rule, error(9))).isPresent();

            assertThat(run(rule, error(10))).isEmpty();
            assertThat(state.isErrorRateAlertActive()).isTrue();

            // 3 errors out of 12..15 events stays at or above 20%
            for (int i = 11; i <= 14; i++) {
                assertThat(run(rule, normal(i))).isEmpty();
            }
            assertThat(state.isErrorRateAlertActive()).isTrue();

            // 3 of 16 drops below and re-arms
            assertThat(run(rule, normal(15))).isEmpty();
            assertThat(state.isErrorRateAlertActive()).isFalse();

            RuleFiring again = run(rule, error(16)).orElseThrow();
            assertThat(again.description()).isEqualTo("Error rate 23.53% over last 17 events in 60s");
        }

        @Test
        @DisplayName("a crossing swallowed by another alert still raises the flag")
        void swallowedCrossing() {
            for (int i = 0; i < 8; i++) {
                run(rule, normal(i));
            }
            run(rule, error(8));

            assertThat(runWithSlotTaken(rule, error(9))).isEmpty();
            assertThat(state.isErrorRateAlertActive()).isTrue();

            assertThat(run(rule, error(10))).isEmpty();
        }

        @Test
        @DisplayName("events older than the window stop counting")
        void windowEviction() {
            for (int i = 0; i < 10; i++) {
                run(rule, error(i));
            }

            assertThat(run(rule, normal(200))).isEmpty();
            assertThat(state.allEvents().count()).isEqualTo(1);
            assertThat(state.errorEvents().count()).isZero();
        }

        @ParameterizedTest
        @ValueSource(strings = {"connection_timeout", "database_error"})
        void countsConfiguredErrorCategories(String category) {
            Event event = Event.builder()
                    .timestamp(normal(0).timestamp())
                    .sourceId("database")
                    .category(category)
                    .build();

            run(rule, event);

            assertThat(state.errorEvents().count()).isEqualTo(1);
        }
    }
}
