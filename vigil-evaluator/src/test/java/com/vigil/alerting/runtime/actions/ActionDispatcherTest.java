package com.vigil.alerting.runtime.actions;

import com.vigil.alerting.api.ActionExecutor;
import com.vigil.alerting.api.model.ActionOutcome;
import com.vigil.alerting.api.model.Alert;
import com.vigil.alerting.api.model.AlertCategory;
import com.vigil.alerting.api.model.RemediationAction;
import com.vigil.alerting.api.model.Severity;
import com.vigil.alerting.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
class ActionDispatcherTest {

    private final Tracer tracer = OpenTelemetry.noop().getTracer("test");
    private final InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();

    @Mock
    private ActionExecutor executor;

    private ActionDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new ActionDispatcher(executor, Map.of(), Duration.ZERO, metrics, tracer);
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    private static Alert alert(AlertCategory category, String sourceId, String offendingIp) {
        Instant now = Instant.parse("2025-01-01T12:00:00Z");
        return new Alert("alert-0123456789abcdef0123456789abcdef", category, Severity.CRITICAL, "test",
                sourceId, null, offendingIp, now, now);
    }

    @ParameterizedTest
    @CsvSource({
            "HIGH_CPU_UTILIZATION, SCALE_OUT",
            "BRUTE_FORCE, BLOCK_SOURCE",
            "HIGH_ERROR_RATE, RESTART",
            "HIGH_MEMORY_UTILIZATION, CAPTURE_DIAGNOSTICS_AND_RESTART",
            "ML_ANOMALY, NOTIFY"
    })
    void defaultMapping(AlertCategory category, RemediationAction expected) {
        assertThat(dispatcher.actionFor(category)).isEqualTo(expected);
    }

    @Nested
    @DisplayName("exactly one executor call per alert")
    class OneCall {

        @Test
        void cpuScalesOutTheSource() {
            ActionOutcome outcome = dispatcher.dispatch(alert(AlertCategory.HIGH_CPU_UTILIZATION, "web-server", null));

            verify(executor).scaleOut("web-server");
            verifyNoMoreInteractions(executor);
            assertThat(outcome.success()).isTrue();
            assertThat(outcome.action()).isEqualTo(RemediationAction.SCALE_OUT);
            assertThat(outcome.target()).isEqualTo("web-server");
        }

        @Test
        void bruteForceBlocksTheOffendingIp() {
            dispatcher.dispatch(alert(AlertCategory.BRUTE_FORCE, "auth-service", "203.0.113.4"));

            verify(executor).blockSource("203.0.113.4");
            verifyNoMoreInteractions(executor);
        }

        @Test
        void errorRateRestarts() {
            dispatcher.dispatch(alert(AlertCategory.HIGH_ERROR_RATE, "database", null));

            verify(executor).restart("database");
            verifyNoMoreInteractions(executor);
        }

        @Test
        void memoryCapturesDiagnostics() {
            dispatcher.dispatch(alert(AlertCategory.HIGH_MEMORY_UTILIZATION, "analytics-engine", null));

            verify(executor).captureDiagnosticsAndRestart("analytics-engine");
            verifyNoMoreInteractions(executor);
        }

        @Test
        void unmappedCategoryNotifies() {
            Alert anomaly = alert(AlertCategory.ML_ANOMALY, "web-server", null);

            dispatcher.dispatch(anomaly);

            verify(executor).notify(anomaly);
            verifyNoMoreInteractions(executor);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("an executor exception becomes a failed outcome and is not retried")
        void executorThrows() {
            doThrow(new IllegalStateException("autoscaler unavailable")).when(executor).scaleOut(anyString());

            ActionOutcome outcome = dispatcher.dispatch(alert(AlertCategory.HIGH_CPU_UTILIZATION, "web-server", null));

            assertThat(outcome.success()).isFalse();
            assertThat(outcome.error()).isEqualTo("autoscaler unavailable");
            verify(executor, times(1)).scaleOut("web-server");
            assertThat(metrics.getCounterValue("action_failures_total", "action", "scale_out")).isEqualTo(1L);
        }

        @Test
        @DisplayName("blocking without an offending IP fails without calling the executor")
        void blockWithoutIp() {
            ActionOutcome outcome = dispatcher.dispatch(alert(AlertCategory.BRUTE_FORCE, "auth-service", null));

            assertThat(outcome.success()).isFalse();
            assertThat(outcome.error()).contains("No offending IP");
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("a call that overruns the timeout is cancelled")
        void timeout() {
            doAnswer(invocation -> {
                Thread.sleep(5_000);
                return null;
            }).when(executor).restart(anyString());

            try (ActionDispatcher bounded = new ActionDispatcher(executor, Map.of(), Duration.ofMillis(100),
                    metrics, tracer)) {
                ActionOutcome outcome = bounded.dispatch(alert(AlertCategory.HIGH_ERROR_RATE, "database", null));

                assertThat(outcome.success()).isFalse();
                assertThat(outcome.error()).contains("timed out after 100 ms");
                assertThat(outcome.duration()).isLessThan(Duration.ofSeconds(5));
            }
        }

        @Test
        @DisplayName("a sub-millisecond timeout is honoured rather than truncated to zero")
        void subMillisecondTimeout() {
            doAnswer(invocation -> {
                Thread.sleep(5_000);
                return null;
            }).when(executor).restart(anyString());

            try (ActionDispatcher bounded = new ActionDispatcher(executor, Map.of(), Duration.ofNanos(500_000),
                    metrics, tracer)) {
                ActionOutcome outcome = bounded.dispatch(alert(AlertCategory.HIGH_ERROR_RATE, "database", null));

                assertThat(outcome.success()).isFalse();
                assertThat(outcome.error()).contains("timed out after 500 us");
                assertThat(outcome.duration()).isGreaterThanOrEqualTo(Duration.ofNanos(500_000));
            }
        }

        @Test
        void fastCallWithinTimeoutSucceeds() {
            try (ActionDispatcher bounded = new ActionDispatcher(executor, Map.of(), Duration.ofSeconds(5),
                    metrics, tracer)) {
                ActionOutcome outcome = bounded.dispatch(alert(AlertCategory.HIGH_ERROR_RATE, "database", null));

                assertThat(outcome.success()).isTrue();
                verify(executor).restart("database");
            }
        }
    }

    @Test
    @DisplayName("overrides replace single entries of the default mapping")
    void overrides() {
        try (ActionDispatcher custom = new ActionDispatcher(executor,
                Map.of(AlertCategory.ML_ANOMALY, RemediationAction.RESTART), Duration.ZERO, metrics, tracer)) {

            custom.dispatch(alert(AlertCategory.ML_ANOMALY, "web-server", null));

            verify(executor).restart("web-server");
            assertThat(custom.actionFor(AlertCategory.HIGH_CPU_UTILIZATION)).isEqualTo(RemediationAction.SCALE_OUT);
        }
    }

    @Test
    void countsSuccessfulDispatches() {
        dispatcher.dispatch(alert(AlertCategory.HIGH_CPU_UTILIZATION, "web-server", null));
        dispatcher.dispatch(alert(AlertCategory.HIGH_CPU_UTILIZATION, "web-server", null));

        assertThat(metrics.getCounterValue("actions_dispatched_total", "action", "scale_out")).isEqualTo(2L);
        assertThat(metrics.getTimerRecordings("action_dispatch")).hasSize(2);
    }
}
