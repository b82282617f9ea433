package com.vigil.alerting.infra.metrics.impl.inmemory;

import com.vigil.alerting.infra.metrics.MetricsRegistry;
import com.vigil.alerting.infra.metrics.Timer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryMetricsRegistryTest {

    private final InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();

    @Test
    void counters_areKeyedByNameAndTags() {
        metrics.counter("alerts_raised_total", "category", "brute_force").increment();
        metrics.counter("alerts_raised_total", "category", "brute_force").increment(2);
        metrics.counter("alerts_raised_total", "category", "ml_anomaly").increment();

        assertThat(metrics.getCounterValue("alerts_raised_total", "category", "brute_force")).isEqualTo(3L);
        assertThat(metrics.getCounterValue("alerts_raised_total", "category", "ml_anomaly")).isEqualTo(1L);
        assertThat(metrics.getCounterValue("alerts_raised_total")).isZero();
    }

    @Test
    void gauge_keepsLastValue() {
        metrics.gauge("error_rate_alert_active").set(1.0);
        metrics.gauge("error_rate_alert_active").set(0.0);

        assertThat(metrics.getGaugeValue("error_rate_alert_active")).isZero();
    }

    @Test
    void timer_interpolatesPercentiles() {
        Timer timer = metrics.timer("event_processing");
        for (int i = 1; i <= 5; i++) {
            timer.record(Duration.ofMillis(i * 10L));
        }

        assertThat(metrics.getTimerRecordings("event_processing")).hasSize(5);
        assertThat(timer.percentile(0.5)).isEqualTo(Duration.ofMillis(30));
        assertThat(timer.percentile(0.0)).isEqualTo(Duration.ofMillis(10));
        assertThat(timer.percentile(0.875)).isEqualTo(Duration.ofMillis(45));
    }

    @Test
    void reset_clearsEverything() {
        metrics.counter("events_processed_total").increment();
        metrics.reset();

        assertThat(metrics.getCounterValue("events_processed_total")).isZero();
    }

    @Test
    @DisplayName("ServiceLoader picks the in-memory provider registered for tests")
    void serviceLoader_prefersInMemoryProviderInTests() {
        assertThat(MetricsRegistry.getInstance()).isInstanceOf(InMemoryMetricsRegistry.class);
    }
}
