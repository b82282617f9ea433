package com.vigil.alerting.service.repository;

import com.vigil.alerting.api.exception.InvalidStatusTransitionException;
import com.vigil.alerting.api.model.Alert;
import com.vigil.alerting.api.model.AlertCategory;
import com.vigil.alerting.api.model.AlertStatus;
import com.vigil.alerting.api.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryAlertRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:15:30Z");

    private InMemoryAlertRepository repository;
    private int counter;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAlertRepository(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Alert alert(String sourceId, Severity severity, Instant createdAt) {
        counter++;
        return new Alert(String.format("alert-%032x", counter), AlertCategory.HIGH_CPU_UTILIZATION, severity,
                "CPU usage at 95.00%", sourceId, null, null, createdAt, createdAt);
    }

    private Alert alert() {
        return alert("web-server", Severity.CRITICAL, NOW);
    }

    @Test
    @DisplayName("new alerts are OPEN with increasing sequence ids")
    void saveAssignsSequence() {
        AlertRecord first = repository.save(alert());
        AlertRecord second = repository.save(alert());

        assertThat(first.sequenceId()).isEqualTo(1L);
        assertThat(second.sequenceId()).isEqualTo(2L);
        assertThat(first.status()).isEqualTo(AlertStatus.OPEN);
        assertThat(first.updatedAt()).isEqualTo(NOW);
        assertThat(repository.latestSequenceId()).isEqualTo(2L);
    }

    @Test
    void publishingStoresTheAlert() {
        Alert alert = alert();

        repository.publish(alert);

        assertThat(repository.findByAlertId(alert.alertId())).map(AlertRecord::alert).contains(alert);
    }

    @Nested
    @DisplayName("status updates")
    class StatusUpdates {

        @Test
        void acknowledgeStampsTime() {
            Alert alert = alert();
            repository.save(alert);

            AlertRecord updated = repository.updateStatus(alert.alertId(), "ACKNOWLEDGED").orElseThrow();

            assertThat(updated.status()).isEqualTo(AlertStatus.ACKNOWLEDGED);
            assertThat(updated.acknowledgedAt()).isEqualTo(NOW);
            assertThat(updated.suppressedAt()).isNull();
            assertThat(repository.findByAlertId(alert.alertId())).contains(updated);
        }

        @Test
        @DisplayName("status names are case-insensitive and earlier stamps are kept")
        void suppressAfterAcknowledge() {
            Alert alert = alert();
            repository.save(alert);
            repository.updateStatus(alert.alertId(), "acknowledged");

            AlertRecord updated = repository.updateStatus(alert.alertId(), "Suppressed").orElseThrow();

            assertThat(updated.status()).isEqualTo(AlertStatus.SUPPRESSED);
            assertThat(updated.acknowledgedAt()).isEqualTo(NOW);
            assertThat(updated.suppressedAt()).isEqualTo(NOW);
        }

        @Test
        void reopening() {
            Alert alert = alert();
            repository.save(alert);
            repository.updateStatus(alert.alertId(), "SUPPRESSED");

            assertThat(repository.updateStatus(alert.alertId(), "open"))
                    .map(AlertRecord::status).contains(AlertStatus.OPEN);
        }

        @ParameterizedTest
        @ValueSource(strings = {"closed", "RESOLVED", ""})
        void unknownStatusIsRejected(String status) {
            Alert alert = alert();
            repository.save(alert);

            assertThatThrownBy(() -> repository.updateStatus(alert.alertId(), status))
                    .isInstanceOf(InvalidStatusTransitionException.class)
                    .hasMessageStartingWith("Unsupported status: ");
            assertThat(repository.findByAlertId(alert.alertId()))
                    .map(AlertRecord::status).contains(AlertStatus.OPEN);
        }

        @Test
        void unknownAlertIsEmpty() {
            assertThat(repository.updateStatus("alert-missing", "ACKNOWLEDGED")).isEmpty();
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @BeforeEach
        void fill() {
            for (int i = 0; i < 5; i++) {
                repository.save(alert());
            }
        }

        @Test
        void recentIsNewestFirst() {
            List<AlertRecord> recent = repository.findRecent(3);

            assertThat(recent).extracting(AlertRecord::sequenceId).containsExactly(5L, 4L, 3L);
        }

        @Test
        @DisplayName("limits are clamped to 1..1000")
        void limitsAreClamped() {
            assertThat(repository.findRecent(0)).hasSize(1);
            assertThat(repository.findRecent(-7)).hasSize(1);
            assertThat(repository.findRecent(50_000)).hasSize(5);
            assertThat(AlertRepository.clampLimit(50_000)).isEqualTo(1000);
        }

        @Test
        void sinceIsOldestFirstAndExclusive() {
            assertThat(repository.findSince(2, 10)).extracting(AlertRecord::sequenceId)
                    .containsExactly(3L, 4L, 5L);
            assertThat(repository.findSince(5, 10)).isEmpty();
            assertThat(repository.findSince(0, 2)).extracting(AlertRecord::sequenceId)
                    .containsExactly(1L, 2L);
        }
    }

    @Test
    @DisplayName("summary counts severities, statuses, top source and minute buckets")
    void summary() {
        Instant minute = Instant.parse("2025-03-10T09:00:10Z");
        repository.save(alert("web-server", Severity.CRITICAL, minute));
        repository.save(alert("web-server", Severity.WARNING, minute.plusSeconds(20)));
        Alert dbAlert = alert("database", Severity.ERROR, minute.plusSeconds(70));
        repository.save(dbAlert);
        repository.updateStatus(dbAlert.alertId(), "ACKNOWLEDGED");

        AlertSummary summary = repository.summary();

        assertThat(summary.totalAlerts()).isEqualTo(3L);
        assertThat(summary.criticalAlerts()).isEqualTo(1L);
        assertThat(summary.openAlerts()).isEqualTo(2L);
        assertThat(summary.acknowledgedAlerts()).isEqualTo(1L);
        assertThat(summary.suppressedAlerts()).isZero();
        assertThat(summary.topSource()).isEqualTo("web-server");
        assertThat(summary.topSourceAlerts()).isEqualTo(2L);
        assertThat(summary.alertsOverTime()).containsExactly(
                new AlertSummary.MinuteBucket(Instant.parse("2025-03-10T09:00:00Z"), 2L),
                new AlertSummary.MinuteBucket(Instant.parse("2025-03-10T09:01:00Z"), 1L));
    }

    @Test
    @DisplayName("only the latest 20 minute buckets are reported")
    void summaryKeepsLastTwentyBuckets() {
        Instant start = Instant.parse("2025-03-10T08:00:00Z");
        for (int i = 0; i < 25; i++) {
            repository.save(alert("web-server", Severity.WARNING, start.plusSeconds(60L * i)));
        }

        List<AlertSummary.MinuteBucket> buckets = repository.summary().alertsOverTime();

        assertThat(buckets).hasSize(20);
        assertThat(buckets.get(0).minute()).isEqualTo(start.plusSeconds(60L * 5));
        assertThat(buckets.get(19).minute()).isEqualTo(start.plusSeconds(60L * 24));
    }

    @Test
    void emptySummary() {
        AlertSummary summary = repository.summary();

        assertThat(summary.totalAlerts()).isZero();
        assertThat(summary.topSource()).isNull();
        assertThat(summary.alertsOverTime()).isEmpty();
    }
}
