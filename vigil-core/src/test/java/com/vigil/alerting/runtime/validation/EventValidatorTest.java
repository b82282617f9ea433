package com.vigil.alerting.runtime.validation;

import com.vigil.alerting.api.exception.EventValidationException;
import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.api.model.EventLevel;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventValidatorTest {

    private final EventValidator validator = new EventValidator();

    @Test
    void wellFormedEventPasses() {
        Event event = Event.builder()
                .timestamp(Instant.now())
                .sourceId("web-server")
                .category("normal_operation")
                .metric("cpu_usage", 22.0)
                .build();

        assertThatCode(() -> validator.validate(event)).doesNotThrowAnyException();
    }

    @Test
    void everyViolationIsReported() {
        Event event = new Event(null, " ", null, null, Map.of(), null, null);

        assertThatThrownBy(() -> validator.validate(event))
                .isInstanceOf(EventValidationException.class)
                .satisfies(e -> assertThat(((EventValidationException) e).getViolations())
                        .containsExactly(
                                "timestamp is required",
                                "source_id must not be blank",
                                "category must not be blank",
                                "level is required"));
    }

    @Test
    void nonFiniteAndNullMetricsAreRejected() {
        Map<String, Double> fields = new HashMap<>();
        fields.put("cpu_usage", Double.NaN);
        fields.put("memory_usage", null);
        fields.put(null, 1.0);
        Event event = new Event(Instant.now(), "db", "database_error", EventLevel.ERROR, fields, null, null);

        assertThat(validator.violations(event))
                .hasSize(3)
                .anyMatch(v -> v.contains("cpu_usage"))
                .anyMatch(v -> v.contains("memory_usage"))
                .anyMatch(v -> v.contains("null key"));
    }

    @Test
    void missingMetricMapIsRejected() {
        Event event = new Event(Instant.now(), "db", "database_error", EventLevel.ERROR, null, null, null);

        assertThat(validator.violations(event)).containsExactly("numeric_fields is required");
    }

    @Test
    void nullEventIsRejected() {
        assertThatThrownBy(() -> validator.validate(null))
                .isInstanceOf(EventValidationException.class)
                .hasMessageContaining("event is null");
    }
}
