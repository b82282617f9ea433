package com.vigil.alerting.service.source;

import com.vigil.alerting.api.model.Event;
import com.vigil.alerting.api.model.EventLevel;
import com.vigil.alerting.runtime.validation.EventValidator;
import com.vigil.alerting.service.source.SyntheticEventGenerator.SimulatedEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SyntheticEventGeneratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-02-02T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void sameSeedSameStream() {
        SyntheticEventGenerator a = new SyntheticEventGenerator(7L, CLOCK);
        SyntheticEventGenerator b = new SyntheticEventGenerator(7L, CLOCK);

        for (int i = 0; i < 100; i++) {
            assertThat(a.nextDocument()).isEqualTo(b.nextDocument());
        }
    }

    @Test
    @DisplayName("event types follow their weights")
    void weightedDistribution() {
        SyntheticEventGenerator generator = new SyntheticEventGenerator(new Random(42L), CLOCK);
        Map<SimulatedEventType, Integer> counts = new EnumMap<>(SimulatedEventType.class);
        int draws = 50_000;

        for (int i = 0; i < draws; i++) {
            counts.merge(generator.pickType(), 1, Integer::sum);
        }

        for (SimulatedEventType type : SimulatedEventType.values()) {
            assertThat(counts.getOrDefault(type, 0) / (double) draws)
                    .as(type.name())
                    .isCloseTo(type.weight(), within(0.01));
        }
    }

    @Test
    void generatedEventsPassValidation() {
        SyntheticEventGenerator generator = new SyntheticEventGenerator(3L, CLOCK);
        EventValidator validator = new EventValidator();

        for (int i = 0; i < 500; i++) {
            Event event = generator.next();
            assertThat(validator.violations(event)).isEmpty();
            assertThat(event.timestamp()).isEqualTo(CLOCK.instant());
            assertThat(SyntheticEventGenerator.SERVICES).contains(event.sourceId());
            assertThat(event.correlationId()).matches("trace-\\d{5}");
        }
    }

    @ParameterizedTest
    @EnumSource(SimulatedEventType.class)
    void metricsAndOriginsPerType(SimulatedEventType type) {
        SyntheticEventGenerator generator = new SyntheticEventGenerator(11L, CLOCK);

        for (int i = 0; i < 50; i++) {
            Event event = generator.generate(type).toEvent();
            assertThat(event.category()).isEqualTo(type.category());

            switch (type) {
                case CPU_SPIKE -> {
                    assertThat(event.metric("cpu_usage").getAsDouble()).isBetween(85.0, 99.9);
                    assertThat(event.metric("memory_usage")).isEmpty();
                }
                case MEMORY_SPIKE -> {
                    assertThat(event.metric("memory_usage").getAsDouble()).isBetween(85.0, 99.9);
                    assertThat(event.metric("cpu_usage")).isEmpty();
                }
                default -> {
                    assertThat(event.metric("cpu_usage").getAsDouble()).isBetween(10.0, 40.0);
                    assertThat(event.metric("memory_usage").getAsDouble()).isBetween(20.0, 50.0);
                }
            }

            double responseTime = event.metric("response_time_ms").getAsDouble();
            if (type == SimulatedEventType.TIMEOUT) {
                assertThat(responseTime).isBetween(5000.0, 10000.0);
                assertThat(event.level()).isEqualTo(EventLevel.ERROR);
            } else {
                assertThat(responseTime).isBetween(10.0, 200.0);
            }

            boolean auth = type == SimulatedEventType.AUTH_FAILURE || type == SimulatedEventType.AUTH_SUCCESS;
            assertThat(event.originIp()).startsWith(auth ? "203.0.113." : "10.0.1.");
        }
    }
}
