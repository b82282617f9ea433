package com.vigil.alerting.infra.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsMatchDocumentedValues() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.getCpuThresholdPct()).isEqualTo(80.0);
        assertThat(config.getMemoryThresholdPct()).isEqualTo(80.0);
        assertThat(config.getAuthFailureCount()).isEqualTo(5);
        assertThat(config.getAuthFailureWindow()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getErrorRateThreshold()).isEqualTo(0.2);
        assertThat(config.getErrorRateWindow()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getErrorRateMinSamples()).isEqualTo(10);
        assertThat(config.getAnomalyWindowSize()).isEqualTo(100);
        assertThat(config.getAnomalyMinFitSamples()).isEqualTo(50);
        assertThat(config.getAnomalyRetrainPeriod()).isEqualTo(20);
        assertThat(config.getAnomalyDetector()).isEqualTo(EngineConfig.AnomalyDetectorType.RANDOM_CUT_FOREST);
        assertThat(config.getAnomalyTrees()).isEqualTo(100);
        assertThat(config.getAnomalySampleSize()).isEqualTo(256);
        assertThat(config.getAnomalyScoreThreshold()).isEqualTo(3.0);
        assertThat(config.getErrorCategories()).containsExactlyInAnyOrder("connection_timeout", "database_error");
        assertThat(config.getActionTimeout()).isZero();
    }

    @Test
    void propertiesFileOverridesDefaults() throws IOException {
        Path file = tempDir.resolve("custom.properties");
        Files.writeString(file, String.join("\n",
                "vigil.cpu.threshold.pct=90",
                "vigil.auth.failure.count=3",
                "vigil.auth.failure.window.s=30",
                "vigil.error.categories=timeout, crash",
                "vigil.anomaly.detector=z_score",
                "vigil.anomaly.sample.size=128",
                "vigil.anomaly.score.threshold=2.5",
                "vigil.action.timeout.ms=250"));

        EngineConfig config = EngineConfig.loadFromProperties(file.toString());

        assertThat(config.getCpuThresholdPct()).isEqualTo(90.0);
        assertThat(config.getAuthFailureCount()).isEqualTo(3);
        assertThat(config.getAuthFailureWindow()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getErrorCategories()).containsExactlyInAnyOrder("timeout", "crash");
        assertThat(config.getAnomalyDetector()).isEqualTo(EngineConfig.AnomalyDetectorType.Z_SCORE);
        assertThat(config.getAnomalySampleSize()).isEqualTo(128);
        assertThat(config.getAnomalyScoreThreshold()).isEqualTo(2.5);
        assertThat(config.getActionTimeout()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.getMemoryThresholdPct()).isEqualTo(80.0);
    }

    @Test
    void missingFileFallsBackToDefaults() {
        EngineConfig config = EngineConfig.loadFromProperties(tempDir.resolve("absent.properties").toString());

        assertThat(config.getAuthFailureCount()).isEqualTo(5);
    }

    @Test
    @DisplayName("environment variables take precedence over properties")
    void environmentOverridesProperties() {
        Properties props = new Properties();
        props.setProperty("vigil.error.rate.threshold", "0.5");
        props.setProperty("vigil.error.rate.min.samples", "20");

        EngineConfig.Builder builder = EngineConfig.builder();
        builder.applyProperties(props);
        builder.applyEnvironment(Map.of("VIGIL_ERROR_RATE_THRESHOLD", "0.3", "UNRELATED", "x"));
        EngineConfig config = builder.build();

        assertThat(config.getErrorRateThreshold()).isEqualTo(0.3);
        assertThat(config.getErrorRateMinSamples()).isEqualTo(20);
    }

    @Test
    void envNamesAreDerivedFromPropertyNames() {
        assertThat(EngineConfig.Builder.envName("anomaly.min.fit.samples")).isEqualTo("VIGIL_ANOMALY_MIN_FIT_SAMPLES");
    }

    @Test
    void unparsableValueNamesTheProperty() {
        Properties props = new Properties();
        props.setProperty("vigil.auth.failure.count", "five");

        EngineConfig.Builder builder = EngineConfig.builder();

        assertThatThrownBy(() -> builder.applyProperties(props))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("vigil.auth.failure.count");
    }

    @Test
    void invalidCombinationsAreRejected() {
        assertThatThrownBy(() -> EngineConfig.builder().anomalyWindowSize(10).anomalyMinFitSamples(50).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("anomaly.window.size");
        assertThatThrownBy(() -> EngineConfig.builder().errorRateThreshold(1.5).build())
                .hasMessageContaining("error.rate.threshold");
        assertThatThrownBy(() -> EngineConfig.builder().authFailureWindow(Duration.ZERO).build())
                .hasMessageContaining("auth.failure.window.s");
        assertThatThrownBy(() -> EngineConfig.builder().errorCategories(Set.of()).build())
                .hasMessageContaining("error.categories");
        assertThatThrownBy(() -> EngineConfig.builder().anomalyScoreThreshold(0.0).build())
                .hasMessageContaining("anomaly.score.threshold");
        assertThatThrownBy(() -> EngineConfig.builder().anomalyScoreThreshold(Double.POSITIVE_INFINITY).build())
                .hasMessageContaining("anomaly.score.threshold");
    }

    @Test
    void toBuilderCopiesEveryValue() {
        EngineConfig original = EngineConfig.builder()
                .authFailureCount(7)
                .anomalySeed(7L)
                .anomalyScoreThreshold(4.5)
                .cpuMetric("cpu")
                .build();

        EngineConfig copy = original.toBuilder().memoryThresholdPct(95).build();

        assertThat(copy.getAuthFailureCount()).isEqualTo(7);
        assertThat(copy.getAnomalySeed()).isEqualTo(7L);
        assertThat(copy.getAnomalyScoreThreshold()).isEqualTo(4.5);
        assertThat(copy.getCpuMetric()).isEqualTo("cpu");
        assertThat(copy.getMemoryThresholdPct()).isEqualTo(95.0);
        assertThat(original.getMemoryThresholdPct()).isEqualTo(80.0);
    }
}
