/*
 * Copyright (c) 2025 Vigil Alerting Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.alerting.infra.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Immutable configuration of the alerting engine: rule thresholds, window sizes,
 * anomaly model parameters and the event vocabulary the rules react to.
 *
 * <p><b>Sources, lowest precedence first:</b>
 * <ol>
 *   <li>Builder defaults</li>
 *   <li>Properties file ({@code vigil.<name>} keys), see {@link #loadFromProperties(String)}</li>
 *   <li>Environment variables ({@code VIGIL_<NAME>}), e.g. {@code VIGIL_CPU_THRESHOLD_PCT=90}</li>
 * </ol>
 * A plain {@link #builder()} never reads the environment.
 *
 * <p><b>Example engine.properties:</b>
 * <pre>
 * vigil.cpu.threshold.pct=85
 * vigil.auth.failure.count=3
 * vigil.auth.failure.window.s=30
 * vigil.error.categories=connection_timeout,database_error
 * vigil.anomaly.detector=Z_SCORE
 * </pre>
 *
 * <p>Every instance is validated on build; invalid values fail with an
 * {@link IllegalArgumentException} naming the property.
 */
public final class EngineConfig {

    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    private static final String PROPERTY_PREFIX = "vigil.";
    private static final String ENV_PREFIX = "VIGIL_";

    /**
     * Outlier algorithm backing each per-source anomaly model.
     */
    public enum AnomalyDetectorType {
        /** Random cut forest ensemble (default). */
        RANDOM_CUT_FOREST,
        /** Per-dimension z-score against the buffer mean. */
        Z_SCORE
    }

    // Rule thresholds
    private final double cpuThresholdPct;
    private final double memoryThresholdPct;
    private final int authFailureCount;
    private final Duration authFailureWindow;
    private final double errorRateThreshold;
    private final Duration errorRateWindow;
    private final int errorRateMinSamples;

    // Anomaly model
    private final int anomalyWindowSize;
    private final int anomalyMinFitSamples;
    private final int anomalyRetrainPeriod;
    private final AnomalyDetectorType anomalyDetector;
    private final int anomalyTrees;
    private final int anomalySampleSize;
    private final long anomalySeed;
    private final double anomalyScoreThreshold;
    private final double anomalyZScoreThreshold;
    private final double anomalyDefaultCpuPct;
    private final double anomalyDefaultMemoryPct;
    private final long anomalyMaxSources;
    private final Duration anomalyIdleExpiry;

    // Event vocabulary
    private final String cpuSpikeCategory;
    private final String memorySpikeCategory;
    private final String authFailureCategory;
    private final Set<String> errorCategories;
    private final String cpuMetric;
    private final String memoryMetric;

    private final Duration actionTimeout;

    private EngineConfig(Builder builder) {
        this.cpuThresholdPct = builder.cpuThresholdPct;
        this.memoryThresholdPct = builder.memoryThresholdPct;
        this.authFailureCount = builder.authFailureCount;
        this.authFailureWindow = builder.authFailureWindow;
        this.errorRateThreshold = builder.errorRateThreshold;
        this.errorRateWindow = builder.errorRateWindow;
        this.errorRateMinSamples = builder.errorRateMinSamples;

        this.anomalyWindowSize = builder.anomalyWindowSize;
        this.anomalyMinFitSamples = builder.anomalyMinFitSamples;
        this.anomalyRetrainPeriod = builder.anomalyRetrainPeriod;
        this.anomalyDetector = builder.anomalyDetector;
        this.anomalyTrees = builder.anomalyTrees;
        this.anomalySampleSize = builder.anomalySampleSize;
        this.anomalySeed = builder.anomalySeed;
        this.anomalyScoreThreshold = builder.anomalyScoreThreshold;
        this.anomalyZScoreThreshold = builder.anomalyZScoreThreshold;
        this.anomalyDefaultCpuPct = builder.anomalyDefaultCpuPct;
        this.anomalyDefaultMemoryPct = builder.anomalyDefaultMemoryPct;
        this.anomalyMaxSources = builder.anomalyMaxSources;
        this.anomalyIdleExpiry = builder.anomalyIdleExpiry;

        this.cpuSpikeCategory = builder.cpuSpikeCategory;
        this.memorySpikeCategory = builder.memorySpikeCategory;
        this.authFailureCategory = builder.authFailureCategory;
        this.errorCategories = Set.copyOf(builder.errorCategories);
        this.cpuMetric = builder.cpuMetric;
        this.memoryMetric = builder.memoryMetric;

        this.actionTimeout = builder.actionTimeout;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Loads {@code engine.properties} from the classpath root.
     */
    public static EngineConfig loadDefault() {
        return loadFromProperties("engine.properties");
    }

    /**
     * Loads configuration from a properties file, searching the classpath first and
     * the file system second. A missing file yields the defaults. Environment
     * variables override file values.
     *
     * @param propertiesPath classpath resource or file path
     */
    public static EngineConfig loadFromProperties(String propertiesPath) {
        Properties props = new Properties();

        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (InputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        Builder builder = builder();
        builder.applyProperties(props);
        builder.applyEnvironment(System.getenv());
        return builder.build();
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.cpuThresholdPct = cpuThresholdPct;
        builder.memoryThresholdPct = memoryThresholdPct;
        builder.authFailureCount = authFailureCount;
        builder.authFailureWindow = authFailureWindow;
        builder.errorRateThreshold = errorRateThreshold;
        builder.errorRateWindow = errorRateWindow;
        builder.errorRateMinSamples = errorRateMinSamples;
        builder.anomalyWindowSize = anomalyWindowSize;
        builder.anomalyMinFitSamples = anomalyMinFitSamples;
        builder.anomalyRetrainPeriod = anomalyRetrainPeriod;
        builder.anomalyDetector = anomalyDetector;
        builder.anomalyTrees = anomalyTrees;
        builder.anomalySampleSize = anomalySampleSize;
        builder.anomalySeed = anomalySeed;
        builder.anomalyScoreThreshold = anomalyScoreThreshold;
        builder.anomalyZScoreThreshold = anomalyZScoreThreshold;
        builder.anomalyDefaultCpuPct = anomalyDefaultCpuPct;
        builder.anomalyDefaultMemoryPct = anomalyDefaultMemoryPct;
        builder.anomalyMaxSources = anomalyMaxSources;
        builder.anomalyIdleExpiry = anomalyIdleExpiry;
        builder.cpuSpikeCategory = cpuSpikeCategory;
        builder.memorySpikeCategory = memorySpikeCategory;
        builder.authFailureCategory = authFailureCategory;
        builder.errorCategories = new LinkedHashSet<>(errorCategories);
        builder.cpuMetric = cpuMetric;
        builder.memoryMetric = memoryMetric;
        builder.actionTimeout = actionTimeout;
        return builder;
    }

    public static final class Builder {

        /**
         * Property name (without prefix) to setter. Env names are derived from these.
         */
        private static final Map<String, BiConsumer<Builder, String>> BINDINGS = new LinkedHashMap<>();

        static {
            BINDINGS.put("cpu.threshold.pct", (b, v) -> b.cpuThresholdPct = Double.parseDouble(v));
            BINDINGS.put("mem.threshold.pct", (b, v) -> b.memoryThresholdPct = Double.parseDouble(v));
            BINDINGS.put("auth.failure.count", (b, v) -> b.authFailureCount = Integer.parseInt(v));
            BINDINGS.put("auth.failure.window.s", (b, v) -> b.authFailureWindow = Duration.ofSeconds(Long.parseLong(v)));
            BINDINGS.put("error.rate.threshold", (b, v) -> b.errorRateThreshold = Double.parseDouble(v));
            BINDINGS.put("error.rate.window.s", (b, v) -> b.errorRateWindow = Duration.ofSeconds(Long.parseLong(v)));
            BINDINGS.put("error.rate.min.samples", (b, v) -> b.errorRateMinSamples = Integer.parseInt(v));
            BINDINGS.put("anomaly.window.size", (b, v) -> b.anomalyWindowSize = Integer.parseInt(v));
            BINDINGS.put("anomaly.min.fit.samples", (b, v) -> b.anomalyMinFitSamples = Integer.parseInt(v));
            BINDINGS.put("anomaly.retrain.period", (b, v) -> b.anomalyRetrainPeriod = Integer.parseInt(v));
            BINDINGS.put("anomaly.detector", (b, v) ->
                    b.anomalyDetector = AnomalyDetectorType.valueOf(v.toUpperCase(Locale.ROOT)));
            BINDINGS.put("anomaly.trees", (b, v) -> b.anomalyTrees = Integer.parseInt(v));
            BINDINGS.put("anomaly.sample.size", (b, v) -> b.anomalySampleSize = Integer.parseInt(v));
            BINDINGS.put("anomaly.seed", (b, v) -> b.anomalySeed = Long.parseLong(v));
            BINDINGS.put("anomaly.score.threshold", (b, v) -> b.anomalyScoreThreshold = Double.parseDouble(v));
            BINDINGS.put("anomaly.zscore.threshold", (b, v) -> b.anomalyZScoreThreshold = Double.parseDouble(v));
            BINDINGS.put("anomaly.default.cpu.pct", (b, v) -> b.anomalyDefaultCpuPct = Double.parseDouble(v));
            BINDINGS.put("anomaly.default.mem.pct", (b, v) -> b.anomalyDefaultMemoryPct = Double.parseDouble(v));
            BINDINGS.put("anomaly.max.sources", (b, v) -> b.anomalyMaxSources = Long.parseLong(v));
            BINDINGS.put("anomaly.idle.expiry.s", (b, v) -> b.anomalyIdleExpiry = Duration.ofSeconds(Long.parseLong(v)));
            BINDINGS.put("cpu.spike.category", (b, v) -> b.cpuSpikeCategory = v);
            BINDINGS.put("memory.spike.category", (b, v) -> b.memorySpikeCategory = v);
            BINDINGS.put("auth.failure.category", (b, v) -> b.authFailureCategory = v);
            BINDINGS.put("error.categories", (b, v) -> b.errorCategories = splitList(v));
            BINDINGS.put("cpu.metric", (b, v) -> b.cpuMetric = v);
            BINDINGS.put("memory.metric", (b, v) -> b.memoryMetric = v);
            BINDINGS.put("action.timeout.ms", (b, v) -> b.actionTimeout = Duration.ofMillis(Long.parseLong(v)));
        }

        private double cpuThresholdPct = 80.0;
        private double memoryThresholdPct = 80.0;
        private int authFailureCount = 5;
        private Duration authFailureWindow = Duration.ofSeconds(60);
        private double errorRateThreshold = 0.2;
        private Duration errorRateWindow = Duration.ofSeconds(60);
        private int errorRateMinSamples = 10;

        private int anomalyWindowSize = 100;
        private int anomalyMinFitSamples = 50;
        private int anomalyRetrainPeriod = 20;
        private AnomalyDetectorType anomalyDetector = AnomalyDetectorType.RANDOM_CUT_FOREST;
        private int anomalyTrees = 100;
        private int anomalySampleSize = 256;
        private long anomalySeed = 42L;
        private double anomalyScoreThreshold = 3.0;
        private double anomalyZScoreThreshold = 3.0;
        private double anomalyDefaultCpuPct = 20.0;
        private double anomalyDefaultMemoryPct = 40.0;
        private long anomalyMaxSources = 10_000;
        private Duration anomalyIdleExpiry = Duration.ZERO;

        private String cpuSpikeCategory = "cpu_utilization_spike";
        private String memorySpikeCategory = "memory_utilization_spike";
        private String authFailureCategory = "auth_failure";
        private Set<String> errorCategories = new LinkedHashSet<>(Set.of("connection_timeout", "database_error"));
        private String cpuMetric = "cpu_usage";
        private String memoryMetric = "memory_usage";

        private Duration actionTimeout = Duration.ZERO;

        private Builder() {
        }

        void applyProperties(Properties props) {
            BINDINGS.forEach((name, setter) -> {
                String value = props.getProperty(PROPERTY_PREFIX + name);
                if (value != null && !value.isBlank()) {
                    apply(PROPERTY_PREFIX + name, value.trim(), setter);
                }
            });
        }

        void applyEnvironment(Map<String, String> env) {
            BINDINGS.forEach((name, setter) -> {
                String key = envName(name);
                String value = env.get(key);
                if (value != null && !value.isBlank()) {
                    logger.fine("Loaded env var: " + key + "=" + value);
                    apply(key, value.trim(), setter);
                }
            });
        }

        private void apply(String key, String value, BiConsumer<Builder, String> setter) {
            try {
                setter.accept(this, value);
            } catch (IllegalArgumentException e) {
                // NumberFormatException included
                throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
            }
        }

        static String envName(String propertyName) {
            return ENV_PREFIX + propertyName.toUpperCase(Locale.ROOT).replace('.', '_');
        }

        private static Set<String> splitList(String value) {
            return Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }

        // Rule thresholds

        public Builder cpuThresholdPct(double pct) {
            this.cpuThresholdPct = pct;
            return this;
        }

        public Builder memoryThresholdPct(double pct) {
            this.memoryThresholdPct = pct;
            return this;
        }

        public Builder authFailureCount(int count) {
            this.authFailureCount = count;
            return this;
        }

        public Builder authFailureWindow(Duration window) {
            this.authFailureWindow = window;
            return this;
        }

        public Builder errorRateThreshold(double threshold) {
            this.errorRateThreshold = threshold;
            return this;
        }

        public Builder errorRateWindow(Duration window) {
            this.errorRateWindow = window;
            return this;
        }

        public Builder errorRateMinSamples(int samples) {
            this.errorRateMinSamples = samples;
            return this;
        }

        // Anomaly model

        public Builder anomalyWindowSize(int size) {
            this.anomalyWindowSize = size;
            return this;
        }

        public Builder anomalyMinFitSamples(int samples) {
            this.anomalyMinFitSamples = samples;
            return this;
        }

        public Builder anomalyRetrainPeriod(int period) {
            this.anomalyRetrainPeriod = period;
            return this;
        }

        public Builder anomalyDetector(AnomalyDetectorType type) {
            this.anomalyDetector = type;
            return this;
        }

        public Builder anomalyTrees(int trees) {
            this.anomalyTrees = trees;
            return this;
        }

        public Builder anomalySampleSize(int size) {
            this.anomalySampleSize = size;
            return this;
        }

        public Builder anomalySeed(long seed) {
            this.anomalySeed = seed;
            return this;
        }

        /**
         * Random cut forest anomaly score above which a sample is an outlier.
         */
        public Builder anomalyScoreThreshold(double threshold) {
            this.anomalyScoreThreshold = threshold;
            return this;
        }

        public Builder anomalyZScoreThreshold(double threshold) {
            this.anomalyZScoreThreshold = threshold;
            return this;
        }

        public Builder anomalyDefaults(double cpuPct, double memoryPct) {
            this.anomalyDefaultCpuPct = cpuPct;
            this.anomalyDefaultMemoryPct = memoryPct;
            return this;
        }

        public Builder anomalyMaxSources(long maxSources) {
            this.anomalyMaxSources = maxSources;
            return this;
        }

        public Builder anomalyIdleExpiry(Duration expiry) {
            this.anomalyIdleExpiry = expiry;
            return this;
        }

        // Event vocabulary

        public Builder cpuSpikeCategory(String category) {
            this.cpuSpikeCategory = category;
            return this;
        }

        public Builder memorySpikeCategory(String category) {
            this.memorySpikeCategory = category;
            return this;
        }

        public Builder authFailureCategory(String category) {
            this.authFailureCategory = category;
            return this;
        }

        public Builder errorCategories(Set<String> categories) {
            this.errorCategories = new LinkedHashSet<>(categories);
            return this;
        }

        public Builder cpuMetric(String metric) {
            this.cpuMetric = metric;
            return this;
        }

        public Builder memoryMetric(String metric) {
            this.memoryMetric = metric;
            return this;
        }

        public Builder actionTimeout(Duration timeout) {
            this.actionTimeout = timeout;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        requireFinite("cpu.threshold.pct", cpuThresholdPct);
        requireFinite("mem.threshold.pct", memoryThresholdPct);
        require(authFailureCount >= 1, "auth.failure.count must be >= 1: " + authFailureCount);
        requirePositive("auth.failure.window.s", authFailureWindow);
        require(errorRateThreshold > 0.0 && errorRateThreshold <= 1.0,
                "error.rate.threshold must be in (0, 1]: " + errorRateThreshold);
        requirePositive("error.rate.window.s", errorRateWindow);
        require(errorRateMinSamples >= 1, "error.rate.min.samples must be >= 1: " + errorRateMinSamples);

        require(anomalyMinFitSamples >= 2, "anomaly.min.fit.samples must be >= 2: " + anomalyMinFitSamples);
        require(anomalyWindowSize >= anomalyMinFitSamples,
                "anomaly.window.size (" + anomalyWindowSize + ") must be >= anomaly.min.fit.samples ("
                        + anomalyMinFitSamples + ")");
        require(anomalyRetrainPeriod >= 1, "anomaly.retrain.period must be >= 1: " + anomalyRetrainPeriod);
        require(anomalyDetector != null, "anomaly.detector must not be null");
        require(anomalyTrees >= 1, "anomaly.trees must be >= 1: " + anomalyTrees);
        require(anomalySampleSize >= 2, "anomaly.sample.size must be >= 2: " + anomalySampleSize);
        require(anomalyScoreThreshold > 0.0, "anomaly.score.threshold must be > 0: " + anomalyScoreThreshold);
        require(anomalyZScoreThreshold > 0.0, "anomaly.zscore.threshold must be > 0: " + anomalyZScoreThreshold);
        requireFinite("anomaly.score.threshold", anomalyScoreThreshold);
        requireFinite("anomaly.default.cpu.pct", anomalyDefaultCpuPct);
        requireFinite("anomaly.default.mem.pct", anomalyDefaultMemoryPct);
        require(anomalyMaxSources >= 1, "anomaly.max.sources must be >= 1: " + anomalyMaxSources);
        requireNonNegative("anomaly.idle.expiry.s", anomalyIdleExpiry);

        requireText("cpu.spike.category", cpuSpikeCategory);
        requireText("memory.spike.category", memorySpikeCategory);
        requireText("auth.failure.category", authFailureCategory);
        require(!errorCategories.isEmpty(), "error.categories must not be empty");
        requireText("cpu.metric", cpuMetric);
        requireText("memory.metric", memoryMetric);

        requireNonNegative("action.timeout.ms", actionTimeout);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    private static void requireFinite(String name, double value) {
        require(Double.isFinite(value) && value >= 0.0, name + " must be a finite non-negative number: " + value);
    }

    private static void requirePositive(String name, Duration value) {
        require(value != null && !value.isNegative() && !value.isZero(), name + " must be positive: " + value);
    }

    private static void requireNonNegative(String name, Duration value) {
        require(value != null && !value.isNegative(), name + " must not be negative: " + value);
    }

    private static void requireText(String name, String value) {
        require(value != null && !value.isBlank(), name + " must not be blank");
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public double getCpuThresholdPct() {
        return cpuThresholdPct;
    }

    public double getMemoryThresholdPct() {
        return memoryThresholdPct;
    }

    public int getAuthFailureCount() {
        return authFailureCount;
    }

    public Duration getAuthFailureWindow() {
        return authFailureWindow;
    }

    public double getErrorRateThreshold() {
        return errorRateThreshold;
    }

    public Duration getErrorRateWindow() {
        return errorRateWindow;
    }

    public int getErrorRateMinSamples() {
        return errorRateMinSamples;
    }

    public int getAnomalyWindowSize() {
        return anomalyWindowSize;
    }

    public int getAnomalyMinFitSamples() {
        return anomalyMinFitSamples;
    }

    public int getAnomalyRetrainPeriod() {
        return anomalyRetrainPeriod;
    }

    public AnomalyDetectorType getAnomalyDetector() {
        return anomalyDetector;
    }

    public int getAnomalyTrees() {
        return anomalyTrees;
    }

    public int getAnomalySampleSize() {
        return anomalySampleSize;
    }

    public long getAnomalySeed() {
        return anomalySeed;
    }

    public double getAnomalyScoreThreshold() {
        return anomalyScoreThreshold;
    }

    public double getAnomalyZScoreThreshold() {
        return anomalyZScoreThreshold;
    }

    public double getAnomalyDefaultCpuPct() {
        return anomalyDefaultCpuPct;
    }

    public double getAnomalyDefaultMemoryPct() {
        return anomalyDefaultMemoryPct;
    }

    public long getAnomalyMaxSources() {
        return anomalyMaxSources;
    }

    public Duration getAnomalyIdleExpiry() {
        return anomalyIdleExpiry;
    }

    public String getCpuSpikeCategory() {
        return cpuSpikeCategory;
    }

    public String getMemorySpikeCategory() {
        return memorySpikeCategory;
    }

    public String getAuthFailureCategory() {
        return authFailureCategory;
    }

    public Set<String> getErrorCategories() {
        return errorCategories;
    }

    public String getCpuMetric() {
        return cpuMetric;
    }

    public String getMemoryMetric() {
        return memoryMetric;
    }

    public Duration getActionTimeout() {
        return actionTimeout;
    }

    @Override
    public String toString() {
        return "EngineConfig{"
                + "cpuThresholdPct=" + cpuThresholdPct
                + ", memoryThresholdPct=" + memoryThresholdPct
                + ", authFailure=" + authFailureCount + "/" + authFailureWindow.toSeconds() + "s"
                + ", errorRate=" + errorRateThreshold + "/" + errorRateWindow.toSeconds() + "s"
                + " (min " + errorRateMinSamples + ")"
                + ", anomaly=" + anomalyDetector + "[window=" + anomalyWindowSize
                + ", minFit=" + anomalyMinFitSamples + ", retrain=" + anomalyRetrainPeriod + "]"
                + ", anomalyMaxSources=" + anomalyMaxSources
                + ", actionTimeout=" + actionTimeout.toMillis() + "ms"
                + '}';
    }
}
