package io.weft.core;

import io.weft.core.execution.DependencyFailurePolicy;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/// Configuration options for a Weft environment.
///
/// Controls threading, cache bounds, history retention, planning thresholds and
/// recommendation thresholds. Use the {@link Builder} for fluent configuration,
/// {@link #fromProperties(Properties)} to read `weft.*` keys, or construct directly
/// with setters for mutable configuration.
///
/// ### Default Values
/// | Option | Default |
/// |---|---|
/// | `threadPoolSize` | `10` |
/// | `cacheMaxEntries` | `1000` |
/// | `cacheTtl` | 1 hour |
/// | `historyLimit` | `1000` |
/// | `planTimeoutFloor` | 60 seconds |
/// | `performanceThreshold` | 5 seconds |
/// | `costThreshold` | `1.0` USD |
/// | `reliabilityThreshold` | `0.9` |
/// | `maxParallelExecutions` | `5` |
/// | `cachingEnabled` | `true` |
/// | `learningEnabled` | `true` |
/// | `predictiveOptimization` | `true` |
/// | `strictRegistration` | `false` |
/// | `registerBuiltInTools` | `false` |
/// | `dependencyFailurePolicy` | `SKIP_DEPENDENTS` |
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link WeftFactory}.
/// Do not modify after environment creation.
///
/// @see WeftFactory#createEnvironment(WeftConfig)
/// @see Builder
public class WeftConfig {

    /// Prefix of the property keys read by {@link #fromProperties(Properties)}.
    public static final String PROPERTY_PREFIX = "weft.";

    private int threadPoolSize = 10;
    private int cacheMaxEntries = 1000;
    private Duration cacheTtl = Duration.ofHours(1);
    private int historyLimit = 1000;
    private Duration planTimeoutFloor = Duration.ofSeconds(60);
    private Duration performanceThreshold = Duration.ofSeconds(5);
    private double costThreshold = 1.0;
    private double reliabilityThreshold = 0.9;
    private int maxParallelExecutions = 5;
    private boolean cachingEnabled = true;
    private boolean learningEnabled = true;
    private boolean predictiveOptimization = true;
    private boolean strictRegistration;
    private boolean registerBuiltInTools;
    private DependencyFailurePolicy dependencyFailurePolicy =
            DependencyFailurePolicy.SKIP_DEPENDENTS;

    /// Creates a configuration with default values.
    public WeftConfig() {}

    /// Returns the size of the fixed worker pool used for parallel groups.
    ///
    /// @return pool size
    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /// Sets the size of the fixed worker pool.
    ///
    /// ### Contracts
    /// - **Precondition**: `threadPoolSize` should be positive
    ///
    /// @param threadPoolSize number of worker threads, must be positive
    public void setThreadPoolSize(int threadPoolSize) {
        this.threadPoolSize = threadPoolSize;
    }

    public int getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public void setCacheMaxEntries(int cacheMaxEntries) {
        this.cacheMaxEntries = cacheMaxEntries;
    }

    /// Returns the cache time-to-live.
    ///
    /// @return time-to-live, `Duration.ZERO` for no expiry, never null
    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public void setCacheTtl(Duration cacheTtl) {
        this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl must not be null");
    }

    /// Returns the number of executions kept in the performance history.
    ///
    /// @return history limit
    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    /// Returns the minimum advisory plan timeout.
    ///
    /// @return timeout floor, never null
    public Duration getPlanTimeoutFloor() {
        return planTimeoutFloor;
    }

    public void setPlanTimeoutFloor(Duration planTimeoutFloor) {
        this.planTimeoutFloor =
                Objects.requireNonNull(planTimeoutFloor, "planTimeoutFloor must not be null");
    }

    /// Returns the step duration above which a run recommends performance work.
    ///
    /// @return threshold, never null
    public Duration getPerformanceThreshold() {
        return performanceThreshold;
    }

    public void setPerformanceThreshold(Duration performanceThreshold) {
        this.performanceThreshold =
                Objects.requireNonNull(
                        performanceThreshold, "performanceThreshold must not be null");
    }

    /// Returns the total run cost above which a run recommends cost work.
    ///
    /// @return threshold in USD
    public double getCostThreshold() {
        return costThreshold;
    }

    public void setCostThreshold(double costThreshold) {
        this.costThreshold = costThreshold;
    }

    /// Returns the success rate below which a tool is treated as unreliable.
    ///
    /// @return threshold in `[0, 1]`
    public double getReliabilityThreshold() {
        return reliabilityThreshold;
    }

    public void setReliabilityThreshold(double reliabilityThreshold) {
        this.reliabilityThreshold = reliabilityThreshold;
    }

    /// Returns the default bound of concurrently running steps for new plans.
    ///
    /// @return maximum concurrent steps
    public int getMaxParallelExecutions() {
        return maxParallelExecutions;
    }

    public void setMaxParallelExecutions(int maxParallelExecutions) {
        this.maxParallelExecutions = maxParallelExecutions;
    }

    /// Returns whether new plans enable caching.
    ///
    /// @return `true` if caching is enabled for new plans
    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    public void setCachingEnabled(boolean cachingEnabled) {
        this.cachingEnabled = cachingEnabled;
    }

    /// Returns whether execution observations update tool profiles.
    ///
    /// @return `true` if learning is enabled
    public boolean isLearningEnabled() {
        return learningEnabled;
    }

    public void setLearningEnabled(boolean learningEnabled) {
        this.learningEnabled = learningEnabled;
    }

    /// Returns whether plan creation assigns retry policies from learned reliability.
    ///
    /// @return `true` if predictive optimization is enabled
    public boolean isPredictiveOptimization() {
        return predictiveOptimization;
    }

    public void setPredictiveOptimization(boolean predictiveOptimization) {
        this.predictiveOptimization = predictiveOptimization;
    }

    /// Returns whether registering an existing tool name is rejected.
    ///
    /// @return `true` for strict registration
    public boolean isStrictRegistration() {
        return strictRegistration;
    }

    public void setStrictRegistration(boolean strictRegistration) {
        this.strictRegistration = strictRegistration;
    }

    /// Returns whether the factory registers {@link io.weft.core.tool.BuiltInTools}.
    ///
    /// @return `true` if built-in tools are registered
    public boolean isRegisterBuiltInTools() {
        return registerBuiltInTools;
    }

    public void setRegisterBuiltInTools(boolean registerBuiltInTools) {
        this.registerBuiltInTools = registerBuiltInTools;
    }

    /// Returns what happens to steps whose dependency did not succeed.
    ///
    /// @return the policy, never null
    public DependencyFailurePolicy getDependencyFailurePolicy() {
        return dependencyFailurePolicy;
    }

    public void setDependencyFailurePolicy(DependencyFailurePolicy dependencyFailurePolicy) {
        this.dependencyFailurePolicy =
                Objects.requireNonNull(
                        dependencyFailurePolicy, "dependencyFailurePolicy must not be null");
    }

    /// Creates a configuration from `weft.*` properties.
    ///
    /// Recognized keys are the option names with the `weft.` prefix, e.g.
    /// `weft.threadPoolSize=4` or `weft.dependencyFailurePolicy=EXECUTE_ANYWAY`.
    /// Durations are given in milliseconds (`weft.cacheTtl=60000`). Missing keys keep
    /// their defaults; unknown keys are ignored.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static WeftConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        WeftConfig config = new WeftConfig();
        PropertyReader reader = new PropertyReader(properties);

        config.threadPoolSize = reader.intValue("threadPoolSize", config.threadPoolSize);
        config.cacheMaxEntries = reader.intValue("cacheMaxEntries", config.cacheMaxEntries);
        config.cacheTtl = reader.millis("cacheTtl", config.cacheTtl);
        config.historyLimit = reader.intValue("historyLimit", config.historyLimit);
        config.planTimeoutFloor = reader.millis("planTimeoutFloor", config.planTimeoutFloor);
        config.performanceThreshold =
                reader.millis("performanceThreshold", config.performanceThreshold);
        config.costThreshold = reader.doubleValue("costThreshold", config.costThreshold);
        config.reliabilityThreshold =
                reader.doubleValue("reliabilityThreshold", config.reliabilityThreshold);
        config.maxParallelExecutions =
                reader.intValue("maxParallelExecutions", config.maxParallelExecutions);
        config.cachingEnabled = reader.bool("cachingEnabled", config.cachingEnabled);
        config.learningEnabled = reader.bool("learningEnabled", config.learningEnabled);
        config.predictiveOptimization =
                reader.bool("predictiveOptimization", config.predictiveOptimization);
        config.strictRegistration = reader.bool("strictRegistration", config.strictRegistration);
        config.registerBuiltInTools =
                reader.bool("registerBuiltInTools", config.registerBuiltInTools);
        String policy = reader.raw("dependencyFailurePolicy");
        if (policy != null) {
            config.dependencyFailurePolicy =
                    DependencyFailurePolicy.valueOf(policy.toUpperCase(Locale.ROOT));
        }
        return config;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    private record PropertyReader(Properties properties) {

        String raw(String option) {
            String value = properties.getProperty(PROPERTY_PREFIX + option);
            return value != null && !value.isBlank() ? value.trim() : null;
        }

        int intValue(String option, int fallback) {
            String value = raw(option);
            try {
                return value != null ? Integer.parseInt(value) : fallback;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid integer for " + PROPERTY_PREFIX + option + ": " + value, e);
            }
        }

        double doubleValue(String option, double fallback) {
            String value = raw(option);
            try {
                return value != null ? Double.parseDouble(value) : fallback;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid number for " + PROPERTY_PREFIX + option + ": " + value, e);
            }
        }

        Duration millis(String option, Duration fallback) {
            String value = raw(option);
            try {
                return value != null ? Duration.ofMillis(Long.parseLong(value)) : fallback;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid milliseconds for " + PROPERTY_PREFIX + option + ": " + value, e);
            }
        }

        boolean bool(String option, boolean fallback) {
            String value = raw(option);
            return value != null ? Boolean.parseBoolean(value) : fallback;
        }
    }

    /// Fluent builder for constructing {@link WeftConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}. The returned config can still be modified
    /// via setters after building.
    public static class Builder {
        private final WeftConfig config = new WeftConfig();

        public Builder threadPoolSize(int threadPoolSize) {
            config.setThreadPoolSize(threadPoolSize);
            return this;
        }

        public Builder cacheMaxEntries(int cacheMaxEntries) {
            config.setCacheMaxEntries(cacheMaxEntries);
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            config.setCacheTtl(cacheTtl);
            return this;
        }

        public Builder historyLimit(int historyLimit) {
            config.setHistoryLimit(historyLimit);
            return this;
        }

        public Builder planTimeoutFloor(Duration planTimeoutFloor) {
            config.setPlanTimeoutFloor(planTimeoutFloor);
            return this;
        }

        public Builder performanceThreshold(Duration performanceThreshold) {
            config.setPerformanceThreshold(performanceThreshold);
            return this;
        }

        public Builder costThreshold(double costThreshold) {
            config.setCostThreshold(costThreshold);
            return this;
        }

        public Builder reliabilityThreshold(double reliabilityThreshold) {
            config.setReliabilityThreshold(reliabilityThreshold);
            return this;
        }

        public Builder maxParallelExecutions(int maxParallelExecutions) {
            config.setMaxParallelExecutions(maxParallelExecutions);
            return this;
        }

        public Builder cachingEnabled(boolean cachingEnabled) {
            config.setCachingEnabled(cachingEnabled);
            return this;
        }

        public Builder learningEnabled(boolean learningEnabled) {
            config.setLearningEnabled(learningEnabled);
            return this;
        }

        public Builder predictiveOptimization(boolean predictiveOptimization) {
            config.setPredictiveOptimization(predictiveOptimization);
            return this;
        }

        public Builder strictRegistration(boolean strictRegistration) {
            config.setStrictRegistration(strictRegistration);
            return this;
        }

        public Builder registerBuiltInTools(boolean registerBuiltInTools) {
            config.setRegisterBuiltInTools(registerBuiltInTools);
            return this;
        }

        public Builder dependencyFailurePolicy(DependencyFailurePolicy policy) {
            config.setDependencyFailurePolicy(policy);
            return this;
        }

        /// Builds and returns the configured {@link WeftConfig} instance.
        ///
        /// @return the configured instance, never null
        public WeftConfig build() {
            return config;
        }
    }
}
