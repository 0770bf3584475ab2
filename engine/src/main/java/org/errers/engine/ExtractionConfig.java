package org.errers.engine;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.errers.engine.scan.AutoRulePolicy;
import org.errers.engine.source.DocumentSource;

/**
 * Settings of an extraction run.
 */
public final class ExtractionConfig {
    private static final String TIMEOUT_PROPERTY = "errers.timeout";
    private static final String MAX_ITERATIONS_PROPERTY = "errers.maxIterations";
    private static final String TRACE_PROPERTY = "errers.trace";
    private static final String PATTERNS_PROPERTY = "errers.patterns";
    private static final String TIMEOUT_MODE_PROPERTY = "errers.timeoutMode";
    private static final String TIMEOUT_ENV = "ERRERS_TIMEOUT";
    private static final String MAX_ITERATIONS_ENV = "ERRERS_MAX_ITERATIONS";
    private static final String TRACE_ENV = "ERRERS_TRACE";
    private static final String PATTERNS_ENV = "ERRERS_PATTERNS";
    private static final String TIMEOUT_MODE_ENV = "ERRERS_TIMEOUT_MODE";

    private final String outputPattern;
    private final Duration ruleTimeout;
    private final TimeoutMode timeoutMode;
    private final int maxIterations;
    private final boolean singlePass;
    private final boolean patternListing;
    private final boolean executionTrace;
    private final Path rootDirectory;
    private final boolean autoRules;
    private final boolean defaultRules;
    private final boolean localRules;
    private final AutoRulePolicy autoRulePolicy;

    private ExtractionConfig(Builder builder) {
        this.outputPattern = builder.outputPattern;
        this.ruleTimeout = builder.ruleTimeout;
        this.timeoutMode = builder.timeoutMode;
        this.maxIterations = builder.maxIterations;
        this.singlePass = builder.singlePass;
        this.patternListing = builder.patternListing;
        this.executionTrace = builder.executionTrace;
        this.rootDirectory = builder.rootDirectory;
        this.autoRules = builder.autoRules;
        this.defaultRules = builder.defaultRules;
        this.localRules = builder.localRules;
        this.autoRulePolicy = builder.autoRulePolicy;
    }

    public static ExtractionConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Defaults overridden by {@code errers.*} system properties, or the matching {@code ERRERS_*} environment
     * variables when a property is not set. The timeout is given in seconds.
     */
    public static ExtractionConfig fromSystemProperties() {
        Builder builder = builder();
        setting(TIMEOUT_PROPERTY, TIMEOUT_ENV)
                .ifPresent(value -> builder.ruleTimeout(Duration.ofMillis(Math.round(Double.parseDouble(value) * 1000))));
        setting(MAX_ITERATIONS_PROPERTY, MAX_ITERATIONS_ENV)
                .ifPresent(value -> builder.maxIterations(Integer.parseInt(value.strip())));
        setting(TRACE_PROPERTY, TRACE_ENV).ifPresent(value -> builder.executionTrace(Boolean.parseBoolean(value)));
        setting(PATTERNS_PROPERTY, PATTERNS_ENV).ifPresent(value -> builder.patternListing(Boolean.parseBoolean(value)));
        setting(TIMEOUT_MODE_PROPERTY, TIMEOUT_MODE_ENV)
                .ifPresent(value -> builder.timeoutMode(TimeoutMode.valueOf(value.strip().toUpperCase(Locale.ROOT))));
        return builder.build();
    }

    private static Optional<String> setting(String property, String environment) {
        String value = System.getProperty(property);
        if (value == null) {
            value = System.getenv(environment);
        }
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    public String getOutputPattern() {
        return outputPattern;
    }

    public Duration getRuleTimeout() {
        return ruleTimeout;
    }

    public TimeoutMode getTimeoutMode() {
        return timeoutMode;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public boolean isSinglePass() {
        return singlePass;
    }

    public boolean isPatternListing() {
        return patternListing;
    }

    public boolean isExecutionTrace() {
        return executionTrace;
    }

    public Optional<Path> getRootDirectory() {
        return Optional.ofNullable(rootDirectory);
    }

    public boolean isAutoRules() {
        return autoRules;
    }

    public boolean isDefaultRules() {
        return defaultRules;
    }

    public boolean isLocalRules() {
        return localRules;
    }

    public AutoRulePolicy getAutoRulePolicy() {
        return autoRulePolicy;
    }

    /** Output file for {@code source}: {@code {stem}} and {@code {name}} are replaced in the output pattern. */
    public Path resolveOutputPath(DocumentSource source) {
        String fileName = outputPattern.replace("{stem}", source.getStem()).replace("{name}", source.getName());
        Path output = Path.of(fileName);
        if (output.isAbsolute()) {
            return output;
        }
        return source.getDirectory().map(directory -> directory.resolve(output)).orElse(output);
    }

    public Builder toBuilder() {
        return builder()
                .outputPattern(outputPattern)
                .ruleTimeout(ruleTimeout)
                .timeoutMode(timeoutMode)
                .maxIterations(maxIterations)
                .singlePass(singlePass)
                .patternListing(patternListing)
                .executionTrace(executionTrace)
                .rootDirectory(rootDirectory)
                .autoRules(autoRules)
                .defaultRules(defaultRules)
                .localRules(localRules)
                .autoRulePolicy(autoRulePolicy);
    }

    public static final class Builder {
        private String outputPattern = "{stem}.txt";
        private Duration ruleTimeout = Duration.ofSeconds(5);
        private TimeoutMode timeoutMode = TimeoutMode.ENFORCED;
        private int maxIterations = 1000;
        private boolean singlePass;
        private boolean patternListing;
        private boolean executionTrace;
        private Path rootDirectory;
        private boolean autoRules = true;
        private boolean defaultRules = true;
        private boolean localRules = true;
        private AutoRulePolicy autoRulePolicy = AutoRulePolicy.defaults();

        private Builder() {}

        public Builder outputPattern(String outputPattern) {
            this.outputPattern = Objects.requireNonNull(outputPattern, "outputPattern");
            return this;
        }

        public Builder ruleTimeout(Duration ruleTimeout) {
            Objects.requireNonNull(ruleTimeout, "ruleTimeout");
            if (ruleTimeout.isNegative() || ruleTimeout.isZero()) {
                throw new IllegalArgumentException("Rule timeout must be positive: " + ruleTimeout);
            }
            this.ruleTimeout = ruleTimeout;
            return this;
        }

        public Builder timeoutMode(TimeoutMode timeoutMode) {
            this.timeoutMode = Objects.requireNonNull(timeoutMode, "timeoutMode");
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            if (maxIterations < 1) {
                throw new IllegalArgumentException("maxIterations must be at least 1: " + maxIterations);
            }
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder singlePass(boolean singlePass) {
            this.singlePass = singlePass;
            return this;
        }

        public Builder patternListing(boolean patternListing) {
            this.patternListing = patternListing;
            return this;
        }

        public Builder executionTrace(boolean executionTrace) {
            this.executionTrace = executionTrace;
            return this;
        }

        /** Directory included files are resolved against; defaults to the document's directory. */
        public Builder rootDirectory(Path rootDirectory) {
            this.rootDirectory = rootDirectory;
            return this;
        }

        public Builder autoRules(boolean autoRules) {
            this.autoRules = autoRules;
            return this;
        }

        public Builder defaultRules(boolean defaultRules) {
            this.defaultRules = defaultRules;
            return this;
        }

        public Builder localRules(boolean localRules) {
            this.localRules = localRules;
            return this;
        }

        public Builder autoRulePolicy(AutoRulePolicy autoRulePolicy) {
            this.autoRulePolicy = Objects.requireNonNull(autoRulePolicy, "autoRulePolicy");
            return this;
        }

        public ExtractionConfig build() {
            return new ExtractionConfig(this);
        }
    }
}
