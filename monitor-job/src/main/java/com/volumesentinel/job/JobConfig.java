package com.volumesentinel.job;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration of one weekly monitor run.
 *
 * <p>
 * Values are resolved from environment variables with defaults, so the job
 * can be driven from a cron entry, a Kubernetes CronJob or a shell.
 * </p>
 *
 * <h3>Variables</h3>
 * <ul>
 * <li>{@code OBSERVATIONS_PATH}: JSON array of weekly observations
 * (required)</li>
 * <li>{@code CHECK_DATE}: ISO week start to check; defaults to the Monday of
 * the current week</li>
 * <li>{@code SENSITIVITY}: preset name; blank means the configured
 * default</li>
 * <li>{@code MONITORING_CONFIG_PATH}: YAML config file; blank means the
 * classpath {@code monitoring.yml}</li>
 * <li>{@code OUTPUT_PATH}: result file; blank means standard output</li>
 * <li>{@code PARALLELISM}: worker threads; defaults to the processor
 * count</li>
 * <li>{@code INCLUDE_TRENDS}: {@code true}/{@code false}, default
 * {@code true}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    // ---------------------------------------------------------------
    // Input / output
    // ---------------------------------------------------------------
    private final String observationsPath;
    private final String outputPath;

    // ---------------------------------------------------------------
    // Check
    // ---------------------------------------------------------------
    private final LocalDate checkDate;
    private final String sensitivity;
    private final boolean includeTrends;

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------
    private final String monitoringConfigPath;
    private final int parallelism;

    private JobConfig(Builder b) {
        this.observationsPath = b.observationsPath;
        this.outputPath = b.outputPath;
        this.checkDate = b.checkDate;
        this.sensitivity = b.sensitivity;
        this.includeTrends = b.includeTrends;
        this.monitoringConfigPath = b.monitoringConfigPath;
        this.parallelism = b.parallelism;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System.getenv(), LocalDate.now());
    }

    static JobConfig fromEnvironment(Map<String, String> env, LocalDate today) {
        try {
            String checkDate = env(env, "CHECK_DATE", "");
            return new Builder()
                    .observationsPath(env(env, "OBSERVATIONS_PATH", ""))
                    .outputPath(env(env, "OUTPUT_PATH", ""))
                    .checkDate(checkDate.isEmpty() ? currentWeek(today) : LocalDate.parse(checkDate))
                    .sensitivity(env(env, "SENSITIVITY", ""))
                    .includeTrends(parseBoolean("INCLUDE_TRENDS", env(env, "INCLUDE_TRENDS", "true")))
                    .monitoringConfigPath(env(env, "MONITORING_CONFIG_PATH", ""))
                    .parallelism(Integer.parseInt(env(env, "PARALLELISM",
                            String.valueOf(Runtime.getRuntime().availableProcessors()))))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException(
                    "Failed to parse CHECK_DATE (expected yyyy-MM-dd): " + e.getParsedString(), e);
        }
    }

    /**
     * @return the Monday on or before {@code today}
     */
    static LocalDate currentWeek(LocalDate today) {
        return today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getObservationsPath() {
        return observationsPath;
    }

    /**
     * @return the result file, or an empty string for standard output
     */
    public String getOutputPath() {
        return outputPath;
    }

    public LocalDate getCheckDate() {
        return checkDate;
    }

    /**
     * @return the preset name, or an empty string for the configured default
     */
    public String getSensitivity() {
        return sensitivity;
    }

    public boolean isIncludeTrends() {
        return includeTrends;
    }

    public String getMonitoringConfigPath() {
        return monitoringConfigPath;
    }

    public int getParallelism() {
        return parallelism;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} requires an observations path and a check date and
     * rejects a parallelism below one.
     * </p>
     */
    public static class Builder {
        private String observationsPath;
        private String outputPath = "";
        private LocalDate checkDate;
        private String sensitivity = "";
        private boolean includeTrends = true;
        private String monitoringConfigPath = "";
        private int parallelism = 1;

        public Builder observationsPath(String v) {
            this.observationsPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder checkDate(LocalDate v) {
            this.checkDate = v;
            return this;
        }

        public Builder sensitivity(String v) {
            this.sensitivity = v;
            return this;
        }

        public Builder includeTrends(boolean v) {
            this.includeTrends = v;
            return this;
        }

        public Builder monitoringConfigPath(String v) {
            this.monitoringConfigPath = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(observationsPath, "observationsPath");
            Objects.requireNonNull(checkDate, "checkDate required");
            Objects.requireNonNull(outputPath, "outputPath required");
            Objects.requireNonNull(sensitivity, "sensitivity required");
            Objects.requireNonNull(monitoringConfigPath, "monitoringConfigPath required");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static boolean parseBoolean(String name, String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalStateException(name + " must be true or false, got: " + value);
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "observationsPath='" + observationsPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                ", checkDate=" + checkDate +
                ", sensitivity='" + sensitivity + '\'' +
                ", includeTrends=" + includeTrends +
                ", monitoringConfigPath='" + monitoringConfigPath + '\'' +
                ", parallelism=" + parallelism +
                '}';
    }
}
