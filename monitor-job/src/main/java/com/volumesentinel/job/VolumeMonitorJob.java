package com.volumesentinel.job;

import com.volumesentinel.core.config.ConfigLoader;
import com.volumesentinel.core.config.MonitoringConfig;
import com.volumesentinel.core.config.SensitivityPreset;
import com.volumesentinel.core.model.Alert;
import com.volumesentinel.core.model.MonitoringResult;
import com.volumesentinel.core.model.Severity;
import com.volumesentinel.core.model.VolumeObservation;
import com.volumesentinel.core.orchestration.MonitoringException;
import com.volumesentinel.core.orchestration.MonitoringOrchestrator;
import com.volumesentinel.core.orchestration.MonitoringRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Entry point of the weekly volume check.
 *
 * <h3>Flow</h3>
 *
 * <pre>
 *   env            → JobConfig
 *   monitoring.yml → MonitoringConfig → SensitivityPreset
 *   JSON rows      → ObservationReader → VolumeObservation[]
 *                  → MonitoringOrchestrator
 *                  → ResultWriter → JSON (file or stdout)
 * </pre>
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@value #EXIT_NO_ALERTS}: no alerts</li>
 * <li>{@value #EXIT_ALERTS}: at least one alert</li>
 * <li>{@value #EXIT_FATAL}: the run could not complete</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class VolumeMonitorJob {

    private static final Logger LOG = LoggerFactory.getLogger(VolumeMonitorJob.class);

    public static final int EXIT_NO_ALERTS = 0;
    public static final int EXIT_ALERTS = 1;
    public static final int EXIT_FATAL = 2;

    private VolumeMonitorJob() {
        // entry-point class: not instantiable
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(JobConfig.fromEnvironment());
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Invalid job configuration: {}", e.getMessage(), e);
            exitCode = EXIT_FATAL;
        }
        System.exit(exitCode);
    }

    /**
     * Execute one check.
     *
     * @return the process exit code
     */
    static int run(JobConfig config) {
        LOG.info("Starting Volume Sentinel with config: {}", config);
        try {
            // 1. Monitoring config and preset
            MonitoringConfig monitoringConfig = loadConfig(config);
            SensitivityPreset preset = monitoringConfig.resolvePreset(
                    config.getSensitivity().isEmpty() ? null : config.getSensitivity());
            LOG.info("Using sensitivity preset {}", preset);

            // 2. Observations
            List<VolumeObservation> observations = new ObservationReader()
                    .read(Path.of(config.getObservationsPath()));

            // 3. Check
            MonitoringRequest request = MonitoringRequest.builder()
                    .checkDate(config.getCheckDate())
                    .preset(preset)
                    .includeTrends(config.isIncludeTrends())
                    .build();
            MonitoringResult result = MonitoringOrchestrator
                    .fromConfig(monitoringConfig, config.getParallelism())
                    .run(observations, request);

            // 4. Output
            ResultWriter writer = new ResultWriter();
            if (config.getOutputPath().isEmpty()) {
                writer.write(result, System.out);
            } else {
                writer.write(result, Path.of(config.getOutputPath()));
            }
            logReport(result);
            return result.hasAlerts() ? EXIT_ALERTS : EXIT_NO_ALERTS;
        } catch (MonitoringException e) {
            LOG.error("Monitoring run failed: {}", e.getMessage(), e);
            return EXIT_FATAL;
        } catch (IOException e) {
            LOG.error("I/O failure: {}", e.getMessage(), e);
            return EXIT_FATAL;
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Invalid configuration: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static MonitoringConfig loadConfig(JobConfig config) {
        String path = config.getMonitoringConfigPath();
        if (path != null && !path.isBlank()) {
            return ConfigLoader.fromFile(path);
        }
        return ConfigLoader.load();
    }

    private static void logReport(MonitoringResult result) {
        if (!result.hasAlerts()) {
            LOG.info("Week {}: no alerts - all combinations within normal volume ranges", result.getCheckDate());
            return;
        }
        LOG.warn("Week {}: {} alert(s) {}", result.getCheckDate(), result.getAlertCount(),
                result.getSeverityCounts());
        for (Severity severity : Severity.values()) {
            for (Alert alert : result.getAlerts()) {
                if (alert.getSeverity() == severity) {
                    LOG.warn("[{}] {}/{} volume={} threshold={} mean={} drop={}% - {}", severity,
                            alert.getSystemId(), alert.getMessageType(), alert.getCurrentVolume(),
                            alert.getThreshold(), String.format(Locale.ROOT, "%.0f", alert.getMean()),
                            String.format(Locale.ROOT, "%.1f", alert.getDropPct()), alert.getMessage());
                }
            }
        }
    }
}
