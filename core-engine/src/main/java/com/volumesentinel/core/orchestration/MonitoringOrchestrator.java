package com.volumesentinel.core.orchestration;

import com.volumesentinel.core.config.MonitoringConfig;
import com.volumesentinel.core.config.SensitivityPreset;
import com.volumesentinel.core.detection.AlertClassifier;
import com.volumesentinel.core.detection.FrequencyDetector;
import com.volumesentinel.core.detection.ThresholdCalculator;
import com.volumesentinel.core.detection.ThresholdOverrideProvider;
import com.volumesentinel.core.detection.VolumeStatistics;
import com.volumesentinel.core.model.Alert;
import com.volumesentinel.core.model.CombinationKey;
import com.volumesentinel.core.model.CombinationSeries;
import com.volumesentinel.core.model.FrequencyProfile;
import com.volumesentinel.core.model.MonitoringResult;
import com.volumesentinel.core.model.RecentComparison;
import com.volumesentinel.core.model.ThresholdRecord;
import com.volumesentinel.core.model.TrendRecord;
import com.volumesentinel.core.model.VolumeObservation;
import com.volumesentinel.core.trend.TrendAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs one or more weekly checks over a set of observations.
 *
 * <h3>Phases</h3>
 *
 * <pre>
 *   LOADED       group observations into per-combination series
 *   PROFILED     frequency profile of every combination's training window
 *   THRESHOLDED  threshold record per combination at the requested sensitivity
 *   CLASSIFIED   alert verdict for the check week (+ optional trends)
 *   DONE         results sorted by combination
 * </pre>
 *
 * <p>
 * Each phase is a data-parallel map over independent combinations on a
 * fixed worker pool. Workers write only their own combination's entry, and
 * the phase is joined before the next one starts. The training window is
 * always the weeks strictly before the check date.
 * </p>
 *
 * <h3>Failure handling</h3>
 * <p>
 * A failure inside one combination is logged and degraded to an insufficient
 * profile or threshold; other combinations are unaffected. Only input that
 * cannot be monitored at all raises {@link MonitoringException}.
 * </p>
 *
 * <p>
 * Profiles and thresholds are cached for the duration of one
 * {@link #runAll(Collection, List)} call, so checking the same date at several
 * sensitivities profiles each combination once.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitoringOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(MonitoringOrchestrator.class);

    /** Trailing training weeks averaged into an alert's context. */
    public static final int RECENT_AVERAGE_WEEKS = 4;

    private final FrequencyDetector frequencyDetector;
    private final ThresholdCalculator thresholdCalculator;
    private final AlertClassifier alertClassifier;
    private final TrendAnalyzer trendAnalyzer;
    private final int parallelism;

    public MonitoringOrchestrator(ThresholdOverrideProvider overrides, int parallelism) {
        this(new FrequencyDetector(), new ThresholdCalculator(overrides), new AlertClassifier(),
                new TrendAnalyzer(), parallelism);
    }

    public MonitoringOrchestrator(FrequencyDetector frequencyDetector, ThresholdCalculator thresholdCalculator,
            AlertClassifier alertClassifier, TrendAnalyzer trendAnalyzer, int parallelism) {
        this.frequencyDetector = Objects.requireNonNull(frequencyDetector, "frequencyDetector must not be null");
        this.thresholdCalculator = Objects.requireNonNull(thresholdCalculator, "thresholdCalculator must not be null");
        this.alertClassifier = Objects.requireNonNull(alertClassifier, "alertClassifier must not be null");
        this.trendAnalyzer = Objects.requireNonNull(trendAnalyzer, "trendAnalyzer must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    public static MonitoringOrchestrator fromConfig(MonitoringConfig config, int parallelism) {
        Objects.requireNonNull(config, "config must not be null");
        return new MonitoringOrchestrator(config.overrideProvider(), parallelism);
    }

    // ---------------------------------------------------------------
    // Entry points
    // ---------------------------------------------------------------

    /**
     * Run a single check.
     *
     * @throws MonitoringException if the observations cannot be monitored
     */
    public MonitoringResult run(Collection<VolumeObservation> observations, MonitoringRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        return runAll(observations, List.of(request)).get(0);
    }

    /**
     * Run several checks over the same observations, in request order.
     *
     * @param observations all rows of the run
     * @param requests     checks to perform
     * @return one result per request
     * @throws MonitoringException if the observations are empty or hold no
     *                             week before a requested check date
     */
    public List<MonitoringResult> runAll(Collection<VolumeObservation> observations,
            List<MonitoringRequest> requests) {
        Objects.requireNonNull(observations, "observations must not be null");
        Objects.requireNonNull(requests, "requests must not be null");
        if (observations.isEmpty()) {
            throw new MonitoringException("No volume observations supplied - nothing to monitor");
        }

        Map<CombinationKey, CombinationSeries> series = CombinationSeries.groupByCombination(observations);
        LOG.info("Loaded {} observation(s) across {} combination(s)", observations.size(), series.size());

        BaselineCache cache = new BaselineCache();
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
        try {
            List<MonitoringResult> results = new ArrayList<>(requests.size());
            for (MonitoringRequest request : requests) {
                results.add(execute(series, request, cache, pool));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    // ---------------------------------------------------------------
    // Phases
    // ---------------------------------------------------------------

    private MonitoringResult execute(Map<CombinationKey, CombinationSeries> allSeries, MonitoringRequest request,
            BaselineCache cache, ExecutorService pool) {
        LocalDate checkDate = request.getCheckDate();
        SensitivityPreset preset = request.getPreset();
        MonitoringRun run = new MonitoringRun(checkDate, preset.getName());

        boolean anyTraining = allSeries.values().stream()
                .anyMatch(s -> s.getObservations().stream().anyMatch(o -> o.getWeekStartDate().isBefore(checkDate)));
        if (!anyTraining) {
            throw new MonitoringException("No observations before check date " + checkDate
                    + " - no training window can be built");
        }

        Map<CombinationKey, CombinationSeries> universe = universe(allSeries, request);
        LOG.info("Checking week {} at sensitivity '{}' for {} combination(s)",
                checkDate, preset.getName(), universe.size());

        // every known combination gets a threshold row, even one that starts after the check date
        Map<CombinationKey, CombinationSeries> training = new TreeMap<>();
        allSeries.forEach((key, s) -> training.put(key, s.before(checkDate)));
        universe.forEach((key, s) -> training.put(key, s.before(checkDate)));
        if (training.size() > universe.size()) {
            LOG.debug("{} combination(s) start after {} and are reported as insufficient history only",
                    training.size() - universe.size(), checkDate);
        }

        Map<CombinationKey, FrequencyProfile> profiles = parallelMap(pool, training.keySet(), key ->
                cache.profiles.computeIfAbsent(new ProfileKey(key, checkDate), k -> profile(training.get(key))));
        run.advance(RunState.PROFILED);

        Map<CombinationKey, ThresholdRecord> thresholds = parallelMap(pool, training.keySet(), key ->
                cache.thresholds.computeIfAbsent(new ThresholdKey(key, checkDate, preset),
                        k -> threshold(training.get(key), profiles.get(key), preset)));
        run.advance(RunState.THRESHOLDED);

        Map<CombinationKey, Optional<Alert>> verdicts = parallelMap(pool, universe.keySet(), key ->
                classify(universe.get(key), training.get(key), checkDate, thresholds.get(key)));

        List<TrendRecord> trends = new ArrayList<>();
        List<RecentComparison> comparisons = new ArrayList<>();
        if (request.isIncludeTrends()) {
            Map<CombinationKey, TrendOutcome> trendOutcomes = parallelMap(pool, universe.keySet(), key ->
                    trend(universe.get(key).upTo(checkDate)));
            trendOutcomes.values().forEach(t -> {
                trends.addAll(t.trends);
                comparisons.add(t.comparison);
            });
        }
        run.advance(RunState.CLASSIFIED);

        List<Alert> alerts = new ArrayList<>();
        verdicts.values().forEach(v -> v.ifPresent(alerts::add));
        MonitoringResult result = new MonitoringResult(checkDate, preset.getName(), alerts,
                new ArrayList<>(thresholds.values()), trends, comparisons);
        run.advance(RunState.DONE);

        LOG.info("Week {} [{}]: {} alert(s) {}", checkDate, preset.getName(),
                result.getAlertCount(), result.getSeverityCounts());
        return result;
    }

    /**
     * Combinations classified for the check week: those seen on or before
     * the check date, plus the expected ones. A combination whose first row
     * lies after the check date did not exist yet, so it gets no verdict and
     * no trends, only an insufficient-history threshold row.
     */
    private static Map<CombinationKey, CombinationSeries> universe(Map<CombinationKey, CombinationSeries> allSeries,
            MonitoringRequest request) {
        LocalDate checkDate = request.getCheckDate();
        Map<CombinationKey, CombinationSeries> universe = new TreeMap<>();
        allSeries.forEach((key, s) -> {
            boolean seen = s.getObservations().stream().anyMatch(o -> !o.getWeekStartDate().isAfter(checkDate));
            if (seen) {
                universe.put(key, s);
            }
        });
        for (CombinationKey expected : request.getExpectedCombinations()) {
            universe.computeIfAbsent(expected, key -> allSeries.getOrDefault(key, CombinationSeries.empty(key)));
        }
        return universe;
    }

    private FrequencyProfile profile(CombinationSeries training) {
        try {
            return frequencyDetector.detect(training);
        } catch (RuntimeException e) {
            LOG.error("Frequency detection failed for {} - treating as insufficient", training.getKey(), e);
            return FrequencyProfile.insufficient(0);
        }
    }

    private ThresholdRecord threshold(CombinationSeries training, FrequencyProfile profile,
            SensitivityPreset preset) {
        try {
            return thresholdCalculator.calculate(training.getKey(), training.volumes(), profile, preset);
        } catch (RuntimeException e) {
            LOG.error("Threshold calculation failed for {} - treating as insufficient history",
                    training.getKey(), e);
            return ThresholdRecord.builder()
                    .key(training.getKey())
                    .sufficientHistory(false)
                    .sampleCount(training.size())
                    .sensitivityLevel(preset.getName())
                    .adjustedZ(preset.getZScore())
                    .frequencyProfile(profile)
                    .build();
        }
    }

    private Optional<Alert> classify(CombinationSeries series, CombinationSeries training, LocalDate checkDate,
            ThresholdRecord threshold) {
        OptionalLong current = series.find(checkDate)
                .map(o -> OptionalLong.of(o.getVolume()))
                .orElse(OptionalLong.empty());
        try {
            return alertClassifier.classify(series.getKey(), checkDate, current, threshold,
                    recentAverage(training));
        } catch (RuntimeException e) {
            LOG.error("Alert classification failed for {} week {} - no verdict", series.getKey(), checkDate, e);
            return Optional.empty();
        }
    }

    private TrendOutcome trend(CombinationSeries history) {
        try {
            return new TrendOutcome(trendAnalyzer.analyze(history), trendAnalyzer.compareRecentToHistorical(history));
        } catch (RuntimeException e) {
            LOG.error("Trend analysis failed for {} - reporting undetermined", history.getKey(), e);
            return new TrendOutcome(trendAnalyzer.analyze(CombinationSeries.empty(history.getKey())),
                    RecentComparison.insufficient(history.getKey(), TrendAnalyzer.DEFAULT_RECENT_WEEKS));
        }
    }

    /**
     * @return mean of the last {@value #RECENT_AVERAGE_WEEKS} training
     *         volumes, or {@code null} without training data
     */
    static Double recentAverage(CombinationSeries training) {
        double[] volumes = training.volumes();
        if (volumes.length == 0) {
            return null;
        }
        int from = Math.max(0, volumes.length - RECENT_AVERAGE_WEEKS);
        return VolumeStatistics.mean(Arrays.copyOfRange(volumes, from, volumes.length));
    }

    // ---------------------------------------------------------------
    // Parallel map
    // ---------------------------------------------------------------

    private static <R> Map<CombinationKey, R> parallelMap(ExecutorService pool, Set<CombinationKey> keys,
            Function<CombinationKey, R> task) {
        List<CombinationKey> ordered = new ArrayList<>(new TreeSet<>(keys));
        List<Callable<R>> calls = new ArrayList<>(ordered.size());
        for (CombinationKey key : ordered) {
            calls.add(() -> task.apply(key));
        }

        Map<CombinationKey, R> out = new TreeMap<>();
        try {
            List<Future<R>> futures = pool.invokeAll(calls);
            for (int i = 0; i < ordered.size(); i++) {
                out.put(ordered.get(i), futures.get(i).get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MonitoringException("Monitoring run interrupted", e);
        } catch (ExecutionException e) {
            throw new MonitoringException("Worker failed outside per-combination handling", e.getCause());
        }
        return out;
    }

    // ---------------------------------------------------------------
    // Internal types
    // ---------------------------------------------------------------

    private static final class TrendOutcome {
        private final List<TrendRecord> trends;
        private final RecentComparison comparison;

        private TrendOutcome(List<TrendRecord> trends, RecentComparison comparison) {
            this.trends = trends;
            this.comparison = comparison;
        }
    }

    /** Profiles depend only on the training window, not on sensitivity. */
    private static final class ProfileKey {
        private final CombinationKey key;
        private final LocalDate checkDate;

        private ProfileKey(CombinationKey key, LocalDate checkDate) {
            this.key = key;
            this.checkDate = checkDate;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof ProfileKey that))
                return false;
            return key.equals(that.key) && checkDate.equals(that.checkDate);
        }

        @Override
        public int hashCode() {
            return Objects.hash(key, checkDate);
        }
    }

    private static final class ThresholdKey {
        private final CombinationKey key;
        private final LocalDate checkDate;
        private final SensitivityPreset preset;

        private ThresholdKey(CombinationKey key, LocalDate checkDate, SensitivityPreset preset) {
            this.key = key;
            this.checkDate = checkDate;
            this.preset = preset;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof ThresholdKey that))
                return false;
            return key.equals(that.key) && checkDate.equals(that.checkDate) && preset.equals(that.preset);
        }

        @Override
        public int hashCode() {
            return Objects.hash(key, checkDate, preset);
        }
    }

    private static final class BaselineCache {
        private final Map<ProfileKey, FrequencyProfile> profiles = new ConcurrentHashMap<>();
        private final Map<ThresholdKey, ThresholdRecord> thresholds = new ConcurrentHashMap<>();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "volume-sentinel-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
