package org.dbreport;

import io.prometheus.client.Histogram;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * Compares the load-test results of every database found in one results directory.
 * 
 * <p>A comparison runs in three steps:
 * <ol>
 *   <li>discover the databases ({@link ResultSetLocator})</li>
 *   <li>load and extract metrics per database ({@link MetricsExtractor}); this step is
 *       independent per database and runs on a thread pool when {@code threads > 1}</li>
 *   <li>score the complete batch ({@link ScoreNormalizer}) and rank it ({@link ComparisonReport})</li>
 * </ol>
 * 
 * <p>Either every database is scored or the comparison fails as a whole; there is no
 * partial report. A directory without results is reported as {@link Optional#empty()}.
 * 
 * <p>Instances hold only the results directory and the current weights. Comparisons over
 * different directories may run concurrently on separate instances.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class DatabaseComparator {
    private static final Logger LOG = Logger.getLogger(DatabaseComparator.class.getName());

    private final Path resultsDir;
    private final int threads;
    private WeightConfiguration weights = WeightConfiguration.defaults();

    /**
     * Creates a comparator with default weights and sequential extraction.
     * 
     * @param resultsDir Directory containing the test results (e.g. {@code 100_1m})
     */
    public DatabaseComparator(Path resultsDir) {
        this(resultsDir, 1);
    }

    /**
     * Creates a comparator with default weights.
     * 
     * @param resultsDir Directory containing the test results
     * @param threads Number of databases extracted concurrently; values below 2 extract sequentially
     */
    public DatabaseComparator(Path resultsDir, int threads) {
        this.resultsDir = resultsDir;
        this.threads = threads;
    }

    public Path getResultsDir() {
        return resultsDir;
    }

    public WeightConfiguration getWeights() {
        return weights;
    }

    public void setWeights(WeightConfiguration weights) {
        this.weights = weights;
    }

    /**
     * Merges a JSON weight override into the current weights.
     * 
     * <p>A malformed override is rejected as a whole and the previous weights stay in effect.
     * 
     * @param json A JSON object such as {@code {"throughput":0.5,"latency":0.3}}
     * @return Empty on success, otherwise a warning describing why the override was rejected
     */
    public Optional<String> applyWeightOverride(String json) {
        try {
            Map<String, Double> overrides = WeightConfiguration.parseOverrides(json);
            weights = weights.withOverrides(overrides);
            LOG.info(() -> "Using custom weights: " + weights);
            return Optional.empty();
        } catch (MalformedWeightsException e) {
            String warning = "Invalid weights (" + e.getMessage() + "), keeping " + weights;
            LOG.warning(warning);
            return Optional.of(warning);
        }
    }

    /**
     * Lists the databases with results in the directory.
     * 
     * @return Sorted database names
     * @throws IOException If the directory cannot be listed
     */
    public List<String> discoverDatabases() throws IOException {
        return ResultSetLocator.discover(resultsDir);
    }

    /**
     * Runs the complete comparison.
     * 
     * @return The ranked report, or empty if no database results were found
     * @throws IOException If an existing result file cannot be read
     */
    public Optional<ComparisonReport> compare() throws IOException {
        List<String> databases = discoverDatabases();
        if (databases.isEmpty()) {
            LOG.warning(() -> "No database test results found in " + resultsDir);
            ReportMetrics.comparisons.labels("no_results").inc();
            return Optional.empty();
        }
        ReportMetrics.groupsDiscovered.inc(databases.size());
        LOG.info(() -> "Found databases: " + String.join(", ", databases));

        List<MetricsRecord> metrics = threads > 1 && databases.size() > 1
            ? extractParallel(databases)
            : extractSequential(databases);

        List<ScoredRecord> scored = ScoreNormalizer.score(metrics, weights);
        ComparisonReport report = new ComparisonReport(resultsDir, weights, scored);
        ReportMetrics.recordScores(report);
        ReportMetrics.comparisons.labels("ranked").inc();
        return Optional.of(report);
    }

    /**
     * Loads and extracts the metrics of one database.
     * 
     * @param database Database name as discovered
     * @return The extracted metrics
     * @throws IOException If an existing result file cannot be read
     */
    public MetricsRecord analyze(String database) throws IOException {
        Histogram.Timer timer = ReportMetrics.extraction.startTimer();
        try {
            LOG.fine(() -> "Analyzing " + database);
            ResultGroup group = ResultSetLocator.locate(resultsDir, database);
            return MetricsExtractor.extract(group, RawRecordTables.load(group));
        } finally {
            timer.observeDuration();
        }
    }

    private List<MetricsRecord> extractSequential(List<String> databases) throws IOException {
        List<MetricsRecord> metrics = new ArrayList<>(databases.size());
        for (String database : databases) {
            metrics.add(analyze(database));
        }
        return metrics;
    }

    private List<MetricsRecord> extractParallel(List<String> databases) throws IOException {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, databases.size()));
        try {
            List<Future<MetricsRecord>> futures = new ArrayList<>(databases.size());
            for (String database : databases) {
                futures.add(pool.submit(() -> analyze(database)));
            }
            // Collect in discovery order regardless of completion order
            List<MetricsRecord> metrics = new ArrayList<>(databases.size());
            for (Future<MetricsRecord> future : futures) {
                metrics.add(future.get());
            }
            return metrics;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException ex = new InterruptedIOException("Metric extraction interrupted");
            ex.initCause(e);
            throw ex;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Metric extraction failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }
}
