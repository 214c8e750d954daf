package org.dbreport;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Computes a {@link MetricsRecord} from the raw Locust tables of one database.
 * 
 * <p><b>Aggregate row:</b> Locust appends a row named {@code Aggregated} that sums all
 * endpoints. Its last occurrence is used; without one, the last row of the stats
 * table stands in for it. Without a stats table every stats-derived field is zero.
 * 
 * <p><b>Scalability:</b> {@code maxUsersReached} is the peak of the history's
 * {@code User Count} column, compared with the target user count encoded in the
 * results directory name.
 * 
 * <p><b>Consistency:</b> variability is measured over history samples with positive
 * throughput only, so ramp-up and shutdown gaps do not inflate the standard deviation.
 * Standard deviations are sample deviations (n - 1); a single sample has zero deviation.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public final class MetricsExtractor {
    private static final Logger LOG = Logger.getLogger(MetricsExtractor.class.getName());

    public static final String AGGREGATE_ROW_NAME = "Aggregated";

    static final String COL_NAME = "Name";
    static final String COL_REQUEST_COUNT = "Request Count";
    static final String COL_REQUESTS_PER_SEC = "Requests/s";
    static final String COL_AVG_RESPONSE = "Average Response Time";
    static final String COL_MEDIAN_RESPONSE = "Median Response Time";
    static final String COL_MIN_RESPONSE = "Min Response Time";
    static final String COL_MAX_RESPONSE = "Max Response Time";
    static final String COL_P50 = "50%";
    static final String COL_P90 = "90%";
    static final String COL_P95 = "95%";
    static final String COL_P99 = "99%";
    static final String COL_FAILURE_COUNT = "Failure Count";
    static final String COL_USER_COUNT = "User Count";
    static final String COL_TOTAL_AVG_RESPONSE = "Total Average Response Time";

    private MetricsExtractor() {
    }

    /**
     * Computes the metrics of one result group.
     * 
     * @param group The located result group (supplies name and target user count)
     * @param tables The tables loaded for the group
     * @return The computed metrics
     */
    public static MetricsRecord extract(ResultGroup group, RawRecordTables tables) {
        MetricsRecord.Builder b = MetricsRecord.builder(group.getName());

        long targetUsers = group.getTargetUserCount();
        long maxUsers = maxUsersReached(tables.history());
        b.targetUsers(targetUsers)
         .maxUsersReached(maxUsers)
         .userAchievementRate(ratio(maxUsers, targetUsers) * 100.0);

        Optional<CsvTable> stats = tables.stats().filter(t -> !t.isEmpty());
        if (stats.isPresent()) {
            CsvTable table = stats.get();
            int row = aggregateRowIndex(table);
            long requests = (long) cell(table, row, COL_REQUEST_COUNT);
            long failures = (long) cell(table, row, COL_FAILURE_COUNT);
            double rps = cell(table, row, COL_REQUESTS_PER_SEC);
            b.totalRequests(requests)
             .requestsPerSec(rps)
             .avgResponseTime(cell(table, row, COL_AVG_RESPONSE))
             .medianResponseTime(cell(table, row, COL_MEDIAN_RESPONSE))
             .minResponseTime(cell(table, row, COL_MIN_RESPONSE))
             .maxResponseTime(cell(table, row, COL_MAX_RESPONSE))
             .p50(cell(table, row, COL_P50))
             .p90(cell(table, row, COL_P90))
             .p95(cell(table, row, COL_P95))
             .p99(cell(table, row, COL_P99))
             .totalFailures(failures)
             .failureRate(ratio(failures, requests) * 100.0)
             .throughputPerUser(ratio(rps, maxUsers));
        } else {
            LOG.info(() -> "No stats data for " + group.getName() + ", stats-derived metrics default to 0");
        }

        applyConsistency(b, tables.history());

        b.failureLogRows(tables.failures().map(CsvTable::size).orElse(-1));
        b.exceptionLogRows(tables.exceptions().map(CsvTable::size).orElse(-1));
        return b.build();
    }

    /**
     * Picks the aggregate row: the last row named {@value #AGGREGATE_ROW_NAME}, else the last row.
     * 
     * @param stats A non-empty stats table
     * @return Zero-based row index
     */
    static int aggregateRowIndex(CsvTable stats) {
        for (int i = stats.size() - 1; i >= 0; i--) {
            if (AGGREGATE_ROW_NAME.equals(stats.get(i, COL_NAME))) {
                return i;
            }
        }
        return stats.size() - 1;
    }

    static long maxUsersReached(Optional<CsvTable> history) {
        if (history.isEmpty() || history.get().isEmpty()) {
            return 0;
        }
        double max = 0;
        for (double users : history.get().column(COL_USER_COUNT)) {
            if (!Double.isNaN(users) && users > max) {
                max = users;
            }
        }
        return (long) max;
    }

    private static void applyConsistency(MetricsRecord.Builder b, Optional<CsvTable> history) {
        if (history.isEmpty() || history.get().isEmpty()) {
            return;
        }
        CsvTable table = history.get();
        double[] throughput = table.column(COL_REQUESTS_PER_SEC);
        double[] latency = table.column(COL_TOTAL_AVG_RESPONSE);

        DescriptiveStatistics throughputStats = new DescriptiveStatistics();
        DescriptiveStatistics latencyStats = new DescriptiveStatistics();
        for (int i = 0; i < throughput.length; i++) {
            // NaN fails the comparison as well
            if (!(throughput[i] > 0)) {
                continue;
            }
            throughputStats.addValue(throughput[i]);
            if (i < latency.length && !Double.isNaN(latency[i])) {
                latencyStats.addValue(latency[i]);
            }
        }
        if (throughputStats.getN() == 0) {
            return;
        }

        double stdDev = throughputStats.getStandardDeviation();
        double mean = throughputStats.getMean();
        b.throughputStdDev(stdDev)
         .throughputCV(ratio(stdDev, mean))
         .latencyStdDev(latencyStats.getN() == 0 ? 0.0 : latencyStats.getStandardDeviation());
    }

    private static double cell(CsvTable table, int row, String column) {
        double value = table.getDouble(row, column);
        if (Double.isNaN(value)) {
            LOG.fine(() -> "Column '" + column + "' missing or not numeric, using 0");
            return 0.0;
        }
        return value;
    }

    /**
     * Division that yields 0 for a zero (or non-positive) denominator.
     */
    static double ratio(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator : 0.0;
    }
}
