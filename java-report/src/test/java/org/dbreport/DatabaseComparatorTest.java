package org.dbreport;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.dbreport.LocustFixtures.aggregatedRow;
import static org.dbreport.LocustFixtures.rampHistory;
import static org.dbreport.LocustFixtures.statsRow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseComparatorTest {

    private static final double EPS = 1e-9;

    /**
     * pg sustains every user with lower latency; scylla pushes more requests but drops
     * users and fails some of them.
     */
    static Path writePgVsScylla(Path tmp) throws Exception {
        Path dir = Files.createDirectories(tmp.resolve("1000_1m"));
        LocustFixtures.writeStats(dir, "pg_1000_1m",
            statsRow("GET", "/users", 20_000, 0, 50, 250),
            aggregatedRow(30_000, 0, 50, 500));
        LocustFixtures.writeHistory(dir, "pg_1000_1m", rampHistory(1000, 0, 450, 500, 550));
        LocustFixtures.writeStats(dir, "scylla_1000_1m",
            aggregatedRow(48_000, 480, 80, 800));
        LocustFixtures.writeHistory(dir, "scylla_1000_1m", rampHistory(950, 640, 800, 960));
        LocustFixtures.writeFailures(dir, "scylla_1000_1m", "POST,/users,WriteTimeout,480");
        return dir;
    }

    @Test
    void shouldRankDatabasesFoundInDirectory(@TempDir Path tmp) throws Exception {
        DatabaseComparator comparator = new DatabaseComparator(writePgVsScylla(tmp));

        Optional<ComparisonReport> result = comparator.compare();

        assertTrue(result.isPresent());
        ComparisonReport report = result.get();
        assertEquals(2, report.getRanked().size());

        ScoredRecord pg = report.getWinner();
        ScoredRecord scylla = report.getRanked().get(1);
        assertEquals("pg", pg.getDatabase());
        assertEquals("scylla", scylla.getDatabase());

        assertEquals(100.0, pg.getScalabilityScore(), EPS);
        assertEquals(95.0, scylla.getScalabilityScore(), EPS);
        assertEquals(62.5, pg.getThroughputScore(), EPS);
        assertEquals(100.0, scylla.getThroughputScore(), EPS);
        assertEquals(100.0, pg.getLatencyScore(), EPS);
        assertEquals(0.0, scylla.getLatencyScore(), EPS);
        assertEquals(100.0, pg.getReliabilityScore(), EPS);
        assertEquals(0.0, scylla.getReliabilityScore(), EPS);
        // CV: pg 0.1, scylla 0.2
        assertEquals(100.0, pg.getConsistencyScore(), EPS);
        assertEquals(0.0, scylla.getConsistencyScore(), EPS);
        assertEquals(90.625, pg.getOverallScore(), EPS);
        assertEquals(58.25, scylla.getOverallScore(), EPS);

        assertEquals("pg", report.getScalabilityLeader().getDatabase());
        assertEquals("scylla", report.getThroughputLeader().getDatabase());
        assertEquals("scylla", report.getTotalRequestsLeader().getDatabase());
        assertEquals("scylla", report.getEfficiencyLeader().getDatabase());
        assertFalse(report.hasScalabilityDivergence());
        assertEquals(1, scylla.getMetrics().getFailureLogRows());
    }

    @Test
    void shouldReportNoResultsForEmptyDirectory(@TempDir Path tmp) throws Exception {
        DatabaseComparator comparator = new DatabaseComparator(Files.createDirectories(tmp.resolve("100_1m")));

        assertTrue(comparator.discoverDatabases().isEmpty());
        assertFalse(comparator.compare().isPresent());
    }

    @Test
    void shouldExtractInParallelWithSameResult(@TempDir Path tmp) throws Exception {
        Path dir = writePgVsScylla(tmp);
        LocustFixtures.writeStats(dir, "mongo_1000_1m", aggregatedRow(10_000, 10, 120, 300));

        ComparisonReport sequential = new DatabaseComparator(dir, 1).compare().orElseThrow();
        ComparisonReport parallel = new DatabaseComparator(dir, 4).compare().orElseThrow();

        assertEquals(sequential.getDiscovered(), parallel.getDiscovered());
        assertEquals(List.of("mongo", "pg", "scylla"),
            List.of(parallel.getDiscovered().get(0).getDatabase(),
                parallel.getDiscovered().get(1).getDatabase(),
                parallel.getDiscovered().get(2).getDatabase()));
    }

    @Test
    void shouldApplyValidWeightOverride(@TempDir Path tmp) throws Exception {
        DatabaseComparator comparator = new DatabaseComparator(writePgVsScylla(tmp));

        Optional<String> warning = comparator.applyWeightOverride(
            "{\"scalability\":0,\"throughput\":1,\"latency\":0,\"reliability\":0,\"consistency\":0}");

        assertFalse(warning.isPresent());
        ComparisonReport report = comparator.compare().orElseThrow();
        assertEquals("scylla", report.getWinner().getDatabase());
        assertEquals(100.0, report.getWinner().getOverallScore(), EPS);
        assertTrue(report.hasScalabilityDivergence());
        assertEquals((1000.0 / 950.0 - 1) * 100, report.getScalingImprovementPercent(), EPS);
    }

    @Test
    void shouldKeepPreviousWeightsWhenOverrideIsMalformed(@TempDir Path tmp) throws Exception {
        DatabaseComparator comparator = new DatabaseComparator(writePgVsScylla(tmp));
        comparator.applyWeightOverride("{\"throughput\":0.5}");
        WeightConfiguration before = comparator.getWeights();

        Optional<String> warning = comparator.applyWeightOverride("{\"throughput\":\"lots\"}");

        assertTrue(warning.isPresent());
        assertEquals(before, comparator.getWeights());
        assertEquals(0.5, comparator.getWeights().weight(Dimension.THROUGHPUT), EPS);
    }

    @Test
    void shouldScoreGroupWithOnlyStatsFile(@TempDir Path tmp) throws Exception {
        Path dir = writePgVsScylla(tmp);
        LocustFixtures.writeStats(dir, "cassandra_1000_1m", aggregatedRow(1_000, 0, 60, 100));

        ComparisonReport report = new DatabaseComparator(dir).compare().orElseThrow();

        ScoredRecord cassandra = report.getDiscovered().get(0);
        assertEquals("cassandra", cassandra.getDatabase());
        assertEquals(0L, cassandra.getMetrics().getMaxUsersReached());
        assertEquals(0.0, cassandra.getScalabilityScore(), EPS);
        assertEquals("cassandra", report.getRanked().get(2).getDatabase());
    }
}
