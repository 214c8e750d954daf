package org.dbreport;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.dbreport.ScoreNormalizerTest.pg;
import static org.dbreport.ScoreNormalizerTest.record;
import static org.dbreport.ScoreNormalizerTest.scylla;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComparisonReportTest {

    private static final double EPS = 1e-9;

    private static ComparisonReport report(MetricsRecord... records) {
        WeightConfiguration weights = WeightConfiguration.defaults();
        return new ComparisonReport(Paths.get("1000_1m"), weights, ScoreNormalizer.score(List.of(records), weights));
    }

    @Test
    void shouldRankByOverallScoreDescending() {
        ComparisonReport r = report(scylla(), pg());

        assertEquals("pg", r.getWinner().getDatabase());
        assertEquals("scylla", r.getRanked().get(1).getDatabase());
        assertEquals("scylla", r.getDiscovered().get(0).getDatabase());
        assertEquals((90.625 - 58.25) / 58.25 * 100, r.getLeadMarginPercent(), EPS);
    }

    @Test
    void shouldKeepDiscoveryOrderForTies() {
        ComparisonReport r = report(
            record("b", 100, 100, 10, 5, 0, 0),
            record("a", 100, 100, 10, 5, 0, 0),
            record("c", 100, 100, 10, 5, 0, 0));

        assertEquals("b", r.getRanked().get(0).getDatabase());
        assertEquals("a", r.getRanked().get(1).getDatabase());
        assertEquals("c", r.getRanked().get(2).getDatabase());
        assertEquals(0.0, r.getLeadMarginPercent(), EPS);
    }

    @Test
    void shouldComputeLeadersIndependentlyOfScore() {
        MetricsRecord fastButSmall = MetricsRecord.builder("redis")
            .targetUsers(1000).maxUsersReached(400).userAchievementRate(40)
            .totalRequests(90_000).requestsPerSec(1500).throughputPerUser(3.75)
            .avgResponseTime(5).build();
        MetricsRecord scalesWell = MetricsRecord.builder("scylla")
            .targetUsers(1000).maxUsersReached(1000).userAchievementRate(100)
            .totalRequests(60_000).requestsPerSec(1000).throughputPerUser(1.0)
            .avgResponseTime(40).failureRate(2).throughputCV(0.4).build();
        MetricsRecord steady = MetricsRecord.builder("pg")
            .targetUsers(1000).maxUsersReached(500).userAchievementRate(50)
            .totalRequests(95_000).requestsPerSec(600).throughputPerUser(1.2)
            .avgResponseTime(10).build();

        ComparisonReport r = report(steady, fastButSmall, scalesWell);

        assertEquals("redis", r.getWinner().getDatabase());
        assertEquals("scylla", r.getScalabilityLeader().getDatabase());
        assertEquals("redis", r.getThroughputLeader().getDatabase());
        assertEquals("pg", r.getTotalRequestsLeader().getDatabase());
        assertEquals("redis", r.getEfficiencyLeader().getDatabase());
        assertEquals("redis", r.getLatencyLeader().getDatabase());
        assertTrue(r.hasScalabilityDivergence());
        assertEquals(150.0, r.getScalingImprovementPercent(), EPS);
    }

    @Test
    void shouldReportNoDivergenceWhenWinnerAlsoScalesBest() {
        ComparisonReport r = report(pg(), scylla());

        assertSame(r.getWinner(), r.getScalabilityLeader());
        assertFalse(r.hasScalabilityDivergence());
        assertEquals(0.0, r.getScalingImprovementPercent());
    }

    @Test
    void shouldPickFirstDiscoveredOnLeaderTies() {
        ComparisonReport r = report(
            record("b", 100, 100, 10, 5, 0, 0),
            record("a", 100, 100, 10, 5, 0, 0));

        assertEquals("b", r.getThroughputLeader().getDatabase());
        assertEquals("b", r.getScalabilityLeader().getDatabase());
        assertEquals("b", r.getLatencyLeader().getDatabase());
    }

    @Test
    void shouldPickLowestAverageLatencyAsLatencyLeader() {
        ComparisonReport r = report(
            record("a", 100, 100, 10, 30, 0, 0),
            record("b", 100, 100, 10, 12, 0, 0),
            record("c", 100, 100, 10, 12, 0, 0),
            record("d", 100, 100, 10, 45, 0, 0));

        assertEquals("b", r.getLatencyLeader().getDatabase());
        assertEquals(12.0, r.getLatencyLeader().getMetrics().getAvgResponseTime());
    }

    @Test
    void shouldGuardScalingImprovementWhenWinnerReachedNoUsers() {
        MetricsRecord winner = MetricsRecord.builder("fast").requestsPerSec(1000).avgResponseTime(1).build();
        MetricsRecord scaler = MetricsRecord.builder("slow")
            .targetUsers(10).maxUsersReached(1).userAchievementRate(10).requestsPerSec(1).avgResponseTime(900).build();

        WeightConfiguration throughputOnly = WeightConfiguration.defaults().withOverrides(Map.of(
            "scalability", 0.0, "throughput", 1.0, "latency", 0.0, "reliability", 0.0, "consistency", 0.0));
        ComparisonReport r = new ComparisonReport(Paths.get("10_1m"), throughputOnly,
            ScoreNormalizer.score(List.of(winner, scaler), throughputOnly));

        assertEquals("fast", r.getWinner().getDatabase());
        assertTrue(r.hasScalabilityDivergence());
        assertEquals(0.0, r.getScalingImprovementPercent());
    }

    @Test
    void shouldRejectEmptyComparison() {
        assertThrows(IllegalArgumentException.class,
            () -> new ComparisonReport(Paths.get("x"), WeightConfiguration.defaults(), List.of()));
    }
}
