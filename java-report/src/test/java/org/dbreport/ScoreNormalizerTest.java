package org.dbreport;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreNormalizerTest {

    private static final double EPS = 1e-9;

    static MetricsRecord record(String name, long target, long maxUsers, double rps,
                                double avgLatency, double failureRate, double cv) {
        return MetricsRecord.builder(name)
            .targetUsers(target)
            .maxUsersReached(maxUsers)
            .userAchievementRate(target > 0 ? maxUsers * 100.0 / target : 0)
            .requestsPerSec(rps)
            .avgResponseTime(avgLatency)
            .failureRate(failureRate)
            .throughputCV(cv)
            .build();
    }

    static MetricsRecord pg() {
        return record("pg", 1000, 1000, 500, 50, 0, 0.1);
    }

    static MetricsRecord scylla() {
        return record("scylla", 1000, 950, 800, 80, 1, 0.2);
    }

    @Test
    void shouldScoreTwoDatabasesRelativeToEachOther() {
        List<ScoredRecord> scored = ScoreNormalizer.score(List.of(pg(), scylla()), WeightConfiguration.defaults());
        ScoredRecord pg = scored.get(0);
        ScoredRecord scylla = scored.get(1);

        assertEquals(100.0, pg.getScalabilityScore(), EPS);
        assertEquals(95.0, scylla.getScalabilityScore(), EPS);
        assertEquals(62.5, pg.getThroughputScore(), EPS);
        assertEquals(100.0, scylla.getThroughputScore(), EPS);
        assertEquals(100.0, pg.getLatencyScore(), EPS);
        assertEquals(0.0, scylla.getLatencyScore(), EPS);
        assertEquals(100.0, pg.getReliabilityScore(), EPS);
        assertEquals(0.0, scylla.getReliabilityScore(), EPS);
        assertEquals(100.0, pg.getConsistencyScore(), EPS);
        assertEquals(0.0, scylla.getConsistencyScore(), EPS);

        assertEquals(90.625, pg.getOverallScore(), EPS);
        assertEquals(58.25, scylla.getOverallScore(), EPS);
    }

    @Test
    void shouldKeepInputOrder() {
        List<ScoredRecord> scored = ScoreNormalizer.score(List.of(scylla(), pg()), WeightConfiguration.defaults());

        assertEquals("scylla", scored.get(0).getDatabase());
        assertEquals("pg", scored.get(1).getDatabase());
        assertEquals(58.25, scored.get(0).getOverallScore(), EPS);
    }

    @Test
    void shouldBeIdempotent() {
        List<MetricsRecord> input = List.of(pg(), scylla(), record("mongo", 1000, 700, 650, 65, 0.5, 0.15));

        List<ScoredRecord> first = ScoreNormalizer.score(input, WeightConfiguration.defaults());
        List<ScoredRecord> second = ScoreNormalizer.score(input, WeightConfiguration.defaults());

        assertEquals(first, second);
    }

    @Test
    void shouldNeverLowerScoresWhenThroughputRises() {
        MetricsRecord other = scylla();
        double previousThroughput = -1;
        double previousOverall = -1;
        for (double rps = 100; rps <= 1600; rps += 100) {
            MetricsRecord candidate = record("pg", 1000, 1000, rps, 50, 0, 0.1);
            ScoredRecord scored = ScoreNormalizer.score(List.of(candidate, other), WeightConfiguration.defaults()).get(0);

            assertTrue(scored.getThroughputScore() >= previousThroughput);
            assertTrue(scored.getOverallScore() >= previousOverall);
            previousThroughput = scored.getThroughputScore();
            previousOverall = scored.getOverallScore();
        }
        assertEquals(100.0, previousThroughput, EPS);
    }

    @Test
    void shouldGiveSingleDatabaseFullMarksOnRelativeDimensions() {
        ScoredRecord only = ScoreNormalizer.score(List.of(scylla()), WeightConfiguration.defaults()).get(0);

        assertEquals(100.0, only.getScalabilityScore(), EPS);
        assertEquals(100.0, only.getThroughputScore(), EPS);
        assertEquals(100.0, only.getLatencyScore(), EPS);
        // its own failure rate and CV are the maxima
        assertEquals(0.0, only.getReliabilityScore(), EPS);
        assertEquals(0.0, only.getConsistencyScore(), EPS);
        assertEquals(80.0, only.getOverallScore(), EPS);
    }

    @Test
    void shouldGiveFlawlessSingleDatabaseFullMarks() {
        ScoredRecord only = ScoreNormalizer.score(List.of(record("solo", 1000, 1000, 500, 50, 0, 0)),
            WeightConfiguration.defaults()).get(0);

        for (Dimension d : Dimension.values()) {
            assertEquals(100.0, only.score(d), EPS, d.name());
        }
        assertEquals(100.0, only.getOverallScore(), EPS);
    }

    @Test
    void shouldHandleDegenerateSingleDatabase() {
        ScoredRecord only = ScoreNormalizer.score(List.of(record("empty", 0, 0, 0, 0, 0, 0)),
            WeightConfiguration.defaults()).get(0);

        assertEquals(0.0, only.getScalabilityScore());
        assertEquals(0.0, only.getThroughputScore());
        assertEquals(100.0, only.getLatencyScore());
        assertEquals(100.0, only.getReliabilityScore());
        assertEquals(100.0, only.getConsistencyScore());
        assertEquals(40.0, only.getOverallScore(), EPS);
    }

    @Test
    void shouldScoreBadDataLowWithoutExcludingIt() {
        MetricsRecord bad = record("broken", 1000, 0, 0, 900, 100, 0.9);

        List<ScoredRecord> scored = ScoreNormalizer.score(List.of(pg(), scylla(), bad), WeightConfiguration.defaults());

        assertEquals(3, scored.size());
        ScoredRecord broken = scored.get(2);
        for (Dimension d : Dimension.values()) {
            assertEquals(0.0, broken.score(d), EPS, d.name());
        }
        assertEquals(0.0, broken.getOverallScore(), EPS);
    }

    @Test
    void shouldKeepEverySubScoreWithinBounds() {
        List<MetricsRecord> input = List.of(
            record("a", 500, 500, 120, 30, 0, 0.05),
            record("b", 500, 250, 900, 300, 4, 0.5),
            record("c", 500, 400, 450, 90, 2, 0.3),
            record("d", 500, 499, 450, 90, 0, 0));

        for (ScoredRecord r : ScoreNormalizer.score(input, WeightConfiguration.defaults())) {
            for (Dimension d : Dimension.values()) {
                assertTrue(r.score(d) >= 0.0 && r.score(d) <= 100.0, r + " " + d);
            }
            assertTrue(r.getOverallScore() >= 0.0 && r.getOverallScore() <= 100.0);
        }
    }

    @Test
    void shouldApplyWeightsWithoutRequiringUnitTotal() {
        WeightConfiguration doubled = WeightConfiguration.defaults().withOverrides(Map.of(
            "scalability", 0.7, "throughput", 0.5, "latency", 0.4, "reliability", 0.3, "consistency", 0.1));

        ScoredRecord only = ScoreNormalizer.score(List.of(record("solo", 1000, 1000, 500, 50, 0, 0)), doubled).get(0);

        assertEquals(200.0, only.getOverallScore(), EPS);
    }

    @Test
    void shouldReturnEmptyForEmptyBatch() {
        assertTrue(ScoreNormalizer.score(List.of(), WeightConfiguration.defaults()).isEmpty());
    }

    @Test
    void shouldAppendScoresToFlatMap() {
        ScoredRecord r = ScoreNormalizer.score(List.of(pg()), WeightConfiguration.defaults()).get(0);
        Map<String, Number> map = r.toMap();

        assertEquals(25, map.size());
        assertEquals(100.0, map.get("latencyScore").doubleValue(), EPS);
        assertEquals(r.getOverallScore(), map.get("overallScore").doubleValue(), EPS);
    }
}
