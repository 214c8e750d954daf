package org.dbreport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Turns the metrics of every database in one comparison into 0-100 scores.
 * 
 * <p>Each score is relative to the other databases in the same batch, so the whole
 * batch must be scored at once:
 * <ul>
 *   <li><b>scalability</b>: {@code userAchievementRate / max * 100}; 0 when the max is 0</li>
 *   <li><b>throughput</b>: {@code requestsPerSec / max * 100}; 0 when the max is 0</li>
 *   <li><b>latency</b>: {@code (1 - (avg - min) / (max - min)) * 100}; 100 when all are equal</li>
 *   <li><b>reliability</b>: {@code (1 - failureRate / max) * 100}; 100 when nobody failed</li>
 *   <li><b>consistency</b>: {@code (1 - throughputCV / max) * 100}; 100 when the max CV is 0</li>
 * </ul>
 * 
 * <p>The overall score is the weighted sum of the five. This is a pure function of
 * its inputs: the same records and weights always give the same scores, in input order.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public final class ScoreNormalizer {

    private ScoreNormalizer() {
    }

    /**
     * Scores a complete comparison batch.
     * 
     * @param records Metrics of every database in the comparison
     * @param weights Weights applied to the sub-scores
     * @return One scored record per input, in input order
     */
    public static List<ScoredRecord> score(List<MetricsRecord> records, WeightConfiguration weights) {
        if (records.isEmpty()) {
            return Collections.emptyList();
        }
        double maxScalability = max(records, MetricsRecord::getUserAchievementRate);
        double maxThroughput = max(records, MetricsRecord::getRequestsPerSec);
        double minLatency = min(records, MetricsRecord::getAvgResponseTime);
        double maxLatency = max(records, MetricsRecord::getAvgResponseTime);
        double maxFailureRate = max(records, MetricsRecord::getFailureRate);
        double maxCv = max(records, MetricsRecord::getThroughputCV);

        List<ScoredRecord> scored = new ArrayList<>(records.size());
        for (MetricsRecord m : records) {
            EnumMap<Dimension, Double> scores = new EnumMap<>(Dimension.class);
            scores.put(Dimension.SCALABILITY, higherIsBetter(m.getUserAchievementRate(), maxScalability));
            scores.put(Dimension.THROUGHPUT, higherIsBetter(m.getRequestsPerSec(), maxThroughput));
            scores.put(Dimension.LATENCY, maxLatency > minLatency
                ? (1 - (m.getAvgResponseTime() - minLatency) / (maxLatency - minLatency)) * 100
                : 100.0);
            scores.put(Dimension.RELIABILITY, lowerIsBetter(m.getFailureRate(), maxFailureRate));
            scores.put(Dimension.CONSISTENCY, lowerIsBetter(m.getThroughputCV(), maxCv));

            double overall = 0.0;
            for (Dimension d : Dimension.values()) {
                overall += scores.get(d) * weights.weight(d);
            }
            scored.add(new ScoredRecord(m, scores, overall));
        }
        return scored;
    }

    private static double higherIsBetter(double value, double max) {
        return max > 0 ? value / max * 100 : 0.0;
    }

    private static double lowerIsBetter(double value, double max) {
        return max > 0 ? (1 - value / max) * 100 : 100.0;
    }

    private static double max(List<MetricsRecord> records, ToDoubleFunction<MetricsRecord> field) {
        double max = Double.NEGATIVE_INFINITY;
        for (MetricsRecord m : records) {
            max = Math.max(max, field.applyAsDouble(m));
        }
        return max;
    }

    private static double min(List<MetricsRecord> records, ToDoubleFunction<MetricsRecord> field) {
        double min = Double.POSITIVE_INFINITY;
        for (MetricsRecord m : records) {
            min = Math.min(min, field.applyAsDouble(m));
        }
        return min;
    }
}
