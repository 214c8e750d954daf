package org.dbreport;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A {@link MetricsRecord} with its 0-100 sub-scores and weighted overall score.
 * 
 * <p>Scores are relative to the other databases of the same comparison and are
 * not comparable across comparisons.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public final class ScoredRecord {
    private final MetricsRecord metrics;
    private final EnumMap<Dimension, Double> scores;
    private final double overallScore;

    public ScoredRecord(MetricsRecord metrics, Map<Dimension, Double> scores, double overallScore) {
        this.metrics = metrics;
        this.scores = new EnumMap<>(scores);
        this.overallScore = overallScore;
    }

    public MetricsRecord getMetrics() {
        return metrics;
    }

    public String getDatabase() {
        return metrics.getDatabase();
    }

    public double score(Dimension dimension) {
        Double s = scores.get(dimension);
        return s == null ? 0.0 : s;
    }

    public double getScalabilityScore() {
        return score(Dimension.SCALABILITY);
    }

    public double getThroughputScore() {
        return score(Dimension.THROUGHPUT);
    }

    public double getLatencyScore() {
        return score(Dimension.LATENCY);
    }

    public double getReliabilityScore() {
        return score(Dimension.RELIABILITY);
    }

    public double getConsistencyScore() {
        return score(Dimension.CONSISTENCY);
    }

    public double getOverallScore() {
        return overallScore;
    }

    /**
     * Metric fields followed by {@code scalabilityScore} ... {@code consistencyScore} and {@code overallScore}.
     */
    public Map<String, Number> toMap() {
        Map<String, Number> m = new LinkedHashMap<>(metrics.toMap());
        for (Dimension d : Dimension.values()) {
            m.put(d.scoreField(), score(d));
        }
        m.put("overallScore", overallScore);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScoredRecord)) return false;
        ScoredRecord other = (ScoredRecord) o;
        return getDatabase().equals(other.getDatabase())
            && Double.compare(overallScore, other.overallScore) == 0
            && scores.equals(other.scores)
            && metrics.toMap().equals(other.metrics.toMap());
    }

    @Override
    public int hashCode() {
        return 31 * getDatabase().hashCode() + Double.hashCode(overallScore);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s overall=%.2f %s", getDatabase(), overallScore, scores);
    }
}
