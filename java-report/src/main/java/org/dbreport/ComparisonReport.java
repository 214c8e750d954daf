package org.dbreport;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Ranked outcome of one comparison, handed to renderers.
 * 
 * <p>The ranking sorts by overall score, highest first; ties keep discovery order.
 * The leaders are computed independently of that ranking, so the score winner and
 * e.g. the scalability leader may be different databases. Both are exposed so a
 * renderer can point out the divergence without recomputing anything.
 * 
 * <p>Leaders are the first database (in discovery order) holding the maximum of:
 * <ul>
 *   <li><b>scalability</b>: {@code userAchievementRate}</li>
 *   <li><b>throughput</b>: {@code requestsPerSec}</li>
 *   <li><b>total work</b>: {@code totalRequests}</li>
 *   <li><b>efficiency</b>: {@code throughputPerUser}</li>
 * </ul>
 * The latency leader is the first database holding the minimum {@code avgResponseTime}.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public final class ComparisonReport {
    private final Path resultsDir;
    private final WeightConfiguration weights;
    private final List<ScoredRecord> discovered;
    private final List<ScoredRecord> ranked;
    private final ScoredRecord scalabilityLeader;
    private final ScoredRecord throughputLeader;
    private final ScoredRecord totalRequestsLeader;
    private final ScoredRecord efficiencyLeader;
    private final ScoredRecord latencyLeader;

    /**
     * Builds the report from scored records.
     * 
     * @param resultsDir The directory the results were read from
     * @param weights The weights the scores were computed with
     * @param scored Scored records in discovery order; must not be empty
     */
    public ComparisonReport(Path resultsDir, WeightConfiguration weights, List<ScoredRecord> scored) {
        if (scored.isEmpty()) {
            throw new IllegalArgumentException("A comparison report needs at least one database");
        }
        this.resultsDir = resultsDir;
        this.weights = weights;
        this.discovered = Collections.unmodifiableList(new ArrayList<>(scored));

        List<ScoredRecord> sorted = new ArrayList<>(scored);
        // List.sort is stable
        sorted.sort(Comparator.comparingDouble(ScoredRecord::getOverallScore).reversed());
        this.ranked = Collections.unmodifiableList(sorted);

        this.scalabilityLeader = leader(discovered, r -> r.getMetrics().getUserAchievementRate());
        this.throughputLeader = leader(discovered, r -> r.getMetrics().getRequestsPerSec());
        this.totalRequestsLeader = leader(discovered, r -> r.getMetrics().getTotalRequests());
        this.efficiencyLeader = leader(discovered, r -> r.getMetrics().getThroughputPerUser());
        this.latencyLeader = leader(discovered, r -> -r.getMetrics().getAvgResponseTime());
    }

    private static ScoredRecord leader(List<ScoredRecord> records, ToDoubleFunction<ScoredRecord> field) {
        ScoredRecord best = records.get(0);
        double bestValue = field.applyAsDouble(best);
        for (int i = 1; i < records.size(); i++) {
            double value = field.applyAsDouble(records.get(i));
            if (value > bestValue) {
                best = records.get(i);
                bestValue = value;
            }
        }
        return best;
    }

    public Path getResultsDir() {
        return resultsDir;
    }

    public WeightConfiguration getWeights() {
        return weights;
    }

    /**
     * Scored records sorted by overall score, highest first.
     */
    public List<ScoredRecord> getRanked() {
        return ranked;
    }

    /**
     * Scored records in discovery (alphabetical) order.
     */
    public List<ScoredRecord> getDiscovered() {
        return discovered;
    }

    public ScoredRecord getWinner() {
        return ranked.get(0);
    }

    public ScoredRecord getScalabilityLeader() {
        return scalabilityLeader;
    }

    public ScoredRecord getThroughputLeader() {
        return throughputLeader;
    }

    public ScoredRecord getTotalRequestsLeader() {
        return totalRequestsLeader;
    }

    public ScoredRecord getEfficiencyLeader() {
        return efficiencyLeader;
    }

    /**
     * The database with the lowest average response time.
     */
    public ScoredRecord getLatencyLeader() {
        return latencyLeader;
    }

    /**
     * True when the database that sustained the most users did not win on score.
     */
    public boolean hasScalabilityDivergence() {
        return !scalabilityLeader.getDatabase().equals(getWinner().getDatabase());
    }

    /**
     * How many more users the scalability leader sustained than the score winner, in percent.
     * 
     * @return {@code (leader.maxUsersReached / winner.maxUsersReached - 1) * 100}, or 0 if
     *         there is no divergence or the winner reached no users
     */
    public double getScalingImprovementPercent() {
        if (!hasScalabilityDivergence()) {
            return 0.0;
        }
        long winnerUsers = getWinner().getMetrics().getMaxUsersReached();
        if (winnerUsers <= 0) {
            return 0.0;
        }
        return ((double) scalabilityLeader.getMetrics().getMaxUsersReached() / winnerUsers - 1) * 100;
    }

    /**
     * The winner's lead over the runner-up, relative to the runner-up's overall score.
     * 
     * @return Lead in percent; 0 with a single database or a runner-up scoring 0
     */
    public double getLeadMarginPercent() {
        if (ranked.size() < 2) {
            return 0.0;
        }
        double runnerUp = ranked.get(1).getOverallScore();
        if (runnerUp <= 0) {
            return 0.0;
        }
        return (getWinner().getOverallScore() - runnerUp) / runnerUp * 100;
    }
}
