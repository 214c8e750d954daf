package org.dbreport;
import java.io.*;
import java.nio.file.*;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Utility class for writing comparison results.
 * 
 * <p>This class handles:
 * <ul>
 *   <li>Console summary of the ranking, leaders and divergence</li>
 *   <li>Summary CSV file (one row per database, in rank order)</li>
 *   <li>JSON report for downstream renderers</li>
 * </ul>
 * 
 * <p><b>CSV Format:</b>
 * <pre>
 * rank,database,targetUsers,...,latencyStdDev,scalabilityScore,...,consistencyScore,overallScore
 * </pre>
 * All numeric columns are written with 2 decimal places.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class ReportWriter {
    private static final String RULE = "============================================================";
    private static final DateTimeFormatter GENERATED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private ReportWriter() {
    }

    /**
     * Prints the ranked summary, the scalability analysis and the divergence context.
     * 
     * @param report The finished comparison
     * @param out Target stream, normally {@code System.out}
     */
    public static void printSummary(ComparisonReport report, PrintStream out) {
        out.println();
        out.println("PERFORMANCE COMPARISON RESULTS:");
        out.println(RULE);
        int rank = 1;
        for (ScoredRecord r : report.getRanked()) {
            MetricsRecord m = r.getMetrics();
            out.println(String.format(Locale.ROOT, "%d. %s: %.1f/100", rank++, upper(r), r.getOverallScore()));
            out.println(String.format(Locale.ROOT, "   Scalability: %.1f%% (%,d of %,d users)",
                m.getUserAchievementRate(), m.getMaxUsersReached(), m.getTargetUsers()));
            out.println(String.format(Locale.ROOT, "   Throughput: %.1f req/s", m.getRequestsPerSec()));
            out.println(String.format(Locale.ROOT, "   Avg Latency: %.2fms", m.getAvgResponseTime()));
            out.println(String.format(Locale.ROOT, "   Failure Rate: %.2f%%", m.getFailureRate()));
            out.println();
        }

        ScoredRecord winner = report.getWinner();
        out.println(String.format(Locale.ROOT, "SCORE WINNER: %s with %.1f/100", upper(winner), winner.getOverallScore()));
        if (report.getRanked().size() > 1) {
            out.println(String.format(Locale.ROOT, "Lead over %s: %.1f%% in weighted score",
                upper(report.getRanked().get(1)), report.getLeadMarginPercent()));
        }

        out.println();
        out.println("SCALABILITY ANALYSIS:");
        out.println(RULE);
        ScoredRecord scal = report.getScalabilityLeader();
        ScoredRecord tput = report.getThroughputLeader();
        ScoredRecord work = report.getTotalRequestsLeader();
        ScoredRecord eff = report.getEfficiencyLeader();
        ScoredRecord lat = report.getLatencyLeader();
        out.println(String.format(Locale.ROOT, "Most Users Handled: %s (%,d users - %.1f%%)",
            upper(scal), scal.getMetrics().getMaxUsersReached(), scal.getMetrics().getUserAchievementRate()));
        out.println(String.format(Locale.ROOT, "Highest Throughput: %s (%.1f req/s)",
            upper(tput), tput.getMetrics().getRequestsPerSec()));
        out.println(String.format(Locale.ROOT, "Most Total Work: %s (%,d requests)",
            upper(work), work.getMetrics().getTotalRequests()));
        out.println(String.format(Locale.ROOT, "Best Efficiency: %s (%.2f req/s per user)",
            upper(eff), eff.getMetrics().getThroughputPerUser()));
        out.println(String.format(Locale.ROOT, "Lowest Latency: %s (%.2fms average)",
            upper(lat), lat.getMetrics().getAvgResponseTime()));

        out.println();
        if (report.hasScalabilityDivergence()) {
            out.println("IMPORTANT CONTEXT:");
            out.println(String.format(Locale.ROOT, "   %s won by SCORE but only handled %.1f%% of target users",
                upper(winner), winner.getMetrics().getUserAchievementRate()));
            out.println(String.format(Locale.ROOT, "   %s handled %.0f%% MORE USERS in practice",
                upper(scal), report.getScalingImprovementPercent()));
            out.println(String.format(Locale.ROOT, "   %s shows better REAL-WORLD SCALABILITY", upper(scal)));
        } else {
            out.println(upper(winner) + " dominated both in score AND scalability");
        }
    }

    /**
     * Writes one CSV row per database, in rank order.
     * 
     * @param report The finished comparison
     * @param csvFile Target file; parent directories are created
     * @throws IOException If the file cannot be written
     */
    public static void writeSummaryCsv(ComparisonReport report, Path csvFile) throws IOException {
        createParent(csvFile);
        List<String> columns = new ArrayList<>(report.getWinner().toMap().keySet());
        try (BufferedWriter w = Files.newBufferedWriter(csvFile)) {
            w.write("rank,database," + String.join(",", columns));
            w.newLine();
            int rank = 1;
            for (ScoredRecord r : report.getRanked()) {
                StringBuilder row = new StringBuilder();
                row.append(rank++).append(',').append(csvField(r.getDatabase()));
                for (Number value : r.toMap().values()) {
                    row.append(',').append(String.format(Locale.ROOT, "%.2f", value.doubleValue()));
                }
                w.write(row.toString());
                w.newLine();
            }
        }
    }

    /**
     * Writes the report as JSON: weights, ranked records, winner, leaders and divergence.
     * 
     * @param report The finished comparison
     * @param jsonFile Target file; parent directories are created
     * @throws IOException If the file cannot be written
     */
    public static void writeJson(ComparisonReport report, Path jsonFile) throws IOException {
        createParent(jsonFile);
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("generatedAt", LocalDateTime.now().format(GENERATED_AT));
        root.put("resultsDir", report.getResultsDir().toString());
        root.put("weights", report.getWeights().asMap());

        List<Map<String, Object>> ranked = new ArrayList<>();
        int rank = 1;
        for (ScoredRecord r : report.getRanked()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("rank", rank++);
            entry.put("database", r.getDatabase());
            entry.putAll(r.toMap());
            entry.put("failureLogRows", r.getMetrics().getFailureLogRows());
            entry.put("exceptionLogRows", r.getMetrics().getExceptionLogRows());
            ranked.add(entry);
        }
        root.put("ranked", ranked);
        root.put("winner", report.getWinner().getDatabase());

        Map<String, String> leaders = new LinkedHashMap<>();
        leaders.put("scalability", report.getScalabilityLeader().getDatabase());
        leaders.put("throughput", report.getThroughputLeader().getDatabase());
        leaders.put("totalRequests", report.getTotalRequestsLeader().getDatabase());
        leaders.put("efficiency", report.getEfficiencyLeader().getDatabase());
        leaders.put("latency", report.getLatencyLeader().getDatabase());
        root.put("leaders", leaders);

        Map<String, Object> divergence = new LinkedHashMap<>();
        divergence.put("scalabilityDiffersFromWinner", report.hasScalabilityDivergence());
        divergence.put("scalingImprovementPercent", report.getScalingImprovementPercent());
        divergence.put("leadMarginPercent", report.getLeadMarginPercent());
        root.put("divergence", divergence);

        Files.writeString(jsonFile, JsonCodec.writePrettyString(root));
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static String upper(ScoredRecord r) {
        return r.getDatabase().toUpperCase(Locale.ROOT);
    }

    private static String csvField(String value) {
        if (value.contains(",") || value.contains("\"")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
