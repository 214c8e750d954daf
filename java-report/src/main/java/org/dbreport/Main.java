package org.dbreport;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Main entry point for the database performance comparison report.
 * 
 * <p>Reads the Locust CSV results of every database found in a results directory,
 * scores them on scalability, throughput, latency, reliability and consistency,
 * and prints the ranking. The ranking is also written as CSV and JSON next to the
 * results (or into {@code report.output.dir}).
 * 
 * <p>Usage:
 * <pre>
 * Main &lt;results_dir&gt; [--weights '{"throughput":0.5,"latency":0.3,"reliability":0.2}']
 * </pre>
 * 
 * <p>When no directory argument is given, {@code report.results.dir} is used. See
 * {@link Config} for the other system properties.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.exit(run(args));
    }

    /**
     * Runs the comparison and returns the process exit code.
     * 
     * @param args Command line arguments
     * @return 0 on success, 1 if the directory is missing or holds no results
     * @throws Exception If result files cannot be read or the report cannot be written
     */
    static int run(String[] args) throws Exception {
        // Parse command line arguments
        String resultsArg = null;
        String weightsArg = Config.WEIGHTS;
        boolean weightsMissing = false;
        for (int i = 0; i < args.length; i++) {
            if ("--weights".equals(args[i])) {
                if (i + 1 < args.length) {
                    weightsArg = args[++i];
                } else {
                    weightsMissing = true;
                }
            } else if (resultsArg == null && !args[i].startsWith("--")) {
                resultsArg = args[i];
            }
        }
        Path resultsDir = Paths.get(resultsArg != null ? resultsArg : Config.RESULTS_DIR);

        if (!Files.isDirectory(resultsDir)) {
            System.out.println("Error: Directory '" + resultsDir + "' not found!");
            return 1;
        }

        DatabaseComparator comparator = new DatabaseComparator(resultsDir, Config.DEFAULT_THREADS);
        if (weightsMissing) {
            System.out.println("Missing value for --weights, using " + comparator.getWeights());
        } else if (weightsArg != null) {
            Optional<String> warning = comparator.applyWeightOverride(weightsArg);
            if (warning.isPresent()) {
                System.out.println("Invalid weights JSON format, using " + comparator.getWeights());
            } else {
                System.out.println("Using custom weights: " + comparator.getWeights());
            }
        }

        if (Config.METRICS_PORT > 0) {
            ReportMetrics.startHttpServer(Config.METRICS_PORT);
        }

        try {
            System.out.println("Discovering databases in " + resultsDir + "...");
            Optional<ComparisonReport> result = comparator.compare();
            if (result.isEmpty()) {
                System.out.println("No database test results found!");
                return 1;
            }
            ComparisonReport report = result.get();

            ReportWriter.printSummary(report, System.out);

            Path outputDir = Config.OUTPUT_DIR != null ? Paths.get(Config.OUTPUT_DIR) : resultsDir;
            Path csv = outputDir.resolve(Config.SUMMARY_CSV);
            Path json = outputDir.resolve(Config.REPORT_JSON);
            ReportWriter.writeSummaryCsv(report, csv);
            ReportWriter.writeJson(report, json);

            System.out.println();
            System.out.println("Summary CSV: " + csv);
            System.out.println("Report JSON: " + json);
            return 0;
        } finally {
            ReportMetrics.stopHttpServer();
        }
    }
}
