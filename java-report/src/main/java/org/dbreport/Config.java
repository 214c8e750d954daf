package org.dbreport;

/**
 * Central configuration class for report parameters.
 * 
 * <p>This class provides access to all report configuration values, including
 * the results directory, output location, extraction parallelism and the
 * optional metrics port. All values can be overridden via system properties.
 * 
 * <p><b>System Properties:</b>
 * <ul>
 *   <li>{@code report.results.dir}: Results directory used when no argument is given (default: results)</li>
 *   <li>{@code report.output.dir}: Directory for the CSV and JSON report (default: the results directory)</li>
 *   <li>{@code report.threads}: Threads used to extract metrics per database (default: 1)</li>
 *   <li>{@code report.metrics.port}: Prometheus scrape port, 0 disables the server (default: 0)</li>
 *   <li>{@code report.weights}: Weight override as a JSON object (default: none)</li>
 * </ul>
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class Config {
    public static final String RESULTS_DIR = System.getProperty("report.results.dir", "results");
    public static final String OUTPUT_DIR = System.getProperty("report.output.dir");
    public static final int DEFAULT_THREADS = Integer.getInteger("report.threads", 1);
    public static final int METRICS_PORT = Integer.getInteger("report.metrics.port", 0);
    public static final String WEIGHTS = System.getProperty("report.weights");

    public static final String SUMMARY_CSV = "comparison_summary.csv";
    public static final String REPORT_JSON = "comparison_report.json";
}
