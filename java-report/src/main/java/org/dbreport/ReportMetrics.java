package org.dbreport;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.HTTPServer;
import java.io.IOException;
import java.net.BindException;
import java.util.logging.Logger;

/**
 * Prometheus metrics about report generation and an optional HTTP server for scraping.
 * 
 * <p>Metrics include:
 * <ul>
 *   <li>{@code report_groups_discovered_total}: Databases found across comparisons</li>
 *   <li>{@code report_files_loaded_total{kind}}: Result CSV files read, by file kind</li>
 *   <li>{@code report_comparisons_total{outcome}}: Comparisons run, by outcome ({@code ranked}, {@code no_results})</li>
 *   <li>{@code report_extraction_seconds}: Time spent loading and extracting one database</li>
 *   <li>{@code report_overall_score{database}}: Overall score from the latest comparison</li>
 * </ul>
 * 
 * <p>The HTTP server starts on a specified port, and automatically finds an
 * available port if the requested port is already in use (tries up to 99
 * additional ports).
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public class ReportMetrics {
    private static final Logger LOG = Logger.getLogger(ReportMetrics.class.getName());

    public static final Counter groupsDiscovered = Counter.build()
            .name("report_groups_discovered_total").help("Databases discovered in results directories").register();
    public static final Counter filesLoaded = Counter.build()
            .name("report_files_loaded_total").help("Result CSV files loaded").labelNames("kind").register();
    public static final Counter comparisons = Counter.build()
            .name("report_comparisons_total").help("Comparisons run").labelNames("outcome").register();
    public static final Histogram extraction = Histogram.build()
            .name("report_extraction_seconds").help("Metric extraction latency seconds per database").register();
    public static final Gauge overallScore = Gauge.build()
            .name("report_overall_score").help("Overall score of the latest comparison").labelNames("database").register();
    private static HTTPServer server;

    /**
     * Starts the Prometheus metrics HTTP server on the specified port.
     * 
     * <p>If the requested port is already in use, automatically tries ports
     * up to 100 higher to find an available port. Server threads are daemons so
     * they never keep the process alive.
     * 
     * @param port The preferred port number for the HTTP server
     * @return The port the server is bound to
     * @throws IOException If no available port is found within the range, or the
     *         server fails for a reason other than the port being taken
     */
    public static synchronized int startHttpServer(int port) throws IOException {
        if (server != null) {
            LOG.info("Metrics server already running on port " + server.getPort());
            return server.getPort();
        }
        
        BindException last = null;
        for (int tryPort = port; tryPort < port + 100; tryPort++) {
            try {
                server = new HTTPServer(tryPort, true);
            } catch (BindException e) {
                LOG.fine("Metrics port " + tryPort + " is in use");
                last = e;
                continue;
            }
            System.out.println(tryPort == port
                ? "Started Prometheus metrics server on port " + port
                : "Started Prometheus metrics server on port " + tryPort + " (port " + port + " was in use)");
            return tryPort;
        }

        throw new IOException("Could not find an available port starting from " + port, last);
    }

    /**
     * Stops the metrics server if it is running.
     */
    public static synchronized void stopHttpServer() {
        if (server != null) {
            server.close();
            server = null;
        }
    }

    /**
     * Publishes the overall score of every database in a report.
     * 
     * @param report The finished comparison
     */
    public static void recordScores(ComparisonReport report) {
        overallScore.clear();
        for (ScoredRecord r : report.getRanked()) {
            overallScore.labels(r.getDatabase()).set(r.getOverallScore());
        }
    }
}
