package org.dbreport;

/**
 * Enumeration of the CSV files a load-test run leaves behind for one database.
 * 
 * <p>Every file shares the run's base name ({@code {database}_{users}_{duration}})
 * and differs only by suffix. Only {@code STATS} is required for a database to be
 * part of a comparison; the others are optional companions.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public enum ResultFileKind {
    STATS("stats"),
    FAILURES("failures"),
    EXCEPTIONS("exceptions"),
    HISTORY("stats_history");

    private final String suffix;

    ResultFileKind(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Gets the suffix appended to the base name, without underscore or extension.
     * 
     * @return The file suffix, e.g. {@code stats_history}
     */
    public String getSuffix() {
        return suffix;
    }

    /**
     * Builds the file name for this kind from a run's base name.
     * 
     * @param baseName The base name, e.g. {@code pg_1000_1m}
     * @return The file name, e.g. {@code pg_1000_1m_stats_history.csv}
     */
    public String fileName(String baseName) {
        return baseName + "_" + suffix + ".csv";
    }

    /**
     * Label used for metrics and log output.
     * 
     * @return The lowercase kind name
     */
    public String label() {
        return name().toLowerCase();
    }
}
