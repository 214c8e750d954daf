package org.dbreport;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Finds the databases that have results in a results directory.
 * 
 * <p>Locust writes one file set per run, named
 * {@code {database}_{users}_{duration}_stats.csv} plus its companions. A database
 * is part of the comparison only if at least one such stats file exists.
 * 
 * <p>The results directory itself is named after the target load, e.g.
 * {@code 100000_1m}; the leading number is the target user count.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public final class ResultSetLocator {
    private static final Logger LOG = Logger.getLogger(ResultSetLocator.class.getName());

    private static final String STATS_SUFFIX = "_stats";
    private static final String CSV_EXTENSION = ".csv";

    private ResultSetLocator() {
    }

    /**
     * Lists the distinct database names found in the directory.
     * 
     * @param resultsDir The results directory to scan
     * @return Sorted, de-duplicated database names; empty if the directory has no stats files
     * @throws IOException If the directory exists but cannot be listed
     */
    public static List<String> discover(Path resultsDir) throws IOException {
        TreeSet<String> names = new TreeSet<>();
        if (!Files.isDirectory(resultsDir)) {
            LOG.warning(() -> "Results directory not found: " + resultsDir);
            return new ArrayList<>();
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(resultsDir, "*" + STATS_SUFFIX + CSV_EXTENSION)) {
            for (Path file : stream) {
                String[] parts = stem(file).split("_");
                // {database}_{users}_{duration}_stats at minimum
                if (parts.length >= 3) {
                    names.add(parts[0]);
                }
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * Resolves the file set of one database.
     * 
     * <p>The first stats file (by name) starting with {@code {name}_} decides the base
     * name shared by all companion files. When none exists the base name falls back to
     * the database name alone.
     * 
     * @param resultsDir The results directory
     * @param name The database name returned by {@link #discover(Path)}
     * @return The located result group
     * @throws IOException If the directory cannot be listed
     */
    public static ResultGroup locate(Path resultsDir, String name) throws IOException {
        String baseName = name;
        List<Path> matches = new ArrayList<>();
        if (Files.isDirectory(resultsDir)) {
            // plain prefix match: database names may contain glob characters
            String prefix = name + "_";
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(resultsDir)) {
                for (Path file : stream) {
                    String fileName = file.getFileName().toString();
                    if (fileName.startsWith(prefix)
                        && fileName.endsWith(STATS_SUFFIX + CSV_EXTENSION)
                        && fileName.length() >= prefix.length() + (STATS_SUFFIX + CSV_EXTENSION).length()) {
                        matches.add(file);
                    }
                }
            }
        }
        if (!matches.isEmpty()) {
            matches.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
            String stem = stem(matches.get(0));
            baseName = stem.substring(0, stem.length() - STATS_SUFFIX.length());
        }
        return new ResultGroup(name, parseTargetUsers(dirName(resultsDir)), resultsDir, baseName);
    }

    /**
     * Parses the target user count from a results directory name.
     * 
     * @param dirName Directory name such as {@code 100000_1m}
     * @return The leading number, or 0 if it is missing or not numeric
     */
    public static long parseTargetUsers(String dirName) {
        if (dirName == null || dirName.isEmpty()) {
            return 0;
        }
        String token = dirName.split("_", -1)[0];
        try {
            return Long.parseLong(token.trim());
        } catch (NumberFormatException e) {
            LOG.fine(() -> "No target user count in directory name '" + dirName + "'");
            return 0;
        }
    }

    private static String dirName(Path resultsDir) {
        Path absolute = resultsDir.toAbsolutePath().normalize();
        Path fileName = absolute.getFileName();
        return fileName == null ? "" : fileName.toString();
    }

    private static String stem(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.substring(0, fileName.length() - CSV_EXTENSION.length());
    }
}
