package org.dbreport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * The CSV tables loaded for one result group.
 * 
 * <p>Any subset of the tables may be absent. A missing file is not an error: the
 * fields derived from it default to zero. A file that exists but cannot be read
 * fails the load.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public final class RawRecordTables {
    private static final Logger LOG = Logger.getLogger(RawRecordTables.class.getName());

    private final Map<ResultFileKind, CsvTable> tables;

    RawRecordTables(Map<ResultFileKind, CsvTable> tables) {
        this.tables = new EnumMap<>(ResultFileKind.class);
        this.tables.putAll(tables);
    }

    /**
     * Loads every companion file of the group that exists on disk.
     * 
     * @param group The result group to load
     * @return The loaded tables
     * @throws IOException If an existing file cannot be read
     */
    public static RawRecordTables load(ResultGroup group) throws IOException {
        Map<ResultFileKind, CsvTable> loaded = new EnumMap<>(ResultFileKind.class);
        for (ResultFileKind kind : ResultFileKind.values()) {
            Path file = group.file(kind);
            if (!Files.isRegularFile(file)) {
                LOG.fine(() -> "No " + kind.label() + " file for " + group.getName() + ": " + file.getFileName());
                continue;
            }
            loaded.put(kind, CsvTable.read(file));
            ReportMetrics.filesLoaded.labels(kind.label()).inc();
        }
        return new RawRecordTables(loaded);
    }

    public Optional<CsvTable> get(ResultFileKind kind) {
        return Optional.ofNullable(tables.get(kind));
    }

    public Optional<CsvTable> stats() {
        return get(ResultFileKind.STATS);
    }

    public Optional<CsvTable> history() {
        return get(ResultFileKind.HISTORY);
    }

    public Optional<CsvTable> failures() {
        return get(ResultFileKind.FAILURES);
    }

    public Optional<CsvTable> exceptions() {
        return get(ResultFileKind.EXCEPTIONS);
    }

    public boolean has(ResultFileKind kind) {
        return tables.containsKey(kind);
    }
}
