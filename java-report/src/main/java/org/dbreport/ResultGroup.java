package org.dbreport;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

/**
 * One database's set of load-test result files within a results directory.
 * 
 * <p>Instances are created by {@link ResultSetLocator} and are immutable. Paths
 * for every {@link ResultFileKind} are always present; whether the file exists on
 * disk is decided when the tables are loaded.
 * 
 * @author krishna.sundar
 * @version 1.0
 */
public final class ResultGroup {
    private final String name;
    private final long targetUserCount;
    private final Path directory;
    private final String baseName;
    private final Map<ResultFileKind, Path> files;

    public ResultGroup(String name, long targetUserCount, Path directory, String baseName) {
        this.name = name;
        this.targetUserCount = targetUserCount;
        this.directory = directory;
        this.baseName = baseName;
        EnumMap<ResultFileKind, Path> paths = new EnumMap<>(ResultFileKind.class);
        for (ResultFileKind kind : ResultFileKind.values()) {
            paths.put(kind, directory.resolve(kind.fileName(baseName)));
        }
        this.files = paths;
    }

    public String getName() {
        return name;
    }

    public long getTargetUserCount() {
        return targetUserCount;
    }

    public Path getDirectory() {
        return directory;
    }

    public String getBaseName() {
        return baseName;
    }

    public Path file(ResultFileKind kind) {
        return files.get(kind);
    }

    @Override
    public String toString() {
        return name + " (" + baseName + ", target=" + targetUserCount + ")";
    }
}
