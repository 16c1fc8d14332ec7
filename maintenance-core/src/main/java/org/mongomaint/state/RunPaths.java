package org.mongomaint.state;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * File locations of one run against one cluster.
 */
public record RunPaths(Path runtimeDirectory, Path logDirectory, String clusterName, String timestamp) {

    public static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss").withZone(ZoneOffset.UTC);

    public static String timestamp(Clock clock) {
        return TIMESTAMP_FORMAT.format(clock.instant());
    }

    public Path stateFile() {
        return runtimeDirectory.resolve(clusterName + "_state.json");
    }

    public Path backupFile() {
        return runtimeDirectory.resolve(clusterName + "_backup_" + timestamp + ".json");
    }

    public Path performanceLog() {
        return logDirectory.resolve(clusterName + "_rebuild_log_" + timestamp + ".json");
    }

    public Path collectionLogDirectory() {
        return logDirectory.resolve(clusterName + "_collections_" + timestamp);
    }

    public Path collectionLog(String collection) {
        return collectionLogDirectory().resolve(collection + "_log.json");
    }

    public Path compactionLog() {
        return logDirectory.resolve(clusterName + "_compact_log_" + timestamp + ".json");
    }
}
