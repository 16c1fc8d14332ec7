package org.mongomaint.log;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.mongomaint.state.SessionRecord;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cumulative performance record of a database rebuild. Embedded in the checkpoint between
 * sessions and written as the run's performance log.
 */
@Data
@NoArgsConstructor
public class DatabaseLog {
    private String clusterName;
    private String dbName;
    private Instant startTime;
    private double totalTimeSeconds;
    private double totalInitialSizeMb;
    private double totalFinalSizeMb;
    private double totalReclaimedMb;
    private Map<String, CollectionLog> collections = new LinkedHashMap<>();
    private List<String> warnings = new ArrayList<>();
    private List<SessionRecord> sessionHistory = new ArrayList<>();
    private boolean aborted;
    private String error;
    private String errorStack;

    public DatabaseLog(String clusterName, String dbName, Instant startTime) {
        this.clusterName = clusterName;
        this.dbName = dbName;
        this.startTime = startTime;
    }

    /** Add a collection's log, merging it into the record of an earlier session if there is one. */
    public CollectionLog mergeCollection(String collection, CollectionLog newer) {
        return collections.merge(collection, newer, CollectionLog::mergedWith);
    }

    public void recomputeTotals() {
        totalInitialSizeMb = collections.values().stream().mapToDouble(CollectionLog::getInitialSizeMb).sum();
        totalFinalSizeMb = collections.values().stream().mapToDouble(CollectionLog::getFinalSizeMb).sum();
        totalReclaimedMb = totalInitialSizeMb - totalFinalSizeMb;
    }

    public int indexCount() {
        return collections.values().stream().mapToInt(c -> c.getIndexes().size()).sum();
    }
}
