package org.mongomaint.log;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class CompactDatabaseLog {
    private String clusterName;
    private String dbName;
    private String mongoVersion = "unknown";
    private Instant startTime;
    private double totalTimeSeconds;
    private boolean supportsAutoCompact;
    private boolean autoCompactUsed;
    private boolean steppedDown;
    private Map<String, CollectionCompactLog> collections = new LinkedHashMap<>();
    private List<String> warnings = new ArrayList<>();
    private boolean aborted;
    private String error;

    public CompactDatabaseLog(String clusterName, String dbName, Instant startTime) {
        this.clusterName = clusterName;
        this.dbName = dbName;
        this.startTime = startTime;
    }
}
