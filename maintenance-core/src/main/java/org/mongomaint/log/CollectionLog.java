package org.mongomaint.log;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Performance record of the indexes rebuilt in one collection, possibly across sessions.
 */
@Data
@NoArgsConstructor
public class CollectionLog {
    private Instant startTime;
    private double totalTimeSeconds;
    private double initialSizeMb;
    private double finalSizeMb;
    private double reclaimedMb;
    private Map<String, IndexLog> indexes = new LinkedHashMap<>();
    private List<String> warnings = new ArrayList<>();

    public CollectionLog(Instant startTime) {
        this.startTime = startTime;
    }

    /**
     * Combine this (earlier) log with one from a later session: index records are added or
     * replaced, times are summed, the final size is the newest one and the initial size the
     * oldest one.
     */
    public CollectionLog mergedWith(CollectionLog newer) {
        var merged = new CollectionLog(startTime);
        merged.indexes.putAll(indexes);
        merged.indexes.putAll(newer.indexes);
        merged.warnings.addAll(warnings);
        merged.warnings.addAll(newer.warnings);
        merged.totalTimeSeconds = totalTimeSeconds + newer.totalTimeSeconds;
        merged.initialSizeMb = initialSizeMb;
        merged.finalSizeMb = newer.finalSizeMb;
        merged.reclaimedMb = merged.initialSizeMb - merged.finalSizeMb;
        return merged;
    }

    public long failedIndexCount() {
        return indexes.values().stream().filter(i -> !i.succeeded()).count();
    }
}
