package org.mongomaint.log;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Compaction record of one collection. {@code measurements} are storage sizes in bytes, one per
 * iteration, in the order they were observed.
 */
@Data
@NoArgsConstructor
public class CollectionCompactLog {
    private Instant startTime;
    private double totalTimeSeconds;
    private double estimatedSavingsMb;
    private List<Long> measurements = new ArrayList<>();
    private boolean converged;
    private double finalMeasurementMb;
    private int iterations;
    private List<CompactErrorRecord> errors = new ArrayList<>();
    private String skippedReason;
    private String error;
    private Boolean steppedDown;
    private Boolean autoCompactEnabled;
    private Boolean autoCompactReducedSize;

    public CollectionCompactLog(Instant startTime) {
        this.startTime = startTime;
    }
}
