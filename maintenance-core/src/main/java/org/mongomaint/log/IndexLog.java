package org.mongomaint.log;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonValue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Performance record of one index rebuild.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexLog {
    public enum Status {
        REBUILT,
        FAILED;

        @JsonValue
        public String jsonName() {
            return name().toLowerCase();
        }
    }

    private Instant startTime;
    private double timeSeconds;
    private double initialSizeMb;
    private double finalSizeMb;
    private Status status;
    private int retryCount;
    private String error;

    public boolean succeeded() {
        return status == Status.REBUILT;
    }
}
