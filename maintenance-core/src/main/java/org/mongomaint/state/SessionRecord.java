package org.mongomaint.state;

import java.time.Duration;
import java.time.Instant;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One invocation of the rebuild against a cluster. A resumed rebuild accumulates several.
 */
@Data
@NoArgsConstructor
public class SessionRecord {
    private String sessionId;
    private Instant startTime;
    private Instant endTime;
    private double totalTimeSeconds;
    private int indexesRebuilt;
    private SessionStatus status = SessionStatus.IN_PROGRESS;

    public SessionRecord(String sessionId, Instant startTime) {
        this.sessionId = sessionId;
        this.startTime = startTime;
    }

    public void finish(Instant end, SessionStatus finalStatus) {
        this.endTime = end;
        this.totalTimeSeconds = Duration.between(startTime, end).toMillis() / 1000.0;
        this.status = finalStatus;
    }
}
