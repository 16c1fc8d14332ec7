package org.mongomaint.rebuild;

import org.mongomaint.log.CollectionLog;

public record CollectionRebuildResult(Outcome outcome, CollectionLog log) {
    public enum Outcome {
        /** At least one index was processed; the log carries the re-measured sizes. */
        COMPLETED,
        /** Nothing to do, or the operator chose to skip. No side effects. */
        SKIPPED
    }

    public boolean isSkipped() {
        return outcome == Outcome.SKIPPED;
    }
}
