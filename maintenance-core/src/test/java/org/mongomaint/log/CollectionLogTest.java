package org.mongomaint.log;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CollectionLogTest {

    private static IndexLog index(IndexLog.Status status) {
        return IndexLog.builder().status(status).initialSizeMb(10).finalSizeMb(4).build();
    }

    @Test
    void mergingKeepsTheFirstInitialSizeAndTheLatestFinalSize() {
        var first = new CollectionLog(Instant.parse("2024-01-01T00:00:00Z"));
        first.setInitialSizeMb(100);
        first.setFinalSizeMb(80);
        first.setTotalTimeSeconds(10);
        first.getIndexes().put("a_1", index(IndexLog.Status.REBUILT));
        first.getWarnings().add("first warning");

        var second = new CollectionLog(Instant.parse("2024-01-02T00:00:00Z"));
        second.setInitialSizeMb(80);
        second.setFinalSizeMb(50);
        second.setTotalTimeSeconds(5);
        second.getIndexes().put("b_1", index(IndexLog.Status.FAILED));

        var merged = first.mergedWith(second);

        assertEquals(first.getStartTime(), merged.getStartTime());
        assertEquals(100, merged.getInitialSizeMb());
        assertEquals(50, merged.getFinalSizeMb());
        assertEquals(50, merged.getReclaimedMb());
        assertEquals(15, merged.getTotalTimeSeconds());
        assertEquals(2, merged.getIndexes().size());
        assertEquals(1, merged.failedIndexCount());
        assertEquals(1, merged.getWarnings().size());
    }

    @Test
    void databaseLogMergesCollectionsAcrossSessions() {
        var databaseLog = new DatabaseLog("c1", "app", Instant.EPOCH);
        var first = new CollectionLog(Instant.EPOCH);
        first.setInitialSizeMb(30);
        first.setFinalSizeMb(20);
        var second = new CollectionLog(Instant.EPOCH);
        second.setInitialSizeMb(20);
        second.setFinalSizeMb(12);

        databaseLog.mergeCollection("orders", first);
        databaseLog.mergeCollection("orders", second);
        databaseLog.recomputeTotals();

        assertEquals(1, databaseLog.getCollections().size());
        assertEquals(30, databaseLog.getTotalInitialSizeMb());
        assertEquals(12, databaseLog.getTotalFinalSizeMb());
        assertEquals(18, databaseLog.getTotalReclaimedMb());
    }
}
