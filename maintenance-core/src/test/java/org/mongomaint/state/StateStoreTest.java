package org.mongomaint.state;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import org.mongomaint.log.CollectionLog;
import org.mongomaint.log.DatabaseLog;
import org.mongomaint.log.IndexLog;
import org.mongomaint.model.IndexDescriptor;
import org.mongomaint.model.ObjectMapperFactory;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class StateStoreTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @TempDir
    Path tempDir;

    private StateStore store(String timestamp) {
        return new StateStore(
            new RunPaths(tempDir.resolve("runtime"), tempDir.resolve("logs"), "cluster1", timestamp),
            ObjectMapperFactory.create()
        );
    }

    @Test
    void timestampIsFileNameSafeUtc() {
        assertEquals("2024-05-01T10-15-30", RunPaths.timestamp(Clock.fixed(NOW, ZoneOffset.UTC)));
    }

    @Test
    void missingCheckpointLoadsEmptyState() {
        var state = store("t1").load();
        assertTrue(state.isEmpty());
        assertTrue(state.getSessions().isEmpty());
    }

    @Test
    void stateSurvivesSaveAndLoad() {
        var store = store("t1");
        store.load();
        var key = JsonNodeFactory.instance.objectNode().put("status", 1);
        var attributes = JsonNodeFactory.instance.objectNode().put("sparse", true);
        store.markInFlight("orders", new IndexDescriptor("status_1", key, attributes));
        store.markCompleted("orders", "createdAt_1");
        var session = new SessionRecord("session_t1", NOW);
        session.finish(NOW.plusSeconds(90), SessionStatus.COMPLETED);
        store.getState().getSessions().add(session);
        var databaseLog = new DatabaseLog("cluster1", "app", NOW);
        var collectionLog = new CollectionLog(NOW);
        collectionLog.getIndexes().put("createdAt_1",
            IndexLog.builder().status(IndexLog.Status.REBUILT).initialSizeMb(3).finalSizeMb(1).build());
        databaseLog.mergeCollection("orders", collectionLog);
        store.getState().setCumulativeLog(databaseLog);
        store.checkpoint();

        var reloaded = store("t2").load();

        assertTrue(reloaded.isCompleted("orders", "createdAt_1"));
        assertFalse(reloaded.isCompleted("orders", "status_1"));
        var inFlight = reloaded.inFlightIn("orders").get("status_1");
        assertNotNull(inFlight);
        assertEquals(key, inFlight.key());
        assertTrue(inFlight.attributes().path("sparse").asBoolean());
        assertEquals(1, reloaded.getSessions().size());
        assertEquals(SessionStatus.COMPLETED, reloaded.getSessions().get(0).getStatus());
        assertEquals(90.0, reloaded.getSessions().get(0).getTotalTimeSeconds());
        var restoredIndex = reloaded.getCumulativeLog().getCollections().get("orders").getIndexes().get("createdAt_1");
        assertEquals(IndexLog.Status.REBUILT, restoredIndex.getStatus());
    }

    @Test
    void completingAnIndexClearsItsInFlightEntry() {
        var store = store("t1");
        store.load();
        var key = JsonNodeFactory.instance.objectNode().put("a", 1);
        store.markInFlight("orders", new IndexDescriptor("a_1", key, JsonNodeFactory.instance.objectNode()));
        store.markCompleted("orders", "a_1");

        var reloaded = store("t2").load();
        assertTrue(reloaded.inFlightIn("orders").isEmpty());
        assertEquals(List.of("a_1"), reloaded.completedIn("orders"));
    }

    @Test
    void unreadableCheckpointLoadsEmptyState() throws Exception {
        var store = store("t1");
        Files.createDirectories(store.getPaths().stateFile().getParent());
        Files.writeString(store.getPaths().stateFile(), "{ not json");

        assertTrue(store.load().isEmpty());
    }

    @Test
    void writesAndDeletesTheBackup() throws Exception {
        var store = store("t1");
        var document = JsonNodeFactory.instance.objectNode().put("name", "a_1");
        store.writeBackup(Map.of("orders", List.of(document)));

        var backup = store.getPaths().backupFile();
        assertTrue(Files.exists(backup));
        assertTrue(Files.readString(backup).contains("a_1"));

        store.deleteBackup();
        assertFalse(Files.exists(backup));
    }

    @Test
    void pruneKeepsOnlyTheNewestFileOfEachKind() throws Exception {
        var runtime = Files.createDirectories(tempDir.resolve("runtime"));
        var oldBackup = touch(runtime.resolve("cluster1_backup_2024-01-01T00-00-00.json"), 1000);
        var newBackup = touch(runtime.resolve("cluster1_backup_2024-02-01T00-00-00.json"), 2000);
        var oldState = touch(runtime.resolve("cluster1_state_2024-01-01T00-00-00.json"), 1000);
        var state = touch(runtime.resolve("cluster1_state.json"), 3000);
        var otherCluster = touch(runtime.resolve("cluster2_backup_2024-01-01T00-00-00.json"), 500);
        var unrelated = touch(runtime.resolve("notes.json"), 100);

        var deleted = store("t1").pruneStaleRuntimeFiles();

        assertEquals(2, deleted.size());
        assertFalse(Files.exists(oldBackup));
        assertFalse(Files.exists(oldState));
        assertTrue(Files.exists(newBackup));
        assertTrue(Files.exists(state));
        assertTrue(Files.exists(otherCluster));
        assertTrue(Files.exists(unrelated));
    }

    private static Path touch(Path file, long epochSeconds) throws Exception {
        Files.writeString(file, "{}");
        Files.setLastModifiedTime(file, FileTime.from(Instant.ofEpochSecond(epochSeconds)));
        return file;
    }
}
