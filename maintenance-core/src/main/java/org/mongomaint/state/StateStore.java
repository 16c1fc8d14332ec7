package org.mongomaint.state;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.mongomaint.StateStoreException;
import org.mongomaint.log.CollectionLog;
import org.mongomaint.log.CompactDatabaseLog;
import org.mongomaint.log.DatabaseLog;
import org.mongomaint.model.IndexDescriptor;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the checkpoint of a run and writes its backup and log files. Every write goes to a
 * temporary file in the target directory first and is then moved into place, so a crash never
 * leaves a truncated checkpoint behind.
 *
 * Single writer: running two instances against the same cluster concurrently is unsupported.
 */
@Slf4j
public class StateStore {
    @Getter
    private final RunPaths paths;
    private final ObjectMapper objectMapper;
    @Getter
    private RebuildState state = new RebuildState();

    public StateStore(RunPaths paths, ObjectMapper objectMapper) {
        this.paths = paths;
        this.objectMapper = objectMapper;
    }

    /**
     * Read the checkpoint. A missing file yields an empty state; so does an unreadable one, after
     * a warning, since the index definitions are still recoverable from the backup file.
     */
    public RebuildState load() {
        var file = paths.stateFile();
        if (!Files.exists(file)) {
            state = new RebuildState();
            return state;
        }
        try {
            state = objectMapper.readValue(file.toFile(), RebuildState.class);
            log.info("Loaded checkpoint {} ({} collection(s) with completed indexes)", file, state.getCompleted().size());
        } catch (IOException e) {
            log.warn("Checkpoint {} is unreadable, starting from an empty state", file, e);
            state = new RebuildState();
        }
        return state;
    }

    public void checkpoint() {
        writeJson(paths.stateFile(), state);
    }

    /** Record the definition of an index about to lose its original, and persist it. */
    public void markInFlight(String collection, IndexDescriptor index) {
        state.markInFlight(collection, index);
        checkpoint();
    }

    public void markCompleted(String collection, String indexName) {
        state.markCompleted(collection, indexName);
        checkpoint();
        log.debug("Checkpoint updated: {}.{} completed", collection, indexName);
    }

    public void deleteCheckpoint() {
        delete(paths.stateFile());
    }

    /** Snapshot of every collection's raw index documents, taken before anything is changed. */
    public void writeBackup(Map<String, List<ObjectNode>> indexesByCollection) {
        writeJson(paths.backupFile(), indexesByCollection);
    }

    public void deleteBackup() {
        delete(paths.backupFile());
    }

    public void writePerformanceLog(DatabaseLog databaseLog) {
        writeJson(paths.performanceLog(), databaseLog);
    }

    public void writeCollectionLog(String collection, CollectionLog collectionLog) {
        writeJson(paths.collectionLog(collection), collectionLog);
    }

    public void writeCompactionLog(CompactDatabaseLog compactLog) {
        writeJson(paths.compactionLog(), compactLog);
    }

    /**
     * Delete older checkpoint and backup files of this cluster left by earlier runs, keeping only
     * the most recently modified file of each kind.
     *
     * @return the deleted files
     */
    public List<Path> pruneStaleRuntimeFiles() {
        var directory = paths.runtimeDirectory();
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        var pattern = Pattern.compile(
            "^" + Pattern.quote(paths.clusterName()) + "_(state|backup)(_\\d{4}(-\\d\\d){2}T(\\d\\d-){2}\\d\\d)?\\.json$"
        );
        Map<String, List<Path>> byKind;
        try (var files = Files.list(directory)) {
            byKind = files
                .filter(Files::isRegularFile)
                .filter(f -> pattern.matcher(f.getFileName().toString()).matches())
                .collect(Collectors.groupingBy(
                    f -> {
                        var matcher = pattern.matcher(f.getFileName().toString());
                        return matcher.matches() ? matcher.group(1) : "";
                    },
                    LinkedHashMap::new,
                    Collectors.toList()
                ));
        } catch (IOException e) {
            throw new StateStoreException(directory, e);
        }

        var deleted = new ArrayList<Path>();
        for (var entry : byKind.entrySet()) {
            var newestFirst = entry.getValue().stream()
                .sorted(Comparator.comparing(StateStore::lastModified)
                    .thenComparing(p -> p.getFileName().toString())
                    .reversed())
                .collect(Collectors.toList());
            for (var stale : newestFirst.subList(1, newestFirst.size())) {
                delete(stale);
                deleted.add(stale);
            }
        }
        if (!deleted.isEmpty()) {
            log.info("Removed {} stale runtime file(s) for cluster {}: {}", deleted.size(), paths.clusterName(), deleted);
        }
        return deleted;
    }

    private void writeJson(Path file, Object value) {
        try {
            var directory = file.toAbsolutePath().getParent();
            Files.createDirectories(directory);
            var temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), value);
                moveIntoPlace(temp, file);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new StateStoreException(file, e);
        }
    }

    private static void moveIntoPlace(Path temp, Path file) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void delete(Path file) {
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("Deleted {}", file);
            }
        } catch (IOException e) {
            throw new StateStoreException(file, e);
        }
    }

    private static FileTime lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            throw new StateStoreException(file, e);
        }
    }
}
