package org.mongomaint.state;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;

import org.mongomaint.log.DatabaseLog;
import org.mongomaint.model.IndexDescriptor;

import lombok.Data;

/**
 * Checkpoint of a rebuild, one per cluster.
 *
 * An index name is in {@link #completed} only once its final index has been verified present
 * with the original key and options. {@link #inFlight} holds the definition of every index whose
 * original may already have been dropped, so a crash before the final build never loses it.
 */
@Data
public class RebuildState {
    private Map<String, List<String>> completed = new LinkedHashMap<>();
    private List<SessionRecord> sessions = new ArrayList<>();
    private DatabaseLog cumulativeLog;
    private Map<String, Map<String, IndexDescriptor>> inFlight = new LinkedHashMap<>();

    public boolean isCompleted(String collection, String indexName) {
        return completed.getOrDefault(collection, List.of()).contains(indexName);
    }

    public List<String> completedIn(String collection) {
        return completed.getOrDefault(collection, List.of());
    }

    public void markCompleted(String collection, String indexName) {
        var names = completed.computeIfAbsent(collection, c -> new ArrayList<>());
        if (!names.contains(indexName)) {
            names.add(indexName);
        }
        clearInFlight(collection, indexName);
    }

    public void markInFlight(String collection, IndexDescriptor index) {
        inFlight.computeIfAbsent(collection, c -> new LinkedHashMap<>()).put(index.name(), index);
    }

    public void clearInFlight(String collection, String indexName) {
        var indexes = inFlight.get(collection);
        if (indexes != null) {
            indexes.remove(indexName);
            if (indexes.isEmpty()) {
                inFlight.remove(collection);
            }
        }
    }

    public Map<String, IndexDescriptor> inFlightIn(String collection) {
        return inFlight.getOrDefault(collection, Map.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return completed.isEmpty() && inFlight.isEmpty();
    }
}
