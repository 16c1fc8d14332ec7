package org.mongomaint.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The parts of a {@code collStats} reply the engines use. All sizes are in bytes.
 */
public record CollectionStats(long size, long storageSize, Map<String, Long> indexSizes) {

    public static final double BYTES_PER_MB = 1024.0 * 1024.0;

    public static CollectionStats fromReply(JsonNode reply) {
        var indexSizes = new LinkedHashMap<String, Long>();
        reply.path("indexSizes").fields()
            .forEachRemaining(entry -> indexSizes.put(entry.getKey(), entry.getValue().asLong(0)));
        return new CollectionStats(
            reply.path("size").asLong(0),
            reply.path("storageSize").asLong(0),
            Collections.unmodifiableMap(indexSizes)
        );
    }

    public long indexSize(String indexName) {
        return indexSizes.getOrDefault(indexName, 0L);
    }

    public long totalIndexSize() {
        return indexSizes.values().stream().mapToLong(Long::longValue).sum();
    }

    public static double toMb(long bytes) {
        return bytes / BYTES_PER_MB;
    }

    public static long fromMb(double megabytes) {
        return Math.round(megabytes * BYTES_PER_MB);
    }
}
