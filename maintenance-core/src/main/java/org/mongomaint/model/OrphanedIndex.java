package org.mongomaint.model;

/**
 * A covering index left behind by an interrupted or superseded run. Recomputed every run.
 */
public record OrphanedIndex(String collection, String indexName) {}
