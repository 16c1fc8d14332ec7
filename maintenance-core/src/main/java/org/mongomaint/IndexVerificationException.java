package org.mongomaint;

import lombok.Getter;

/**
 * An index that should exist after a build is missing, still building, or carries a key or
 * options different from what was requested.
 */
@Getter
public class IndexVerificationException extends MaintenanceException {
    private final String collection;
    private final String indexName;

    public IndexVerificationException(String collection, String indexName, String reason) {
        super("Verification failed for index '" + indexName + "' on '" + collection + "': " + reason);
        this.collection = collection;
        this.indexName = indexName;
    }
}
