package org.mongomaint.coordinator;

import java.util.Map;

/**
 * Optional observer of a rebuild. Implement only the hooks you need; every hook defaults to a
 * no-op. Hooks are invoked best-effort: anything they throw is logged and ignored.
 */
public interface MaintenanceCoordinator {

    MaintenanceCoordinator NONE = new MaintenanceCoordinator() {};

    default void onRebuildStart(String databaseName, int collectionCount) {}

    default void onCollectionStart(String collection, int indexCount) {}

    default void onIndexStart(String collection, String indexName, double sizeMb) {}

    default void onIndexComplete(String collection, String indexName, double seconds, boolean success) {}

    default void onCollectionComplete(String collection, double reclaimedMb, double seconds) {}

    /**
     * @param warning summary of non-fatal problems (for example failed indexes), or {@code null}
     */
    default void onRebuildComplete(
        String databaseName,
        double totalReclaimedMb,
        double seconds,
        boolean success,
        String warning
    ) {}

    default void onError(String message, Map<String, Object> context) {}
}
