package org.mongomaint.config;

import java.nio.file.Path;
import java.util.List;

import org.mongomaint.confirm.ConfirmationProvider;
import org.mongomaint.coordinator.MaintenanceCoordinator;
import org.mongomaint.retry.PollingPolicy;
import org.mongomaint.retry.RetryPolicy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Caller input for an index rebuild run.
 */
@Value
@Builder(toBuilder = true)
public class RebuildConfig {
    @NonNull
    String databaseName;
    /** Overrides the name derived from the connection; {@code null} to derive it. */
    String clusterName;

    @Builder.Default
    Path logDirectory = Path.of("rebuild_logs");
    @Builder.Default
    Path runtimeDirectory = Path.of(".rebuild_runtime");

    @Builder.Default
    String coverSuffix = "_cover_temp";
    /** Ascending field appended to a covering index's key. */
    @Builder.Default
    String coverField = "_rebuild_cover_field_";

    @Builder.Default
    CollectionFilter collectionFilter = CollectionFilter.acceptAll();
    @Singular
    List<String> ignoredIndexes;

    /** When set, the confirmation provider is consulted before destructive steps. */
    @Builder.Default
    boolean safeRun = true;
    @Builder.Default
    boolean performanceLogging = true;
    @Builder.Default
    boolean saveCollectionLogs = false;

    @Builder.Default
    RetryPolicy retryPolicy = RetryPolicy.defaults();
    @Builder.Default
    PollingPolicy readinessPolling = PollingPolicy.defaults();

    @Builder.Default
    MaintenanceCoordinator coordinator = MaintenanceCoordinator.NONE;
    @Builder.Default
    ConfirmationProvider confirmationProvider = ConfirmationProvider.autoApprove();
}
