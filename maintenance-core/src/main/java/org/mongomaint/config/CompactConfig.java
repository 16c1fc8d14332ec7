package org.mongomaint.config;

import java.nio.file.Path;
import java.time.Duration;

import org.mongomaint.confirm.ConfirmationProvider;
import org.mongomaint.retry.PollingPolicy;
import org.mongomaint.retry.RetryPolicy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Caller input for a compaction run.
 */
@Value
@Builder(toBuilder = true)
public class CompactConfig {
    @NonNull
    String databaseName;
    String clusterName;

    @Builder.Default
    Path logDirectory = Path.of("rebuild_logs");
    @Builder.Default
    boolean performanceLogging = true;

    @Builder.Default
    CollectionFilter collectionFilter = CollectionFilter.acceptAll();

    /** Collections whose estimated reclaimable space is below this are skipped. */
    @Builder.Default
    double minSavingsMb = 5000;
    /** Allowed relative distance of the latest measurement from the first one. */
    @Builder.Default
    double convergenceTolerance = 0.20;
    /** The tolerance rule only applies when both measurements are at least this large. */
    @Builder.Default
    double minConvergenceSizeMb = 5000;
    @Builder.Default
    int maxIterations = 10;
    @Builder.Default
    int stepDownTimeoutSeconds = 120;

    /** {@code null} means: step down on servers older than 8.0. */
    Boolean forceStepdown;
    /** {@code null} means: use node-level auto compaction on 8.0 and newer. */
    Boolean autoCompact;
    @Builder.Default
    boolean forceManualCompact = false;
    /** Interactive mode; only consulted when filters conflict with auto compaction. */
    @Builder.Default
    boolean safeRun = false;

    @Builder.Default
    int autoCompactFreeSpaceTargetMb = 10;
    @Builder.Default
    Duration iterationDelay = Duration.ofMillis(100);
    @Builder.Default
    Duration stepDownSettleDelay = Duration.ofSeconds(2);
    @Builder.Default
    PollingPolicy stepDownPolling = PollingPolicy.builder().timeout(Duration.ofMinutes(2)).build();
    @Builder.Default
    PollingPolicy autoCompactPolling = PollingPolicy.builder()
        .initialDelay(Duration.ofSeconds(5))
        .maxDelay(Duration.ofSeconds(30))
        .timeout(Duration.ofMinutes(5))
        .build();
    @Builder.Default
    RetryPolicy compactRetry = RetryPolicy.defaults();

    @Builder.Default
    ConfirmationProvider confirmationProvider = ConfirmationProvider.autoApprove();
}
