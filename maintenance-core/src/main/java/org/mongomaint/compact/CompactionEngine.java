package org.mongomaint.compact;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.mongomaint.MaintenanceAbortedException;
import org.mongomaint.client.Commands;
import org.mongomaint.client.DatabaseClient;
import org.mongomaint.client.DatabaseCommandException;
import org.mongomaint.client.NodeTarget;
import org.mongomaint.config.CompactConfig;
import org.mongomaint.log.CollectionCompactLog;
import org.mongomaint.log.CompactErrorRecord;
import org.mongomaint.model.CollectionStats;
import org.mongomaint.version.ServerVersionInfo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Compacts one collection on the secondaries until its storage size stops changing.
 *
 * <p>Each round runs {@code compact} on up to two distinct secondaries and measures the storage
 * size on the first one that succeeded. Rounds stop at convergence (see
 * {@link ConvergenceDetector}) or after the configured maximum; not converging is reported in the
 * log, not raised. Command failures are recorded per round and never end the loop.
 */
public class CompactionEngine {
    static final int TARGETS_PER_ROUND = 2;
    static final String NO_SECONDARIES = "No active secondary targets available for compact.";

    private final DatabaseClient client;
    private final CompactConfig config;
    private final ReplicaSetTopology topology;
    private final ConvergenceDetector detector;
    private final Clock clock;
    private final Logger log;

    public CompactionEngine(DatabaseClient client, CompactConfig config, Clock clock) {
        this(client, config, clock, LoggerFactory.getLogger(CompactionEngine.class));
    }

    public CompactionEngine(DatabaseClient client, CompactConfig config, Clock clock, Logger log) {
        this.client = client;
        this.config = config;
        this.topology = new ReplicaSetTopology(client);
        this.detector = ConvergenceDetector.from(config);
        this.clock = clock;
        this.log = log;
    }

    /**
     * @param postStepDown   skip the savings estimate; used when re-compacting after the primary
     *                       stepped down
     * @param preferredZones zones tried first, typically the former primary's
     * @return the collection's log; errors only on abort
     */
    public Mono<CollectionCompactLog> compact(
        String collection,
        ServerVersionInfo version,
        boolean postStepDown,
        List<String> preferredZones
    ) {
        return Mono.defer(() -> {
            var collectionLog = new CollectionCompactLog(clock.instant());
            log.info("--- Collection: '{}' ---", collection);

            Mono<Boolean> proceed = postStepDown
                ? Mono.just(true)
                : estimateSavings(collection, version).map(bytes -> {
                    var estimatedMb = CollectionStats.toMb(bytes);
                    collectionLog.setEstimatedSavingsMb(estimatedMb);
                    if (estimatedMb < config.getMinSavingsMb()) {
                        var reason = String.format("estimated savings %.0f MB below %.0f MB threshold",
                            estimatedMb, config.getMinSavingsMb());
                        log.info("Skipping collection '{}': {}", collection, reason);
                        collectionLog.setSkippedReason(reason);
                        return false;
                    }
                    log.info("Estimated space savings for '{}': {} MB", collection, String.format("%.0f", estimatedMb));
                    return true;
                });

            return proceed
                .flatMap(go -> go ? iterate(collection, preferredZones, collectionLog) : Mono.<Void>empty())
                .then(Mono.fromCallable(() -> finish(collection, collectionLog)))
                .onErrorResume(e -> !(e instanceof MaintenanceAbortedException), e -> {
                    log.error("Failed to compact '{}'", collection, e);
                    collectionLog.setError(e.getMessage());
                    collectionLog.setTotalTimeSeconds(secondsSince(collectionLog));
                    return Mono.just(collectionLog);
                });
        });
    }

    /**
     * Reclaimable bytes: the dry-run figure where the server supports it, otherwise the gap
     * between allocated and live size. Zero when neither can be read.
     */
    Mono<Long> estimateSavings(String collection, ServerVersionInfo version) {
        Mono<Long> fromStats = client.collectionStats(collection, NodeTarget.primary())
            .map(CollectionStats::fromReply)
            .map(stats -> {
                var wasted = Math.max(0, stats.storageSize() - stats.size());
                log.atDebug().setMessage("{}: storageSize={} MB, dataSize={} MB, estimated savings={} MB")
                    .addArgument(collection)
                    .addArgument(() -> String.format("%.0f", CollectionStats.toMb(stats.storageSize())))
                    .addArgument(() -> String.format("%.0f", CollectionStats.toMb(stats.size())))
                    .addArgument(() -> String.format("%.0f", CollectionStats.toMb(wasted)))
                    .log();
                return wasted;
            });
        Mono<Long> estimate = !version.supportsAutoCompact()
            ? fromStats
            : client.runCommand(Commands.compactDryRun(collection))
                .filter(reply -> Commands.isOk(reply) && reply.has("bytesFreed"))
                .map(reply -> reply.path("bytesFreed").asLong())
                .onErrorResume(e -> {
                    log.debug("dryRun not available for '{}', estimating from collStats: {}", collection, e.getMessage());
                    return Mono.empty();
                })
                .switchIfEmpty(fromStats);
        return estimate.onErrorResume(e -> {
            log.debug("Space estimate for '{}' failed: {}", collection, e.getMessage());
            return Mono.just(0L);
        });
    }

    private Mono<Void> iterate(String collection, List<String> preferredZones, CollectionCompactLog collectionLog) {
        log.info("Running iterative compact of '{}' on secondaries", collection);
        return Flux.range(1, config.getMaxIterations())
            .concatMap(iteration -> round(collection, iteration, preferredZones, collectionLog)
                .map(sizeBytes -> {
                    collectionLog.getMeasurements().add(sizeBytes);
                    log.debug("Iteration {}: {} MB", iteration, String.format("%.0f", CollectionStats.toMb(sizeBytes)));
                    return detector.hasConverged(collectionLog.getMeasurements());
                })
                .defaultIfEmpty(false)
                .doOnNext(converged -> collectionLog.setIterations(iteration))
                .flatMap(converged -> converged
                    ? Mono.just(true)
                    : Mono.delay(config.getIterationDelay()).thenReturn(false)))
            .takeUntil(Boolean::booleanValue)
            .last(false)
            .doOnNext(collectionLog::setConverged)
            .then();
    }

    /** One compaction round; emits the measured storage size, or nothing if no target succeeded. */
    private Mono<Long> round(String collection, int iteration, List<String> preferredZones, CollectionCompactLog collectionLog) {
        return topology.secondaryTargets(preferredZones)
            .flatMap(targets -> {
                if (targets.isEmpty()) {
                    log.debug(NO_SECONDARIES);
                    collectionLog.getErrors().add(new CompactErrorRecord(iteration, null, NO_SECONDARIES, false, null));
                    return Mono.<Long>empty();
                }
                if (targets.size() < TARGETS_PER_ROUND) {
                    log.warn("Fewer than {} distinct secondary targets found for compact", TARGETS_PER_ROUND);
                }
                return Flux.fromIterable(targets.subList(0, Math.min(TARGETS_PER_ROUND, targets.size())))
                    .concatMap(target -> compactOn(collection, iteration, target, collectionLog)
                        .map(succeeded -> Map.entry(target, succeeded)))
                    .filter(Map.Entry::getValue)
                    .map(Map.Entry::getKey)
                    .collectList()
                    .flatMap(succeeded -> succeeded.isEmpty()
                        ? Mono.<Long>empty()
                        : measure(collection, iteration, succeeded.get(0), collectionLog));
            })
            .onErrorResume(e -> !(e instanceof MaintenanceAbortedException), e -> {
                log.debug("Compact round {} of '{}' failed: {}", iteration, collection, e.getMessage());
                collectionLog.getErrors().add(new CompactErrorRecord(iteration, null, e.getMessage(), false, null));
                return Mono.empty();
            });
    }

    private Mono<Boolean> compactOn(
        String collection,
        int iteration,
        ReplicaSetTopology.SecondaryTarget target,
        CollectionCompactLog collectionLog
    ) {
        log.info("Targeting secondary zone: {}", target.zone());
        var firstFailure = new AtomicReference<Throwable>();
        var retry = config.getCompactRetry();
        return retry.execute(
                () -> client.runCommand(Commands.compact(collection), target.target())
                    .flatMap(reply -> Commands.isOk(reply)
                        ? Mono.just(reply)
                        : Mono.error(new DatabaseCommandException("compact", reply.path("code").asInt(0), reply.toString()))),
                e -> !(e instanceof MaintenanceAbortedException),
                signal -> {
                    firstFailure.compareAndSet(null, signal.failure());
                    log.debug("Compact on {} failed, retrying: {}", target.zone(), signal.failure().getMessage());
                    return Mono.empty();
                })
            .map(reply -> {
                if (firstFailure.get() != null) {
                    collectionLog.getErrors().add(new CompactErrorRecord(
                        iteration, target.zone(), firstFailure.get().getMessage(), true, "retry"));
                }
                log.debug("Compact iteration {} succeeded on {}", iteration, target.zone());
                return true;
            })
            .onErrorResume(e -> !(e instanceof MaintenanceAbortedException), e -> {
                log.debug("Compact failed on {}: {}", target.zone(), e.getMessage());
                collectionLog.getErrors().add(new CompactErrorRecord(
                    iteration, target.zone(), e.getMessage(), false, retry.getMaxRetries() > 0 ? "retry" : null));
                return Mono.just(false);
            });
    }

    /** Storage size on the member that was compacted. */
    private Mono<Long> measure(
        String collection,
        int iteration,
        ReplicaSetTopology.SecondaryTarget target,
        CollectionCompactLog collectionLog
    ) {
        return client.collectionStats(collection, target.target())
            .map(reply -> CollectionStats.fromReply(reply).storageSize())
            .onErrorResume(e -> {
                log.debug("Failed to read the size of '{}' on {}: {}", collection, target.zone(), e.getMessage());
                collectionLog.getErrors().add(new CompactErrorRecord(iteration, target.zone(), e.getMessage(), false, null));
                return Mono.empty();
            });
    }

    private CollectionCompactLog finish(String collection, CollectionCompactLog collectionLog) {
        var measurements = collectionLog.getMeasurements();
        if (!measurements.isEmpty()) {
            collectionLog.setFinalMeasurementMb(CollectionStats.toMb(measurements.get(measurements.size() - 1)));
        }
        collectionLog.setTotalTimeSeconds(secondsSince(collectionLog));
        if (collectionLog.getSkippedReason() != null) {
            return collectionLog;
        }
        var inMb = measurements.stream()
            .map(bytes -> String.format("%.0f", CollectionStats.toMb(bytes)))
            .collect(Collectors.joining(", ", "[", "]"));
        if (collectionLog.isConverged()) {
            log.info("Convergence of '{}' detected after {} iteration(s), measurements (MB): {}",
                collection, collectionLog.getIterations(), inMb);
        } else {
            log.warn("No convergence of '{}' after {} iteration(s) (max {}), measurements (MB): {}",
                collection, collectionLog.getIterations(), config.getMaxIterations(), inMb);
        }
        if (!collectionLog.getErrors().isEmpty()) {
            log.info("Encountered {} error(s) while compacting '{}'", collectionLog.getErrors().size(), collection);
            collectionLog.getErrors().forEach(err -> log.info("  Iteration {} on {}: {}{}", err.iteration(), err.target(),
                err.error(), err.fallback() == null ? "" : " (retried: " + (err.retrySucceeded() ? "succeeded" : "failed") + ")"));
        }
        return collectionLog;
    }

    private double secondsSince(CollectionCompactLog collectionLog) {
        return Duration.between(collectionLog.getStartTime(), clock.instant()).toMillis() / 1000.0;
    }
}
