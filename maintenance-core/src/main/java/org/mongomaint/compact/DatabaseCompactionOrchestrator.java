package org.mongomaint.compact;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.mongomaint.MaintenanceAbortedException;
import org.mongomaint.client.DatabaseClient;
import org.mongomaint.client.NodeTarget;
import org.mongomaint.config.CompactConfig;
import org.mongomaint.confirm.ConfirmationPoint;
import org.mongomaint.confirm.Decision;
import org.mongomaint.log.CollectionCompactLog;
import org.mongomaint.log.CompactDatabaseLog;
import org.mongomaint.model.ObjectMapperFactory;
import org.mongomaint.rebuild.ClusterNameResolver;
import org.mongomaint.state.RunPaths;
import org.mongomaint.state.StateStore;
import org.mongomaint.version.ServerVersionInfo;
import org.mongomaint.version.VersionProbe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Entry point of a compaction run over one database.
 *
 * <p>Strategy by server version:
 * <ul>
 *   <li>before 8.0: iterative compaction on the secondaries, then (unless disabled) a primary
 *   step-down followed by a second pass that prefers the former primary;</li>
 *   <li>8.0 and newer: a single run of node-level auto compaction on the primary and each
 *   distinct secondary, unless collection filters or configuration select the manual path.</li>
 * </ul>
 *
 * Compaction keeps no checkpoint. Running it again recomputes the savings estimate, and
 * collections that are already compact fall below the savings floor and are skipped.
 */
public class DatabaseCompactionOrchestrator {
    static final String NO_MATCHING_COLLECTIONS = "No collections match the specified criteria.";
    static final String FEW_SECONDARIES =
        "Fewer than 2 distinct secondary targets found. AutoCompact will run on available nodes only.";

    private final DatabaseClient client;
    private final CompactConfig config;
    private final Clock clock;
    private final Logger log;
    private final CompactionEngine engine;
    private final ReplicaSetTopology topology;
    private final PrimaryStepDownRunner stepDownRunner;
    private final AutoCompactRunner autoCompactRunner;

    public DatabaseCompactionOrchestrator(DatabaseClient client, CompactConfig config) {
        this(client, config, Clock.systemUTC(), LoggerFactory.getLogger(DatabaseCompactionOrchestrator.class));
    }

    public DatabaseCompactionOrchestrator(DatabaseClient client, CompactConfig config, Clock clock, Logger log) {
        this.client = client;
        this.config = config;
        this.clock = clock;
        this.log = log;
        this.engine = new CompactionEngine(client, config, clock, log);
        this.topology = new ReplicaSetTopology(client);
        this.stepDownRunner = new PrimaryStepDownRunner(client, config, topology, log);
        this.autoCompactRunner = new AutoCompactRunner(client, config, log);
    }

    public Mono<CompactDatabaseLog> run() {
        return Mono.defer(() -> {
            var start = clock.instant();
            log.info("### Starting collection compact for database '{}' ###", config.getDatabaseName());
            return new ClusterNameResolver(client).resolve(config.getClusterName())
                .flatMap(clusterName -> new CompactRun(clusterName, start).execute());
        });
    }

    /** Which strategy a run uses, fixed before any collection is touched. */
    record Strategy(boolean autoCompactOnly, boolean stepDown) {}

    private class CompactRun {
        private final Instant start;
        private final StateStore store;
        private final CompactDatabaseLog databaseLog;

        CompactRun(String clusterName, Instant start) {
            this.start = start;
            var paths = new RunPaths(config.getLogDirectory(), config.getLogDirectory(), clusterName, RunPaths.timestamp(clock));
            this.store = new StateStore(paths, ObjectMapperFactory.create());
            this.databaseLog = new CompactDatabaseLog(clusterName, config.getDatabaseName(), start);
        }

        Mono<CompactDatabaseLog> execute() {
            return new VersionProbe(client).detect()
                .doOnNext(version -> {
                    databaseLog.setMongoVersion(version.fullVersion());
                    databaseLog.setSupportsAutoCompact(version.supportsAutoCompact());
                    VersionProbe.requireMinimum(version);
                    log.info("Min savings threshold: {} MB, convergence tolerance: +/-{}%, min convergence size: {} MB",
                        config.getMinSavingsMb(), Math.round(config.getConvergenceTolerance() * 100),
                        config.getMinConvergenceSizeMb());
                })
                .flatMap(version -> selectCollections().flatMap(collections -> collections.isEmpty()
                    ? Mono.fromCallable(this::noMatchingCollections)
                    : chooseStrategy(version).flatMap(strategy -> compactAll(collections, version, strategy))
                        .then(Mono.fromCallable(this::finish))))
                .onErrorResume(MaintenanceAbortedException.class, e -> {
                    log.warn("User aborted. {}", e.getMessage());
                    databaseLog.setAborted(true);
                    databaseLog.getWarnings().add("User aborted.");
                    return Mono.fromCallable(this::finish);
                })
                .onErrorResume(e -> !(e instanceof MaintenanceAbortedException), e -> {
                    log.error("Compact operation failed", e);
                    databaseLog.setError(e.getMessage());
                    try {
                        finish();
                    } catch (RuntimeException writeFailure) {
                        e.addSuppressed(writeFailure);
                    }
                    return Mono.error(e);
                });
        }

        private Mono<List<String>> selectCollections() {
            var filter = config.getCollectionFilter();
            if (filter.includeOverridesExclude()) {
                log.warn("Both include and exclude lists were given; the exclude list is ignored");
            }
            return client.listCollectionNames()
                .filter(filter::accepts)
                .collectList()
                .doOnNext(names -> {
                    if (!names.isEmpty()) {
                        log.info("Found {} collection(s) to process", names.size());
                        names.forEach(name -> log.info("  - {}", name));
                    }
                });
        }

        Mono<Strategy> chooseStrategy(ServerVersionInfo version) {
            var supportsAuto = version.supportsAutoCompact();
            var stepDown = config.getForceStepdown() != null ? config.getForceStepdown() : !supportsAuto;
            boolean autoRequested = config.getAutoCompact() != null ? config.getAutoCompact() : supportsAuto;
            if (!supportsAuto || !autoRequested) {
                return Mono.just(new Strategy(false, !supportsAuto && stepDown));
            }
            if (config.isForceManualCompact()) {
                log.info("Manual compaction forced by configuration");
                return Mono.just(new Strategy(false, false));
            }
            if (!config.getCollectionFilter().hasRules()) {
                return Mono.just(new Strategy(true, false));
            }
            log.warn("Collection filters were given, but autoCompact is node-wide and affects ALL collections");
            if (!config.isSafeRun()) {
                log.warn("Defaulting to manual compaction to honor the collection filters (non-interactive mode)");
                return Mono.just(new Strategy(false, false));
            }
            return config.getConfirmationProvider().ask(ConfirmationPoint.AUTO_COMPACT_FALLBACK, config.getDatabaseName())
                .flatMap(decision -> {
                    if (decision == Decision.YES) {
                        log.info("Using manual compaction to honor the collection filters");
                        return Mono.just(new Strategy(false, false));
                    }
                    if (decision == Decision.NO) {
                        log.warn("Proceeding with autoCompact, collection filters will be ignored");
                        return Mono.just(new Strategy(true, false));
                    }
                    return Mono.error(new MaintenanceAbortedException("User aborted at the autoCompact fallback prompt"));
                });
        }

        private Mono<Void> compactAll(List<String> collections, ServerVersionInfo version, Strategy strategy) {
            if (strategy.autoCompactOnly()) {
                log.info("--- Skipping manual compact (autoCompact enabled) ---");
                collections.forEach(name -> databaseLog.getCollections().put(name, new CollectionCompactLog(clock.instant())));
                return runAutoCompact(collections);
            }
            log.info("--- Compacting collections on secondaries ---");
            Mono<Void> manual = Flux.fromIterable(collections)
                .concatMap(name -> engine.compact(name, version, false, List.of())
                    .doOnNext(collectionLog -> databaseLog.getCollections().put(name, collectionLog)))
                .then();
            return strategy.stepDown() ? manual.then(stepDownAndRecompact(collections, version)) : manual;
        }

        private Mono<Void> stepDownAndRecompact(List<String> collections, ServerVersionInfo version) {
            log.info("--- Stepping down primary (required before 8.0 for full convergence) ---");
            return stepDownRunner.stepDown().flatMap(outcome -> {
                databaseLog.setSteppedDown(outcome.steppedDown());
                if (!outcome.steppedDown()) {
                    databaseLog.getWarnings().add("Primary step-down did not complete; the primary was not compacted");
                    return Mono.<Void>empty();
                }
                log.info("--- Re-compacting collections after step-down ---");
                var preferred = outcome.formerPrimaryZone().map(List::of).orElse(List.of());
                return Flux.fromIterable(collections)
                    .filter(name -> databaseLog.getCollections().get(name).getSkippedReason() == null)
                    .concatMap(name -> engine.compact(name, version, true, preferred)
                        .doOnNext(recompacted -> mergeRecompaction(databaseLog.getCollections().get(name), recompacted)))
                    .then();
            });
        }

        private Mono<Void> runAutoCompact(List<String> collections) {
            log.info("--- Enabling autoCompact (8.0+) on every node; it compacts ALL collections ---");
            databaseLog.setAutoCompactUsed(true);
            return topology.secondaryTargets(List.of())
                .onErrorResume(e -> {
                    log.warn("Could not read the replica set topology, running autoCompact on the primary only", e);
                    return Mono.just(List.of());
                })
                .flatMap(secondaries -> {
                    if (secondaries.size() < CompactionEngine.TARGETS_PER_ROUND) {
                        log.warn(FEW_SECONDARIES);
                        databaseLog.getWarnings().add(FEW_SECONDARIES);
                    }
                    return autoCompactRunner.runOnce(NodeTarget.primary())
                        .flatMap(primaryFinished -> Flux.fromIterable(secondaries)
                            .concatMap(secondary -> autoCompactRunner.runOnce(secondary.target()))
                            .then(Mono.fromRunnable(() -> collections.forEach(name -> {
                                var collectionLog = databaseLog.getCollections()
                                    .computeIfAbsent(name, n -> new CollectionCompactLog(clock.instant()));
                                collectionLog.setAutoCompactEnabled(true);
                                collectionLog.setAutoCompactReducedSize(primaryFinished);
                                collectionLog.setTotalTimeSeconds(secondsSince(collectionLog.getStartTime()));
                            }))));
                })
                .then();
        }

        private CompactDatabaseLog noMatchingCollections() {
            log.error(NO_MATCHING_COLLECTIONS);
            databaseLog.setError(NO_MATCHING_COLLECTIONS);
            return finish();
        }

        private CompactDatabaseLog finish() {
            databaseLog.setTotalTimeSeconds(secondsSince(start));
            if (config.isPerformanceLogging()) {
                store.writeCompactionLog(databaseLog);
                log.info("Compaction log written to {}", store.getPaths().compactionLog());
            }
            if (databaseLog.getError() == null && !databaseLog.isAborted()) {
                log.info("Compact operation completed in {}s", String.format("%.1f", databaseLog.getTotalTimeSeconds()));
            }
            return databaseLog;
        }

        private double secondsSince(Instant from) {
            return Duration.between(from, clock.instant()).toMillis() / 1000.0;
        }
    }

    /** Append a post-step-down pass to the collection's first-pass log. */
    static void mergeRecompaction(CollectionCompactLog first, CollectionCompactLog second) {
        first.getMeasurements().addAll(second.getMeasurements());
        first.setIterations(first.getIterations() + second.getIterations());
        var errors = new ArrayList<>(first.getErrors());
        errors.addAll(second.getErrors());
        first.setErrors(errors);
        first.setConverged(second.isConverged());
        first.setSteppedDown(true);
        if (!second.getMeasurements().isEmpty()) {
            first.setFinalMeasurementMb(second.getFinalMeasurementMb());
        }
        if (second.getError() != null) {
            first.setError(second.getError());
        }
        first.setTotalTimeSeconds(first.getTotalTimeSeconds() + second.getTotalTimeSeconds());
    }
}
