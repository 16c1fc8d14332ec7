package org.mongomaint.rebuild;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.mongomaint.MaintenanceAbortedException;
import org.mongomaint.client.DatabaseClient;
import org.mongomaint.client.NodeTarget;
import org.mongomaint.config.RebuildConfig;
import org.mongomaint.confirm.ConfirmationPoint;
import org.mongomaint.confirm.ConfirmationProvider;
import org.mongomaint.confirm.Decision;
import org.mongomaint.coordinator.CoordinatorNotifier;
import org.mongomaint.log.DatabaseLog;
import org.mongomaint.model.CollectionStats;
import org.mongomaint.model.ObjectMapperFactory;
import org.mongomaint.state.RunPaths;
import org.mongomaint.state.SessionRecord;
import org.mongomaint.state.SessionStatus;
import org.mongomaint.state.StateStore;
import org.mongomaint.version.IndexOptionFilter;
import org.mongomaint.version.ServerVersionInfo;
import org.mongomaint.version.VersionProbe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Entry point of an index rebuild over one database.
 *
 * <p>A run resumes from the cluster's checkpoint when one exists: completed indexes are skipped,
 * the cumulative performance log is continued and a new session is appended to the history.
 * The checkpoint and the index backup are removed only when every index of the run succeeded.
 *
 * <p>Outcomes:
 * <ul>
 *   <li>normal completion, possibly with failed indexes listed as warnings;</li>
 *   <li>operator abort: the returned log has {@code aborted} set and the checkpoint is kept;</li>
 *   <li>critical error: the partial log is written with the error and stack, and the error is
 *   propagated.</li>
 * </ul>
 */
public class DatabaseRebuildOrchestrator {
    static final String USER_ABORTED = "User aborted.";
    static final String NO_MATCHING_COLLECTIONS = "No collections match the specified criteria.";

    private final DatabaseClient client;
    private final RebuildConfig config;
    private final Clock clock;
    private final Logger log;
    private final ObjectMapper objectMapper = ObjectMapperFactory.create();
    private final CoordinatorNotifier notifier;

    public DatabaseRebuildOrchestrator(DatabaseClient client, RebuildConfig config) {
        this(client, config, Clock.systemUTC(), LoggerFactory.getLogger(DatabaseRebuildOrchestrator.class));
    }

    public DatabaseRebuildOrchestrator(DatabaseClient client, RebuildConfig config, Clock clock, Logger log) {
        this.client = client;
        this.config = config;
        this.clock = clock;
        this.log = log;
        this.notifier = new CoordinatorNotifier(config.getCoordinator());
    }

    public Mono<DatabaseLog> run() {
        return Mono.defer(() -> {
            var start = clock.instant();
            log.info("### Starting index rebuild for database '{}' ###", config.getDatabaseName());
            return new ClusterNameResolver(client).resolve(config.getClusterName())
                .flatMap(clusterName -> new RebuildRun(clusterName, start).execute());
        });
    }

    /** Mutable bookkeeping of a single invocation. */
    private class RebuildRun {
        private final String clusterName;
        private final Instant start;
        private final StateStore store;
        private final SessionRecord session;
        private DatabaseLog databaseLog;
        private int indexesRebuilt;
        private int indexesFailed;

        RebuildRun(String clusterName, Instant start) {
            this.clusterName = clusterName;
            this.start = start;
            var paths = new RunPaths(
                config.getRuntimeDirectory(),
                config.getLogDirectory(),
                clusterName,
                RunPaths.timestamp(clock)
            );
            this.store = new StateStore(paths, objectMapper);
            this.session = new SessionRecord("session_" + paths.timestamp(), start);
            this.databaseLog = new DatabaseLog(clusterName, config.getDatabaseName(), start);
        }

        Mono<DatabaseLog> execute() {
            return Mono.fromRunnable(this::startSession)
                .then(reclaimOrphans())
                .then(Mono.fromRunnable(store::pruneStaleRuntimeFiles))
                .then(new VersionProbe(client).detect())
                .doOnNext(VersionProbe::requireMinimum)
                .flatMap(version -> selectCollections()
                    .flatMap(selected -> selected.isEmpty()
                        ? Mono.fromCallable(this::noMatchingCollections)
                        : rebuildAll(selected, version).then(Mono.fromCallable(this::finish))))
                .onErrorResume(MaintenanceAbortedException.class, this::aborted)
                .onErrorResume(e -> !(e instanceof MaintenanceAbortedException), this::failed);
        }

        private void startSession() {
            var state = store.load();
            if (state.getCumulativeLog() != null) {
                databaseLog = state.getCumulativeLog();
                databaseLog.setAborted(false);
                databaseLog.setError(null);
                databaseLog.setErrorStack(null);
                log.info("Resuming rebuild: {} session(s) recorded, {} index(es) already completed",
                    state.getSessions().size(), state.getCompleted().values().stream().mapToInt(List::size).sum());
            }
            state.getSessions().add(session);
            state.setCumulativeLog(databaseLog);
            store.checkpoint();
        }

        private Mono<Void> reclaimOrphans() {
            ConfirmationProvider confirmation = config.isSafeRun()
                ? config.getConfirmationProvider()
                : ConfirmationProvider.autoApprove();
            var reclaimer = new OrphanReclaimer(client, confirmation, log);
            return client.listCollectionNames().collectList()
                .flatMap(names -> reclaimer.reclaimStrict(names, config.getCoverSuffix(), store.getState().getCompleted()))
                .then();
        }

        /** Back up every collection's indexes, then apply the filter, size ordering and confirmation. */
        private Mono<List<String>> selectCollections() {
            return client.listCollectionNames()
                .concatMap(name -> Mono.zip(
                    client.listIndexes(name).collectList(),
                    client.collectionStats(name, NodeTarget.primary()).map(CollectionStats::fromReply)
                ).map(t -> new Discovered(name, t.getT1(), t.getT2().totalIndexSize())))
                .collectList()
                .flatMap(discovered -> {
                    var backup = new LinkedHashMap<String, List<ObjectNode>>();
                    discovered.forEach(d -> backup.put(d.name(), d.indexes()));
                    store.writeBackup(backup);
                    log.info("Backed up index definitions of {} collection(s) to {}",
                        backup.size(), store.getPaths().backupFile());

                    var filter = config.getCollectionFilter();
                    if (filter.includeOverridesExclude()) {
                        log.warn("Both include and exclude lists were given; the exclude list is ignored");
                    }
                    var selected = new ArrayList<Discovered>();
                    for (var d : discovered) {
                        if (filter.accepts(d.name())) {
                            selected.add(d);
                        }
                    }
                    if (selected.isEmpty()) {
                        return Mono.just(List.<String>of());
                    }
                    selected.sort(Comparator.comparingLong(Discovered::indexBytes).reversed());
                    log.info("Collections to process (largest total index size first):");
                    selected.forEach(d -> log.info("  - {} (~{} MB of indexes)", d.name(),
                        String.format("%.2f", CollectionStats.toMb(d.indexBytes()))));
                    return confirmCollections(selected.stream().map(Discovered::name).toList());
                });
        }

        private Mono<List<String>> confirmCollections(List<String> names) {
            if (!config.isSafeRun()) {
                return Mono.just(names);
            }
            var confirmation = config.getConfirmationProvider();
            return confirmation.ask(ConfirmationPoint.COLLECTION_LIST, config.getDatabaseName())
                .flatMap(decision -> {
                    if (decision == Decision.YES) {
                        return Mono.just(names);
                    }
                    if (decision != Decision.SPECIFY) {
                        return Mono.error(new MaintenanceAbortedException(USER_ABORTED));
                    }
                    return Flux.fromIterable(names)
                        .concatMap(name -> confirmation.ask(ConfirmationPoint.COLLECTION, name)
                            .map(answer -> Map.entry(name, answer)))
                        .takeWhile(answer -> answer.getValue() != Decision.END)
                        .filter(answer -> answer.getValue() == Decision.YES)
                        .map(Map.Entry::getKey)
                        .collectList();
                });
        }

        private Mono<Void> rebuildAll(List<String> collections, ServerVersionInfo version) {
            notifier.notify("onRebuildStart", c -> c.onRebuildStart(config.getDatabaseName(), collections.size()));
            var indexEngine = new IndexRebuildEngine(client, store, new IndexOptionFilter(version), config, clock, log);
            var collectionEngine = new CollectionRebuildEngine(client, indexEngine, store, config, clock, log);
            return Flux.fromIterable(collections)
                .concatMap(collection -> collectionEngine.rebuild(collection)
                    .doOnNext(result -> record(collection, result)))
                .then();
        }

        private void record(String collection, CollectionRebuildResult result) {
            if (result.isSkipped()) {
                return;
            }
            var collectionLog = result.log();
            var failed = (int) collectionLog.failedIndexCount();
            indexesFailed += failed;
            indexesRebuilt += collectionLog.getIndexes().size() - failed;
            databaseLog.getWarnings().addAll(collectionLog.getWarnings());

            var merged = databaseLog.mergeCollection(collection, collectionLog);
            databaseLog.recomputeTotals();
            session.setIndexesRebuilt(indexesRebuilt);
            store.getState().setCumulativeLog(databaseLog);
            store.checkpoint();
            if (config.isSaveCollectionLogs()) {
                store.writeCollectionLog(collection, merged);
            }
        }

        private DatabaseLog noMatchingCollections() {
            log.error(NO_MATCHING_COLLECTIONS);
            databaseLog.setError(NO_MATCHING_COLLECTIONS);
            closeSession(SessionStatus.COMPLETED);
            store.checkpoint();
            return databaseLog;
        }

        private DatabaseLog finish() {
            closeSession(SessionStatus.COMPLETED);
            var sessionSeconds = session.getTotalTimeSeconds();
            String warning = indexesFailed == 0
                ? null
                : indexesFailed + " index(es) failed to rebuild; the checkpoint was kept so a later run can retry them";
            notifier.notify("onRebuildComplete", c -> c.onRebuildComplete(config.getDatabaseName(),
                databaseLog.getTotalReclaimedMb(), sessionSeconds, indexesFailed == 0, warning));

            writePerformanceLog();
            if (indexesFailed == 0) {
                store.deleteCheckpoint();
                store.deleteBackup();
            } else {
                log.warn(warning);
                databaseLog.getWarnings().add(warning);
                store.checkpoint();
            }
            log.info("Rebuild of '{}' finished in {}s: {} index(es) rebuilt, {} failed, {} MB reclaimed overall",
                config.getDatabaseName(), String.format("%.1f", sessionSeconds), indexesRebuilt, indexesFailed,
                String.format("%.2f", databaseLog.getTotalReclaimedMb()));
            return databaseLog;
        }

        private Mono<DatabaseLog> aborted(MaintenanceAbortedException e) {
            log.warn(USER_ABORTED + " {}", e.getMessage());
            databaseLog.setAborted(true);
            databaseLog.getWarnings().add(USER_ABORTED);
            closeSession(SessionStatus.ABORTED);
            store.checkpoint();
            writePerformanceLog();
            notifier.notify("onRebuildComplete", c -> c.onRebuildComplete(config.getDatabaseName(),
                databaseLog.getTotalReclaimedMb(), session.getTotalTimeSeconds(), false, USER_ABORTED));
            return Mono.just(databaseLog);
        }

        private Mono<DatabaseLog> failed(Throwable e) {
            log.error("Rebuild of '{}' failed", config.getDatabaseName(), e);
            databaseLog.setError(e.getMessage());
            databaseLog.setErrorStack(stackTrace(e));
            closeSession(SessionStatus.FAILED);
            try {
                store.checkpoint();
                writePerformanceLog();
            } catch (RuntimeException writeFailure) {
                log.error("Could not record the failure in {}", store.getPaths().stateFile(), writeFailure);
                e.addSuppressed(writeFailure);
            }
            notifier.notify("onError", c -> c.onError(String.valueOf(e.getMessage()), Map.of(
                "database", config.getDatabaseName(),
                "cluster", clusterName
            )));
            notifier.notify("onRebuildComplete", c -> c.onRebuildComplete(config.getDatabaseName(),
                databaseLog.getTotalReclaimedMb(), session.getTotalTimeSeconds(), false, e.getMessage()));
            return Mono.error(e);
        }

        private void closeSession(SessionStatus status) {
            var now = clock.instant();
            session.setIndexesRebuilt(indexesRebuilt);
            session.finish(now, status);
            var sessions = store.getState().getSessions();
            databaseLog.setSessionHistory(new ArrayList<>(sessions));
            databaseLog.setTotalTimeSeconds(sessions.stream().mapToDouble(SessionRecord::getTotalTimeSeconds).sum());
            databaseLog.recomputeTotals();
            store.getState().setCumulativeLog(databaseLog);
            log.debug("Session {} closed as {} after {}", session.getSessionId(), status, Duration.between(start, now));
        }

        private void writePerformanceLog() {
            if (config.isPerformanceLogging()) {
                store.writePerformanceLog(databaseLog);
                Path file = store.getPaths().performanceLog();
                log.info("Performance log written to {}", file);
            }
        }
    }

    private record Discovered(String name, List<ObjectNode> indexes, long indexBytes) {}

    private static String stackTrace(Throwable e) {
        var out = new StringWriter();
        e.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
