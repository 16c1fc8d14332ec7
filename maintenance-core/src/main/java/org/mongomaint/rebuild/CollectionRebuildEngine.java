package org.mongomaint.rebuild;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import org.mongomaint.MaintenanceAbortedException;
import org.mongomaint.client.DatabaseClient;
import org.mongomaint.client.NodeTarget;
import org.mongomaint.config.CollectionFilter;
import org.mongomaint.config.RebuildConfig;
import org.mongomaint.confirm.ConfirmationPoint;
import org.mongomaint.confirm.Decision;
import org.mongomaint.coordinator.CoordinatorNotifier;
import org.mongomaint.log.CollectionLog;
import org.mongomaint.log.IndexLog;
import org.mongomaint.model.CollectionStats;
import org.mongomaint.model.IndexDescriptor;
import org.mongomaint.state.StateStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Rebuilds the eligible indexes of one collection, largest first, then re-measures the
 * collection's index sizes once. Measuring after every index would pick up the transient sizes
 * some storage engines report while a build is settling.
 *
 * Not eligible: indexes already completed in the checkpoint, {@code _id_}, unique indexes,
 * covering indexes and names matching the ignore patterns. An index recorded in flight whose
 * original is gone is always eligible, so a crash between drop and final build is repaired.
 */
public class CollectionRebuildEngine {
    private final DatabaseClient client;
    private final IndexRebuildEngine indexEngine;
    private final StateStore stateStore;
    private final RebuildConfig config;
    private final CoordinatorNotifier notifier;
    private final Clock clock;
    private final Logger log;

    public CollectionRebuildEngine(
        DatabaseClient client,
        IndexRebuildEngine indexEngine,
        StateStore stateStore,
        RebuildConfig config,
        Clock clock
    ) {
        this(client, indexEngine, stateStore, config, clock, LoggerFactory.getLogger(CollectionRebuildEngine.class));
    }

    public CollectionRebuildEngine(
        DatabaseClient client,
        IndexRebuildEngine indexEngine,
        StateStore stateStore,
        RebuildConfig config,
        Clock clock,
        Logger log
    ) {
        this.client = client;
        this.indexEngine = indexEngine;
        this.stateStore = stateStore;
        this.config = config;
        this.notifier = new CoordinatorNotifier(config.getCoordinator());
        this.clock = clock;
        this.log = log;
    }

    record Candidate(IndexDescriptor index, long sizeBytes) {}

    public Mono<CollectionRebuildResult> rebuild(String collection) {
        return Mono.defer(() -> {
            var start = clock.instant();
            return Mono.zip(
                    client.listIndexes(collection).map(IndexDescriptor::fromListIndexes).collectList(),
                    client.collectionStats(collection, NodeTarget.primary()).map(CollectionStats::fromReply)
                )
                .flatMap(current -> process(collection, start, current.getT1(), current.getT2()));
        });
    }

    List<Candidate> selectCandidates(String collection, List<IndexDescriptor> indexes, CollectionStats stats) {
        var state = stateStore.getState();
        var present = new HashSet<String>();
        var candidates = new ArrayList<Candidate>();
        for (var index : indexes) {
            present.add(index.name());
            if (index.name().endsWith(config.getCoverSuffix())) {
                continue;
            }
            if (state.isCompleted(collection, index.name())) {
                log.info("Skipping index '{}' (already completed in the checkpoint)", index.name());
                continue;
            }
            if (index.isIdIndex() || index.isUnique()
                || CollectionFilter.matchesAny(index.name(), config.getIgnoredIndexes())) {
                continue;
            }
            candidates.add(new Candidate(index, stats.indexSize(index.name())));
        }
        for (Map.Entry<String, IndexDescriptor> inFlight : state.inFlightIn(collection).entrySet()) {
            var name = inFlight.getKey();
            if (!present.contains(name) && !state.isCompleted(collection, name)) {
                log.warn("Index '{}' on '{}' was dropped by an interrupted run, recovering it", name, collection);
                candidates.add(new Candidate(inFlight.getValue(), stats.indexSize(name + config.getCoverSuffix())));
            }
        }
        candidates.sort(Comparator.comparingLong(Candidate::sizeBytes).reversed());
        return candidates;
    }

    private Mono<CollectionRebuildResult> process(
        String collection,
        Instant start,
        List<IndexDescriptor> indexes,
        CollectionStats initialStats
    ) {
        var candidates = selectCandidates(collection, indexes, initialStats);
        if (candidates.isEmpty()) {
            log.info("No indexes in '{}' require rebuild", collection);
            return Mono.just(new CollectionRebuildResult(CollectionRebuildResult.Outcome.SKIPPED, new CollectionLog(start)));
        }
        log.info("Found {} index(es) to rebuild in '{}' (largest first):", candidates.size(), collection);
        candidates.forEach(c -> log.info("  - {} (~{} MB)", c.index().name(),
            String.format("%.3f", CollectionStats.toMb(c.sizeBytes()))));

        notifier.notify("onCollectionStart", c -> c.onCollectionStart(collection, candidates.size()));

        return confirm(ConfirmationPoint.INDEX_LIST, collection).flatMap(decision -> {
            switch (decision) {
                case YES:
                    return rebuildAll(collection, start, candidates, initialStats, false);
                case SPECIFY:
                    return rebuildAll(collection, start, candidates, initialStats, true);
                case SKIP:
                    log.info("Skipping collection '{}'", collection);
                    return Mono.just(new CollectionRebuildResult(
                        CollectionRebuildResult.Outcome.SKIPPED, new CollectionLog(start)));
                default:
                    return Mono.error(new MaintenanceAbortedException("User aborted the operation at collection " + collection));
            }
        });
    }

    private Mono<CollectionRebuildResult> rebuildAll(
        String collection,
        Instant start,
        List<Candidate> candidates,
        CollectionStats initialStats,
        boolean specifyEach
    ) {
        var collectionLog = new CollectionLog(start);
        return Flux.fromIterable(candidates)
            .concatMap(candidate -> shouldProcess(collection, candidate, specifyEach)
                .filter(Boolean::booleanValue)
                .flatMap(proceed -> rebuildOne(collection, candidate, collectionLog)))
            .then(Mono.defer(() -> measure(collection, collectionLog, initialStats)));
    }

    private Mono<Boolean> shouldProcess(String collection, Candidate candidate, boolean specifyEach) {
        if (!specifyEach) {
            return Mono.just(true);
        }
        var name = candidate.index().name();
        return config.getConfirmationProvider().ask(ConfirmationPoint.INDEX, collection + "." + name)
            .flatMap(decision -> {
                if (decision == Decision.YES) {
                    return Mono.just(true);
                }
                if (decision == Decision.NO || decision == Decision.SKIP) {
                    log.info("Skipping index '{}'", name);
                    return Mono.just(false);
                }
                return Mono.error(new MaintenanceAbortedException("User aborted the operation at index " + collection + "." + name));
            });
    }

    private Mono<IndexLog> rebuildOne(String collection, Candidate candidate, CollectionLog collectionLog) {
        var name = candidate.index().name();
        var sizeMb = CollectionStats.toMb(candidate.sizeBytes());
        notifier.notify("onIndexStart", c -> c.onIndexStart(collection, name, sizeMb));
        return indexEngine.rebuild(collection, candidate.index(), candidate.sizeBytes())
            .doOnNext(indexLog -> {
                collectionLog.getIndexes().put(name, indexLog);
                notifier.notify("onIndexComplete",
                    c -> c.onIndexComplete(collection, name, indexLog.getTimeSeconds(), indexLog.succeeded()));
                if (!indexLog.succeeded()) {
                    var warning = "Index '" + name + "' on '" + collection + "' failed after "
                        + indexLog.getRetryCount() + " retries: " + indexLog.getError();
                    collectionLog.getWarnings().add(warning);
                    notifier.notify("onError", c -> c.onError(warning, Map.of(
                        "collection", collection,
                        "index", name,
                        "retryCount", indexLog.getRetryCount()
                    )));
                }
            });
    }

    private Mono<CollectionRebuildResult> measure(String collection, CollectionLog collectionLog, CollectionStats initialStats) {
        return client.collectionStats(collection, NodeTarget.primary())
            .map(CollectionStats::fromReply)
            .map(finalStats -> {
                collectionLog.getIndexes().forEach((name, indexLog) -> {
                    if (indexLog.succeeded()) {
                        indexLog.setFinalSizeMb(CollectionStats.toMb(finalStats.indexSize(name)));
                    }
                });
                collectionLog.setInitialSizeMb(CollectionStats.toMb(initialStats.totalIndexSize()));
                collectionLog.setFinalSizeMb(CollectionStats.toMb(finalStats.totalIndexSize()));
                collectionLog.setReclaimedMb(collectionLog.getInitialSizeMb() - collectionLog.getFinalSizeMb());
                collectionLog.setTotalTimeSeconds(
                    Duration.between(collectionLog.getStartTime(), clock.instant()).toMillis() / 1000.0);

                notifier.notify("onCollectionComplete", c -> c.onCollectionComplete(
                    collection, collectionLog.getReclaimedMb(), collectionLog.getTotalTimeSeconds()));
                log.info("Collection '{}' complete in {}s, reclaimed {} MB", collection,
                    String.format("%.1f", collectionLog.getTotalTimeSeconds()),
                    String.format("%.2f", collectionLog.getReclaimedMb()));
                return new CollectionRebuildResult(CollectionRebuildResult.Outcome.COMPLETED, collectionLog);
            });
    }

    private Mono<Decision> confirm(ConfirmationPoint point, String subject) {
        if (!config.isSafeRun()) {
            return Mono.just(Decision.YES);
        }
        return config.getConfirmationProvider().ask(point, subject)
            .doOnNext(decision -> log.info("Operator chose {} for {}", decision, subject));
    }
}
