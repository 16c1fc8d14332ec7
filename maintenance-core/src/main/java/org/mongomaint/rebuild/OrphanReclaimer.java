package org.mongomaint.rebuild;

import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;

import org.mongomaint.MaintenanceAbortedException;
import org.mongomaint.client.DatabaseClient;
import org.mongomaint.client.DatabaseCommandException;
import org.mongomaint.confirm.ConfirmationPoint;
import org.mongomaint.confirm.ConfirmationProvider;
import org.mongomaint.confirm.Decision;
import org.mongomaint.model.OrphanedIndex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Finds covering indexes left behind by interrupted runs and drops them.
 *
 * <ul>
 *   <li><b>Strict</b> ({@link #reclaimStrict}): a covering index is removed only when the index
 *   it covers is already recorded as completed. During a multi-session rebuild a covering index
 *   of an unfinished index may be the current run's live work.</li>
 *   <li><b>Aggressive</b> ({@link #reclaimAll}): every index carrying the covering suffix is
 *   removed. Meant for standalone cleanup when no rebuild is in progress.</li>
 * </ul>
 *
 * Before anything is dropped the {@link ConfirmationProvider} is asked at
 * {@link ConfirmationPoint#ORPHAN_CLEANUP}: YES drops, SKIP leaves the orphans in place, any
 * other answer aborts.
 */
public class OrphanReclaimer {
    private final DatabaseClient client;
    private final ConfirmationProvider confirmation;
    private final Logger log;

    public OrphanReclaimer(DatabaseClient client, ConfirmationProvider confirmation) {
        this(client, confirmation, LoggerFactory.getLogger(OrphanReclaimer.class));
    }

    public OrphanReclaimer(DatabaseClient client, ConfirmationProvider confirmation, Logger log) {
        this.client = client;
        this.confirmation = confirmation;
        this.log = log;
    }

    /**
     * @param completed completed index names per collection, as recorded in the checkpoint
     * @return the indexes that were dropped
     */
    public Mono<List<OrphanedIndex>> reclaimStrict(
        List<String> collections,
        String coverSuffix,
        Map<String, List<String>> completed
    ) {
        return reclaim(collections, coverSuffix,
            (collection, originalName) -> completed.getOrDefault(collection, List.of()).contains(originalName));
    }

    public Mono<List<OrphanedIndex>> reclaimAll(List<String> collections, String coverSuffix) {
        return reclaim(collections, coverSuffix, (collection, originalName) -> true);
    }

    Mono<List<OrphanedIndex>> findOrphans(
        List<String> collections,
        String coverSuffix,
        BiPredicate<String, String> eligible
    ) {
        return Flux.fromIterable(collections)
            .concatMap(collection -> client.listIndexes(collection)
                .map(document -> document.path("name").asText(""))
                .filter(name -> name.endsWith(coverSuffix) && name.length() > coverSuffix.length())
                .filter(name -> eligible.test(collection, name.substring(0, name.length() - coverSuffix.length())))
                .map(name -> new OrphanedIndex(collection, name)))
            .collectList();
    }

    private Mono<List<OrphanedIndex>> reclaim(
        List<String> collections,
        String coverSuffix,
        BiPredicate<String, String> eligible
    ) {
        log.info("Checking {} collection(s) for orphaned covering indexes", collections.size());
        return findOrphans(collections, coverSuffix, eligible)
            .flatMap(orphans -> {
                if (orphans.isEmpty()) {
                    log.info("No orphaned indexes found");
                    return Mono.just(orphans);
                }
                log.warn("Found {} orphaned covering index(es): {}", orphans.size(), orphans);
                return confirmation.ask(ConfirmationPoint.ORPHAN_CLEANUP, orphans.size() + " orphaned index(es)")
                    .flatMap(decision -> {
                        if (decision == Decision.SKIP) {
                            log.info("Leaving orphaned indexes in place");
                            return Mono.just(List.<OrphanedIndex>of());
                        }
                        if (decision != Decision.YES) {
                            return Mono.error(new MaintenanceAbortedException("User aborted orphan cleanup"));
                        }
                        return drop(orphans);
                    });
            });
    }

    private Mono<List<OrphanedIndex>> drop(List<OrphanedIndex> orphans) {
        return Flux.fromIterable(orphans)
            .concatMap(orphan -> client.dropIndex(orphan.collection(), orphan.indexName())
                .onErrorResume(
                    e -> e instanceof DatabaseCommandException
                        && ((DatabaseCommandException) e).getCode() == DatabaseCommandException.INDEX_NOT_FOUND,
                    e -> {
                        log.debug("Orphan {} was already gone", orphan);
                        return Mono.empty();
                    })
                .doOnSuccess(unused -> log.info("Dropped orphaned index '{}' from '{}'", orphan.indexName(), orphan.collection()))
                .thenReturn(orphan))
            .collectList();
    }
}
