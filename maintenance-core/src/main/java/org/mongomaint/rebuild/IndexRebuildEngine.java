package org.mongomaint.rebuild;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.mongomaint.MaintenanceAbortedException;
import org.mongomaint.StateStoreException;
import org.mongomaint.client.DatabaseClient;
import org.mongomaint.client.DatabaseCommandException;
import org.mongomaint.config.RebuildConfig;
import org.mongomaint.log.IndexLog;
import org.mongomaint.model.CollectionStats;
import org.mongomaint.model.IndexDescriptor;
import org.mongomaint.state.StateStore;
import org.mongomaint.version.IndexOptionFilter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Rebuilds one index in place without leaving the collection uncovered.
 *
 * <ol>
 *   <li>Covering key = original key plus one ascending synthetic field, covering name = original
 *   name plus the covering suffix, covering options = the partial filter, if any.</li>
 *   <li>A leftover covering index from a crashed run is reused when it has finished building and
 *   has the expected shape; otherwise it is dropped.</li>
 *   <li>Create and verify the covering index.</li>
 *   <li>Record the definition in the checkpoint, then drop the original.</li>
 *   <li>Create the final index under the original name with version-filtered options.</li>
 *   <li>Verify the final index.</li>
 *   <li>Drop the covering index.</li>
 *   <li>Mark the index completed and persist the checkpoint immediately.</li>
 * </ol>
 *
 * Steps 1 to 7 run under the configured {@link org.mongomaint.retry.RetryPolicy}. When retries are
 * exhausted the index is reported {@link IndexLog.Status#FAILED} and the caller moves on; only an
 * abort or a checkpoint I/O failure escapes as an error.
 */
public class IndexRebuildEngine {
    private final DatabaseClient client;
    private final StateStore stateStore;
    private final IndexOptionFilter optionFilter;
    private final RebuildConfig config;
    private final Clock clock;
    private final Logger log;
    private final IndexReadinessChecker readiness;
    private final IndexVerifier verifier;

    public IndexRebuildEngine(
        DatabaseClient client,
        StateStore stateStore,
        IndexOptionFilter optionFilter,
        RebuildConfig config,
        Clock clock
    ) {
        this(client, stateStore, optionFilter, config, clock, LoggerFactory.getLogger(IndexRebuildEngine.class));
    }

    public IndexRebuildEngine(
        DatabaseClient client,
        StateStore stateStore,
        IndexOptionFilter optionFilter,
        RebuildConfig config,
        Clock clock,
        Logger log
    ) {
        this.client = client;
        this.stateStore = stateStore;
        this.optionFilter = optionFilter;
        this.config = config;
        this.clock = clock;
        this.log = log;
        this.readiness = new IndexReadinessChecker(client);
        this.verifier = new IndexVerifier(readiness, config.getReadinessPolling(), IndexOptionFilter.ALL_KNOWN_OPTIONS);
    }

    /** What the rebuild of one index will create, derived before anything is touched. */
    record Plan(
        String collection,
        IndexDescriptor original,
        ObjectNode finalOptions,
        String coverName,
        ObjectNode coverKey,
        ObjectNode coverOptions,
        AtomicReference<IndexRebuildPhase> phase
    ) {}

    Plan plan(String collection, IndexDescriptor original) {
        var originalOptions = original.options(IndexOptionFilter.ALL_KNOWN_OPTIONS);
        var coverKey = original.key().deepCopy();
        coverKey.put(config.getCoverField(), 1);
        var coverOptions = JsonNodeFactory.instance.objectNode();
        if (originalOptions.has("partialFilterExpression")) {
            coverOptions.set("partialFilterExpression", originalOptions.get("partialFilterExpression").deepCopy());
        }
        return new Plan(
            collection,
            original,
            optionFilter.filter(originalOptions),
            original.name() + config.getCoverSuffix(),
            coverKey,
            coverOptions,
            new AtomicReference<>(IndexRebuildPhase.PLANNING)
        );
    }

    /**
     * @param sizeBytes size of the original index, recorded as the initial size
     * @return the outcome; errors only on abort or checkpoint failure
     */
    public Mono<IndexLog> rebuild(String collection, IndexDescriptor index, long sizeBytes) {
        return Mono.defer(() -> {
            var start = clock.instant();
            var retries = new AtomicInteger();
            var plan = plan(collection, index);
            log.info("Rebuilding index '{}' on '{}' (~{} MB)", index.name(), collection,
                String.format("%.3f", CollectionStats.toMb(sizeBytes)));

            return config.getRetryPolicy().execute(
                    () -> attempt(plan),
                    e -> !isFatal(e),
                    signal -> {
                        retries.incrementAndGet();
                        log.warn("Attempt {} for '{}.{}' failed during {}, retrying: {}",
                            signal.totalRetries() + 1, collection, index.name(), plan.phase().get(),
                            signal.failure().getMessage());
                        return cleanupBeforeRetry(plan);
                    })
                .then(Mono.fromRunnable(() -> stateStore.markCompleted(collection, index.name())))
                .then(Mono.fromCallable(() -> {
                    var result = indexLog(start, sizeBytes, retries.get());
                    result.setStatus(IndexLog.Status.REBUILT);
                    return result;
                }))
                .doOnNext(result -> log.info("Rebuild of '{}.{}' complete in {}s", collection, index.name(),
                    String.format("%.1f", result.getTimeSeconds())))
                .onErrorResume(e -> !isFatal(e), e -> {
                    var failedIn = plan.phase().getAndSet(IndexRebuildPhase.FAILED);
                    log.error("Rebuild of '{}.{}' failed during {} after {} retries", collection, index.name(),
                        failedIn, retries.get(), e);
                    var result = indexLog(start, sizeBytes, retries.get());
                    result.setStatus(IndexLog.Status.FAILED);
                    result.setError(failedIn + ": " + e.getMessage());
                    return Mono.just(result);
                });
        });
    }

    private Mono<Void> attempt(Plan plan) {
        return currentIndexes(plan.collection()).flatMap(existing -> {
            boolean originalPresent = existing.containsKey(plan.original().name());
            return prepareCover(plan, existing.get(plan.coverName()), originalPresent)
                .then(swap(plan, originalPresent));
        });
    }

    private Mono<Void> prepareCover(Plan plan, IndexDescriptor leftover, boolean originalPresent) {
        enter(plan, IndexRebuildPhase.COVERING);
        Mono<Void> create = originalPresent
            ? createAndVerifyCover(plan)
            : Mono.fromRunnable(() -> log.warn("Original '{}.{}' is already gone, building it from the recorded definition",
                plan.collection(), plan.original().name()));

        if (leftover == null) {
            return create.doOnSuccess(unused -> enter(plan, IndexRebuildPhase.COVERED));
        }
        return readiness.isReady(plan.collection(), plan.coverName()).flatMap(ready -> {
            var mismatch = IndexVerifier.mismatch(leftover, plan.coverKey(), plan.coverOptions(),
                IndexOptionFilter.ALL_KNOWN_OPTIONS);
            if (ready && mismatch.isEmpty()) {
                log.info("Reusing existing covering index '{}' on '{}'", plan.coverName(), plan.collection());
                return Mono.<Void>empty();
            }
            log.warn("Leftover covering index '{}' on '{}' is unusable ({}), dropping it", plan.coverName(),
                plan.collection(), ready ? mismatch.get() : "still building");
            if (!originalPresent) {
                log.warn("'{}' has no index on {} until '{}' is rebuilt", plan.collection(), plan.original().key(),
                    plan.original().name());
            }
            return dropIfPresent(plan.collection(), plan.coverName()).then(create);
        }).doOnSuccess(unused -> enter(plan, IndexRebuildPhase.COVERED));
    }

    private Mono<Void> createAndVerifyCover(Plan plan) {
        return client.createIndex(plan.collection(), plan.coverKey(), withName(plan.coverOptions(), plan.coverName()))
            .then(verifier.verify(plan.collection(), plan.coverName(), plan.coverKey(), plan.coverOptions()))
            .then();
    }

    private Mono<Void> swap(Plan plan, boolean originalPresent) {
        var original = plan.original();
        return Mono.fromRunnable(() -> {
                enter(plan, IndexRebuildPhase.SWAPPING);
                stateStore.markInFlight(plan.collection(), original);
            })
            .then(originalPresent ? client.dropIndex(plan.collection(), original.name()) : Mono.empty())
            .then(client.createIndex(plan.collection(), original.key(), withName(plan.finalOptions(), original.name())))
            .then(Mono.fromRunnable(() -> enter(plan, IndexRebuildPhase.SWAPPED)))
            .then(Mono.defer(() -> {
                enter(plan, IndexRebuildPhase.VERIFYING);
                return verifier.verify(plan.collection(), original.name(), original.key(), plan.finalOptions());
            }))
            .then(dropIfPresent(plan.collection(), plan.coverName()))
            .then(Mono.fromRunnable(() -> enter(plan, IndexRebuildPhase.DONE)));
    }

    /**
     * A leftover covering index is dropped before the next attempt, unless the original is
     * already gone: then the covering index is the only thing serving queries and is reused.
     */
    private Mono<Void> cleanupBeforeRetry(Plan plan) {
        return currentIndexes(plan.collection()).flatMap(existing -> {
            if (!existing.containsKey(plan.coverName())) {
                return Mono.<Void>empty();
            }
            if (!existing.containsKey(plan.original().name())) {
                log.info("Keeping covering index '{}' on '{}' while the original is missing",
                    plan.coverName(), plan.collection());
                return Mono.<Void>empty();
            }
            return dropIfPresent(plan.collection(), plan.coverName());
        });
    }

    private Mono<Map<String, IndexDescriptor>> currentIndexes(String collection) {
        return client.listIndexes(collection)
            .map(IndexDescriptor::fromListIndexes)
            .collect(Collectors.toMap(IndexDescriptor::name, Function.identity(), (a, b) -> a));
    }

    private Mono<Void> dropIfPresent(String collection, String indexName) {
        return client.dropIndex(collection, indexName)
            .onErrorResume(
                e -> e instanceof DatabaseCommandException
                    && ((DatabaseCommandException) e).getCode() == DatabaseCommandException.INDEX_NOT_FOUND,
                e -> Mono.empty());
    }

    private void enter(Plan plan, IndexRebuildPhase phase) {
        plan.phase().set(phase);
        log.debug("{}.{} -> {}", plan.collection(), plan.original().name(), phase);
    }

    private IndexLog indexLog(Instant start, long sizeBytes, int retryCount) {
        return IndexLog.builder()
            .startTime(start)
            .timeSeconds(Duration.between(start, clock.instant()).toMillis() / 1000.0)
            .initialSizeMb(CollectionStats.toMb(sizeBytes))
            .retryCount(retryCount)
            .build();
    }

    private static ObjectNode withName(ObjectNode options, String name) {
        var result = JsonNodeFactory.instance.objectNode().put("name", name);
        result.setAll(options.deepCopy());
        return result;
    }

    static boolean isFatal(Throwable e) {
        return e instanceof MaintenanceAbortedException || e instanceof StateStoreException;
    }
}
