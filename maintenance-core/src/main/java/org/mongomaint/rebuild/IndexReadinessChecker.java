package org.mongomaint.rebuild;

import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import org.mongomaint.client.Commands;
import org.mongomaint.client.DatabaseClient;
import org.mongomaint.client.DatabaseCommandException;
import org.mongomaint.model.IndexDescriptor;
import org.mongomaint.retry.PollingPolicy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Decides whether an index has finished building. Two independent signals are combined: the
 * build markers on the {@code listIndexes} descriptor, and the {@code building} flag reported by
 * {@code $indexStats}. The statistics query is best effort; restricted tiers deny it, in which
 * case the descriptor alone decides.
 */
@Slf4j
@RequiredArgsConstructor
public class IndexReadinessChecker {
    private final DatabaseClient client;

    public Mono<Optional<IndexDescriptor>> find(String collection, String indexName) {
        return client.listIndexes(collection)
            .map(IndexDescriptor::fromListIndexes)
            .filter(descriptor -> descriptor.name().equals(indexName))
            .next()
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
    }

    /** {@code false} when the index is missing or either signal reports a build in progress. */
    public Mono<Boolean> isReady(String collection, String indexName) {
        return find(collection, indexName).flatMap(found -> {
            if (found.isEmpty()) {
                log.debug("Index {}.{} not found", collection, indexName);
                return Mono.just(false);
            }
            if (found.get().isBuilding()) {
                log.debug("Index {}.{} descriptor reports a build in progress", collection, indexName);
                return Mono.just(false);
            }
            return buildingFlag(collection, indexName).map(building -> !building).defaultIfEmpty(true);
        });
    }

    /** Poll {@link #isReady} under {@code polling}; {@code false} if the timeout elapses first. */
    public Mono<Boolean> awaitReady(String collection, String indexName, PollingPolicy polling) {
        return polling.await(() -> isReady(collection, indexName));
    }

    /** Empty when the statistics are unavailable or do not mention the index. */
    Mono<Boolean> buildingFlag(String collection, String indexName) {
        return client.runCommand(Commands.indexStats(collection))
            .flatMap(reply -> {
                for (JsonNode stat : reply.path("cursor").path("firstBatch")) {
                    if (indexName.equals(stat.path("name").asText())) {
                        return Mono.just(stat.path("building").asBoolean(false));
                    }
                }
                return Mono.<Boolean>empty();
            })
            .onErrorResume(e -> {
                if (e instanceof DatabaseCommandException && ((DatabaseCommandException) e).isUnauthorized()) {
                    log.debug("$indexStats not permitted on {}, relying on the index descriptor", collection);
                } else {
                    log.debug("$indexStats unavailable on {}, relying on the index descriptor", collection, e);
                }
                return Mono.empty();
            });
    }
}
