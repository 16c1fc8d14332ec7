package org.mongomaint.client;

import com.fasterxml.jackson.databind.node.ObjectNode;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Port for talking to one database of an already connected deployment (replica set, sharded
 * cluster or an in-memory test double).
 *
 * Engines only ever see JSON documents here: commands go out as {@link ObjectNode}s and replies
 * come back the same way, so nothing above this interface depends on a driver.
 */
public interface DatabaseClient extends AutoCloseable {

    /** Name of the database every non-admin command runs against. */
    String databaseName();

    /** Connection string the client was opened with, used to derive a cluster name. */
    String connectionString();

    Flux<String> listCollectionNames();

    /** Raw {@code listIndexes} documents, in server order. */
    Flux<ObjectNode> listIndexes(String collection);

    /**
     * Run a command against the database, routed to the given member.
     * Fails with {@link DatabaseCommandException} when the server rejects it.
     */
    Mono<ObjectNode> runCommand(ObjectNode command, NodeTarget target);

    /** Run a command against the {@code admin} database, routed to the given member. */
    Mono<ObjectNode> runAdminCommand(ObjectNode command, NodeTarget target);

    default Mono<ObjectNode> runCommand(ObjectNode command) {
        return runCommand(command, NodeTarget.primary());
    }

    default Mono<ObjectNode> runAdminCommand(ObjectNode command) {
        return runAdminCommand(command, NodeTarget.primary());
    }

    default Mono<Void> createIndex(String collection, ObjectNode key, ObjectNode options) {
        return runCommand(Commands.createIndexes(collection, key, options)).then();
    }

    default Mono<Void> dropIndex(String collection, String indexName) {
        return runCommand(Commands.dropIndexes(collection, indexName)).then();
    }

    default Mono<ObjectNode> collectionStats(String collection, NodeTarget target) {
        return runCommand(Commands.collStats(collection), target);
    }

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
