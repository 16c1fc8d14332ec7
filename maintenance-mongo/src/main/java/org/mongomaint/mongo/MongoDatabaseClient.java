package org.mongomaint.mongo;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.mongomaint.client.Commands;
import org.mongomaint.client.DatabaseClient;
import org.mongomaint.client.DatabaseCommandException;
import org.mongomaint.client.NodeTarget;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.ReadPreference;
import com.mongodb.Tag;
import com.mongodb.TagSet;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link DatabaseClient} over the MongoDB Reactive Streams driver.
 *
 * Commands travel as relaxed extended JSON between Jackson trees and BSON documents. Secondary
 * targets become {@code secondary} read preferences restricted to the target's tag set; a target
 * without tags goes to any secondary.
 */
@Slf4j
public class MongoDatabaseClient implements DatabaseClient {
    static final String APPLICATION_NAME = "mongo-maintenance";
    private static final String ADMIN_DATABASE = "admin";
    private static final JsonWriterSettings RELAXED = JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

    private final MongoClient mongoClient;
    private final String connectionString;
    private final String databaseName;
    private final ObjectMapper objectMapper;

    public MongoDatabaseClient(String connectionString, String databaseName) {
        this(
            MongoClients.create(MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(connectionString))
                .applicationName(APPLICATION_NAME)
                .build()),
            connectionString,
            databaseName
        );
    }

    MongoDatabaseClient(MongoClient mongoClient, String connectionString, String databaseName) {
        this.mongoClient = mongoClient;
        this.connectionString = connectionString;
        this.databaseName = databaseName;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String databaseName() {
        return databaseName;
    }

    @Override
    public String connectionString() {
        return connectionString;
    }

    @Override
    public Flux<String> listCollectionNames() {
        return Flux.defer(() -> Flux.from(mongoClient.getDatabase(databaseName).listCollectionNames()))
            .onErrorMap(e -> translate("listCollections", e));
    }

    @Override
    public Flux<ObjectNode> listIndexes(String collection) {
        return Flux.defer(() -> Flux.from(mongoClient.getDatabase(databaseName).getCollection(collection).listIndexes()))
            .map(this::toObjectNode)
            .onErrorMap(e -> translate("listIndexes", e));
    }

    @Override
    public Mono<ObjectNode> runCommand(ObjectNode command, NodeTarget target) {
        return run(databaseName, command, target);
    }

    @Override
    public Mono<ObjectNode> runAdminCommand(ObjectNode command, NodeTarget target) {
        return run(ADMIN_DATABASE, command, target);
    }

    private Mono<ObjectNode> run(String database, ObjectNode command, NodeTarget target) {
        var name = Commands.commandName(command);
        return Mono.defer(() -> {
                log.atDebug().setMessage("Running {} on {}.{}: {}")
                    .addArgument(name)
                    .addArgument(database)
                    .addArgument(target)
                    .addArgument(command::toString)
                    .log();
                return Mono.from(mongoClient.getDatabase(database).runCommand(toDocument(command), readPreference(target)));
            })
            .map(this::toObjectNode)
            .onErrorMap(e -> translate(name, e));
    }

    static ReadPreference readPreference(NodeTarget target) {
        if (target.isPrimary()) {
            return ReadPreference.primary();
        }
        if (target.tags().isEmpty()) {
            return ReadPreference.secondary();
        }
        return ReadPreference.secondary(new TagSet(target.tags().entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .map(tag -> new Tag(tag.getKey(), tag.getValue()))
            .toList()));
    }

    Document toDocument(ObjectNode node) {
        try {
            return Document.parse(objectMapper.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Command is not serializable: " + node, e);
        }
    }

    ObjectNode toObjectNode(Document document) {
        try {
            return (ObjectNode) objectMapper.readTree(document.toJson(RELAXED));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Server reply is not valid JSON", e);
        }
    }

    /** Server rejections carry their error code into {@link DatabaseCommandException}. */
    static Throwable translate(String commandName, Throwable e) {
        if (e instanceof DatabaseCommandException) {
            return e;
        }
        if (e instanceof MongoCommandException) {
            var commandException = (MongoCommandException) e;
            return new DatabaseCommandException(commandName, commandException.getErrorCode(),
                commandException.getErrorMessage(), e);
        }
        if (e instanceof MongoException) {
            return new DatabaseCommandException(commandName, ((MongoException) e).getCode(), e.getMessage(), e);
        }
        return e;
    }

    @Override
    public void close() {
        mongoClient.close();
    }
}
