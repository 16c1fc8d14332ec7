package org.mongomaint.client;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.mongomaint.model.IndexDescriptor;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A DatabaseClient backed by plain maps, for exercising the engines without a server.
 *
 * Collections, indexes and sizes are set up through the builder-style methods; the replica set is
 * a list of members with zones and states. Commands are recorded in {@link #getExecuted()} and
 * can be made to fail with {@link #failNext}. Every method is lazy, like a real driver call.
 */
public class InMemoryDatabaseClient implements DatabaseClient {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static final long DEFAULT_REBUILT_INDEX_SIZE = 1024L * 1024L;

    /** A command as received, with where it was routed. */
    public record Executed(String name, ObjectNode command, String target, boolean admin) {}

    public record Member(int id, String host, String zone, int state) {}

    private static class CollectionData {
        final Map<String, ObjectNode> indexes = new LinkedHashMap<>();
        final Map<String, Long> indexSizes = new LinkedHashMap<>();
        long size;
        long storageSize;
        final Deque<Long> secondaryStorageSizes = new ArrayDeque<>();
        long lastSecondaryStorageSize;
        Long dryRunBytesFreed;
    }

    private record Fault(Predicate<Executed> matches, Supplier<RuntimeException> error, int[] remaining) {}

    private final String databaseName;
    private final String connectionString;
    private final Map<String, CollectionData> collections = new LinkedHashMap<>();
    private final Map<String, Long> sizesAfterRebuild = new HashMap<>();
    private final Map<String, Integer> buildingPolls = new HashMap<>();
    private final List<Member> members = new ArrayList<>();
    private final List<Fault> faults = new ArrayList<>();
    private final List<Executed> executed = Collections.synchronizedList(new ArrayList<>());
    private final Set<String> autoCompactEnabledOn = new HashSet<>();
    private final Map<String, Integer> autoCompactRunningPolls = new HashMap<>();

    private String serverVersion = "7.0.2";
    private String replicaSetName = "rs0";
    private boolean indexStatsUnauthorized;
    private boolean stepDownDropsConnection = true;

    public InMemoryDatabaseClient(String databaseName) {
        this(databaseName, "mongodb://localhost:27017");
    }

    public InMemoryDatabaseClient(String databaseName, String connectionString) {
        this.databaseName = databaseName;
        this.connectionString = connectionString;
    }

    // ---- setup ----

    public synchronized InMemoryDatabaseClient withServerVersion(String version) {
        this.serverVersion = version;
        return this;
    }

    public synchronized InMemoryDatabaseClient withReplicaSetName(String name) {
        this.replicaSetName = name;
        return this;
    }

    public synchronized InMemoryDatabaseClient withCollection(String name, long size, long storageSize) {
        var data = collection(name);
        data.size = size;
        data.storageSize = storageSize;
        return this;
    }

    /** Adds {@code _id_} if the collection has no indexes yet. */
    public synchronized InMemoryDatabaseClient withIndex(String collection, String name, ObjectNode key, ObjectNode options, long sizeBytes) {
        var data = collection(collection);
        if (data.indexes.isEmpty() && !IndexDescriptor.ID_INDEX_NAME.equals(name)) {
            data.indexes.put(IndexDescriptor.ID_INDEX_NAME, indexDocument(IndexDescriptor.ID_INDEX_NAME, NODES.objectNode().put("_id", 1), NODES.objectNode()));
            data.indexSizes.put(IndexDescriptor.ID_INDEX_NAME, 4096L);
        }
        data.indexes.put(name, indexDocument(name, key, options));
        data.indexSizes.put(name, sizeBytes);
        return this;
    }

    public InMemoryDatabaseClient withIndex(String collection, String name, ObjectNode key, long sizeBytes) {
        return withIndex(collection, name, key, NODES.objectNode(), sizeBytes);
    }

    /** Size the index reports once it has been created again. */
    public synchronized InMemoryDatabaseClient withSizeAfterRebuild(String collection, String name, long sizeBytes) {
        sizesAfterRebuild.put(collection + "." + name, sizeBytes);
        return this;
    }

    /** {@code $indexStats} reports the index as building for the next {@code polls} queries. */
    public synchronized InMemoryDatabaseClient withBuildingPolls(String collection, String name, int polls) {
        buildingPolls.put(collection + "." + name, polls);
        return this;
    }

    public synchronized InMemoryDatabaseClient withIndexStatsUnauthorized() {
        this.indexStatsUnauthorized = true;
        return this;
    }

    /** Storage sizes reported by secondaries, consumed one per {@code collStats}; the last one repeats. */
    public synchronized InMemoryDatabaseClient withSecondaryStorageSizes(String collection, Long... sizes) {
        var data = collection(collection);
        data.secondaryStorageSizes.addAll(List.of(sizes));
        return this;
    }

    public synchronized InMemoryDatabaseClient withDryRunBytesFreed(String collection, long bytes) {
        collection(collection).dryRunBytesFreed = bytes;
        return this;
    }

    public synchronized InMemoryDatabaseClient withMember(int id, String host, String zone, int state) {
        members.add(new Member(id, host, zone, state));
        return this;
    }

    /** Primary {@code p1} in zone-a and secondaries {@code s1}, {@code s2} in zones b and c. */
    public InMemoryDatabaseClient withThreeMemberReplicaSet() {
        return withMember(0, "p1:27017", "zone-a", 1)
            .withMember(1, "s1:27017", "zone-b", 2)
            .withMember(2, "s2:27017", "zone-c", 2);
    }

    /** {@code currentOp} on {@code target} lists an autoCompact job for the next {@code polls} queries. */
    public synchronized InMemoryDatabaseClient withAutoCompactRunningPolls(String target, int polls) {
        autoCompactRunningPolls.put(target, polls);
        return this;
    }

    public synchronized InMemoryDatabaseClient withStepDownDropsConnection(boolean drops) {
        this.stepDownDropsConnection = drops;
        return this;
    }

    /** The next {@code times} commands matching {@code matches} fail with {@code error}. */
    public synchronized InMemoryDatabaseClient failNext(Predicate<Executed> matches, int times, Supplier<RuntimeException> error) {
        faults.add(new Fault(matches, error, new int[] {times}));
        return this;
    }

    public InMemoryDatabaseClient failNext(String commandName, int times) {
        return failNext(e -> e.name().equals(commandName), times,
            () -> new DatabaseCommandException(commandName, 1, "injected failure"));
    }

    // ---- inspection ----

    public List<Executed> getExecuted() {
        synchronized (executed) {
            return List.copyOf(executed);
        }
    }

    public long count(String commandName) {
        return getExecuted().stream().filter(e -> e.name().equals(commandName)).count();
    }

    public synchronized List<String> indexNames(String collection) {
        var data = collections.get(collection);
        return data == null ? List.of() : List.copyOf(data.indexes.keySet());
    }

    public synchronized ObjectNode indexDocument(String collection, String name) {
        var data = collections.get(collection);
        return data == null || !data.indexes.containsKey(name) ? null : data.indexes.get(name).deepCopy();
    }

    public synchronized Set<String> autoCompactEnabledOn() {
        return Set.copyOf(autoCompactEnabledOn);
    }

    public synchronized List<Member> members() {
        return List.copyOf(members);
    }

    // ---- DatabaseClient ----

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
        return Flux.defer(() -> {
            synchronized (this) {
                return Flux.fromIterable(new ArrayList<>(collections.keySet()));
            }
        });
    }

    @Override
    public Flux<ObjectNode> listIndexes(String collection) {
        return Flux.defer(() -> {
            synchronized (this) {
                var data = collections.get(collection);
                if (data == null) {
                    return Flux.<ObjectNode>empty();
                }
                var copies = new ArrayList<ObjectNode>();
                data.indexes.values().forEach(doc -> copies.add(doc.deepCopy()));
                return Flux.fromIterable(copies);
            }
        });
    }

    @Override
    public Mono<ObjectNode> runCommand(ObjectNode command, NodeTarget target) {
        return Mono.fromCallable(() -> execute(command, target, false));
    }

    @Override
    public Mono<ObjectNode> runAdminCommand(ObjectNode command, NodeTarget target) {
        return Mono.fromCallable(() -> execute(command, target, true));
    }

    private synchronized ObjectNode execute(ObjectNode command, NodeTarget target, boolean admin) {
        var call = new Executed(Commands.commandName(command), command.deepCopy(), target.label(), admin);
        executed.add(call);
        for (var fault : faults) {
            if (fault.remaining()[0] > 0 && fault.matches().test(call)) {
                fault.remaining()[0]--;
                throw fault.error().get();
            }
        }
        switch (call.name()) {
            case "createIndexes":
                return createIndexes(command);
            case "dropIndexes":
                return dropIndexes(command);
            case "aggregate":
                return indexStats(command);
            case "collStats":
                return collStats(command.path("collStats").asText(), target);
            case "compact":
                return compact(command);
            case "buildInfo":
                return ok().put("version", serverVersion);
            case "hello":
                return ok().put("setName", replicaSetName).put("isWritablePrimary", true);
            case "replSetGetConfig":
                return replSetGetConfig();
            case "replSetGetStatus":
                return replSetGetStatus();
            case "replSetStepDown":
                return stepDown();
            case "autoCompact":
                return autoCompact(command, target);
            case "currentOp":
                return currentOp(target);
            default:
                throw new DatabaseCommandException(call.name(), 59, "no such command: '" + call.name() + "'");
        }
    }

    private ObjectNode createIndexes(ObjectNode command) {
        var collectionName = command.path("createIndexes").asText();
        var data = collection(collectionName);
        var spec = (ObjectNode) command.path("indexes").get(0);
        var name = spec.path("name").asText();
        if (data.indexes.containsKey(name)) {
            return ok().put("note", "index already exists");
        }
        var options = spec.deepCopy();
        options.remove("key");
        options.remove("name");
        data.indexes.put(name, indexDocument(name, (ObjectNode) spec.get("key"), options));
        data.indexSizes.put(name, sizesAfterRebuild.getOrDefault(collectionName + "." + name, DEFAULT_REBUILT_INDEX_SIZE));
        return ok().put("numIndexesAfter", data.indexes.size());
    }

    private ObjectNode dropIndexes(ObjectNode command) {
        var data = collections.get(command.path("dropIndexes").asText());
        var name = command.path("index").asText();
        if (data == null || data.indexes.remove(name) == null) {
            throw new DatabaseCommandException("dropIndexes", DatabaseCommandException.INDEX_NOT_FOUND,
                "index not found with name [" + name + "]");
        }
        data.indexSizes.remove(name);
        return ok();
    }

    private ObjectNode indexStats(ObjectNode command) {
        if (indexStatsUnauthorized) {
            throw new DatabaseCommandException("aggregate", DatabaseCommandException.UNAUTHORIZED, "not authorized");
        }
        var collectionName = command.path("aggregate").asText();
        var data = collection(collectionName);
        var reply = ok();
        var batch = reply.putObject("cursor").putArray("firstBatch");
        for (var name : data.indexes.keySet()) {
            var stat = batch.addObject().put("name", name);
            var key = collectionName + "." + name;
            var polls = buildingPolls.getOrDefault(key, 0);
            if (polls > 0) {
                buildingPolls.put(key, polls - 1);
                stat.put("building", true);
            }
        }
        return reply;
    }

    private ObjectNode collStats(String collectionName, NodeTarget target) {
        var data = collection(collectionName);
        long storageSize = data.storageSize;
        if (!target.isPrimary()) {
            if (!data.secondaryStorageSizes.isEmpty()) {
                data.lastSecondaryStorageSize = data.secondaryStorageSizes.poll();
            }
            storageSize = data.lastSecondaryStorageSize != 0 ? data.lastSecondaryStorageSize : data.storageSize;
        }
        var reply = ok().put("ns", databaseName + "." + collectionName).put("size", data.size).put("storageSize", storageSize);
        var sizes = reply.putObject("indexSizes");
        data.indexSizes.forEach(sizes::put);
        long total = data.indexSizes.values().stream().mapToLong(Long::longValue).sum();
        return reply.put("totalIndexSize", total);
    }

    private ObjectNode compact(ObjectNode command) {
        var data = collection(command.path("compact").asText());
        if (command.path("dryRun").asBoolean(false)) {
            var reply = ok();
            if (data.dryRunBytesFreed != null) {
                reply.put("bytesFreed", data.dryRunBytesFreed);
            }
            return reply;
        }
        return ok();
    }

    private ObjectNode replSetGetConfig() {
        var reply = ok();
        ArrayNode configMembers = reply.putObject("config").putArray("members");
        for (var member : members) {
            var doc = configMembers.addObject().put("_id", member.id()).put("host", member.host());
            if (member.zone() != null) {
                doc.putObject("tags").put("availabilityZone", member.zone());
            }
        }
        return reply;
    }

    private ObjectNode replSetGetStatus() {
        var reply = ok().put("set", replicaSetName);
        var statusMembers = reply.putArray("members");
        for (var member : members) {
            statusMembers.addObject().put("_id", member.id()).put("name", member.host()).put("state", member.state());
        }
        return reply;
    }

    /** The primary becomes a secondary and the first secondary is elected. */
    private ObjectNode stepDown() {
        int primary = -1;
        int successor = -1;
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i).state() == 1 && primary < 0) {
                primary = i;
            } else if (members.get(i).state() == 2 && successor < 0) {
                successor = i;
            }
        }
        if (primary < 0 || successor < 0) {
            throw new DatabaseCommandException("replSetStepDown", 262, "no electable secondaries caught up");
        }
        var former = members.get(primary);
        var next = members.get(successor);
        members.set(primary, new Member(former.id(), former.host(), former.zone(), 2));
        members.set(successor, new Member(next.id(), next.host(), next.zone(), 1));
        if (stepDownDropsConnection) {
            throw new DatabaseCommandException("replSetStepDown", 91, "connection closed during step down");
        }
        return ok();
    }

    private ObjectNode autoCompact(ObjectNode command, NodeTarget target) {
        if (command.path("autoCompact").asBoolean(false)) {
            autoCompactEnabledOn.add(target.label());
        } else {
            autoCompactEnabledOn.remove(target.label());
        }
        return ok();
    }

    private ObjectNode currentOp(NodeTarget target) {
        var reply = ok();
        var inprog = reply.putArray("inprog");
        var polls = autoCompactRunningPolls.getOrDefault(target.label(), 0);
        if (polls > 0) {
            autoCompactRunningPolls.put(target.label(), polls - 1);
            inprog.addObject().put("desc", "autoCompact").put("active", true);
        }
        return reply;
    }

    private CollectionData collection(String name) {
        return collections.computeIfAbsent(name, n -> new CollectionData());
    }

    private static ObjectNode indexDocument(String name, ObjectNode key, JsonNode options) {
        var doc = NODES.objectNode().put("v", 2);
        doc.set("key", key.deepCopy());
        doc.put("name", name);
        options.fields().forEachRemaining(field -> doc.set(field.getKey(), field.getValue().deepCopy()));
        return doc;
    }

    private static ObjectNode ok() {
        return NODES.objectNode().put("ok", 1);
    }

}
