package org.mongomaint.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builders for the database commands the engines issue, plus reply helpers.
 */
public final class Commands {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Commands() {}

    public static ObjectNode object() {
        return NODES.objectNode();
    }

    public static ObjectNode buildInfo() {
        return object().put("buildInfo", 1);
    }

    public static ObjectNode hello() {
        return object().put("hello", 1);
    }

    public static ObjectNode collStats(String collection) {
        return object().put("collStats", collection);
    }

    /** {@code createIndexes} with a single index; {@code options} must not contain key or name. */
    public static ObjectNode createIndexes(String collection, ObjectNode key, ObjectNode options) {
        var spec = object();
        spec.set("key", key.deepCopy());
        spec.setAll(options.deepCopy());
        var command = object().put("createIndexes", collection);
        command.putArray("indexes").add(spec);
        return command;
    }

    public static ObjectNode dropIndexes(String collection, String indexName) {
        return object().put("dropIndexes", collection).put("index", indexName);
    }

    /** Aggregation over {@code $indexStats}; the reply carries a {@code building} flag per index. */
    public static ObjectNode indexStats(String collection) {
        var command = object().put("aggregate", collection);
        command.putArray("pipeline").addObject().putObject("$indexStats");
        command.putObject("cursor");
        return command;
    }

    public static ObjectNode compact(String collection) {
        return object().put("compact", collection);
    }

    public static ObjectNode compactDryRun(String collection) {
        return compact(collection).put("dryRun", true);
    }

    public static ObjectNode replSetGetConfig() {
        return object().put("replSetGetConfig", 1);
    }

    public static ObjectNode replSetGetStatus() {
        return object().put("replSetGetStatus", 1);
    }

    public static ObjectNode replSetStepDown(int timeoutSeconds) {
        return object().put("replSetStepDown", timeoutSeconds);
    }

    public static ObjectNode enableAutoCompact(int freeSpaceTargetMb) {
        return object().put("autoCompact", true).put("freeSpaceTargetMB", freeSpaceTargetMb).put("runOnce", true);
    }

    public static ObjectNode disableAutoCompact() {
        return object().put("autoCompact", false);
    }

    public static ObjectNode currentOp() {
        return object().put("currentOp", 1).put("active", true);
    }

    /** The command name is the first field of a command document. */
    public static String commandName(ObjectNode command) {
        var names = command.fieldNames();
        return names.hasNext() ? names.next() : "";
    }

    public static boolean isOk(JsonNode reply) {
        var ok = reply.path("ok");
        return ok.isNumber() ? ok.asDouble() == 1.0 : ok.asBoolean(false);
    }
}
