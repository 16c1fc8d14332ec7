package org.mongomaint.model;

import java.util.Collection;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One index definition as reported by {@code listIndexes}.
 *
 * @param name       unique per collection
 * @param key        ordered key specification
 * @param attributes everything else the server reported (options plus build markers), minus
 *                   {@code v}, {@code ns}, {@code key} and {@code name}
 */
public record IndexDescriptor(
    @JsonProperty("name") String name,
    @JsonProperty("key") ObjectNode key,
    @JsonProperty("attributes") ObjectNode attributes
) {
    public static final String ID_INDEX_NAME = "_id_";

    private static final Set<String> NON_OPTION_FIELDS = Set.of("v", "ns", "key", "name");

    public static IndexDescriptor fromListIndexes(ObjectNode document) {
        var attributes = JsonNodeFactory.instance.objectNode();
        document.fields().forEachRemaining(field -> {
            if (!NON_OPTION_FIELDS.contains(field.getKey())) {
                attributes.set(field.getKey(), field.getValue().deepCopy());
            }
        });
        var key = document.path("key");
        return new IndexDescriptor(
            document.path("name").asText(),
            key.isObject() ? ((ObjectNode) key).deepCopy() : JsonNodeFactory.instance.objectNode(),
            attributes
        );
    }

    /** The subset of {@link #attributes()} whose names are in {@code allowed}, in server order. */
    public ObjectNode options(Collection<String> allowed) {
        var options = JsonNodeFactory.instance.objectNode();
        attributes.fields().forEachRemaining(field -> {
            if (allowed.contains(field.getKey())) {
                options.set(field.getKey(), field.getValue().deepCopy());
            }
        });
        return options;
    }

    /**
     * A build is still running when the descriptor carries a {@code buildUUID}, or a
     * {@code buildState} other than {@code ready}.
     */
    @JsonIgnore
    public boolean isBuilding() {
        if (attributes.hasNonNull("buildUUID")) {
            return true;
        }
        var buildState = attributes.path("buildState");
        return !buildState.isMissingNode() && !buildState.isNull() && !"ready".equals(buildState.asText());
    }

    @JsonIgnore
    public boolean isUnique() {
        return attributes.path("unique").asBoolean(false);
    }

    @JsonIgnore
    public boolean isIdIndex() {
        return ID_INDEX_NAME.equals(name);
    }
}
