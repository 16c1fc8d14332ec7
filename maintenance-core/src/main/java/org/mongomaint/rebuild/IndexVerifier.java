package org.mongomaint.rebuild;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.mongomaint.IndexVerificationException;
import org.mongomaint.model.IndexDescriptor;
import org.mongomaint.retry.PollingPolicy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Confirms that an index exists, has finished building and carries exactly the expected key and
 * options. An index that is not listed at all fails at once; only a listed index is polled. A failure here is never accepted silently: it means the collection may be missing the
 * index it is supposed to have.
 */
@Slf4j
@RequiredArgsConstructor
public class IndexVerifier {
    /** Integers and longs (and whole doubles) reported for the same value compare equal. */
    static final Comparator<JsonNode> NUMERIC_TOLERANT = (a, b) -> {
        if (a.equals(b)) {
            return 0;
        }
        if (a.isNumber() && b.isNumber()) {
            return Double.compare(a.asDouble(), b.asDouble()) == 0 ? 0 : 1;
        }
        return 1;
    };

    private final IndexReadinessChecker readiness;
    private final PollingPolicy polling;
    /** Option keys that take part in the comparison; everything else on the descriptor is ignored. */
    private final Set<String> comparedOptions;

    /**
     * @return the verified descriptor, or an {@link IndexVerificationException} error
     */
    public Mono<IndexDescriptor> verify(
        String collection,
        String indexName,
        ObjectNode expectedKey,
        ObjectNode expectedOptions
    ) {
        return readiness.find(collection, indexName).flatMap(listed -> listed.isEmpty()
            ? Mono.error(notFound(collection, indexName))
            : readiness.awaitReady(collection, indexName, polling)
                .flatMap(ready -> readiness.find(collection, indexName).flatMap(found -> {
                    if (found.isEmpty()) {
                        return Mono.error(notFound(collection, indexName));
                    }
                    if (!ready) {
                        return Mono.error(new IndexVerificationException(collection, indexName,
                            "build still in progress after " + polling.getTimeout()));
                    }
                    var mismatch = mismatch(found.get(), expectedKey, expectedOptions, comparedOptions);
                    if (mismatch.isPresent()) {
                        return Mono.error(new IndexVerificationException(collection, indexName, mismatch.get()));
                    }
                    log.info("Verified index '{}' on '{}'", indexName, collection);
                    return Mono.just(found.get());
                })));
    }

    private static IndexVerificationException notFound(String collection, String indexName) {
        return new IndexVerificationException(collection, indexName, "index not found");
    }

    /** A description of the first difference found, or empty when the descriptor matches. */
    public static Optional<String> mismatch(
        IndexDescriptor actual,
        ObjectNode expectedKey,
        ObjectNode expectedOptions,
        Set<String> comparedOptions
    ) {
        if (!keysEqual(actual.key(), expectedKey)) {
            return Optional.of("key mismatch, expected " + expectedKey + " but found " + actual.key());
        }
        var actualOptions = actual.options(comparedOptions);
        var wantedOptions = restrict(expectedOptions, comparedOptions);
        if (!actualOptions.equals(NUMERIC_TOLERANT, wantedOptions)) {
            return Optional.of("options mismatch, expected " + wantedOptions + " but found " + actualOptions);
        }
        return Optional.empty();
    }

    /** Field order is significant in an index key; numeric types are not. */
    static boolean keysEqual(ObjectNode actual, ObjectNode expected) {
        if (actual.size() != expected.size()) {
            return false;
        }
        Iterator<Map.Entry<String, JsonNode>> left = actual.fields();
        Iterator<Map.Entry<String, JsonNode>> right = expected.fields();
        while (left.hasNext()) {
            var a = left.next();
            var b = right.next();
            if (!a.getKey().equals(b.getKey()) || !a.getValue().equals(NUMERIC_TOLERANT, b.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static ObjectNode restrict(ObjectNode options, Set<String> keys) {
        var result = JsonNodeFactory.instance.objectNode();
        options.fields().forEachRemaining(field -> {
            if (keys.contains(field.getKey())) {
                result.set(field.getKey(), field.getValue());
            }
        });
        return result;
    }
}
