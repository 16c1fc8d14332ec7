package org.mongomaint.config;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Include and exclude rules for collection names. A non-empty include list overrides the
 * exclude list. Patterns ending in {@code *} match by prefix, everything else exactly.
 */
@Value
@Builder
public class CollectionFilter {
    @Singular("include")
    List<String> included;
    @Singular("exclude")
    List<String> excluded;

    public static CollectionFilter acceptAll() {
        return CollectionFilter.builder().build();
    }

    public boolean accepts(String collection) {
        if (!included.isEmpty()) {
            return matchesAny(collection, included);
        }
        return !matchesAny(collection, excluded);
    }

    public boolean hasRules() {
        return !included.isEmpty() || !excluded.isEmpty();
    }

    /** True when both lists are set, in which case the exclude list is ignored. */
    public boolean includeOverridesExclude() {
        return !included.isEmpty() && !excluded.isEmpty();
    }

    public static boolean matchesAny(String name, List<String> patterns) {
        for (var pattern : patterns) {
            if (pattern.endsWith("*")) {
                if (name.startsWith(pattern.substring(0, pattern.length() - 1))) {
                    return true;
                }
            } else if (name.equals(pattern)) {
                return true;
            }
        }
        return false;
    }
}
