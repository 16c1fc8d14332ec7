package org.mongomaint.version;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps a server version to the index option keys it understands and strips everything else
 * from a requested option set.
 */
@Slf4j
public class IndexOptionFilter {

    /** Release in which each group of index options first appeared, oldest first. */
    @Getter
    public enum Milestone {
        V3_0(3, 0, List.of(
            "unique",
            "expireAfterSeconds",
            "sparse",
            "storageEngine",
            "weights",
            "default_language",
            "language_override",
            "textIndexVersion",
            "2dsphereIndexVersion",
            "bits",
            "min",
            "max",
            "bucketSize"
        )),
        V3_2(3, 2, List.of("partialFilterExpression")),
        V3_4(3, 4, List.of("collation")),
        V4_2(4, 2, List.of("wildcardProjection")),
        V4_4(4, 4, List.of("hidden")),
        V7_0(7, 0, List.of("columnstoreProjection"));

        private final int major;
        private final int minor;
        private final List<String> options;

        Milestone(int major, int minor, List<String> options) {
            this.major = major;
            this.minor = minor;
            this.options = options;
        }
    }

    /** Every option key any known release understands. */
    public static final Set<String> ALL_KNOWN_OPTIONS = Collections.unmodifiableSet(
        Arrays.stream(Milestone.values())
            .flatMap(m -> m.getOptions().stream())
            .collect(LinkedHashSet::new, Set::add, Set::addAll)
    );

    @Getter
    private final ServerVersionInfo version;
    private final Set<String> allowed;

    public IndexOptionFilter(ServerVersionInfo version) {
        this.version = version;
        this.allowed = allowedOptions(version);
        log.atDebug().setMessage("Index options supported by {}: {}")
            .addArgument(version)
            .addArgument(allowed)
            .log();
    }

    /** Union of every milestone at or below {@code version}. */
    public static Set<String> allowedOptions(ServerVersionInfo version) {
        var result = new LinkedHashSet<String>();
        for (var milestone : Milestone.values()) {
            if (version.isAtLeast(milestone.getMajor(), milestone.getMinor())) {
                result.addAll(milestone.getOptions());
            }
        }
        return Collections.unmodifiableSet(result);
    }

    public Set<String> allowedOptions() {
        return allowed;
    }

    public boolean isAllowed(String option) {
        return allowed.contains(option);
    }

    /** A copy of {@code options} without the keys this server version does not understand. */
    public ObjectNode filter(ObjectNode options) {
        var filtered = JsonNodeFactory.instance.objectNode();
        options.fields().forEachRemaining(field -> {
            if (allowed.contains(field.getKey())) {
                filtered.set(field.getKey(), field.getValue().deepCopy());
            } else {
                log.debug("Skipping unsupported option \"{}\" for server version {}", field.getKey(), version);
            }
        });
        return filtered;
    }
}
