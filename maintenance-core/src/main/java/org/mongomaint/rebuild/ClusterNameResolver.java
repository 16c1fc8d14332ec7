package org.mongomaint.rebuild;

import java.util.Optional;
import java.util.regex.Pattern;

import org.mongomaint.client.Commands;
import org.mongomaint.client.DatabaseClient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Derives the name that scopes a cluster's checkpoint and log files: an explicit override, else
 * the first label of a {@code mongodb+srv} host, else the replica set name, else
 * {@value #UNKNOWN_CLUSTER}. Every name is reduced to letters, digits, {@code _} and {@code -}
 * before it becomes part of a file name.
 */
@Slf4j
@RequiredArgsConstructor
public class ClusterNameResolver {
    public static final String UNKNOWN_CLUSTER = "unknown-cluster";

    private static final Pattern SRV_HOST = Pattern.compile("^mongodb\\+srv://(?:[^@/]+@)?([^/?]+)");
    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[^a-zA-Z0-9_-]");

    private final DatabaseClient client;

    public Mono<String> resolve(String override) {
        var overridden = sanitize(override);
        if (!overridden.isEmpty()) {
            if (!overridden.equals(override)) {
                log.warn("Cluster name '{}' contains unsafe characters, using '{}'", override, overridden);
            }
            return Mono.just(overridden);
        }
        return fromConnectionString(client.connectionString())
            .map(Mono::just)
            .orElseGet(this::fromReplicaSetName)
            .doOnNext(name -> log.info("Using cluster name '{}'", name));
    }

    static Optional<String> fromConnectionString(String connectionString) {
        if (connectionString == null) {
            return Optional.empty();
        }
        var matcher = SRV_HOST.matcher(connectionString);
        if (!matcher.find()) {
            return Optional.empty();
        }
        var firstLabel = sanitize(matcher.group(1).split("\\.")[0]);
        return firstLabel.isEmpty() ? Optional.empty() : Optional.of(firstLabel);
    }

    static String sanitize(String name) {
        return name == null ? "" : UNSAFE_CHARACTERS.matcher(name).replaceAll("");
    }

    private Mono<String> fromReplicaSetName() {
        return client.runAdminCommand(Commands.hello())
            .map(reply -> sanitize(reply.path("setName").asText("")))
            .filter(name -> !name.isEmpty())
            .defaultIfEmpty(UNKNOWN_CLUSTER)
            .onErrorResume(e -> {
                log.debug("Could not read the replica set name", e);
                return Mono.just(UNKNOWN_CLUSTER);
            });
    }
}
