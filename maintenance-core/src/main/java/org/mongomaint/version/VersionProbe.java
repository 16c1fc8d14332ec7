package org.mongomaint.version;

import org.mongomaint.UnsupportedServerVersionException;
import org.mongomaint.client.Commands;
import org.mongomaint.client.DatabaseClient;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Detects the server version with a single {@code buildInfo} call.
 */
@Slf4j
@RequiredArgsConstructor
public class VersionProbe {
    public static final int MINIMUM_MAJOR = 4;
    public static final int MINIMUM_MINOR = 4;

    private final DatabaseClient client;

    /**
     * Never fails: any error, or a reply without a version, yields {@link ServerVersionInfo#BASELINE}
     * so no feature is assumed that the server may lack.
     */
    public Mono<ServerVersionInfo> detect() {
        return client.runAdminCommand(Commands.buildInfo())
            .map(reply -> ServerVersionInfo.parse(reply.path("version").asText(null)))
            .defaultIfEmpty(ServerVersionInfo.BASELINE)
            .onErrorResume(e -> {
                log.warn("Could not detect server version, assuming {} compatibility", ServerVersionInfo.BASELINE, e);
                return Mono.just(ServerVersionInfo.BASELINE);
            })
            .doOnNext(version -> log.info("Detected server version {}", version));
    }

    /**
     * Both rebuild and compaction rely on {@code buildState}, the {@code building} flag of
     * {@code $indexStats} and consistent index listings across members, all of which need 4.4.
     */
    public static void requireMinimum(ServerVersionInfo version) {
        if (!version.isAtLeast(MINIMUM_MAJOR, MINIMUM_MINOR)) {
            throw new UnsupportedServerVersionException(
                "Server version " + MINIMUM_MAJOR + "." + MINIMUM_MINOR + "+ required, found " + version.fullVersion()
            );
        }
    }
}
