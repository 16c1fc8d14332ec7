package org.mongomaint.compact;

import java.util.Optional;

import org.mongomaint.client.Commands;
import org.mongomaint.client.DatabaseClient;
import org.mongomaint.config.CompactConfig;

import org.slf4j.Logger;
import reactor.core.publisher.Mono;

/**
 * Asks the primary to step down so that it can be compacted as a secondary, then waits until the
 * former primary reports the secondary state.
 *
 * <p>The connection carrying {@code replSetStepDown} is usually closed by the server while the
 * command runs, so an error from the command itself is expected and only logged.
 */
public class PrimaryStepDownRunner {
    private final DatabaseClient client;
    private final CompactConfig config;
    private final ReplicaSetTopology topology;
    private final Logger log;

    public PrimaryStepDownRunner(DatabaseClient client, CompactConfig config, ReplicaSetTopology topology, Logger log) {
        this.client = client;
        this.config = config;
        this.topology = topology;
        this.log = log;
    }

    /**
     * @param steppedDown     whether the former primary was observed as a secondary in time
     * @param formerPrimaryZone zone (or host) of the member that was primary, if one was found
     */
    public record Outcome(boolean steppedDown, Optional<String> formerPrimaryZone) {
        static Outcome failed(Optional<String> zone) {
            return new Outcome(false, zone);
        }
    }

    public Mono<Outcome> stepDown() {
        return topology.primaryMember()
            .flatMap(primary -> {
                if (primary.isEmpty()) {
                    log.warn("No primary found in the replica set status, not stepping down");
                    return Mono.just(Outcome.failed(Optional.empty()));
                }
                var former = primary.get();
                var zone = Optional.of(former.zone() != null ? former.zone() : former.host());
                log.info("Stepping down primary {} (timeout: {}s)", former.host(), config.getStepDownTimeoutSeconds());
                return client.runAdminCommand(Commands.replSetStepDown(config.getStepDownTimeoutSeconds()))
                    .then()
                    .onErrorResume(e -> {
                        log.debug("Expected connection error during step-down: {}", e.getMessage());
                        return Mono.empty();
                    })
                    .then(Mono.delay(config.getStepDownSettleDelay()))
                    .then(config.getStepDownPolling().await(() -> isSecondary(former.id())))
                    .map(settled -> {
                        if (settled) {
                            log.info("Former primary {} is now a secondary", former.host());
                        } else {
                            log.warn("Former primary {} did not report the secondary state within {}",
                                former.host(), config.getStepDownPolling().getTimeout());
                        }
                        return new Outcome(settled, zone);
                    });
            })
            .onErrorResume(e -> {
                log.error("Primary step-down failed", e);
                return Mono.just(Outcome.failed(Optional.empty()));
            });
    }

    private Mono<Boolean> isSecondary(int memberId) {
        return topology.members()
            .map(members -> members.stream().anyMatch(m -> m.id() == memberId && m.isSecondary()))
            .onErrorResume(e -> {
                log.debug("Replica set status unavailable while waiting for the election: {}", e.getMessage());
                return Mono.just(false);
            });
    }
}
