package org.mongomaint.compact;

import com.fasterxml.jackson.databind.JsonNode;

import org.mongomaint.client.Commands;
import org.mongomaint.client.DatabaseClient;
import org.mongomaint.client.NodeTarget;
import org.mongomaint.config.CompactConfig;

import org.slf4j.Logger;
import reactor.core.publisher.Mono;

/**
 * Runs the node-level background compaction job once on a single member.
 *
 * <p>The job is enabled with {@code runOnce}, the member's active operations are polled until
 * the job is gone, and the feature is disabled again on every exit path: completion, timeout,
 * error and cancellation.
 */
public class AutoCompactRunner {
    private final DatabaseClient client;
    private final CompactConfig config;
    private final Logger log;

    public AutoCompactRunner(DatabaseClient client, CompactConfig config, Logger log) {
        this.client = client;
        this.config = config;
        this.log = log;
    }

    /**
     * @return {@code true} when the job finished within the polling timeout; {@code false} on
     * timeout or failure
     */
    public Mono<Boolean> runOnce(NodeTarget target) {
        var polling = config.getAutoCompactPolling();
        return Mono.usingWhen(
                Mono.just(target),
                node -> client.runAdminCommand(Commands.enableAutoCompact(config.getAutoCompactFreeSpaceTargetMb()), node)
                    .doOnNext(reply -> log.info("autoCompact enabled on {}, monitoring progress", node))
                    .then(Mono.delay(polling.getInitialDelay()))
                    .then(polling.await(() -> isRunning(node).map(running -> !running)))
                    .doOnNext(finished -> {
                        if (finished) {
                            log.info("autoCompact runOnce completed on {}", node);
                        } else {
                            log.warn("autoCompact on {} timed out after {}", node, polling.getTimeout());
                        }
                    }),
                this::disable,
                (node, e) -> disable(node),
                this::disable
            )
            .onErrorResume(e -> {
                log.error("autoCompact failed on {}", target, e);
                return Mono.just(false);
            });
    }

    private Mono<Void> disable(NodeTarget node) {
        return client.runAdminCommand(Commands.disableAutoCompact(), node)
            .doOnNext(reply -> log.info("autoCompact disabled on {}", node))
            .then()
            .onErrorResume(e -> {
                log.warn("Failed to disable autoCompact on {}", node, e);
                return Mono.empty();
            });
    }

    /** An unreadable operation list counts as "not running" so the poll cannot hang on it. */
    Mono<Boolean> isRunning(NodeTarget node) {
        return client.runAdminCommand(Commands.currentOp(), node)
            .map(reply -> {
                for (JsonNode op : reply.path("inprog")) {
                    if (op.path("command").has("autoCompact") || op.path("desc").asText("").contains("autoCompact")) {
                        return true;
                    }
                }
                return false;
            })
            .onErrorResume(e -> {
                log.debug("Failed to check autoCompact status on {}: {}", node, e.getMessage());
                return Mono.just(false);
            });
    }
}
