package org.mongomaint.compact;

import java.nio.file.Path;
import java.time.Duration;

import org.mongomaint.client.InMemoryDatabaseClient;
import org.mongomaint.client.NodeTarget;
import org.mongomaint.config.CompactConfig;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.helpers.NOPLogger;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class AutoCompactRunnerTest {

    @TempDir
    Path tempDir;

    private InMemoryDatabaseClient client;

    @BeforeEach
    void setUp() {
        client = new InMemoryDatabaseClient("app").withServerVersion("8.0.1").withThreeMemberReplicaSet();
    }

    private AutoCompactRunner runner(CompactConfig config) {
        return new AutoCompactRunner(client, config, NOPLogger.NOP_LOGGER);
    }

    private AutoCompactRunner runner() {
        return runner(CompactFixtures.config(tempDir).build());
    }

    @Test
    void runsUntilTheJobDisappearsThenDisables() {
        client.withAutoCompactRunningPolls("primary", 3);

        StepVerifier.create(runner().runOnce(NodeTarget.primary()))
            .expectNext(true)
            .verifyComplete();

        assertTrue(client.autoCompactEnabledOn().isEmpty());
        assertEquals(2, client.count("autoCompact"));
        assertEquals(4, client.count("currentOp"));
        var enable = client.getExecuted().get(0);
        assertEquals("autoCompact", enable.name());
        assertTrue(enable.admin());
        assertTrue(enable.command().path("runOnce").asBoolean());
        assertEquals(10, enable.command().path("freeSpaceTargetMB").asInt());
    }

    @Test
    void timeoutStillDisables() {
        client.withAutoCompactRunningPolls("zone-b", Integer.MAX_VALUE);
        var config = CompactFixtures.config(tempDir).autoCompactPolling(CompactFixtures.polling(Duration.ofMillis(50))).build();

        StepVerifier.create(runner(config).runOnce(NodeTarget.secondary("zone-b")))
            .expectNext(false)
            .verifyComplete();

        assertTrue(client.autoCompactEnabledOn().isEmpty());
    }

    @Test
    void failureToEnableIsReportedAndStillDisables() {
        client.failNext(call -> call.name().equals("autoCompact") && call.command().path("autoCompact").asBoolean(), 1,
            () -> new IllegalStateException("not permitted"));

        StepVerifier.create(runner().runOnce(NodeTarget.primary()))
            .expectNext(false)
            .verifyComplete();

        assertEquals(2, client.count("autoCompact"));
        assertFalse(client.getExecuted().get(1).command().path("autoCompact").asBoolean(true));
    }

    @Test
    void failureToDisableIsOnlyLogged() {
        client.failNext(call -> call.name().equals("autoCompact") && !call.command().path("autoCompact").asBoolean(), 1,
            () -> new IllegalStateException("connection reset"));

        StepVerifier.create(runner().runOnce(NodeTarget.primary()))
            .expectNext(true)
            .verifyComplete();
    }

    @Test
    void unreadableOperationListCountsAsFinished() {
        client.withAutoCompactRunningPolls("primary", 5).failNext("currentOp", 10);

        StepVerifier.create(runner().isRunning(NodeTarget.primary()))
            .expectNext(false)
            .verifyComplete();
    }
}
