package org.mongomaint.rebuild;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.mongomaint.MaintenanceAbortedException;
import org.mongomaint.client.InMemoryDatabaseClient;
import org.mongomaint.config.RebuildConfig;
import org.mongomaint.confirm.ConfirmationPoint;
import org.mongomaint.confirm.Decision;
import org.mongomaint.coordinator.MaintenanceCoordinator;
import org.mongomaint.coordinator.RecordingCoordinator;
import org.mongomaint.log.IndexLog;
import org.mongomaint.model.IndexDescriptor;
import org.mongomaint.state.StateStore;
import org.mongomaint.version.IndexOptionFilter;
import org.mongomaint.version.ServerVersionInfo;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.helpers.NOPLogger;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mongomaint.rebuild.RebuildFixtures.CLOCK;
import static org.mongomaint.rebuild.RebuildFixtures.creates;
import static org.mongomaint.rebuild.RebuildFixtures.key;
import static org.mongomaint.rebuild.RebuildFixtures.mb;
import static org.mongomaint.rebuild.RebuildFixtures.options;
import static org.mongomaint.rebuild.RebuildFixtures.serverError;

class CollectionRebuildEngineTest {

    @TempDir
    Path tempDir;

    private InMemoryDatabaseClient client;
    private StateStore store;
    private RecordingCoordinator coordinator;

    @BeforeEach
    void setUp() {
        client = new InMemoryDatabaseClient("app")
            .withIndex("orders", "email_1", key("email", 1), options().put("unique", true), mb(3))
            .withIndex("orders", "a_1", key("a", 1), mb(5))
            .withIndex("orders", "b_1", key("b", 1), mb(20))
            .withIndex("orders", "c_archive_1", key("c", 1), mb(50))
            .withSizeAfterRebuild("orders", "a_1", mb(2))
            .withSizeAfterRebuild("orders", "b_1", mb(8));
        store = RebuildFixtures.stateStore(tempDir);
        coordinator = new RecordingCoordinator();
    }

    private RebuildConfig.RebuildConfigBuilder config() {
        return RebuildFixtures.config(tempDir).ignoredIndex("c_*").coordinator(coordinator);
    }

    private CollectionRebuildEngine engine(RebuildConfig config) {
        var indexEngine = new IndexRebuildEngine(client, store, new IndexOptionFilter(ServerVersionInfo.parse("7.0.2")),
            config, CLOCK, NOPLogger.NOP_LOGGER);
        return new CollectionRebuildEngine(client, indexEngine, store, config, CLOCK, NOPLogger.NOP_LOGGER);
    }

    @Test
    void rebuildsEligibleIndexesLargestFirst() {
        StepVerifier.create(engine(config().build()).rebuild("orders"))
            .assertNext(result -> {
                assertEquals(CollectionRebuildResult.Outcome.COMPLETED, result.outcome());
                assertEquals(List.of("b_1", "a_1"), List.copyOf(result.log().getIndexes().keySet()));
            })
            .verifyComplete();

        assertEquals(List.of("indexStart:orders.b_1", "indexStart:orders.a_1"), coordinator.eventsStartingWith("indexStart"));
        assertEquals(0, client.getExecuted().stream().filter(call -> creates(call, "email_1")).count());
        assertEquals(0, client.getExecuted().stream().filter(call -> creates(call, "c_archive_1")).count());
        assertEquals(0, client.getExecuted().stream().filter(call -> creates(call, "_id_")).count());
    }

    @Test
    void sizesAreMeasuredOnceAfterTheLastIndex() {
        StepVerifier.create(engine(config().build()).rebuild("orders"))
            .assertNext(result -> {
                var log = result.log();
                assertEquals(8.0, log.getIndexes().get("b_1").getFinalSizeMb(), 1e-9);
                assertEquals(2.0, log.getIndexes().get("a_1").getFinalSizeMb(), 1e-9);
                assertEquals(20.0, log.getIndexes().get("b_1").getInitialSizeMb(), 1e-9);
                assertEquals(15.0, log.getReclaimedMb(), 1e-6);
                assertEquals(log.getInitialSizeMb() - log.getFinalSizeMb(), log.getReclaimedMb(), 1e-9);
            })
            .verifyComplete();

        assertEquals(2, client.count("collStats"));
    }

    @Test
    void completedIndexesAreSkipped() {
        store.markCompleted("orders", "b_1");

        StepVerifier.create(engine(config().build()).rebuild("orders"))
            .assertNext(result -> assertEquals(List.of("a_1"), List.copyOf(result.log().getIndexes().keySet())))
            .verifyComplete();
    }

    @Test
    void collectionWithNothingToRebuildIsSkippedWithoutSideEffects() {
        var onlyIneligible = new InMemoryDatabaseClient("app")
            .withIndex("users", "email_1", key("email", 1), options().put("unique", true), mb(1));
        client = onlyIneligible;

        StepVerifier.create(engine(config().build()).rebuild("users"))
            .assertNext(result -> assertTrue(result.isSkipped()))
            .verifyComplete();
        assertEquals(0, client.count("createIndexes"));
        assertTrue(coordinator.events().isEmpty());
    }

    @Test
    void operatorCanSkipTheCollection() {
        var config = config().safeRun(true).confirmationProvider((point, subject) -> Decision.SKIP).build();

        StepVerifier.create(engine(config).rebuild("orders"))
            .assertNext(result -> assertTrue(result.isSkipped()))
            .verifyComplete();
        assertEquals(0, client.count("createIndexes"));
    }

    @Test
    void refusingTheIndexListAborts() {
        var config = config().safeRun(true).confirmationProvider((point, subject) -> Decision.NO).build();

        StepVerifier.create(engine(config).rebuild("orders"))
            .expectError(MaintenanceAbortedException.class)
            .verify();
        assertEquals(0, client.count("createIndexes"));
    }

    @Test
    void specifyAsksForEachIndex() {
        var config = config().safeRun(true).confirmationProvider((point, subject) -> {
            if (point == ConfirmationPoint.INDEX_LIST) {
                return Decision.SPECIFY;
            }
            return subject.equals("orders.b_1") ? Decision.YES : Decision.NO;
        }).build();

        StepVerifier.create(engine(config).rebuild("orders"))
            .assertNext(result -> assertEquals(List.of("b_1"), List.copyOf(result.log().getIndexes().keySet())))
            .verifyComplete();
        assertEquals(0, client.getExecuted().stream().filter(call -> creates(call, "a_1")).count());
    }

    @Test
    void indexDroppedByAnInterruptedRunIsRecovered() {
        var definition = new IndexDescriptor("d_1", key("d", 1), options().put("sparse", true));
        store.markInFlight("orders", definition);
        client.withIndex("orders", "d_1_cover_temp", key("d", 1, "_rebuild_cover_field_", 1), mb(1));

        StepVerifier.create(engine(config().build()).rebuild("orders"))
            .assertNext(result -> assertTrue(result.log().getIndexes().containsKey("d_1")))
            .verifyComplete();

        assertTrue(client.indexDocument("orders", "d_1").path("sparse").asBoolean());
        assertFalse(client.indexNames("orders").contains("d_1_cover_temp"));
        assertTrue(store.getState().isCompleted("orders", "d_1"));
        assertTrue(store.getState().inFlightIn("orders").isEmpty());
    }

    @Test
    void failedIndexDoesNotStopTheOthers() {
        client.failNext(call -> creates(call, "b_1"), 10, () -> serverError("createIndexes"));

        StepVerifier.create(engine(config().build()).rebuild("orders"))
            .assertNext(result -> {
                var log = result.log();
                assertEquals(IndexLog.Status.FAILED, log.getIndexes().get("b_1").getStatus());
                assertEquals(IndexLog.Status.REBUILT, log.getIndexes().get("a_1").getStatus());
                assertEquals(1, log.failedIndexCount());
                assertEquals(1, log.getWarnings().size());
                assertEquals(0.0, log.getIndexes().get("b_1").getFinalSizeMb());
            })
            .verifyComplete();

        assertTrue(coordinator.events().contains("indexComplete:orders.b_1:false"));
        assertTrue(coordinator.events().contains("error:b_1"));
    }

    @Test
    void throwingCoordinatorDoesNotInterruptTheRebuild() {
        MaintenanceCoordinator broken = new MaintenanceCoordinator() {
            @Override
            public void onIndexStart(String collection, String indexName, double sizeMb) {
                throw new IllegalStateException("dashboard offline");
            }

            @Override
            public void onCollectionComplete(String collection, double reclaimedMb, double seconds) {
                throw new IllegalStateException("dashboard offline");
            }

            @Override
            public void onError(String message, Map<String, Object> context) {
                throw new IllegalStateException("dashboard offline");
            }
        };

        StepVerifier.create(engine(config().coordinator(broken).build()).rebuild("orders"))
            .assertNext(result -> assertEquals(2, result.log().getIndexes().size()))
            .verifyComplete();
    }
}
