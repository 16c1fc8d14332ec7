package org.mongomaint.coordinator;

import java.util.function.Consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Single entry point for invoking coordinator hooks. A misbehaving hook must never abort the
 * maintenance work, so every exception is caught here and logged at DEBUG.
 */
@Slf4j
@RequiredArgsConstructor
public class CoordinatorNotifier {
    private final MaintenanceCoordinator coordinator;

    public void notify(String hook, Consumer<MaintenanceCoordinator> call) {
        if (coordinator == null) {
            return;
        }
        try {
            call.accept(coordinator);
        } catch (RuntimeException e) {
            log.debug("Coordinator.{} threw, ignoring", hook, e);
        }
    }
}
