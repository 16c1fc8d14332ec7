package org.mongomaint.confirm;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Decision function consulted at the points listed in {@link ConfirmationPoint}. Implementations
 * typically block on operator input, so engines call them through {@link #ask} which moves the
 * call onto a scheduler that tolerates blocking.
 */
@FunctionalInterface
public interface ConfirmationProvider {

    /**
     * @param subject what is being confirmed, e.g. a collection or {@code collection.index} name
     */
    Decision confirm(ConfirmationPoint point, String subject);

    default Mono<Decision> ask(ConfirmationPoint point, String subject) {
        return Mono.fromCallable(() -> confirm(point, subject))
            .subscribeOn(Schedulers.boundedElastic());
    }

    static ConfirmationProvider autoApprove() {
        return (point, subject) -> Decision.YES;
    }
}
