package org.mongomaint.retry;

import java.time.Duration;
import java.util.function.Supplier;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Mono;

/**
 * Exponential back-off polling under an overall timeout. Expiry of the timeout is a "not yet"
 * answer, not an error; deciding what to do about it is left to the caller.
 */
@Value
@Builder
public class PollingPolicy {
    @Builder.Default
    Duration initialDelay = Duration.ofSeconds(2);
    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(20);
    @Builder.Default
    Duration timeout = Duration.ofMinutes(10);

    public static PollingPolicy defaults() {
        return PollingPolicy.builder().build();
    }

    /**
     * Evaluate {@code condition} now and then after each back-off delay until it yields
     * {@code true}. Emits {@code false} if the timeout elapses first. Errors from the condition
     * are propagated.
     */
    public Mono<Boolean> await(Supplier<Mono<Boolean>> condition) {
        return Mono.defer(condition)
            .filter(Boolean::booleanValue)
            .repeatWhenEmpty(attempts -> attempts.concatMap(attempt -> Mono.delay(delayFor(attempt))))
            .timeout(timeout, Mono.just(false));
    }

    /** {@code initialDelay * 2^attempt}, capped at {@code maxDelay}. */
    public Duration delayFor(long attempt) {
        if (attempt >= 31) {
            return maxDelay;
        }
        var delay = initialDelay.multipliedBy(1L << attempt);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
