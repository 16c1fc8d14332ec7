package org.mongomaint.retry;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Bounded retry with a fixed delay and a cleanup hook that runs before every new attempt.
 * Shared by the index rebuild (one policy per index) and compaction (one per compact command).
 */
@Value
@Builder
public class RetryPolicy {
    @Builder.Default
    int maxRetries = 1;
    @Builder.Default
    Duration delay = Duration.ofSeconds(2);

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy noRetries() {
        return RetryPolicy.builder().maxRetries(0).build();
    }

    public <T> Mono<T> execute(Supplier<Mono<T>> attempt) {
        return execute(attempt, e -> true, signal -> Mono.empty());
    }

    /**
     * Subscribe to {@code attempt} and re-subscribe up to {@link #getMaxRetries()} times when it
     * fails with an error accepted by {@code retryable}. {@code beforeRetry} runs after the delay
     * has been scheduled and before the next attempt; its failure fails the whole execution.
     * Once retries are exhausted the last attempt's error is propagated unchanged.
     */
    public <T> Mono<T> execute(
        Supplier<Mono<T>> attempt,
        Predicate<Throwable> retryable,
        Function<Retry.RetrySignal, Mono<?>> beforeRetry
    ) {
        return Mono.defer(attempt)
            .retryWhen(Retry.fixedDelay(maxRetries, delay)
                .filter(retryable)
                .doBeforeRetryAsync(signal -> beforeRetry.apply(signal.copy()).then())
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }
}
