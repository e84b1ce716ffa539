package com.chainwatch.watcher;

import com.chainwatch.common.CancellationToken;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Adapts one concrete data source to the watcher engine. Holds no ordering state; the engine owns slots.
 *
 * @param <R> raw payload type yielded by the subscription
 * @param <N> normalized value type delivered to consumers
 */
public interface WatcherStrategy<R, N> {

    /**
     * Opens the push channel. The Mono completes once the subscription is established; the inner Flux
     * completes when the channel closes gracefully and errors when it breaks. Must stop emitting and
     * release resources once {@code cancellation} fires or the subscription is cancelled.
     */
    Mono<Flux<SubscriptionItem<R>>> subscribe(CancellationToken cancellation);

    /**
     * Whether {@link #poll} is implemented. Without a poll there is no fallback when the subscription fails.
     */
    default boolean hasPoll() {
        return false;
    }

    /**
     * Performs one retrieval and passes results to {@code emitter}. Errors on fatal fetch failures.
     */
    default Mono<Void> poll(PollEmitter<N> emitter, CancellationToken cancellation) {
        return Mono.error(new UnsupportedOperationException("poll not supported"));
    }

    /**
     * Pure and total: malformed input maps to null (absent) instead of throwing.
     */
    N normalize(R raw);
}
