package com.chainwatch.watcher;

/**
 * One raw item from the push channel: either carries the slot assigned by the source ({@link Enveloped})
 * or carries none ({@link Bare}), in which case the engine synthesizes the next slot.
 *
 * @param <R> raw payload type
 */
public interface SubscriptionItem<R> {

    R value();

    static <R> SubscriptionItem<R> enveloped(long slot, R value) {
        return new Enveloped<>(slot, value);
    }

    static <R> SubscriptionItem<R> bare(R value) {
        return new Bare<>(value);
    }

    record Enveloped<R>(long slot, R value) implements SubscriptionItem<R> {
    }

    record Bare<R>(R value) implements SubscriptionItem<R> {
    }
}
