package com.chainwatch.watcher;

/**
 * Result of one poll retrieval. Null slot = let the engine synthesize one; null value = resource absent.
 */
public record PollEmission<N>(Long slot, N value) {

    public static <N> PollEmission<N> at(long slot, N value) {
        return new PollEmission<>(slot, value);
    }

    public static <N> PollEmission<N> withoutSlot(N value) {
        return new PollEmission<>(null, value);
    }
}
