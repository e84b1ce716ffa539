package com.chainwatch.watcher;

/**
 * Sink for accepted updates. Called with strictly increasing slots, possibly from different threads.
 */
@FunctionalInterface
public interface UpdateListener<N> {
    void onUpdate(long slot, N value);
}
