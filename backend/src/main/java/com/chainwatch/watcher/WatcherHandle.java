package com.chainwatch.watcher;

/**
 * Handle of a running watcher.
 */
public interface WatcherHandle {

    /**
     * Idempotent and terminal. Once it returns, no further update or error callback is invoked.
     */
    void stop();

    boolean isStopped();

    WatcherState state();

    /**
     * Last slot delivered to the consumer, -1 before the first update.
     */
    long lastAcceptedSlot();

    String name();
}
