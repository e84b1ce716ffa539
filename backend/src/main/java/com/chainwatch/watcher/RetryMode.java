package com.chainwatch.watcher;

/**
 * What the watcher does once the subscription cannot be (re)established or breaks.
 */
public enum RetryMode {
    /** Retry connect up to maxRetries, then poll for the rest of the watcher's life. Stream loss goes straight to polling. */
    FALLBACK_TO_POLLING,
    /** Stream loss triggers reconnects; while polling, a new subscription is attempted periodically. */
    PERPETUAL
}
