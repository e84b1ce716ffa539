package com.chainwatch.watcher;

/**
 * Terminal failure: the subscription is exhausted and there is nothing to fall back to.
 */
public class UnrecoverableWatcherException extends RuntimeException {

    public UnrecoverableWatcherException(String message) {
        super(message);
    }

    public UnrecoverableWatcherException(String message, Throwable cause) {
        super(message, cause);
    }
}
