package com.chainwatch.watcher;

import java.time.Duration;

public class WsConnectTimeoutException extends RuntimeException {

    public WsConnectTimeoutException(Duration timeout) {
        super("subscription connect timeout after " + timeout.toMillis() + " ms");
    }
}
