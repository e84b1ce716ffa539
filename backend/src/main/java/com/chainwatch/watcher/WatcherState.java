package com.chainwatch.watcher;

public enum WatcherState {
    CONNECTING,
    STREAMING,
    RECONNECTING,
    POLLING,
    STOPPED
}
