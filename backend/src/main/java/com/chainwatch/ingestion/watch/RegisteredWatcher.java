package com.chainwatch.ingestion.watch;

import com.chainwatch.watcher.WatcherHandle;

import java.time.Instant;

/**
 * Running (or terminally stopped) watcher known to the registry.
 *
 * @param target account address, program id or logs filter text
 */
public record RegisteredWatcher(String id, WatchKind kind, String target, WatcherHandle handle, Instant startedAt) {
}
