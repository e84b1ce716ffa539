package com.chainwatch.api.dto;

import java.time.Instant;

/**
 * One watcher in POST and GET /api/v1/watchers responses. lastSlot is -1 before the first update.
 */
public record WatcherResponse(
        String id,
        String kind,
        String target,
        String state,
        long lastSlot,
        Instant startedAt
) {
}
