package com.chainwatch.ingestion.watch;

/**
 * What a registered watcher follows.
 */
public enum WatchKind {
    ACCOUNT,
    PROGRAM_LOGS,
    TRANSACTION_LOGS
}
