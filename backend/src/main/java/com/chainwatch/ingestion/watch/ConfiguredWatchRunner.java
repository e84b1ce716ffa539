package com.chainwatch.ingestion.watch;

import com.chainwatch.domain.LogsFilter;
import com.chainwatch.ingestion.config.WatchTargetsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the watch targets listed under chainwatch.watch.targets once the application is ready.
 * A bad target is logged and skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConfiguredWatchRunner {

    private final WatchTargetsProperties targetsProperties;
    private final SolanaWatchService watchService;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int started = 0;
        for (WatchTargetsProperties.Target target : targetsProperties.getTargets()) {
            try {
                RegisteredWatcher watcher = start(target);
                log.info("Started configured watcher {} ({} {})", watcher.id(), watcher.kind(), watcher.target());
                started++;
            } catch (IllegalArgumentException e) {
                log.warn("Skipping watch target {} {}: {}", target.getKind(), target.getAddress(), e.getMessage());
            }
        }
        if (started > 0) {
            log.info("Started {} configured watcher(s)", started);
        }
    }

    private RegisteredWatcher start(WatchTargetsProperties.Target target) {
        if (target.getKind() == null) {
            throw new IllegalArgumentException("kind is required");
        }
        return switch (target.getKind()) {
            case ACCOUNT -> watchService.watchAccount(requireAddress(target), target.getCommitment());
            case PROGRAM_LOGS -> watchService.watchProgramLogs(requireAddress(target), target.getCommitment());
            case TRANSACTION_LOGS -> watchService.watchTransactionLogs(
                    LogsFilter.parse(target.getFilter(), target.getAddress()), target.getCommitment());
        };
    }

    private static String requireAddress(WatchTargetsProperties.Target target) {
        if (target.getAddress() == null || target.getAddress().isBlank()) {
            throw new IllegalArgumentException("address is required");
        }
        return target.getAddress().trim();
    }
}
