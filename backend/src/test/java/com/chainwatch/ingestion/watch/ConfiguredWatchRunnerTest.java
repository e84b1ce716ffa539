package com.chainwatch.ingestion.watch;

import com.chainwatch.domain.Commitment;
import com.chainwatch.domain.LogsFilter;
import com.chainwatch.ingestion.config.WatchTargetsProperties;
import com.chainwatch.watcher.WatcherHandle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConfiguredWatchRunnerTest {

    private static final String ADDRESS = "SysvarC1ock11111111111111111111111111111111";

    @Mock
    SolanaWatchService watchService;

    private static WatchTargetsProperties.Target target(WatchKind kind, String address, String filter) {
        WatchTargetsProperties.Target target = new WatchTargetsProperties.Target();
        target.setKind(kind);
        target.setAddress(address);
        target.setFilter(filter);
        return target;
    }

    private static RegisteredWatcher registered(WatchKind kind) {
        return new RegisteredWatcher("id", kind, "t", mock(WatcherHandle.class), Instant.now());
    }

    @Test
    void startsEveryConfiguredTarget() {
        WatchTargetsProperties properties = new WatchTargetsProperties();
        WatchTargetsProperties.Target account = target(WatchKind.ACCOUNT, ADDRESS, null);
        account.setCommitment(Commitment.FINALIZED);
        properties.setTargets(List.of(
                account,
                target(WatchKind.PROGRAM_LOGS, ADDRESS, null),
                target(WatchKind.TRANSACTION_LOGS, null, "allWithVotes")));
        RegisteredWatcher accountWatcher = registered(WatchKind.ACCOUNT);
        RegisteredWatcher programWatcher = registered(WatchKind.PROGRAM_LOGS);
        RegisteredWatcher logsWatcher = registered(WatchKind.TRANSACTION_LOGS);
        when(watchService.watchAccount(ADDRESS, Commitment.FINALIZED)).thenReturn(accountWatcher);
        when(watchService.watchProgramLogs(ADDRESS, null)).thenReturn(programWatcher);
        when(watchService.watchTransactionLogs(LogsFilter.allWithVotes(), null)).thenReturn(logsWatcher);

        new ConfiguredWatchRunner(properties, watchService).onApplicationReady();

        verify(watchService).watchAccount(ADDRESS, Commitment.FINALIZED);
        verify(watchService).watchProgramLogs(ADDRESS, null);
        verify(watchService).watchTransactionLogs(LogsFilter.allWithVotes(), null);
    }

    @Test
    void invalidTargetsAreSkipped() {
        WatchTargetsProperties properties = new WatchTargetsProperties();
        properties.setTargets(List.of(
                target(null, ADDRESS, null),
                target(WatchKind.ACCOUNT, " ", null),
                target(WatchKind.TRANSACTION_LOGS, null, "votes")));

        new ConfiguredWatchRunner(properties, watchService).onApplicationReady();

        verify(watchService, never()).watchAccount(any(), any());
        verify(watchService, never()).watchTransactionLogs(any(), any());
    }
}
