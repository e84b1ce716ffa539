package com.chainwatch.ingestion.watch;

import com.chainwatch.config.SchedulerConfig;
import com.chainwatch.domain.AccountSnapshot;
import com.chainwatch.domain.Commitment;
import com.chainwatch.domain.LogsFilter;
import com.chainwatch.domain.TransactionLog;
import com.chainwatch.ingestion.adapter.solana.SolanaRpcGateway;
import com.chainwatch.ingestion.adapter.solana.SolanaSubscriptionClient;
import com.chainwatch.ingestion.config.WatcherProperties;
import com.chainwatch.ingestion.strategy.AccountWatchStrategy;
import com.chainwatch.ingestion.strategy.ProgramLogsWatchStrategy;
import com.chainwatch.ingestion.strategy.TransactionLogsWatchStrategy;
import com.chainwatch.watcher.UnifiedWatcher;
import com.chainwatch.watcher.UpdateListener;
import com.chainwatch.watcher.WatcherHandle;
import com.chainwatch.watcher.WatcherOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Starts Solana watchers with the configured defaults and registers them.
 * Overloads without listeners log each update and error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SolanaWatchService {

    private final SolanaRpcGateway rpcGateway;
    private final SolanaSubscriptionClient subscriptionClient;
    private final WatcherProperties watcherProperties;
    private final WatcherRegistry registry;
    @Qualifier(SchedulerConfig.WATCHER_SCHEDULER)
    private final Scheduler watcherScheduler;

    public RegisteredWatcher watchAccount(String address, Commitment commitment) {
        String name = "account:" + address;
        return watchAccount(address, commitment, loggingListener(name), loggingErrors(name));
    }

    public RegisteredWatcher watchAccount(String address, Commitment commitment,
                                         UpdateListener<AccountSnapshot> onUpdate, Consumer<Throwable> onError) {
        AccountWatchStrategy strategy = new AccountWatchStrategy(
                address, resolve(commitment), rpcGateway, subscriptionClient);
        WatcherOptions<AccountSnapshot> options = this.<AccountSnapshot>defaults("account:" + address,
                        watcherProperties.getAccountPollIntervalMs())
                .onUpdate(onUpdate)
                .onError(onError)
                .build();
        WatcherHandle handle = UnifiedWatcher.start(strategy, options);
        return registry.register(WatchKind.ACCOUNT, address, handle);
    }

    public RegisteredWatcher watchProgramLogs(String programId, Commitment commitment) {
        String name = "program-logs:" + programId;
        return watchProgramLogs(programId, commitment, loggingListener(name), loggingErrors(name));
    }

    public RegisteredWatcher watchProgramLogs(String programId, Commitment commitment,
                                             UpdateListener<TransactionLog> onUpdate, Consumer<Throwable> onError) {
        ProgramLogsWatchStrategy strategy = new ProgramLogsWatchStrategy(programId, resolve(commitment),
                watcherProperties.getMaxSignaturesPerPoll(), rpcGateway, subscriptionClient);
        WatcherOptions<TransactionLog> options = this.<TransactionLog>defaults("program-logs:" + programId,
                        watcherProperties.getProgramLogsPollIntervalMs())
                .onUpdate(onUpdate)
                .onError(onError)
                .build();
        WatcherHandle handle = UnifiedWatcher.start(strategy, options);
        return registry.register(WatchKind.PROGRAM_LOGS, programId, handle);
    }

    public RegisteredWatcher watchTransactionLogs(LogsFilter filter, Commitment commitment) {
        String name = "transaction-logs:" + filter;
        return watchTransactionLogs(filter, commitment, loggingListener(name), loggingErrors(name));
    }

    /**
     * No poll exists for log filters: once the subscription is exhausted the watcher reports an
     * unrecoverable error and stops.
     */
    public RegisteredWatcher watchTransactionLogs(LogsFilter filter, Commitment commitment,
                                                 UpdateListener<TransactionLog> onUpdate, Consumer<Throwable> onError) {
        TransactionLogsWatchStrategy strategy = new TransactionLogsWatchStrategy(
                filter, resolve(commitment), subscriptionClient);
        WatcherOptions<TransactionLog> options = this.<TransactionLog>defaults(
                        "transaction-logs:" + strategy.getFilter(), 0)
                .onUpdate(onUpdate)
                .onError(onError)
                .build();
        WatcherHandle handle = UnifiedWatcher.start(strategy, options);
        return registry.register(WatchKind.TRANSACTION_LOGS, strategy.getFilter().toString(), handle);
    }

    private <N> WatcherOptions.Builder<N> defaults(String name, long pollIntervalMs) {
        return WatcherOptions.<N>builder()
                .name(name)
                .wsConnectTimeout(Duration.ofMillis(watcherProperties.getWsConnectTimeoutMs()))
                .pollInterval(Duration.ofMillis(pollIntervalMs))
                .heartbeatPollInterval(Duration.ofMillis(watcherProperties.getHeartbeatPollMs()))
                .maxRetries(watcherProperties.getMaxRetries())
                .retryDelay(Duration.ofMillis(watcherProperties.getRetryDelayMs()))
                .retryMode(watcherProperties.getRetryMode())
                .pollingReconnectInterval(Duration.ofMillis(watcherProperties.getPollingReconnectIntervalMs()))
                .scheduler(watcherScheduler);
    }

    private Commitment resolve(Commitment commitment) {
        return commitment != null ? commitment : watcherProperties.getCommitment();
    }

    private static <N> UpdateListener<N> loggingListener(String name) {
        return (slot, value) -> log.info("[{}] slot {}: {}", name, slot, value != null ? value : "<absent>");
    }

    private static Consumer<Throwable> loggingErrors(String name) {
        return e -> log.warn("[{}] {}", name, e.getMessage());
    }
}
