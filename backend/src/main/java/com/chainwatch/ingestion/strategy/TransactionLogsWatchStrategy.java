package com.chainwatch.ingestion.strategy;

import com.chainwatch.common.CancellationToken;
import com.chainwatch.domain.Commitment;
import com.chainwatch.domain.LogsFilter;
import com.chainwatch.domain.TransactionLog;
import com.chainwatch.ingestion.adapter.solana.SolanaSubscriptionClient;
import com.chainwatch.watcher.SubscriptionItem;
import com.chainwatch.watcher.WatcherStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Transaction logs through logsSubscribe only. There is no HTTP equivalent for arbitrary log filters,
 * so the watcher stops with an unrecoverable error once the subscription is exhausted.
 */
public class TransactionLogsWatchStrategy implements WatcherStrategy<JsonNode, TransactionLog> {

    private final LogsFilter filter;
    private final Commitment commitment;
    private final SolanaSubscriptionClient subscriptionClient;

    public TransactionLogsWatchStrategy(LogsFilter filter, Commitment commitment,
                                        SolanaSubscriptionClient subscriptionClient) {
        this.filter = filter != null ? filter : LogsFilter.all();
        this.commitment = commitment != null ? commitment : Commitment.CONFIRMED;
        this.subscriptionClient = subscriptionClient;
    }

    @Override
    public Mono<Flux<SubscriptionItem<JsonNode>>> subscribe(CancellationToken cancellation) {
        List<Object> params = List.of(filter.toRpcParam(), Map.of("commitment", commitment.rpcValue()));
        return subscriptionClient.subscribe("logsSubscribe", params, cancellation)
                .map(stream -> stream.map(RpcValues::toItem));
    }

    @Override
    public TransactionLog normalize(JsonNode raw) {
        try {
            return RpcValues.toTransactionLog(raw);
        } catch (RuntimeException e) {
            return null;
        }
    }

    public LogsFilter getFilter() {
        return filter;
    }
}
