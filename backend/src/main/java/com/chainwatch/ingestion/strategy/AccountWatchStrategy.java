package com.chainwatch.ingestion.strategy;

import com.chainwatch.common.CancellationToken;
import com.chainwatch.domain.AccountSnapshot;
import com.chainwatch.domain.Commitment;
import com.chainwatch.ingestion.adapter.RpcException;
import com.chainwatch.ingestion.adapter.solana.SolanaRpcGateway;
import com.chainwatch.ingestion.adapter.solana.SolanaSubscriptionClient;
import com.chainwatch.watcher.PollEmission;
import com.chainwatch.watcher.PollEmitter;
import com.chainwatch.watcher.SubscriptionItem;
import com.chainwatch.watcher.WatcherStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Account strategy: accountSubscribe for pushes, getAccountInfo for polls, both base64-encoded.
 * A missing account is delivered as an absent (null) value.
 */
public class AccountWatchStrategy implements WatcherStrategy<JsonNode, AccountSnapshot> {

    private final String address;
    private final Commitment commitment;
    private final SolanaRpcGateway rpcGateway;
    private final SolanaSubscriptionClient subscriptionClient;

    public AccountWatchStrategy(String address, Commitment commitment,
                                SolanaRpcGateway rpcGateway, SolanaSubscriptionClient subscriptionClient) {
        this.address = address;
        this.commitment = commitment != null ? commitment : Commitment.CONFIRMED;
        this.rpcGateway = rpcGateway;
        this.subscriptionClient = subscriptionClient;
    }

    @Override
    public Mono<Flux<SubscriptionItem<JsonNode>>> subscribe(CancellationToken cancellation) {
        return subscriptionClient.subscribe("accountSubscribe", List.of(address, accountConfig()), cancellation)
                .map(stream -> stream.map(RpcValues::toItem));
    }

    @Override
    public boolean hasPoll() {
        return true;
    }

    @Override
    public Mono<Void> poll(PollEmitter<AccountSnapshot> emitter, CancellationToken cancellation) {
        return rpcGateway.call("getAccountInfo", List.of(address, accountConfig()))
                .doOnNext(result -> {
                    JsonNode slot = result.path("context").path("slot");
                    if (!slot.isIntegralNumber()) {
                        throw new RpcException("getAccountInfo response without context.slot for " + address);
                    }
                    if (!cancellation.isCancelled()) {
                        emitter.emit(PollEmission.at(slot.asLong(), normalize(result.path("value"))));
                    }
                })
                .then();
    }

    @Override
    public AccountSnapshot normalize(JsonNode raw) {
        try {
            return RpcValues.toAccountSnapshot(address, raw);
        } catch (RuntimeException e) {
            return null;
        }
    }

    public String getAddress() {
        return address;
    }

    private Map<String, Object> accountConfig() {
        return Map.of("encoding", "base64", "commitment", commitment.rpcValue());
    }
}
