package com.chainwatch.ingestion.adapter.solana;

import com.chainwatch.common.CancellationToken;
import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Solana JSON-RPC subscriptions (accountSubscribe, logsSubscribe, ...) over WebSocket.
 */
public interface SolanaSubscriptionClient {

    /**
     * Opens a connection and sends {@code method}. The Mono completes once the server confirms the
     * subscription; the inner Flux carries each notification's {@code result} ({@code {context, value}}),
     * completes when the socket closes and errors when it breaks. Cancelling the token closes the socket.
     */
    Mono<Flux<JsonNode>> subscribe(String method, List<?> params, CancellationToken cancellation);
}
