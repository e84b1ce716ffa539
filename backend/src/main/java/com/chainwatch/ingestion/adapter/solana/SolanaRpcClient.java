package com.chainwatch.ingestion.adapter.solana;

import reactor.core.publisher.Mono;

/**
 * Solana JSON-RPC over HTTP. Returns the raw response body; error handling and retries live in
 * {@link SolanaRpcGateway}.
 */
public interface SolanaRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
