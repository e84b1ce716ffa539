package com.chainwatch.ingestion.adapter.solana;

import com.chainwatch.ingestion.adapter.RpcEndpointRotator;
import com.chainwatch.ingestion.adapter.RpcException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Poll-side Solana RPC access: endpoint rotation, local rate limit, JSON-RPC error mapping and retries.
 * Each attempt goes to the next endpoint; the returned Mono emits the JSON-RPC {@code result} node.
 */
@Slf4j
public class SolanaRpcGateway {

    private final SolanaRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public SolanaRpcGateway(SolanaRpcClient rpcClient, RpcEndpointRotator rotator,
                            RateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    public Mono<JsonNode> call(String method, Object params) {
        return Mono.defer(() -> callOnce(rotator.getNextEndpoint(), method, params))
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    long attempt = signal.totalRetries();
                    Throwable failure = signal.failure();
                    if (attempt + 1 >= rotator.getMaxAttempts()) {
                        return Mono.error(new RpcException(
                                method + " failed after " + (attempt + 1) + " attempts: " + messageOf(failure), failure));
                    }
                    long delayMs = rotator.retryDelayMs((int) attempt);
                    log.debug("{} attempt {} failed ({}), retrying in {} ms", method, attempt + 1, messageOf(failure), delayMs);
                    return Mono.delay(Duration.ofMillis(delayMs));
                })));
    }

    private Mono<JsonNode> callOnce(String endpoint, String method, Object params) {
        return acquirePermit(endpoint, method)
                .then(Mono.defer(() -> rpcClient.call(endpoint, method, params)))
                .map(json -> readResult(method, json));
    }

    private Mono<Void> acquirePermit(String endpoint, String method) {
        return Mono.defer(() -> {
            long waitNanos = rateLimiter.reservePermission();
            if (waitNanos < 0) {
                return Mono.error(new RpcException("Local limiter timeout before " + method + " on " + endpoint));
            }
            if (waitNanos == 0) {
                return Mono.empty();
            }
            log.debug("Local Solana RPC limiter delays {} on {} by {} ms", method, endpoint, waitNanos / 1_000_000L);
            return Mono.delay(Duration.ofNanos(waitNanos)).then();
        });
    }

    JsonNode readResult(String method, String json) {
        if (json == null || json.isBlank()) {
            throw new RpcException("Empty Solana RPC response to " + method);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Unparseable Solana RPC response to " + method, e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            Integer code = error.path("code").isInt() ? error.path("code").asInt() : null;
            throw new RpcException(method + " error: " + error, code, null);
        }
        return root.path("result");
    }

    private static String messageOf(Throwable e) {
        if (e == null) {
            return "unknown";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
