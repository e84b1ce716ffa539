package com.chainwatch.ingestion.adapter;

import com.chainwatch.common.RetryPolicy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Round-robin endpoint selection plus the retry schedule used when an endpoint fails.
 * One rotator per transport (HTTP for polls, WebSocket for subscriptions).
 */
public class RpcEndpointRotator {

    private final String transport;
    private final List<String> endpoints;
    private final AtomicInteger index = new AtomicInteger(0);
    private final RetryPolicy retryPolicy;

    public RpcEndpointRotator(String transport, List<String> endpoints, RetryPolicy retryPolicy) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one " + transport + " endpoint required");
        }
        this.transport = transport;
        this.endpoints = List.copyOf(endpoints);
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    /**
     * Next endpoint in round-robin order; a reconnect after failure lands on a different endpoint.
     */
    public String getNextEndpoint() {
        int i = Math.floorMod(index.getAndIncrement(), endpoints.size());
        return endpoints.get(i);
    }

    /**
     * Delay in ms before retrying after the given attempt (0-based).
     */
    public long retryDelayMs(int attempt) {
        return retryPolicy.delayMs(attempt);
    }

    public int getMaxAttempts() {
        return Math.max(1, retryPolicy.getMaxAttempts());
    }

    public List<String> getEndpoints() {
        return endpoints;
    }

    public String getTransport() {
        return transport;
    }
}
