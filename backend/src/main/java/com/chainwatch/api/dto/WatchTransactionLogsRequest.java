package com.chainwatch.api.dto;

import com.chainwatch.api.validation.SolanaAddress;
import com.chainwatch.domain.Commitment;

/**
 * POST /api/v1/watchers/transaction-logs request body.
 * filter: all | allWithVotes | mentions; without filter, mentions when an address is given, otherwise all.
 */
public record WatchTransactionLogsRequest(
        String filter,

        @SolanaAddress
        String mentions,

        Commitment commitment
) {
}
