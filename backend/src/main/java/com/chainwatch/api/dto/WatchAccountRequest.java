package com.chainwatch.api.dto;

import com.chainwatch.api.validation.SolanaAddress;
import com.chainwatch.domain.Commitment;
import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/watchers/accounts request body. Missing commitment = configured default.
 */
public record WatchAccountRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        @SolanaAddress
        String address,

        Commitment commitment
) {
}
