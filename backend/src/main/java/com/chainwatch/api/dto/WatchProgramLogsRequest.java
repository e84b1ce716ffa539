package com.chainwatch.api.dto;

import com.chainwatch.api.validation.SolanaAddress;
import com.chainwatch.domain.Commitment;
import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/watchers/program-logs request body.
 */
public record WatchProgramLogsRequest(
        @NotBlank(message = "INVALID_ADDRESS")
        @SolanaAddress
        String programId,

        Commitment commitment
) {
}
