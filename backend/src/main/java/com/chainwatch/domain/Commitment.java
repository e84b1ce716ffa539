package com.chainwatch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Solana commitment level, sent as the lowercase name in RPC configs.
 */
public enum Commitment {
    PROCESSED,
    CONFIRMED,
    FINALIZED;

    @JsonValue
    public String rpcValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive; null stays null so callers can apply their default.
     *
     * @throws IllegalArgumentException for unknown levels
     */
    @JsonCreator
    public static Commitment fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return Commitment.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
