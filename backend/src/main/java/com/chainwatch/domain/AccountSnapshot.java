package com.chainwatch.domain;

import java.math.BigInteger;
import java.util.Base64;

/**
 * Account state at one slot, decoded from a base64-encoded RPC account.
 *
 * @param dataBase64 raw account data as returned by the RPC (base64)
 * @param rentEpoch  u64 on chain; may exceed Long.MAX_VALUE
 */
public record AccountSnapshot(
        String address,
        long lamports,
        String owner,
        boolean executable,
        BigInteger rentEpoch,
        long space,
        String dataBase64
) {

    public byte[] data() {
        if (dataBase64 == null || dataBase64.isEmpty()) {
            return new byte[0];
        }
        return Base64.getDecoder().decode(dataBase64);
    }
}
