package com.chainwatch.domain;

import java.util.List;

/**
 * Log messages of one transaction. {@code err} is the JSON error text, null when the transaction succeeded.
 */
public record TransactionLog(String signature, String err, List<String> logs) {

    public TransactionLog {
        logs = logs != null ? List.copyOf(logs) : List.of();
    }

    public boolean failed() {
        return err != null;
    }

    public boolean mentions(String address) {
        return address != null && logs.stream().anyMatch(line -> line.contains(address));
    }
}
