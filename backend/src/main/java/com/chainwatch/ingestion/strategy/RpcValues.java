package com.chainwatch.ingestion.strategy;

import com.chainwatch.domain.AccountSnapshot;
import com.chainwatch.domain.TransactionLog;
import com.chainwatch.watcher.SubscriptionItem;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON shapes shared by the Solana strategies. Parsers are total: anything malformed yields null.
 */
final class RpcValues {

    private RpcValues() {
    }

    /**
     * Notification result {context: {slot}, value} becomes an enveloped item; anything else is bare.
     */
    static SubscriptionItem<JsonNode> toItem(JsonNode result) {
        JsonNode slot = result.path("context").path("slot");
        if (slot.isIntegralNumber()) {
            return SubscriptionItem.enveloped(slot.asLong(), result.path("value"));
        }
        return SubscriptionItem.bare(result);
    }

    static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    static AccountSnapshot toAccountSnapshot(String address, JsonNode value) {
        if (isAbsent(value) || !value.isObject()) {
            return null;
        }
        JsonNode lamports = value.path("lamports");
        JsonNode owner = value.path("owner");
        if (!lamports.isIntegralNumber() || !owner.isTextual()) {
            return null;
        }
        JsonNode data = value.path("data");
        String dataBase64;
        if (data.isArray()) {
            if (data.size() > 1 && !"base64".equals(data.get(1).asText())) {
                return null;
            }
            dataBase64 = data.path(0).asText("");
        } else if (data.isTextual()) {
            dataBase64 = data.asText();
        } else {
            dataBase64 = "";
        }
        JsonNode rentEpoch = value.path("rentEpoch");
        return new AccountSnapshot(
                address,
                lamports.asLong(),
                owner.asText(),
                value.path("executable").asBoolean(false),
                rentEpoch.isNumber() ? rentEpoch.bigIntegerValue() : BigInteger.ZERO,
                value.path("space").asLong(0L),
                dataBase64);
    }

    static TransactionLog toTransactionLog(JsonNode value) {
        if (isAbsent(value) || !value.isObject()) {
            return null;
        }
        String signature = value.path("signature").asText(null);
        if (signature == null || signature.isBlank()) {
            return null;
        }
        return new TransactionLog(signature, errText(value.path("err")), lines(value.path("logs")));
    }

    static String errText(JsonNode err) {
        return isAbsent(err) ? null : err.toString();
    }

    static List<String> lines(JsonNode array) {
        List<String> lines = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(line -> lines.add(line.asText()));
        }
        return lines;
    }
}
