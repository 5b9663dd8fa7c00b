package com.walletcustody.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.walletcustody.domain.Transfer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decodes ERC20 Transfer(address,address,uint256) logs from a receipt's {@code logs} array.
 * topic1 = sender, topic2 = recipient (low 20 bytes), data = big-endian uint256 value.
 */
@Slf4j
@Component
public class TransferEventDecoder {

    private static final Pattern HEX_ADDRESS = Pattern.compile("[0-9a-fA-F]{40}");

    public static final String TRANSFER_TOPIC = "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef";

    public List<Transfer> decode(JsonNode logs) {
        List<Transfer> transfers = new ArrayList<>();
        if (logs == null || !logs.isArray()) {
            return transfers;
        }
        for (JsonNode logNode : logs) {
            Transfer transfer = decodeLog(logNode);
            if (transfer != null) {
                transfers.add(transfer);
            }
        }
        return transfers;
    }

    /** Null for non-Transfer or malformed logs. */
    Transfer decodeLog(JsonNode logNode) {
        JsonNode topics = logNode.path("topics");
        if (!topics.isArray() || topics.size() < 3) {
            return null;
        }
        if (!TRANSFER_TOPIC.equalsIgnoreCase(topics.get(0).asText())) {
            return null;
        }
        String from = topicToAddress(topics.get(1).asText());
        String to = topicToAddress(topics.get(2).asText());
        BigInteger value = parseAmount(logNode.path("data").asText(""));
        if (from == null || to == null || value == null) {
            log.debug("Skipping malformed Transfer log at index {}", logNode.path("logIndex").asText("?"));
            return null;
        }
        return Transfer.tokenTransfer(from, to, value);
    }

    /** Null unless the low 20 bytes are hex. */
    private static String topicToAddress(String topic) {
        if (topic == null || topic.length() < 40) return null;
        String low = topic.substring(topic.length() - 40);
        if (!HEX_ADDRESS.matcher(low).matches()) return null;
        return "0x" + low.toLowerCase(Locale.ROOT);
    }

    /** "0x" alone is zero. */
    private static BigInteger parseAmount(String data) {
        if (data == null || !data.startsWith("0x")) return null;
        String hex = data.substring(2);
        if (hex.isEmpty()) return BigInteger.ZERO;
        try {
            BigInteger value = new BigInteger(hex, 16);
            return value.signum() < 0 ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
