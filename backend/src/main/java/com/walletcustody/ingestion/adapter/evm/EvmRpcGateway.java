package com.walletcustody.ingestion.adapter.evm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletcustody.common.LedgerUnavailableException;
import com.walletcustody.ingestion.config.LedgerRpcProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Rate-limited JSON-RPC invocation with result/error unwrapping. The ledger client and the token symbol
 * resolver share one instance and one permit budget.
 */
@Slf4j
@Component
public class EvmRpcGateway {

    private final LedgerRpcClient rpcClient;
    private final RateLimiter ledgerRpcRateLimiter;
    private final LedgerRpcProperties properties;
    private final ObjectMapper objectMapper;

    public EvmRpcGateway(
            LedgerRpcClient rpcClient,
            @Qualifier("ledgerRpcRateLimiter") RateLimiter ledgerRpcRateLimiter,
            LedgerRpcProperties properties,
            ObjectMapper objectMapper
    ) {
        this.rpcClient = rpcClient;
        this.ledgerRpcRateLimiter = ledgerRpcRateLimiter;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the {@code result} node; a JSON null result comes back as a NullNode.
     *
     * @throws LedgerUnavailableException on transport failure, malformed body or JSON-RPC error object
     */
    public JsonNode call(String method, Object params) {
        long acquireStart = System.nanoTime();
        boolean permitted = ledgerRpcRateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new LedgerUnavailableException("Local limiter timeout before " + method);
        }
        if (waitedMs >= Math.max(1L, properties.getLocalLimiterLogThresholdMs())) {
            log.info("Local ledger RPC limiter delayed {} ms before {}", waitedMs, method);
        }
        String json = rpcClient.call(method, params).block();
        if (json == null || json.isBlank()) {
            throw new LedgerUnavailableException("Empty response for " + method);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new LedgerUnavailableException("Malformed response for " + method, e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new LedgerUnavailableException(method + " returned error " + error.path("code").asText()
                    + ": " + error.path("message").asText(error.toString()));
        }
        return root.path("result");
    }

    static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    /** Parses a JSON-RPC hex quantity ("0x1a"). Null for absent or empty input. */
    static BigInteger parseQuantity(String hex) {
        if (hex == null || hex.isBlank() || "null".equals(hex)) return null;
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.isEmpty()) return BigInteger.ZERO;
        try {
            return new BigInteger(digits, 16);
        } catch (NumberFormatException e) {
            throw new LedgerUnavailableException("Not a hex quantity: " + hex, e);
        }
    }

    static String toQuantity(BigInteger value) {
        return "0x" + value.toString(16);
    }
}
