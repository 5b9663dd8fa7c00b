package com.walletcustody.ingestion.adapter.evm;

import com.fasterxml.jackson.databind.JsonNode;
import com.walletcustody.config.CaffeineConfig;
import com.walletcustody.ingestion.adapter.LedgerClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves ERC20 symbol() via eth_call, cached per contract in tokenSymbolCache (TTL 24h).
 * Failed lookups return {@link LedgerClient#UNKNOWN_SYMBOL} and are not cached.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TokenSymbolResolver {

    /** ERC20 symbol() selector: keccak256("symbol()") first 4 bytes. */
    private static final String SYMBOL_SELECTOR = "0x95d89b41";
    private static final int ABI_WORD = 32;

    private final EvmRpcGateway rpcGateway;
    private final CacheManager cacheManager;

    public String resolve(String contractAddress) {
        if (contractAddress == null || contractAddress.isBlank()) return LedgerClient.UNKNOWN_SYMBOL;
        String key = contractAddress.toLowerCase(Locale.ROOT);
        Cache cache = cacheManager.getCache(CaffeineConfig.TOKEN_SYMBOL_CACHE);
        if (cache != null) {
            String cached = cache.get(key, String.class);
            if (cached != null) return cached;
        }
        String symbol = fetchSymbol(contractAddress);
        if (symbol.isEmpty()) {
            return LedgerClient.UNKNOWN_SYMBOL;
        }
        String normalized = symbol.toUpperCase(Locale.ROOT);
        if (cache != null) {
            cache.put(key, normalized);
        }
        return normalized;
    }

    private String fetchSymbol(String contractAddress) {
        List<Object> params = List.of(
                Map.of("to", contractAddress, "data", SYMBOL_SELECTOR),
                "latest"
        );
        try {
            JsonNode result = rpcGateway.call("eth_call", params);
            if (EvmRpcGateway.isAbsent(result)) return "";
            String hex = result.asText("");
            if (!hex.startsWith("0x")) return "";
            return decodeSymbolResult(hex);
        } catch (RuntimeException e) {
            log.warn("symbol() lookup failed for {}: {}", contractAddress, e.getMessage());
            return "";
        }
    }

    /** ABI string: dynamic (offset word, length word, bytes) or a zero-padded bytes32. */
    static String decodeSymbolResult(String hex) {
        byte[] payload;
        try {
            payload = Hex.decode(hex.startsWith("0x") ? hex.substring(2) : hex);
        } catch (DecoderException e) {
            log.debug("Undecodable symbol() result {}", hex);
            return "";
        }
        if (payload.length < ABI_WORD) return "";
        if (payload.length >= 2 * ABI_WORD && BigInteger.valueOf(ABI_WORD).equals(word(payload, 0))) {
            BigInteger length = word(payload, 1);
            if (length.signum() <= 0 || length.compareTo(BigInteger.valueOf(payload.length - 2L * ABI_WORD)) > 0) {
                return "";
            }
            return new String(payload, 2 * ABI_WORD, length.intValueExact(), StandardCharsets.UTF_8).trim();
        }
        int end = 0;
        while (end < ABI_WORD && payload[end] != 0) end++;
        return new String(payload, 0, end, StandardCharsets.UTF_8).trim();
    }

    private static BigInteger word(byte[] payload, int index) {
        return new BigInteger(1, Arrays.copyOfRange(payload, index * ABI_WORD, (index + 1) * ABI_WORD));
    }
}
