package com.walletcustody.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of transaction hashes: trimmed, 0x-prefixed, 64 hex digits, lower case.
 */
public final class TransactionHashes {

    private static final Pattern HASH = Pattern.compile("^0x[0-9a-f]{64}$");

    private TransactionHashes() {
    }

    /**
     * @throws InvalidRequestException when the input is not a 32-byte hex hash
     */
    public static String normalize(String rawHash) {
        if (rawHash == null || rawHash.isBlank()) {
            throw new InvalidRequestException("Transaction hash is required");
        }
        String hash = rawHash.trim().toLowerCase(Locale.ROOT);
        if (!hash.startsWith("0x")) {
            hash = "0x" + hash;
        }
        if (!HASH.matcher(hash).matches()) {
            throw new InvalidRequestException("Invalid transaction hash: " + rawHash);
        }
        return hash;
    }
}
