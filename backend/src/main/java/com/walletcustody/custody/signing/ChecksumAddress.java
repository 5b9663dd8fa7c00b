package com.walletcustody.custody.signing;

import com.walletcustody.common.EvmAddresses;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * EIP-55 mixed-case checksum encoding of a 20-byte address.
 */
public final class ChecksumAddress {

    private ChecksumAddress() {
    }

    /**
     * @throws IllegalArgumentException when {@code address} is not 0x followed by 40 hex digits
     */
    public static String of(String address) {
        if (!EvmAddresses.isValid(address)) {
            throw new IllegalArgumentException("Not an address: " + address);
        }
        String lower = address.trim().substring(2).toLowerCase(Locale.ROOT);
        String hash = Hex.toHexString(Keccak.keccak256(lower.getBytes(StandardCharsets.US_ASCII)));
        StringBuilder out = new StringBuilder("0x");
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            out.append(Character.digit(hash.charAt(i), 16) >= 8 ? Character.toUpperCase(c) : c);
        }
        return out.toString();
    }
}
