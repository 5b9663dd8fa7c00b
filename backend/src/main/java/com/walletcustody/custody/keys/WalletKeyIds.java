package com.walletcustody.custody.keys;

import com.walletcustody.custody.signing.ChecksumAddress;

/**
 * Key ids are the configured prefix followed by the wallet's EIP-55 checksummed address, so every spelling of an
 * address resolves to the same secret. Used for both reads and writes.
 */
public final class WalletKeyIds {

    private WalletKeyIds() {
    }

    public static String keyId(String prefix, String address) {
        return prefix + ChecksumAddress.of(address);
    }
}
