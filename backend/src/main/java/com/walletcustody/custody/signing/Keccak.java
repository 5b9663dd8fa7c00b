package com.walletcustody.custody.signing;

import org.bouncycastle.crypto.digests.KeccakDigest;

/**
 * Keccak-256 as used by the ledger (original Keccak padding, not SHA3-256).
 */
public final class Keccak {

    private Keccak() {
    }

    public static byte[] keccak256(byte[] input) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}
