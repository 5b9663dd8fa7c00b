package com.walletcustody.custody.signing;

import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;

/**
 * ABI call data for ERC20 methods.
 */
public final class Erc20Calls {

    /** transfer(address,uint256) selector. */
    static final String TRANSFER_SELECTOR = "a9059cbb";

    private Erc20Calls() {
    }

    public static byte[] transfer(String recipient, BigInteger amount) {
        String address = Eip1559Transaction.strip0x(recipient).toLowerCase();
        return Hex.decode(TRANSFER_SELECTOR + leftPad(address) + leftPad(amount.toString(16)));
    }

    private static String leftPad(String hex) {
        if (hex.length() > 64) {
            throw new IllegalArgumentException("ABI word overflow: " + hex);
        }
        return "0".repeat(64 - hex.length()) + hex;
    }
}
