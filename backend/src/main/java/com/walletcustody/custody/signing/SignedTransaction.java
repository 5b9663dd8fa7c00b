package com.walletcustody.custody.signing;

import java.math.BigInteger;

/**
 * Signed envelope ready for eth_sendRawTransaction. {@code hash} is keccak256 of {@code raw}.
 */
public record SignedTransaction(byte[] raw, String hash, int yParity, BigInteger r, BigInteger s) {
}
