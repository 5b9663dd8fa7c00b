package com.walletcustody.domain;

import java.math.BigInteger;

/**
 * Transaction as returned by eth_getTransactionByHash. {@code to} is null for contract creation,
 * {@code blockNumber} is null while unmined.
 */
public record RawLedgerTransaction(String hash, String from, String to, BigInteger value, String input, Long blockNumber) {

    public boolean hasCallData() {
        return input != null && input.length() > 2;
    }

    public boolean isMined() {
        return blockNumber != null;
    }
}
