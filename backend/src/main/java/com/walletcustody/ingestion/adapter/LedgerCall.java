package com.walletcustody.ingestion.adapter;

import java.math.BigInteger;

/**
 * Call object for eth_estimateGas. {@code data} is 0x-prefixed hex or null.
 */
public record LedgerCall(String from, String to, BigInteger value, String data) {
}
