package com.walletcustody.domain;

import java.math.BigInteger;

/**
 * One value movement inside a ledger transaction: the native value itself or a decoded ERC20 Transfer log.
 */
public record Transfer(TransferAsset asset, String from, String to, BigInteger value) {

    public static Transfer nativeTransfer(String from, String to, BigInteger value) {
        return new Transfer(TransferAsset.NATIVE, from, to, value);
    }

    public static Transfer tokenTransfer(String from, String to, BigInteger value) {
        return new Transfer(TransferAsset.TOKEN, from, to, value);
    }

    public boolean isFrom(String address) {
        return address != null && address.equalsIgnoreCase(from);
    }

    public boolean isTo(String address) {
        return address != null && address.equalsIgnoreCase(to);
    }
}
