package com.walletcustody.domain;

/**
 * Forward-only: PENDING may become CONFIRMED, never the reverse.
 */
public enum TransactionStatus {
    PENDING,
    CONFIRMED;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static TransactionStatus fromDbValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
