package com.walletcustody.domain;

/**
 * Direction relative to custodied wallets. Internal transfers (both ends custodied) are stored as WITHDRAW.
 */
public enum TransactionType {
    DEPOSIT,
    WITHDRAW,
    UNKNOWN;

    public String dbValue() {
        return name().toLowerCase();
    }

    public static TransactionType fromDbValue(String value) {
        return value == null ? UNKNOWN : valueOf(value.toUpperCase());
    }
}
