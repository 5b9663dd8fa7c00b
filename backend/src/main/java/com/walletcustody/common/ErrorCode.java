package com.walletcustody.common;

/**
 * Stable error codes carried by {@link CustodyException}. The HTTP layer maps them to status codes.
 */
public enum ErrorCode {
    INVALID_AMOUNT,
    INVALID_REQUEST,
    INSUFFICIENT_BALANCE,
    KEY_NOT_FOUND,
    KEY_CUSTODY_UNAVAILABLE,
    LEDGER_UNAVAILABLE,
    TRANSACTION_NOT_FOUND
}
