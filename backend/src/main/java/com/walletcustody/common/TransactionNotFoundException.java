package com.walletcustody.common;

/**
 * Hash is unknown to the ledger or the store.
 */
public class TransactionNotFoundException extends CustodyException {

    public TransactionNotFoundException(String message) {
        super(ErrorCode.TRANSACTION_NOT_FOUND, true, message);
    }

    public TransactionNotFoundException(String message, Throwable cause) {
        super(ErrorCode.TRANSACTION_NOT_FOUND, true, message, cause);
    }
}
