package com.walletcustody.common;

/**
 * Ledger node call failed (transport, timeout or JSON-RPC error object).
 */
public class LedgerUnavailableException extends CustodyException {

    public LedgerUnavailableException(String message) {
        super(ErrorCode.LEDGER_UNAVAILABLE, false, message);
    }

    public LedgerUnavailableException(String message, Throwable cause) {
        super(ErrorCode.LEDGER_UNAVAILABLE, false, message, cause);
    }
}
