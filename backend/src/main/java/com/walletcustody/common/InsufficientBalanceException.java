package com.walletcustody.common;

/**
 * Native balance does not cover value plus fees.
 */
public class InsufficientBalanceException extends CustodyException {

    public InsufficientBalanceException(String message) {
        super(ErrorCode.INSUFFICIENT_BALANCE, true, message);
    }

    public InsufficientBalanceException(String message, Throwable cause) {
        super(ErrorCode.INSUFFICIENT_BALANCE, true, message, cause);
    }
}
