package com.walletcustody.common;

/**
 * Amount is non-numeric, non-positive, negative or above the maximum supply.
 */
public class InvalidAmountException extends CustodyException {

    public InvalidAmountException(String message) {
        super(ErrorCode.INVALID_AMOUNT, true, message);
    }

    public InvalidAmountException(String message, Throwable cause) {
        super(ErrorCode.INVALID_AMOUNT, true, message, cause);
    }
}
