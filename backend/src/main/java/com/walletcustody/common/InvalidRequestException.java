package com.walletcustody.common;

/**
 * Request failed validation (malformed address or hash, missing field, paging out of range).
 */
public class InvalidRequestException extends CustodyException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, true, message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(ErrorCode.INVALID_REQUEST, true, message, cause);
    }
}
