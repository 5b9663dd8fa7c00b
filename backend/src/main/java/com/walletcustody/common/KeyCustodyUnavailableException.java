package com.walletcustody.common;

/**
 * Key custody service could not be reached or returned an unexpected error.
 */
public class KeyCustodyUnavailableException extends CustodyException {

    public KeyCustodyUnavailableException(String message) {
        super(ErrorCode.KEY_CUSTODY_UNAVAILABLE, false, message);
    }

    public KeyCustodyUnavailableException(String message, Throwable cause) {
        super(ErrorCode.KEY_CUSTODY_UNAVAILABLE, false, message, cause);
    }
}
