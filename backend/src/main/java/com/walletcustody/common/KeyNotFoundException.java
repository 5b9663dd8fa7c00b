package com.walletcustody.common;

/**
 * No signing key is stored for the requested key id.
 */
public class KeyNotFoundException extends CustodyException {

    public KeyNotFoundException(String message) {
        super(ErrorCode.KEY_NOT_FOUND, true, message);
    }

    public KeyNotFoundException(String message, Throwable cause) {
        super(ErrorCode.KEY_NOT_FOUND, true, message, cause);
    }
}
