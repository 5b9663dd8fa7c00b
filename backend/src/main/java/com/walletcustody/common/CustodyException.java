package com.walletcustody.common;

/**
 * Base of all failures raised by the custody core. {@link #isClientError()} tells callers whether the
 * request itself was wrong (correctable by the caller) or a dependency failed.
 */
public abstract class CustodyException extends RuntimeException {

    private final ErrorCode errorCode;
    private final boolean clientError;

    protected CustodyException(ErrorCode errorCode, boolean clientError, String message) {
        super(message);
        this.errorCode = errorCode;
        this.clientError = clientError;
    }

    protected CustodyException(ErrorCode errorCode, boolean clientError, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.clientError = clientError;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isClientError() {
        return clientError;
    }
}
