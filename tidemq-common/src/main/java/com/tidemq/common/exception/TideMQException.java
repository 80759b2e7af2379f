package com.tidemq.common.exception;

/**
 * Base exception for all TideMQ client errors.
 * All custom exceptions extend this base class.
 */
public class TideMQException extends RuntimeException {

    private final ErrorCode errorCode;

    public TideMQException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public TideMQException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TideMQException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getCode() {
        return errorCode.getCode();
    }
}
