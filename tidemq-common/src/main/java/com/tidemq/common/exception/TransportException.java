package com.tidemq.common.exception;

/**
 * Exception thrown when a broker call fails for a reason other than a timeout
 */
public class TransportException extends TideMQException {

    public TransportException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorCode.NETWORK_ERROR, message, cause);
    }
}
