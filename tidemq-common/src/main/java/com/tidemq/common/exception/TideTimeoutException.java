package com.tidemq.common.exception;

/**
 * Thrown when a broker request or a bounded wait runs out of time
 */
public class TideTimeoutException extends TideMQException {

    public TideTimeoutException(String message) {
        super(ErrorCode.REQUEST_TIMED_OUT, message);
    }

    public TideTimeoutException(String message, Throwable cause) {
        super(ErrorCode.REQUEST_TIMED_OUT, message, cause);
    }
}
