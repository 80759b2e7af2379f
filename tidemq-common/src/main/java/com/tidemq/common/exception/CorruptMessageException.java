package com.tidemq.common.exception;

/**
 * Thrown when a fetched message set fails validation or cannot be decompressed
 */
public class CorruptMessageException extends TideMQException {

    public CorruptMessageException(String message) {
        super(ErrorCode.CORRUPT_MESSAGE, message);
    }

    public CorruptMessageException(String message, Throwable cause) {
        super(ErrorCode.CORRUPT_MESSAGE, message, cause);
    }
}
