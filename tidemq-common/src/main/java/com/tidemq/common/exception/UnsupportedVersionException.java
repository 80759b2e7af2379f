package com.tidemq.common.exception;

/**
 * Thrown when the broker does not support an operation the consumer needs
 */
public class UnsupportedVersionException extends TideMQException {

    public UnsupportedVersionException(String message) {
        super(ErrorCode.UNSUPPORTED_VERSION, message);
    }
}
