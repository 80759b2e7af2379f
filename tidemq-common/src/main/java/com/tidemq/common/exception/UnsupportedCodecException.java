package com.tidemq.common.exception;

/**
 * Thrown when a message set uses a compression codec whose library is not available
 */
public class UnsupportedCodecException extends TideMQException {

    public UnsupportedCodecException(String message) {
        super(ErrorCode.UNSUPPORTED_CODEC, message);
    }
}
