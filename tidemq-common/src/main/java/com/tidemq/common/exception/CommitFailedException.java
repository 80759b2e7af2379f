package com.tidemq.common.exception;

/**
 * Exception thrown when a synchronous offset commit is rejected or fails
 */
public class CommitFailedException extends TideMQException {

    public CommitFailedException(String message) {
        super(ErrorCode.OFFSET_COMMIT_FAILED, message);
    }

    public CommitFailedException(String message, Throwable cause) {
        super(ErrorCode.OFFSET_COMMIT_FAILED, message, cause);
    }
}
