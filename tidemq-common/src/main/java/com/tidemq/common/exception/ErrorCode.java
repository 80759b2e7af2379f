package com.tidemq.common.exception;

/**
 * Error codes for categorizing consumer failures.
 * Error codes are organized by category:
 * - 1xxx: Client errors
 * - 2xxx: Fetch and offset errors
 * - 3xxx: Capability errors
 * - 4xxx: Network errors
 * - 5xxx: Group / commit errors
 */
public enum ErrorCode {

    // Client errors (1xxx)
    INVALID_REQUEST(1001, "Invalid request parameters"),
    INVALID_CONFIGURATION(1002, "Invalid consumer configuration"),
    PARTITION_NOT_ASSIGNED(1003, "Partition is not assigned to this consumer"),
    INVALID_OFFSET(1004, "Invalid offset value"),

    // Fetch and offset errors (2xxx)
    OFFSET_OUT_OF_RANGE(2001, "Requested offset is out of range"),
    OFFSET_RESET_REQUIRED(2002, "No committed offset and no reset policy configured"),
    FETCH_SIZE_TOO_SMALL(2003, "Message is larger than the maximum fetch buffer"),
    CORRUPT_MESSAGE(2004, "Fetched message set is corrupt"),
    UNKNOWN_TOPIC_OR_PARTITION(2005, "Topic or partition is not known to the broker"),
    LEADER_NOT_AVAILABLE(2006, "No leader available for partition"),

    // Capability errors (3xxx)
    UNSUPPORTED_CODEC(3001, "Compression codec is not available"),
    UNSUPPORTED_VERSION(3002, "Broker does not support the requested operation"),

    // Network errors (4xxx)
    REQUEST_TIMED_OUT(4001, "Request timed out"),
    NETWORK_ERROR(4002, "Network error while talking to the broker"),

    // Group / commit errors (5xxx)
    OFFSET_COMMIT_FAILED(5001, "Failed to commit consumer offsets"),

    UNKNOWN_ERROR(9999, "Unknown error occurred");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Retriable errors may succeed on a later attempt without caller action.
     */
    public boolean isRetriable() {
        return this == UNKNOWN_TOPIC_OR_PARTITION
                || this == LEADER_NOT_AVAILABLE
                || this == REQUEST_TIMED_OUT
                || this == NETWORK_ERROR;
    }

    public static ErrorCode fromCode(int code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code == code) {
                return errorCode;
            }
        }
        return UNKNOWN_ERROR;
    }
}
