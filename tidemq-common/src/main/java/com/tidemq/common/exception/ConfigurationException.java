package com.tidemq.common.exception;

/**
 * Exception thrown when a consumer configuration value is missing or invalid
 */
public class ConfigurationException extends TideMQException {

    public ConfigurationException(String message) {
        super(ErrorCode.INVALID_CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.INVALID_CONFIGURATION, message, cause);
    }
}
