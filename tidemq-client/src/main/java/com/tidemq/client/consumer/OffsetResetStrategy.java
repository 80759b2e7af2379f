package com.tidemq.client.consumer;

import java.util.Locale;

/**
 * Where a partition without a usable position starts reading
 */
public enum OffsetResetStrategy {
    EARLIEST,
    LATEST,
    /** Fail instead of guessing. */
    NONE;

    /**
     * Parses the configuration value; the legacy names "smallest" and "largest" are accepted.
     */
    public static OffsetResetStrategy fromConfig(String value) {
        if (value == null) {
            return NONE;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "earliest":
            case "smallest":
                return EARLIEST;
            case "latest":
            case "largest":
                return LATEST;
            case "none":
            case "fail":
                return NONE;
            default:
                throw new IllegalArgumentException("Unknown offset reset strategy: " + value);
        }
    }
}
