package com.tidemq.client.consumer;

/**
 * Reference point of a relative seek
 */
public enum SeekOrigin {
    BEGINNING,
    CURRENT,
    END
}
