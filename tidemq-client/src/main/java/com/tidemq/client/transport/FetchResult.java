package com.tidemq.client.transport;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one partition fetch
 */
@Getter
@ToString(exclude = "records")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FetchResult {

    public enum Status {
        /** {@code records} holds a message set, possibly ending in a partial entry. */
        RECORDS,
        /** Fetch offset is the end of the log: no data yet. */
        EMPTY,
        /** The broker refused to return the next message because it exceeds maxBytes. */
        SIZE_TOO_SMALL,
        /** Fetch offset lies outside the retained log. */
        OFFSET_OUT_OF_RANGE
    }

    private final Status status;
    private final byte[] records;
    private final long highWaterMark;
    private final long logStartOffset;
    /** Size of the next message when the status is SIZE_TOO_SMALL, otherwise -1. */
    private final int requiredBytes;

    public static FetchResult records(byte[] records, long highWaterMark, long logStartOffset) {
        return new FetchResult(Status.RECORDS, records, highWaterMark, logStartOffset, -1);
    }

    public static FetchResult empty(long highWaterMark, long logStartOffset) {
        return new FetchResult(Status.EMPTY, new byte[0], highWaterMark, logStartOffset, -1);
    }

    public static FetchResult sizeTooSmall(int requiredBytes, long highWaterMark, long logStartOffset) {
        return new FetchResult(Status.SIZE_TOO_SMALL, new byte[0], highWaterMark, logStartOffset, requiredBytes);
    }

    public static FetchResult offsetOutOfRange(long highWaterMark, long logStartOffset) {
        return new FetchResult(Status.OFFSET_OUT_OF_RANGE, new byte[0], highWaterMark, logStartOffset, -1);
    }

    public int sizeInBytes() {
        return records.length;
    }
}
