package com.tidemq.client.transport;

import com.tidemq.common.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Per-partition answer of a list-offsets call. A successful lookup with no
 * matching message has a null offset.
 */
@Data
@AllArgsConstructor
public class ListOffsetsResult {
    private final ErrorCode error;
    private final Long offset;
    private final Long timestamp;

    public static ListOffsetsResult found(long offset, long timestamp) {
        return new ListOffsetsResult(null, offset, timestamp);
    }

    public static ListOffsetsResult notFound() {
        return new ListOffsetsResult(null, null, null);
    }

    public static ListOffsetsResult failed(ErrorCode error) {
        return new ListOffsetsResult(error, null, null);
    }

    public boolean isError() {
        return error != null;
    }
}
