package com.tidemq.common.exception;

import com.tidemq.common.model.TopicPartition;

/**
 * Thrown when a fetch position is outside the range of offsets the broker retains
 */
public class OffsetOutOfRangeException extends TideMQException {

    private final TopicPartition partition;
    private final long offset;

    public OffsetOutOfRangeException(TopicPartition partition, long offset) {
        super(ErrorCode.OFFSET_OUT_OF_RANGE,
                "Fetch position " + offset + " is out of range for partition " + partition);
        this.partition = partition;
        this.offset = offset;
    }

    public TopicPartition getPartition() {
        return partition;
    }

    public long getOffset() {
        return offset;
    }
}
