package com.tidemq.common.exception;

import com.tidemq.common.model.TopicPartition;

/**
 * Thrown when the next message of a partition does not fit the largest fetch
 * buffer the consumer is allowed to use. The caller has to raise the cap or
 * seek past the message.
 */
public class FetchSizeTooSmallException extends TideMQException {

    private final TopicPartition partition;
    private final long offset;
    private final int requiredSize;
    private final int maxBufferSize;

    public FetchSizeTooSmallException(TopicPartition partition, long offset, int requiredSize, int maxBufferSize) {
        super(ErrorCode.FETCH_SIZE_TOO_SMALL, String.format(
                "Message at offset %d of %s needs %s bytes but the fetch buffer is capped at %d bytes",
                offset, partition, requiredSize > 0 ? String.valueOf(requiredSize) : "more than " + maxBufferSize,
                maxBufferSize));
        this.partition = partition;
        this.offset = offset;
        this.requiredSize = requiredSize;
        this.maxBufferSize = maxBufferSize;
    }

    public TopicPartition getPartition() {
        return partition;
    }

    public long getOffset() {
        return offset;
    }

    /**
     * Size of the oversized message in bytes, or -1 if the broker did not return enough to tell.
     */
    public int getRequiredSize() {
        return requiredSize;
    }

    public int getMaxBufferSize() {
        return maxBufferSize;
    }
}
