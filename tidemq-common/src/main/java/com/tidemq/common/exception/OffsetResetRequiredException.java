package com.tidemq.common.exception;

import com.tidemq.common.model.TopicPartition;

/**
 * Thrown when a partition has no committed offset and the reset policy is "none"
 */
public class OffsetResetRequiredException extends TideMQException {

    private final TopicPartition partition;

    public OffsetResetRequiredException(TopicPartition partition) {
        super(ErrorCode.OFFSET_RESET_REQUIRED,
                "No committed offset for partition " + partition + " and auto offset reset is disabled");
        this.partition = partition;
    }

    public TopicPartition getPartition() {
        return partition;
    }
}
