package com.tidemq.common.exception;

import com.tidemq.common.model.TopicPartition;

/**
 * Exception thrown when an operation names a partition this consumer does not own
 */
public class PartitionNotAssignedException extends TideMQException {

    public PartitionNotAssignedException(TopicPartition partition) {
        super(ErrorCode.PARTITION_NOT_ASSIGNED, "Partition not assigned: " + partition);
    }
}
