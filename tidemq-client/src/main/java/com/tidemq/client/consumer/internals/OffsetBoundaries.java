package com.tidemq.client.consumer.internals;

import com.tidemq.common.model.TopicPartition;

/**
 * Source of a partition's log boundaries, used to reset positions.
 */
public interface OffsetBoundaries {

    long beginningOffset(TopicPartition partition);

    long endOffset(TopicPartition partition);
}
