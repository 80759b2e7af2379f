package com.tidemq.client.consumer.internals;

import com.tidemq.common.model.TopicPartition;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Where and how much to fetch for one partition, captured together with the
 * cursor epoch so a stale result can be recognised.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class FetchPosition {
    private final TopicPartition partition;
    private final long offset;
    private final int bufferSize;
    private final long epoch;
}
