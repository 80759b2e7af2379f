package com.tidemq.client.transport;

import com.tidemq.common.exception.TideTimeoutException;
import com.tidemq.common.model.TopicPartition;

import java.io.Closeable;
import java.util.Map;
import java.util.Set;

/**
 * Network side of the consumer. Every call is bounded by the timeout it is given
 * and fails with {@link TideTimeoutException} when it runs out.
 *
 * <p>Implementations must tolerate concurrent calls for different partitions.
 */
public interface BrokerTransport extends Closeable {

    /** List-offsets sentinel: oldest retained offset. */
    long EARLIEST_TIMESTAMP = -2L;

    /** List-offsets sentinel: one past the newest offset. */
    long LATEST_TIMESTAMP = -1L;

    /**
     * Read up to {@code maxBytes} of the partition's log starting at {@code offset}.
     */
    FetchResult fetch(TopicPartition partition, long offset, int maxBytes, long timeoutMs);

    /**
     * Store the given positions for the group. Either all are stored or the call fails.
     */
    void commit(String groupId, Map<TopicPartition, Long> offsets, long timeoutMs);

    /**
     * Committed positions of the group; partitions without a commit are absent from the result.
     */
    Map<TopicPartition, Long> fetchCommitted(String groupId, Set<TopicPartition> partitions, long timeoutMs);

    /**
     * Resolve each target timestamp (or {@link #EARLIEST_TIMESTAMP} / {@link #LATEST_TIMESTAMP}) to an offset.
     */
    Map<TopicPartition, ListOffsetsResult> listOffsets(Map<TopicPartition, Long> targets, long timeoutMs);

    /**
     * Whether the broker can search its log by message timestamp.
     */
    boolean supportsTimestampLookup();

    @Override
    void close();
}
