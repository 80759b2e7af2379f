package com.tidemq.client.consumer;

import com.tidemq.common.model.Message;
import com.tidemq.common.model.OffsetAndTimestamp;
import com.tidemq.common.model.TopicPartition;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Consumer interface for receiving messages
 */
public interface Consumer extends Iterable<Message>, AutoCloseable {

    /**
     * Add partitions; each starts at the group's committed offset or the reset strategy's boundary
     */
    void assign(Collection<TopicPartition> partitions);

    /**
     * Add partitions starting at explicit offsets
     */
    void assign(Map<TopicPartition, Long> initialOffsets);

    /**
     * Remove partitions
     */
    void unassign(Collection<TopicPartition> partitions);

    Set<TopicPartition> assignment();

    /**
     * Poll for new messages
     */
    Map<TopicPartition, List<Message>> poll(long timeoutMs);

    /**
     * Next message, or null after consumer_timeout_ms without one
     */
    Message next();

    Message next(long timeoutMs);

    /**
     * Up to {@code count} messages, waiting at most {@code timeoutMs}
     */
    List<Message> getMessages(int count, long timeoutMs);

    /**
     * Commit offsets synchronously
     */
    void commitSync();

    /**
     * Commit offsets asynchronously
     */
    void commitAsync();

    /**
     * Seek to a specific offset
     */
    void seek(TopicPartition partition, long offset);

    /**
     * Move by {@code delta} relative to {@code origin}, spreading the delta over
     * the partitions (all assigned ones when empty)
     */
    void seek(long delta, SeekOrigin origin, Collection<TopicPartition> partitions);

    /**
     * Seek to beginning
     */
    void seekToBeginning(Collection<TopicPartition> partitions);

    /**
     * Seek to end
     */
    void seekToEnd(Collection<TopicPartition> partitions);

    long position(TopicPartition partition);

    Long committed(TopicPartition partition);

    /**
     * Messages between the current position and the end of the log
     */
    long pending(Collection<TopicPartition> partitions);

    Map<TopicPartition, OffsetAndTimestamp> offsetsForTimes(Map<TopicPartition, Long> timestamps);

    Map<TopicPartition, Long> beginningOffsets(Collection<TopicPartition> partitions);

    Map<TopicPartition, Long> endOffsets(Collection<TopicPartition> partitions);

    /**
     * Make a blocked poll return early. Safe to call from any thread.
     */
    void wakeup();

    /**
     * Close the consumer
     */
    @Override
    void close();
}
