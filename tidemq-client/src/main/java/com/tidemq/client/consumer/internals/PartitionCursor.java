package com.tidemq.client.consumer.internals;

import com.tidemq.common.model.TopicPartition;

import java.util.function.LongSupplier;

/**
 * Consumption state of one assigned partition.
 *
 * <p>All access goes through the cursor's own monitor. Mutators are package
 * private: only {@link PartitionCursorTable} changes a cursor.
 */
public class PartitionCursor {

    public enum State {
        /** Assigned without a known start offset. */
        AWAITING_POSITION,
        FETCHING,
        /** Stopped after an unrecoverable fetch error; cleared by a seek. */
        FAILED
    }

    private final TopicPartition partition;
    // Shared by every cursor of a table, so a re-assigned partition never reuses an epoch
    private final LongSupplier epochs;

    // Next offset to fetch, which is also the next offset handed to the application
    private long fetchOffset = -1L;
    private Long lastReturnedOffset;
    private Long committedOffset;
    private int fetchBufferSize;
    private Long highWaterMark;
    private long epoch;
    private State state = State.AWAITING_POSITION;

    PartitionCursor(TopicPartition partition, int fetchBufferSize, LongSupplier epochs) {
        this.partition = partition;
        this.fetchBufferSize = fetchBufferSize;
        this.epochs = epochs;
        this.epoch = epochs.getAsLong();
    }

    public TopicPartition getPartition() {
        return partition;
    }

    public synchronized long getFetchOffset() {
        return fetchOffset;
    }

    public synchronized Long getLastReturnedOffset() {
        return lastReturnedOffset;
    }

    public synchronized Long getCommittedOffset() {
        return committedOffset;
    }

    public synchronized int getFetchBufferSize() {
        return fetchBufferSize;
    }

    public synchronized Long getHighWaterMark() {
        return highWaterMark;
    }

    public synchronized long getEpoch() {
        return epoch;
    }

    public synchronized State getState() {
        return state;
    }

    /**
     * Offset of the next message to consume, or null while awaiting a position.
     */
    public synchronized Long position() {
        return state == State.AWAITING_POSITION ? null : fetchOffset;
    }

    synchronized FetchPosition fetchPosition() {
        return new FetchPosition(partition, fetchOffset, fetchBufferSize, epoch);
    }

    synchronized void setFetchOffset(long offset) {
        this.fetchOffset = offset;
        if (state == State.AWAITING_POSITION) {
            state = State.FETCHING;
        }
    }

    synchronized boolean advance(long expectedEpoch, long newLastReturnedOffset) {
        if (expectedEpoch != epoch || state != State.FETCHING) {
            return false;
        }
        lastReturnedOffset = newLastReturnedOffset;
        fetchOffset = newLastReturnedOffset + 1;
        return true;
    }

    synchronized void advance(long newLastReturnedOffset) {
        lastReturnedOffset = newLastReturnedOffset;
        fetchOffset = newLastReturnedOffset + 1;
    }

    synchronized long seek(long offset) {
        fetchOffset = offset;
        lastReturnedOffset = null;
        state = State.FETCHING;
        epoch = epochs.getAsLong();
        return epoch;
    }

    synchronized boolean initialize(long expectedEpoch, long offset, Long committed) {
        if (state != State.AWAITING_POSITION || expectedEpoch != epoch) {
            return false;
        }
        fetchOffset = offset;
        committedOffset = committed;
        state = State.FETCHING;
        return true;
    }

    synchronized boolean markFailed(long expectedEpoch) {
        if (expectedEpoch != epoch) {
            return false;
        }
        state = State.FAILED;
        return true;
    }

    synchronized void markCommitted(long offset) {
        committedOffset = offset;
    }

    synchronized void setFetchBufferSize(int size) {
        fetchBufferSize = size;
    }

    synchronized void setHighWaterMark(long highWaterMark) {
        this.highWaterMark = highWaterMark;
    }

    @Override
    public synchronized String toString() {
        return "PartitionCursor(" + partition
                + ", fetchOffset=" + fetchOffset
                + ", lastReturned=" + lastReturnedOffset
                + ", committed=" + committedOffset
                + ", bufferSize=" + fetchBufferSize
                + ", hwm=" + highWaterMark
                + ", epoch=" + epoch
                + ", state=" + state + ")";
    }
}
