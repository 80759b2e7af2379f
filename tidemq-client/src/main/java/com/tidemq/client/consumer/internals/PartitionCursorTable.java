package com.tidemq.client.consumer.internals;

import com.tidemq.client.consumer.OffsetResetStrategy;
import com.tidemq.common.exception.OffsetResetRequiredException;
import com.tidemq.common.exception.PartitionNotAssignedException;
import com.tidemq.common.model.TopicPartition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Positions of every assigned partition.
 *
 * <p>Assignment changes and seeks may arrive from any thread while the
 * consumption thread polls. Each cursor is updated under its own monitor and no
 * method holds a monitor while calling out to the network.
 */
@Slf4j
public class PartitionCursorTable {

    private final Map<TopicPartition, PartitionCursor> cursors = new ConcurrentHashMap<>();
    private final int initialFetchBufferSize;
    private final AtomicLong epochs = new AtomicLong();

    public PartitionCursorTable(int initialFetchBufferSize) {
        this.initialFetchBufferSize = initialFetchBufferSize;
    }

    /**
     * @throws PartitionNotAssignedException if the partition is not assigned
     */
    public PartitionCursor get(TopicPartition partition) {
        PartitionCursor cursor = cursors.get(partition);
        if (cursor == null) {
            throw new PartitionNotAssignedException(partition);
        }
        return cursor;
    }

    public boolean isAssigned(TopicPartition partition) {
        return cursors.containsKey(partition);
    }

    /**
     * Track a newly assigned partition. Its start offset is decided later by
     * {@link #initializePosition}. Re-assigning a tracked partition keeps its cursor.
     */
    public void onAssign(TopicPartition partition) {
        PartitionCursor previous = cursors.putIfAbsent(partition,
                newCursor(partition));
        if (previous == null) {
            log.info("Assigned partition {}", partition);
        } else {
            log.debug("Partition {} already assigned, keeping position {}", partition, previous.position());
        }
    }

    /**
     * Track a newly assigned partition starting at {@code initialOffset}.
     */
    public void onAssign(TopicPartition partition, long initialOffset) {
        requireValidOffset(initialOffset);
        PartitionCursor cursor = cursors.computeIfAbsent(partition,
                this::newCursor);
        cursor.seek(initialOffset);
        log.info("Assigned partition {} at offset {}", partition, initialOffset);
    }

    private PartitionCursor newCursor(TopicPartition partition) {
        return new PartitionCursor(partition, initialFetchBufferSize, epochs::incrementAndGet);
    }

    public void onRevoke(TopicPartition partition) {
        if (cursors.remove(partition) != null) {
            log.info("Revoked partition {}", partition);
        }
    }

    public void setFetchOffset(TopicPartition partition, long offset) {
        requireValidOffset(offset);
        get(partition).setFetchOffset(offset);
    }

    /**
     * Record {@code newLastReturnedOffset} as handed to the application.
     */
    public void advance(TopicPartition partition, long newLastReturnedOffset) {
        get(partition).advance(newLastReturnedOffset);
    }

    /**
     * Advance only if the cursor was not repositioned since {@code expectedEpoch}.
     *
     * @return false when the partition was revoked or repositioned
     */
    public boolean advance(TopicPartition partition, long expectedEpoch, long newLastReturnedOffset) {
        PartitionCursor cursor = cursors.get(partition);
        return cursor != null && cursor.advance(expectedEpoch, newLastReturnedOffset);
    }

    /**
     * Reposition the partition. Data buffered for the old position is dropped
     * and a failed partition becomes fetchable again.
     *
     * @return the new epoch
     */
    public long seek(TopicPartition partition, long offset) {
        requireValidOffset(offset);
        long epoch = get(partition).seek(offset);
        log.info("Seeking partition {} to offset {}", partition, offset);
        return epoch;
    }

    /**
     * Reposition the partition only if nothing else moved it since {@code expectedEpoch}.
     *
     * @return the new epoch, or -1 if the cursor changed or is gone
     */
    public long resetIfCurrent(TopicPartition partition, long expectedEpoch, long offset) {
        PartitionCursor cursor = cursors.get(partition);
        if (cursor == null) {
            return -1L;
        }
        synchronized (cursor) {
            if (cursor.getEpoch() != expectedEpoch) {
                return -1L;
            }
            return cursor.seek(offset);
        }
    }

    public boolean isCurrent(TopicPartition partition, long epoch) {
        PartitionCursor cursor = cursors.get(partition);
        return cursor != null && cursor.getEpoch() == epoch;
    }

    /**
     * Positions that differ from the last committed offset. Each entry is read
     * atomically, so a concurrent advance is either fully in or fully out.
     */
    public Map<TopicPartition, Long> snapshotCommittable() {
        Map<TopicPartition, Long> snapshot = new HashMap<>();
        for (PartitionCursor cursor : cursors.values()) {
            synchronized (cursor) {
                Long position = cursor.position();
                if (position != null && !position.equals(cursor.getCommittedOffset())) {
                    snapshot.put(cursor.getPartition(), position);
                }
            }
        }
        return snapshot;
    }

    /**
     * Apply an acknowledged commit. Partitions revoked in the meantime are ignored.
     */
    public void markCommitted(Map<TopicPartition, Long> committed) {
        committed.forEach((partition, offset) -> {
            PartitionCursor cursor = cursors.get(partition);
            if (cursor != null) {
                cursor.markCommitted(offset);
            }
        });
    }

    /**
     * Give an awaiting partition its start offset: the committed offset when one
     * exists, otherwise the boundary chosen by {@code resetStrategy}.
     *
     * @return the partition's position after the call
     * @throws OffsetResetRequiredException if there is no commit and the strategy is NONE
     */
    public long initializePosition(TopicPartition partition, Long committedOffset,
                                   OffsetResetStrategy resetStrategy, OffsetBoundaries boundaries) {
        PartitionCursor cursor = get(partition);
        long epoch;
        synchronized (cursor) {
            if (cursor.getState() != PartitionCursor.State.AWAITING_POSITION) {
                return cursor.getFetchOffset();
            }
            epoch = cursor.getEpoch();
        }

        long offset;
        if (committedOffset != null) {
            offset = committedOffset;
        } else {
            switch (resetStrategy) {
                case EARLIEST:
                    offset = boundaries.beginningOffset(partition);
                    break;
                case LATEST:
                    offset = boundaries.endOffset(partition);
                    break;
                default:
                    throw new OffsetResetRequiredException(partition);
            }
        }

        if (cursor.initialize(epoch, offset, committedOffset)) {
            if (committedOffset != null) {
                log.info("Partition {} resumes from committed offset {}", partition, offset);
            } else {
                log.info("Partition {} has no committed offset, reset to {} offset {}",
                        partition, resetStrategy, offset);
            }
        }
        return cursor.getFetchOffset();
    }

    public SortedSet<TopicPartition> assignedPartitions() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(cursors.keySet()));
    }

    public Set<TopicPartition> awaitingPosition() {
        Set<TopicPartition> awaiting = new TreeSet<>();
        for (PartitionCursor cursor : cursors.values()) {
            if (cursor.getState() == PartitionCursor.State.AWAITING_POSITION) {
                awaiting.add(cursor.getPartition());
            }
        }
        return awaiting;
    }

    /**
     * Next offset to consume, or null while the partition awaits a position.
     */
    public Long position(TopicPartition partition) {
        return get(partition).position();
    }

    public Long committed(TopicPartition partition) {
        return get(partition).getCommittedOffset();
    }

    /**
     * Stop fetching the partition until it is sought, if it was not moved since {@code expectedEpoch}.
     */
    public void markFailed(TopicPartition partition, long expectedEpoch) {
        PartitionCursor cursor = cursors.get(partition);
        if (cursor != null && cursor.markFailed(expectedEpoch)) {
            log.error("Partition {} marked failed at offset {}", partition, cursor.getFetchOffset());
        }
    }

    public void updateHighWaterMark(TopicPartition partition, long highWaterMark) {
        PartitionCursor cursor = cursors.get(partition);
        if (cursor != null) {
            cursor.setHighWaterMark(highWaterMark);
        }
    }

    public void setFetchBufferSize(TopicPartition partition, int size) {
        PartitionCursor cursor = cursors.get(partition);
        if (cursor != null) {
            cursor.setFetchBufferSize(size);
        }
    }

    /**
     * Fetch positions of every fetchable partition not in {@code exclusions}, in partition order.
     */
    public List<FetchPosition> fetchPlan(Collection<TopicPartition> exclusions) {
        List<FetchPosition> plan = new ArrayList<>();
        for (TopicPartition partition : assignedPartitions()) {
            if (exclusions.contains(partition)) {
                continue;
            }
            PartitionCursor cursor = cursors.get(partition);
            if (cursor == null) {
                continue;
            }
            synchronized (cursor) {
                if (cursor.getState() == PartitionCursor.State.FETCHING) {
                    plan.add(cursor.fetchPosition());
                }
            }
        }
        return plan;
    }

    public void clear() {
        cursors.clear();
    }

    private static void requireValidOffset(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must be >= 0, got " + offset);
        }
    }
}
