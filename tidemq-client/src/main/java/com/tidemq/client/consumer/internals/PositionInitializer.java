package com.tidemq.client.consumer.internals;

import com.tidemq.client.consumer.OffsetResetStrategy;
import com.tidemq.client.transport.BrokerTransport;
import com.tidemq.common.exception.PartitionNotAssignedException;
import com.tidemq.common.model.TopicPartition;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Gives partitions assigned without an offset their start position: the
 * group's committed offset, else the reset strategy's boundary.
 */
@Slf4j
public class PositionInitializer {

    private final PartitionCursorTable table;
    private final BrokerTransport transport;
    private final OffsetBoundaries boundaries;
    private final String groupId;
    private final OffsetResetStrategy resetStrategy;
    private final long requestTimeoutMs;

    public PositionInitializer(PartitionCursorTable table, BrokerTransport transport, OffsetBoundaries boundaries,
                               String groupId, OffsetResetStrategy resetStrategy, long requestTimeoutMs) {
        this.table = table;
        this.transport = transport;
        this.boundaries = boundaries;
        this.groupId = groupId;
        this.resetStrategy = resetStrategy;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public void initializeMissing() {
        Set<TopicPartition> awaiting = table.awaitingPosition();
        if (awaiting.isEmpty()) {
            return;
        }
        Map<TopicPartition, Long> committed = groupId == null
                ? Collections.emptyMap()
                : transport.fetchCommitted(groupId, awaiting, requestTimeoutMs);
        log.debug("Initializing positions of {} (committed: {})", awaiting, committed);

        for (TopicPartition partition : awaiting) {
            try {
                table.initializePosition(partition, committed.get(partition), resetStrategy, boundaries);
            } catch (PartitionNotAssignedException e) {
                log.debug("Partition {} was revoked while its position was initialized", partition);
            }
        }
    }

    /**
     * Position of the partition, initializing it first if needed.
     */
    public long positionOf(TopicPartition partition) {
        Long position = table.position(partition);
        if (position != null) {
            return position;
        }
        Long committed = groupId == null
                ? null
                : transport.fetchCommitted(groupId, Collections.singleton(partition), requestTimeoutMs).get(partition);
        return table.initializePosition(partition, committed, resetStrategy, boundaries);
    }
}
