package com.tidemq.client.consumer.internals;

import com.tidemq.client.transport.BrokerTransport;
import com.tidemq.client.transport.ListOffsetsResult;
import com.tidemq.common.exception.ErrorCode;
import com.tidemq.common.exception.TideMQException;
import com.tidemq.common.exception.TideTimeoutException;
import com.tidemq.common.exception.TransportException;
import com.tidemq.common.exception.UnsupportedVersionException;
import com.tidemq.common.model.OffsetAndTimestamp;
import com.tidemq.common.model.TopicPartition;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves timestamps and log boundaries to offsets. Never touches cursors.
 *
 * <p>Retriable errors (unknown partition, no leader, timeouts) are retried
 * every {@code retryBackoffMs} until {@code requestTimeoutMs} has passed or
 * the consumer is closed.
 */
@Slf4j
public class TimestampOffsetResolver implements OffsetBoundaries {

    private final BrokerTransport transport;
    private final PollCanceller canceller;
    private final long requestTimeoutMs;
    private final long retryBackoffMs;

    public TimestampOffsetResolver(BrokerTransport transport, PollCanceller canceller, long requestTimeoutMs,
                                   long retryBackoffMs) {
        this.transport = transport;
        this.canceller = canceller;
        this.requestTimeoutMs = requestTimeoutMs;
        this.retryBackoffMs = retryBackoffMs;
    }

    /**
     * For each partition, the earliest message whose timestamp is at or after the
     * target. A partition maps to null when no such message exists.
     *
     * @throws IllegalArgumentException    if a target timestamp is negative
     * @throws UnsupportedVersionException if the broker cannot search by timestamp
     * @throws TideTimeoutException        if the lookup does not finish within requestTimeoutMs
     */
    public Map<TopicPartition, OffsetAndTimestamp> offsetsForTimes(Map<TopicPartition, Long> timestamps) {
        if (timestamps.isEmpty()) {
            return Collections.emptyMap();
        }
        timestamps.forEach((partition, timestamp) -> {
            if (timestamp == null || timestamp < 0) {
                throw new IllegalArgumentException("The target time for partition " + partition
                        + " is " + timestamp + ". The target time cannot be negative.");
            }
        });
        if (!transport.supportsTimestampLookup()) {
            throw new UnsupportedVersionException("Broker does not support looking up offsets by timestamp");
        }

        Map<TopicPartition, OffsetAndTimestamp> result = new HashMap<>();
        listOffsets(timestamps, "offsets by times").forEach((partition, lookup) -> result.put(partition,
                lookup.getOffset() == null ? null : new OffsetAndTimestamp(lookup.getOffset(),
                        lookup.getTimestamp() == null ? -1L : lookup.getTimestamp())));
        return result;
    }

    public Map<TopicPartition, Long> beginningOffsets(Collection<TopicPartition> partitions) {
        return boundaryOffsets(partitions, BrokerTransport.EARLIEST_TIMESTAMP, "beginning offsets");
    }

    public Map<TopicPartition, Long> endOffsets(Collection<TopicPartition> partitions) {
        return boundaryOffsets(partitions, BrokerTransport.LATEST_TIMESTAMP, "end offsets");
    }

    @Override
    public long beginningOffset(TopicPartition partition) {
        return beginningOffsets(Collections.singleton(partition)).get(partition);
    }

    @Override
    public long endOffset(TopicPartition partition) {
        return endOffsets(Collections.singleton(partition)).get(partition);
    }

    private Map<TopicPartition, Long> boundaryOffsets(Collection<TopicPartition> partitions, long sentinel,
                                                      String what) {
        if (partitions.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<TopicPartition, Long> targets = new HashMap<>();
        for (TopicPartition partition : partitions) {
            targets.put(partition, sentinel);
        }

        Map<TopicPartition, Long> offsets = new HashMap<>();
        listOffsets(targets, what).forEach((partition, lookup) -> {
            if (lookup.getOffset() == null) {
                throw new TransportException(ErrorCode.UNKNOWN_ERROR,
                        "Broker returned no " + what + " for partition " + partition);
            }
            offsets.put(partition, lookup.getOffset());
        });
        return offsets;
    }

    private Map<TopicPartition, ListOffsetsResult> listOffsets(Map<TopicPartition, Long> targets, String what) {
        long deadline = System.currentTimeMillis() + requestTimeoutMs;
        Map<TopicPartition, Long> remaining = new HashMap<>(targets);
        Map<TopicPartition, ListOffsetsResult> resolved = new HashMap<>();
        ErrorCode lastError = null;

        while (true) {
            long timeLeft = deadline - System.currentTimeMillis();
            if (timeLeft <= 0) {
                break;
            }
            try {
                Map<TopicPartition, ListOffsetsResult> response = transport.listOffsets(remaining, timeLeft);
                for (Map.Entry<TopicPartition, Long> target : new HashMap<>(remaining).entrySet()) {
                    TopicPartition partition = target.getKey();
                    ListOffsetsResult lookup = response.get(partition);
                    if (lookup == null) {
                        lastError = ErrorCode.UNKNOWN_TOPIC_OR_PARTITION;
                    } else if (lookup.isError()) {
                        if (!lookup.getError().isRetriable()) {
                            throw new TransportException(lookup.getError(),
                                    "Failed to list " + what + " for partition " + partition + ": "
                                            + lookup.getError().getMessage());
                        }
                        lastError = lookup.getError();
                        log.debug("Retriable error {} listing {} for {}", lookup.getError(), what, partition);
                    } else {
                        resolved.put(partition, lookup);
                        remaining.remove(partition);
                    }
                }
            } catch (TideMQException e) {
                if (!e.getErrorCode().isRetriable()) {
                    throw e;
                }
                lastError = e.getErrorCode();
                log.debug("Retriable error listing {}: {}", what, e.getMessage());
            }

            if (remaining.isEmpty()) {
                return resolved;
            }
            long backoffMs = Math.min(retryBackoffMs, deadline - System.currentTimeMillis());
            if (backoffMs <= 0) {
                break;
            }
            if (canceller.awaitClose(backoffMs)) {
                throw new IllegalStateException("Consumer closed while listing " + what);
            }
        }

        throw new TideTimeoutException("Failed to get " + what + " for " + remaining.keySet()
                + " within " + requestTimeoutMs + "ms" + (lastError == null ? "" : ", last error: " + lastError));
    }
}
