package com.tidemq.client.consumer.internals;

import com.tidemq.client.consumer.OffsetResetStrategy;
import com.tidemq.client.transport.BrokerTransport;
import com.tidemq.client.transport.FetchResult;
import com.tidemq.common.codec.DecodedBatch;
import com.tidemq.common.codec.MessageDecoder;
import com.tidemq.common.exception.FetchSizeTooSmallException;
import com.tidemq.common.exception.OffsetOutOfRangeException;
import com.tidemq.common.exception.TideMQException;
import com.tidemq.common.model.TopicPartition;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Fetches and decodes one partition at a time, growing the fetch buffer when
 * the next message does not fit and resetting positions that fell out of the
 * broker's range.
 *
 * <p>The transport is called without holding any cursor monitor. A result is
 * only used if the cursor still has the epoch it had when the fetch started.
 */
@Slf4j
public class FetchBufferManager {

    private final BrokerTransport transport;
    private final MessageDecoder decoder;
    private final PartitionCursorTable table;
    private final OffsetBoundaries boundaries;
    private final PollCanceller canceller;
    private final Integer maxBufferSize;
    private final long requestTimeoutMs;
    private final boolean resetOnOutOfRange;
    private final OffsetResetStrategy resetStrategy;

    public FetchBufferManager(BrokerTransport transport, MessageDecoder decoder, PartitionCursorTable table,
                              OffsetBoundaries boundaries, PollCanceller canceller, Integer maxBufferSize,
                              long requestTimeoutMs, boolean resetOnOutOfRange,
                              OffsetResetStrategy resetStrategy) {
        this.transport = transport;
        this.decoder = decoder;
        this.table = table;
        this.boundaries = boundaries;
        this.canceller = canceller;
        this.maxBufferSize = maxBufferSize;
        this.requestTimeoutMs = requestTimeoutMs;
        this.resetOnOutOfRange = resetOnOutOfRange;
        this.resetStrategy = resetStrategy;
    }

    /**
     * Fetch the messages at {@code planned}.
     *
     * @return the batch with the epoch it was fetched under (a reset bumps it),
     * or empty if there is no data yet, the broker failed transiently, the cursor
     * moved or the poll was cancelled
     * @throws FetchSizeTooSmallException if the next message exceeds maxBufferSize
     * @throws OffsetOutOfRangeException  if the position is out of range and cannot be reset
     */
    public Optional<FetchedBatch> fetch(FetchPosition planned) {
        TopicPartition partition = planned.getPartition();
        long offset = planned.getOffset();
        long epoch = planned.getEpoch();
        BufferGrowth growth = BufferGrowth.start(planned.getBufferSize(), maxBufferSize);
        boolean resetAttempted = false;

        while (true) {
            if (canceller.isCancelled()) {
                log.debug("Fetch of {} cancelled", partition);
                return Optional.empty();
            }

            FetchResult result;
            try {
                result = transport.fetch(partition, offset, growth.size(), requestTimeoutMs);
            } catch (TideMQException e) {
                if (!e.getErrorCode().isRetriable()) {
                    throw e;
                }
                log.debug("Fetch of {} at offset {} failed with {}, retrying on the next poll: {}",
                        partition, offset, e.getErrorCode(), e.getMessage());
                return Optional.empty();
            }
            if (!table.isCurrent(partition, epoch)) {
                log.debug("Discarding fetch of {} at offset {}: partition moved or was revoked", partition, offset);
                return Optional.empty();
            }
            if (result.getHighWaterMark() >= 0) {
                table.updateHighWaterMark(partition, result.getHighWaterMark());
            }

            switch (result.getStatus()) {
                case EMPTY:
                    log.debug("No data for {} at offset {}", partition, offset);
                    return Optional.empty();

                case OFFSET_OUT_OF_RANGE:
                    if (resetAttempted || !resetOnOutOfRange || resetStrategy == OffsetResetStrategy.NONE) {
                        table.markFailed(partition, epoch);
                        throw new OffsetOutOfRangeException(partition, offset);
                    }
                    long resetOffset = resetStrategy == OffsetResetStrategy.EARLIEST
                            ? boundaries.beginningOffset(partition)
                            : boundaries.endOffset(partition);
                    epoch = table.resetIfCurrent(partition, epoch, resetOffset);
                    if (epoch < 0) {
                        return Optional.empty();
                    }
                    log.warn("Fetch offset {} is out of range for partition {}, resetting to {} offset {}",
                            offset, partition, resetStrategy, resetOffset);
                    offset = resetOffset;
                    resetAttempted = true;
                    continue;

                case SIZE_TOO_SMALL:
                    growth = grow(growth, partition, offset, result.getRequiredBytes());
                    continue;

                default:
                    DecodedBatch batch = decoder.decode(partition, result.getRecords(), offset);
                    if (batch.needsLargerBuffer()) {
                        growth = grow(growth, partition, offset, batch.getTruncatedEntrySize());
                        continue;
                    }
                    if (growth.isGrown()) {
                        table.setFetchBufferSize(partition, growth.size());
                    }
                    if (batch.isEmpty()) {
                        return Optional.empty();
                    }
                    log.debug("Fetched {} messages ({} bytes) from {} at offset {}",
                            batch.size(), batch.getValidBytes(), partition, offset);
                    return Optional.of(new FetchedBatch(batch, epoch));
            }
        }
    }

    private static BufferGrowth grow(BufferGrowth growth, TopicPartition partition, long offset, int requiredSize) {
        BufferGrowth next = growth.grow(partition, offset, requiredSize);
        log.info("Message at offset {} of {} does not fit {} bytes, retrying with {} bytes",
                offset, partition, growth.size(), next.size());
        return next;
    }
}
