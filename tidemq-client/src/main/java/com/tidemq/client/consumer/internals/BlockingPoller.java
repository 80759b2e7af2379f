package com.tidemq.client.consumer.internals;

import com.tidemq.common.model.Message;
import com.tidemq.common.model.TopicPartition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntConsumer;

/**
 * Turns fetches into blocking reads.
 *
 * <p>Messages already fetched for a partition are handed out before that
 * partition is fetched again. Each fetch round starts one partition further
 * along so no partition is starved, and stops issuing fetches once
 * {@code fetchMaxBytes} have arrived. A buffered batch whose cursor was moved
 * (seek, revoke, reassign) is dropped instead of returned.
 *
 * <p>Not thread safe: only the consumption thread calls it. Other threads
 * interrupt a wait through the {@link PollCanceller}.
 */
@Slf4j
public class BlockingPoller {

    private final PartitionCursorTable table;
    private final FetchBufferManager fetcher;
    private final PositionInitializer positionInitializer;
    private final PollCanceller canceller;
    private final IntConsumer consumptionListener;
    private final int maxPollRecords;
    private final int fetchMaxBytes;
    private final long retryBackoffMs;

    // Fetched but not yet returned, in drain order
    private final LinkedHashMap<TopicPartition, Buffered> buffered = new LinkedHashMap<>();
    private int nextRoundStart = 0;

    public BlockingPoller(PartitionCursorTable table, FetchBufferManager fetcher,
                          PositionInitializer positionInitializer, PollCanceller canceller,
                          IntConsumer consumptionListener, int maxPollRecords, int fetchMaxBytes,
                          long retryBackoffMs) {
        this.table = table;
        this.fetcher = fetcher;
        this.positionInitializer = positionInitializer;
        this.canceller = canceller;
        this.consumptionListener = consumptionListener;
        this.maxPollRecords = maxPollRecords;
        this.fetchMaxBytes = fetchMaxBytes;
        this.retryBackoffMs = retryBackoffMs;
    }

    /**
     * Wait up to {@code timeoutMs} for messages.
     *
     * @return at most maxPollRecords messages grouped by partition; empty on
     * timeout, wakeup or close
     */
    public Map<TopicPartition, List<Message>> poll(long timeoutMs) {
        Map<TopicPartition, List<Message>> records = poll(timeoutMs, maxPollRecords);
        return records == null ? Collections.emptyMap() : records;
    }

    /**
     * Next message, or null if none arrived within {@code timeoutMs}.
     */
    public Message next(long timeoutMs) {
        Map<TopicPartition, List<Message>> records = poll(timeoutMs, 1);
        if (records == null) {
            return null;
        }
        for (List<Message> messages : records.values()) {
            if (!messages.isEmpty()) {
                return messages.get(0);
            }
        }
        return null;
    }

    /**
     * Wait until {@code count} messages arrived or {@code timeoutMs} passed.
     */
    public List<Message> getMessages(int count, long timeoutMs) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive, got " + count);
        }
        List<Message> messages = new ArrayList<>(count);
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (messages.size() < count) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            int wanted = Math.min(count - messages.size(), maxPollRecords);
            Map<TopicPartition, List<Message>> records = poll(remaining, wanted);
            if (records == null) {
                break;
            }
            records.values().forEach(messages::addAll);
        }
        return messages;
    }

    /**
     * @return the drained messages, empty on timeout, or null if woken up or closed
     */
    private Map<TopicPartition, List<Message>> poll(long timeoutMs, int maxRecords) {
        long deadline = System.currentTimeMillis() + Math.max(0L, timeoutMs);
        while (true) {
            Map<TopicPartition, List<Message>> drained = drain(maxRecords);
            if (!drained.isEmpty()) {
                return drained;
            }
            if (canceller.isCancelled()) {
                canceller.clearWakeup();
                log.debug("Poll cancelled");
                return null;
            }

            positionInitializer.initializeMissing();
            fetchRound();
            if (!buffered.isEmpty()) {
                continue;
            }

            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return Collections.emptyMap();
            }
            canceller.await(Math.min(retryBackoffMs, remaining));
        }
    }

    private void fetchRound() {
        List<FetchPosition> plan = table.fetchPlan(buffered.keySet());
        if (plan.isEmpty()) {
            return;
        }
        int start = Math.floorMod(nextRoundStart++, plan.size());
        long roundBytes = 0;
        for (int i = 0; i < plan.size(); i++) {
            if (roundBytes >= fetchMaxBytes || canceller.isCancelled()) {
                break;
            }
            FetchPosition position = plan.get((start + i) % plan.size());
            Optional<FetchedBatch> fetched = fetcher.fetch(position);
            if (fetched.isPresent()) {
                FetchedBatch batch = fetched.get();
                buffered.put(position.getPartition(),
                        new Buffered(batch.getBatch().getMessages(), batch.getEpoch()));
                roundBytes += batch.getBatch().getValidBytes();
            }
        }
        log.debug("Fetch round over {} partitions buffered {} bytes", plan.size(), roundBytes);
    }

    private Map<TopicPartition, List<Message>> drain(int maxRecords) {
        Map<TopicPartition, List<Message>> drained = new LinkedHashMap<>();
        int total = 0;
        // revoked, re-assigned or sought since the fetch
        buffered.entrySet().removeIf(e -> !table.isCurrent(e.getKey(), e.getValue().epoch));

        Iterator<Map.Entry<TopicPartition, Buffered>> it = buffered.entrySet().iterator();
        while (it.hasNext() && total < maxRecords) {
            Map.Entry<TopicPartition, Buffered> entry = it.next();
            TopicPartition partition = entry.getKey();
            Buffered batch = entry.getValue();
            it.remove();

            List<Message> chunk = batch.take(maxRecords - total);
            if (chunk.isEmpty() || !table.advance(partition, batch.epoch, lastOffset(chunk))) {
                log.debug("Dropping buffered messages of {}: partition moved or was revoked", partition);
                continue;
            }
            drained.put(partition, chunk);
            total += chunk.size();
            if (batch.hasRemaining()) {
                // back of the queue; the iterator is not used after this
                buffered.put(partition, batch);
                break;
            }
        }

        if (total > 0) {
            consumptionListener.accept(total);
        }
        return drained;
    }

    private static long lastOffset(List<Message> chunk) {
        return chunk.get(chunk.size() - 1).getOffset();
    }

    private static final class Buffered {
        final List<Message> messages;
        final long epoch;
        int next;

        Buffered(List<Message> messages, long epoch) {
            this.messages = messages;
            this.epoch = epoch;
        }

        List<Message> take(int max) {
            int end = Math.min(messages.size(), next + max);
            List<Message> chunk = new ArrayList<>(messages.subList(next, end));
            next = end;
            return chunk;
        }

        boolean hasRemaining() {
            return next < messages.size();
        }
    }
}
