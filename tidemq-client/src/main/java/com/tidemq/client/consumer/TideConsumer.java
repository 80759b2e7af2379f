package com.tidemq.client.consumer;

import com.tidemq.client.consumer.internals.AutoCommitScheduler;
import com.tidemq.client.consumer.internals.BlockingPoller;
import com.tidemq.client.consumer.internals.FetchBufferManager;
import com.tidemq.client.consumer.internals.PartitionCursorTable;
import com.tidemq.client.consumer.internals.PollCanceller;
import com.tidemq.client.consumer.internals.PositionInitializer;
import com.tidemq.client.consumer.internals.TimestampOffsetResolver;
import com.tidemq.client.transport.BrokerTransport;
import com.tidemq.client.transport.HttpBrokerTransport;
import com.tidemq.common.codec.CodecRegistry;
import com.tidemq.common.codec.MessageDecoder;
import com.tidemq.common.exception.ConfigurationException;
import com.tidemq.common.model.Message;
import com.tidemq.common.model.OffsetAndTimestamp;
import com.tidemq.common.model.TopicPartition;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeSet;

/**
 * Default implementation of Consumer.
 *
 * <p>Reading (poll, next, iteration, getMessages) belongs to one thread.
 * Assignment changes, seeks, {@link #wakeup()} and {@link #close()} may be
 * called from any thread.
 */
@Slf4j
public class TideConsumer implements Consumer {

    private final ConsumerConfig config;
    private final BrokerTransport transport;
    private final PartitionCursorTable table;
    private final PollCanceller canceller;
    private final TimestampOffsetResolver resolver;
    private final PositionInitializer positionInitializer;
    private final AutoCommitScheduler commitScheduler;
    private final BlockingPoller poller;
    private volatile boolean closed = false;

    public TideConsumer(ConsumerConfig config) {
        this(config, createTransport(config));
    }

    public TideConsumer(ConsumerConfig config, BrokerTransport transport) {
        this.config = config.validate();
        this.transport = transport;
        this.table = new PartitionCursorTable(config.getMaxPartitionFetchBytes());
        this.canceller = new PollCanceller();
        this.resolver = new TimestampOffsetResolver(transport, canceller, config.getRequestTimeoutMs(),
                config.getRetryBackoffMs());
        this.positionInitializer = new PositionInitializer(table, transport, resolver, config.getGroupId(),
                config.resetStrategy(), config.getRequestTimeoutMs());

        MessageDecoder decoder = new MessageDecoder(new CodecRegistry(config.getDisabledCodecs()));
        FetchBufferManager fetcher = new FetchBufferManager(transport, decoder, table, resolver, canceller,
                config.getMaxBufferSize(), config.getRequestTimeoutMs(),
                Boolean.TRUE.equals(config.getResetOnOutOfRange()), config.resetStrategy());

        this.commitScheduler = new AutoCommitScheduler(table, transport, config.getGroupId(),
                config.isAutoCommitEnabled(), config.getAutoCommitIntervalMs(), config.getAutoCommitEveryN(),
                config.getRequestTimeoutMs(), config.getClientId());
        this.poller = new BlockingPoller(table, fetcher, positionInitializer, canceller,
                commitScheduler::recordConsumed, config.getMaxPollRecords(), config.getFetchMaxBytes(),
                config.getRetryBackoffMs());

        commitScheduler.start();
        log.info("TideConsumer initialized with config: {}", config);
    }

    private static BrokerTransport createTransport(ConsumerConfig config) {
        if (config.getBrokerUrl() == null || config.getBrokerUrl().isEmpty()) {
            throw new ConfigurationException("broker_url is required");
        }
        return new HttpBrokerTransport(config.getBrokerUrl(), config.getClientId(), config.getFetchMaxWaitMs(),
                config.getRequestTimeoutMs());
    }

    @Override
    public void assign(Collection<TopicPartition> partitions) {
        validateNotClosed();
        log.info("Assigning partitions: {}", partitions);
        for (TopicPartition partition : partitions) {
            table.onAssign(partition);
        }
    }

    @Override
    public void assign(Map<TopicPartition, Long> initialOffsets) {
        validateNotClosed();
        log.info("Assigning partitions with offsets: {}", initialOffsets);
        initialOffsets.forEach(table::onAssign);
    }

    @Override
    public void unassign(Collection<TopicPartition> partitions) {
        validateNotClosed();
        for (TopicPartition partition : partitions) {
            table.onRevoke(partition);
        }
    }

    @Override
    public Set<TopicPartition> assignment() {
        return table.assignedPartitions();
    }

    @Override
    public Map<TopicPartition, List<Message>> poll(long timeoutMs) {
        validateNotClosed();
        requireNonNegative(timeoutMs);
        return poller.poll(timeoutMs);
    }

    @Override
    public Message next() {
        return next(config.getConsumerTimeoutMs());
    }

    @Override
    public Message next(long timeoutMs) {
        validateNotClosed();
        requireNonNegative(timeoutMs);
        return poller.next(timeoutMs);
    }

    @Override
    public List<Message> getMessages(int count, long timeoutMs) {
        validateNotClosed();
        requireNonNegative(timeoutMs);
        return poller.getMessages(count, timeoutMs);
    }

    /**
     * Messages until {@code consumer_timeout_ms} passes without one.
     */
    @Override
    public Iterator<Message> iterator() {
        return new Iterator<>() {
            private Message upcoming;

            @Override
            public boolean hasNext() {
                if (upcoming == null && !closed) {
                    upcoming = TideConsumer.this.next();
                }
                return upcoming != null;
            }

            @Override
            public Message next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Message message = upcoming;
                upcoming = null;
                return message;
            }
        };
    }

    @Override
    public void commitSync() {
        validateNotClosed();
        commitScheduler.commitSync();
    }

    @Override
    public void commitAsync() {
        validateNotClosed();
        commitScheduler.commitAsync();
    }

    @Override
    public void seek(TopicPartition partition, long offset) {
        validateNotClosed();
        table.seek(partition, offset);
    }

    @Override
    public void seek(long delta, SeekOrigin origin, Collection<TopicPartition> partitions) {
        validateNotClosed();
        List<TopicPartition> targets = new ArrayList<>(targetsOf(partitions));
        if (targets.isEmpty()) {
            return;
        }
        Map<TopicPartition, Long> beginning = resolver.beginningOffsets(targets);
        Map<TopicPartition, Long> end = resolver.endOffsets(targets);

        // floor division: the first (delta mod n) partitions take one more
        long share = Math.floorDiv(delta, (long) targets.size());
        long extra = Math.floorMod(delta, (long) targets.size());
        for (int i = 0; i < targets.size(); i++) {
            TopicPartition partition = targets.get(i);
            long partitionDelta = share + (i < extra ? 1 : 0);
            long base;
            switch (origin) {
                case BEGINNING:
                    base = beginning.get(partition);
                    break;
                case CURRENT:
                    base = positionInitializer.positionOf(partition);
                    break;
                default:
                    base = end.get(partition);
            }
            long target = Math.max(beginning.get(partition), Math.min(end.get(partition), base + partitionDelta));
            table.seek(partition, target);
        }
        log.info("Relative seek by {} from {} over {}", delta, origin, targets);
    }

    @Override
    public void seekToBeginning(Collection<TopicPartition> partitions) {
        validateNotClosed();
        resolver.beginningOffsets(targetsOf(partitions)).forEach(table::seek);
    }

    @Override
    public void seekToEnd(Collection<TopicPartition> partitions) {
        validateNotClosed();
        resolver.endOffsets(targetsOf(partitions)).forEach(table::seek);
    }

    @Override
    public long position(TopicPartition partition) {
        validateNotClosed();
        return positionInitializer.positionOf(partition);
    }

    @Override
    public Long committed(TopicPartition partition) {
        validateNotClosed();
        if (table.isAssigned(partition)) {
            Long committed = table.committed(partition);
            if (committed != null) {
                return committed;
            }
        }
        if (config.getGroupId() == null) {
            return null;
        }
        return transport.fetchCommitted(config.getGroupId(), Collections.singleton(partition),
                config.getRequestTimeoutMs()).get(partition);
    }

    @Override
    public long pending(Collection<TopicPartition> partitions) {
        validateNotClosed();
        Set<TopicPartition> targets = targetsOf(partitions);
        long pending = 0;
        for (Map.Entry<TopicPartition, Long> end : resolver.endOffsets(targets).entrySet()) {
            pending += Math.max(0L, end.getValue() - positionInitializer.positionOf(end.getKey()));
        }
        return pending;
    }

    @Override
    public Map<TopicPartition, OffsetAndTimestamp> offsetsForTimes(Map<TopicPartition, Long> timestamps) {
        validateNotClosed();
        return resolver.offsetsForTimes(timestamps);
    }

    @Override
    public Map<TopicPartition, Long> beginningOffsets(Collection<TopicPartition> partitions) {
        validateNotClosed();
        return resolver.beginningOffsets(partitions);
    }

    @Override
    public Map<TopicPartition, Long> endOffsets(Collection<TopicPartition> partitions) {
        validateNotClosed();
        return resolver.endOffsets(partitions);
    }

    @Override
    public void wakeup() {
        canceller.wakeup();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        log.info("Closing TideConsumer (clientId: {}, groupId: {})...", config.getClientId(), config.getGroupId());
        closed = true;

        // 1. Release a blocked poll
        canceller.close();

        // 2. Stop the commit timer and commit final offsets
        commitScheduler.close();

        // 3. Forget positions and release the connection
        table.clear();
        transport.close();

        log.info("TideConsumer closed successfully");
    }

    private Set<TopicPartition> targetsOf(Collection<TopicPartition> partitions) {
        if (partitions == null || partitions.isEmpty()) {
            return table.assignedPartitions();
        }
        Set<TopicPartition> targets = new TreeSet<>(partitions);
        for (TopicPartition partition : targets) {
            table.get(partition);
        }
        return targets;
    }

    private static void requireNonNegative(long timeoutMs) {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("Timeout must not be negative, got " + timeoutMs);
        }
    }

    private void validateNotClosed() {
        if (closed) {
            throw new IllegalStateException("Consumer is closed");
        }
    }
}
