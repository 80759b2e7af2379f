package com.tidemq.client.consumer.internals;

import com.tidemq.client.consumer.OffsetResetStrategy;
import com.tidemq.client.transport.InMemoryBroker;
import com.tidemq.common.codec.CodecRegistry;
import com.tidemq.common.codec.MessageDecoder;
import com.tidemq.common.exception.ErrorCode;
import com.tidemq.common.model.Message;
import com.tidemq.common.model.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for blocking reads over the fetch layer
 */
class BlockingPollerTest {

    private static final TopicPartition P0 = new TopicPartition("clicks", 0);
    private static final TopicPartition P1 = new TopicPartition("clicks", 1);

    private InMemoryBroker broker;
    private PartitionCursorTable table;
    private PollCanceller canceller;
    private final AtomicInteger consumed = new AtomicInteger();

    @BeforeEach
    void setUp() {
        broker = new InMemoryBroker();
        broker.createTopic("clicks", 2);
        table = new PartitionCursorTable(1024);
        canceller = new PollCanceller();
    }

    private BlockingPoller poller(int maxPollRecords, int fetchMaxBytes) {
        TimestampOffsetResolver resolver = new TimestampOffsetResolver(broker, canceller, 1000L, 10L);
        FetchBufferManager fetcher = new FetchBufferManager(broker, new MessageDecoder(new CodecRegistry()), table,
                resolver, canceller, 1 << 20, 1000L, true, OffsetResetStrategy.EARLIEST);
        PositionInitializer initializer = new PositionInitializer(table, broker, resolver, null,
                OffsetResetStrategy.EARLIEST, 1000L);
        return new BlockingPoller(table, fetcher, initializer, canceller, consumed::addAndGet,
                maxPollRecords, fetchMaxBytes, 20L);
    }

    private static List<String> values(Map<TopicPartition, List<Message>> records) {
        return records.values().stream()
                .flatMap(List::stream)
                .map(Message::valueAsString)
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Poll returns buffered messages before fetching again")
    void testDrainBeforeFetch() {
        broker.produce(P0, "a", "b", "c", "d", "e");
        table.onAssign(P0);
        BlockingPoller poller = poller(2, 1 << 20);

        assertEquals(List.of("a", "b"), values(poller.poll(1000)));
        assertEquals(1, broker.fetchCount.get());
        assertEquals(List.of("c", "d"), values(poller.poll(1000)));
        assertEquals(List.of("e"), values(poller.poll(1000)));
        assertEquals(1, broker.fetchCount.get());

        assertEquals(5L, table.position(P0));
        assertEquals(5, consumed.get());
    }

    @Test
    @DisplayName("Partitions are served in turn")
    void testFairness() {
        for (int i = 0; i < 10; i++) {
            broker.produce(P0, "p0-" + i);
            broker.produce(P1, "p1-" + i);
        }
        table.onAssign(P0);
        table.onAssign(P1);
        BlockingPoller poller = poller(1, 1 << 20);

        List<TopicPartition> order = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            order.add(poller.next(1000).topicPartition());
        }

        assertEquals(3, order.stream().filter(P0::equals).count());
        assertEquals(3, order.stream().filter(P1::equals).count());
    }

    @Test
    @DisplayName("Fetch round stops once fetch_max_bytes have arrived")
    void testFetchMaxBytes() {
        broker.produce(P0, "a", "b");
        broker.produce(P1, "x", "y");
        table.onAssign(P0);
        table.onAssign(P1);
        BlockingPoller poller = poller(500, 10);

        Map<TopicPartition, List<Message>> first = poller.poll(1000);
        assertEquals(1, first.size());
        assertEquals(1, broker.fetchCount.get());

        // next round starts at the other partition
        Map<TopicPartition, List<Message>> second = poller.poll(1000);
        assertEquals(1, second.size());
        assertNotEquals(first.keySet(), second.keySet());
        assertEquals(2, broker.fetchCount.get());
    }

    @Test
    @DisplayName("Seek during drain drops buffered messages")
    void testSeekDiscardsBuffer() {
        broker.produce(P0, "a", "b", "c", "d");
        table.onAssign(P0, 0L);
        BlockingPoller poller = poller(1, 1 << 20);

        assertEquals("a", poller.next(1000).valueAsString());
        table.seek(P0, 3L);

        assertEquals("d", poller.next(1000).valueAsString());
        assertEquals(4L, table.position(P0));
    }

    @Test
    @DisplayName("Revoked partition is not returned")
    void testRevokeDiscardsBuffer() {
        broker.produce(P0, "a", "b");
        table.onAssign(P0, 0L);
        BlockingPoller poller = poller(1, 1 << 20);

        assertNotNull(poller.next(1000));
        table.onRevoke(P0);

        assertNull(poller.next(100));
    }

    @Test
    @DisplayName("Idle poll waits the full timeout")
    void testTimeout() {
        table.onAssign(P0);
        BlockingPoller poller = poller(10, 1 << 20);

        long start = System.currentTimeMillis();
        assertTrue(poller.poll(300).isEmpty());
        assertTrue(System.currentTimeMillis() - start >= 300);
    }

    @Test
    @DisplayName("Wakeup releases a blocked poll early")
    void testWakeup() {
        table.onAssign(P0);
        BlockingPoller poller = poller(10, 1 << 20);
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
        try {
            executor.schedule(canceller::wakeup, 100, TimeUnit.MILLISECONDS);

            long start = System.currentTimeMillis();
            assertNull(poller.next(10_000));
            assertTrue(System.currentTimeMillis() - start < 5_000);
        } finally {
            executor.shutdownNow();
        }
        assertFalse(canceller.isCancelled());
    }

    @Test
    @DisplayName("Wakeup releases a blocked getMessages early")
    void testWakeupEndsGetMessages() {
        table.onAssign(P0);
        BlockingPoller poller = poller(10, 1 << 20);
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
        try {
            executor.schedule(canceller::wakeup, 100, TimeUnit.MILLISECONDS);

            long start = System.currentTimeMillis();
            assertTrue(poller.getMessages(5, 10_000).isEmpty());
            assertTrue(System.currentTimeMillis() - start < 5_000);
        } finally {
            executor.shutdownNow();
        }
        assertFalse(canceller.isCancelled());
    }

    @Test
    @DisplayName("A transient fetch failure is retried within the same poll")
    void testTransientFetchFailure() {
        broker.produce(P0, "a", "b");
        table.onAssign(P0, 0L);
        broker.failFetches(ErrorCode.LEADER_NOT_AVAILABLE, 2);
        BlockingPoller poller = poller(10, 1 << 20);

        assertEquals(List.of("a", "b"), values(poller.poll(5_000)));
        assertEquals(2L, table.position(P0));
    }

    @Test
    @DisplayName("A fetch buffered before a revoke is not returned after the partition is re-assigned")
    void testReassignDropsBuffered() {
        broker.produce(P0, "a", "b", "c", "d");
        table.onAssign(P0, 0L);
        BlockingPoller poller = poller(2, 1 << 20);
        assertEquals(List.of("a", "b"), values(poller.poll(1000)));

        table.onRevoke(P0);
        table.onAssign(P0, 0L);

        assertEquals(List.of("a", "b"), values(poller.poll(1000)));
        assertEquals(2L, table.position(P0));
    }

    @Test
    @DisplayName("Messages produced while waiting are picked up")
    void testDataArrivesDuringWait() {
        table.onAssign(P0);
        BlockingPoller poller = poller(10, 1 << 20);
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
        try {
            executor.schedule(() -> broker.produce(P0, "late"), 150, TimeUnit.MILLISECONDS);

            Message message = poller.next(5_000);
            assertNotNull(message);
            assertEquals("late", message.valueAsString());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("getMessages collects across polls up to the count")
    void testGetMessages() {
        broker.produce(P0, "a", "b", "c");
        broker.produce(P1, "x", "y", "z");
        table.onAssign(P0);
        table.onAssign(P1);
        BlockingPoller poller = poller(2, 1 << 20);

        assertEquals(5, poller.getMessages(5, 1000).size());
        assertEquals(1, poller.getMessages(5, 200).size());
        assertThrows(IllegalArgumentException.class, () -> poller.getMessages(0, 100));
    }
}
