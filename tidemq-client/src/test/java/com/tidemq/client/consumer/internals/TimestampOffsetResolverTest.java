package com.tidemq.client.consumer.internals;

import com.tidemq.client.transport.InMemoryBroker;
import com.tidemq.common.exception.TideTimeoutException;
import com.tidemq.common.exception.UnsupportedVersionException;
import com.tidemq.common.model.OffsetAndTimestamp;
import com.tidemq.common.model.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for timestamp and boundary lookups
 */
class TimestampOffsetResolverTest {

    private static final TopicPartition P0 = new TopicPartition("metrics", 0);
    private static final TopicPartition P1 = new TopicPartition("metrics", 1);

    private InMemoryBroker broker;
    private PollCanceller canceller;
    private TimestampOffsetResolver resolver;

    @BeforeEach
    void setUp() {
        broker = new InMemoryBroker();
        canceller = new PollCanceller();
        broker.createTopic("metrics", 2);
        broker.setClock(1000L);
        broker.produce(P0, "a", "b", "c");      // timestamps 1000..1002
        broker.setClock(2000L);
        broker.produce(P1, "x", "y");           // timestamps 2000..2001
        resolver = new TimestampOffsetResolver(broker, canceller, 500L, 20L);
    }

    @Test
    @DisplayName("Empty request returns an empty map without calling the broker")
    void testEmptyRequest() {
        assertTrue(resolver.offsetsForTimes(Collections.emptyMap()).isEmpty());
        assertEquals(0, broker.listOffsetsCount.get());
    }

    @Test
    @DisplayName("Earliest message at or after the target timestamp")
    void testOffsetsForTimes() {
        Map<TopicPartition, OffsetAndTimestamp> result = resolver.offsetsForTimes(Map.of(P0, 1001L, P1, 0L));

        assertEquals(new OffsetAndTimestamp(1L, 1001L), result.get(P0));
        assertEquals(new OffsetAndTimestamp(0L, 2000L), result.get(P1));
    }

    @Test
    @DisplayName("Timestamp after every message maps to null")
    void testTimestampAfterAll() {
        Map<TopicPartition, OffsetAndTimestamp> result = resolver.offsetsForTimes(Map.of(P0, 9999999999999L));

        assertTrue(result.containsKey(P0));
        assertNull(result.get(P0));
    }

    @Test
    @DisplayName("Negative timestamp is rejected before any network call")
    void testNegativeTimestamp() {
        assertThrows(IllegalArgumentException.class, () -> resolver.offsetsForTimes(Map.of(P0, -1L)));
        assertEquals(0, broker.listOffsetsCount.get());
    }

    @Test
    @DisplayName("Broker without timestamp lookup is reported as unsupported")
    void testUnsupported() {
        broker.setTimestampLookupSupported(false);

        assertThrows(UnsupportedVersionException.class, () -> resolver.offsetsForTimes(Map.of(P0, 0L)));
        // boundary lookups still work
        assertEquals(3L, resolver.endOffset(P0));
    }

    @Test
    @DisplayName("Unknown partition is retried until the request timeout")
    void testUnknownPartitionTimesOut() {
        TopicPartition unknown = new TopicPartition("metrics", 100);
        long start = System.currentTimeMillis();

        assertThrows(TideTimeoutException.class, () -> resolver.offsetsForTimes(Map.of(unknown, 0L)));

        long elapsed = System.currentTimeMillis() - start;
        assertTrue(elapsed >= 400, "gave up after " + elapsed + "ms");
        assertTrue(broker.listOffsetsCount.get() > 1);
    }

    @Test
    @DisplayName("Closing the consumer ends a lookup that is still retrying")
    void testCloseEndsRetries() {
        resolver = new TimestampOffsetResolver(broker, canceller, 10_000L, 50L);
        TopicPartition unknown = new TopicPartition("metrics", 100);
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
        try {
            executor.schedule(canceller::close, 150, TimeUnit.MILLISECONDS);
            long start = System.currentTimeMillis();

            assertThrows(IllegalStateException.class, () -> resolver.endOffset(unknown));

            long elapsed = System.currentTimeMillis() - start;
            assertTrue(elapsed < 5000, "close took " + elapsed + "ms to take effect");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A wakeup does not cut a lookup short")
    void testWakeupDoesNotEndRetries() {
        canceller.wakeup();

        assertEquals(3L, resolver.endOffset(P0));
        assertThrows(TideTimeoutException.class, () -> resolver.endOffset(new TopicPartition("metrics", 100)));
        assertTrue(canceller.isCancelled());
    }

    @Test
    @DisplayName("Beginning and end offsets follow retention and appends")
    void testBoundaries() {
        broker.truncateBefore(P0, 2L);

        assertEquals(Map.of(P0, 2L, P1, 0L), resolver.beginningOffsets(List.of(P0, P1)));
        assertEquals(Map.of(P0, 3L, P1, 2L), resolver.endOffsets(List.of(P0, P1)));
    }
}
