package com.tidemq.client.consumer.internals;

import com.tidemq.client.consumer.OffsetResetStrategy;
import com.tidemq.client.transport.InMemoryBroker;
import com.tidemq.common.codec.CodecRegistry;
import com.tidemq.common.codec.CompressionCodec;
import com.tidemq.common.codec.MessageDecoder;
import com.tidemq.common.exception.ErrorCode;
import com.tidemq.common.exception.FetchSizeTooSmallException;
import com.tidemq.common.exception.OffsetOutOfRangeException;
import com.tidemq.common.exception.TransportException;
import com.tidemq.common.exception.UnsupportedCodecException;
import com.tidemq.common.model.Message;
import com.tidemq.common.model.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for fetch outcome handling: growth, resets, codecs
 */
class FetchBufferManagerTest {

    private static final TopicPartition TP = new TopicPartition("logs", 0);

    private InMemoryBroker broker;
    private PartitionCursorTable table;
    private PollCanceller canceller;
    private TimestampOffsetResolver resolver;

    @BeforeEach
    void setUp() {
        broker = new InMemoryBroker();
        broker.createTopic("logs", 1);
        table = new PartitionCursorTable(1024);
        canceller = new PollCanceller();
        resolver = new TimestampOffsetResolver(broker, canceller, 1000L, 10L);
    }

    private FetchBufferManager manager(Integer maxBufferSize, boolean resetOnOutOfRange,
                                       OffsetResetStrategy strategy) {
        return manager(new CodecRegistry(), maxBufferSize, resetOnOutOfRange, strategy);
    }

    private FetchBufferManager manager(CodecRegistry registry, Integer maxBufferSize, boolean resetOnOutOfRange,
                                       OffsetResetStrategy strategy) {
        return new FetchBufferManager(broker, new MessageDecoder(registry), table, resolver, canceller,
                maxBufferSize, 1000L, resetOnOutOfRange, strategy);
    }

    private FetchPosition plan() {
        return table.fetchPlan(List.of()).get(0);
    }

    private static List<Long> offsets(FetchedBatch batch) {
        return batch.getBatch().getMessages().stream().map(Message::getOffset).collect(Collectors.toList());
    }

    private static byte[] payload(int size) {
        byte[] bytes = new byte[size];
        Arrays.fill(bytes, (byte) 'x');
        return bytes;
    }

    @Test
    @DisplayName("Fetch returns the messages at the cursor position")
    void testFetchRecords() {
        broker.produce(TP, "a", "b", "c", "d");
        table.onAssign(TP, 1L);

        Optional<FetchedBatch> batch = manager(2048, true, OffsetResetStrategy.LATEST).fetch(plan());

        assertTrue(batch.isPresent());
        assertEquals(List.of(1L, 2L, 3L), offsets(batch.get()));
        assertEquals("b", batch.get().getBatch().getMessages().get(0).valueAsString());
        // fetching does not move the cursor; handing messages out does
        assertEquals(1L, table.position(TP));
        assertEquals(4L, table.get(TP).getHighWaterMark());
    }

    @Test
    @DisplayName("No data yet is not an error")
    void testFetchEmpty() {
        broker.produce(TP, "a");
        table.onAssign(TP, 1L);

        assertFalse(manager(2048, true, OffsetResetStrategy.LATEST).fetch(plan()).isPresent());
    }

    @Test
    @DisplayName("Retriable broker error yields no data and leaves the cursor fetchable")
    void testRetriableFetchError() {
        broker.produce(TP, "a", "b");
        table.onAssign(TP, 0L);
        broker.failFetches(ErrorCode.LEADER_NOT_AVAILABLE, 1);
        FetchBufferManager manager = manager(2048, true, OffsetResetStrategy.LATEST);

        assertFalse(manager.fetch(plan()).isPresent());
        assertEquals(PartitionCursor.State.FETCHING, table.get(TP).getState());

        Optional<FetchedBatch> batch = manager.fetch(plan());
        assertTrue(batch.isPresent());
        assertEquals(List.of(0L, 1L), offsets(batch.get()));
    }

    @Test
    @DisplayName("Non-retriable broker error is raised")
    void testFatalFetchError() {
        broker.produce(TP, "a");
        table.onAssign(TP, 0L);
        broker.failFetches(ErrorCode.UNKNOWN_ERROR, 1);

        TransportException e = assertThrows(TransportException.class,
                () -> manager(2048, true, OffsetResetStrategy.LATEST).fetch(plan()));
        assertEquals(ErrorCode.UNKNOWN_ERROR, e.getErrorCode());
    }

    @Test
    @DisplayName("Message larger than the buffer is fetched after doubling it")
    void testBufferGrowth() {
        // 1024 + 24 bytes of entry: too big for 1024, fits 2048
        broker.produce(TP, null, payload(1024 - 22 - 12 + 24));
        broker.produce(TP, "small");
        table.onAssign(TP, 0L);

        Optional<FetchedBatch> batch = manager(2048, true, OffsetResetStrategy.LATEST).fetch(plan());

        assertTrue(batch.isPresent());
        assertEquals(0L, offsets(batch.get()).get(0));
        assertEquals(List.of(1024, 2048), broker.fetchSizes);
        assertEquals(2048, table.get(TP).getFetchBufferSize());
    }

    @Test
    @DisplayName("Broker size signal also triggers growth")
    void testBufferGrowthOnSignal() {
        broker.setSizeTooSmallSignal(true);
        broker.produce(TP, null, payload(1500));
        table.onAssign(TP, 0L);

        Optional<FetchedBatch> batch = manager(4096, true, OffsetResetStrategy.LATEST).fetch(plan());

        assertTrue(batch.isPresent());
        assertEquals(1500, batch.get().getBatch().getMessages().get(0).getValue().length);
        assertEquals(2048, table.get(TP).getFetchBufferSize());
    }

    @Test
    @DisplayName("Message larger than the cap fails without advancing")
    void testBufferCapExceeded() {
        broker.produce(TP, null, payload(5000));
        table.onAssign(TP, 0L);
        FetchBufferManager manager = manager(2048, true, OffsetResetStrategy.LATEST);

        FetchSizeTooSmallException e = assertThrows(FetchSizeTooSmallException.class, () -> manager.fetch(plan()));

        assertEquals(TP, e.getPartition());
        assertEquals(0L, e.getOffset());
        assertEquals(5000 + 22 + 12, e.getRequiredSize());
        assertEquals(2048, e.getMaxBufferSize());
        assertEquals(0L, table.position(TP));
        // the partial entry already tells the size, so no doomed retry is made
        assertEquals(List.of(1024), broker.fetchSizes);
    }

    @Test
    @DisplayName("Broker size signal beyond the cap fails at once")
    void testBufferCapExceededWithSignal() {
        broker.setSizeTooSmallSignal(true);
        broker.produce(TP, null, payload(3000));
        table.onAssign(TP, 0L);
        FetchBufferManager manager = manager(2048, true, OffsetResetStrategy.LATEST);

        FetchSizeTooSmallException e = assertThrows(FetchSizeTooSmallException.class, () -> manager.fetch(plan()));

        assertEquals(3000 + 22 + 12, e.getRequiredSize());
        assertEquals(1, broker.fetchCount.get());
        assertEquals(1024, table.get(TP).getFetchBufferSize());
    }

    @Test
    @DisplayName("Without a cap the buffer grows until the message fits")
    void testUnboundedGrowth() {
        broker.produce(TP, null, payload(100_000));
        table.onAssign(TP, 0L);

        Optional<FetchedBatch> batch = manager(null, true, OffsetResetStrategy.LATEST).fetch(plan());

        assertTrue(batch.isPresent());
        assertEquals(131072, table.get(TP).getFetchBufferSize());
    }

    @Test
    @DisplayName("Out of range position is reset to the earliest offset")
    void testOutOfRangeResetEarliest() {
        broker.produce(TP, "a", "b", "c", "d", "e");
        broker.truncateBefore(TP, 3L);
        table.onAssign(TP, 1L);
        long epoch = table.get(TP).getEpoch();

        Optional<FetchedBatch> batch = manager(2048, true, OffsetResetStrategy.EARLIEST).fetch(plan());

        assertTrue(batch.isPresent());
        assertEquals(List.of(3L, 4L), offsets(batch.get()));
        assertTrue(batch.get().getEpoch() > epoch);
        assertEquals(3L, table.position(TP));
    }

    @Test
    @DisplayName("Out of range position is reset to the end")
    void testOutOfRangeResetLatest() {
        broker.produce(TP, "a", "b", "c");
        table.onAssign(TP, 40L);

        Optional<FetchedBatch> batch = manager(2048, true, OffsetResetStrategy.LATEST).fetch(plan());

        assertFalse(batch.isPresent());
        assertEquals(3L, table.position(TP));
    }

    @Test
    @DisplayName("Out of range without a reset policy fails the partition")
    void testOutOfRangeWithoutReset() {
        broker.produce(TP, "a", "b", "c");
        table.onAssign(TP, 40L);
        FetchBufferManager manager = manager(2048, true, OffsetResetStrategy.NONE);

        OffsetOutOfRangeException e = assertThrows(OffsetOutOfRangeException.class, () -> manager.fetch(plan()));

        assertEquals(40L, e.getOffset());
        assertEquals(PartitionCursor.State.FAILED, table.get(TP).getState());
        assertTrue(table.fetchPlan(List.of()).isEmpty());

        table.seek(TP, 0L);
        assertEquals(3, manager.fetch(plan()).orElseThrow().getBatch().size());
    }

    @Test
    @DisplayName("Out of range with resets switched off fails even with a strategy")
    void testOutOfRangeResetDisabled() {
        broker.produce(TP, "a");
        table.onAssign(TP, 9L);
        FetchBufferManager manager = manager(2048, false, OffsetResetStrategy.EARLIEST);

        assertThrows(OffsetOutOfRangeException.class, () -> manager.fetch(plan()));
        assertEquals(PartitionCursor.State.FAILED, table.get(TP).getState());
    }

    @Test
    @DisplayName("Unavailable codec fails the fetch without advancing")
    void testUnsupportedCodec() {
        broker.produceCompressed(TP, CompressionCodec.GZIP, "a", "b");
        table.onAssign(TP, 0L);
        FetchBufferManager manager = manager(new CodecRegistry(EnumSet.of(CompressionCodec.GZIP)), 2048, true,
                OffsetResetStrategy.LATEST);

        UnsupportedCodecException e = assertThrows(UnsupportedCodecException.class, () -> manager.fetch(plan()));

        assertEquals("Libraries for gzip compression codec not found", e.getMessage());
        assertEquals(0L, table.position(TP));
        assertEquals(PartitionCursor.State.FETCHING, table.get(TP).getState());
    }

    @Test
    @DisplayName("Result of a fetch overtaken by a seek is discarded")
    void testStaleResultDiscarded() {
        broker.produce(TP, "a", "b");
        table.onAssign(TP, 0L);
        FetchPosition planned = plan();
        table.seek(TP, 1L);

        assertFalse(manager(2048, true, OffsetResetStrategy.LATEST).fetch(planned).isPresent());
    }

    @Test
    @DisplayName("Cancelled poll stops before calling the broker")
    void testCancelled() {
        broker.produce(TP, "a");
        table.onAssign(TP, 0L);
        canceller.wakeup();

        assertFalse(manager(2048, true, OffsetResetStrategy.LATEST).fetch(plan()).isPresent());
        assertEquals(0, broker.fetchCount.get());
    }

    @Test
    @DisplayName("Compressed entries are returned flattened from the requested offset")
    void testCompressedFromMiddle() {
        broker.produceCompressed(TP, CompressionCodec.GZIP, "a", "b", "c");
        table.onAssign(TP, 1L);

        Optional<FetchedBatch> batch = manager(2048, true, OffsetResetStrategy.LATEST).fetch(plan());

        assertEquals(List.of(1L, 2L), offsets(batch.orElseThrow()));
        assertEquals("c", new String(batch.get().getBatch().getMessages().get(1).getValue(),
                StandardCharsets.UTF_8));
    }
}
