package com.tidemq.client.consumer.internals;

import com.tidemq.common.exception.FetchSizeTooSmallException;
import com.tidemq.common.model.TopicPartition;

/**
 * Fetch buffer size while retrying one oversized message: doubles on every
 * attempt and never passes the cap. A null cap means unbounded.
 */
public final class BufferGrowth {

    private final int size;
    private final Integer cap;
    private final int attempt;

    private BufferGrowth(int size, Integer cap, int attempt) {
        this.size = size;
        this.cap = cap;
        this.attempt = attempt;
    }

    public static BufferGrowth start(int size, Integer cap) {
        return new BufferGrowth(size, cap, 0);
    }

    public int size() {
        return size;
    }

    public Integer cap() {
        return cap;
    }

    public int attempt() {
        return attempt;
    }

    public boolean isGrown() {
        return attempt > 0;
    }

    private int limit() {
        return cap == null ? Integer.MAX_VALUE : cap;
    }

    /**
     * Next size to try for a message at {@code offset} needing {@code requiredSize}
     * bytes (-1 when unknown).
     *
     * @throws FetchSizeTooSmallException when the buffer is already at its cap or
     *                                    the message is known to exceed it
     */
    public BufferGrowth grow(TopicPartition partition, long offset, int requiredSize) {
        if (size >= limit() || requiredSize > limit()) {
            throw new FetchSizeTooSmallException(partition, offset, requiredSize, limit());
        }
        long doubled = Math.max(1L, (long) size * 2);
        return new BufferGrowth((int) Math.min(doubled, limit()), cap, attempt + 1);
    }

    @Override
    public String toString() {
        return "BufferGrowth(size=" + size + ", cap=" + cap + ", attempt=" + attempt + ")";
    }
}
