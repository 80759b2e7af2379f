package com.tidemq.common.codec;

import com.tidemq.common.model.Message;
import com.tidemq.common.model.TopicPartition;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Messages decoded from one fetch response of one partition, in offset order.
 */
@Getter
public class DecodedBatch {

    private final TopicPartition partition;
    private final List<Message> messages;
    /** Bytes of complete entries that were read. */
    private final int validBytes;
    /** True when the payload ended inside an entry. */
    private final boolean truncated;
    /** Full size of the truncated entry, or -1 when its header was cut off as well. */
    private final int truncatedEntrySize;

    public DecodedBatch(TopicPartition partition, List<Message> messages, int validBytes,
                        boolean truncated, int truncatedEntrySize) {
        this.partition = partition;
        this.messages = Collections.unmodifiableList(messages);
        this.validBytes = validBytes;
        this.truncated = truncated;
        this.truncatedEntrySize = truncatedEntrySize;
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public int size() {
        return messages.size();
    }

    /**
     * True when nothing could be returned because the next wanted entry did not fit.
     */
    public boolean needsLargerBuffer() {
        return truncated && messages.isEmpty();
    }

    public long lastOffset() {
        if (messages.isEmpty()) {
            throw new IllegalStateException("Empty batch for " + partition);
        }
        return messages.get(messages.size() - 1).getOffset();
    }
}
