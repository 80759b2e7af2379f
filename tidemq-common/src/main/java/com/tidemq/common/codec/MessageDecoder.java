package com.tidemq.common.codec;

import com.tidemq.common.exception.CorruptMessageException;
import com.tidemq.common.exception.UnsupportedCodecException;
import com.tidemq.common.model.Message;
import com.tidemq.common.model.TopicPartition;
import com.tidemq.common.util.ChecksumUtil;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static com.tidemq.common.codec.MessageSetFormat.LOG_OVERHEAD;
import static com.tidemq.common.codec.MessageSetFormat.MAGIC;
import static com.tidemq.common.codec.MessageSetFormat.MESSAGE_OVERHEAD;

/**
 * Decodes a fetched message set into messages.
 *
 * <p>Compressed entries are unwrapped into their inner messages, which keep
 * their own offsets. A batch is built completely before it is returned: any
 * corrupt entry fails the whole batch.
 */
@Slf4j
public class MessageDecoder {

    private final CodecRegistry codecRegistry;

    public MessageDecoder(CodecRegistry codecRegistry) {
        this.codecRegistry = codecRegistry;
    }

    /**
     * Decode {@code payload}, dropping messages below {@code minOffset}.
     *
     * @throws UnsupportedCodecException if an entry uses a codec that is not available
     * @throws CorruptMessageException   if an entry fails validation
     */
    public DecodedBatch decode(TopicPartition partition, byte[] payload, long minOffset) {
        List<Message> messages = new ArrayList<>();
        if (payload == null || payload.length == 0) {
            return new DecodedBatch(partition, messages, 0, false, -1);
        }

        ByteBuffer buffer = ByteBuffer.wrap(payload);
        long lastOffset = -1L;
        boolean truncated = false;
        int truncatedEntrySize = -1;

        while (buffer.hasRemaining()) {
            if (buffer.remaining() < LOG_OVERHEAD) {
                truncated = true;
                break;
            }
            int entryStart = buffer.position();
            long offset = buffer.getLong();
            int size = buffer.getInt();
            if (size < MESSAGE_OVERHEAD || (long) size + LOG_OVERHEAD > Integer.MAX_VALUE) {
                throw new CorruptMessageException(String.format(
                        "Message at offset %d of %s has invalid size %d", offset, partition, size));
            }
            if (buffer.remaining() < size) {
                truncated = true;
                truncatedEntrySize = LOG_OVERHEAD + size;
                buffer.position(entryStart);
                break;
            }

            ByteBuffer body = buffer.slice();
            body.limit(size);
            buffer.position(buffer.position() + size);

            Entry entry = readEntry(partition, offset, body);
            if (entry.codec == CompressionCodec.NONE) {
                lastOffset = append(partition, messages, entry.toMessage(partition), lastOffset, minOffset);
            } else {
                for (Message inner : unwrap(partition, entry)) {
                    lastOffset = append(partition, messages, inner, lastOffset, minOffset);
                }
            }
        }

        int validBytes = truncated ? buffer.position() : payload.length;
        log.trace("Decoded {} messages ({} bytes, truncated={}) from {}",
                messages.size(), validBytes, truncated, partition);
        return new DecodedBatch(partition, messages, validBytes, truncated, truncatedEntrySize);
    }

    private static long append(TopicPartition partition, List<Message> messages, Message message,
                               long lastOffset, long minOffset) {
        long offset = message.getOffset();
        if (offset <= lastOffset) {
            throw new CorruptMessageException(String.format(
                    "Offsets of %s are not increasing: %d after %d", partition, offset, lastOffset));
        }
        if (offset >= minOffset) {
            messages.add(message);
        }
        return offset;
    }

    private List<Message> unwrap(TopicPartition partition, Entry wrapper) {
        codecRegistry.ensureAvailable(wrapper.codec);
        if (wrapper.value == null) {
            throw new CorruptMessageException(String.format(
                    "Compressed message at offset %d of %s has no payload", wrapper.offset, partition));
        }

        ByteBuffer inner = ByteBuffer.wrap(codecRegistry.decompress(wrapper.codec, wrapper.value));
        List<Message> messages = new ArrayList<>();
        while (inner.hasRemaining()) {
            if (inner.remaining() < LOG_OVERHEAD) {
                throw new CorruptMessageException("Truncated entry inside compressed message at offset "
                        + wrapper.offset + " of " + partition);
            }
            long offset = inner.getLong();
            int size = inner.getInt();
            if (size < MESSAGE_OVERHEAD || inner.remaining() < size) {
                throw new CorruptMessageException("Invalid entry inside compressed message at offset "
                        + wrapper.offset + " of " + partition);
            }
            ByteBuffer body = inner.slice();
            body.limit(size);
            inner.position(inner.position() + size);

            Entry entry = readEntry(partition, offset, body);
            if (entry.codec != CompressionCodec.NONE) {
                throw new CorruptMessageException("Nested compression inside message at offset "
                        + wrapper.offset + " of " + partition);
            }
            messages.add(entry.toMessage(partition));
        }

        if (messages.isEmpty() || messages.get(messages.size() - 1).getOffset() != wrapper.offset) {
            throw new CorruptMessageException(String.format(
                    "Compressed message at offset %d of %s does not end with its own offset",
                    wrapper.offset, partition));
        }
        return messages;
    }

    private static Entry readEntry(TopicPartition partition, long offset, ByteBuffer body) {
        int storedCrc = body.getInt();
        int computedCrc = ChecksumUtil.crc32(body);
        if (storedCrc != computedCrc) {
            throw new CorruptMessageException(String.format(
                    "CRC mismatch for message at offset %d of %s (stored %08x, computed %08x)",
                    offset, partition, storedCrc, computedCrc));
        }

        byte magic = body.get();
        if (magic != MAGIC) {
            throw new CorruptMessageException(String.format(
                    "Unknown magic byte %d for message at offset %d of %s", magic, offset, partition));
        }
        byte attributes = body.get();
        CompressionCodec codec = CompressionCodec.fromAttributes(attributes);
        if (codec == null) {
            throw new UnsupportedCodecException("Unknown compression codec id "
                    + (attributes & CompressionCodec.ATTRIBUTE_MASK) + " at offset " + offset + " of " + partition);
        }
        long timestamp = body.getLong();
        byte[] key = readBytes(partition, offset, body);
        byte[] value = readBytes(partition, offset, body);
        if (body.hasRemaining()) {
            throw new CorruptMessageException(String.format(
                    "%d trailing bytes in message at offset %d of %s", body.remaining(), offset, partition));
        }
        return new Entry(offset, codec, timestamp, key, value);
    }

    private static byte[] readBytes(TopicPartition partition, long offset, ByteBuffer body) {
        if (body.remaining() < 4) {
            throw new CorruptMessageException("Message at offset " + offset + " of " + partition + " is too short");
        }
        int length = body.getInt();
        if (length < 0) {
            return null;
        }
        if (length > body.remaining()) {
            throw new CorruptMessageException(String.format(
                    "Field length %d exceeds message at offset %d of %s", length, offset, partition));
        }
        byte[] bytes = new byte[length];
        body.get(bytes);
        return bytes;
    }

    private static final class Entry {
        final long offset;
        final CompressionCodec codec;
        final long timestamp;
        final byte[] key;
        final byte[] value;

        Entry(long offset, CompressionCodec codec, long timestamp, byte[] key, byte[] value) {
            this.offset = offset;
            this.codec = codec;
            this.timestamp = timestamp;
            this.key = key;
            this.value = value;
        }

        Message toMessage(TopicPartition partition) {
            return Message.builder()
                    .topic(partition.getTopic())
                    .partition(partition.getPartition())
                    .offset(offset)
                    .timestamp(timestamp)
                    .key(key == null ? null : new String(key, StandardCharsets.UTF_8))
                    .value(value)
                    .build();
        }
    }
}
