package com.tidemq.common.codec;

import com.tidemq.common.model.Message;
import com.tidemq.common.util.ChecksumUtil;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.tidemq.common.codec.MessageSetFormat.CRC_LENGTH;
import static com.tidemq.common.codec.MessageSetFormat.LOG_OVERHEAD;
import static com.tidemq.common.codec.MessageSetFormat.MAGIC;
import static com.tidemq.common.codec.MessageSetFormat.MESSAGE_OVERHEAD;

/**
 * Writes messages in the layout read by {@link MessageDecoder}. Brokers use it
 * to build fetch payloads; every message must already carry its offset.
 */
public class MessageSetWriter {

    private final CodecRegistry codecRegistry;

    public MessageSetWriter(CodecRegistry codecRegistry) {
        this.codecRegistry = codecRegistry;
    }

    /**
     * Write {@code messages} as plain entries, or as one compressed wrapper entry
     * carrying the offset of the last message.
     */
    public byte[] write(List<Message> messages, CompressionCodec codec) {
        if (messages.isEmpty()) {
            return new byte[0];
        }
        if (codec == CompressionCodec.NONE) {
            return writePlain(messages);
        }

        byte[] compressed = codecRegistry.compress(codec, writePlain(messages));
        Message last = messages.get(messages.size() - 1);
        ByteBuffer buffer = ByteBuffer.allocate(LOG_OVERHEAD + MESSAGE_OVERHEAD + compressed.length);
        writeEntry(buffer, last.getOffset(), codec, timestampOf(last), null, compressed);
        return buffer.array();
    }

    /**
     * Bytes one uncompressed message occupies in a message set.
     */
    public static int sizeInBytes(Message message) {
        return LOG_OVERHEAD + MESSAGE_OVERHEAD + keyBytesLength(message.getKey())
                + (message.getValue() == null ? 0 : message.getValue().length);
    }

    private static byte[] writePlain(List<Message> messages) {
        int total = 0;
        for (Message message : messages) {
            total += sizeInBytes(message);
        }
        ByteBuffer buffer = ByteBuffer.allocate(total);
        for (Message message : messages) {
            if (message.getOffset() == null) {
                throw new IllegalArgumentException("Message has no offset: " + message);
            }
            byte[] key = message.getKey() == null ? null : message.getKey().getBytes(StandardCharsets.UTF_8);
            writeEntry(buffer, message.getOffset(), CompressionCodec.NONE, timestampOf(message), key,
                    message.getValue());
        }
        return buffer.array();
    }

    private static void writeEntry(ByteBuffer buffer, long offset, CompressionCodec codec, long timestamp,
                                   byte[] key, byte[] value) {
        int size = MESSAGE_OVERHEAD + (key == null ? 0 : key.length) + (value == null ? 0 : value.length);
        buffer.putLong(offset);
        buffer.putInt(size);

        int crcPosition = buffer.position();
        buffer.position(crcPosition + CRC_LENGTH);
        buffer.put(MAGIC);
        buffer.put(codec.id);
        buffer.putLong(timestamp);
        putBytes(buffer, key);
        putBytes(buffer, value);

        int end = buffer.position();
        int crc = ChecksumUtil.crc32(buffer.array(), crcPosition + CRC_LENGTH, end - crcPosition - CRC_LENGTH);
        buffer.putInt(crcPosition, crc);
    }

    private static void putBytes(ByteBuffer buffer, byte[] bytes) {
        if (bytes == null) {
            buffer.putInt(-1);
        } else {
            buffer.putInt(bytes.length);
            buffer.put(bytes);
        }
    }

    private static int keyBytesLength(String key) {
        return key == null ? 0 : key.getBytes(StandardCharsets.UTF_8).length;
    }

    private static long timestampOf(Message message) {
        return message.getTimestamp() == null ? -1L : message.getTimestamp();
    }
}
