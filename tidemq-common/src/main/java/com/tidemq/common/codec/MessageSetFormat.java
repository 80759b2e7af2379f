package com.tidemq.common.codec;

/**
 * Layout constants of a message set.
 *
 * <pre>
 * offset      int64
 * size        int32   bytes that follow
 * crc         int32   CRC32 of everything after the crc field
 * magic       int8
 * attributes  int8    low 3 bits: codec id
 * timestamp   int64
 * keyLength   int32   -1 for null
 * key         bytes
 * valueLength int32   -1 for null
 * value       bytes
 * </pre>
 */
public final class MessageSetFormat {

    public static final int OFFSET_LENGTH = 8;
    public static final int SIZE_LENGTH = 4;
    public static final int LOG_OVERHEAD = OFFSET_LENGTH + SIZE_LENGTH;

    public static final int CRC_LENGTH = 4;
    public static final int MAGIC_LENGTH = 1;
    public static final int ATTRIBUTES_LENGTH = 1;
    public static final int TIMESTAMP_LENGTH = 8;
    public static final int KEY_SIZE_LENGTH = 4;
    public static final int VALUE_SIZE_LENGTH = 4;

    /** Size of a message body with null key and null value. */
    public static final int MESSAGE_OVERHEAD = CRC_LENGTH + MAGIC_LENGTH + ATTRIBUTES_LENGTH
            + TIMESTAMP_LENGTH + KEY_SIZE_LENGTH + VALUE_SIZE_LENGTH;

    public static final byte MAGIC = 1;

    private MessageSetFormat() {
    }
}
