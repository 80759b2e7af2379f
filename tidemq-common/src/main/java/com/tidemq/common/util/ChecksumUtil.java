package com.tidemq.common.util;

import java.nio.ByteBuffer;
import java.util.zip.CRC32;

/**
 * Utility for calculating message checksums
 */
public final class ChecksumUtil {

    private ChecksumUtil() {
    }

    /**
     * CRC32 of {@code length} bytes of {@code data} starting at {@code offset}.
     */
    public static int crc32(byte[] data, int offset, int length) {
        CRC32 crc32 = new CRC32();
        crc32.update(data, offset, length);
        return (int) crc32.getValue();
    }

    /**
     * CRC32 of the remaining bytes of the buffer. The buffer position is not moved.
     */
    public static int crc32(ByteBuffer buffer) {
        CRC32 crc32 = new CRC32();
        crc32.update(buffer.duplicate());
        return (int) crc32.getValue();
    }
}
