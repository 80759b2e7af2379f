package com.tidemq.common.codec;

import java.util.Locale;

/**
 * Compression codec of a message set entry. The id is stored in the low bits
 * of the message attributes.
 */
public enum CompressionCodec {
    NONE((byte) 0, "none"),
    // Shipped with the JDK
    GZIP((byte) 1, "gzip"),
    // Library classes are only touched from SnappySupport / Lz4Support, so a
    // missing or broken native library does not break loading this enum.
    SNAPPY((byte) 2, "snappy"),
    LZ4((byte) 3, "lz4");

    public static final int ATTRIBUTE_MASK = 0x07;

    public final byte id;
    public final String name;

    CompressionCodec(byte id, String name) {
        this.id = id;
        this.name = name;
    }

    public static CompressionCodec fromAttributes(byte attributes) {
        return fromId(attributes & ATTRIBUTE_MASK);
    }

    /**
     * @return the codec with this id, or null if the id is unknown
     */
    public static CompressionCodec fromId(int id) {
        for (CompressionCodec codec : values()) {
            if (codec.id == id) {
                return codec;
            }
        }
        return null;
    }

    public static CompressionCodec forName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (CompressionCodec codec : values()) {
            if (codec.name.equals(normalized)) {
                return codec;
            }
        }
        throw new IllegalArgumentException("Unknown compression codec: " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
