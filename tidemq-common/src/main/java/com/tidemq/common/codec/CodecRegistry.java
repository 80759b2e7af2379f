package com.tidemq.common.codec;

import com.tidemq.common.exception.CorruptMessageException;
import com.tidemq.common.exception.UnsupportedCodecException;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Maps each {@link CompressionCodec} to its stream implementation.
 *
 * <p>Availability is decided once, when the registry is built: a codec is
 * available when it was not disabled by configuration and its library could be
 * loaded. Decoding a message set never has to touch the network to find out a
 * codec is missing.
 */
@Slf4j
public class CodecRegistry {

    interface StreamCodec {
        InputStream wrapForInput(InputStream in) throws IOException;

        OutputStream wrapForOutput(OutputStream out) throws IOException;
    }

    private final Map<CompressionCodec, StreamCodec> codecs = new EnumMap<>(CompressionCodec.class);

    public CodecRegistry() {
        this(Collections.emptySet());
    }

    public CodecRegistry(Collection<CompressionCodec> disabled) {
        Set<CompressionCodec> disabledCodecs = disabled.isEmpty()
                ? EnumSet.noneOf(CompressionCodec.class)
                : EnumSet.copyOf(disabled);

        for (CompressionCodec codec : CompressionCodec.values()) {
            if (codec == CompressionCodec.NONE) {
                continue;
            }
            if (disabledCodecs.contains(codec)) {
                log.info("Compression codec {} disabled by configuration", codec);
                continue;
            }
            StreamCodec streamCodec = load(codec);
            if (streamCodec != null) {
                codecs.put(codec, streamCodec);
            }
        }
        log.debug("Available compression codecs: {}", codecs.keySet());
    }

    private static StreamCodec load(CompressionCodec codec) {
        try {
            switch (codec) {
                case GZIP:
                    return new StreamCodec() {
                        @Override
                        public InputStream wrapForInput(InputStream in) throws IOException {
                            return new GZIPInputStream(in);
                        }

                        @Override
                        public OutputStream wrapForOutput(OutputStream out) throws IOException {
                            return new GZIPOutputStream(out);
                        }
                    };
                case SNAPPY:
                    SnappySupport.probe();
                    return new StreamCodec() {
                        @Override
                        public InputStream wrapForInput(InputStream in) throws IOException {
                            return SnappySupport.wrapForInput(in);
                        }

                        @Override
                        public OutputStream wrapForOutput(OutputStream out) {
                            return SnappySupport.wrapForOutput(out);
                        }
                    };
                case LZ4:
                    Lz4Support.probe();
                    return new StreamCodec() {
                        @Override
                        public InputStream wrapForInput(InputStream in) throws IOException {
                            return Lz4Support.wrapForInput(in);
                        }

                        @Override
                        public OutputStream wrapForOutput(OutputStream out) throws IOException {
                            return Lz4Support.wrapForOutput(out);
                        }
                    };
                default:
                    return null;
            }
        } catch (IOException | Error e) {
            // NoClassDefFoundError when the jar is absent, SnappyError when the native part fails to load
            log.warn("Libraries for {} compression codec could not be loaded: {}", codec, e.toString());
            return null;
        }
    }

    public boolean isAvailable(CompressionCodec codec) {
        return codec == CompressionCodec.NONE || codecs.containsKey(codec);
    }

    public Set<CompressionCodec> availableCodecs() {
        EnumSet<CompressionCodec> available = EnumSet.of(CompressionCodec.NONE);
        available.addAll(codecs.keySet());
        return available;
    }

    public void ensureAvailable(CompressionCodec codec) {
        if (!isAvailable(codec)) {
            throw new UnsupportedCodecException("Libraries for " + codec + " compression codec not found");
        }
    }

    public byte[] decompress(CompressionCodec codec, byte[] data) {
        ensureAvailable(codec);
        if (codec == CompressionCodec.NONE) {
            return data;
        }
        try (InputStream in = codecs.get(codec).wrapForInput(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        } catch (IOException | RuntimeException e) {
            throw new CorruptMessageException("Failed to decompress " + codec + " message set", e);
        }
    }

    public byte[] compress(CompressionCodec codec, byte[] data) {
        ensureAvailable(codec);
        if (codec == CompressionCodec.NONE) {
            return data;
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(32, data.length / 2));
        try (OutputStream out = codecs.get(codec).wrapForOutput(buffer)) {
            out.write(data);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to compress message set with " + codec, e);
        }
        return buffer.toByteArray();
    }
}
