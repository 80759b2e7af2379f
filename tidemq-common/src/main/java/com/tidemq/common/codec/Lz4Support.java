package com.tidemq.common.codec;

import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4FrameInputStream;
import net.jpountz.lz4.LZ4FrameOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * LZ4 streams in the standard frame format.
 */
final class Lz4Support {

    private Lz4Support() {
    }

    static void probe() {
        LZ4Factory.fastestInstance();
    }

    static InputStream wrapForInput(InputStream in) throws IOException {
        return new LZ4FrameInputStream(in);
    }

    static OutputStream wrapForOutput(OutputStream out) throws IOException {
        return new LZ4FrameOutputStream(out);
    }
}
