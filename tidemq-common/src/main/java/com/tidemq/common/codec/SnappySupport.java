package com.tidemq.common.codec;

import org.xerial.snappy.Snappy;
import org.xerial.snappy.SnappyInputStream;
import org.xerial.snappy.SnappyOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Snappy streams using the xerial framing. Only referenced once the registry
 * has decided snappy is wanted.
 */
final class SnappySupport {

    private SnappySupport() {
    }

    /**
     * Forces the native library to load.
     */
    static void probe() throws IOException {
        Snappy.uncompress(Snappy.compress(new byte[]{1}));
    }

    static InputStream wrapForInput(InputStream in) throws IOException {
        return new SnappyInputStream(in);
    }

    static OutputStream wrapForOutput(OutputStream out) {
        return new SnappyOutputStream(out);
    }
}
