/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.compression;

import java.io.IOException;

import com.aayushatharva.brotli4j.Brotli4jLoader;
import com.aayushatharva.brotli4j.encoder.Encoder;

/**
 * Compressor for Brotli, backed by the brotli4j native library.
 */
public class BrotliCompressor implements Compressor {

    public BrotliCompressor() {
        Brotli4jLoader.ensureAvailability();
    }

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        return Encoder.compress(uncompressed);
    }

    @Override
    public String getName() {
        return "BROTLI";
    }
}
