/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.compression;

import java.io.IOException;

import org.xerial.snappy.Snappy;

/**
 * Compressor for Snappy (raw block format, no framing).
 */
public class SnappyCompressor implements Compressor {

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        return Snappy.compress(uncompressed);
    }

    @Override
    public String getName() {
        return "SNAPPY";
    }
}
