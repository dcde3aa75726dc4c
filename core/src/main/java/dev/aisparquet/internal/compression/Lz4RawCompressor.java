/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.compression;

import java.io.IOException;

import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;

/**
 * Compressor for LZ4_RAW (standard LZ4 block format without framing or headers).
 */
public class Lz4RawCompressor implements Compressor {

    private final LZ4Compressor compressor;

    public Lz4RawCompressor() {
        this.compressor = LZ4Factory.fastestInstance().fastCompressor();
    }

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        try {
            return compressor.compress(uncompressed);
        }
        catch (LZ4Exception e) {
            throw new IOException("LZ4_RAW compression failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getName() {
        return "LZ4_RAW";
    }
}
