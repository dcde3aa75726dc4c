/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.compression;

import java.io.IOException;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdException;

/**
 * Compressor for ZSTD.
 */
public class ZstdCompressor implements Compressor {

    static final int DEFAULT_LEVEL = 3;

    private final int level;

    public ZstdCompressor() {
        this(DEFAULT_LEVEL);
    }

    public ZstdCompressor(int level) {
        this.level = level;
    }

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        try {
            return Zstd.compress(uncompressed, level);
        }
        catch (ZstdException e) {
            throw new IOException("ZSTD compression failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getName() {
        return "ZSTD";
    }
}
