/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.metadata;

import java.util.Locale;

/**
 * Compression codecs defined by Parquet.
 */
public enum CompressionCodec {
    UNCOMPRESSED(0),
    SNAPPY(1),
    GZIP(2),
    LZO(3),
    BROTLI(4),
    LZ4(5),
    ZSTD(6),
    LZ4_RAW(7);

    private final int thriftValue;

    CompressionCodec(int thriftValue) {
        this.thriftValue = thriftValue;
    }

    public int getThriftValue() {
        return thriftValue;
    }

    /**
     * Resolves a codec from its name, ignoring case (e.g. {@code "zstd"}).
     *
     * @throws IllegalArgumentException if no codec has the given name
     */
    public static CompressionCodec fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (CompressionCodec codec : values()) {
            if (codec.name().equals(normalized)) {
                return codec;
            }
        }
        throw new IllegalArgumentException("Unknown compression codec: " + name);
    }
}
