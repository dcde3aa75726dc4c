/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.compression;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;

import dev.aisparquet.metadata.CompressionCodec;

/**
 * Factory for creating compressor instances based on compression codec.
 */
public class CompressorFactory {

    private static final Logger LOG = System.getLogger(CompressorFactory.class.getName());

    private CompressorFactory() {
    }

    /**
     * Get a compressor for the given compression codec.
     *
     * @param codec the compression codec
     * @return the appropriate compressor
     * @throws UnsupportedOperationException if the codec is not supported or the required library is missing
     */
    public static Compressor getCompressor(CompressionCodec codec) {
        Compressor compressor = switch (codec) {
            case UNCOMPRESSED -> new UncompressedCompressor();
            case GZIP -> new GzipCompressor();
            case SNAPPY -> {
                checkClassAvailable("org.xerial.snappy.Snappy",
                        "SNAPPY",
                        "org.xerial.snappy:snappy-java");
                yield new SnappyCompressor();
            }
            case ZSTD -> {
                checkClassAvailable("com.github.luben.zstd.Zstd",
                        "ZSTD",
                        "com.github.luben:zstd-jni");
                yield new ZstdCompressor();
            }
            case LZ4_RAW -> {
                checkClassAvailable("net.jpountz.lz4.LZ4Factory",
                        "LZ4_RAW",
                        "org.lz4:lz4-java");
                yield new Lz4RawCompressor();
            }
            case BROTLI -> {
                checkClassAvailable("com.aayushatharva.brotli4j.Brotli4jLoader",
                        "BROTLI",
                        "com.aayushatharva.brotli4j:brotli4j");
                yield new BrotliCompressor();
            }
            case LZ4 -> throw new UnsupportedOperationException(
                    "Hadoop-framed LZ4 compression is not supported, use LZ4_RAW instead");
            case LZO -> throw new UnsupportedOperationException("LZO compression is not supported");
        };
        LOG.log(Level.DEBUG, "Using {0} compressor", compressor.getName());
        return compressor;
    }

    private static void checkClassAvailable(String className, String codecName, String dependency) {
        try {
            Class.forName(className);
        }
        catch (ClassNotFoundException e) {
            throw new UnsupportedOperationException(
                    "Cannot write " + codecName + "-compressed Parquet file: required library not found. " +
                            "Add the following dependency to your project: " + dependency);
        }
    }
}
