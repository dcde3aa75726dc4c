/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.compression;

/**
 * "Compressor" for uncompressed data - returns the input as is.
 */
public class UncompressedCompressor implements Compressor {

    @Override
    public byte[] compress(byte[] uncompressed) {
        return uncompressed;
    }

    @Override
    public String getName() {
        return "UNCOMPRESSED";
    }
}
