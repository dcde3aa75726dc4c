/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.compression;

import java.io.IOException;

/**
 * Interface for compressing page data before it is written.
 */
public interface Compressor {

    /**
     * Compress the given page data.
     *
     * @param uncompressed the uncompressed page bytes
     * @return the compressed bytes
     * @throws IOException if compression fails
     */
    byte[] compress(byte[] uncompressed) throws IOException;

    /**
     * Get the name of this compressor.
     */
    String getName();
}
