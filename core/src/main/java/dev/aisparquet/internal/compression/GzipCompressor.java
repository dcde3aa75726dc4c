/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.compression;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPOutputStream;

/**
 * Compressor for GZIP using the JDK's deflater. Writes a single GZIP member.
 */
public class GzipCompressor implements Compressor {

    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, uncompressed.length / 4));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(uncompressed);
        }
        return out.toByteArray();
    }

    @Override
    public String getName() {
        return "GZIP";
    }
}
