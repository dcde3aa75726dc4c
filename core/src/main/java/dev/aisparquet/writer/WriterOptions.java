/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.writer;

import dev.aisparquet.metadata.CompressionCodec;

/**
 * Options for {@link ParquetFileWriter}.
 *
 * @param codec compression applied to every data page
 * @param createdBy value of the footer's {@code created_by} field
 */
public record WriterOptions(CompressionCodec codec, String createdBy) {

    public static final String COMPRESSION_PROPERTY = "aisparquet.compression";

    public static final String DEFAULT_CREATED_BY = "aisparquet version 1.0.0";

    public WriterOptions {
        if (codec == null) {
            throw new IllegalArgumentException("Compression codec must not be null");
        }
    }

    public static WriterOptions defaults() {
        return new WriterOptions(CompressionCodec.SNAPPY, DEFAULT_CREATED_BY);
    }

    /**
     * Defaults, with the codec overridden by the {@value #COMPRESSION_PROPERTY} system property if set.
     */
    public static WriterOptions fromSystemProperties() {
        String codec = System.getProperty(COMPRESSION_PROPERTY);
        if (codec == null || codec.isBlank()) {
            return defaults();
        }
        return new WriterOptions(CompressionCodec.fromName(codec), DEFAULT_CREATED_BY);
    }

    public WriterOptions withCodec(CompressionCodec codec) {
        return new WriterOptions(codec, createdBy);
    }
}
