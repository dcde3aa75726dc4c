/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.metadata;

/**
 * Column chunk metadata. {@code fileOffset} points at the first page of the chunk.
 */
public record ColumnChunk(long fileOffset, ColumnMetaData metaData) {
}
