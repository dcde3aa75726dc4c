/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.writer;

import java.io.IOException;

import dev.aisparquet.schema.ExportSchema;

/**
 * Sink for flushed row groups. The schema is fixed when the writer is created.
 *
 * <pre>{@code
 * try (RowGroupWriter group = container.createRowGroup()) {
 *     for (ColumnData column : columns) {
 *         group.writeColumn(column);
 *     }
 * }
 * }</pre>
 *
 * <p>Closing the container finalizes it after the last row group.</p>
 */
public interface ContainerWriter extends AutoCloseable {

    ExportSchema schema();

    /**
     * Starts a new row group. Only one row group may be open at a time.
     *
     * @throws IllegalStateException if a row group is still open or the writer is closed
     */
    RowGroupWriter createRowGroup() throws IOException;

    @Override
    void close() throws IOException;
}
