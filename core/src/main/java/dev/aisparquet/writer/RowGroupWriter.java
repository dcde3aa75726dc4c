/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.writer;

import java.io.IOException;

import dev.aisparquet.column.ColumnData;

/**
 * Scope of one row group. Accepts exactly one {@link #writeColumn(ColumnData)} call per schema
 * column, in schema order, all with the same record count. Closing the scope finalizes the row group.
 */
public interface RowGroupWriter extends AutoCloseable {

    /**
     * @throws IllegalStateException if the column is out of order or its record count differs
     *         from the columns written before
     */
    void writeColumn(ColumnData column) throws IOException;

    /**
     * @throws IllegalStateException if not every schema column was written
     */
    @Override
    void close() throws IOException;
}
