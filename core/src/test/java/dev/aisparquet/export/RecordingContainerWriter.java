/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.export;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import dev.aisparquet.column.ColumnData;
import dev.aisparquet.schema.ExportSchema;
import dev.aisparquet.writer.ContainerWriter;
import dev.aisparquet.writer.RowGroupWriter;

/**
 * Keeps copies of all written row groups in memory, or only their record counts.
 */
class RecordingContainerWriter implements ContainerWriter {

    private final ExportSchema schema;
    final List<List<List<Object>>> rowGroups = new ArrayList<>();
    final List<Integer> recordCounts = new ArrayList<>();
    int closeCount;
    boolean failOnWrite;
    boolean keepValues = true;

    RecordingContainerWriter(ExportSchema schema) {
        this.schema = schema;
    }

    @Override
    public ExportSchema schema() {
        return schema;
    }

    @Override
    public RowGroupWriter createRowGroup() {
        List<List<Object>> columns = new ArrayList<>();
        return new RowGroupWriter() {

            private int recordCount;

            @Override
            public void writeColumn(ColumnData data) throws IOException {
                if (failOnWrite) {
                    throw new IOException("disk full");
                }
                if (!keepValues) {
                    recordCount = data.recordCount();
                    return;
                }
                List<Object> values = new ArrayList<>(data.recordCount());
                for (int i = 0; i < data.recordCount(); i++) {
                    Object value = data.getValue(i);
                    values.add(value instanceof byte[] bytes ? Arrays.copyOf(bytes, bytes.length) : value);
                }
                columns.add(values);
                recordCount = data.recordCount();
            }

            @Override
            public void close() {
                rowGroups.add(columns);
                recordCounts.add(recordCount);
            }
        };
    }

    @Override
    public void close() {
        closeCount++;
    }

    Object value(int rowGroup, String column, int row) {
        return rowGroups.get(rowGroup).get(schema.getColumn(column).columnIndex()).get(row);
    }
}
