/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.export;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import dev.aisparquet.column.ColumnData;
import dev.aisparquet.schema.ColumnSchema;
import dev.aisparquet.schema.ExportSchema;

/**
 * Pre-allocated column-major storage for one row group.
 * <p>
 * Every column gets a primitive array of the group capacity, plus a null mask for nullable columns.
 * Text columns get one fixed-width byte slice per row. Nothing is allocated after construction;
 * {@link #truncate(int)} only shortens the logical length seen by {@link #snapshot()}.
 * </p>
 */
public final class ColumnBufferSet {

    private final ExportSchema schema;
    private final int capacity;

    private final int[][] intValues;
    private final long[][] longValues;
    private final boolean[][] booleanValues;
    private final byte[][][] textValues;
    private final BitSet[] nulls;

    private int length;

    public ColumnBufferSet(ExportSchema schema, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.schema = schema;
        this.capacity = capacity;
        this.length = capacity;

        int columnCount = schema.getColumnCount();
        this.intValues = new int[columnCount][];
        this.longValues = new long[columnCount][];
        this.booleanValues = new boolean[columnCount][];
        this.textValues = new byte[columnCount][][];
        this.nulls = new BitSet[columnCount];

        for (ColumnSchema column : schema.getColumns()) {
            int index = column.columnIndex();
            switch (column.type()) {
                case INT32 -> intValues[index] = new int[capacity];
                case INT64 -> longValues[index] = new long[capacity];
                case BOOLEAN -> booleanValues[index] = new boolean[capacity];
                case FIXED_LEN_BYTE_ARRAY -> textValues[index] = new byte[capacity][column.typeLength()];
            }
            if (column.isNullable()) {
                nulls[index] = new BitSet(capacity);
            }
        }
    }

    public ExportSchema schema() {
        return schema;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Number of rows handed out by {@link #snapshot()}.
     */
    public int length() {
        return length;
    }

    public void setInt(int row, int column, int value) {
        ints(column)[row] = value;
        markPresent(row, column);
    }

    public void setLong(int row, int column, long value) {
        longs(column)[row] = value;
        markPresent(row, column);
    }

    public void setBoolean(int row, int column, boolean value) {
        booleans(column)[row] = value;
        markPresent(row, column);
    }

    /**
     * Marks the value at {@code row} as absent.
     *
     * @throws IllegalArgumentException if the column is not nullable
     */
    public void setNull(int row, int column) {
        BitSet mask = nulls[column];
        if (mask == null) {
            throw new IllegalArgumentException("Column '" + schema.getColumn(column).name() + "' is not nullable");
        }
        checkRow(row);
        mask.set(row);
    }

    /**
     * The pre-allocated slice of a text column for {@code row}, to be filled by a {@link TextFieldNormalizer}.
     */
    public byte[] textBuffer(int row, int column) {
        byte[][] slices = textValues[column];
        if (slices == null) {
            throw wrongType(column, "text");
        }
        return slices[row];
    }

    /**
     * Shortens the logical length to the number of rows actually written. Only meant for the last,
     * partially filled group.
     */
    public void truncate(int newLength) {
        if (newLength < 0 || newLength > capacity) {
            throw new IllegalArgumentException("Length must be between 0 and " + capacity + ": " + newLength);
        }
        this.length = newLength;
    }

    /**
     * Restores the full capacity and clears all null marks. Values are left in place and are
     * overwritten by the next rows.
     */
    public void reset() {
        length = capacity;
        for (BitSet mask : nulls) {
            if (mask != null) {
                mask.clear();
            }
        }
    }

    /**
     * Column-major view of the first {@link #length()} rows, in schema order. The returned
     * columns share this buffer set's arrays and are only valid until the next write.
     */
    public List<ColumnData> snapshot() {
        List<ColumnData> columns = new ArrayList<>(schema.getColumnCount());
        for (ColumnSchema column : schema.getColumns()) {
            int index = column.columnIndex();
            columns.add(switch (column.type()) {
                case INT32 -> new ColumnData.IntColumn(column, intValues[index], nulls[index], length);
                case INT64 -> new ColumnData.LongColumn(column, longValues[index], nulls[index], length);
                case BOOLEAN -> new ColumnData.BooleanColumn(column, booleanValues[index], nulls[index], length);
                case FIXED_LEN_BYTE_ARRAY -> new ColumnData.FixedLenByteArrayColumn(column, textValues[index], nulls[index], length);
            });
        }
        return columns;
    }

    private int[] ints(int column) {
        int[] values = intValues[column];
        if (values == null) {
            throw wrongType(column, "INT32");
        }
        return values;
    }

    private long[] longs(int column) {
        long[] values = longValues[column];
        if (values == null) {
            throw wrongType(column, "INT64");
        }
        return values;
    }

    private boolean[] booleans(int column) {
        boolean[] values = booleanValues[column];
        if (values == null) {
            throw wrongType(column, "BOOLEAN");
        }
        return values;
    }

    private void markPresent(int row, int column) {
        BitSet mask = nulls[column];
        if (mask != null) {
            mask.clear(row);
        }
    }

    private void checkRow(int row) {
        if (row < 0 || row >= capacity) {
            throw new IndexOutOfBoundsException("Row " + row + " outside of capacity " + capacity);
        }
    }

    private IllegalArgumentException wrongType(int column, String expected) {
        ColumnSchema schemaColumn = schema.getColumn(column);
        return new IllegalArgumentException("Column '" + schemaColumn.name() + "' is " + schemaColumn.type()
                + ", not " + expected);
    }
}
