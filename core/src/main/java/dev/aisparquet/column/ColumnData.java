/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.column;

import java.util.BitSet;

import dev.aisparquet.schema.ColumnSchema;

/**
 * Column-major data of one column within one row group.
 * <p>
 * Values live in typed primitive arrays that may be longer than {@link #recordCount()};
 * only the first {@code recordCount} entries belong to the row group. A {@link BitSet}
 * marks null rows; it is {@code null} for non-nullable columns.
 * </p>
 */
public sealed interface ColumnData {

    ColumnSchema column();

    int recordCount();

    BitSet nulls();

    /** Get the value at index, boxing primitives. Returns null for null rows. */
    Object getValue(int index);

    default boolean isNull(int index) {
        BitSet n = nulls();
        return n != null && n.get(index);
    }

    /** Number of non-null values among the first {@link #recordCount()} rows. */
    default int nonNullCount() {
        BitSet n = nulls();
        if (n == null) {
            return recordCount();
        }
        int nullCount = n.get(0, recordCount()).cardinality();
        return recordCount() - nullCount;
    }

    record IntColumn(ColumnSchema column, int[] values, BitSet nulls, int recordCount) implements ColumnData {
        public int get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : get(index);
        }
    }

    record LongColumn(ColumnSchema column, long[] values, BitSet nulls, int recordCount) implements ColumnData {
        public long get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : get(index);
        }
    }

    record BooleanColumn(ColumnSchema column, boolean[] values, BitSet nulls, int recordCount) implements ColumnData {
        public boolean get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : get(index);
        }
    }

    record FixedLenByteArrayColumn(ColumnSchema column, byte[][] values, BitSet nulls, int recordCount) implements ColumnData {
        public byte[] get(int index) {
            return values[index];
        }

        @Override
        public Object getValue(int index) {
            return isNull(index) ? null : get(index);
        }
    }
}
