/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.encoding;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import dev.aisparquet.column.ColumnData;

/**
 * Encoder for PLAIN encoding. Only non-null values are written; nulls are carried
 * by the definition levels.
 */
public class PlainEncoder {

    private PlainEncoder() {
    }

    /**
     * Number of bytes {@link #encode(ColumnData, ByteBuffer)} will write for the given column.
     */
    public static int encodedSize(ColumnData data) {
        int nonNull = data.nonNullCount();
        if (data instanceof ColumnData.IntColumn) {
            return nonNull * Integer.BYTES;
        }
        else if (data instanceof ColumnData.LongColumn) {
            return nonNull * Long.BYTES;
        }
        else if (data instanceof ColumnData.BooleanColumn) {
            return (nonNull + 7) / 8;
        }
        else {
            return nonNull * data.column().typeLength();
        }
    }

    public static void encode(ColumnData data, ByteBuffer target) {
        ByteBuffer out = target.order(ByteOrder.LITTLE_ENDIAN);
        int count = data.recordCount();

        if (data instanceof ColumnData.IntColumn c) {
            int[] values = c.values();
            for (int i = 0; i < count; i++) {
                if (!c.isNull(i)) {
                    out.putInt(values[i]);
                }
            }
        }
        else if (data instanceof ColumnData.LongColumn c) {
            long[] values = c.values();
            for (int i = 0; i < count; i++) {
                if (!c.isNull(i)) {
                    out.putLong(values[i]);
                }
            }
        }
        else if (data instanceof ColumnData.BooleanColumn c) {
            encodeBooleans(c, out);
        }
        else if (data instanceof ColumnData.FixedLenByteArrayColumn c) {
            int width = c.column().typeLength();
            byte[][] values = c.values();
            for (int i = 0; i < count; i++) {
                if (!c.isNull(i)) {
                    if (values[i].length != width) {
                        throw new IllegalStateException("Value of column '" + c.column().name() + "' at row " + i
                                + " has " + values[i].length + " bytes, expected " + width);
                    }
                    out.put(values[i]);
                }
            }
        }
    }

    /**
     * Booleans are bit-packed, least significant bit first.
     */
    private static void encodeBooleans(ColumnData.BooleanColumn column, ByteBuffer out) {
        boolean[] values = column.values();
        int current = 0;
        int bit = 0;
        for (int i = 0; i < column.recordCount(); i++) {
            if (column.isNull(i)) {
                continue;
            }
            if (values[i]) {
                current |= 1 << bit;
            }
            if (++bit == 8) {
                out.put((byte) current);
                current = 0;
                bit = 0;
            }
        }
        if (bit > 0) {
            out.put((byte) current);
        }
    }
}
