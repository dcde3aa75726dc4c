/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.encoding;

import java.io.ByteArrayOutputStream;
import java.util.BitSet;

/**
 * Encoder for RLE/Bit-Packing Hybrid encoding.
 * Used for definition levels of nullable columns.
 * <p>
 * Runs of at least 8 equal values (and a trailing run of any length) become RLE runs;
 * everything else is bit-packed in groups of 8 values, at most 63 groups per run header.
 * The last bit-packed group may be padded with zeros; readers stop at the page's value count.
 * </p>
 */
public class RleBitPackingHybridEncoder {

    private static final int MIN_RLE_RUN = 8;
    private static final int MAX_GROUPS_PER_RUN = 63;

    private final int bitWidth;
    private final int valueBytes;

    public RleBitPackingHybridEncoder(int bitWidth) {
        if (bitWidth < 1 || bitWidth > 32) {
            throw new IllegalArgumentException("Bit width must be between 1 and 32: " + bitWidth);
        }
        this.bitWidth = bitWidth;
        this.valueBytes = (bitWidth + 7) / 8;
    }

    /**
     * Encodes definition levels for a flat nullable column: 0 for null rows, 1 otherwise.
     */
    public static byte[] encodeDefinitionLevels(BitSet nulls, int count) {
        int[] levels = new int[count];
        for (int i = 0; i < count; i++) {
            levels[i] = nulls != null && nulls.get(i) ? 0 : 1;
        }
        return new RleBitPackingHybridEncoder(1).encode(levels, 0, count);
    }

    public byte[] encode(int[] values, int offset, int count) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(16, count / 8));
        int end = offset + count;
        int pos = offset;

        while (pos < end) {
            int run = runLength(values, pos, end);
            if (run >= MIN_RLE_RUN || pos + run == end) {
                writeRleRun(out, values[pos], run);
                pos += run;
            }
            else {
                int start = pos;
                int groups = 0;
                while (pos < end && groups < MAX_GROUPS_PER_RUN) {
                    if (pos > start && runLength(values, pos, end) >= MIN_RLE_RUN) {
                        break;
                    }
                    pos = Math.min(pos + 8, end);
                    groups++;
                }
                writeBitPackedRun(out, values, start, pos, groups);
            }
        }
        return out.toByteArray();
    }

    private static int runLength(int[] values, int pos, int end) {
        int value = values[pos];
        int i = pos + 1;
        while (i < end && values[i] == value) {
            i++;
        }
        return i - pos;
    }

    private void writeRleRun(ByteArrayOutputStream out, int value, int count) {
        writeUnsignedVarInt(out, (long) count << 1);
        for (int i = 0; i < valueBytes; i++) {
            out.write((value >>> (i * 8)) & 0xFF);
        }
    }

    private void writeBitPackedRun(ByteArrayOutputStream out, int[] values, int start, int end, int groups) {
        writeUnsignedVarInt(out, ((long) groups << 1) | 1);

        int totalValues = groups * 8;
        long bitBuffer = 0;
        int bitsInBuffer = 0;
        long mask = (1L << bitWidth) - 1;

        for (int i = 0; i < totalValues; i++) {
            int index = start + i;
            long value = index < end ? values[index] & mask : 0;
            bitBuffer |= value << bitsInBuffer;
            bitsInBuffer += bitWidth;
            while (bitsInBuffer >= 8) {
                out.write((int) (bitBuffer & 0xFF));
                bitBuffer >>>= 8;
                bitsInBuffer -= 8;
            }
        }
        // groups * 8 * bitWidth is always a multiple of 8, so nothing is left over
    }

    private static void writeUnsignedVarInt(ByteArrayOutputStream out, long value) {
        long v = value;
        while ((v & ~0x7FL) != 0) {
            out.write((int) ((v & 0x7F) | 0x80));
            v >>>= 7;
        }
        out.write((int) v);
    }
}
