/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.export;

import java.util.Arrays;

import dev.aisparquet.ais.AisTextField;
import dev.aisparquet.metadata.PhysicalType;
import dev.aisparquet.schema.ColumnSchema;
import dev.aisparquet.schema.ExportSchema;

/**
 * Renders AIS text fields into fixed-width byte slices. Characters are written as ASCII from the
 * start of the slice; the rest of the slice is zeroed so nothing of a previous row survives.
 */
public final class TextFieldNormalizer {

    private final int bitLength;
    private final int width;

    /**
     * @param bitLength declared bit length of the text field
     * @throws IllegalArgumentException if {@code bitLength} is not a positive multiple of 6
     */
    public TextFieldNormalizer(int bitLength) {
        this.width = ExportSchema.textWidth(bitLength);
        this.bitLength = bitLength;
    }

    /**
     * A normalizer matching the width of a fixed-width text column.
     */
    public static TextFieldNormalizer forColumn(ColumnSchema column) {
        if (column.type() != PhysicalType.FIXED_LEN_BYTE_ARRAY) {
            throw new IllegalArgumentException("Column '" + column.name() + "' is not a text column: " + column.type());
        }
        return new TextFieldNormalizer(column.typeLength() * ExportSchema.BITS_PER_CHARACTER);
    }

    public int bitLength() {
        return bitLength;
    }

    /**
     * Number of bytes of every destination slice.
     */
    public int width() {
        return width;
    }

    /**
     * Writes {@code text} into {@code destination}. A {@code null} or empty text yields all zero bytes.
     *
     * @throws IllegalArgumentException if {@code destination} is not exactly {@link #width()} bytes
     *         or the text has more characters than fit
     */
    public void normalize(AisTextField text, byte[] destination) {
        if (destination.length != width) {
            throw new IllegalArgumentException("Expected destination of " + width + " bytes but got " + destination.length);
        }

        int written = 0;
        if (text != null && text.characterCount() > 0) {
            written = text.writeAsAscii(destination);
        }
        Arrays.fill(destination, written, width, (byte) 0);
    }
}
