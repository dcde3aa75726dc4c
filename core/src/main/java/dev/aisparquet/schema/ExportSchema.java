/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import dev.aisparquet.metadata.PhysicalType;
import dev.aisparquet.metadata.RepetitionType;
import dev.aisparquet.metadata.SchemaElement;

/**
 * Flat, ordered schema of an export file. Fixed at construction time.
 * <p>
 * Scalar columns are nullable. Text columns hold 6-bit AIS characters rendered as
 * ASCII into a fixed number of bytes and are never null; absent text is all zero bytes.
 * </p>
 */
public final class ExportSchema {

    /** AIS packs text with 6 bits per character. */
    public static final int BITS_PER_CHARACTER = 6;

    private final String name;
    private final List<ColumnSchema> columns;
    private final Map<String, Integer> columnNameToIndex;

    private ExportSchema(String name, List<ColumnSchema> columns) {
        this.name = name;
        this.columns = Collections.unmodifiableList(columns);

        this.columnNameToIndex = new HashMap<>(columns.size() * 2);
        for (ColumnSchema column : columns) {
            if (columnNameToIndex.put(column.name(), column.columnIndex()) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column.name());
            }
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<ColumnSchema> getColumns() {
        return columns;
    }

    public ColumnSchema getColumn(int index) {
        return columns.get(index);
    }

    public ColumnSchema getColumn(String name) {
        Integer index = columnNameToIndex.get(name);
        if (index == null) {
            throw new IllegalArgumentException("Column not found: " + name);
        }
        return columns.get(index);
    }

    public int getColumnCount() {
        return columns.size();
    }

    /**
     * Flattens this schema into footer schema elements: the root group followed by one leaf per column.
     */
    public List<SchemaElement> toSchemaElements() {
        List<SchemaElement> elements = new ArrayList<>(columns.size() + 1);
        elements.add(SchemaElement.group(name, columns.size()));
        for (ColumnSchema column : columns) {
            elements.add(new SchemaElement(column.name(), column.type(), column.typeLength(), column.repetitionType(), null));
        }
        return elements;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("message ").append(name).append(" {\n");
        for (ColumnSchema column : columns) {
            sb.append("  ").append(column).append('\n');
        }
        return sb.append('}').toString();
    }

    /**
     * Builds a schema column by column, in order.
     */
    public static final class Builder {

        private final String name;
        private final List<ColumnSchema> columns = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder int32(String columnName) {
            return add(columnName, PhysicalType.INT32, RepetitionType.OPTIONAL, null);
        }

        public Builder int64(String columnName) {
            return add(columnName, PhysicalType.INT64, RepetitionType.OPTIONAL, null);
        }

        public Builder bool(String columnName) {
            return add(columnName, PhysicalType.BOOLEAN, RepetitionType.OPTIONAL, null);
        }

        /**
         * Adds a fixed-width text column able to hold {@code bitLength / 6} characters.
         *
         * @throws IllegalArgumentException if {@code bitLength} is not a positive multiple of 6
         */
        public Builder text(String columnName, int bitLength) {
            return add(columnName, PhysicalType.FIXED_LEN_BYTE_ARRAY, RepetitionType.REQUIRED, textWidth(bitLength));
        }

        public ExportSchema build() {
            if (columns.isEmpty()) {
                throw new IllegalArgumentException("Schema '" + name + "' has no columns");
            }
            return new ExportSchema(name, new ArrayList<>(columns));
        }

        private Builder add(String columnName, PhysicalType type, RepetitionType repetitionType, Integer typeLength) {
            columns.add(new ColumnSchema(columnName, type, repetitionType, typeLength, columns.size()));
            return this;
        }
    }

    /**
     * Number of bytes needed for a text field of the given bit length.
     *
     * @throws IllegalArgumentException if {@code bitLength} is not a positive multiple of 6
     */
    public static int textWidth(int bitLength) {
        if (bitLength <= 0 || bitLength % BITS_PER_CHARACTER != 0) {
            throw new IllegalArgumentException(
                    "AIS stores all text with 6 bits per character, # bits must be divisible by 6: " + bitLength);
        }
        return bitLength / BITS_PER_CHARACTER;
    }
}
