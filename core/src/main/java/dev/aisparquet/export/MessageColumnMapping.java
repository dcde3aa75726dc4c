/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.export;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

import dev.aisparquet.ais.AisMessage;
import dev.aisparquet.ais.AisTextField;
import dev.aisparquet.metadata.PhysicalType;
import dev.aisparquet.schema.ColumnSchema;
import dev.aisparquet.schema.ExportSchema;

/**
 * Field-to-column table for one message kind. Writes every column of a row that it does not
 * leave to the caller: bound columns get the message's value, unbound nullable columns get null
 * and unbound text columns get zero bytes.
 *
 * @param <T> the message kind
 */
public final class MessageColumnMapping<T extends AisMessage> {

    private final Class<T> messageClass;
    private final List<IntBinding<T>> intBindings;
    private final List<BooleanBinding<T>> booleanBindings;
    private final List<TextBinding<T>> textBindings;
    private final int[] nullColumns;
    private final int[] emptyTextColumns;
    private final TextFieldNormalizer[] emptyTextNormalizers;

    private MessageColumnMapping(Builder<T> builder, int[] nullColumns, int[] emptyTextColumns) {
        this.messageClass = builder.messageClass;
        this.intBindings = List.copyOf(builder.intBindings);
        this.booleanBindings = List.copyOf(builder.booleanBindings);
        this.textBindings = List.copyOf(builder.textBindings);
        this.nullColumns = nullColumns;
        this.emptyTextColumns = emptyTextColumns;
        this.emptyTextNormalizers = new TextFieldNormalizer[emptyTextColumns.length];
        for (int i = 0; i < emptyTextColumns.length; i++) {
            emptyTextNormalizers[i] = TextFieldNormalizer.forColumn(builder.schema.getColumn(emptyTextColumns[i]));
        }
    }

    public static <T extends AisMessage> Builder<T> builder(Class<T> messageClass, ExportSchema schema) {
        return new Builder<>(messageClass, schema);
    }

    public Class<T> messageClass() {
        return messageClass;
    }

    /**
     * Writes all columns this mapping is responsible for into {@code row}.
     */
    public void write(T message, ColumnBufferSet buffers, int row) {
        for (IntBinding<T> binding : intBindings) {
            buffers.setInt(row, binding.column, binding.getter.applyAsInt(message));
        }
        for (BooleanBinding<T> binding : booleanBindings) {
            buffers.setBoolean(row, binding.column, binding.getter.test(message));
        }
        for (TextBinding<T> binding : textBindings) {
            binding.normalizer.normalize(binding.getter.apply(message), buffers.textBuffer(row, binding.column));
        }
        for (int column : nullColumns) {
            buffers.setNull(row, column);
        }
        for (int i = 0; i < emptyTextColumns.length; i++) {
            emptyTextNormalizers[i].normalize(AisTextField.EMPTY, buffers.textBuffer(row, emptyTextColumns[i]));
        }
    }

    private record IntBinding<T>(int column, ToIntFunction<T> getter) {
    }

    private record BooleanBinding<T>(int column, Predicate<T> getter) {
    }

    private record TextBinding<T>(int column, TextFieldNormalizer normalizer, Function<T, AisTextField> getter) {
    }

    /**
     * Collects bindings and validates them against the schema.
     */
    public static final class Builder<T extends AisMessage> {

        private final Class<T> messageClass;
        private final ExportSchema schema;
        private final Set<String> claimed = new HashSet<>();
        private final List<IntBinding<T>> intBindings = new ArrayList<>();
        private final List<BooleanBinding<T>> booleanBindings = new ArrayList<>();
        private final List<TextBinding<T>> textBindings = new ArrayList<>();

        private Builder(Class<T> messageClass, ExportSchema schema) {
            this.messageClass = messageClass;
            this.schema = schema;
        }

        public Builder<T> intColumn(String columnName, ToIntFunction<T> getter) {
            ColumnSchema column = claim(columnName, PhysicalType.INT32);
            intBindings.add(new IntBinding<>(column.columnIndex(), getter));
            return this;
        }

        public Builder<T> booleanColumn(String columnName, Predicate<T> getter) {
            ColumnSchema column = claim(columnName, PhysicalType.BOOLEAN);
            booleanBindings.add(new BooleanBinding<>(column.columnIndex(), getter));
            return this;
        }

        /**
         * Binds a text field of the given declared bit length.
         *
         * @throws IllegalArgumentException if the bit length does not match the column width
         */
        public Builder<T> textColumn(String columnName, int bitLength, Function<T, AisTextField> getter) {
            ColumnSchema column = claim(columnName, PhysicalType.FIXED_LEN_BYTE_ARRAY);
            TextFieldNormalizer normalizer = new TextFieldNormalizer(bitLength);
            if (normalizer.width() != column.typeLength()) {
                throw new IllegalArgumentException("Text of " + bitLength + " bits does not fit column '"
                        + columnName + "' of " + column.typeLength() + " bytes");
            }
            textBindings.add(new TextBinding<>(column.columnIndex(), normalizer, getter));
            return this;
        }

        /**
         * Leaves columns to the caller; this mapping will not touch them.
         */
        public Builder<T> excluding(String... columnNames) {
            for (String columnName : columnNames) {
                claim(columnName, schema.getColumn(columnName).type());
            }
            return this;
        }

        public MessageColumnMapping<T> build() {
            List<Integer> nullColumns = new ArrayList<>();
            List<Integer> emptyTextColumns = new ArrayList<>();
            for (ColumnSchema column : schema.getColumns()) {
                if (claimed.contains(column.name())) {
                    continue;
                }
                if (column.type() == PhysicalType.FIXED_LEN_BYTE_ARRAY) {
                    emptyTextColumns.add(column.columnIndex());
                }
                else if (column.isNullable()) {
                    nullColumns.add(column.columnIndex());
                }
                else {
                    throw new IllegalArgumentException("Required column '" + column.name() + "' is not bound for "
                            + messageClass.getSimpleName());
                }
            }
            return new MessageColumnMapping<>(this, toArray(nullColumns), toArray(emptyTextColumns));
        }

        private ColumnSchema claim(String columnName, PhysicalType expectedType) {
            ColumnSchema column = schema.getColumn(columnName);
            if (column.type() != expectedType) {
                throw new IllegalArgumentException("Column '" + columnName + "' is " + column.type()
                        + ", not " + expectedType);
            }
            if (!claimed.add(columnName)) {
                throw new IllegalArgumentException("Column '" + columnName + "' is bound twice for "
                        + messageClass.getSimpleName());
            }
            return column;
        }

        private static int[] toArray(List<Integer> values) {
            return values.stream().mapToInt(Integer::intValue).toArray();
        }
    }
}
