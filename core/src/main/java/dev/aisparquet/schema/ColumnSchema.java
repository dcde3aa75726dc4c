/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.schema;

import dev.aisparquet.metadata.PhysicalType;
import dev.aisparquet.metadata.RepetitionType;

/**
 * A primitive column of a flat export schema.
 *
 * @param name column name as written to the file
 * @param type physical storage type
 * @param repetitionType {@link RepetitionType#OPTIONAL} for nullable scalars,
 *        {@link RepetitionType#REQUIRED} for fixed-width text
 * @param typeLength byte width of {@link PhysicalType#FIXED_LEN_BYTE_ARRAY} columns, otherwise {@code null}
 * @param columnIndex position of the column in the schema
 */
public record ColumnSchema(
        String name,
        PhysicalType type,
        RepetitionType repetitionType,
        Integer typeLength,
        int columnIndex) {

    public boolean isNullable() {
        return repetitionType == RepetitionType.OPTIONAL;
    }

    /**
     * Maximum definition level; 1 for nullable columns, 0 otherwise.
     */
    public int maxDefinitionLevel() {
        return isNullable() ? 1 : 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(repetitionType.name().toLowerCase());
        sb.append(" ");
        sb.append(type.name().toLowerCase());
        if (typeLength != null) {
            sb.append("(").append(typeLength).append(")");
        }
        sb.append(" ");
        sb.append(name);
        sb.append(";");
        return sb.toString();
    }
}
