/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.schema;

import org.junit.jupiter.api.Test;

import dev.aisparquet.metadata.PhysicalType;
import dev.aisparquet.metadata.RepetitionType;
import dev.aisparquet.metadata.SchemaElement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ExportSchemaTest {

    @Test
    void testColumnsKeepDeclarationOrder() {
        ExportSchema schema = ExportSchema.builder("s")
                .int32("a")
                .int64("b")
                .bool("c")
                .text("d", 42)
                .build();

        assertThat(schema.getColumnCount()).isEqualTo(4);
        assertThat(schema.getColumns()).extracting(ColumnSchema::name).containsExactly("a", "b", "c", "d");
        assertThat(schema.getColumn("d").columnIndex()).isEqualTo(3);
        assertThat(schema.getColumn("d").typeLength()).isEqualTo(7);
        assertThat(schema.getColumn("d").isNullable()).isFalse();
        assertThat(schema.getColumn("a").maxDefinitionLevel()).isEqualTo(1);
    }

    @Test
    void testSchemaElementsStartWithRootGroup() {
        ExportSchema schema = ExportSchema.builder("root").int32("x").text("y", 6).build();

        assertThat(schema.toSchemaElements()).containsExactly(
                SchemaElement.group("root", 2),
                new SchemaElement("x", PhysicalType.INT32, null, RepetitionType.OPTIONAL, null),
                new SchemaElement("y", PhysicalType.FIXED_LEN_BYTE_ARRAY, 1, RepetitionType.REQUIRED, null));
    }

    @Test
    void testTextBitLengthMustBeMultipleOfSix() {
        assertThatThrownBy(() -> ExportSchema.builder("s").text("t", 40))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("divisible by 6");
        assertThatThrownBy(() -> ExportSchema.textWidth(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(ExportSchema.textWidth(120)).isEqualTo(20);
    }

    @Test
    void testDuplicateAndUnknownColumns() {
        assertThatThrownBy(() -> ExportSchema.builder("s").int32("a").bool("a").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");

        ExportSchema schema = ExportSchema.builder("s").int32("a").build();
        assertThatThrownBy(() -> schema.getColumn("b"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEmptySchemaIsRejected() {
        assertThatThrownBy(() -> ExportSchema.builder("s").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testToStringListsColumns() {
        ExportSchema schema = ExportSchema.builder("s").int32("a").text("n", 12).build();

        assertThat(schema.toString()).isEqualTo("message s {\n  optional int32 a;\n  required fixed_len_byte_array(2) n;\n}");
    }
}
