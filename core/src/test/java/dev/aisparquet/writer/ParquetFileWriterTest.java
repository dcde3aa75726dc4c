/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.writer;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.BitSet;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import dev.aisparquet.column.ColumnData;
import dev.aisparquet.metadata.ColumnMetaData;
import dev.aisparquet.metadata.CompressionCodec;
import dev.aisparquet.metadata.Encoding;
import dev.aisparquet.metadata.FileMetaData;
import dev.aisparquet.metadata.PageHeader;
import dev.aisparquet.metadata.PhysicalType;
import dev.aisparquet.metadata.RepetitionType;
import dev.aisparquet.metadata.SchemaElement;
import dev.aisparquet.schema.ExportSchema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ParquetFileWriterTest {

    private static final ExportSchema SCHEMA = ExportSchema.builder("test")
            .int32("id")
            .int64("ts")
            .bool("flag")
            .text("name", 18)
            .build();

    @ParameterizedTest
    @EnumSource(value = CompressionCodec.class, names = { "UNCOMPRESSED", "SNAPPY", "ZSTD", "GZIP", "LZ4_RAW" })
    void testWriteAndReadBack(CompressionCodec codec) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ParquetFileWriter writer = ParquetFileWriter.create(out, SCHEMA, WriterOptions.defaults().withCodec(codec))) {
            writeGroup(writer, new int[]{ 1, 2, 3 }, nulls(1), new String[]{ "ABC", "", "XY" });
            writeGroup(writer, new int[]{ 4, 5 }, nulls(), new String[]{ "DEF", "GHI" });
        }

        ParquetTestReader reader = ParquetTestReader.of(out.toByteArray());
        FileMetaData metaData = reader.metaData();

        assertThat(metaData.version()).isEqualTo(1);
        assertThat(metaData.numRows()).isEqualTo(5);
        assertThat(metaData.createdBy()).isEqualTo(WriterOptions.DEFAULT_CREATED_BY);
        assertThat(metaData.rowGroups()).hasSize(2);
        assertThat(metaData.rowGroups().get(0).numRows()).isEqualTo(3);
        assertThat(metaData.rowGroups().get(1).numRows()).isEqualTo(2);

        List<SchemaElement> schema = metaData.schema();
        assertThat(schema).hasSize(5);
        assertThat(schema.get(0).name()).isEqualTo("test");
        assertThat(schema.get(0).numChildren()).isEqualTo(4);
        assertThat(schema.get(1)).isEqualTo(new SchemaElement("id", PhysicalType.INT32, null, RepetitionType.OPTIONAL, null));
        assertThat(schema.get(4)).isEqualTo(new SchemaElement("name", PhysicalType.FIXED_LEN_BYTE_ARRAY, 3, RepetitionType.REQUIRED, null));

        ColumnMetaData id = metaData.rowGroups().get(0).columns().get(0).metaData();
        assertThat(id.codec()).isEqualTo(codec);
        assertThat(id.pathInSchema()).containsExactly("id");
        assertThat(id.encodings()).containsExactly(Encoding.PLAIN, Encoding.RLE);
        assertThat(id.numValues()).isEqualTo(3);
        assertThat(id.dataPageOffset()).isEqualTo(4);

        ColumnMetaData name = metaData.rowGroups().get(0).columns().get(3).metaData();
        assertThat(name.encodings()).containsExactly(Encoding.PLAIN);

        assertThat(reader.readColumn(0, 0)).containsExactly(1, null, 3);
        assertThat(reader.readColumn(0, 1)).containsExactly(1000L, null, 3000L);
        assertThat(reader.readColumn(0, 2)).containsExactly(true, null, true);
        assertThat(reader.readColumn(1, 0)).containsExactly(4, 5);
        assertThat(reader.readColumn(1, 2)).containsExactly(false, true);

        List<Object> names = reader.readColumn(0, 3);
        assertThat((byte[]) names.get(0)).isEqualTo("ABC".getBytes(StandardCharsets.US_ASCII));
        assertThat((byte[]) names.get(1)).containsExactly(0, 0, 0);
        assertThat((byte[]) names.get(2)).containsExactly('X', 'Y', 0);
    }

    @Test
    void testPageHeaderDescribesDataPage() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ParquetFileWriter writer = ParquetFileWriter.create(out, SCHEMA,
                WriterOptions.defaults().withCodec(CompressionCodec.UNCOMPRESSED))) {
            writeGroup(writer, new int[]{ 7, 8, 9, 10 }, nulls(), new String[]{ "A", "B", "C", "D" });
        }

        PageHeader header = ParquetTestReader.of(out.toByteArray()).readPageHeader(0, 0);
        assertThat(header.type()).isEqualTo(PageHeader.PageType.DATA_PAGE);
        assertThat(header.dataPageHeader().numValues()).isEqualTo(4);
        assertThat(header.dataPageHeader().encoding()).isEqualTo(Encoding.PLAIN);
        assertThat(header.dataPageHeader().definitionLevelEncoding()).isEqualTo(Encoding.RLE);
        // 4-byte level length, RLE run of four 1s (2 bytes), four ints
        assertThat(header.uncompressedPageSize()).isEqualTo(4 + 2 + 16);
        assertThat(header.compressedPageSize()).isEqualTo(header.uncompressedPageSize());
    }

    @Test
    void testEmptyFileHasFooterOnly() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ParquetFileWriter.create(out, SCHEMA, WriterOptions.defaults()).close();

        FileMetaData metaData = ParquetTestReader.of(out.toByteArray()).metaData();
        assertThat(metaData.numRows()).isZero();
        assertThat(metaData.rowGroups()).isEmpty();
        assertThat(metaData.schema()).hasSize(5);
    }

    @Test
    void testWriteToPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("out.parquet");
        try (ParquetFileWriter writer = ParquetFileWriter.create(file, SCHEMA, WriterOptions.defaults())) {
            writeGroup(writer, new int[]{ 42 }, nulls(), new String[]{ "Q" });
            assertThat(writer.getRowGroupCount()).isEqualTo(1);
            assertThat(writer.getTotalRows()).isEqualTo(1);
        }

        ParquetTestReader reader = ParquetTestReader.open(file);
        assertThat(reader.readColumn(0, 0)).containsExactly(42);
    }

    @Test
    void testCloseIsIdempotent() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ParquetFileWriter writer = ParquetFileWriter.create(out, SCHEMA, WriterOptions.defaults());
        writer.close();
        int size = out.size();
        writer.close();

        assertThat(out.size()).isEqualTo(size);
        assertThatThrownBy(writer::createRowGroup).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testColumnsMustBeWrittenInSchemaOrder() throws Exception {
        ParquetFileWriter writer = ParquetFileWriter.create(new ByteArrayOutputStream(), SCHEMA, WriterOptions.defaults());
        RowGroupWriter group = writer.createRowGroup();

        assertThatThrownBy(() -> group.writeColumn(longColumn(new long[]{ 1 }, new BitSet(), 1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'id'");
        assertThatThrownBy(writer::close)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("is open");
    }

    @Test
    void testRecordCountsMustMatch() throws Exception {
        ParquetFileWriter writer = ParquetFileWriter.create(new ByteArrayOutputStream(), SCHEMA, WriterOptions.defaults());
        RowGroupWriter group = writer.createRowGroup();
        group.writeColumn(intColumn(new int[]{ 1, 2 }, new BitSet(), 2));

        assertThatThrownBy(() -> group.writeColumn(longColumn(new long[]{ 1 }, new BitSet(), 1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("has 1 rows");
    }

    @Test
    void testRowGroupWithMissingColumnsCannotBeClosed() throws Exception {
        ParquetFileWriter writer = ParquetFileWriter.create(new ByteArrayOutputStream(), SCHEMA, WriterOptions.defaults());
        RowGroupWriter group = writer.createRowGroup();
        group.writeColumn(intColumn(new int[]{ 1 }, new BitSet(), 1));

        assertThatThrownBy(group::close)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("1 of 4 columns");
    }

    @Test
    void testOnlyOneRowGroupAtATime() throws Exception {
        ParquetFileWriter writer = ParquetFileWriter.create(new ByteArrayOutputStream(), SCHEMA, WriterOptions.defaults());
        writer.createRowGroup();

        assertThatThrownBy(writer::createRowGroup)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("still open");
    }

    @Test
    void testHadoopLz4IsRejected() {
        assertThatThrownBy(() -> ParquetFileWriter.create(new ByteArrayOutputStream(), SCHEMA,
                WriterOptions.defaults().withCodec(CompressionCodec.LZ4)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testCodecFromSystemProperty() {
        String previous = System.getProperty(WriterOptions.COMPRESSION_PROPERTY);
        try {
            System.setProperty(WriterOptions.COMPRESSION_PROPERTY, "zstd");
            assertThat(WriterOptions.fromSystemProperties().codec()).isEqualTo(CompressionCodec.ZSTD);

            System.clearProperty(WriterOptions.COMPRESSION_PROPERTY);
            assertThat(WriterOptions.fromSystemProperties().codec()).isEqualTo(CompressionCodec.SNAPPY);
        }
        finally {
            if (previous != null) {
                System.setProperty(WriterOptions.COMPRESSION_PROPERTY, previous);
            }
            else {
                System.clearProperty(WriterOptions.COMPRESSION_PROPERTY);
            }
        }
    }

    private static void writeGroup(ParquetFileWriter writer, int[] ids, BitSet nulls, String[] names) throws Exception {
        int count = ids.length;
        long[] timestamps = new long[count];
        boolean[] flags = new boolean[count];
        byte[][] text = new byte[count][3];
        for (int i = 0; i < count; i++) {
            timestamps[i] = ids[i] * 1000L;
            flags[i] = ids[i] % 2 == 1;
            byte[] ascii = names[i].getBytes(StandardCharsets.US_ASCII);
            System.arraycopy(ascii, 0, text[i], 0, ascii.length);
        }

        try (RowGroupWriter group = writer.createRowGroup()) {
            group.writeColumn(intColumn(ids, nulls, count));
            group.writeColumn(longColumn(timestamps, nulls, count));
            group.writeColumn(new ColumnData.BooleanColumn(SCHEMA.getColumn("flag"), flags, nulls, count));
            group.writeColumn(new ColumnData.FixedLenByteArrayColumn(SCHEMA.getColumn("name"), text, null, count));
        }
    }

    private static ColumnData intColumn(int[] values, BitSet nulls, int count) {
        return new ColumnData.IntColumn(SCHEMA.getColumn("id"), values, nulls, count);
    }

    private static ColumnData longColumn(long[] values, BitSet nulls, int count) {
        return new ColumnData.LongColumn(SCHEMA.getColumn("ts"), values, nulls, count);
    }

    private static BitSet nulls(int... rows) {
        BitSet nulls = new BitSet();
        for (int row : rows) {
            nulls.set(row);
        }
        return nulls;
    }
}
