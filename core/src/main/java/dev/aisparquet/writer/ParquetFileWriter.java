/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.writer;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import dev.aisparquet.column.ColumnData;
import dev.aisparquet.internal.compression.CompressorFactory;
import dev.aisparquet.internal.thrift.FileMetaDataWriter;
import dev.aisparquet.internal.writer.ColumnChunkEncoder;
import dev.aisparquet.internal.writer.ColumnChunkEncoder.EncodedColumnChunk;
import dev.aisparquet.metadata.ColumnChunk;
import dev.aisparquet.metadata.FileMetaData;
import dev.aisparquet.metadata.PhysicalType;
import dev.aisparquet.metadata.RowGroup;
import dev.aisparquet.schema.ColumnSchema;
import dev.aisparquet.schema.ExportSchema;

/**
 * Writer for Parquet files with a flat schema.
 *
 * <pre>{@code
 * try (ParquetFileWriter writer = ParquetFileWriter.create(path, schema, WriterOptions.defaults())) {
 *     try (RowGroupWriter group = writer.createRowGroup()) {
 *         // one writeColumn() per schema column
 *     }
 * }
 * }</pre>
 *
 * <p>Each column chunk is written as one data page. Row groups are streamed to the output as
 * they are closed; only their metadata is kept until the footer is written on {@link #close()}.</p>
 */
public class ParquetFileWriter implements ContainerWriter {

    private static final System.Logger LOG = System.getLogger(ParquetFileWriter.class.getName());

    static final byte[] MAGIC = "PAR1".getBytes(StandardCharsets.US_ASCII);
    static final int FORMAT_VERSION = 1;

    private final OutputStream out;
    private final boolean ownsStream;
    private final ExportSchema schema;
    private final WriterOptions options;
    private final ColumnChunkEncoder encoder;
    private final List<RowGroup> rowGroups = new ArrayList<>();

    private long position;
    private long totalRows;
    private ParquetRowGroupWriter openRowGroup;
    private boolean closed;

    private ParquetFileWriter(OutputStream out, boolean ownsStream, ExportSchema schema, WriterOptions options) {
        this.out = out;
        this.ownsStream = ownsStream;
        this.schema = schema;
        this.options = options;
        this.encoder = new ColumnChunkEncoder(options.codec(), CompressorFactory.getCompressor(options.codec()));
    }

    /**
     * Create a writer for a new file at the given path. The file is closed when the writer is closed.
     */
    public static ParquetFileWriter create(Path path, ExportSchema schema, WriterOptions options) throws IOException {
        OutputStream stream = new BufferedOutputStream(Files.newOutputStream(path));
        try {
            LOG.log(System.Logger.Level.DEBUG, "Writing Parquet file ''{0}'' with {1} columns, codec {2}",
                    path, schema.getColumnCount(), options.codec());
            return start(stream, true, schema, options);
        }
        catch (IOException | RuntimeException e) {
            try {
                stream.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    /**
     * Create a writer on top of the given stream. The stream is flushed, but NOT closed, when the writer is closed.
     */
    public static ParquetFileWriter create(OutputStream stream, ExportSchema schema, WriterOptions options) throws IOException {
        return start(new BufferedOutputStream(stream), false, schema, options);
    }

    private static ParquetFileWriter start(OutputStream stream, boolean ownsStream, ExportSchema schema,
                                           WriterOptions options) throws IOException {
        ParquetFileWriter writer = new ParquetFileWriter(stream, ownsStream, schema, options);
        writer.write(MAGIC);
        return writer;
    }

    @Override
    public ExportSchema schema() {
        return schema;
    }

    public WriterOptions options() {
        return options;
    }

    /**
     * Number of rows in all row groups closed so far.
     */
    public long getTotalRows() {
        return totalRows;
    }

    public int getRowGroupCount() {
        return rowGroups.size();
    }

    @Override
    public RowGroupWriter createRowGroup() {
        if (closed) {
            throw new IllegalStateException("Writer is closed");
        }
        if (openRowGroup != null) {
            throw new IllegalStateException("Row group " + rowGroups.size() + " is still open");
        }
        openRowGroup = new ParquetRowGroupWriter();
        return openRowGroup;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;

        try {
            if (openRowGroup != null) {
                throw new IllegalStateException("Cannot close writer while row group " + rowGroups.size() + " is open");
            }

            FileMetaData metaData = new FileMetaData(
                    FORMAT_VERSION,
                    schema.toSchemaElements(),
                    totalRows,
                    List.copyOf(rowGroups),
                    options.createdBy());
            byte[] footer = FileMetaDataWriter.write(metaData);

            write(footer);
            write(new byte[]{
                    (byte) footer.length,
                    (byte) (footer.length >>> 8),
                    (byte) (footer.length >>> 16),
                    (byte) (footer.length >>> 24) });
            write(MAGIC);
            out.flush();

            LOG.log(System.Logger.Level.DEBUG, "Finished Parquet file: {0} rows in {1} row groups, {2} bytes",
                    totalRows, rowGroups.size(), position);
        }
        finally {
            if (ownsStream) {
                out.close();
            }
        }
    }

    private void write(byte[] bytes) throws IOException {
        out.write(bytes);
        position += bytes.length;
    }

    private static boolean matchesType(ColumnData data, PhysicalType type) {
        return switch (type) {
            case INT32 -> data instanceof ColumnData.IntColumn;
            case INT64 -> data instanceof ColumnData.LongColumn;
            case BOOLEAN -> data instanceof ColumnData.BooleanColumn;
            case FIXED_LEN_BYTE_ARRAY -> data instanceof ColumnData.FixedLenByteArrayColumn;
        };
    }

    private final class ParquetRowGroupWriter implements RowGroupWriter {

        private final List<ColumnChunk> chunks = new ArrayList<>(schema.getColumnCount());
        private int recordCount = -1;
        private long totalByteSize;
        private boolean finished;

        @Override
        public void writeColumn(ColumnData data) throws IOException {
            if (finished) {
                throw new IllegalStateException("Row group is already closed");
            }
            int expectedIndex = chunks.size();
            if (expectedIndex >= schema.getColumnCount()) {
                throw new IllegalStateException("All " + schema.getColumnCount() + " columns were already written");
            }
            ColumnSchema expected = schema.getColumn(expectedIndex);
            if (!expected.equals(data.column())) {
                throw new IllegalStateException("Expected column " + expectedIndex + " '" + expected.name()
                        + "' but got '" + data.column().name() + "'");
            }
            if (!matchesType(data, expected.type())) {
                throw new IllegalStateException("Column '" + expected.name() + "' of type " + expected.type()
                        + " cannot be written from " + data.getClass().getSimpleName());
            }
            if (recordCount >= 0 && data.recordCount() != recordCount) {
                throw new IllegalStateException("Column '" + expected.name() + "' has " + data.recordCount()
                        + " rows, previous columns had " + recordCount);
            }
            recordCount = data.recordCount();

            EncodedColumnChunk encoded = encoder.encode(data);
            long offset = position;
            write(encoded.pageHeader());
            write(encoded.pageBody());

            chunks.add(new ColumnChunk(offset, encoded.toMetaData(encoder.codec(), offset)));
            totalByteSize += encoded.totalUncompressedSize();
        }

        @Override
        public void close() {
            if (finished) {
                return;
            }
            finished = true;
            openRowGroup = null;

            if (chunks.size() != schema.getColumnCount()) {
                throw new IllegalStateException("Row group " + rowGroups.size() + " has " + chunks.size()
                        + " of " + schema.getColumnCount() + " columns");
            }

            rowGroups.add(new RowGroup(List.copyOf(chunks), totalByteSize, recordCount));
            totalRows += recordCount;

            LOG.log(System.Logger.Level.DEBUG, "Wrote row group {0} with {1} rows, {2} bytes",
                    rowGroups.size() - 1, recordCount, totalByteSize);
        }
    }
}
