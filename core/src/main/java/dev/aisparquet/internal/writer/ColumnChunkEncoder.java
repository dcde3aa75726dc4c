/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.writer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

import dev.aisparquet.column.ColumnData;
import dev.aisparquet.internal.compression.Compressor;
import dev.aisparquet.internal.encoding.PlainEncoder;
import dev.aisparquet.internal.encoding.RleBitPackingHybridEncoder;
import dev.aisparquet.internal.thrift.PageHeaderWriter;
import dev.aisparquet.metadata.CompressionCodec;
import dev.aisparquet.metadata.ColumnMetaData;
import dev.aisparquet.metadata.DataPageHeader;
import dev.aisparquet.metadata.Encoding;
import dev.aisparquet.metadata.PageHeader;
import dev.aisparquet.schema.ColumnSchema;

/**
 * Encodes the data of one column within one row group as a single v1 data page.
 * <p>
 * Page body layout: definition levels (nullable columns only, 4-byte little-endian length
 * followed by RLE/bit-packed levels of bit width 1), then the PLAIN encoded non-null values.
 * The whole body is compressed; the page header is not.
 * </p>
 */
public class ColumnChunkEncoder {

    private static final System.Logger LOG = System.getLogger(ColumnChunkEncoder.class.getName());

    private final CompressionCodec codec;
    private final Compressor compressor;

    public ColumnChunkEncoder(CompressionCodec codec, Compressor compressor) {
        this.codec = codec;
        this.compressor = compressor;
    }

    public EncodedColumnChunk encode(ColumnData data) throws IOException {
        ColumnSchema column = data.column();
        int recordCount = data.recordCount();

        byte[] definitionLevels = column.isNullable()
                ? RleBitPackingHybridEncoder.encodeDefinitionLevels(data.nulls(), recordCount)
                : null;

        int levelsSize = definitionLevels != null ? Integer.BYTES + definitionLevels.length : 0;
        ByteBuffer body = ByteBuffer.allocate(levelsSize + PlainEncoder.encodedSize(data)).order(ByteOrder.LITTLE_ENDIAN);
        if (definitionLevels != null) {
            body.putInt(definitionLevels.length);
            body.put(definitionLevels);
        }
        PlainEncoder.encode(data, body);
        if (body.hasRemaining()) {
            throw new IllegalStateException("Encoded size mismatch for column '" + column.name() + "': "
                    + body.remaining() + " bytes unused");
        }

        byte[] uncompressed = body.array();
        byte[] compressed = compressor.compress(uncompressed);

        PageHeader header = new PageHeader(
                PageHeader.PageType.DATA_PAGE,
                uncompressed.length,
                compressed.length,
                new DataPageHeader(recordCount, Encoding.PLAIN, Encoding.RLE, Encoding.RLE));
        byte[] headerBytes = PageHeaderWriter.write(header);

        LOG.log(System.Logger.Level.TRACE, "Encoded column ''{0}'': {1} values, {2} bytes, {3} bytes compressed",
                column.name(), recordCount, uncompressed.length, compressed.length);

        return new EncodedColumnChunk(column, recordCount, headerBytes, compressed, uncompressed.length);
    }

    /**
     * A page ready to be written: header bytes followed by the (compressed) body.
     */
    public record EncodedColumnChunk(
            ColumnSchema column,
            int numValues,
            byte[] pageHeader,
            byte[] pageBody,
            int uncompressedBodySize) {

        public int totalCompressedSize() {
            return pageHeader.length + pageBody.length;
        }

        public int totalUncompressedSize() {
            return pageHeader.length + uncompressedBodySize;
        }

        public ColumnMetaData toMetaData(CompressionCodec codec, long dataPageOffset) {
            List<Encoding> encodings = column.isNullable()
                    ? List.of(Encoding.PLAIN, Encoding.RLE)
                    : List.of(Encoding.PLAIN);
            return new ColumnMetaData(
                    column.type(),
                    encodings,
                    List.of(column.name()),
                    codec,
                    numValues,
                    totalUncompressedSize(),
                    totalCompressedSize(),
                    dataPageOffset);
        }
    }

    public CompressionCodec codec() {
        return codec;
    }
}
