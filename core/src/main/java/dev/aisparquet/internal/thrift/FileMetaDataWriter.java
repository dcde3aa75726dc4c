/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.thrift;

import java.util.List;

import dev.aisparquet.metadata.ColumnChunk;
import dev.aisparquet.metadata.ColumnMetaData;
import dev.aisparquet.metadata.Encoding;
import dev.aisparquet.metadata.FileMetaData;
import dev.aisparquet.metadata.RowGroup;
import dev.aisparquet.metadata.SchemaElement;

/**
 * Writer for FileMetaData in Thrift Compact Protocol, i.e. the Parquet footer.
 * Field ids follow parquet.thrift.
 */
public class FileMetaDataWriter {

    public static byte[] write(FileMetaData metaData) {
        ThriftCompactWriter writer = new ThriftCompactWriter(4096);
        write(writer, metaData);
        return writer.toByteArray();
    }

    public static void write(ThriftCompactWriter writer, FileMetaData metaData) {
        short saved = writer.pushFieldIdContext();

        writer.writeI32Field((short) 1, metaData.version());

        writer.writeFieldHeader((short) 2, ThriftCompactWriter.TYPE_LIST);
        writer.writeListHeader(ThriftCompactWriter.TYPE_STRUCT, metaData.schema().size());
        for (SchemaElement element : metaData.schema()) {
            writeSchemaElement(writer, element);
        }

        writer.writeI64Field((short) 3, metaData.numRows());

        writer.writeFieldHeader((short) 4, ThriftCompactWriter.TYPE_LIST);
        writer.writeListHeader(ThriftCompactWriter.TYPE_STRUCT, metaData.rowGroups().size());
        for (RowGroup rowGroup : metaData.rowGroups()) {
            writeRowGroup(writer, rowGroup);
        }

        if (metaData.createdBy() != null) {
            writer.writeStringField((short) 6, metaData.createdBy());
        }

        writer.writeFieldStop();
        writer.popFieldIdContext(saved);
    }

    private static void writeSchemaElement(ThriftCompactWriter writer, SchemaElement element) {
        short saved = writer.pushFieldIdContext();
        if (element.type() != null) {
            writer.writeI32Field((short) 1, element.type().getThriftValue());
        }
        if (element.typeLength() != null) {
            writer.writeI32Field((short) 2, element.typeLength());
        }
        if (element.repetitionType() != null) {
            writer.writeI32Field((short) 3, element.repetitionType().getThriftValue());
        }
        writer.writeStringField((short) 4, element.name());
        if (element.numChildren() != null) {
            writer.writeI32Field((short) 5, element.numChildren());
        }
        writer.writeFieldStop();
        writer.popFieldIdContext(saved);
    }

    private static void writeRowGroup(ThriftCompactWriter writer, RowGroup rowGroup) {
        short saved = writer.pushFieldIdContext();

        writer.writeFieldHeader((short) 1, ThriftCompactWriter.TYPE_LIST);
        writer.writeListHeader(ThriftCompactWriter.TYPE_STRUCT, rowGroup.columns().size());
        for (ColumnChunk chunk : rowGroup.columns()) {
            writeColumnChunk(writer, chunk);
        }
        writer.writeI64Field((short) 2, rowGroup.totalByteSize());
        writer.writeI64Field((short) 3, rowGroup.numRows());

        writer.writeFieldStop();
        writer.popFieldIdContext(saved);
    }

    private static void writeColumnChunk(ThriftCompactWriter writer, ColumnChunk chunk) {
        short saved = writer.pushFieldIdContext();

        writer.writeI64Field((short) 2, chunk.fileOffset());
        writer.writeFieldHeader((short) 3, ThriftCompactWriter.TYPE_STRUCT);
        writeColumnMetaData(writer, chunk.metaData());

        writer.writeFieldStop();
        writer.popFieldIdContext(saved);
    }

    private static void writeColumnMetaData(ThriftCompactWriter writer, ColumnMetaData metaData) {
        short saved = writer.pushFieldIdContext();

        writer.writeI32Field((short) 1, metaData.type().getThriftValue());

        List<Encoding> encodings = metaData.encodings();
        writer.writeFieldHeader((short) 2, ThriftCompactWriter.TYPE_LIST);
        writer.writeListHeader(ThriftCompactWriter.TYPE_I32, encodings.size());
        for (Encoding encoding : encodings) {
            writer.writeI32(encoding.getThriftValue());
        }

        writer.writeFieldHeader((short) 3, ThriftCompactWriter.TYPE_LIST);
        writer.writeListHeader(ThriftCompactWriter.TYPE_BINARY, metaData.pathInSchema().size());
        for (String path : metaData.pathInSchema()) {
            writer.writeString(path);
        }

        writer.writeI32Field((short) 4, metaData.codec().getThriftValue());
        writer.writeI64Field((short) 5, metaData.numValues());
        writer.writeI64Field((short) 6, metaData.totalUncompressedSize());
        writer.writeI64Field((short) 7, metaData.totalCompressedSize());
        writer.writeI64Field((short) 9, metaData.dataPageOffset());

        writer.writeFieldStop();
        writer.popFieldIdContext(saved);
    }
}
