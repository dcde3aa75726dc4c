/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.thrift;

import dev.aisparquet.metadata.DataPageHeader;
import dev.aisparquet.metadata.PageHeader;

/**
 * Writer for PageHeader in Thrift Compact Protocol.
 */
public class PageHeaderWriter {

    public static byte[] write(PageHeader header) {
        ThriftCompactWriter writer = new ThriftCompactWriter(64);
        write(writer, header);
        return writer.toByteArray();
    }

    public static void write(ThriftCompactWriter writer, PageHeader header) {
        short saved = writer.pushFieldIdContext();

        writer.writeI32Field((short) 1, header.type().getThriftValue());
        writer.writeI32Field((short) 2, header.uncompressedPageSize());
        writer.writeI32Field((short) 3, header.compressedPageSize());
        if (header.dataPageHeader() != null) {
            writer.writeFieldHeader((short) 5, ThriftCompactWriter.TYPE_STRUCT);
            writeDataPageHeader(writer, header.dataPageHeader());
        }

        writer.writeFieldStop();
        writer.popFieldIdContext(saved);
    }

    private static void writeDataPageHeader(ThriftCompactWriter writer, DataPageHeader header) {
        short saved = writer.pushFieldIdContext();

        writer.writeI32Field((short) 1, header.numValues());
        writer.writeI32Field((short) 2, header.encoding().getThriftValue());
        writer.writeI32Field((short) 3, header.definitionLevelEncoding().getThriftValue());
        writer.writeI32Field((short) 4, header.repetitionLevelEncoding().getThriftValue());

        writer.writeFieldStop();
        writer.popFieldIdContext(saved);
    }
}
