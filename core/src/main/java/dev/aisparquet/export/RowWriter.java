/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.export;

import dev.aisparquet.ais.AisDecodingException;
import dev.aisparquet.ais.AisMessage;
import dev.aisparquet.ais.AisMessageDecoder;
import dev.aisparquet.ais.AisPayload;
import dev.aisparquet.ais.NmeaLine;
import dev.aisparquet.ais.NmeaTagBlock;
import dev.aisparquet.schema.ExportSchema;

/**
 * Decodes one message and writes it as one row of a {@link ColumnBufferSet}. Every column of the
 * row is written, so no value of a previous row survives.
 */
public final class RowWriter {

    private final AisColumnMappings mappings;
    private final int sourceColumn;
    private final int messageTypeColumn;
    private final int timestampColumn;

    public RowWriter(ExportSchema schema) {
        this.mappings = new AisColumnMappings(schema);
        this.sourceColumn = schema.getColumn(AisExportSchema.SOURCE).columnIndex();
        this.messageTypeColumn = schema.getColumn(AisExportSchema.MESSAGE_TYPE).columnIndex();
        this.timestampColumn = schema.getColumn(AisExportSchema.TIMESTAMP).columnIndex();
    }

    /**
     * Decodes the payload and writes it into {@code row}. Nothing is written for skipped messages.
     * Unsupported kinds are skipped before the tag block is looked at.
     *
     * @throws IllegalStateException if a decodable message's tag block carries no timestamp
     */
    public RowWriteResult write(NmeaLine line, byte[] asciiPayload, int padding, ColumnBufferSet buffers, int row) {
        AisMessage message;
        try {
            AisPayload payload = new AisPayload(asciiPayload, padding);
            int messageType = payload.messageType();
            if (!AisMessageDecoder.isSupported(messageType)) {
                return new RowWriteResult.Skipped(SkipReason.UNSUPPORTED_MESSAGE_TYPE, "message type " + messageType);
            }
            message = AisMessageDecoder.decode(payload);
        }
        catch (AisDecodingException e) {
            return new RowWriteResult.Skipped(SkipReason.DECODE_FAILURE, e.getMessage());
        }

        writeMessage(line.tagBlock(), message, buffers, row);
        return new RowWriteResult.Written(row);
    }

    /**
     * Writes an already decoded message into {@code row}.
     *
     * @throws IllegalStateException if the tag block carries no timestamp
     */
    public void writeMessage(NmeaTagBlock tagBlock, AisMessage message, ColumnBufferSet buffers, int row) {
        long timestamp = requireTimestamp(tagBlock);

        mappings.write(message, buffers, row);
        buffers.setInt(row, sourceColumn, parseSourceId(tagBlock.source()));
        buffers.setInt(row, messageTypeColumn, message.messageType());
        buffers.setLong(row, timestampColumn, timestamp);
    }

    /**
     * Leading decimal integer of the tag block source, or 0 if there is none or it overflows.
     */
    static int parseSourceId(String source) {
        if (source == null || source.isEmpty()) {
            return 0;
        }
        int start = source.charAt(0) == '-' || source.charAt(0) == '+' ? 1 : 0;
        int end = start;
        while (end < source.length() && source.charAt(end) >= '0' && source.charAt(end) <= '9') {
            end++;
        }
        if (end == start) {
            return 0;
        }
        try {
            return Integer.parseInt(source, 0, end, 10);
        }
        catch (NumberFormatException e) {
            return 0;
        }
    }

    private static long requireTimestamp(NmeaTagBlock tagBlock) {
        Long timestamp = tagBlock.unixTimestamp();
        if (timestamp == null) {
            throw new IllegalStateException("Tag block has no timestamp (c:) field");
        }
        return timestamp;
    }
}
