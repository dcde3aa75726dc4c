/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.internal.thrift;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writer for Thrift Compact Protocol into an in-memory buffer.
 * Reference: https://github.com/apache/thrift/blob/master/doc/specs/thrift-compact-protocol.md
 */
public class ThriftCompactWriter {

    static final byte TYPE_BOOLEAN_TRUE = 0x01;
    static final byte TYPE_BOOLEAN_FALSE = 0x02;
    static final byte TYPE_BYTE = 0x03;
    static final byte TYPE_I16 = 0x04;
    static final byte TYPE_I32 = 0x05;
    static final byte TYPE_I64 = 0x06;
    static final byte TYPE_BINARY = 0x08;
    static final byte TYPE_LIST = 0x09;
    static final byte TYPE_STRUCT = 0x0C;

    private final ByteArrayOutputStream buffer;
    private short lastFieldId = 0;

    public ThriftCompactWriter() {
        this(256);
    }

    public ThriftCompactWriter(int initialCapacity) {
        this.buffer = new ByteArrayOutputStream(initialCapacity);
    }

    /**
     * Returns the number of bytes written so far.
     */
    public int size() {
        return buffer.size();
    }

    /**
     * Returns a copy of the bytes written so far.
     */
    public byte[] toByteArray() {
        return buffer.toByteArray();
    }

    /**
     * Write an unsigned varint.
     */
    public void writeVarint(long value) {
        long v = value;
        while ((v & ~0x7FL) != 0) {
            buffer.write((int) ((v & 0x7F) | 0x80));
            v >>>= 7;
        }
        buffer.write((int) v);
    }

    /**
     * Write a zigzag-encoded signed integer.
     */
    public void writeZigzag(long value) {
        writeVarint((value << 1) ^ (value >> 63));
    }

    public void writeByte(byte value) {
        buffer.write(value);
    }

    public void writeI32(int value) {
        writeZigzag(value);
    }

    public void writeI64(long value) {
        writeZigzag(value);
    }

    /**
     * Write a binary value (length-prefixed).
     */
    public void writeBinary(byte[] value) {
        writeVarint(value.length);
        buffer.write(value, 0, value.length);
    }

    public void writeString(String value) {
        writeBinary(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Write a field header. Short form when the id delta fits into 4 bits, long form otherwise.
     */
    public void writeFieldHeader(short fieldId, byte type) {
        int delta = fieldId - lastFieldId;
        if (delta > 0 && delta <= 15) {
            buffer.write((delta << 4) | type);
        }
        else {
            buffer.write(type);
            writeZigzag(fieldId);
        }
        lastFieldId = fieldId;
    }

    /**
     * Boolean fields carry their value in the type nibble of the header.
     */
    public void writeBooleanField(short fieldId, boolean value) {
        writeFieldHeader(fieldId, value ? TYPE_BOOLEAN_TRUE : TYPE_BOOLEAN_FALSE);
    }

    public void writeI32Field(short fieldId, int value) {
        writeFieldHeader(fieldId, TYPE_I32);
        writeI32(value);
    }

    public void writeI64Field(short fieldId, long value) {
        writeFieldHeader(fieldId, TYPE_I64);
        writeI64(value);
    }

    public void writeStringField(short fieldId, String value) {
        writeFieldHeader(fieldId, TYPE_BINARY);
        writeString(value);
    }

    /**
     * Write a list header.
     */
    public void writeListHeader(byte elementType, int size) {
        if (size < 15) {
            buffer.write((size << 4) | elementType);
        }
        else {
            buffer.write(0xF0 | elementType);
            writeVarint(size);
        }
    }

    /**
     * Write the STOP marker that terminates a struct.
     */
    public void writeFieldStop() {
        buffer.write(0);
    }

    /**
     * Save the current last field ID and reset it for writing a nested struct.
     */
    public short pushFieldIdContext() {
        short saved = lastFieldId;
        lastFieldId = 0;
        return saved;
    }

    /**
     * Restore the last field ID after writing a nested struct.
     */
    public void popFieldIdContext(short savedFieldId) {
        lastFieldId = savedFieldId;
    }
}
