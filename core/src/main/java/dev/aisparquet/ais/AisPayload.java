/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.ais;

import java.nio.charset.StandardCharsets;

/**
 * Bit reader over an ASCII-armored AIS payload. Every payload character carries 6 bits,
 * most significant bit first; the trailing {@code padding} bits of the last character are not part
 * of the message.
 */
public final class AisPayload {

    private final byte[] ascii;
    private final int bitLength;

    public AisPayload(byte[] ascii, int padding) {
        if (padding < 0 || padding > 5) {
            throw new AisDecodingException("Padding must be between 0 and 5: " + padding);
        }
        this.ascii = ascii;
        this.bitLength = Math.max(0, ascii.length * 6 - padding);
    }

    public static AisPayload of(String payload, int padding) {
        return new AisPayload(payload.getBytes(StandardCharsets.US_ASCII), padding);
    }

    /**
     * Reads the message type from the first 6 bits without decoding anything else.
     */
    public static int peekMessageType(byte[] ascii, int padding) {
        return new AisPayload(ascii, padding).getUnsigned(0, 6);
    }

    public int bitLength() {
        return bitLength;
    }

    public int messageType() {
        return getUnsigned(0, 6);
    }

    /**
     * Reads an unsigned field of up to 31 bits.
     */
    public int getUnsigned(int bitOffset, int bitCount) {
        if (bitCount < 1 || bitCount > 31) {
            throw new IllegalArgumentException("Unsigned fields must be 1 to 31 bits wide: " + bitCount);
        }
        checkRange(bitOffset, bitCount);

        int result = 0;
        for (int bit = bitOffset; bit < bitOffset + bitCount; bit++) {
            result = (result << 1) | bitAt(bit);
        }
        return result;
    }

    /**
     * Reads a two's complement signed field of up to 32 bits.
     */
    public int getSigned(int bitOffset, int bitCount) {
        if (bitCount < 2 || bitCount > 32) {
            throw new IllegalArgumentException("Signed fields must be 2 to 32 bits wide: " + bitCount);
        }
        checkRange(bitOffset, bitCount);

        long result = 0;
        for (int bit = bitOffset; bit < bitOffset + bitCount; bit++) {
            result = (result << 1) | bitAt(bit);
        }
        int shift = 64 - bitCount;
        return (int) ((result << shift) >> shift);
    }

    public boolean getBoolean(int bitOffset) {
        checkRange(bitOffset, 1);
        return bitAt(bitOffset) != 0;
    }

    /**
     * Returns a view of a 6-bit text field. The range and the payload characters covering it are
     * validated now, the text itself is read on demand.
     *
     * @throws AisDecodingException if the field exceeds the payload or covers an invalid character
     */
    public AisTextField getText(int bitOffset, int bitCount) {
        if (bitCount % 6 != 0) {
            throw new IllegalArgumentException("Text fields must be a multiple of 6 bits wide: " + bitCount);
        }
        checkRange(bitOffset, bitCount);
        if (bitCount > 0) {
            for (int i = bitOffset / 6; i <= (bitOffset + bitCount - 1) / 6; i++) {
                decodeCharacter(ascii[i]);
            }
        }
        return new AisTextField(this, bitOffset, bitCount / 6);
    }

    /**
     * Value of the 6-bit character starting at the given bit offset.
     */
    int sixBitValueAt(int bitOffset) {
        return getUnsigned(bitOffset, 6);
    }

    private int bitAt(int bit) {
        int value = decodeCharacter(ascii[bit / 6]);
        return (value >> (5 - bit % 6)) & 1;
    }

    private void checkRange(int bitOffset, int bitCount) {
        if (bitOffset < 0 || bitOffset + bitCount > bitLength) {
            throw new AisDecodingException("Field at bit " + bitOffset + " with " + bitCount
                    + " bits exceeds payload of " + bitLength + " bits");
        }
    }

    private static int decodeCharacter(byte c) {
        int value = c - 48;
        if (value > 40) {
            value -= 8;
        }
        if (value < 0 || value > 63) {
            throw new AisDecodingException("Invalid payload character: '" + (char) c + "'");
        }
        return value;
    }
}
