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
 * A text field of an AIS message: 6 bits per character, padded with {@code @} (value 0).
 */
public final class AisTextField {

    /** A text field without characters. */
    public static final AisTextField EMPTY = new AisTextField(null, 0, 0);

    private final AisPayload payload;
    private final int bitOffset;
    private final int maxCharacters;

    AisTextField(AisPayload payload, int bitOffset, int maxCharacters) {
        this.payload = payload;
        this.bitOffset = bitOffset;
        this.maxCharacters = maxCharacters;
    }

    /**
     * Number of characters the field can hold.
     */
    public int maxCharacters() {
        return maxCharacters;
    }

    /**
     * Number of characters before the first {@code @} padding character.
     */
    public int characterCount() {
        for (int i = 0; i < maxCharacters; i++) {
            if (payload.sixBitValueAt(bitOffset + i * 6) == 0) {
                return i;
            }
        }
        return maxCharacters;
    }

    /**
     * Writes the {@link #characterCount()} characters as ASCII to the start of {@code destination}.
     *
     * @return the number of bytes written
     */
    public int writeAsAscii(byte[] destination) {
        int count = characterCount();
        if (destination.length < count) {
            throw new IllegalArgumentException("Destination of " + destination.length
                    + " bytes cannot hold " + count + " characters");
        }
        for (int i = 0; i < count; i++) {
            destination[i] = (byte) toAscii(payload.sixBitValueAt(bitOffset + i * 6));
        }
        return count;
    }

    @Override
    public String toString() {
        byte[] ascii = new byte[characterCount()];
        writeAsAscii(ascii);
        return new String(ascii, StandardCharsets.US_ASCII);
    }

    private static int toAscii(int sixBit) {
        return sixBit < 32 ? sixBit + 64 : sixBit;
    }
}
