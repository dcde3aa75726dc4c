/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.ais;

/**
 * One line of an AIS NMEA stream: an optional tag block followed by an {@code !xxVDM} or
 * {@code !xxVDO} sentence, e.g.
 * {@code \s:42,c:1567684904*38\!AIVDM,1,1,,B,33m9UtPP@50wwE:VJbhBGOwb0000,0*1C}.
 *
 * @param tagBlock the tag block, {@link NmeaTagBlock#EMPTY} if the line has none
 * @param talker sentence identifier without the leading {@code !}, e.g. {@code AIVDM}
 * @param fragmentCount number of sentences the message is split into
 * @param fragmentNumber 1-based position of this sentence within the message
 * @param messageId sequential message id linking fragments, empty for single-sentence messages
 * @param channel radio channel, may be empty
 * @param payload ASCII-armored payload of this fragment
 * @param padding number of fill bits at the end of the payload
 */
public record NmeaLine(
        NmeaTagBlock tagBlock,
        String talker,
        int fragmentCount,
        int fragmentNumber,
        String messageId,
        String channel,
        String payload,
        int padding) {

    private static final int FIELD_COUNT = 7;

    /**
     * Parses a line. The sentence checksum is not validated.
     *
     * @throws IllegalArgumentException if the line is not a well-formed AIS sentence
     */
    public static NmeaLine parse(String line) {
        NmeaTagBlock tagBlock = NmeaTagBlock.EMPTY;
        String sentence = line;

        if (line.startsWith("\\")) {
            int end = line.indexOf('\\', 1);
            if (end < 0) {
                throw new IllegalArgumentException("Unterminated tag block: '" + line + "'");
            }
            tagBlock = NmeaTagBlock.parse(line.substring(1, end));
            sentence = line.substring(end + 1);
        }

        if (!sentence.startsWith("!")) {
            throw new IllegalArgumentException("Not an encapsulated sentence: '" + line + "'");
        }

        String[] fields = sentence.substring(1).split(",", -1);
        if (fields.length != FIELD_COUNT) {
            throw new IllegalArgumentException("Expected " + FIELD_COUNT + " sentence fields but got "
                    + fields.length + ": '" + line + "'");
        }

        String talker = fields[0];
        if (talker.length() != 5 || !(talker.endsWith("VDM") || talker.endsWith("VDO"))) {
            throw new IllegalArgumentException("Not an AIS sentence: '" + talker + "'");
        }

        int fragmentCount = parseNumber(fields[1], "fragment count", line);
        int fragmentNumber = parseNumber(fields[2], "fragment number", line);
        if (fragmentCount < 1 || fragmentNumber < 1 || fragmentNumber > fragmentCount) {
            throw new IllegalArgumentException("Invalid fragment " + fragmentNumber + " of " + fragmentCount
                    + ": '" + line + "'");
        }

        String paddingField = fields[6];
        int checksumStart = paddingField.indexOf('*');
        if (checksumStart >= 0) {
            paddingField = paddingField.substring(0, checksumStart);
        }
        int padding = parseNumber(paddingField, "padding", line);
        if (padding > 5) {
            throw new IllegalArgumentException("Invalid padding " + padding + ": '" + line + "'");
        }

        return new NmeaLine(tagBlock, talker, fragmentCount, fragmentNumber, fields[3], fields[4], fields[5], padding);
    }

    public boolean isFragmented() {
        return fragmentCount > 1;
    }

    private static int parseNumber(String value, String what, String line) {
        try {
            int number = Integer.parseInt(value);
            if (number < 0) {
                throw new IllegalArgumentException("Negative " + what + ": '" + line + "'");
            }
            return number;
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed " + what + ": '" + line + "'", e);
        }
    }
}
