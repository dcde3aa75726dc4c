/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.ais;

/**
 * An NMEA 4.0 tag block, the {@code key:value} list between backslashes that precedes a sentence,
 * e.g. {@code \s:42,c:1567684904*38\}.
 *
 * @param source raw {@code s:} value, or {@code null} if absent
 * @param unixTimestamp {@code c:} value in seconds since the epoch, or {@code null} if absent
 * @param sentenceGrouping raw {@code g:} value, or {@code null} if absent
 */
public record NmeaTagBlock(String source, Long unixTimestamp, String sentenceGrouping) {

    public static final NmeaTagBlock EMPTY = new NmeaTagBlock(null, null, null);

    /**
     * Parses the content of a tag block, without the enclosing backslashes. A trailing
     * {@code *hh} checksum is stripped and not validated. Unknown keys are ignored.
     *
     * @throws IllegalArgumentException if a field is not of the form {@code key:value}
     *         or the timestamp is not a number
     */
    public static NmeaTagBlock parse(String content) {
        String fields = content;
        int checksumStart = fields.lastIndexOf('*');
        if (checksumStart >= 0) {
            fields = fields.substring(0, checksumStart);
        }
        if (fields.isEmpty()) {
            return EMPTY;
        }

        String source = null;
        Long unixTimestamp = null;
        String sentenceGrouping = null;

        for (String field : fields.split(",")) {
            int colon = field.indexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("Malformed tag block field: '" + field + "'");
            }
            String key = field.substring(0, colon);
            String value = field.substring(colon + 1);
            switch (key) {
                case "s" -> source = value;
                case "c" -> unixTimestamp = parseTimestamp(value);
                case "g" -> sentenceGrouping = value;
                default -> {
                    // not needed for export
                }
            }
        }
        return new NmeaTagBlock(source, unixTimestamp, sentenceGrouping);
    }

    private static Long parseTimestamp(String value) {
        try {
            return Long.parseLong(value);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed tag block timestamp: '" + value + "'", e);
        }
    }
}
