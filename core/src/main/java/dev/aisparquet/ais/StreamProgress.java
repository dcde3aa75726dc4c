/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.ais;

import java.util.OptionalLong;

/**
 * Throughput snapshot of a running parse.
 *
 * @param done whether this is the final report
 * @param totalLines lines read so far
 * @param totalMessages complete messages delivered so far
 * @param totalElapsedMillis time since parsing started
 * @param linesSinceLastUpdate lines read since the previous report
 * @param messagesSinceLastUpdate messages delivered since the previous report
 * @param elapsedSinceLastUpdateMillis time since the previous report
 */
public record StreamProgress(
        boolean done,
        long totalLines,
        long totalMessages,
        long totalElapsedMillis,
        long linesSinceLastUpdate,
        long messagesSinceLastUpdate,
        long elapsedSinceLastUpdateMillis) {

    /**
     * Messages per second over the whole parse; empty if no time has elapsed.
     */
    public OptionalLong overallMessagesPerSecond() {
        return perSecond(totalMessages, totalElapsedMillis);
    }

    /**
     * Lines per second over the whole parse; empty if no time has elapsed.
     */
    public OptionalLong overallLinesPerSecond() {
        return perSecond(totalLines, totalElapsedMillis);
    }

    /**
     * Messages per second since the previous report; empty if no time has elapsed.
     */
    public OptionalLong recentMessagesPerSecond() {
        return perSecond(messagesSinceLastUpdate, elapsedSinceLastUpdateMillis);
    }

    private static OptionalLong perSecond(long count, long elapsedMillis) {
        if (elapsedMillis <= 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(1000L * count / elapsedMillis);
    }
}
