/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.ais;

/**
 * Receives complete AIS messages from a {@link NmeaStreamParser}.
 */
public interface AisMessageStreamProcessor {

    /**
     * Called once per complete message, in arrival order.
     *
     * @param line the message's first line; its tag block carries source and timestamp
     * @param asciiPayload the ASCII-armored payload, concatenated over all fragments
     * @param padding fill bits at the end of the last fragment
     */
    void onNext(NmeaLine line, byte[] asciiPayload, int padding);

    /**
     * Called once after the last message.
     */
    void onCompleted();

    /**
     * Called periodically while parsing and once more with {@link StreamProgress#done()} set.
     */
    void progress(StreamProgress progress);
}
