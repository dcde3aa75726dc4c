/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.ais;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Reads NMEA lines, reassembles multi-sentence messages and hands complete messages to an
 * {@link AisMessageStreamProcessor}.
 * <p>
 * Fragments are correlated by channel and message id. A fragment arriving out of sequence
 * discards the partial message it belongs to. Malformed lines are counted and skipped.
 * </p>
 */
public class NmeaStreamParser {

    public static final String PROGRESS_INTERVAL_PROPERTY = "aisparquet.progressIntervalMillis";

    public static final long DEFAULT_PROGRESS_INTERVAL_MILLIS = 1000;

    private static final Logger LOG = System.getLogger(NmeaStreamParser.class.getName());

    private final long progressIntervalMillis;
    private final LongSupplier clock;

    private final Map<String, PendingMessage> pending = new HashMap<>();

    private long totalLines;
    private long totalMessages;
    private long malformedLines;
    private long discardedFragments;

    public NmeaStreamParser() {
        this(DEFAULT_PROGRESS_INTERVAL_MILLIS, System::currentTimeMillis);
    }

    /**
     * @param progressIntervalMillis minimum time between two progress reports
     * @param clock current time in milliseconds
     */
    public NmeaStreamParser(long progressIntervalMillis, LongSupplier clock) {
        if (progressIntervalMillis <= 0) {
            throw new IllegalArgumentException("Progress interval must be positive: " + progressIntervalMillis);
        }
        this.progressIntervalMillis = progressIntervalMillis;
        this.clock = clock;
    }

    /**
     * A parser with the progress interval taken from the {@value #PROGRESS_INTERVAL_PROPERTY}
     * system property, if set.
     */
    public static NmeaStreamParser fromSystemProperties() {
        return new NmeaStreamParser(Long.getLong(PROGRESS_INTERVAL_PROPERTY, DEFAULT_PROGRESS_INTERVAL_MILLIS),
                System::currentTimeMillis);
    }

    public void parseFile(Path path, AisMessageStreamProcessor processor) throws IOException {
        LOG.log(Level.DEBUG, "Parsing NMEA file ''{0}''", path);
        try (InputStream in = Files.newInputStream(path)) {
            parseStream(in, processor);
        }
    }

    /**
     * Parses the stream to its end. Calls {@link AisMessageStreamProcessor#onCompleted()} once,
     * followed by a final progress report. The stream is not closed.
     */
    public void parseStream(InputStream in, AisMessageStreamProcessor processor) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.ISO_8859_1));

        long start = clock.getAsLong();
        long lastUpdate = start;
        long linesAtLastUpdate = 0;
        long messagesAtLastUpdate = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            totalLines++;
            processLine(line.strip(), processor);

            long now = clock.getAsLong();
            if (now - lastUpdate >= progressIntervalMillis) {
                processor.progress(new StreamProgress(false, totalLines, totalMessages, now - start,
                        totalLines - linesAtLastUpdate, totalMessages - messagesAtLastUpdate, now - lastUpdate));
                lastUpdate = now;
                linesAtLastUpdate = totalLines;
                messagesAtLastUpdate = totalMessages;
            }
        }

        if (!pending.isEmpty()) {
            discardedFragments += pending.size();
            LOG.log(Level.DEBUG, "Discarding {0} incomplete messages at end of stream", pending.size());
            pending.clear();
        }

        processor.onCompleted();

        long now = clock.getAsLong();
        processor.progress(new StreamProgress(true, totalLines, totalMessages, now - start,
                totalLines - linesAtLastUpdate, totalMessages - messagesAtLastUpdate, now - lastUpdate));

        LOG.log(Level.DEBUG, "Parsed {0} lines into {1} messages, {2} malformed lines, {3} incomplete messages",
                totalLines, totalMessages, malformedLines, discardedFragments);
    }

    public long getTotalLines() {
        return totalLines;
    }

    public long getTotalMessages() {
        return totalMessages;
    }

    public long getMalformedLines() {
        return malformedLines;
    }

    /**
     * Number of partial multi-sentence messages that never completed.
     */
    public long getDiscardedFragments() {
        return discardedFragments;
    }

    private void processLine(String text, AisMessageStreamProcessor processor) {
        if (text.isEmpty()) {
            return;
        }

        NmeaLine line;
        try {
            line = NmeaLine.parse(text);
        }
        catch (IllegalArgumentException e) {
            malformedLines++;
            LOG.log(malformedLines == 1 ? Level.WARNING : Level.DEBUG,
                    "Skipping malformed line {0}: {1}", totalLines, e.getMessage());
            return;
        }

        if (!line.isFragmented()) {
            deliver(line, line.payload(), line.padding(), processor);
            return;
        }

        String key = line.channel() + ':' + line.messageId();
        if (line.fragmentNumber() == 1) {
            PendingMessage previous = pending.put(key, new PendingMessage(line));
            if (previous != null) {
                discardedFragments++;
            }
            return;
        }

        PendingMessage message = pending.get(key);
        if (message == null || message.nextFragment != line.fragmentNumber()
                || message.first.fragmentCount() != line.fragmentCount()) {
            if (message != null) {
                pending.remove(key);
            }
            discardedFragments++;
            LOG.log(Level.DEBUG, "Discarding out of sequence fragment {0} of {1} at line {2}",
                    line.fragmentNumber(), line.fragmentCount(), totalLines);
            return;
        }

        message.payload.append(line.payload());
        message.nextFragment++;
        if (line.fragmentNumber() == line.fragmentCount()) {
            pending.remove(key);
            deliver(message.first, message.payload.toString(), line.padding(), processor);
        }
    }

    private void deliver(NmeaLine first, String payload, int padding, AisMessageStreamProcessor processor) {
        totalMessages++;
        processor.onNext(first, payload.getBytes(StandardCharsets.ISO_8859_1), padding);
    }

    private static final class PendingMessage {

        private final NmeaLine first;
        private final StringBuilder payload;
        private int nextFragment = 2;

        PendingMessage(NmeaLine first) {
            this.first = first;
            this.payload = new StringBuilder(first.payload());
        }
    }
}
