/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.ais;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class NmeaStreamParserTest {

    private static final String POSITION =
            "\\s:3,c:1567684904*00\\!AIVDM,1,1,,A,15RTgt0PAso;90TKcjM8h6g208CQ,0*4A";
    private static final String STATIC_PART_1 =
            "\\g:1-2-1,s:3,c:1567684905*00\\!AIVDM,2,1,1,A,55?MbV02;H;s<HtKR20EHE:0@T4@Dn2222222216L961O5Gf0NSQEp6ClRp8,0*1C";
    private static final String STATIC_PART_2 =
            "\\g:2-2-1*00\\!AIVDM,2,2,1,A,88888888880,2*25";

    @Test
    void testDeliversMessagesInArrivalOrder() throws Exception {
        RecordingProcessor processor = new RecordingProcessor();

        new NmeaStreamParser().parseStream(stream(POSITION, STATIC_PART_1, STATIC_PART_2, POSITION), processor);

        assertThat(processor.events).containsExactly("next:1", "next:5", "next:1", "completed", "progress:done");
        assertThat(processor.payloads.get(1)).endsWith("88888888880");
        assertThat(processor.paddings).containsExactly(0, 2, 0);
    }

    @Test
    void testFragmentedMessageUsesFirstLineTagBlock() throws Exception {
        RecordingProcessor processor = new RecordingProcessor();

        new NmeaStreamParser().parseStream(stream(STATIC_PART_1, STATIC_PART_2), processor);

        assertThat(processor.lines).hasSize(1);
        assertThat(processor.lines.get(0).tagBlock().unixTimestamp()).isEqualTo(1567684905L);
        AisPayload payload = new AisPayload(processor.payloads.get(0).getBytes(StandardCharsets.US_ASCII), 2);
        assertThat(payload.bitLength()).isEqualTo(424);
    }

    @Test
    void testInterleavedFragmentsOnDifferentChannels() throws Exception {
        RecordingProcessor processor = new RecordingProcessor();

        new NmeaStreamParser().parseStream(stream(
                "\\c:1*00\\!AIVDM,2,1,4,A,AAAA,0*00",
                "\\c:2*00\\!AIVDM,2,1,4,B,BBBB,0*00",
                "!AIVDM,2,2,4,B,bb,2*00",
                "!AIVDM,2,2,4,A,aa,4*00"), processor);

        assertThat(processor.payloads).containsExactly("BBBBbb", "AAAAaa");
        assertThat(processor.paddings).containsExactly(2, 4);
    }

    @Test
    void testOutOfSequenceFragmentsAreDiscarded() throws Exception {
        RecordingProcessor processor = new RecordingProcessor();
        NmeaStreamParser parser = new NmeaStreamParser();

        parser.parseStream(stream(
                "!AIVDM,3,1,9,A,AAAA,0*00",
                "!AIVDM,3,3,9,A,CCCC,0*00",
                "!AIVDM,2,2,8,A,DDDD,0*00",
                "!AIVDM,2,1,7,A,EEEE,0*00"), processor);

        assertThat(processor.payloads).isEmpty();
        assertThat(parser.getDiscardedFragments()).isEqualTo(3);
        assertThat(processor.events).containsExactly("completed", "progress:done");
    }

    @Test
    void testMalformedLinesAreSkipped() throws Exception {
        RecordingProcessor processor = new RecordingProcessor();
        NmeaStreamParser parser = new NmeaStreamParser();

        parser.parseStream(stream("not nmea", "", POSITION, "!AIVDM,1,1"), processor);

        assertThat(processor.payloads).hasSize(1);
        assertThat(parser.getMalformedLines()).isEqualTo(2);
        assertThat(parser.getTotalLines()).isEqualTo(4);
        assertThat(parser.getTotalMessages()).isEqualTo(1);
    }

    @Test
    void testProgressIsReportedPerInterval() throws Exception {
        AtomicLong clock = new AtomicLong(0);
        RecordingProcessor processor = new RecordingProcessor() {
            @Override
            public void onNext(NmeaLine line, byte[] asciiPayload, int padding) {
                super.onNext(line, asciiPayload, padding);
                clock.addAndGet(400);
            }
        };

        new NmeaStreamParser(1000, clock::get).parseStream(stream(POSITION, POSITION, POSITION, POSITION, POSITION), processor);

        assertThat(processor.progress).hasSize(2);
        StreamProgress interim = processor.progress.get(0);
        assertThat(interim.done()).isFalse();
        assertThat(interim.totalMessages()).isEqualTo(3);
        assertThat(interim.totalElapsedMillis()).isEqualTo(1200);
        assertThat(interim.overallMessagesPerSecond()).hasValue(2);

        StreamProgress last = processor.progress.get(1);
        assertThat(last.done()).isTrue();
        assertThat(last.totalLines()).isEqualTo(5);
        assertThat(last.totalMessages()).isEqualTo(5);
        assertThat(last.messagesSinceLastUpdate()).isEqualTo(2);
        assertThat(last.elapsedSinceLastUpdateMillis()).isEqualTo(800);
    }

    @Test
    void testZeroElapsedTimeHasNoRate() throws Exception {
        RecordingProcessor processor = new RecordingProcessor();

        new NmeaStreamParser(1000, () -> 42).parseStream(stream(POSITION), processor);

        StreamProgress last = processor.progress.get(0);
        assertThat(last.totalElapsedMillis()).isZero();
        assertThat(last.overallMessagesPerSecond()).isEmpty();
        assertThat(last.recentMessagesPerSecond()).isEmpty();
    }

    private static ByteArrayInputStream stream(String... lines) {
        return new ByteArrayInputStream((String.join("\r\n", lines) + "\r\n").getBytes(StandardCharsets.ISO_8859_1));
    }

    static class RecordingProcessor implements AisMessageStreamProcessor {

        final List<String> events = new ArrayList<>();
        final List<NmeaLine> lines = new ArrayList<>();
        final List<String> payloads = new ArrayList<>();
        final List<Integer> paddings = new ArrayList<>();
        final List<StreamProgress> progress = new ArrayList<>();

        @Override
        public void onNext(NmeaLine line, byte[] asciiPayload, int padding) {
            lines.add(line);
            payloads.add(new String(asciiPayload, StandardCharsets.US_ASCII));
            paddings.add(padding);
            events.add("next:" + AisPayload.peekMessageType(asciiPayload, padding));
        }

        @Override
        public void onCompleted() {
            events.add("completed");
        }

        @Override
        public void progress(StreamProgress progress) {
            this.progress.add(progress);
            if (progress.done()) {
                events.add("progress:done");
            }
        }
    }
}
