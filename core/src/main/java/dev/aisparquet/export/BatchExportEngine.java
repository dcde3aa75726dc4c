/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.export;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.OptionalLong;

import dev.aisparquet.ais.AisMessageStreamProcessor;
import dev.aisparquet.ais.NmeaLine;
import dev.aisparquet.ais.StreamProgress;
import dev.aisparquet.column.ColumnData;
import dev.aisparquet.writer.ContainerWriter;
import dev.aisparquet.writer.RowGroupWriter;

/**
 * Turns a stream of AIS messages into row groups of a {@link ContainerWriter}.
 * <p>
 * Rows accumulate in a pre-allocated {@link ColumnBufferSet}. Whenever it is full, all columns are
 * written as one row group and the buffers are reused. On completion any partially filled group
 * is written with its actual row count and the container is closed.
 * </p>
 * <p>
 * Not thread-safe; meant to be driven by a single {@link dev.aisparquet.ais.NmeaStreamParser}.
 * </p>
 */
public class BatchExportEngine implements AisMessageStreamProcessor {

    private static final Logger LOG = System.getLogger(BatchExportEngine.class.getName());

    public enum State {
        ACCUMULATING,
        FLUSHING,
        CLOSED
    }

    private final ContainerWriter writer;
    private final ColumnBufferSet buffers;
    private final RowWriter rowWriter;
    private final long[] skipCounts = new long[SkipReason.values().length];

    private State state = State.ACCUMULATING;
    private int indexInGroup;
    private long totalIngested;
    private long rowGroupsFlushed;

    /**
     * @param writer receives the row groups; it is closed by {@link #onCompleted()}
     * @param options batching options
     */
    public BatchExportEngine(ContainerWriter writer, ExportOptions options) {
        this.writer = writer;
        this.buffers = new ColumnBufferSet(writer.schema(), options.maxRowsPerGroup());
        this.rowWriter = new RowWriter(writer.schema());
    }

    @Override
    public void onNext(NmeaLine line, byte[] asciiPayload, int padding) {
        checkOpen();

        RowWriteResult result = rowWriter.write(line, asciiPayload, padding, buffers, indexInGroup);
        if (result instanceof RowWriteResult.Skipped skipped) {
            recordSkip(skipped);
            return;
        }

        indexInGroup++;
        totalIngested++;
        if (indexInGroup == buffers.capacity()) {
            flush();
        }
    }

    @Override
    public void onCompleted() {
        checkOpen();

        try {
            if (indexInGroup != 0) {
                buffers.truncate(indexInGroup);
                flush();
            }
        }
        finally {
            closeWriter();
        }

        LOG.log(Level.DEBUG, "Export completed: {0} rows in {1} row groups", totalIngested, rowGroupsFlushed);
    }

    @Override
    public void progress(StreamProgress progress) {
        LOG.log(Level.INFO, "{0} lines, {1} messages in {2} ms ({3} messages/s overall, {4} messages/s recent)",
                progress.totalLines(), progress.totalMessages(), progress.totalElapsedMillis(),
                formatRate(progress.overallMessagesPerSecond()), formatRate(progress.recentMessagesPerSecond()));

        if (progress.done()) {
            LOG.log(Level.INFO, "Exported {0} rows in {1} row groups; skipped {2} unsupported and {3} undecodable messages",
                    totalIngested, rowGroupsFlushed,
                    skipCounts[SkipReason.UNSUPPORTED_MESSAGE_TYPE.ordinal()],
                    skipCounts[SkipReason.DECODE_FAILURE.ordinal()]);
        }
    }

    public State state() {
        return state;
    }

    /**
     * Rows written into the current, not yet flushed group.
     */
    public int rowsInCurrentGroup() {
        return indexInGroup;
    }

    public ExportStatistics statistics() {
        return new ExportStatistics(totalIngested, rowGroupsFlushed,
                skipCounts[SkipReason.UNSUPPORTED_MESSAGE_TYPE.ordinal()],
                skipCounts[SkipReason.DECODE_FAILURE.ordinal()]);
    }

    private void flush() {
        state = State.FLUSHING;
        try (RowGroupWriter group = writer.createRowGroup()) {
            for (ColumnData column : buffers.snapshot()) {
                group.writeColumn(column);
            }
        }
        catch (IOException e) {
            state = State.CLOSED;
            throw new UncheckedIOException("Failed to write row group " + rowGroupsFlushed, e);
        }

        rowGroupsFlushed++;
        LOG.log(Level.DEBUG, "Flushed row group {0} with {1} rows", rowGroupsFlushed, buffers.length());

        buffers.reset();
        indexInGroup = 0;
        state = State.ACCUMULATING;
    }

    private void closeWriter() {
        try {
            writer.close();
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to close container writer", e);
        }
        finally {
            state = State.CLOSED;
        }
    }

    private void recordSkip(RowWriteResult.Skipped skipped) {
        long count = ++skipCounts[skipped.reason().ordinal()];
        if (skipped.reason() == SkipReason.DECODE_FAILURE) {
            LOG.log(count == 1 ? Level.WARNING : Level.DEBUG, "Dropping undecodable message: {0}", skipped.detail());
        }
        else {
            LOG.log(Level.TRACE, "Skipping {0}", skipped.detail());
        }
    }

    private void checkOpen() {
        if (state == State.CLOSED) {
            throw new IllegalStateException("Export engine is closed");
        }
    }

    private static String formatRate(OptionalLong rate) {
        return rate.isPresent() ? Long.toString(rate.getAsLong()) : "n/a";
    }
}
