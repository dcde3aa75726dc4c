/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet;

import java.io.IOException;
import java.nio.file.Path;

import dev.aisparquet.ais.NmeaStreamParser;
import dev.aisparquet.export.AisExportSchema;
import dev.aisparquet.export.BatchExportEngine;
import dev.aisparquet.export.ExportOptions;
import dev.aisparquet.export.ExportStatistics;
import dev.aisparquet.writer.ParquetFileWriter;
import dev.aisparquet.writer.WriterOptions;

/**
 * Converts a file of NMEA AIS sentences into a Parquet file.
 * <p>
 * Usage: {@code NmeaToParquet <input.nm4> <output.parquet>}. Group size, compression and progress
 * interval are read from the {@code aisparquet.*} system properties.
 * </p>
 */
public final class NmeaToParquet {

    public static void main(String[] args) throws IOException {
        if (args.length != 2) {
            System.err.println("Usage: NmeaToParquet <input> <output>");
            System.exit(2);
        }

        Path input = Path.of(args[0]);
        Path output = Path.of(args[1]);
        System.out.println("Converting " + input + " to " + output);

        ExportStatistics statistics = convert(input, output, ExportOptions.fromSystemProperties(),
                WriterOptions.fromSystemProperties(), NmeaStreamParser.fromSystemProperties());

        System.out.println("Wrote " + statistics.rowsWritten() + " rows in " + statistics.rowGroupsWritten()
                + " row groups, skipped " + statistics.totalSkipped() + " messages");
    }

    /**
     * Parses {@code input} and writes all exportable messages to {@code output}.
     */
    public static ExportStatistics convert(Path input, Path output, ExportOptions exportOptions,
                                           WriterOptions writerOptions, NmeaStreamParser parser)
            throws IOException {
        try (ParquetFileWriter writer = ParquetFileWriter.create(output, AisExportSchema.SCHEMA, writerOptions)) {
            BatchExportEngine engine = new BatchExportEngine(writer, exportOptions);
            parser.parseFile(input, engine);
            return engine.statistics();
        }
    }

    private NmeaToParquet() {
    }
}
