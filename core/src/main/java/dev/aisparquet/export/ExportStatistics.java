/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.export;

/**
 * Counters of a {@link BatchExportEngine}.
 *
 * @param rowsWritten rows accepted so far, including rows not yet flushed
 * @param rowGroupsWritten row groups handed to the container writer
 * @param unsupportedMessages messages of kinds that are not exported
 * @param decodeFailures messages dropped because their payload could not be decoded
 */
public record ExportStatistics(long rowsWritten, long rowGroupsWritten, long unsupportedMessages, long decodeFailures) {

    public long skipped(SkipReason reason) {
        return switch (reason) {
            case UNSUPPORTED_MESSAGE_TYPE -> unsupportedMessages;
            case DECODE_FAILURE -> decodeFailures;
        };
    }

    public long totalSkipped() {
        return unsupportedMessages + decodeFailures;
    }
}
