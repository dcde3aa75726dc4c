/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.export;

/**
 * Options for {@link BatchExportEngine}.
 *
 * @param maxRowsPerGroup number of rows buffered before a row group is written
 */
public record ExportOptions(int maxRowsPerGroup) {

    public static final String ROWS_PER_GROUP_PROPERTY = "aisparquet.rowsPerGroup";

    public static final int DEFAULT_MAX_ROWS_PER_GROUP = 100_000;

    public ExportOptions {
        if (maxRowsPerGroup <= 0) {
            throw new IllegalArgumentException("Rows per group must be positive: " + maxRowsPerGroup);
        }
    }

    public static ExportOptions defaults() {
        return new ExportOptions(DEFAULT_MAX_ROWS_PER_GROUP);
    }

    /**
     * Defaults, with the group size overridden by the {@value #ROWS_PER_GROUP_PROPERTY} system property if set.
     */
    public static ExportOptions fromSystemProperties() {
        return new ExportOptions(Integer.getInteger(ROWS_PER_GROUP_PROPERTY, DEFAULT_MAX_ROWS_PER_GROUP));
    }
}
