/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.metadata;

/**
 * Field repetition types in Parquet schema. Export schemas are flat, so only
 * required and optional fields occur.
 */
public enum RepetitionType {
    REQUIRED(0), // Field must be present
    OPTIONAL(1); // Field may be null

    private final int thriftValue;

    RepetitionType(int thriftValue) {
        this.thriftValue = thriftValue;
    }

    public int getThriftValue() {
        return thriftValue;
    }
}
