/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.metadata;

/**
 * Value and level encodings used by the writer.
 */
public enum Encoding {
    PLAIN(0),
    RLE(3);

    private final int thriftValue;

    Encoding(int thriftValue) {
        this.thriftValue = thriftValue;
    }

    public int getThriftValue() {
        return thriftValue;
    }
}
