/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.metadata;

/**
 * Header for a page in Parquet. The writer only emits v1 data pages.
 */
public record PageHeader(
        PageType type,
        int uncompressedPageSize,
        int compressedPageSize,
        DataPageHeader dataPageHeader) {

    public enum PageType {
        DATA_PAGE(0),
        DICTIONARY_PAGE(2),
        DATA_PAGE_V2(3);

        private final int thriftValue;

        PageType(int thriftValue) {
            this.thriftValue = thriftValue;
        }

        public int getThriftValue() {
            return thriftValue;
        }
    }
}
