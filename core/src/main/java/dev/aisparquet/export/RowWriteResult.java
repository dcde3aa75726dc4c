/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.export;

/**
 * Outcome of writing one message.
 */
public sealed interface RowWriteResult {

    record Written(int row) implements RowWriteResult {
    }

    record Skipped(SkipReason reason, String detail) implements RowWriteResult {
    }
}
