/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.export;

/**
 * Why a message did not become a row.
 */
public enum SkipReason {
    /** The message kind is not part of the export. */
    UNSUPPORTED_MESSAGE_TYPE,
    /** The payload could not be decoded. */
    DECODE_FAILURE
}
