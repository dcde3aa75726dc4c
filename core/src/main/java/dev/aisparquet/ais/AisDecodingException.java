/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.ais;

/**
 * Thrown when an AIS payload cannot be decoded, e.g. because it is shorter than the
 * fields of its message type or contains characters outside the 6-bit armoring alphabet.
 */
public class AisDecodingException extends RuntimeException {

    public AisDecodingException(String message) {
        super(message);
    }
}
