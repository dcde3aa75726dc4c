/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.aisparquet.metadata;

/**
 * Element of the flattened schema stored in the file footer. The root group has
 * no type and a child count; leaf columns have a type and no children.
 */
public record SchemaElement(
        String name,
        PhysicalType type,
        Integer typeLength,
        RepetitionType repetitionType,
        Integer numChildren) {

    public static SchemaElement group(String name, int numChildren) {
        return new SchemaElement(name, null, null, null, numChildren);
    }

    public boolean isPrimitive() {
        return type != null;
    }
}
