/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.chunkplanner.core.model;

import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;

import java.io.IOException;
import java.util.Objects;

/**
 * A named, typed column as declared by a chunk or by the table schema.
 *
 * @param name column name
 * @param type semantic column type
 */
public record ColumnDefinition(String name, ColumnType type) implements Writeable {

    public ColumnDefinition {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Column name cannot be null or empty");
        }
        Objects.requireNonNull(type, "Column type cannot be null");
    }

    /**
     * Deserialize a column definition.
     * @param in the stream to read from
     * @return the column definition
     * @throws IOException if reading fails
     */
    public static ColumnDefinition readFrom(StreamInput in) throws IOException {
        return new ColumnDefinition(in.readString(), in.readEnum(ColumnType.class));
    }

    @Override
    public void writeTo(StreamOutput out) throws IOException {
        out.writeString(name);
        out.writeEnum(type);
    }

    @Override
    public String toString() {
        return name + ":" + type.getTypeName();
    }
}
