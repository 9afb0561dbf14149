/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.drawtools.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// The draws of one sampling chain: an ordered collection of equally long
/// columns, the first [#warmup()] entries of each being saved warmup draws.
///
/// All transforming methods return new chains; columns and chain
/// attributes carry over unchanged unless stated otherwise.
public final class Chain {

    private final List<DrawColumn> columns;
    private final int warmup;
    private final Map<String, String> attributes;

    public Chain(List<DrawColumn> columns, int warmup) {
        this(columns, warmup, Map.of());
    }

    public Chain(List<DrawColumn> columns, int warmup, Map<String, String> attributes) {
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns cannot be null"));
        this.attributes = Map.copyOf(Objects.requireNonNull(attributes, "attributes cannot be null"));
        if (warmup < 0) {
            throw new IllegalArgumentException("warmup must be >= 0: " + warmup);
        }
        this.warmup = warmup;
        int length = -1;
        for (DrawColumn column : this.columns) {
            if (length < 0) {
                length = column.length();
            } else if (column.length() != length) {
                throw new IllegalArgumentException("Column '" + column.name() + "' has " + column.length()
                    + " draws, expected " + length);
            }
        }
        if (length >= 0 && warmup > length) {
            throw new IllegalArgumentException("warmup (" + warmup + ") exceeds draw count (" + length + ")");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<DrawColumn> columns() {
        return columns;
    }

    public DrawColumn column(int index) {
        return columns.get(index);
    }

    public int columnCount() {
        return columns.size();
    }

    /// @return the number of saved warmup draws at the start of every column
    public int warmup() {
        return warmup;
    }

    /// @return total draws per column, warmup included
    public int drawCount() {
        return columns.isEmpty() ? warmup : columns.get(0).length();
    }

    /// @return draws per column after warmup
    public int keptDraws() {
        return drawCount() - warmup;
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public List<String> names() {
        return columns.stream().map(DrawColumn::name).toList();
    }

    /// Renames the columns at the given positions.
    ///
    /// @param positions column positions, in ascending order
    /// @param names new names, one per position
    public Chain renamed(int[] positions, List<String> names) {
        if (positions.length != names.size()) {
            throw new IllegalArgumentException("positions and names differ in length: "
                + positions.length + " vs " + names.size());
        }
        List<DrawColumn> updated = new ArrayList<>(columns);
        for (int k = 0; k < positions.length; k++) {
            updated.set(positions[k], updated.get(positions[k]).withName(names.get(k)));
        }
        return new Chain(updated, warmup, attributes);
    }

    /// Permutes the values among the given positions; names and attributes stay in place.
    /// After the call, the column at `positions[k]` holds the values previously at
    /// `positions[order[k]]`.
    public Chain permuted(int[] positions, int[] order) {
        if (positions.length != order.length) {
            throw new IllegalArgumentException("positions and order differ in length: "
                + positions.length + " vs " + order.length);
        }
        List<DrawColumn> updated = new ArrayList<>(columns);
        for (int k = 0; k < positions.length; k++) {
            updated.set(positions[k], columns.get(positions[k]).withValuesOf(columns.get(positions[order[k]])));
        }
        return new Chain(updated, warmup, attributes);
    }

    /// Rearranges whole columns: the result's column `k` is this chain's column `order[k]`.
    public Chain reordered(int[] order) {
        if (order.length != columns.size()) {
            throw new IllegalArgumentException("order has " + order.length + " entries for "
                + columns.size() + " columns");
        }
        List<DrawColumn> updated = new ArrayList<>(columns.size());
        for (int index : order) {
            updated.add(columns.get(index));
        }
        return new Chain(updated, warmup, attributes);
    }

    public Chain withColumn(DrawColumn column) {
        List<DrawColumn> updated = new ArrayList<>(columns);
        updated.add(column);
        return new Chain(updated, warmup, attributes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Chain other)) {
            return false;
        }
        return warmup == other.warmup && columns.equals(other.columns) && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, warmup, attributes);
    }

    /// Builder collecting columns in insertion order.
    public static final class Builder {
        private final List<DrawColumn> columns = new ArrayList<>();
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private int warmup;

        private Builder() {
        }

        public Builder warmup(int warmup) {
            this.warmup = warmup;
            return this;
        }

        public Builder column(String name, double... values) {
            columns.add(new DrawColumn(name, values));
            return this;
        }

        public Builder column(DrawColumn column) {
            columns.add(column);
            return this;
        }

        public Builder attribute(String key, String value) {
            attributes.put(key, value);
            return this;
        }

        public Chain build() {
            return new Chain(columns, warmup, Collections.unmodifiableMap(attributes));
        }
    }
}
