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

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/// One named column of scalar draws within a chain.
///
/// Columns are immutable: renaming or replacing values returns a new column
/// that keeps the attributes of the original (for example whether the
/// values are on the constrained or unconstrained scale).
public final class DrawColumn {

    private final String name;
    private final double[] values;
    private final Map<String, String> attributes;

    public DrawColumn(String name, double[] values) {
        this(name, values, Map.of());
    }

    public DrawColumn(String name, double[] values, Map<String, String> attributes) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.values = Objects.requireNonNull(values, "values cannot be null").clone();
        this.attributes = Map.copyOf(Objects.requireNonNull(attributes, "attributes cannot be null"));
    }

    public String name() {
        return name;
    }

    /// @return a copy of the draws
    public double[] values() {
        return values.clone();
    }

    public double get(int draw) {
        return values[draw];
    }

    public int length() {
        return values.length;
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public DrawColumn withName(String newName) {
        return new DrawColumn(newName, values, attributes);
    }

    /// Takes the values of another column, keeping this column's name and attributes.
    public DrawColumn withValuesOf(DrawColumn source) {
        return new DrawColumn(name, source.values, attributes);
    }

    /// @return the draws from `start` (inclusive) to the end
    public double[] tail(int start) {
        return Arrays.copyOfRange(values, start, values.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DrawColumn other)) {
            return false;
        }
        return name.equals(other.name)
            && Arrays.equals(values, other.values)
            && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, Arrays.hashCode(values), attributes);
    }

    @Override
    public String toString() {
        return "DrawColumn{" + name + ", length=" + values.length + "}";
    }
}
