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

package io.nosqlbench.drawtools.rename;

import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/// Anchored matching of flat parameter names against a class prefix.
///
/// ## Purpose
///
/// The sampling backend names columns `<class>`, `<class>_<k>` or
/// `<class>_<k>[<j>]`. Locating the columns of one class must never pick up
/// a longer class that shares the prefix: class `b` must not match `bs[1]`
/// or `bsp[1]`. Every pattern is therefore anchored at the start of the
/// name and requires a [Boundary] right after the prefix.
///
/// ## Boundaries
///
/// | Boundary          | Accepted after the prefix        | Example for prefix `cor_1`         |
/// |-------------------|----------------------------------|------------------------------------|
/// | BRACKET           | `[`                              | `cor_1[1]`                         |
/// | END               | end of name                      | `cor_1`                            |
/// | BRACKET_OR_END    | `[` or end                       | `cor_1[1]`, `cor_1`                |
/// | DISAMBIGUATED     | optional `_<digits>`, then `[` or end | `cor_1_2[1]`, `cor_1[1]`      |
/// | UNDERSCORE_OR_END | `_` or end                       | `cor_1_x`, `cor_1`                 |
/// | PRIOR_TWIN        | `__<digits>`, `[` or end         | `cor_1__2`, `cor_1[1]`, `cor_1`    |
/// | LITERAL           | anything (prefix carries its own delimiter) | `sbhaz[2,` → `sbhaz[2,1]` |
///
/// Patterns are pure values; matching has no side effects.
public final class NamePattern {

    /// What must follow the prefix for a name to match.
    public enum Boundary {
        BRACKET,
        END,
        BRACKET_OR_END,
        DISAMBIGUATED,
        UNDERSCORE_OR_END,
        PRIOR_TWIN,
        LITERAL
    }

    private final String prefix;
    private final Boundary boundary;

    private NamePattern(String prefix, Boundary boundary) {
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
        this.boundary = Objects.requireNonNull(boundary, "boundary cannot be null");
    }

    public static NamePattern of(String prefix, Boundary boundary) {
        return new NamePattern(prefix, boundary);
    }

    /// Vector or array elements of a class: `<class>[...]`.
    public static NamePattern indexed(String cls) {
        return new NamePattern(cls, Boundary.BRACKET);
    }

    /// A class that is either scalar or indexed.
    public static NamePattern scalarOrIndexed(String cls) {
        return new NamePattern(cls, Boundary.BRACKET_OR_END);
    }

    /// Exactly the scalar `<class>`.
    public static NamePattern exact(String cls) {
        return new NamePattern(cls, Boundary.END);
    }

    /// A class that may carry a numeric disambiguator suffix assigned by the
    /// code generator, e.g. `cor_1_2[3]` for nested correlation blocks.
    public static NamePattern disambiguated(String cls) {
        return new NamePattern(cls, Boundary.DISAMBIGUATED);
    }

    /// Elements of a two-dimensional class whose first index equals `first`:
    /// `<class>[<first>,...]`.
    public static NamePattern firstIndex(String cls, int first) {
        return new NamePattern(cls + "[" + first + ",", Boundary.LITERAL);
    }

    /// Prior-tracking twins `prior_<class>`, `prior_<class>[j]` and `prior_<class>__<k>`.
    public static NamePattern priorTwin(String cls) {
        return new NamePattern(PriorRenamer.PRIOR_PREFIX + cls, Boundary.PRIOR_TWIN);
    }

    public String prefix() {
        return prefix;
    }

    public Boundary boundary() {
        return boundary;
    }

    /// @param name a flat parameter name
    /// @return true if the name starts with the prefix followed by the boundary
    public boolean matches(String name) {
        if (!name.startsWith(prefix)) {
            return false;
        }
        int at = prefix.length();
        return switch (boundary) {
            case LITERAL -> true;
            case BRACKET -> isBracket(name, at);
            case END -> at == name.length();
            case BRACKET_OR_END -> at == name.length() || isBracket(name, at);
            case UNDERSCORE_OR_END -> at == name.length() || name.charAt(at) == '_';
            case DISAMBIGUATED -> {
                int next = skipDigitSuffix(name, at, "_");
                yield next == name.length() || isBracket(name, next);
            }
            case PRIOR_TWIN -> at == name.length() || isBracket(name, at)
                || skipDigitSuffix(name, at, "__") > at;
        };
    }

    /// Computes the positional match mask over a name table.
    ///
    /// @param names the flat name table
    /// @return a mask with bit `i` set when `names.get(i)` matches
    public BitSet mask(List<String> names) {
        BitSet mask = new BitSet(names.size());
        for (int i = 0; i < names.size(); i++) {
            if (matches(names.get(i))) {
                mask.set(i);
            }
        }
        return mask;
    }

    /// @return number of matching names
    public int count(List<String> names) {
        return mask(names).cardinality();
    }

    public boolean any(List<String> names) {
        return names.stream().anyMatch(this::matches);
    }

    /// Functional form: `match(names, prefix, boundary)`.
    public static BitSet match(List<String> names, String prefix, Boundary boundary) {
        return of(prefix, boundary).mask(names);
    }

    private static boolean isBracket(String name, int at) {
        return at < name.length() && name.charAt(at) == '[';
    }

    /// @return the position after `<separator><digits>` at `at`, or `at` when absent
    private static int skipDigitSuffix(String name, int at, String separator) {
        if (!name.startsWith(separator, at)) {
            return at;
        }
        int pos = at + separator.length();
        int start = pos;
        while (pos < name.length() && Character.isDigit(name.charAt(pos))) {
            pos++;
        }
        return pos > start ? pos : at;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NamePattern other)) {
            return false;
        }
        return prefix.equals(other.prefix) && boundary == other.boundary;
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, boundary);
    }

    @Override
    public String toString() {
        return prefix + "<" + boundary.name().toLowerCase() + ">";
    }
}
