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

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// One match-and-replace instruction over the columns of a sample store.
///
/// ## Contract
///
/// - [#mask()] selects column positions of the name table
/// - [#names()] holds one replacement name per selected position, in
///   position order
/// - [#sort()], when present, permutes the values of the selected columns
///   among themselves: the `k`-th selected column receives the values of
///   the `sort[k]`-th selected column
///
/// An operation whose replacement count differs from its match count is
/// still representable; [RenameExecutor] decides how to apply it.
public final class RenameOperation {

    private final BitSet mask;
    private final List<String> names;
    private final int[] sort;

    private RenameOperation(BitSet mask, List<String> names, int[] sort) {
        this.mask = (BitSet) Objects.requireNonNull(mask, "mask cannot be null").clone();
        this.names = List.copyOf(Objects.requireNonNull(names, "names cannot be null"));
        this.sort = sort == null ? null : sort.clone();
    }

    public static RenameOperation of(BitSet mask, List<String> names) {
        return new RenameOperation(mask, names, null);
    }

    /// @param sort 0-based permutation of the selected columns' values
    public static RenameOperation sorted(BitSet mask, List<String> names, int[] sort) {
        return new RenameOperation(mask, names, Objects.requireNonNull(sort, "sort cannot be null"));
    }

    /// Renames a single column.
    public static RenameOperation single(int position, String name) {
        BitSet mask = new BitSet();
        mask.set(position);
        return new RenameOperation(mask, List.of(name), null);
    }

    public BitSet mask() {
        return (BitSet) mask.clone();
    }

    public List<String> names() {
        return names;
    }

    public Optional<int[]> sort() {
        return sort == null ? Optional.empty() : Optional.of(sort.clone());
    }

    public int matchCount() {
        return mask.cardinality();
    }

    /// @return selected positions in ascending order
    public int[] positions() {
        return mask.stream().toArray();
    }

    /// @return true if the operation selects no column
    public boolean isNoOp() {
        return mask.isEmpty();
    }

    /// @return true if the replacement count differs from the match count
    public boolean isMismatched() {
        return names.size() != mask.cardinality();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RenameOperation other)) {
            return false;
        }
        return mask.equals(other.mask) && names.equals(other.names) && Arrays.equals(sort, other.sort);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mask, names, Arrays.hashCode(sort));
    }

    @Override
    public String toString() {
        return "RenameOperation{mask=" + mask + ", names=" + names
            + (sort == null ? "" : ", sort=" + Arrays.toString(sort)) + "}";
    }
}
