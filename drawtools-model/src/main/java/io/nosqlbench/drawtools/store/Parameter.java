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

import java.util.List;

/// A named parameter and its array dimensions; scalars have no dimensions.
///
/// @param name the parameter name without index, e.g. `r_site`
/// @param dims size of each index dimension
public record Parameter(String name, List<Integer> dims) {

    public Parameter {
        dims = dims == null ? List.of() : List.copyOf(dims);
    }

    public static Parameter scalar(String name) {
        return new Parameter(name, List.of());
    }

    public boolean isScalar() {
        return dims.isEmpty();
    }

    /// @return number of flat columns this parameter spans
    public int flatCount() {
        int count = 1;
        for (int dim : dims) {
            count *= dim;
        }
        return count;
    }
}
