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

package io.nosqlbench.drawtools.model;

import java.util.List;

/// Imputed missing response values.
///
/// @param rows 1-based data row of each imputed value
public record MissingValues(List<Integer> rows) implements TermGroup {

    public MissingValues {
        rows = Copies.list(rows);
    }

    @Override
    public TermKind kind() {
        return TermKind.MISSING_VALUES;
    }
}
