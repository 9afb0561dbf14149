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

import java.util.List;

/// What the [RenameExecutor] did with a plan.
///
/// @param applied operations that renamed at least one column
/// @param noOps operations whose mask selected nothing
/// @param mismatches operations whose replacement count differed from their match count
public record RenameReport(int applied, int noOps, List<Mismatch> mismatches) {

    public RenameReport {
        mismatches = List.copyOf(mismatches);
    }

    /// A truncated operation. Only the first `min(matched, provided)`
    /// matched columns were renamed.
    ///
    /// @param operationIndex position of the operation in the plan
    /// @param matched columns selected by the mask
    /// @param provided replacement names supplied
    public record Mismatch(int operationIndex, int matched, int provided) {
    }

    public static RenameReport empty() {
        return new RenameReport(0, 0, List.of());
    }

    public boolean hasMismatches() {
        return !mismatches.isEmpty();
    }
}
