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

package io.nosqlbench.drawtools;

import io.nosqlbench.drawtools.rename.RenameReport;
import io.nosqlbench.drawtools.store.SampleStore;

import java.util.List;

/// Final store of the pipeline with a record of what each step did.
///
/// @param store the renamed, reordered and augmented store
/// @param renameReport applied, no-op and mismatched rename operations
/// @param synthesized derived columns appended to the store
/// @param skipped derived columns that could not be computed
public record PostprocessResult(SampleStore store, RenameReport renameReport,
                                List<String> synthesized, List<String> skipped) {

    public PostprocessResult {
        synthesized = List.copyOf(synthesized);
        skipped = List.copyOf(skipped);
    }
}
