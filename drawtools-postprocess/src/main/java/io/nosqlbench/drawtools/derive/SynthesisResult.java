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

package io.nosqlbench.drawtools.derive;

import io.nosqlbench.drawtools.store.SampleStore;

import java.util.List;

/// Outcome of a [DerivedQuantitySynthesizer] run.
///
/// @param store the store with all successfully synthesized columns appended
/// @param synthesized names of the appended columns
/// @param skipped names of columns that could not be computed
public record SynthesisResult(SampleStore store, List<String> synthesized, List<String> skipped) {

    public SynthesisResult {
        synthesized = List.copyOf(synthesized);
        skipped = List.copyOf(skipped);
    }
}
