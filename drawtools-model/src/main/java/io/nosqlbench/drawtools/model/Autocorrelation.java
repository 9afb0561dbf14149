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

/// Autocorrelation structure of a response.
///
/// Only the unstructured form carries labels: its correlation matrix is
/// indexed by the observed time points.
///
/// @param unstructuredTimes time labels of an unstructured correlation, empty otherwise
public record Autocorrelation(List<String> unstructuredTimes) implements TermGroup {

    public Autocorrelation {
        unstructuredTimes = Copies.list(unstructuredTimes);
    }

    public boolean isUnstructured() {
        return !unstructuredTimes.isEmpty();
    }

    @Override
    public TermKind kind() {
        return TermKind.AUTOCORRELATION;
    }
}
