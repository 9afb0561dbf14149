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

/// Gaussian process terms of one predictor.
///
/// @param terms the processes in backend order
public record GaussianProcesses(List<Term> terms) implements TermGroup {

    public GaussianProcesses {
        terms = Copies.list(terms);
    }

    /// One Gaussian process.
    ///
    /// @param scaleLabels labels for the marginal scale `sdgp`, one per level of a
    ///                    categorical `by` moderator (a single label otherwise)
    /// @param lengthScaleLabels labels for the length-scales `lscale`
    public record Term(List<String> scaleLabels, List<String> lengthScaleLabels) {
        public Term {
            scaleLabels = Copies.list(scaleLabels);
            lengthScaleLabels = Copies.list(lengthScaleLabels);
        }

        public boolean hasByLevels() {
            return scaleLabels.size() > 1;
        }
    }

    @Override
    public TermKind kind() {
        return TermKind.GAUSSIAN_PROCESS;
    }
}
