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

/// Spline smooth terms of one predictor.
///
/// @param linearNames labels of the unpenalized (linear) smooth parts, class `bs`
/// @param terms the smooth terms in backend order
/// @param specialPrior whether a shrinkage prior adds the `sdbs` shadow class
public record Smooths(List<String> linearNames, List<Term> terms, boolean specialPrior) implements TermGroup {

    public Smooths {
        linearNames = Copies.list(linearNames);
        terms = Copies.list(terms);
    }

    /// @param label the smooth label, e.g. `sx_1`
    /// @param bases number of penalized bases
    public record Term(String label, int bases) {
        public Term {
            label = Copies.text(label);
            if (bases < 0) {
                throw new IllegalArgumentException("bases must be >= 0: " + bases);
            }
        }
    }

    public boolean isEmpty() {
        return linearNames.isEmpty() && terms.isEmpty();
    }

    @Override
    public TermKind kind() {
        return TermKind.SMOOTH;
    }
}
