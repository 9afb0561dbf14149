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

import java.util.ArrayList;
import java.util.List;

/// Special (e.g. monotonic or measurement-error interaction) coefficients of one predictor.
///
/// @param effects the special coefficients in backend column order
/// @param specialPrior whether a shrinkage prior adds the `sdbsp` shadow class
public record SpecialEffects(List<Effect> effects, boolean specialPrior) implements TermGroup {

    public SpecialEffects {
        effects = Copies.list(effects);
    }

    public SpecialEffects(List<Effect> effects) {
        this(effects, false);
    }

    /// One special coefficient.
    ///
    /// @param coefficient the coefficient label
    /// @param monotonicComponents number of ordinal (monotonic) variables in the term,
    ///                            each of which owns a simplex parameter
    public record Effect(String coefficient, int monotonicComponents) {
        public Effect {
            coefficient = Copies.text(coefficient);
            if (monotonicComponents < 0) {
                throw new IllegalArgumentException("monotonicComponents must be >= 0: " + monotonicComponents);
            }
        }
    }

    /// @return coefficient labels in order
    public List<String> coefficients() {
        return effects.stream().map(Effect::coefficient).toList();
    }

    /// Labels of the simplex parameters, one per monotonic component:
    /// `coef1, coef2, ...` for each coefficient with monotonic terms.
    public List<String> simplexLabels() {
        List<String> labels = new ArrayList<>();
        for (Effect effect : effects) {
            for (int k = 1; k <= effect.monotonicComponents(); k++) {
                labels.add(effect.coefficient() + k);
            }
        }
        return labels;
    }

    @Override
    public TermKind kind() {
        return TermKind.SPECIAL;
    }
}
