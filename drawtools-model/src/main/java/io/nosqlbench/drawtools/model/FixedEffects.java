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

/// Population-level ("fixed") coefficients of one predictor.
///
/// @param coefficients coefficient labels in backend column order
/// @param specialPrior whether a shrinkage prior adds the `sdb` shadow class
public record FixedEffects(List<String> coefficients, boolean specialPrior) implements TermGroup {

    public FixedEffects {
        coefficients = Copies.list(coefficients);
    }

    public FixedEffects(List<String> coefficients) {
        this(coefficients, false);
    }

    @Override
    public TermKind kind() {
        return TermKind.FIXED;
    }
}
