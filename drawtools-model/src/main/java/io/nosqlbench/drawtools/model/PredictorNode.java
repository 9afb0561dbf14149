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

/// A linear predictor of one distributional or non-linear parameter.
///
/// @param dpar distributional parameter name, `mu` for the main predictor
/// @param nlpar non-linear parameter name, empty if this is not a non-linear sub-predictor
/// @param terms predictor-scoped term groups
public record PredictorNode(String dpar, String nlpar, List<TermGroup> terms) {

    public PredictorNode {
        dpar = dpar == null || dpar.isEmpty() ? NamePrefix.MAIN_DPAR : dpar;
        nlpar = Copies.text(nlpar);
        terms = Copies.list(terms);
        ScopeCheck.require(TermKind.Scope.PREDICTOR, terms);
    }

    public PredictorNode(String dpar, List<TermGroup> terms) {
        this(dpar, "", terms);
    }
}
