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

/// One response of the model with its predictors.
///
/// @param response response label, empty for a univariate model
/// @param distributionalParameters parameter names of the response family, e.g. `mu`, `sigma`
/// @param predictors predictors of the distributional and non-linear parameters
/// @param terms response-scoped term groups
public record ResponseNode(String response, List<String> distributionalParameters,
                           List<PredictorNode> predictors, List<TermGroup> terms) {

    public ResponseNode {
        response = Copies.text(response);
        distributionalParameters = Copies.list(distributionalParameters);
        predictors = Copies.list(predictors);
        terms = Copies.list(terms);
        ScopeCheck.require(TermKind.Scope.RESPONSE, terms);
    }

    /// @return the prefix qualifying response-level classes such as thresholds
    public String prefix() {
        return NamePrefix.combine(response, NamePrefix.MAIN_DPAR, "");
    }
}
