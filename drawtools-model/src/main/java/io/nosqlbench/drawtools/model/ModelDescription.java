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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Structural description of a fitted model, as compiled from its formula.
///
/// ## Purpose
///
/// The sampling backend only knows positional parameter names such as
/// `b[2]` or `r_1_1[3]`. This tree carries the labels that were dropped on
/// the way: coefficient names, group levels, smooth labels, response names.
///
/// ## Tree
///
/// ```text
/// ModelDescription
///  ├─ ResponseNode (response × family)
///  │   ├─ PredictorNode (dpar / nlpar)
///  │   │   └─ TermGroup*  fixed, special, category-specific, smooth, gp, autocorrelation
///  │   └─ TermGroup*      thresholds, hazard baseline, missing values, family correlation
///  └─ TermGroup*          group-level, measurement error, residual correlation
/// ```
///
/// Every label is read-only input; term groups absent from the fitted
/// draws simply produce no renaming.
///
/// @param responses the responses, a single one for univariate models
/// @param terms model-scoped term groups
/// @see ModelDescriptions
public record ModelDescription(List<ResponseNode> responses, List<TermGroup> terms) {

    public ModelDescription {
        responses = Copies.list(responses);
        terms = Copies.list(terms);
        ScopeCheck.require(TermKind.Scope.MODEL, terms);
    }

    public boolean isMultivariate() {
        return responses.size() > 1;
    }

    /// @return response labels in order
    public List<String> responseNames() {
        return responses.stream().map(ResponseNode::response).toList();
    }

    /// Union of the distributional parameter names of all responses, in
    /// first-appearance order.
    public List<String> distributionalParameters() {
        Set<String> dpars = new LinkedHashSet<>();
        for (ResponseNode response : responses) {
            dpars.addAll(response.distributionalParameters());
            for (PredictorNode predictor : response.predictors()) {
                dpars.add(predictor.dpar());
            }
        }
        return new ArrayList<>(dpars);
    }

    /// Starts a builder for a univariate model.
    public static Builder builder() {
        return new Builder();
    }

    /// Builder for univariate descriptions, mostly used in code and tests.
    ///
    /// ```java
    /// ModelDescription description = ModelDescription.builder()
    ///     .predictor("mu", new FixedEffects(List.of("Intercept", "x1")))
    ///     .model(new GroupLevelEffects(terms, levels))
    ///     .build();
    /// ```
    public static final class Builder {
        private String response = "";
        private final List<String> dpars = new ArrayList<>();
        private final List<PredictorNode> predictors = new ArrayList<>();
        private final List<TermGroup> responseTerms = new ArrayList<>();
        private final List<TermGroup> modelTerms = new ArrayList<>();

        private Builder() {
        }

        public Builder response(String response) {
            this.response = response;
            return this;
        }

        public Builder distributionalParameters(String... dpars) {
            this.dpars.addAll(List.of(dpars));
            return this;
        }

        public Builder predictor(String dpar, TermGroup... terms) {
            predictors.add(new PredictorNode(dpar, List.of(terms)));
            return this;
        }

        public Builder predictor(PredictorNode predictor) {
            predictors.add(predictor);
            return this;
        }

        public Builder responseTerm(TermGroup term) {
            responseTerms.add(term);
            return this;
        }

        public Builder model(TermGroup term) {
            modelTerms.add(term);
            return this;
        }

        public ModelDescription build() {
            List<String> family = dpars.isEmpty() ? List.of(NamePrefix.MAIN_DPAR) : dpars;
            ResponseNode node = new ResponseNode(response, family, predictors, responseTerms);
            return new ModelDescription(List.of(node), modelTerms);
        }
    }
}
