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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Latent noise-free variables of predictors measured with error.
///
/// @param terms one entry per latent variable, in backend order
/// @param levels level labels of each grouping factor, keyed by group name
public record MeasurementError(List<Term> terms, Map<String, List<String>> levels) implements TermGroup {

    public MeasurementError {
        terms = Copies.list(terms);
        levels = Copies.levels(levels);
    }

    /// @param coefficient latent variable label
    /// @param group grouping factor shared by the latent values, empty if ungrouped
    /// @param correlated whether correlations between variables of the group are estimated
    public record Term(String coefficient, String group, boolean correlated) {
        public Term {
            coefficient = Copies.text(coefficient);
            group = Copies.text(group);
        }
    }

    /// Maps each distinct group (first-appearance order) to the 1-based
    /// indices of its terms within [#terms()].
    public Map<String, List<Integer>> groups() {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int k = 0; k < terms.size(); k++) {
            groups.computeIfAbsent(terms.get(k).group(), g -> new ArrayList<>()).add(k + 1);
        }
        return groups;
    }

    @Override
    public TermKind kind() {
        return TermKind.MEASUREMENT_ERROR;
    }
}
