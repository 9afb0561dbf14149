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

/// Group-level ("random") effects of the whole model.
///
/// ## Structure
///
/// One [Term] per coefficient. Terms sharing an [Term#id()] form one
/// covariance block: they share the `sd_<id>` vector and, when correlated,
/// the `cor_<id>` matrix. Per-level draws live under `r_<id><prefix>_<cn>`.
///
/// ```text
///   id 1 ─┬─ Term(group=site, coef=Intercept, cn=1)
///         └─ Term(group=site, coef=x,         cn=2)
///   id 2 ─── Term(group=plot, coef=Intercept, cn=1)
/// ```
///
/// @param terms one entry per group-level coefficient
/// @param levels level labels of each grouping factor, keyed by group name
public record GroupLevelEffects(List<Term> terms, Map<String, List<String>> levels) implements TermGroup {

    public GroupLevelEffects {
        terms = Copies.list(terms);
        levels = Copies.levels(levels);
    }

    /// One group-level coefficient.
    ///
    /// @param id covariance block identifier
    /// @param group grouping factor label
    /// @param coefficient coefficient label
    /// @param coefficientIndex 1-based position of the coefficient within its block and predictor
    /// @param response response label, empty for univariate models
    /// @param dpar distributional parameter the coefficient belongs to
    /// @param nlpar non-linear parameter the coefficient belongs to, empty if none
    /// @param correlated whether correlations are estimated within the block
    /// @param by name of a nesting ("by") variable, empty if none
    /// @param byLevels levels of the nesting variable
    /// @param distribution residual distribution of the group-level effects, `gaussian` or `student`
    /// @param groupIndex 1-based index of the grouping factor among all factors
    public record Term(int id, String group, String coefficient, int coefficientIndex,
                       String response, String dpar, String nlpar, boolean correlated,
                       String by, List<String> byLevels, String distribution, int groupIndex) {

        public Term {
            group = Copies.text(group);
            coefficient = Copies.text(coefficient);
            response = Copies.text(response);
            dpar = dpar == null || dpar.isEmpty() ? "mu" : dpar;
            nlpar = Copies.text(nlpar);
            by = Copies.text(by);
            byLevels = Copies.list(byLevels);
            distribution = distribution == null || distribution.isEmpty() ? "gaussian" : distribution;
        }

        /// Convenience constructor for an uncorrelated, unnested gaussian term of `mu`.
        public Term(int id, String group, String coefficient, int coefficientIndex) {
            this(id, group, coefficient, coefficientIndex, "", "mu", "", false, "", List.of(), "gaussian", id);
        }

        /// @return the combined name prefix of the predictor owning this term
        public String prefix() {
            return NamePrefix.combine(response, dpar, nlpar);
        }

        public boolean isNested() {
            return !by.isEmpty();
        }

        public boolean isStudent() {
            return "student".equals(distribution);
        }
    }

    /// Groups terms by block id, keeping first-appearance order.
    public Map<Integer, List<Term>> blocks() {
        Map<Integer, List<Term>> blocks = new LinkedHashMap<>();
        for (Term term : terms) {
            blocks.computeIfAbsent(term.id(), id -> new ArrayList<>()).add(term);
        }
        return blocks;
    }

    @Override
    public TermKind kind() {
        return TermKind.GROUP_LEVEL;
    }
}
