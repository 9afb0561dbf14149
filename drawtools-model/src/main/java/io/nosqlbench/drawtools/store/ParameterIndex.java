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

package io.nosqlbench.drawtools.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Derives the parameter index (name plus dimensions) from flat column names.
///
/// ## Flat Name Grammar
///
/// ```text
///   <parameter>                  scalar
///   <parameter>[<i>]             vector element
///   <parameter>[<i>,<j>,...]     array element, labels may be non-numeric
/// ```
///
/// A parameter's dimension sizes are the number of distinct labels seen at
/// each index position, so `r_site[A,Intercept]`, `r_site[B,Intercept]`
/// yields `r_site` with dimensions `[2, 1]`.
public final class ParameterIndex {

    private ParameterIndex() {
    }

    /// Strips the bracketed index from a flat name.
    ///
    /// @param flatName a flat column name
    /// @return the parameter name
    public static String baseName(String flatName) {
        int bracket = flatName.indexOf('[');
        return bracket < 0 ? flatName : flatName.substring(0, bracket);
    }

    /// Splits the bracketed index of a flat name into its labels.
    ///
    /// @return index labels, empty for a scalar or a malformed index
    public static List<String> indexLabels(String flatName) {
        int open = flatName.indexOf('[');
        if (open < 0 || !flatName.endsWith("]")) {
            return List.of();
        }
        String inner = flatName.substring(open + 1, flatName.length() - 1);
        return List.of(inner.split(",", -1));
    }

    /// Builds the parameter index of a flat name table, parameters ordered
    /// by first appearance.
    public static List<Parameter> fromFlatNames(List<String> flatNames) {
        Map<String, List<Set<String>>> labelsByParameter = new LinkedHashMap<>();
        for (String flatName : flatNames) {
            String base = baseName(flatName);
            List<Set<String>> labels = labelsByParameter.computeIfAbsent(base, b -> new ArrayList<>());
            List<String> index = indexLabels(flatName);
            for (int d = 0; d < index.size(); d++) {
                if (labels.size() <= d) {
                    labels.add(new LinkedHashSet<>());
                }
                labels.get(d).add(index.get(d));
            }
        }
        List<Parameter> parameters = new ArrayList<>(labelsByParameter.size());
        labelsByParameter.forEach((name, labels) ->
            parameters.add(new Parameter(name, labels.stream().map(Set::size).toList())));
        return parameters;
    }
}
