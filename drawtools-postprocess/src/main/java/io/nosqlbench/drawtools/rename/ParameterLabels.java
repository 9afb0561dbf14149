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

package io.nosqlbench.drawtools.rename;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Label helpers shared by the rename rules.
public final class ParameterLabels {

    /// Separator between the parts of correlation and group-level sd names.
    public static final String SEPARATOR = "__";

    private static final Pattern WHITESPACE = Pattern.compile("[ \t\r\n]");

    private ParameterLabels() {
    }

    /// Names of the lower-triangle entries of a correlation matrix over
    /// `names`: `<type>__<n_j>__<n_i>` for `i = 2..k`, `j = 1..i-1`.
    ///
    /// @param names labels of the correlated variables
    /// @param type the correlation class, e.g. `cor_site`
    /// @return the pair names, empty for fewer than two labels
    public static List<String> correlationNames(List<String> names, String type) {
        List<String> out = new ArrayList<>();
        for (int i = 1; i < names.size(); i++) {
            for (int j = 0; j < i; j++) {
                out.add(type + SEPARATOR + names.get(j) + SEPARATOR + names.get(i));
            }
        }
        return out;
    }

    /// Replaces whitespace in a level label, which the backend cannot carry in names.
    public static String sanitize(String label, String filler) {
        return WHITESPACE.matcher(label).replaceAll(Matcher.quoteReplacement(filler));
    }

    public static List<String> sanitize(List<String> labels, String filler) {
        return labels.stream().map(label -> sanitize(label, filler)).toList();
    }

    /// @return `"1".."count"`
    public static List<String> sequence(int count) {
        List<String> out = new ArrayList<>(count);
        for (int k = 1; k <= count; k++) {
            out.add(Integer.toString(k));
        }
        return out;
    }

    /// `base[label]` for each label.
    public static List<String> indexed(String base, List<String> labels) {
        return labels.stream().map(label -> base + "[" + label + "]").toList();
    }

    /// `base_label` for each label.
    public static List<String> suffixed(String base, List<String> labels) {
        return labels.stream().map(label -> base + "_" + label).toList();
    }

    /// Two-dimensional index names `base[row,col]`, rows varying fastest.
    public static List<String> crossIndexed(String base, List<String> rows, List<String> cols) {
        List<String> out = new ArrayList<>(rows.size() * cols.size());
        for (String col : cols) {
            for (String row : rows) {
                out.add(base + "[" + row + "," + col + "]");
            }
        }
        return out;
    }
}
