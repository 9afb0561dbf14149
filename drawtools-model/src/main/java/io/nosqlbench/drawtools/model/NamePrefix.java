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

import java.util.StringJoiner;

/// Builds the name prefixes that qualify parameter classes by response,
/// distributional parameter and non-linear parameter.
///
/// The main distributional parameter `mu` never contributes to a prefix, so
/// `b` coefficients of `mu` in a univariate model stay plain `b`, while those
/// of `sigma` in response `y1` become `b_y1_sigma`.
public final class NamePrefix {

    public static final String MAIN_DPAR = "mu";

    private NamePrefix() {
    }

    /// Joins the non-empty parts with `_`, dropping the `mu` parameter.
    ///
    /// @param response response label, may be empty
    /// @param dpar distributional parameter, may be empty
    /// @param nlpar non-linear parameter, may be empty
    /// @return the combined prefix, empty when all parts are empty
    public static String combine(String response, String dpar, String nlpar) {
        StringJoiner joiner = new StringJoiner("_");
        joiner.setEmptyValue("");
        addIfPresent(joiner, response);
        if (dpar != null && !MAIN_DPAR.equals(dpar)) {
            addIfPresent(joiner, dpar);
        }
        addIfPresent(joiner, nlpar);
        return joiner.toString();
    }

    /// Prepends an underscore to a non-empty value.
    ///
    /// @return `"_" + value`, or the empty string for an empty value
    public static String underscored(String value) {
        return value == null || value.isEmpty() ? "" : "_" + value;
    }

    private static void addIfPresent(StringJoiner joiner, String part) {
        if (part != null && !part.isEmpty()) {
            joiner.add(part);
        }
    }
}
