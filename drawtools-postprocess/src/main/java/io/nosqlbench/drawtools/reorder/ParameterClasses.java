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

package io.nosqlbench.drawtools.reorder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/// The presentation order of parameter classes.
///
/// A class is the leading run of a parameter name before its first `_` or
/// `[`: `b_x1` belongs to `b`, `sd_site__Intercept` to `sd`, `lp__` to `lp`.
/// Classes not in the list rank after every listed class.
public final class ParameterClasses {

    private static final List<String> LEADING = List.of(
        "b", "bs", "bsp", "bcs", "ar", "ma", "sderr", "lagsar", "errorsar",
        "car", "rhocar", "sdcar", "cosy", "cortime", "sd", "cor", "df", "sds",
        "sdgp", "lscale");

    private static final List<String> TRAILING = List.of(
        "hs", "R2D2", "sdb", "sdbsp", "sdbs", "sdar", "sdma", "lncor",
        "Intercept", "tmp", "rescor", "delta", "simo", "r", "s", "zgp", "rcar",
        "sbhaz", "Ymi", "Yl", "meanme", "sdme", "corme", "Xme", "prior",
        "lprior", "lp");

    private static final Pattern INTERCEPT = Pattern.compile("_Intercept(_\\d+)?$");

    private final List<String> order;
    private final Map<String, Integer> ranks;

    /// @param distributionalParameters classes of the model's distributional
    ///        parameters (`sigma`, `nu`, ...), ranked between the process
    ///        hyperparameters and the shrinkage classes
    public ParameterClasses(List<String> distributionalParameters) {
        List<String> all = new ArrayList<>(LEADING);
        all.addAll(distributionalParameters);
        all.addAll(TRAILING);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < all.size(); i++) {
            index.putIfAbsent(all.get(i), i);
        }
        this.order = List.copyOf(all);
        this.ranks = Map.copyOf(index);
    }

    /// @return the class of a parameter name
    public static String classOf(String parameterName) {
        int end = parameterName.length();
        int underscore = parameterName.indexOf('_');
        int bracket = parameterName.indexOf('[');
        if (underscore >= 0) {
            end = underscore;
        }
        if (bracket >= 0 && bracket < end) {
            end = bracket;
        }
        return parameterName.substring(0, end);
    }

    /// @return true for intercept-type names such as `b_Intercept` or `b_Intercept_2`
    public static boolean isIntercept(String parameterName) {
        return INTERCEPT.matcher(parameterName).find();
    }

    /// @return the rank of a class, or [#unknownRank()] if it is not listed
    public int rank(String cls) {
        return ranks.getOrDefault(cls, unknownRank());
    }

    public int unknownRank() {
        return order.size();
    }

    public List<String> order() {
        return order;
    }
}
